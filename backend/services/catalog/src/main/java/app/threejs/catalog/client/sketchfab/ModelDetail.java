package app.threejs.catalog.client.sketchfab;

import com.fasterxml.jackson.databind.JsonNode;

public record ModelDetail(
        String uid,
        String name,
        boolean isDownloadable,
        JsonNode raw
) {
}
