package app.threejs.catalog.client.sketchfab;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Map;

@JsonPropertyOrder({"uid", "name", "description", "viewerUrl", "embedUrl", "thumbnailUrl", "user", "isDownloadable", "formats"})
public record ModelSummary(
        String uid,
        String name,
        String description,
        String viewerUrl,
        String embedUrl,
        String thumbnailUrl,
        @JsonProperty("user") String ownerName,
        @JsonProperty("isDownloadable") boolean isDownloadable,
        Map<String, Long> formats
) {
}
