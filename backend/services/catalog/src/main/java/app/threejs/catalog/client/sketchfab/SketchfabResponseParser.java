package app.threejs.catalog.client.sketchfab;

import app.threejs.catalog.support.JsonDefaults;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class SketchfabResponseParser {

    private static final Logger log = LoggerFactory.getLogger(SketchfabResponseParser.class);

    private SketchfabResponseParser() {
    }

    /** Keeps downloadable models from {@code results.models}; everything else is skipped. */
    public static List<ModelSummary> downloadableModels(JsonNode response) {
        List<ModelSummary> models = new ArrayList<>();
        if (response == null) {
            return models;
        }
        JsonNode items = response.path("results").path("models");
        if (!items.isArray()) {
            return models;
        }
        for (JsonNode item : items) {
            if (!JsonDefaults.bool(item, "isDownloadable")) {
                log.debug("Skipping model {} because it is not downloadable",
                        JsonDefaults.firstNonBlank(JsonDefaults.text(item, "name"), JsonDefaults.text(item, "uid")));
                continue;
            }
            models.add(toSummary(item));
        }
        return models;
    }

    public static ModelSummary toSummary(JsonNode item) {
        return new ModelSummary(
                JsonDefaults.text(item, "uid"),
                JsonDefaults.text(item, "name"),
                JsonDefaults.text(item, "description"),
                JsonDefaults.text(item, "viewerUrl"),
                JsonDefaults.text(item, "embedUrl"),
                thumbnailUrl(item),
                JsonDefaults.text(JsonDefaults.object(item, "user"), "username"),
                JsonDefaults.bool(item, "isDownloadable"),
                formats(item)
        );
    }

    public static ModelDetail toDetail(String requestedId, JsonNode response) {
        return new ModelDetail(
                JsonDefaults.firstNonBlank(JsonDefaults.text(response, "uid"), requestedId),
                JsonDefaults.text(response, "name"),
                JsonDefaults.bool(response, "isDownloadable"),
                response
        );
    }

    /** Every top-level key is kept, in response order, so callers can report what is offered. */
    public static Map<String, DownloadLink> downloadLinks(JsonNode response) {
        Map<String, DownloadLink> links = new LinkedHashMap<>();
        if (response == null || !response.isObject()) {
            return links;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = response.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            links.put(field.getKey(), new DownloadLink(
                    JsonDefaults.text(value, "url"),
                    JsonDefaults.number(value, "size", 0),
                    JsonDefaults.number(value, "expires", 0)
            ));
        }
        return links;
    }

    private static String thumbnailUrl(JsonNode item) {
        JsonNode images = item.path("thumbnails").path("images");
        if (!images.isArray() || images.isEmpty()) {
            return "";
        }
        return JsonDefaults.text(images.get(0), "url");
    }

    private static Map<String, Long> formats(JsonNode item) {
        Map<String, Long> formats = new LinkedHashMap<>();
        JsonNode archives = JsonDefaults.object(item, "archives");
        if (archives == null) {
            return formats;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = archives.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode archive = field.getValue();
            if (archive == null || !archive.isObject() || archive.isEmpty()) {
                continue;
            }
            formats.put(field.getKey(), JsonDefaults.number(archive, "size", 0));
        }
        return formats;
    }
}
