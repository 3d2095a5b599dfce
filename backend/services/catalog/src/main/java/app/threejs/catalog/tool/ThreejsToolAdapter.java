package app.threejs.catalog.tool;

import app.threejs.catalog.client.sketchfab.ModelSummary;
import app.threejs.catalog.client.sketchfab.SketchfabClient;
import app.threejs.catalog.credential.CredentialHolder;
import app.threejs.catalog.service.GltfLookup;
import app.threejs.catalog.service.GltfUrlService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Maps the tool names the agent host calls onto catalog operations and renders every outcome,
 * failures included, as pretty-printed JSON text. {@link #invoke} never throws.
 */
@Component
public class ThreejsToolAdapter {

    private static final Logger log = LoggerFactory.getLogger(ThreejsToolAdapter.class);

    public static final String SEARCH_MODELS = "threejs_search_models";
    public static final String GET_GLTF_MODEL_URL = "threejs_get_gltf_model_url";

    private static final ToolDescriptor SEARCH_TOOL = new ToolDescriptor(
            SEARCH_MODELS,
            "Search for 3D models on Sketchfab that match your query.",
            """
            {
              "type": "object",
              "properties": {
                "query": {
                  "type": "string",
                  "description": "Search term for 3D models (e.g., 'car', 'house', 'character')"
                },
                "limit": {
                  "type": "integer",
                  "description": "Maximum number of results to return (1-24, default: 10)"
                }
              },
              "required": ["query"]
            }
            """
    );

    private static final ToolDescriptor GLTF_TOOL = new ToolDescriptor(
            GET_GLTF_MODEL_URL,
            "Get direct url of a GLTF file for a Sketchfab model without downloading it",
            """
            {
              "type": "object",
              "properties": {
                "model_id": {
                  "type": "string",
                  "description": "The uid of the model returned in the Sketchfab search response."
                }
              },
              "required": ["model_id"]
            }
            """
    );

    private final SketchfabClient sketchfabClient;
    private final GltfUrlService gltfUrlService;
    private final ObjectMapper objectMapper;
    private final boolean gltfToolEnabled;

    public ThreejsToolAdapter(SketchfabClient sketchfabClient,
                              GltfUrlService gltfUrlService,
                              ObjectMapper objectMapper,
                              CredentialHolder credentialHolder) {
        this.sketchfabClient = sketchfabClient;
        this.gltfUrlService = gltfUrlService;
        this.objectMapper = objectMapper;
        this.gltfToolEnabled = credentialHolder.get().hasAccessToken();
    }

    public List<ToolDescriptor> availableTools() {
        List<ToolDescriptor> tools = new ArrayList<>();
        tools.add(SEARCH_TOOL);
        if (gltfToolEnabled) {
            tools.add(GLTF_TOOL);
        }
        return tools;
    }

    public String invoke(String name, Map<String, Object> arguments) {
        Map<String, Object> args = arguments == null ? Map.of() : arguments;
        try {
            if (SEARCH_MODELS.equals(name)) {
                return searchModels(args);
            }
            if (GET_GLTF_MODEL_URL.equals(name) && gltfToolEnabled) {
                return getGltfModelUrl(args);
            }
            throw new IllegalArgumentException("Unknown tool: " + name);
        } catch (Exception ex) {
            log.error("Error invoking tool {}: {}", name, ex.getMessage());
            ObjectNode error = objectMapper.createObjectNode();
            error.put("error", ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage());
            return render(error);
        }
    }

    private String searchModels(Map<String, Object> args) {
        String query = requireText(args, "query");
        Integer limit = optionalInt(args, "limit");
        List<ModelSummary> models = sketchfabClient.search(query, limit);
        ObjectNode result = objectMapper.createObjectNode();
        result.set("models", objectMapper.valueToTree(models));
        return render(result);
    }

    private String getGltfModelUrl(Map<String, Object> args) {
        String modelId = requireText(args, "model_id");
        GltfLookup lookup = gltfUrlService.resolveGltfUrl(modelId);
        ObjectNode result = objectMapper.createObjectNode();
        switch (lookup.status()) {
            case RESOLVED -> {
                result.put("model_name", lookup.modelName());
                result.put("model_id", lookup.modelId());
                result.put("gltf_url", lookup.gltfUrl());
            }
            case NOT_DOWNLOADABLE -> result.put("error", "Model '" + lookup.modelName() + "' is not downloadable.");
            case FORMAT_UNAVAILABLE -> {
                result.put("error", "GLTF format is not available for model '" + lookup.modelName() + "'.");
                ArrayNode formats = result.putArray("available_formats");
                lookup.availableFormats().forEach(formats::add);
            }
        }
        return render(result);
    }

    private String render(ObjectNode node) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(node);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize tool result", ex);
        }
    }

    private static String requireText(Map<String, Object> args, String key) {
        Object value = args.get(key);
        if (value == null || value.toString().isBlank()) {
            throw new IllegalArgumentException("Missing required argument: " + key);
        }
        return value.toString().trim();
    }

    private static int narrow(long value) {
        return (int) Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, value));
    }

    private static Integer optionalInt(Map<String, Object> args, String key) {
        Object value = args.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return narrow(number.longValue());
        }
        String text = value.toString().trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            return narrow(Long.parseLong(text));
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Argument " + key + " must be an integer", ex);
        }
    }
}
