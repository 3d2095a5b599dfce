package app.threejs.catalog.service;

import java.util.List;

/**
 * Result of {@link GltfUrlService#resolveGltfUrl}. Only {@link Status#RESOLVED} carries a
 * {@code gltfUrl}; only {@link Status#FORMAT_UNAVAILABLE} carries {@code availableFormats}.
 */
public record GltfLookup(
        Status status,
        String modelId,
        String modelName,
        String gltfUrl,
        List<String> availableFormats
) {

    public enum Status {
        RESOLVED,
        NOT_DOWNLOADABLE,
        FORMAT_UNAVAILABLE
    }

    public static GltfLookup resolved(String modelId, String modelName, String gltfUrl) {
        return new GltfLookup(Status.RESOLVED, modelId, modelName, gltfUrl, List.of());
    }

    public static GltfLookup notDownloadable(String modelId, String modelName) {
        return new GltfLookup(Status.NOT_DOWNLOADABLE, modelId, modelName, null, List.of());
    }

    public static GltfLookup formatUnavailable(String modelId, String modelName, List<String> availableFormats) {
        return new GltfLookup(Status.FORMAT_UNAVAILABLE, modelId, modelName, null, List.copyOf(availableFormats));
    }
}
