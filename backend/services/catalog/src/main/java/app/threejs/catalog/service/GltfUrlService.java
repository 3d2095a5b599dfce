package app.threejs.catalog.service;

import app.threejs.catalog.client.sketchfab.DownloadLink;
import app.threejs.catalog.client.sketchfab.ModelDetail;
import app.threejs.catalog.client.sketchfab.SketchfabClient;
import app.threejs.catalog.support.JsonDefaults;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Map;

@Service
public class GltfUrlService {

    private static final Logger log = LoggerFactory.getLogger(GltfUrlService.class);
    static final String GLTF_FORMAT = "gltf";

    private final SketchfabClient sketchfabClient;

    public GltfUrlService(SketchfabClient sketchfabClient) {
        this.sketchfabClient = sketchfabClient;
    }

    /**
     * Looks up the model, then its download links. Each step fails on its own; nothing is
     * retried or rolled back.
     */
    public GltfLookup resolveGltfUrl(String modelId) {
        ModelDetail model = sketchfabClient.getModel(modelId);
        String modelName = JsonDefaults.firstNonBlank(model.name(), modelId);
        if (!model.isDownloadable()) {
            log.info("Model {} is not downloadable", modelId);
            return GltfLookup.notDownloadable(modelId, modelName);
        }

        Map<String, DownloadLink> links = sketchfabClient.resolveDownloadLinks(modelId);
        DownloadLink gltf = links.get(GLTF_FORMAT);
        if (gltf == null || gltf.url() == null || gltf.url().isBlank()) {
            log.info("Model {} offers no usable gltf archive, available: {}", modelId, links.keySet());
            return GltfLookup.formatUnavailable(modelId, modelName, new ArrayList<>(links.keySet()));
        }
        return GltfLookup.resolved(modelId, modelName, gltf.url());
    }
}
