package app.threejs.catalog.service;

import app.threejs.catalog.client.sketchfab.DownloadLink;
import app.threejs.catalog.client.sketchfab.ModelDetail;
import app.threejs.catalog.client.sketchfab.SketchfabClient;
import app.threejs.catalog.support.FailureKind;
import app.threejs.catalog.support.SketchfabException;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class GltfUrlServiceTest {

    private final SketchfabClient sketchfabClient = mock(SketchfabClient.class);
    private final GltfUrlService service = new GltfUrlService(sketchfabClient);

    @Test
    void notDownloadableModelNeverRequestsDownloadLinks() {
        when(sketchfabClient.getModel("m1")).thenReturn(new ModelDetail("m1", "Statue", false, null));

        GltfLookup lookup = service.resolveGltfUrl("m1");

        assertThat(lookup.status()).isEqualTo(GltfLookup.Status.NOT_DOWNLOADABLE);
        assertThat(lookup.modelName()).isEqualTo("Statue");
        verify(sketchfabClient, never()).resolveDownloadLinks(anyString());
    }

    @Test
    void notDownloadableModelWithoutNameIsReportedById() {
        when(sketchfabClient.getModel("m1")).thenReturn(new ModelDetail("m1", "", false, null));

        assertThat(service.resolveGltfUrl("m1").modelName()).isEqualTo("m1");
    }

    @Test
    void missingGltfListsAvailableFormatsVerbatim() {
        when(sketchfabClient.getModel("m2")).thenReturn(new ModelDetail("m2", "Chair", true, null));
        Map<String, DownloadLink> links = new LinkedHashMap<>();
        links.put("usdz", new DownloadLink("https://cdn/usdz", 1, 300));
        links.put("source", new DownloadLink("https://cdn/source", 2, 300));
        when(sketchfabClient.resolveDownloadLinks("m2")).thenReturn(links);

        GltfLookup lookup = service.resolveGltfUrl("m2");

        assertThat(lookup.status()).isEqualTo(GltfLookup.Status.FORMAT_UNAVAILABLE);
        assertThat(lookup.availableFormats()).containsExactly("usdz", "source");
        assertThat(lookup.gltfUrl()).isNull();
    }

    @Test
    void gltfEntryWithoutUrlIsFormatUnavailable() {
        when(sketchfabClient.getModel("m5")).thenReturn(new ModelDetail("m5", "Vase", true, null));
        Map<String, DownloadLink> links = new LinkedHashMap<>();
        links.put("gltf", new DownloadLink("", 0, 0));
        links.put("usdz", new DownloadLink("https://cdn/usdz", 1, 300));
        when(sketchfabClient.resolveDownloadLinks("m5")).thenReturn(links);

        GltfLookup lookup = service.resolveGltfUrl("m5");

        assertThat(lookup.status()).isEqualTo(GltfLookup.Status.FORMAT_UNAVAILABLE);
        assertThat(lookup.gltfUrl()).isNull();
        assertThat(lookup.availableFormats()).containsExactly("gltf", "usdz");
    }

    @Test
    void gltfLinkIsResolvedWithModelName() {
        when(sketchfabClient.getModel("m3")).thenReturn(new ModelDetail("m3", "Lamp", true, null));
        when(sketchfabClient.resolveDownloadLinks("m3"))
                .thenReturn(Map.of("gltf", new DownloadLink("https://cdn/lamp.zip", 10, 300)));

        GltfLookup lookup = service.resolveGltfUrl("m3");

        assertThat(lookup).isEqualTo(GltfLookup.resolved("m3", "Lamp", "https://cdn/lamp.zip"));
    }

    @Test
    void stepFailuresPropagate() {
        when(sketchfabClient.getModel("m4")).thenReturn(new ModelDetail("m4", "Desk", true, null));
        when(sketchfabClient.resolveDownloadLinks("m4"))
                .thenThrow(new SketchfabException(FailureKind.AUTH_REQUIRED, "OAuth2 access token is required for downloading models"));

        assertThatThrownBy(() -> service.resolveGltfUrl("m4"))
                .isInstanceOf(SketchfabException.class)
                .hasMessage("OAuth2 access token is required for downloading models");
    }
}
