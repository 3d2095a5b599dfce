package app.threejs.catalog.client.sketchfab;

public record DownloadLink(
        String url,
        long size,
        long expires
) {
}
