package app.threejs.catalog.client.sketchfab;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of {@link SketchfabClient#download}. {@code extractedDir} is {@code null} unless the
 * payload was a zip archive. The caller owns every file referenced here.
 */
public record DownloadResult(
        Path localPath,
        boolean isArchive,
        Path extractedDir,
        List<String> extractedEntries
) {
}
