package app.threejs.catalog.support;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

public final class ZipArchives {

    private static final byte[] LOCAL_FILE_HEADER = new byte[] {0x50, 0x4b, 0x03, 0x04};

    private ZipArchives() {
    }

    public static boolean hasZipSignature(Path file) throws IOException {
        try (InputStream inputStream = Files.newInputStream(file)) {
            return hasZipSignature(inputStream.readNBytes(LOCAL_FILE_HEADER.length));
        }
    }

    public static boolean hasZipSignature(byte[] header) {
        if (header == null || header.length < LOCAL_FILE_HEADER.length) {
            return false;
        }
        for (int i = 0; i < LOCAL_FILE_HEADER.length; i++) {
            if (header[i] != LOCAL_FILE_HEADER[i]) {
                return false;
            }
        }
        return true;
    }

    /**
     * Extracts every entry of {@code archive} below {@code targetDir} and returns entry names
     * in the order the archive lists them. The target directory is created even when the
     * archive holds no entries.
     */
    public static List<String> extract(Path archive, Path targetDir) throws IOException {
        Files.createDirectories(targetDir);
        Path root = targetDir.toAbsolutePath().normalize();
        List<String> entries = new ArrayList<>();
        try (ZipFile zipFile = new ZipFile(archive.toFile())) {
            Enumeration<? extends ZipEntry> enumeration = zipFile.entries();
            while (enumeration.hasMoreElements()) {
                ZipEntry entry = enumeration.nextElement();
                Path target = root.resolve(entry.getName()).normalize();
                if (!target.startsWith(root)) {
                    throw new IOException("Zip entry escapes extraction directory: " + entry.getName());
                }
                if (entry.isDirectory()) {
                    Files.createDirectories(target);
                } else {
                    Path parent = target.getParent();
                    if (parent != null) {
                        Files.createDirectories(parent);
                    }
                    try (InputStream in = zipFile.getInputStream(entry)) {
                        Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
                    }
                }
                entries.add(entry.getName());
            }
        }
        return entries;
    }
}
