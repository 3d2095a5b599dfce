package app.threejs.catalog.credential;

import app.threejs.catalog.config.SketchfabProps;
import app.threejs.catalog.support.FailureKind;
import app.threejs.catalog.support.JsonDefaults;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermissions;

/**
 * Reads and writes the persisted credentials file
 * ({@code access_token, refresh_token, client_id, client_secret, token_expiry}).
 */
@Service
public class CredentialStore {

    private static final Logger log = LoggerFactory.getLogger(CredentialStore.class);
    private static final String DEFAULT_FILE_NAME = ".sketchfab_credentials.json";

    private final ObjectMapper objectMapper;
    private final Path defaultLocation;

    public CredentialStore(ObjectMapper objectMapper, SketchfabProps props) {
        this.objectMapper = objectMapper;
        this.defaultLocation = props == null || props.credentialsFile() == null || props.credentialsFile().isBlank()
                ? Path.of(System.getProperty("user.home"), DEFAULT_FILE_NAME)
                : Path.of(props.credentialsFile());
    }

    public Path defaultLocation() {
        return defaultLocation;
    }

    public Credential load(Path explicitPath) {
        Path path = explicitPath == null ? defaultLocation : explicitPath;
        if (!Files.exists(path)) {
            log.warn("Credentials file not found: {}", path);
            return Credential.empty();
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(path.toFile());
        } catch (IOException ex) {
            log.error("{}: failed to read credentials file {}: {}", FailureKind.CONFIG_INVALID, path, ex.getMessage());
            return Credential.empty();
        }
        if (root == null || !root.isObject()) {
            log.error("{}: credentials file {} does not contain a JSON object", FailureKind.CONFIG_INVALID, path);
            return Credential.empty();
        }
        log.info("Loaded credentials from {}", path);
        return new Credential(
                JsonDefaults.text(root, "access_token"),
                JsonDefaults.text(root, "refresh_token"),
                JsonDefaults.text(root, "client_id"),
                JsonDefaults.text(root, "client_secret"),
                JsonDefaults.number(root, "token_expiry", 0)
        );
    }

    public boolean save(Credential credential, Path explicitPath) {
        Path path = (explicitPath == null ? defaultLocation : explicitPath).toAbsolutePath();
        Credential value = credential == null ? Credential.empty() : credential;
        Path temp = null;
        try {
            Path dir = path.getParent();
            Files.createDirectories(dir);
            temp = Files.createTempFile(dir, path.getFileName().toString(), ".tmp");
            restrictToOwner(temp);
            Files.write(temp, serialize(value));
            moveIntoPlace(temp, path);
            log.info("Stored updated credentials to {}", path);
            return true;
        } catch (IOException | RuntimeException ex) {
            log.error("Failed to store credentials to {}: {}", path, ex.getMessage());
            deleteQuietly(temp);
            return false;
        }
    }

    private byte[] serialize(Credential credential) throws JsonProcessingException {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("access_token", credential.accessToken());
        node.put("refresh_token", credential.refreshToken());
        node.put("client_id", credential.clientId());
        node.put("client_secret", credential.clientSecret());
        node.put("token_expiry", credential.expiryEpochSeconds());
        return objectMapper.writeValueAsBytes(node);
    }

    private void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException ex) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void restrictToOwner(Path file) {
        if (!FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
            return;
        }
        try {
            Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("rw-------"));
        } catch (IOException | UnsupportedOperationException ex) {
            log.debug("Could not restrict permissions on {}: {}", file, ex.getMessage());
        }
    }

    private void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException ex) {
            log.warn("Failed to delete temporary credentials file {}", file);
        }
    }
}
