package app.threejs.catalog.credential;

import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The process-wide slot for the current {@link Credential}. Credentials are immutable and
 * replaced as a whole, so readers never see a half-rotated token pair.
 */
public class CredentialHolder {

    private final AtomicReference<Credential> current;
    private final Path location;

    public CredentialHolder(Credential initial, Path location) {
        this.current = new AtomicReference<>(initial == null ? Credential.empty() : initial);
        this.location = location;
    }

    public Credential get() {
        return current.get();
    }

    public void replace(Credential credential) {
        current.set(Objects.requireNonNull(credential, "credential"));
    }

    public Path location() {
        return location;
    }
}
