package app.threejs.catalog.credential;

import app.threejs.catalog.config.SketchfabProps;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.mock.env.MockEnvironment;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class CredentialResolverTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Clock clock = Clock.fixed(Instant.ofEpochSecond(1_700_000_000L), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    @Test
    void resolvesEachFieldFromHighestPrecedenceSource() {
        Path file = tempDir.resolve("creds.json");
        CredentialStore store = storeAt(file);
        store.save(new Credential("file-access", "file-refresh", "file-client", "file-secret", 1_900_000_000L), file);

        MockEnvironment environment = new MockEnvironment()
                .withProperty("SKETCHFAB_ACCESS_TOKEN", "env-access")
                .withProperty("SKETCHFAB_REFRESH_TOKEN", "env-refresh");
        DefaultApplicationArguments args = new DefaultApplicationArguments("--sketchfab_access_token=flag-access");

        CredentialResolver resolver = new CredentialResolver(store, environment, clock);
        Credential credential = resolver.resolve(args, resolver.resolveLocation(args));

        assertThat(credential.accessToken()).isEqualTo("flag-access");
        assertThat(credential.refreshToken()).isEqualTo("env-refresh");
        assertThat(credential.clientId()).isEqualTo("file-client");
        assertThat(credential.clientSecret()).isEqualTo("file-secret");
        assertThat(credential.expiryEpochSeconds()).isEqualTo(1_900_000_000L);
    }

    @Test
    void blankOverridesFallThroughToLowerSources() {
        Path file = tempDir.resolve("creds.json");
        CredentialStore store = storeAt(file);
        store.save(new Credential("file-access", "", "", "", 0), file);

        MockEnvironment environment = new MockEnvironment().withProperty("SKETCHFAB_ACCESS_TOKEN", "  ");
        DefaultApplicationArguments args = new DefaultApplicationArguments("--sketchfab_access_token=");

        CredentialResolver resolver = new CredentialResolver(store, environment, clock);

        assertThat(resolver.resolve(args, file).accessToken()).isEqualTo("file-access");
    }

    @Test
    void explicitCredentialsFileWinsOverConfiguredLocation() {
        Path configured = tempDir.resolve("configured.json");
        Path explicit = tempDir.resolve("explicit.json");
        CredentialStore store = storeAt(configured);
        store.save(new Credential("explicit-access", "", "", "", 42), explicit);

        DefaultApplicationArguments args = new DefaultApplicationArguments("--credentials_file=" + explicit);
        CredentialResolver resolver = new CredentialResolver(store, new MockEnvironment(), clock);

        Path location = resolver.resolveLocation(args);
        Credential credential = resolver.resolve(args, location);

        assertThat(location).isEqualTo(explicit);
        assertThat(credential.accessToken()).isEqualTo("explicit-access");
        assertThat(credential.expiryEpochSeconds()).isEqualTo(42);
    }

    @Test
    void acceptsFlagsWithSpaceSeparatedValues() {
        Path configured = tempDir.resolve("configured.json");
        Path explicit = tempDir.resolve("explicit.json");
        CredentialStore store = storeAt(configured);
        store.save(new Credential("", "file-refresh", "", "", 0), explicit);

        DefaultApplicationArguments args = new DefaultApplicationArguments(
                "--sketchfab_access_token", "tok-123",
                "--sketchfab_client_id=flag-client",
                "--credentials_file", explicit.toString());
        CredentialResolver resolver = new CredentialResolver(store, new MockEnvironment(), clock);

        Path location = resolver.resolveLocation(args);
        Credential credential = resolver.resolve(args, location);

        assertThat(location).isEqualTo(explicit);
        assertThat(credential.accessToken()).isEqualTo("tok-123");
        assertThat(credential.clientId()).isEqualTo("flag-client");
        assertThat(credential.refreshToken()).isEqualTo("file-refresh");
    }

    @Test
    void flagWithoutValueIsIgnored() {
        Path file = tempDir.resolve("creds.json");
        CredentialStore store = storeAt(file);
        store.save(new Credential("file-access", "", "", "", 0), file);

        DefaultApplicationArguments args = new DefaultApplicationArguments(
                "--sketchfab_access_token", "--sketchfab_client_id=flag-client");
        CredentialResolver resolver = new CredentialResolver(store, new MockEnvironment(), clock);

        assertThat(resolver.resolve(args, file).accessToken()).isEqualTo("file-access");
    }

    @Test
    void missingEverywhereResolvesToEmptyCredential() {
        Path file = tempDir.resolve("none.json");
        CredentialResolver resolver = new CredentialResolver(storeAt(file), new MockEnvironment(), clock);
        DefaultApplicationArguments args = new DefaultApplicationArguments();

        assertThat(resolver.resolve(args, resolver.resolveLocation(args))).isEqualTo(Credential.empty());
    }

    private CredentialStore storeAt(Path defaultFile) {
        return new CredentialStore(objectMapper, new SketchfabProps(null, null, defaultFile.toString(), null, null));
    }
}
