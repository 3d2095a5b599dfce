package app.threejs.catalog.credential;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;

/**
 * Builds the startup {@link Credential}. Each field is resolved on its own:
 * command-line flag, then environment variable, then the persisted file, then empty.
 * The expiry is only ever read from the file.
 */
@Component
public class CredentialResolver {

    private static final Logger log = LoggerFactory.getLogger(CredentialResolver.class);

    static final String ARG_ACCESS_TOKEN = "sketchfab_access_token";
    static final String ARG_REFRESH_TOKEN = "sketchfab_refresh_token";
    static final String ARG_CLIENT_ID = "sketchfab_client_id";
    static final String ARG_CLIENT_SECRET = "sketchfab_client_secret";
    static final String ARG_CREDENTIALS_FILE = "credentials_file";

    static final String ENV_ACCESS_TOKEN = "SKETCHFAB_ACCESS_TOKEN";
    static final String ENV_REFRESH_TOKEN = "SKETCHFAB_REFRESH_TOKEN";
    static final String ENV_CLIENT_ID = "SKETCHFAB_CLIENT_ID";
    static final String ENV_CLIENT_SECRET = "SKETCHFAB_CLIENT_SECRET";

    private final CredentialStore credentialStore;
    private final Environment environment;
    private final Clock clock;

    public CredentialResolver(CredentialStore credentialStore, Environment environment, Clock clock) {
        this.credentialStore = credentialStore;
        this.environment = environment;
        this.clock = clock;
    }

    public Path resolveLocation(ApplicationArguments args) {
        String explicit = option(args, ARG_CREDENTIALS_FILE);
        return explicit.isEmpty() ? credentialStore.defaultLocation() : Path.of(explicit);
    }

    public Credential resolve(ApplicationArguments args, Path location) {
        Credential file = credentialStore.load(location);
        Credential resolved = new Credential(
                pick(option(args, ARG_ACCESS_TOKEN), env(ENV_ACCESS_TOKEN), file.accessToken()),
                pick(option(args, ARG_REFRESH_TOKEN), env(ENV_REFRESH_TOKEN), file.refreshToken()),
                pick(option(args, ARG_CLIENT_ID), env(ENV_CLIENT_ID), file.clientId()),
                pick(option(args, ARG_CLIENT_SECRET), env(ENV_CLIENT_SECRET), file.clientSecret()),
                file.expiryEpochSeconds()
        );
        logStatus(resolved);
        return resolved;
    }

    private void logStatus(Credential credential) {
        if (credential.hasAccessToken()) {
            log.info("OAuth2 access token found");
            if (TokenExpiry.isDue(credential, clock.instant().getEpochSecond())) {
                log.warn("Access token is expired or about to expire - will attempt to refresh on first use");
            }
        } else {
            log.warn("No Sketchfab access token provided. Download functionality will be DISABLED.");
        }
        reportPresence("refresh token", credential.refreshToken());
        reportPresence("client ID", credential.clientId());
        reportPresence("client secret", credential.clientSecret());
        if (credential.hasAccessToken() && credential.canRefresh()) {
            log.info("Automatic token refresh is available");
        }
    }

    private void reportPresence(String label, String value) {
        if (value.isEmpty()) {
            log.warn("No {} found - automatic token refresh will not be available", label);
        } else {
            log.info("OAuth2 {} found", label);
        }
    }

    private String option(ApplicationArguments args, String name) {
        if (args == null) {
            return "";
        }
        List<String> values = args.containsOption(name) ? args.getOptionValues(name) : null;
        if (values != null && !values.isEmpty()) {
            String last = values.get(values.size() - 1);
            return last == null ? "" : last.trim();
        }
        return separatedOption(args.getSourceArgs(), name);
    }

    /**
     * Reads {@code --name value}, which Spring's option parser treats as a bare flag followed
     * by a non-option argument. The last occurrence wins.
     */
    private static String separatedOption(String[] sourceArgs, String name) {
        if (sourceArgs == null) {
            return "";
        }
        String flag = "--" + name;
        String found = "";
        for (int i = 0; i < sourceArgs.length - 1; i++) {
            String next = sourceArgs[i + 1];
            if (flag.equals(sourceArgs[i]) && next != null && !next.startsWith("--")) {
                found = next.trim();
            }
        }
        return found;
    }

    private String env(String name) {
        String value = environment.getProperty(name);
        return value == null ? "" : value.trim();
    }

    private static String pick(String explicit, String fromEnv, String fromFile) {
        if (!explicit.isEmpty()) {
            return explicit;
        }
        if (!fromEnv.isEmpty()) {
            return fromEnv;
        }
        return fromFile;
    }
}
