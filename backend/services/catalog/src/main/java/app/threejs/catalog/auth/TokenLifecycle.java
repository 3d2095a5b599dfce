package app.threejs.catalog.auth;

import app.threejs.catalog.config.SketchfabProps;
import app.threejs.catalog.credential.Credential;
import app.threejs.catalog.credential.CredentialHolder;
import app.threejs.catalog.credential.CredentialStore;
import app.threejs.catalog.credential.TokenExpiry;
import app.threejs.catalog.support.FailureKind;
import app.threejs.catalog.support.JsonDefaults;
import app.threejs.catalog.support.SketchfabException;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.net.URI;
import java.time.Clock;

/**
 * Keeps the Sketchfab access token usable. Refresh is best effort: when it cannot run or fails,
 * callers continue with the token they already have and the remote API decides whether it works.
 */
@Service
public class TokenLifecycle {

    private static final Logger log = LoggerFactory.getLogger(TokenLifecycle.class);

    private final RestClient restClient;
    private final URI oauthUri;
    private final CredentialHolder credentialHolder;
    private final CredentialStore credentialStore;
    private final Clock clock;
    private final Object refreshLock = new Object();

    public TokenLifecycle(@Qualifier("sketchfabRestClient") RestClient restClient,
                          SketchfabProps props,
                          CredentialHolder credentialHolder,
                          CredentialStore credentialStore,
                          Clock clock) {
        this.restClient = restClient;
        this.oauthUri = URI.create(props.oauthUrl());
        this.credentialHolder = credentialHolder;
        this.credentialStore = credentialStore;
        this.clock = clock;
    }

    public Credential current() {
        return credentialHolder.get();
    }

    /**
     * Returns {@code false} only when there is no access token at all. An expiring token is
     * refreshed first when the refresh fields are present.
     */
    public boolean ensureValid() {
        Credential observed = credentialHolder.get();
        if (!observed.hasAccessToken()) {
            return false;
        }
        if (!TokenExpiry.isDue(observed, now())) {
            return true;
        }
        if (!observed.canRefresh()) {
            log.warn("Access token is expiring but refresh_token, client_id or client_secret is missing; using the current token");
            return true;
        }
        log.info("Access token is about to expire, refreshing");
        try {
            refreshIfUnchanged(observed);
        } catch (SketchfabException ex) {
            log.warn("Continuing with the current access token: {}", ex.getMessage());
        }
        return true;
    }

    public Credential refresh() {
        synchronized (refreshLock) {
            return exchange(credentialHolder.get());
        }
    }

    private void refreshIfUnchanged(Credential observed) {
        synchronized (refreshLock) {
            Credential latest = credentialHolder.get();
            if (latest != observed && !TokenExpiry.isDue(latest, now())) {
                log.debug("Access token was refreshed by another caller");
                return;
            }
            exchange(latest);
        }
    }

    private Credential exchange(Credential credential) {
        if (!credential.canRefresh()) {
            log.warn("Cannot refresh token: missing refresh_token, client_id, or client_secret");
            throw new SketchfabException(FailureKind.AUTH_REFRESH_FAILED,
                    "Cannot refresh token: missing refresh_token, client_id, or client_secret");
        }

        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", "refresh_token");
        form.add("client_id", credential.clientId());
        form.add("client_secret", credential.clientSecret());
        form.add("refresh_token", credential.refreshToken());

        log.info("Attempting to refresh access token");
        JsonNode response;
        try {
            response = restClient.post()
                    .uri(oauthUri)
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .body(form)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException ex) {
            log.error("Failed to refresh access token: {}", ex.getMessage());
            throw new SketchfabException(FailureKind.AUTH_REFRESH_FAILED,
                    "Failed to refresh access token: " + ex.getMessage(), ex);
        }

        String accessToken = JsonDefaults.text(response, "access_token");
        if (accessToken.isBlank()) {
            log.error("Failed to refresh access token: response has no access_token");
            throw new SketchfabException(FailureKind.AUTH_REFRESH_FAILED,
                    "Failed to refresh access token: response has no access_token");
        }
        long ttl = JsonDefaults.number(response, "expires_in", 0);
        long expiry = expiryAfter(ttl > 0 ? ttl : TokenExpiry.DEFAULT_TTL_SECONDS);

        Credential updated = credential.withRotatedTokens(accessToken, JsonDefaults.text(response, "refresh_token"), expiry);
        credentialHolder.replace(updated);
        log.info("Successfully refreshed access token");

        if (!credentialStore.save(updated, credentialHolder.location())) {
            log.warn("Refreshed token is only kept in memory; it will be lost on restart");
        }
        return updated;
    }

    private long expiryAfter(long ttlSeconds) {
        try {
            return Math.addExact(now(), ttlSeconds);
        } catch (ArithmeticException ex) {
            return Long.MAX_VALUE;
        }
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }
}
