package app.threejs.catalog.credential;

/**
 * Sketchfab OAuth2 state. Absent strings are stored as {@code ""} and an absent expiry as {@code 0},
 * which means the token never expires as far as this process knows.
 */
public record Credential(
        String accessToken,
        String refreshToken,
        String clientId,
        String clientSecret,
        long expiryEpochSeconds
) {

    public Credential {
        accessToken = normalize(accessToken);
        refreshToken = normalize(refreshToken);
        clientId = normalize(clientId);
        clientSecret = normalize(clientSecret);
        expiryEpochSeconds = Math.max(expiryEpochSeconds, 0);
    }

    public static Credential empty() {
        return new Credential("", "", "", "", 0);
    }

    public boolean hasAccessToken() {
        return !accessToken.isEmpty();
    }

    public boolean hasExpiry() {
        return expiryEpochSeconds > 0;
    }

    public boolean canRefresh() {
        return !refreshToken.isEmpty() && !clientId.isEmpty() && !clientSecret.isEmpty();
    }

    public Credential withRotatedTokens(String newAccessToken, String newRefreshToken, long newExpiryEpochSeconds) {
        String refresh = newRefreshToken == null || newRefreshToken.isBlank() ? refreshToken : newRefreshToken;
        return new Credential(newAccessToken, refresh, clientId, clientSecret, newExpiryEpochSeconds);
    }

    @Override
    public String toString() {
        return "Credential[accessToken=" + mask(accessToken)
                + ", refreshToken=" + mask(refreshToken)
                + ", clientId=" + clientId
                + ", clientSecret=" + mask(clientSecret)
                + ", expiryEpochSeconds=" + expiryEpochSeconds + "]";
    }

    private static String normalize(String value) {
        return value == null ? "" : value.trim();
    }

    private static String mask(String value) {
        return value.isEmpty() ? "<empty>" : "***";
    }
}
