package app.threejs.catalog.credential;

public final class TokenExpiry {

    /** Tokens are treated as expired this many seconds before their recorded expiry. */
    public static final long SAFETY_MARGIN_SECONDS = 300;

    /** Lifetime assumed when the token endpoint does not return {@code expires_in}. */
    public static final long DEFAULT_TTL_SECONDS = 30L * 24 * 60 * 60;

    private TokenExpiry() {
    }

    public static boolean isDue(Credential credential, long nowEpochSeconds) {
        return credential.hasExpiry() && nowEpochSeconds > credential.expiryEpochSeconds() - SAFETY_MARGIN_SECONDS;
    }
}
