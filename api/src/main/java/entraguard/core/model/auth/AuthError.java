package entraguard.core.model.auth;

/**
 * Reasons a request can be refused by the authorization component.
 *
 * <p>The code is kept for server-side logs and metrics only. Clients see the
 * {@link Rejection} it maps to and nothing more.
 */
public enum AuthError {
    METADATA_UNAVAILABLE(Rejection.UNAUTHORIZED),
    UNKNOWN_SIGNING_KEY(Rejection.UNAUTHORIZED),
    MALFORMED_TOKEN(Rejection.UNAUTHORIZED),
    DISALLOWED_ALGORITHM(Rejection.UNAUTHORIZED),
    INVALID_SIGNATURE(Rejection.UNAUTHORIZED),
    INVALID_ISSUER(Rejection.UNAUTHORIZED),
    INVALID_AUDIENCE(Rejection.UNAUTHORIZED),
    TOKEN_EXPIRED(Rejection.UNAUTHORIZED),
    TOKEN_NOT_YET_VALID(Rejection.UNAUTHORIZED),
    GUEST_USER_NOT_ALLOWED(Rejection.UNAUTHORIZED),
    MISSING_CREDENTIALS(Rejection.UNAUTHORIZED),
    INSUFFICIENT_SCOPE(Rejection.FORBIDDEN);

    private final Rejection rejection;

    AuthError(Rejection rejection) {
        this.rejection = rejection;
    }

    public Rejection rejection() {
        return rejection;
    }

    /**
     * Externally observable outcome of a refused request.
     */
    public enum Rejection {
        /** Credential missing or invalid (401). */
        UNAUTHORIZED,
        /** Valid credential without the required permission (403). */
        FORBIDDEN
    }
}
