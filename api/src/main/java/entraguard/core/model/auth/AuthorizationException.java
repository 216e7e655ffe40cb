package entraguard.core.model.auth;

/**
 * Raised when a bearer token cannot be verified or does not grant access.
 *
 * <p>The message is diagnostic and must not be sent to clients.
 */
public class AuthorizationException extends RuntimeException {

    private final AuthError error;

    public AuthorizationException(AuthError error, String message) {
        super(message);
        this.error = error;
    }

    public AuthorizationException(AuthError error, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
    }

    public AuthError error() {
        return error;
    }

    public AuthError.Rejection rejection() {
        return error.rejection();
    }
}
