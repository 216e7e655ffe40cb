package entraguard.core.model.auth;

import java.util.Set;

/**
 * Raised when a verified token lacks the scopes a route requires.
 */
public class InsufficientScopeException extends AuthorizationException {

    private final Set<String> missingScopes;

    public InsufficientScopeException(Set<String> missingScopes) {
        super(AuthError.INSUFFICIENT_SCOPE, "Token is missing required scope(s): " + missingScopes);
        this.missingScopes = Set.copyOf(missingScopes);
    }

    public Set<String> missingScopes() {
        return missingScopes;
    }
}
