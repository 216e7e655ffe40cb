package entraguard.core.model.auth;

/**
 * How a route's required scopes are compared against the scopes granted to a token.
 */
public enum ScopePolicy {

    /**
     * The token must carry at least one of the required scopes.
     */
    ANY_OF,

    /**
     * The token must carry every required scope.
     */
    ALL_OF
}
