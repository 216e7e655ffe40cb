package entraguard.core.model.auth;

import java.util.Arrays;
import java.util.Set;

/**
 * Scopes a route demands of its caller, with the policy used to compare them.
 *
 * <p>An empty scope set means the route only requires authentication.
 */
public record RequiredScopes(Set<String> scopes, ScopePolicy policy) {

    public RequiredScopes {
        scopes = scopes == null ? Set.of() : Set.copyOf(scopes);
        if (policy == null) {
            policy = ScopePolicy.ANY_OF;
        }
    }

    public static RequiredScopes none() {
        return new RequiredScopes(Set.of(), ScopePolicy.ANY_OF);
    }

    public static RequiredScopes anyOf(String... scopes) {
        return new RequiredScopes(Set.copyOf(Arrays.asList(scopes)), ScopePolicy.ANY_OF);
    }

    public static RequiredScopes allOf(String... scopes) {
        return new RequiredScopes(Set.copyOf(Arrays.asList(scopes)), ScopePolicy.ALL_OF);
    }

    public boolean isEmpty() {
        return scopes.isEmpty();
    }
}
