package entraguard.core.service.auth;

import java.util.LinkedHashSet;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import entraguard.core.model.auth.InsufficientScopeException;
import entraguard.core.model.auth.RequiredScopes;
import entraguard.core.model.auth.ScopePolicy;
import entraguard.core.model.auth.TenantSettings;
import entraguard.core.model.auth.ValidatedIdentity;

/**
 * Decides whether a verified identity holds the delegated permissions a route requires.
 *
 * <p>Access tokens carry short scope names in {@code scp} (e.g., {@code user_impersonation}),
 * while routes may name the qualified form {@code api://<app-client-id>/user_impersonation}.
 * Qualified scopes of this application are reduced to their short name before comparison.
 */
@ApplicationScoped
public class ScopeEnforcer {

    private final TenantSettings settings;

    @Inject
    public ScopeEnforcer(TenantSettings settings) {
        this.settings = settings;
    }

    /**
     * Check the identity's granted scopes against the route's requirement.
     *
     * @throws InsufficientScopeException naming the missing scopes when the check fails
     */
    public void authorize(ValidatedIdentity identity, RequiredScopes required) {
        if (required.isEmpty()) {
            return;
        }

        var missing = new LinkedHashSet<String>();
        for (var scope : required.scopes()) {
            if (!identity.hasScope(settings.shortScopeName(scope))) {
                missing.add(scope);
            }
        }

        if (isSatisfied(required, missing)) {
            return;
        }
        throw new InsufficientScopeException(missing);
    }

    private static boolean isSatisfied(RequiredScopes required, Set<String> missing) {
        if (required.policy() == ScopePolicy.ALL_OF) {
            return missing.isEmpty();
        }
        return missing.size() < required.scopes().size();
    }
}
