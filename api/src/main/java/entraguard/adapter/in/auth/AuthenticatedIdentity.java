package entraguard.adapter.in.auth;

import java.util.Optional;

import jakarta.enterprise.context.RequestScoped;
import jakarta.inject.Inject;

import io.vertx.ext.web.RoutingContext;

import entraguard.core.model.auth.ValidatedIdentity;

/**
 * Identity established for the current request by {@link ScopeAuthorizationFilter}.
 *
 * <p>The identity travels on the Vert.x {@link RoutingContext} so the filter can attach
 * it from any thread its verification completes on.
 */
@RequestScoped
public class AuthenticatedIdentity {

    private static final String CONTEXT_KEY = AuthenticatedIdentity.class.getName();

    @Inject
    RoutingContext routingContext;

    static void attach(RoutingContext routingContext, ValidatedIdentity identity) {
        routingContext.put(CONTEXT_KEY, identity);
    }

    public Optional<ValidatedIdentity> get() {
        return Optional.ofNullable(routingContext.get(CONTEXT_KEY));
    }

    /**
     * Return the identity of a request that passed a {@link RequiresScopes} route.
     *
     * @throws IllegalStateException if the request was not authenticated
     */
    public ValidatedIdentity require() {
        return get().orElseThrow(() -> new IllegalStateException("Request has no authenticated identity"));
    }
}
