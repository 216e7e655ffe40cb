package entraguard.adapter.in.auth;

import java.lang.reflect.Method;
import java.util.LinkedHashSet;
import java.util.Optional;

import jakarta.inject.Inject;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ResourceInfo;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;
import io.vertx.ext.web.RoutingContext;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerRequestFilter;

import entraguard.adapter.in.problem.AuthProblem;
import entraguard.core.model.auth.AuthorizationException;
import entraguard.core.model.auth.RequiredScopes;
import entraguard.core.model.auth.TenantSettings;
import entraguard.core.model.auth.ValidatedIdentity;
import entraguard.core.port.in.BearerAuthorization;

/**
 * Request filter that guards routes annotated with {@link RequiresScopes}.
 *
 * <p>Requests to unannotated routes pass through untouched. For guarded routes the
 * filter authenticates the bearer token, checks the required scopes and stores the
 * resulting identity in {@link AuthenticatedIdentity}. Refused requests are aborted
 * with a 401 or 403 problem response before the resource method runs.
 */
public class ScopeAuthorizationFilter {

    private static final Logger LOG = Logger.getLogger(ScopeAuthorizationFilter.class);

    private final BearerAuthorization authorization;
    private final TenantSettings settings;

    @Inject
    public ScopeAuthorizationFilter(BearerAuthorization authorization, TenantSettings settings) {
        this.authorization = authorization;
        this.settings = settings;
    }

    @ServerRequestFilter(priority = Priorities.AUTHORIZATION)
    public Uni<Response> authorize(
            ContainerRequestContext requestContext, ResourceInfo resourceInfo, RoutingContext routingContext) {
        var annotation = findAnnotation(resourceInfo);
        if (annotation.isEmpty()) {
            return Uni.createFrom().nullItem();
        }

        var requiresScopes = annotation.get();
        var required = requiredScopes(requiresScopes);
        var header = requestContext.getHeaderString(HttpHeaders.AUTHORIZATION);

        Uni<Optional<ValidatedIdentity>> authentication = requiresScopes.credentialsOptional()
                ? authorization.authenticateOptionally(header, required)
                : authorization.authenticateAndAuthorize(header, required).map(Optional::of);

        return authentication.map(result -> {
                    result.ifPresent(identity -> AuthenticatedIdentity.attach(routingContext, identity));
                    return (Response) null;
                })
                .onFailure(AuthorizationException.class)
                .recoverWithItem(e -> refuse(requestContext, (AuthorizationException) e));
    }

    /**
     * Translate a route annotation into the scopes it demands.
     */
    RequiredScopes requiredScopes(RequiresScopes annotation) {
        var scopes = new LinkedHashSet<String>();
        for (String scope : annotation.value()) {
            if (RequiresScopes.APPLICATION_SCOPE.equals(scope)) {
                scopes.add(settings.scopeName());
            } else if (scope != null && !scope.isBlank()) {
                scopes.add(scope.trim());
            }
        }
        return new RequiredScopes(scopes, annotation.policy().resolve(settings.scopePolicy()));
    }

    static Optional<RequiresScopes> findAnnotation(ResourceInfo resourceInfo) {
        Method method = resourceInfo.getResourceMethod();
        if (method != null && method.isAnnotationPresent(RequiresScopes.class)) {
            return Optional.of(method.getAnnotation(RequiresScopes.class));
        }
        Class<?> resourceClass = resourceInfo.getResourceClass();
        if (resourceClass != null && resourceClass.isAnnotationPresent(RequiresScopes.class)) {
            return Optional.of(resourceClass.getAnnotation(RequiresScopes.class));
        }
        return Optional.empty();
    }

    private Response refuse(ContainerRequestContext requestContext, AuthorizationException e) {
        LOG.debugv(
                "Refused {0} {1}: {2}",
                requestContext.getMethod(),
                requestContext.getUriInfo().getPath(),
                e.error());
        return AuthProblem.toResponse(e);
    }
}
