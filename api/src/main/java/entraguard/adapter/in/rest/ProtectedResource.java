package entraguard.adapter.in.rest;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

import org.jboss.logging.Logger;

import entraguard.adapter.in.auth.AuthenticatedIdentity;
import entraguard.adapter.in.auth.RequiresScopes;
import entraguard.adapter.in.dto.ProtectedResponse;
import entraguard.adapter.in.dto.UserResponse;

/**
 * Endpoint that requires a bearer token granting the application's delegated scope.
 *
 * <p>Requests are authenticated by {@link entraguard.adapter.in.auth.ScopeAuthorizationFilter}
 * before this resource is invoked.
 */
@Path("/protected")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class ProtectedResource {

    private static final Logger LOG = Logger.getLogger(ProtectedResource.class);

    static final String AUTHENTICATED_MESSAGE = "You are authenticated!";

    private final AuthenticatedIdentity authenticatedIdentity;

    public ProtectedResource(AuthenticatedIdentity authenticatedIdentity) {
        this.authenticatedIdentity = authenticatedIdentity;
    }

    @GET
    @RequiresScopes(RequiresScopes.APPLICATION_SCOPE)
    public ProtectedResponse whoAmI() {
        var identity = authenticatedIdentity.require();
        LOG.debugv("Serving protected resource to subject {0}", identity.subject());
        return new ProtectedResponse(AUTHENTICATED_MESSAGE, UserResponse.from(identity));
    }
}
