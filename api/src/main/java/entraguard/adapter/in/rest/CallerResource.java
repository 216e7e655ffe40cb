package entraguard.adapter.in.rest;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

import entraguard.adapter.in.auth.AuthenticatedIdentity;
import entraguard.adapter.in.auth.RequiresScopes;
import entraguard.adapter.in.dto.CallerResponse;
import entraguard.adapter.in.dto.UserResponse;

/**
 * Reports who is calling. Anonymous requests are allowed; a token that is sent must be valid.
 */
@Path("/me")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class CallerResource {

    private final AuthenticatedIdentity authenticatedIdentity;

    public CallerResource(AuthenticatedIdentity authenticatedIdentity) {
        this.authenticatedIdentity = authenticatedIdentity;
    }

    @GET
    @RequiresScopes(credentialsOptional = true)
    public CallerResponse caller() {
        return authenticatedIdentity
                .get()
                .map(identity -> new CallerResponse(true, UserResponse.from(identity)))
                .orElseGet(CallerResponse::anonymous);
    }
}
