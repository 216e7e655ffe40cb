package entraguard.adapter.in.rest;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

import entraguard.adapter.in.dto.MessageResponse;

/**
 * Unauthenticated endpoint.
 */
@Path("/")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class PublicResource {

    static final String PUBLIC_MESSAGE = "Hello, this is a public endpoint.";

    @GET
    public MessageResponse hello() {
        return new MessageResponse(PUBLIC_MESSAGE);
    }
}
