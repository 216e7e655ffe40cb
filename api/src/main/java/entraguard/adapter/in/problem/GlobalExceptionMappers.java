package entraguard.adapter.in.problem;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.core.Response;

import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import entraguard.core.model.auth.AuthorizationException;

/**
 * Global exception mappers for converting exceptions to RFC 7807 Problem Details.
 *
 * <p>Maps an {@link AuthorizationException} raised outside the request filter to the
 * same generic 401/403 response the filter produces.
 */
@ApplicationScoped
public class GlobalExceptionMappers {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMappers.class);

    @ServerExceptionMapper
    public Response mapAuthorizationException(AuthorizationException e) {
        LOG.debugv("Authorization failed ({0}): {1}", e.error(), e.getMessage());
        return AuthProblem.toResponse(e);
    }
}
