package entraguard.core.port.in;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import entraguard.core.model.auth.RequiredScopes;
import entraguard.core.model.auth.ValidatedIdentity;

/**
 * Use case for authenticating and authorizing requests that carry bearer tokens.
 */
public interface BearerAuthorization {

    /**
     * Authenticate the caller and check the route's required scopes.
     *
     * @param authorizationHeader value of the {@code Authorization} header, may be null
     * @param requiredScopes      scopes the route demands
     * @return the caller's identity, or an {@code AuthorizationException}
     */
    Uni<ValidatedIdentity> authenticateAndAuthorize(String authorizationHeader, RequiredScopes requiredScopes);

    /**
     * Like {@link #authenticateAndAuthorize}, but a request without credentials
     * yields an empty result instead of a {@code MISSING_CREDENTIALS} failure.
     *
     * <p>Credentials that are present must still be valid and sufficiently scoped.
     */
    Uni<Optional<ValidatedIdentity>> authenticateOptionally(
            String authorizationHeader, RequiredScopes requiredScopes);
}
