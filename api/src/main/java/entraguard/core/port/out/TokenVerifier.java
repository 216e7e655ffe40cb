package entraguard.core.port.out;

import java.util.Set;

import io.smallrye.mutiny.Uni;

import entraguard.core.model.auth.ValidatedIdentity;

/**
 * Port for verifying bearer access tokens.
 */
public interface TokenVerifier {

    /**
     * Verify a raw bearer token.
     *
     * <p>Implementations must check the signature before trusting any claim, then
     * the issuer, audience, expiry and not-before claims.
     *
     * @param rawToken          the compact token (without the "Bearer " prefix)
     * @param expectedAudiences audience values of which the token must carry at least one
     * @param expectedIssuer    exact issuer the token must carry
     * @return the identity, or an {@code AuthorizationException} naming the failed check
     */
    Uni<ValidatedIdentity> verify(String rawToken, Set<String> expectedAudiences, String expectedIssuer);
}
