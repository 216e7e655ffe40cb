package entraguard.core.model.auth;

import java.net.URI;
import java.util.Set;

/**
 * The parts of an OpenID discovery document used for token verification.
 *
 * @param issuer              the provider's issuer identifier
 * @param jwksUri             location of the provider's signing key set
 * @param signingAlgorithms   advertised token signing algorithms (may be empty)
 */
public record OpenIdMetadata(String issuer, URI jwksUri, Set<String> signingAlgorithms) {

    public OpenIdMetadata {
        if (issuer == null || issuer.isBlank()) {
            throw new IllegalArgumentException("Issuer cannot be null or blank");
        }
        if (jwksUri == null) {
            throw new IllegalArgumentException("JWKS URI cannot be null");
        }
        signingAlgorithms = signingAlgorithms == null ? Set.of() : Set.copyOf(signingAlgorithms);
    }
}
