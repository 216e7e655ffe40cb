package entraguard.core.port.out;

import java.net.URI;

import io.smallrye.mutiny.Uni;

import entraguard.core.model.auth.OpenIdMetadata;
import entraguard.core.model.auth.SigningKeySet;

/**
 * Port for retrieving discovery metadata and signing keys from the identity provider.
 *
 * <p>Implementations perform the network call and parse the response defensively;
 * caching is the caller's concern.
 */
public interface IdentityProviderClient {

    /**
     * Fetch and parse the OpenID discovery document.
     *
     * @param discoveryUri the {@code .well-known/openid-configuration} location
     * @return the parsed metadata, or a {@link FetchException} failure
     */
    Uni<OpenIdMetadata> fetchMetadata(URI discoveryUri);

    /**
     * Fetch and parse the JSON Web Key Set.
     *
     * @param jwksUri the key set location taken from the discovery document
     * @return the signing keys that carry a key identifier, or a {@link FetchException} failure
     */
    Uni<SigningKeySet> fetchKeySet(URI jwksUri);

    /**
     * Raised when a fetch fails because of transport errors, unexpected status
     * codes or malformed documents.
     */
    class FetchException extends RuntimeException {
        public FetchException(String message) {
            super(message);
        }

        public FetchException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
