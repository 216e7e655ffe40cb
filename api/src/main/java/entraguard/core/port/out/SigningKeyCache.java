package entraguard.core.port.out;

import io.smallrye.mutiny.Uni;
import org.jose4j.jwk.JsonWebKey;

import entraguard.core.model.auth.OpenIdMetadata;
import entraguard.core.model.auth.SigningKeySet;

/**
 * Port for the tenant's cached discovery metadata and signing keys.
 *
 * <p>Implementations are responsible for:
 * <ul>
 *   <li>Fetching metadata and keys lazily, or eagerly when warmed up</li>
 *   <li>Swapping the cached snapshot atomically</li>
 *   <li>Coalescing concurrent refreshes into a single fetch</li>
 *   <li>Serving the previous snapshot when a refresh fails</li>
 * </ul>
 */
public interface SigningKeyCache {

    /**
     * Get the discovery metadata, fetching it if nothing fresh is cached.
     *
     * @return the metadata, or an {@code AuthorizationException} with
     *         {@code METADATA_UNAVAILABLE} when no snapshot can be obtained
     */
    Uni<OpenIdMetadata> getMetadata();

    /**
     * Get the current signing key set, fetching it if nothing fresh is cached.
     */
    Uni<SigningKeySet> getKeySet();

    /**
     * Get the signing key with the given identifier.
     *
     * <p>An unknown key identifier triggers one refresh, to pick up rotated keys,
     * before the lookup is retried.
     *
     * @param keyId the {@code kid} header of the token
     * @return the key, or an {@code AuthorizationException} with {@code UNKNOWN_SIGNING_KEY}
     */
    Uni<JsonWebKey> getSigningKey(String keyId);

    /**
     * Force a refresh of metadata and keys.
     *
     * @return the key set after the refresh
     */
    Uni<SigningKeySet> refresh();

    /**
     * Mark the cached snapshot as stale so the next access refetches it.
     *
     * <p>The stale snapshot is still served if that refetch fails.
     */
    void invalidate();
}
