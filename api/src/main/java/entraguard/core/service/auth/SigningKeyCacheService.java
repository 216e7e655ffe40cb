package entraguard.core.service.auth;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;
import org.jose4j.jwk.JsonWebKey;

import entraguard.core.model.auth.AuthError;
import entraguard.core.model.auth.AuthorizationException;
import entraguard.core.model.auth.OpenIdMetadata;
import entraguard.core.model.auth.SigningKeySet;
import entraguard.core.model.auth.TenantSettings;
import entraguard.core.port.out.AuthMetrics;
import entraguard.core.port.out.AuthMetrics.FetchOutcome;
import entraguard.core.port.out.AuthMetrics.RefreshTrigger;
import entraguard.core.port.out.IdentityProviderClient;
import entraguard.core.port.out.IdentityProviderClient.FetchException;
import entraguard.core.port.out.SigningKeyCache;

/**
 * Caches the tenant's OpenID discovery metadata and signing key set.
 *
 * <p>Features:
 * <ul>
 *   <li>Lazy loading on first use, or eager warm-up at startup</li>
 *   <li>Optional TTL; without one the snapshot is kept until invalidated</li>
 *   <li>One refresh on an unknown key identifier to follow key rotation</li>
 *   <li>Stale snapshot served when a refresh fails</li>
 * </ul>
 *
 * <p>Thread-safety: metadata and keys live in one immutable snapshot that is
 * replaced by a single reference swap, so readers never see a partial update.
 * Concurrent refreshes are coalesced into one in-flight fetch whose outcome every
 * waiting caller observes.
 */
@ApplicationScoped
public class SigningKeyCacheService implements SigningKeyCache {

    private static final Logger LOG = Logger.getLogger(SigningKeyCacheService.class);

    private final IdentityProviderClient client;
    private final TenantSettings settings;
    private final AuthMetrics metrics;
    private final Clock clock;

    private final AtomicReference<ProviderSnapshot> snapshot = new AtomicReference<>();
    private final AtomicReference<Uni<ProviderSnapshot>> inFlightFetch = new AtomicReference<>();

    @Inject
    public SigningKeyCacheService(
            IdentityProviderClient client, TenantSettings settings, AuthMetrics metrics, Clock clock) {
        this.client = client;
        this.settings = settings;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public Uni<OpenIdMetadata> getMetadata() {
        return currentSnapshot().map(ProviderSnapshot::metadata);
    }

    @Override
    public Uni<SigningKeySet> getKeySet() {
        return currentSnapshot().map(ProviderSnapshot::keys);
    }

    @Override
    public Uni<JsonWebKey> getSigningKey(String keyId) {
        return Uni.createFrom().deferred(() -> {
            var cached = snapshot.get();
            if (cached == null || !isFresh(cached)) {
                // The load below already reflects the provider's current keys
                return currentSnapshot().map(loaded -> requireKey(loaded, keyId));
            }

            var key = cached.keys().find(keyId);
            if (key.isPresent()) {
                return Uni.createFrom().item(key.get());
            }

            LOG.infov("Signing key {0} not in cached key set, refreshing", keyId);
            return refreshFrom(cached, RefreshTrigger.UNKNOWN_KEY).map(refreshed -> requireKey(refreshed, keyId));
        });
    }

    @Override
    public Uni<SigningKeySet> refresh() {
        LOG.infov("Force refreshing OpenID metadata for tenant {0}", settings.tenantId());
        return Uni.createFrom()
                .deferred(() -> refreshFrom(snapshot.get(), RefreshTrigger.FORCED))
                .map(ProviderSnapshot::keys);
    }

    @Override
    public void invalidate() {
        LOG.infov("Invalidating cached OpenID metadata for tenant {0}", settings.tenantId());
        snapshot.updateAndGet(current -> current == null ? null : current.markInvalidated());
    }

    private Uni<ProviderSnapshot> currentSnapshot() {
        return Uni.createFrom().deferred(() -> {
            var cached = snapshot.get();
            if (cached != null && isFresh(cached)) {
                LOG.debugv("Using cached OpenID metadata for tenant {0}", settings.tenantId());
                return Uni.createFrom().item(cached);
            }
            return refreshFrom(cached, cached == null ? RefreshTrigger.INITIAL : RefreshTrigger.EXPIRED);
        });
    }

    /**
     * Join the in-flight fetch or start one, unless the snapshot has already been
     * replaced since {@code seen} was read.
     */
    private Uni<ProviderSnapshot> refreshFrom(ProviderSnapshot seen, RefreshTrigger trigger) {
        return inFlightFetch.updateAndGet(existing -> existing != null ? existing : createFetch(seen, trigger));
    }

    private Uni<ProviderSnapshot> createFetch(ProviderSnapshot seen, RefreshTrigger trigger) {
        return Uni.createFrom()
                .deferred(() -> {
                    var latest = snapshot.get();
                    if (latest != null && latest != seen && isFresh(latest)) {
                        return Uni.createFrom().item(latest);
                    }
                    return fetchSnapshot(trigger);
                })
                .onTermination()
                .invoke(() -> inFlightFetch.set(null))
                .memoize()
                .indefinitely();
    }

    private Uni<ProviderSnapshot> fetchSnapshot(RefreshTrigger trigger) {
        var discoveryUri = settings.discoveryUri();

        return Uni.createFrom()
                .deferred(() -> {
                    LOG.infov("Fetching OpenID metadata from {0} (trigger: {1})", discoveryUri, trigger);
                    return client.fetchMetadata(discoveryUri);
                })
                .ifNoItem()
                .after(settings.fetchTimeout())
                .failWith(() -> new FetchException("Timeout fetching OpenID metadata from " + discoveryUri))
                .flatMap(metadata -> fetchKeys(metadata)
                        .map(keys -> new ProviderSnapshot(metadata, keys, clock.instant(), false)))
                .invoke(fresh -> {
                    snapshot.set(fresh);
                    metrics.recordMetadataFetch(trigger, FetchOutcome.SUCCESS);
                    LOG.infov(
                            "Cached {0} signing keys from {1}",
                            fresh.keys().size(), fresh.metadata().jwksUri());
                })
                .onFailure()
                .recoverWithUni(error -> fallBackToStale(trigger, error));
    }

    private Uni<SigningKeySet> fetchKeys(OpenIdMetadata metadata) {
        var jwksUri = metadata.jwksUri();
        if (settings.requireHttps() && !"https".equalsIgnoreCase(jwksUri.getScheme())) {
            return Uni.createFrom().failure(new FetchException("Refusing non-https JWKS URI " + jwksUri));
        }
        if (!settings.expectedIssuer().equals(metadata.issuer())) {
            LOG.warnv(
                    "Discovery issuer {0} differs from expected issuer {1}",
                    metadata.issuer(), settings.expectedIssuer());
        }

        return Uni.createFrom()
                .deferred(() -> client.fetchKeySet(jwksUri))
                .ifNoItem()
                .after(settings.fetchTimeout())
                .failWith(() -> new FetchException("Timeout fetching JWKS from " + jwksUri));
    }

    private Uni<ProviderSnapshot> fallBackToStale(RefreshTrigger trigger, Throwable error) {
        LOG.errorv(error, "Failed to fetch OpenID metadata for tenant {0}", settings.tenantId());

        var stale = snapshot.get();
        if (stale != null) {
            LOG.warnv("Using stale OpenID metadata for tenant {0} due to: {1}", settings.tenantId(), error.getMessage());
            metrics.recordMetadataFetch(trigger, FetchOutcome.STALE);
            return Uni.createFrom().item(stale);
        }

        metrics.recordMetadataFetch(trigger, FetchOutcome.FAILURE);
        return Uni.createFrom()
                .failure(new AuthorizationException(
                        AuthError.METADATA_UNAVAILABLE, "OpenID metadata unavailable: " + error.getMessage(), error));
    }

    private boolean isFresh(ProviderSnapshot cached) {
        if (cached.invalidated()) {
            return false;
        }
        return settings.cacheTtl()
                .map(ttl -> clock.instant().isBefore(cached.fetchedAt().plus(ttl)))
                .orElse(true);
    }

    private static JsonWebKey requireKey(ProviderSnapshot current, String keyId) {
        return current.keys()
                .find(keyId)
                .orElseThrow(() -> new AuthorizationException(
                        AuthError.UNKNOWN_SIGNING_KEY, "Signing key '%s' not found in JWKS".formatted(keyId)));
    }

    private record ProviderSnapshot(
            OpenIdMetadata metadata, SigningKeySet keys, Instant fetchedAt, boolean invalidated) {
        ProviderSnapshot markInvalidated() {
            return new ProviderSnapshot(metadata, keys, fetchedAt, true);
        }
    }
}
