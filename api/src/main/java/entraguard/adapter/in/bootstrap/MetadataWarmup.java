package entraguard.adapter.in.bootstrap;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;

import io.quarkus.runtime.StartupEvent;
import org.jboss.logging.Logger;

import entraguard.config.EntraConfig;
import entraguard.core.port.out.SigningKeyCache;

/**
 * Loads the tenant's discovery metadata and signing keys on application startup.
 *
 * <p>Startup does not wait for the fetch and does not fail when the identity
 * provider is unreachable: the first protected request retries the load.
 */
@ApplicationScoped
public class MetadataWarmup {

    private static final Logger LOG = Logger.getLogger(MetadataWarmup.class);

    private final SigningKeyCache keyCache;
    private final EntraConfig config;

    @Inject
    public MetadataWarmup(SigningKeyCache keyCache, EntraConfig config) {
        this.keyCache = keyCache;
        this.config = config;
    }

    void onStart(@Observes StartupEvent event) {
        if (!config.metadata().warmUp()) {
            LOG.debug("Metadata warm-up is disabled");
            return;
        }

        LOG.infov("Loading OpenID metadata for tenant {0}", config.tenantId());
        keyCache.getKeySet()
                .subscribe()
                .with(
                        keys -> LOG.infov("Metadata warm-up complete: {0} signing keys", keys.size()),
                        error -> LOG.warnv(
                                "Metadata warm-up failed, retrying on first protected request: {0}",
                                error.getMessage()));
    }
}
