package entraguard.config;

import java.net.URI;
import java.time.Clock;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import org.jboss.logging.Logger;

import entraguard.core.model.auth.TenantSettings;

/**
 * Produces the core layer's configuration values from {@link EntraConfig}.
 */
@ApplicationScoped
public class TenantSettingsProducer {

    private static final Logger LOG = Logger.getLogger(TenantSettingsProducer.class);

    private final EntraConfig config;

    @Inject
    public TenantSettingsProducer(EntraConfig config) {
        this.config = config;
    }

    @Produces
    @Singleton
    public TenantSettings tenantSettings() {
        var metadata = config.metadata();
        var settings = TenantSettings.builder(config.tenantId(), config.appClientId())
                .scopeName(config.scopeName())
                .authorityHost(URI.create(config.authorityHost()))
                .tokenVersion(config.tokenVersion())
                .allowedAlgorithms(config.allowedAlgorithms())
                .clockSkew(config.clockSkew())
                .scopePolicy(config.scopePolicy())
                .allowGuestUsers(config.allowGuestUsers())
                .cacheTtl(metadata.cacheTtl().orElse(null))
                .fetchTimeout(metadata.fetchTimeout())
                .requireHttps(metadata.requireHttps())
                .build();

        LOG.infov(
                "Accepting v{0} access tokens from issuer {1} for scope {2}",
                settings.tokenVersion(), settings.expectedIssuer(), settings.qualifiedScope());
        return settings;
    }

    @Produces
    @Singleton
    public Clock clock() {
        return Clock.systemUTC();
    }
}
