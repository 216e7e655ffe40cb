package entraguard.adapter.out.telemetry;

import java.util.Locale;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import entraguard.core.model.auth.AuthError;
import entraguard.core.port.out.AuthMetrics;

/**
 * Micrometer implementation of {@link AuthMetrics}.
 *
 * <p>Records:
 * <ul>
 *   <li>{@code entra.metadata.fetch} - metadata/key-set fetches by trigger and outcome</li>
 *   <li>{@code entra.auth.success} - requests that passed all checks</li>
 *   <li>{@code entra.auth.rejections} - refused requests by precise reason</li>
 * </ul>
 */
@ApplicationScoped
public class MicrometerAuthMetrics implements AuthMetrics {

    private final MeterRegistry registry;
    private final Counter successCounter;

    @Inject
    public MicrometerAuthMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.successCounter = Counter.builder("entra.auth.success")
                .description("Requests that passed token verification and scope checks")
                .register(registry);
    }

    @Override
    public void recordMetadataFetch(RefreshTrigger trigger, FetchOutcome outcome) {
        Counter.builder("entra.metadata.fetch")
                .description("OpenID metadata and signing key fetches")
                .tag("trigger", tagValue(trigger))
                .tag("outcome", tagValue(outcome))
                .register(registry)
                .increment();
    }

    @Override
    public void recordSuccess() {
        successCounter.increment();
    }

    @Override
    public void recordRejection(AuthError error) {
        Counter.builder("entra.auth.rejections")
                .description("Requests refused by the authorization component")
                .tag("reason", tagValue(error))
                .tag("outcome", tagValue(error.rejection()))
                .register(registry)
                .increment();
    }

    private static String tagValue(Enum<?> value) {
        return value.name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
