package entraguard.config;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import entraguard.core.model.auth.ScopePolicy;

/**
 * Configuration mapping for the Entra ID tenant whose access tokens are accepted.
 *
 * <p>Configuration prefix: {@code entra}
 *
 * <h2>Configuration Properties</h2>
 * <ul>
 *   <li>{@code entra.tenant-id} - directory (tenant) id</li>
 *   <li>{@code entra.app-client-id} - client id of this backend application</li>
 *   <li>{@code entra.scope-name} - delegated permission exposed by the application</li>
 *   <li>{@code entra.metadata.*} - discovery metadata caching</li>
 * </ul>
 */
@ConfigMapping(prefix = "entra")
public interface EntraConfig {

    /**
     * Directory (tenant) id. Only tokens issued by this tenant are accepted.
     */
    String tenantId();

    /**
     * Client id of the backend application, used as the expected audience.
     */
    String appClientId();

    /**
     * Short name of the delegated permission, qualified as
     * {@code api://<app-client-id>/<scope-name>}.
     *
     * @return scope name (default: user_impersonation)
     */
    @WithDefault("user_impersonation")
    String scopeName();

    /**
     * Identity provider host.
     *
     * @return authority host (default: https://login.microsoftonline.com)
     */
    @WithDefault("https://login.microsoftonline.com")
    String authorityHost();

    /**
     * Access token version the application is registered for (1 or 2).
     *
     * @return token version (default: 2)
     */
    @WithDefault("2")
    int tokenVersion();

    /**
     * Signing algorithms accepted on inbound tokens.
     *
     * @return allowed algorithms (default: RS256)
     */
    @WithDefault("RS256")
    Set<String> allowedAlgorithms();

    /**
     * Tolerance applied to both the exp and nbf checks.
     *
     * @return clock skew (default: 60 seconds)
     */
    @WithDefault("PT60S")
    Duration clockSkew();

    /**
     * Scope policy for routes that do not choose one.
     *
     * @return scope policy (default: any-of)
     */
    @WithDefault("any-of")
    ScopePolicy scopePolicy();

    /**
     * Accept tokens of guest accounts ({@code acct} claim of 1).
     *
     * @return true to allow guests (default: false)
     */
    @WithDefault("false")
    boolean allowGuestUsers();

    /**
     * Discovery metadata and signing key caching.
     */
    MetadataConfig metadata();

    interface MetadataConfig {

        /**
         * Freshness window of the cached metadata and keys.
         *
         * <p>When unset, the snapshot is kept until invalidated. An unknown
         * key identifier always triggers a refresh.
         *
         * @return cache TTL
         */
        Optional<Duration> cacheTtl();

        /**
         * Bound on each discovery and JWKS request. On timeout the stale
         * snapshot is served if one exists.
         *
         * @return fetch timeout (default: 5 seconds)
         */
        @WithDefault("PT5S")
        Duration fetchTimeout();

        /**
         * Fetch metadata at startup instead of on the first protected request.
         *
         * @return true to warm up eagerly (default: true)
         */
        @WithDefault("true")
        boolean warmUp();

        /**
         * Refuse a discovery document whose jwks_uri is not https.
         *
         * @return true to require https (default: true)
         */
        @WithDefault("true")
        boolean requireHttps();
    }
}
