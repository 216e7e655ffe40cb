package entraguard.core.model.auth;

import java.net.URI;
import java.time.Duration;
import java.util.Optional;
import java.util.Set;

/**
 * Settings for verifying access tokens issued by a single Entra ID tenant.
 *
 * @param tenantId          directory (tenant) identifier
 * @param appClientId       client id of the protected backend application
 * @param scopeName         short name of the application's delegated permission
 * @param authorityHost     identity provider host (e.g., https://login.microsoftonline.com)
 * @param tokenVersion      access token version, 1 or 2
 * @param allowedAlgorithms signing algorithms accepted on inbound tokens
 * @param clockSkew         tolerance applied to the exp and nbf checks
 * @param scopePolicy       default policy for routes that do not choose one
 * @param allowGuestUsers   whether guest accounts may authenticate
 * @param cacheTtl          freshness window of cached metadata; empty means until invalidated
 * @param fetchTimeout      bound on each discovery and key-set fetch
 * @param requireHttps      reject key-set endpoints that are not https
 */
public record TenantSettings(
        String tenantId,
        String appClientId,
        String scopeName,
        URI authorityHost,
        int tokenVersion,
        Set<String> allowedAlgorithms,
        Duration clockSkew,
        ScopePolicy scopePolicy,
        boolean allowGuestUsers,
        Optional<Duration> cacheTtl,
        Duration fetchTimeout,
        boolean requireHttps) {

    public static final String DEFAULT_AUTHORITY_HOST = "https://login.microsoftonline.com";
    public static final String DEFAULT_SCOPE_NAME = "user_impersonation";
    public static final String APPLICATION_ID_URI_SCHEME = "api://";

    private static final String DISCOVERY_PATH = "/.well-known/openid-configuration";

    public TenantSettings {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("Tenant ID cannot be null or blank");
        }
        if (appClientId == null || appClientId.isBlank()) {
            throw new IllegalArgumentException("Application client ID cannot be null or blank");
        }
        if (scopeName == null || scopeName.isBlank()) {
            scopeName = DEFAULT_SCOPE_NAME;
        }
        if (authorityHost == null) {
            authorityHost = URI.create(DEFAULT_AUTHORITY_HOST);
        }
        if (tokenVersion != 1 && tokenVersion != 2) {
            throw new IllegalArgumentException("Token version must be 1 or 2, got " + tokenVersion);
        }
        if (allowedAlgorithms == null || allowedAlgorithms.isEmpty()) {
            allowedAlgorithms = Set.of("RS256");
        }
        if (allowedAlgorithms.stream().anyMatch("none"::equalsIgnoreCase)) {
            throw new IllegalArgumentException("The 'none' algorithm cannot be allowed");
        }
        allowedAlgorithms = Set.copyOf(allowedAlgorithms);
        if (clockSkew == null) {
            clockSkew = Duration.ofSeconds(60);
        }
        if (clockSkew.isNegative()) {
            throw new IllegalArgumentException("Clock skew cannot be negative");
        }
        if (scopePolicy == null) {
            scopePolicy = ScopePolicy.ANY_OF;
        }
        if (cacheTtl == null) {
            cacheTtl = Optional.empty();
        }
        if (fetchTimeout == null) {
            fetchTimeout = Duration.ofSeconds(5);
        }
    }

    /**
     * OpenID discovery document location for the tenant.
     */
    public URI discoveryUri() {
        var base = tenantAuthority();
        if (tokenVersion == 2) {
            return URI.create(base + "/v2.0" + DISCOVERY_PATH);
        }
        return URI.create(base + DISCOVERY_PATH);
    }

    /**
     * Issuer that access tokens of the configured version must carry.
     */
    public String expectedIssuer() {
        if (tokenVersion == 2) {
            return tenantAuthority() + "/v2.0";
        }
        return "https://sts.windows.net/" + tenantId + "/";
    }

    /**
     * Audience values accepted on access tokens: the client id and its application ID URI.
     */
    public Set<String> audiences() {
        return Set.of(appClientId, applicationIdUri());
    }

    public String applicationIdUri() {
        return APPLICATION_ID_URI_SCHEME + appClientId;
    }

    /**
     * Delegated permission in its fully qualified form, {@code api://<app-client-id>/<scope-name>}.
     */
    public String qualifiedScope() {
        return qualify(scopeName);
    }

    public String qualify(String scope) {
        return applicationIdUri() + "/" + scope;
    }

    /**
     * Reduce a qualified scope of this application to the short name carried in the {@code scp} claim.
     *
     * <p>Scopes of other applications and short names are returned unchanged.
     */
    public String shortScopeName(String scope) {
        var prefix = applicationIdUri() + "/";
        if (scope.startsWith(prefix)) {
            return scope.substring(prefix.length());
        }
        return scope;
    }

    private String tenantAuthority() {
        var host = authorityHost.toString();
        while (host.endsWith("/")) {
            host = host.substring(0, host.length() - 1);
        }
        return host + "/" + tenantId;
    }

    public static Builder builder(String tenantId, String appClientId) {
        return new Builder(tenantId, appClientId);
    }

    public static class Builder {
        private final String tenantId;
        private final String appClientId;
        private String scopeName = DEFAULT_SCOPE_NAME;
        private URI authorityHost = URI.create(DEFAULT_AUTHORITY_HOST);
        private int tokenVersion = 2;
        private Set<String> allowedAlgorithms = Set.of("RS256");
        private Duration clockSkew = Duration.ofSeconds(60);
        private ScopePolicy scopePolicy = ScopePolicy.ANY_OF;
        private boolean allowGuestUsers;
        private Duration cacheTtl;
        private Duration fetchTimeout = Duration.ofSeconds(5);
        private boolean requireHttps = true;

        private Builder(String tenantId, String appClientId) {
            this.tenantId = tenantId;
            this.appClientId = appClientId;
        }

        public Builder scopeName(String scopeName) {
            this.scopeName = scopeName;
            return this;
        }

        public Builder authorityHost(URI authorityHost) {
            this.authorityHost = authorityHost;
            return this;
        }

        public Builder tokenVersion(int tokenVersion) {
            this.tokenVersion = tokenVersion;
            return this;
        }

        public Builder allowedAlgorithms(Set<String> allowedAlgorithms) {
            this.allowedAlgorithms = allowedAlgorithms;
            return this;
        }

        public Builder clockSkew(Duration clockSkew) {
            this.clockSkew = clockSkew;
            return this;
        }

        public Builder scopePolicy(ScopePolicy scopePolicy) {
            this.scopePolicy = scopePolicy;
            return this;
        }

        public Builder allowGuestUsers(boolean allowGuestUsers) {
            this.allowGuestUsers = allowGuestUsers;
            return this;
        }

        public Builder cacheTtl(Duration cacheTtl) {
            this.cacheTtl = cacheTtl;
            return this;
        }

        public Builder fetchTimeout(Duration fetchTimeout) {
            this.fetchTimeout = fetchTimeout;
            return this;
        }

        public Builder requireHttps(boolean requireHttps) {
            this.requireHttps = requireHttps;
            return this;
        }

        public TenantSettings build() {
            return new TenantSettings(
                    tenantId,
                    appClientId,
                    scopeName,
                    authorityHost,
                    tokenVersion,
                    allowedAlgorithms,
                    clockSkew,
                    scopePolicy,
                    allowGuestUsers,
                    Optional.ofNullable(cacheTtl),
                    fetchTimeout,
                    requireHttps);
        }
    }
}
