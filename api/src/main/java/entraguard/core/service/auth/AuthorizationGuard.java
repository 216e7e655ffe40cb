package entraguard.core.service.auth;

import java.util.Locale;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import entraguard.core.model.auth.AuthError;
import entraguard.core.model.auth.AuthorizationException;
import entraguard.core.model.auth.RequiredScopes;
import entraguard.core.model.auth.TenantSettings;
import entraguard.core.model.auth.ValidatedIdentity;
import entraguard.core.port.in.BearerAuthorization;
import entraguard.core.port.out.AuthMetrics;
import entraguard.core.port.out.TokenVerifier;

/**
 * Authenticates bearer tokens and enforces route scopes.
 *
 * <p>Extracts the token from the {@code Authorization} header, verifies it
 * against the tenant's expected issuer and audiences, then applies the
 * {@link ScopeEnforcer}. Every refusal is logged and counted with its precise
 * {@link AuthError}; callers only need {@link AuthError#rejection()} to answer
 * the client.
 */
@ApplicationScoped
public class AuthorizationGuard implements BearerAuthorization {

    private static final Logger LOG = Logger.getLogger(AuthorizationGuard.class);

    private static final String BEARER_SCHEME = "bearer ";

    private final TokenVerifier verifier;
    private final ScopeEnforcer scopeEnforcer;
    private final TenantSettings settings;
    private final AuthMetrics metrics;

    @Inject
    public AuthorizationGuard(
            TokenVerifier verifier, ScopeEnforcer scopeEnforcer, TenantSettings settings, AuthMetrics metrics) {
        this.verifier = verifier;
        this.scopeEnforcer = scopeEnforcer;
        this.settings = settings;
        this.metrics = metrics;
    }

    @Override
    public Uni<ValidatedIdentity> authenticateAndAuthorize(String authorizationHeader, RequiredScopes requiredScopes) {
        var token = extractBearerToken(authorizationHeader);
        if (token.isEmpty()) {
            return reject(new AuthorizationException(
                    AuthError.MISSING_CREDENTIALS, "No bearer token in Authorization header"));
        }
        return verifyAndAuthorize(token.get(), requiredScopes);
    }

    @Override
    public Uni<Optional<ValidatedIdentity>> authenticateOptionally(
            String authorizationHeader, RequiredScopes requiredScopes) {
        var token = extractBearerToken(authorizationHeader);
        if (token.isEmpty()) {
            LOG.debug("No bearer token present, continuing unauthenticated");
            return Uni.createFrom().item(Optional.empty());
        }
        return verifyAndAuthorize(token.get(), requiredScopes).map(Optional::of);
    }

    private Uni<ValidatedIdentity> verifyAndAuthorize(String token, RequiredScopes requiredScopes) {
        return verifier.verify(token, settings.audiences(), settings.expectedIssuer())
                .invoke(identity -> scopeEnforcer.authorize(identity, requiredScopes))
                .invoke(identity -> {
                    metrics.recordSuccess();
                    LOG.debugv("Authorized subject {0} with scopes {1}", identity.subject(), identity.scopes());
                })
                .onFailure(AuthorizationException.class)
                .invoke(error -> recordRejection((AuthorizationException) error));
    }

    private Uni<ValidatedIdentity> reject(AuthorizationException error) {
        recordRejection(error);
        return Uni.createFrom().failure(error);
    }

    private void recordRejection(AuthorizationException error) {
        metrics.recordRejection(error.error());
        LOG.debugv("Request rejected ({0}): {1}", error.error(), error.getMessage());
    }

    /**
     * Extract the token from an {@code Authorization: Bearer <token>} header value.
     *
     * <p>The scheme is matched case-insensitively.
     */
    static Optional<String> extractBearerToken(String authorizationHeader) {
        if (authorizationHeader == null || authorizationHeader.isBlank()) {
            return Optional.empty();
        }
        var header = authorizationHeader.trim();
        if (header.length() <= BEARER_SCHEME.length()
                || !header.substring(0, BEARER_SCHEME.length()).toLowerCase(Locale.ROOT).equals(BEARER_SCHEME)) {
            return Optional.empty();
        }
        var token = header.substring(BEARER_SCHEME.length()).trim();
        return token.isEmpty() ? Optional.empty() : Optional.of(token);
    }
}
