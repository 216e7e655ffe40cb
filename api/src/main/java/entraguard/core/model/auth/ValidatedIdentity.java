package entraguard.core.model.auth;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Caller identity established from a verified access token.
 *
 * <p>Created per request and discarded with it.
 */
public record ValidatedIdentity(
        String subject,
        String tenantId,
        String objectId,
        String name,
        String email,
        String preferredUsername,
        String upn,
        String appId,
        Set<String> scopes,
        List<String> roles,
        List<String> groups,
        Instant issuedAt,
        Instant expiresAt,
        Map<String, Object> additionalClaims) {

    public ValidatedIdentity {
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("Subject cannot be null or blank");
        }
        scopes = scopes == null ? Set.of() : Set.copyOf(scopes);
        roles = roles == null ? List.of() : List.copyOf(roles);
        groups = groups == null ? List.of() : List.copyOf(groups);
        additionalClaims = additionalClaims == null ? Map.of() : Map.copyOf(additionalClaims);
    }

    public static ValidatedIdentity from(TokenClaims claims) {
        return new ValidatedIdentity(
                claims.subject(),
                claims.tenantId(),
                claims.objectId(),
                claims.name(),
                claims.email(),
                claims.preferredUsername(),
                claims.upn(),
                claims.appId(),
                claims.scopes(),
                claims.roles(),
                claims.groups(),
                claims.issuedAt(),
                claims.expiresAt(),
                claims.otherClaims());
    }

    public boolean hasScope(String scope) {
        return scopes.contains(scope);
    }
}
