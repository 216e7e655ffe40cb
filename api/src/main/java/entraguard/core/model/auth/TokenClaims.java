package entraguard.core.model.auth;

import java.time.DateTimeException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Typed view of an access token's claim set.
 *
 * <p>Built by {@link #fromMap(Map)}, which rejects well-known claims of the wrong
 * type. Claims without a dedicated field are kept in {@code otherClaims}.
 */
public record TokenClaims(
        String issuer,
        List<String> audiences,
        String subject,
        Instant expiresAt,
        Instant notBefore,
        Instant issuedAt,
        Set<String> scopes,
        String tenantId,
        String objectId,
        String name,
        String email,
        String preferredUsername,
        String upn,
        String appId,
        List<String> roles,
        List<String> groups,
        Integer accountType,
        Map<String, Object> otherClaims) {

    public static final String ISSUER = "iss";
    public static final String AUDIENCE = "aud";
    public static final String SUBJECT = "sub";
    public static final String EXPIRATION = "exp";
    public static final String NOT_BEFORE = "nbf";
    public static final String ISSUED_AT = "iat";
    public static final String SCOPE = "scp";
    public static final String TENANT_ID = "tid";
    public static final String OBJECT_ID = "oid";
    public static final String NAME = "name";
    public static final String EMAIL = "email";
    public static final String PREFERRED_USERNAME = "preferred_username";
    public static final String UPN = "upn";
    public static final String AUTHORIZED_PARTY = "azp";
    public static final String APP_ID = "appid";
    public static final String ROLES = "roles";
    public static final String GROUPS = "groups";
    public static final String ACCOUNT_TYPE = "acct";

    /** Value of the {@code acct} claim for guest accounts. */
    public static final int GUEST_ACCOUNT = 1;

    private static final Set<String> KNOWN_CLAIMS = Set.of(
            ISSUER,
            AUDIENCE,
            SUBJECT,
            EXPIRATION,
            NOT_BEFORE,
            ISSUED_AT,
            SCOPE,
            TENANT_ID,
            OBJECT_ID,
            NAME,
            EMAIL,
            PREFERRED_USERNAME,
            UPN,
            AUTHORIZED_PARTY,
            APP_ID,
            ROLES,
            GROUPS,
            ACCOUNT_TYPE);

    public TokenClaims {
        audiences = audiences == null ? List.of() : List.copyOf(audiences);
        scopes = scopes == null ? Set.of() : Set.copyOf(scopes);
        roles = roles == null ? List.of() : List.copyOf(roles);
        groups = groups == null ? List.of() : List.copyOf(groups);
        otherClaims = otherClaims == null ? Map.of() : Map.copyOf(otherClaims);
    }

    /**
     * Parse a raw claim map.
     *
     * @throws IllegalArgumentException if a well-known claim has an unexpected type
     */
    public static TokenClaims fromMap(Map<String, Object> claims) {
        var others = new HashMap<String, Object>();
        for (var entry : claims.entrySet()) {
            if (!KNOWN_CLAIMS.contains(entry.getKey()) && entry.getValue() != null) {
                others.put(entry.getKey(), entry.getValue());
            }
        }

        var appId = string(claims, AUTHORIZED_PARTY);
        if (appId == null) {
            appId = string(claims, APP_ID);
        }

        var accountType = numeric(claims, ACCOUNT_TYPE);

        return new TokenClaims(
                string(claims, ISSUER),
                stringList(claims, AUDIENCE),
                string(claims, SUBJECT),
                instant(claims, EXPIRATION),
                instant(claims, NOT_BEFORE),
                instant(claims, ISSUED_AT),
                scopeSet(claims),
                string(claims, TENANT_ID),
                string(claims, OBJECT_ID),
                string(claims, NAME),
                string(claims, EMAIL),
                string(claims, PREFERRED_USERNAME),
                string(claims, UPN),
                appId,
                stringList(claims, ROLES),
                stringList(claims, GROUPS),
                accountType == null ? null : accountType.intValue(),
                others);
    }

    public boolean isGuest() {
        return accountType != null && accountType == GUEST_ACCOUNT;
    }

    private static String string(Map<String, Object> claims, String name) {
        var value = claims.get(name);
        if (value == null) {
            return null;
        }
        if (value instanceof String text) {
            return text;
        }
        throw new IllegalArgumentException("Claim '%s' must be a string".formatted(name));
    }

    private static List<String> stringList(Map<String, Object> claims, String name) {
        var value = claims.get(name);
        if (value == null) {
            return List.of();
        }
        if (value instanceof String text) {
            return List.of(text);
        }
        if (value instanceof Collection<?> values) {
            var result = new ArrayList<String>(values.size());
            for (var item : values) {
                if (!(item instanceof String text)) {
                    throw new IllegalArgumentException("Claim '%s' must contain only strings".formatted(name));
                }
                result.add(text);
            }
            return result;
        }
        throw new IllegalArgumentException("Claim '%s' must be a string or an array of strings".formatted(name));
    }

    private static Set<String> scopeSet(Map<String, Object> claims) {
        var scope = string(claims, SCOPE);
        if (scope == null || scope.isBlank()) {
            return Set.of();
        }
        var scopes = new LinkedHashSet<String>();
        Arrays.stream(scope.trim().split("\\s+")).forEach(scopes::add);
        return scopes;
    }

    private static Instant instant(Map<String, Object> claims, String name) {
        var seconds = numeric(claims, name);
        if (seconds == null) {
            return null;
        }
        try {
            return Instant.ofEpochSecond(seconds);
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Claim '%s' is out of range".formatted(name), e);
        }
    }

    private static Long numeric(Map<String, Object> claims, String name) {
        var value = claims.get(name);
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.longValue();
        }
        throw new IllegalArgumentException("Claim '%s' must be numeric".formatted(name));
    }
}
