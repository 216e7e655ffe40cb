package entraguard.adapter.out.auth;

import java.time.Clock;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;
import org.jose4j.jwa.AlgorithmConstraints;
import org.jose4j.jwa.AlgorithmConstraints.ConstraintType;
import org.jose4j.jwk.JsonWebKey;
import org.jose4j.jws.JsonWebSignature;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.consumer.InvalidJwtException;
import org.jose4j.jwx.HeaderParameterNames;
import org.jose4j.lang.JoseException;

import entraguard.core.model.auth.AuthError;
import entraguard.core.model.auth.AuthorizationException;
import entraguard.core.model.auth.TenantSettings;
import entraguard.core.model.auth.TokenClaims;
import entraguard.core.model.auth.ValidatedIdentity;
import entraguard.core.port.out.SigningKeyCache;
import entraguard.core.port.out.TokenVerifier;

/**
 * Verifies Entra ID access tokens (compact JWS) against the tenant's signing keys.
 *
 * <p>Checks run in this order, each failing with its own {@link AuthError}:
 * <ol>
 *   <li>Structure: three segments with a parseable header</li>
 *   <li>Algorithm: header {@code alg} must be on the allow-list ({@code none} never is)</li>
 *   <li>Key: resolved by {@code kid} through the {@link SigningKeyCache}</li>
 *   <li>Signature: verified with the resolved key under the same allow-list</li>
 *   <li>Issuer, audience, expiry and not-before, with symmetric clock skew</li>
 *   <li>Guest accounts, unless allowed</li>
 * </ol>
 *
 * <p>No claim is read before the signature has been verified. Any unexpected failure
 * while reading the token is reported as {@link AuthError#MALFORMED_TOKEN}.
 */
@ApplicationScoped
public class EntraTokenVerifier implements TokenVerifier {

    private static final Logger LOG = Logger.getLogger(EntraTokenVerifier.class);

    private final SigningKeyCache keyCache;
    private final TenantSettings settings;
    private final Clock clock;

    @Inject
    public EntraTokenVerifier(SigningKeyCache keyCache, TenantSettings settings, Clock clock) {
        this.keyCache = keyCache;
        this.settings = settings;
        this.clock = clock;
    }

    @Override
    public Uni<ValidatedIdentity> verify(String rawToken, Set<String> expectedAudiences, String expectedIssuer) {
        return Uni.createFrom()
                .item(() -> parse(rawToken))
                .flatMap(token -> keyCache.getSigningKey(token.keyId())
                        .map(key -> verifyWithKey(token, key, expectedAudiences, expectedIssuer)))
                .onFailure(error -> !(error instanceof AuthorizationException))
                .transform(error -> new AuthorizationException(
                        AuthError.MALFORMED_TOKEN, "Unreadable token: " + error, error));
    }

    private ParsedToken parse(String rawToken) {
        if (rawToken == null || rawToken.isBlank()) {
            throw new AuthorizationException(AuthError.MALFORMED_TOKEN, "Token is empty");
        }
        if (rawToken.split("\\.", -1).length != 3) {
            throw new AuthorizationException(AuthError.MALFORMED_TOKEN, "Token is not a compact JWS");
        }

        var jws = new JsonWebSignature();
        try {
            jws.setCompactSerialization(rawToken);
        } catch (JoseException e) {
            throw new AuthorizationException(AuthError.MALFORMED_TOKEN, "Failed to parse token: " + e.getMessage(), e);
        }

        var algorithm = stringHeader(jws, HeaderParameterNames.ALGORITHM);
        if (algorithm == null || algorithm.isBlank()) {
            throw new AuthorizationException(AuthError.MALFORMED_TOKEN, "Token header has no alg");
        }
        if (!settings.allowedAlgorithms().contains(algorithm)) {
            throw new AuthorizationException(
                    AuthError.DISALLOWED_ALGORITHM, "Token algorithm '%s' is not allowed".formatted(algorithm));
        }

        var keyId = stringHeader(jws, HeaderParameterNames.KEY_ID);
        if (keyId == null || keyId.isBlank()) {
            throw new AuthorizationException(AuthError.UNKNOWN_SIGNING_KEY, "Token header has no kid");
        }
        return new ParsedToken(jws, algorithm, keyId);
    }

    private static String stringHeader(JsonWebSignature jws, String name) {
        var value = jws.getHeaders().getObjectHeaderValue(name);
        if (value == null || value instanceof String) {
            return (String) value;
        }
        throw new AuthorizationException(
                AuthError.MALFORMED_TOKEN, "Token header '%s' is not a string".formatted(name));
    }

    private ValidatedIdentity verifyWithKey(
            ParsedToken token, JsonWebKey key, Set<String> expectedAudiences, String expectedIssuer) {
        verifySignature(token, key);
        var claims = readClaims(token.jws());

        if (!expectedIssuer.equals(claims.issuer())) {
            throw new AuthorizationException(
                    AuthError.INVALID_ISSUER, "Unexpected issuer '%s'".formatted(claims.issuer()));
        }
        if (claims.audiences().stream().noneMatch(expectedAudiences::contains)) {
            throw new AuthorizationException(
                    AuthError.INVALID_AUDIENCE, "Unexpected audience %s".formatted(claims.audiences()));
        }
        checkTimeWindow(claims);

        if (claims.subject() == null || claims.subject().isBlank()) {
            throw new AuthorizationException(AuthError.MALFORMED_TOKEN, "Token has no subject");
        }
        if (!settings.allowGuestUsers() && claims.isGuest()) {
            throw new AuthorizationException(
                    AuthError.GUEST_USER_NOT_ALLOWED, "Guest account %s is not allowed".formatted(claims.objectId()));
        }

        LOG.debugv("Verified token for subject {0} (kid {1})", claims.subject(), token.keyId());
        return ValidatedIdentity.from(claims);
    }

    private void verifySignature(ParsedToken token, JsonWebKey key) {
        var jws = token.jws();
        var algorithm = token.algorithm();
        if (key.getAlgorithm() != null && !key.getAlgorithm().equals(algorithm)) {
            throw new AuthorizationException(
                    AuthError.INVALID_SIGNATURE,
                    "Key %s is bound to %s, token uses %s".formatted(key.getKeyId(), key.getAlgorithm(), algorithm));
        }

        jws.setAlgorithmConstraints(
                new AlgorithmConstraints(ConstraintType.PERMIT, settings.allowedAlgorithms().toArray(new String[0])));
        jws.setKey(key.getKey());

        boolean valid;
        try {
            valid = jws.verifySignature();
        } catch (JoseException e) {
            // Raised for key types that do not match the algorithm
            throw new AuthorizationException(
                    AuthError.INVALID_SIGNATURE, "Signature verification failed: " + e.getMessage(), e);
        }
        if (!valid) {
            throw new AuthorizationException(AuthError.INVALID_SIGNATURE, "Invalid token signature");
        }
    }

    private TokenClaims readClaims(JsonWebSignature jws) {
        try {
            var claims = JwtClaims.parse(jws.getPayload());
            return TokenClaims.fromMap(claims.getClaimsMap());
        } catch (JoseException | InvalidJwtException | IllegalArgumentException e) {
            throw new AuthorizationException(AuthError.MALFORMED_TOKEN, "Malformed claims: " + e.getMessage(), e);
        }
    }

    private void checkTimeWindow(TokenClaims claims) {
        var now = clock.instant();
        var skew = settings.clockSkew();

        if (claims.expiresAt() == null) {
            throw new AuthorizationException(AuthError.MALFORMED_TOKEN, "Token has no exp claim");
        }
        // Skew is applied to the clock so extreme claim values cannot overflow
        if (!now.minus(skew).isBefore(claims.expiresAt())) {
            throw new AuthorizationException(
                    AuthError.TOKEN_EXPIRED, "Token expired at %s".formatted(claims.expiresAt()));
        }
        if (claims.notBefore() != null && now.plus(skew).isBefore(claims.notBefore())) {
            throw new AuthorizationException(
                    AuthError.TOKEN_NOT_YET_VALID, "Token not valid before %s".formatted(claims.notBefore()));
        }
    }

    private record ParsedToken(JsonWebSignature jws, String algorithm, String keyId) {}
}
