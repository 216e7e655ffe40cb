package entraguard.core.model.auth;

import java.util.Map;
import java.util.Optional;

import org.jose4j.jwk.JsonWebKey;

/**
 * Immutable snapshot of a provider's signing keys, indexed by key identifier.
 *
 * <p>A refresh produces a new instance; existing instances are never modified.
 */
public record SigningKeySet(Map<String, JsonWebKey> keys) {

    public SigningKeySet {
        keys = keys == null ? Map.of() : Map.copyOf(keys);
    }

    public static SigningKeySet empty() {
        return new SigningKeySet(Map.of());
    }

    public Optional<JsonWebKey> find(String keyId) {
        if (keyId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(keys.get(keyId));
    }

    public int size() {
        return keys.size();
    }
}
