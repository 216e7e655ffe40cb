package entraguard.adapter.out.http;

import java.net.URI;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.ext.web.client.HttpResponse;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;
import org.jose4j.jwk.JsonWebKey;
import org.jose4j.jwk.JsonWebKeySet;
import org.jose4j.jwk.Use;
import org.jose4j.lang.JoseException;

import entraguard.core.model.auth.OpenIdMetadata;
import entraguard.core.model.auth.SigningKeySet;
import entraguard.core.model.auth.TenantSettings;
import entraguard.core.port.out.IdentityProviderClient;

/**
 * Vert.x Web Client implementation of {@link IdentityProviderClient}.
 *
 * <p>The discovery document is a third-party contract, so only the fields needed
 * for verification are read and each is type-checked:
 * <pre>{@code
 * {
 *   "issuer": "https://login.microsoftonline.com/<tenant>/v2.0",
 *   "jwks_uri": "https://login.microsoftonline.com/<tenant>/discovery/v2.0/keys",
 *   "id_token_signing_alg_values_supported": ["RS256"],
 *   ...
 * }
 * }</pre>
 *
 * <p>Keys without a {@code kid}, or whose {@code use} is not {@code sig}, are dropped.
 */
@ApplicationScoped
public class VertxIdentityProviderClient implements IdentityProviderClient {

    private static final Logger LOG = Logger.getLogger(VertxIdentityProviderClient.class);

    private final WebClient webClient;
    private final TenantSettings settings;

    @Inject
    public VertxIdentityProviderClient(Vertx vertx, TenantSettings settings) {
        this.webClient = WebClient.create(vertx);
        this.settings = settings;
    }

    @Override
    public Uni<OpenIdMetadata> fetchMetadata(URI discoveryUri) {
        return get(discoveryUri).map(response -> parseMetadata(discoveryUri, response));
    }

    @Override
    public Uni<SigningKeySet> fetchKeySet(URI jwksUri) {
        return get(jwksUri).map(response -> parseKeySet(jwksUri, response));
    }

    private Uni<HttpResponse<Buffer>> get(URI uri) {
        return webClient
                .getAbs(uri.toString())
                .ssl("https".equalsIgnoreCase(uri.getScheme()))
                .timeout(settings.fetchTimeout().toMillis())
                .putHeader("Accept", "application/json")
                .send()
                .onFailure(error -> !(error instanceof FetchException))
                .transform(error -> new FetchException("Request to " + uri + " failed: " + error.getMessage(), error));
    }

    private OpenIdMetadata parseMetadata(URI discoveryUri, HttpResponse<Buffer> response) {
        var json = parseJsonObject(discoveryUri, response);

        var issuer = requireString(json, "issuer", discoveryUri);
        var jwksUri = requireString(json, "jwks_uri", discoveryUri);
        var algorithms = optionalStringSet(json, "id_token_signing_alg_values_supported");

        try {
            return new OpenIdMetadata(issuer, URI.create(jwksUri), algorithms);
        } catch (IllegalArgumentException e) {
            throw new FetchException("Invalid jwks_uri in discovery document from " + discoveryUri, e);
        }
    }

    private SigningKeySet parseKeySet(URI jwksUri, HttpResponse<Buffer> response) {
        checkStatus(jwksUri, response);

        JsonWebKeySet keySet;
        try {
            keySet = new JsonWebKeySet(response.bodyAsString());
        } catch (JoseException e) {
            throw new FetchException("Failed to parse JWKS response from " + jwksUri + ": " + e.getMessage(), e);
        }

        var keys = new LinkedHashMap<String, JsonWebKey>();
        for (var key : keySet.getJsonWebKeys()) {
            if (key.getKeyId() == null || key.getKeyId().isBlank()) {
                LOG.debugv("Skipping JWKS entry without kid from {0}", jwksUri);
                continue;
            }
            if (key.getUse() != null && !Use.SIGNATURE.equals(key.getUse())) {
                LOG.debugv("Skipping non-signing key {0} from {1}", key.getKeyId(), jwksUri);
                continue;
            }
            keys.putIfAbsent(key.getKeyId(), key);
        }
        return new SigningKeySet(keys);
    }

    private JsonObject parseJsonObject(URI uri, HttpResponse<Buffer> response) {
        checkStatus(uri, response);
        try {
            var json = response.bodyAsJsonObject();
            if (json == null) {
                throw new FetchException("Empty response body from " + uri);
            }
            return json;
        } catch (DecodeException | ClassCastException e) {
            throw new FetchException("Malformed JSON from " + uri, e);
        }
    }

    private static void checkStatus(URI uri, HttpResponse<Buffer> response) {
        if (response.statusCode() != 200) {
            throw new FetchException("%s returned status %d".formatted(uri, response.statusCode()));
        }
    }

    private static String requireString(JsonObject json, String field, URI source) {
        var value = json.getValue(field);
        if (value instanceof String text && !text.isBlank()) {
            return text;
        }
        throw new FetchException("Discovery document from %s has no valid '%s'".formatted(source, field));
    }

    private static Set<String> optionalStringSet(JsonObject json, String field) {
        var result = new HashSet<String>();
        if (json.getValue(field) instanceof JsonArray array) {
            for (var value : array) {
                if (value instanceof String text) {
                    result.add(text);
                }
            }
        }
        return result;
    }
}
