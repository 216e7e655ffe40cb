package entraguard.adapter.in.rest;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.nullValue;

import java.time.Instant;

import io.quarkus.test.common.QuarkusTestResource;
import io.quarkus.test.junit.QuarkusTest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import entraguard.support.EntraWireMockResource;
import entraguard.support.TestTokens;

@QuarkusTest
@QuarkusTestResource(EntraWireMockResource.class)
@DisplayName("Protected endpoints")
class ProtectedResourceTest {

    private static TestTokens.Builder token() {
        return TestTokens.token(EntraWireMockResource.issuer());
    }

    @Nested
    @DisplayName("GET /protected")
    class ProtectedEndpoint {

        @Test
        @DisplayName("should return the caller identity for a scoped token")
        void shouldAuthorizeScopedToken() {
            given().header("Authorization", "Bearer " + token().sign())
                    .when()
                    .get("/protected")
                    .then()
                    .statusCode(200)
                    .body("message", equalTo("You are authenticated!"))
                    .body("user.sub", equalTo(TestTokens.SUBJECT))
                    .body("user.oid", equalTo(TestTokens.OBJECT_ID))
                    .body("user.preferred_username", equalTo("test.user@example.com"))
                    .body("user.email", equalTo(TestTokens.EMAIL))
                    .body("user.scopes", hasItem(TestTokens.SCOPE));
        }

        @Test
        @DisplayName("should accept the application ID URI audience and a lowercase scheme")
        void shouldAcceptApplicationIdUri() {
            var token = token().audience("api://" + TestTokens.APP_CLIENT_ID).sign();

            given().header("Authorization", "bearer " + token)
                    .when()
                    .get("/protected")
                    .then()
                    .statusCode(200);
        }

        @Test
        @DisplayName("should challenge a request without credentials")
        void shouldChallengeMissingCredentials() {
            given().when()
                    .get("/protected")
                    .then()
                    .statusCode(401)
                    .header("WWW-Authenticate", containsString("Bearer"))
                    .header("Content-Type", containsString("application/problem+json"))
                    .body("title", equalTo("Unauthorized"));
        }

        @Test
        @DisplayName("should reject an expired token with 401")
        void shouldRejectExpiredToken() {
            var expired = token().issuedAt(Instant.now().minusSeconds(7200))
                    .expiresAt(Instant.now().minusSeconds(3600))
                    .sign();

            given().header("Authorization", "Bearer " + expired)
                    .when()
                    .get("/protected")
                    .then()
                    .statusCode(401)
                    .header("WWW-Authenticate", containsString("invalid_token"));
        }

        @Test
        @DisplayName("should reject a token for another audience with 401")
        void shouldRejectWrongAudience() {
            given().header("Authorization", "Bearer " + token().audience("other-app").sign())
                    .when()
                    .get("/protected")
                    .then()
                    .statusCode(401);
        }

        @Test
        @DisplayName("should reject a forged signature with 401")
        void shouldRejectForgedToken() {
            var forged = token().signedWith(TestTokens.ATTACKER_KEY).sign();

            given().header("Authorization", "Bearer " + forged)
                    .when()
                    .get("/protected")
                    .then()
                    .statusCode(401);
        }

        @Test
        @DisplayName("should reject a malformed token with 401")
        void shouldRejectMalformedToken() {
            given().header("Authorization", "Bearer not-a-token")
                    .when()
                    .get("/protected")
                    .then()
                    .statusCode(401);
        }

        @Test
        @DisplayName("should reject non-string alg and kid headers with 401")
        void shouldRejectNonStringHeaders() {
            var payload = token().claims().toJson();

            for (var header : new String[] {
                "{\"alg\":\"RS256\",\"kid\":123}",
                "{\"alg\":256,\"kid\":\"" + TestTokens.PRIMARY_KEY_ID + "\"}"
            }) {
                given().header("Authorization", "Bearer " + TestTokens.rawToken(header, payload))
                        .when()
                        .get("/protected")
                        .then()
                        .statusCode(401)
                        .header("WWW-Authenticate", containsString("invalid_token"));
            }
        }

        @Test
        @DisplayName("should reject a signed token with an out-of-range exp with 401")
        void shouldRejectOutOfRangeExpiry() {
            var token = token().withoutExpiry().claim("exp", 1e19).sign();

            given().header("Authorization", "Bearer " + token)
                    .when()
                    .get("/protected")
                    .then()
                    .statusCode(401);
        }

        @Test
        @DisplayName("should refuse a valid token without the scope with 403")
        void shouldForbidInsufficientScope() {
            given().header("Authorization", "Bearer " + token().scopes("files.read").sign())
                    .when()
                    .get("/protected")
                    .then()
                    .statusCode(403)
                    .header("WWW-Authenticate", containsString("insufficient_scope"))
                    .body("title", equalTo("Forbidden"));
        }

        @Test
        @DisplayName("should pick up a rotated signing key")
        void shouldFollowKeyRotation() {
            EntraWireMockResource.publishKeys(TestTokens.PRIMARY_KEY, TestTokens.ROTATED_KEY);

            given().header("Authorization", "Bearer " + token().signedWith(TestTokens.ROTATED_KEY).sign())
                    .when()
                    .get("/protected")
                    .then()
                    .statusCode(200)
                    .body("user.sub", equalTo(TestTokens.SUBJECT));
        }
    }

    @Nested
    @DisplayName("GET /me")
    class CallerEndpoint {

        @Test
        @DisplayName("should report an anonymous caller")
        void shouldAllowAnonymous() {
            given().when()
                    .get("/me")
                    .then()
                    .statusCode(200)
                    .body("authenticated", equalTo(false))
                    .body("user", nullValue());
        }

        @Test
        @DisplayName("should report an authenticated caller")
        void shouldReportAuthenticatedCaller() {
            given().header("Authorization", "Bearer " + token().scopes("files.read").sign())
                    .when()
                    .get("/me")
                    .then()
                    .statusCode(200)
                    .body("authenticated", equalTo(true))
                    .body("user.sub", equalTo(TestTokens.SUBJECT));
        }

        @Test
        @DisplayName("should still reject an invalid token")
        void shouldRejectInvalidToken() {
            given().header("Authorization", "Bearer not-a-token")
                    .when()
                    .get("/me")
                    .then()
                    .statusCode(401);
        }

        @Test
        @DisplayName("should reject a numeric kid with 401")
        void shouldRejectNumericKeyId() {
            var token = TestTokens.rawToken("{\"alg\":\"RS256\",\"kid\":123}", token().claims().toJson());

            given().header("Authorization", "Bearer " + token)
                    .when()
                    .get("/me")
                    .then()
                    .statusCode(401);
        }
    }
}
