package entraguard.core.service.auth;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Instant;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import entraguard.core.model.auth.AuthError;
import entraguard.core.model.auth.InsufficientScopeException;
import entraguard.core.model.auth.RequiredScopes;
import entraguard.core.model.auth.TenantSettings;
import entraguard.core.model.auth.ValidatedIdentity;

@DisplayName("ScopeEnforcer")
class ScopeEnforcerTest {

    private static final String APP = "test-app";

    private ScopeEnforcer enforcer;

    @BeforeEach
    void setUp() {
        enforcer = new ScopeEnforcer(TenantSettings.builder("test-tenant", APP).build());
    }

    private static ValidatedIdentity identityWithScopes(String... scopes) {
        return new ValidatedIdentity(
                "user-123",
                "test-tenant",
                null,
                null,
                null,
                null,
                null,
                null,
                Set.of(scopes),
                null,
                null,
                null,
                Instant.now().plusSeconds(3600),
                null);
    }

    @Test
    @DisplayName("should pass when no scopes are required")
    void shouldPassWithoutRequirement() {
        assertDoesNotThrow(() -> enforcer.authorize(identityWithScopes(), RequiredScopes.none()));
    }

    @Nested
    @DisplayName("any-of policy")
    class AnyOf {

        @Test
        @DisplayName("should pass when the short scope is granted")
        void shouldPassForShortScope() {
            assertDoesNotThrow(() -> enforcer.authorize(
                    identityWithScopes("user_impersonation"), RequiredScopes.anyOf("user_impersonation")));
        }

        @Test
        @DisplayName("should match a qualified requirement against the short scp value")
        void shouldNormaliseQualifiedScope() {
            assertDoesNotThrow(() -> enforcer.authorize(
                    identityWithScopes("user_impersonation"),
                    RequiredScopes.anyOf("api://" + APP + "/user_impersonation")));
        }

        @Test
        @DisplayName("should pass when one of several scopes is granted")
        void shouldPassForOneOfSeveral() {
            assertDoesNotThrow(() -> enforcer.authorize(
                    identityWithScopes("files.read"), RequiredScopes.anyOf("files.write", "files.read")));
        }

        @Test
        @DisplayName("should fail with INSUFFICIENT_SCOPE when none is granted")
        void shouldFailWhenNoneGranted() {
            var error = assertThrows(
                    InsufficientScopeException.class,
                    () -> enforcer.authorize(identityWithScopes("files.read"), RequiredScopes.anyOf("user_impersonation")));

            assertEquals(AuthError.INSUFFICIENT_SCOPE, error.error());
            assertEquals(AuthError.Rejection.FORBIDDEN, error.rejection());
            assertEquals(Set.of("user_impersonation"), error.missingScopes());
        }

        @Test
        @DisplayName("should fail for a token without scp")
        void shouldFailWithoutScp() {
            assertThrows(
                    InsufficientScopeException.class,
                    () -> enforcer.authorize(identityWithScopes(), RequiredScopes.anyOf("user_impersonation")));
        }

        @Test
        @DisplayName("should not shorten scopes of another application")
        void shouldNotNormaliseForeignScope() {
            assertThrows(
                    InsufficientScopeException.class,
                    () -> enforcer.authorize(
                            identityWithScopes("user_impersonation"),
                            RequiredScopes.anyOf("api://other-app/user_impersonation")));
        }
    }

    @Nested
    @DisplayName("all-of policy")
    class AllOf {

        @Test
        @DisplayName("should pass when every scope is granted")
        void shouldPassWhenAllGranted() {
            assertDoesNotThrow(() -> enforcer.authorize(
                    identityWithScopes("files.read", "files.write", "user_impersonation"),
                    RequiredScopes.allOf("files.read", "files.write")));
        }

        @Test
        @DisplayName("should fail naming the missing scope")
        void shouldFailWhenOneMissing() {
            var error = assertThrows(
                    InsufficientScopeException.class,
                    () -> enforcer.authorize(
                            identityWithScopes("files.read"), RequiredScopes.allOf("files.read", "files.write")));

            assertEquals(Set.of("files.write"), error.missingScopes());
        }
    }
}
