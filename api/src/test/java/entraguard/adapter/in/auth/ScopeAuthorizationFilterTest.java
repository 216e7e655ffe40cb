package entraguard.adapter.in.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.lang.reflect.Method;
import java.util.Set;

import jakarta.ws.rs.container.ResourceInfo;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import entraguard.core.model.auth.ScopePolicy;
import entraguard.core.model.auth.TenantSettings;
import entraguard.core.port.in.BearerAuthorization;

@DisplayName("ScopeAuthorizationFilter")
class ScopeAuthorizationFilterTest {

    private ScopeAuthorizationFilter filter;

    @BeforeEach
    void setUp() {
        var settings = TenantSettings.builder("test-tenant", "test-app")
                .scopeName("access_as_user")
                .scopePolicy(ScopePolicy.ALL_OF)
                .build();
        filter = new ScopeAuthorizationFilter(mock(BearerAuthorization.class), settings);
    }

    @RequiresScopes("class.scope")
    static class AnnotatedResource {

        public void inherited() {}

        @RequiresScopes(value = {RequiresScopes.APPLICATION_SCOPE, "files.read"}, policy = RequiresScopes.Policy.ANY_OF)
        public void overridden() {}
    }

    static class PlainResource {

        public void open() {}

        @RequiresScopes
        public void authenticatedOnly() {}
    }

    private static ResourceInfo resourceInfo(Class<?> type, String methodName) throws NoSuchMethodException {
        Method method = type.getMethod(methodName);
        var info = mock(ResourceInfo.class);
        when(info.getResourceMethod()).thenReturn(method);
        when(info.getResourceClass()).thenAnswer(invocation -> type);
        return info;
    }

    @Nested
    @DisplayName("findAnnotation()")
    class FindAnnotation {

        @Test
        @DisplayName("should prefer the method annotation")
        void shouldPreferMethod() throws Exception {
            var annotation = ScopeAuthorizationFilter.findAnnotation(
                    resourceInfo(AnnotatedResource.class, "overridden"));

            assertEquals(RequiresScopes.Policy.ANY_OF, annotation.orElseThrow().policy());
        }

        @Test
        @DisplayName("should fall back to the class annotation")
        void shouldFallBackToClass() throws Exception {
            var annotation = ScopeAuthorizationFilter.findAnnotation(
                    resourceInfo(AnnotatedResource.class, "inherited"));

            assertEquals("class.scope", annotation.orElseThrow().value()[0]);
        }

        @Test
        @DisplayName("should find nothing on unannotated routes")
        void shouldIgnoreUnannotated() throws Exception {
            assertTrue(ScopeAuthorizationFilter.findAnnotation(resourceInfo(PlainResource.class, "open"))
                    .isEmpty());
        }
    }

    @Nested
    @DisplayName("requiredScopes()")
    class RequiredScopesResolution {

        @Test
        @DisplayName("should resolve the application scope placeholder and explicit policy")
        void shouldResolvePlaceholder() throws Exception {
            var annotation = AnnotatedResource.class.getMethod("overridden").getAnnotation(RequiresScopes.class);

            var required = filter.requiredScopes(annotation);

            assertEquals(Set.of("access_as_user", "files.read"), required.scopes());
            assertEquals(ScopePolicy.ANY_OF, required.policy());
        }

        @Test
        @DisplayName("should apply the configured policy by default")
        void shouldApplyConfiguredPolicy() {
            var required = filter.requiredScopes(AnnotatedResource.class.getAnnotation(RequiresScopes.class));

            assertEquals(Set.of("class.scope"), required.scopes());
            assertEquals(ScopePolicy.ALL_OF, required.policy());
        }

        @Test
        @DisplayName("should require authentication only for an empty annotation")
        void shouldRequireAuthenticationOnly() throws Exception {
            var annotation = PlainResource.class.getMethod("authenticatedOnly").getAnnotation(RequiresScopes.class);

            assertTrue(filter.requiredScopes(annotation).isEmpty());
        }
    }
}
