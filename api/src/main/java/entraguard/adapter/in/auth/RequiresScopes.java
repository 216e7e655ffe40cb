package entraguard.adapter.in.auth;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

import entraguard.core.model.auth.ScopePolicy;

/**
 * Protects a resource class or method with an Entra ID bearer token.
 *
 * <p>Example:
 * <pre>{@code
 * @GET
 * @RequiresScopes(RequiresScopes.APPLICATION_SCOPE)
 * public UserResponse me() { ... }
 * }</pre>
 *
 * <p>Scopes may be short names ({@code user_impersonation}) or qualified with the
 * application ID URI ({@code api://<app-client-id>/user_impersonation}). With no
 * scopes, the route only requires a valid token. A method annotation overrides
 * the class annotation.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.TYPE, ElementType.METHOD})
public @interface RequiresScopes {

    /**
     * Placeholder for the application's configured delegated permission.
     */
    String APPLICATION_SCOPE = "${entra.scope-name}";

    /**
     * Required scopes.
     */
    String[] value() default {};

    /**
     * Comparison policy. The configured {@code entra.scope-policy} applies when unset.
     */
    Policy policy() default Policy.DEFAULT;

    /**
     * Let requests without an Authorization header through unauthenticated.
     *
     * <p>A token that is present must still be valid and sufficiently scoped.
     */
    boolean credentialsOptional() default false;

    enum Policy {
        DEFAULT(null),
        ANY_OF(ScopePolicy.ANY_OF),
        ALL_OF(ScopePolicy.ALL_OF);

        private final ScopePolicy scopePolicy;

        Policy(ScopePolicy scopePolicy) {
            this.scopePolicy = scopePolicy;
        }

        public ScopePolicy resolve(ScopePolicy configuredDefault) {
            return scopePolicy != null ? scopePolicy : configuredDefault;
        }
    }
}
