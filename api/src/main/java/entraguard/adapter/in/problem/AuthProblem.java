package entraguard.adapter.in.problem;

import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.Response.Status;

import io.quarkiverse.resteasy.problem.HttpProblem;

import entraguard.core.model.auth.AuthError;
import entraguard.core.model.auth.AuthorizationException;

/**
 * RFC 7807 Problem Details factory for authorization refusals.
 *
 * <p>Details are deliberately generic: the precise {@link AuthError} stays in
 * server logs and metrics. The {@code WWW-Authenticate} challenge follows RFC 6750.
 */
public final class AuthProblem {

    public static final String PROBLEM_JSON = "application/problem+json";

    private static final String REALM = "entra-guard";

    private AuthProblem() {
        // Utility class - prevent instantiation
    }

    public static HttpProblem unauthorized() {
        return HttpProblem.builder()
                .withTitle("Unauthorized")
                .withStatus(Status.UNAUTHORIZED)
                .withDetail("A valid bearer token is required")
                .build();
    }

    public static HttpProblem forbidden() {
        return HttpProblem.builder()
                .withTitle("Forbidden")
                .withStatus(Status.FORBIDDEN)
                .withDetail("The bearer token does not grant access to this resource")
                .build();
    }

    /**
     * Build the response for a refused request.
     */
    public static Response toResponse(AuthorizationException error) {
        if (error.rejection() == AuthError.Rejection.FORBIDDEN) {
            return problemResponse(forbidden())
                    .header(HttpHeaders.WWW_AUTHENTICATE, challenge("insufficient_scope"))
                    .build();
        }
        var challenge = error.error() == AuthError.MISSING_CREDENTIALS
                ? "Bearer realm=\"" + REALM + "\""
                : challenge("invalid_token");
        return problemResponse(unauthorized())
                .header(HttpHeaders.WWW_AUTHENTICATE, challenge)
                .build();
    }

    public static Response.ResponseBuilder problemResponse(HttpProblem problem) {
        return Response.status(problem.getStatus()).type(PROBLEM_JSON).entity(problem);
    }

    private static String challenge(String errorCode) {
        return "Bearer realm=\"%s\", error=\"%s\"".formatted(REALM, errorCode);
    }
}
