package entraguard.adapter.in.problem;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import java.util.Arrays;
import java.util.List;

import io.quarkiverse.resteasy.problem.HttpProblem;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import entraguard.core.model.auth.AuthError;
import entraguard.core.model.auth.AuthorizationException;

@DisplayName("GlobalExceptionMappers")
class GlobalExceptionMappersTest {

    private final GlobalExceptionMappers mappers = new GlobalExceptionMappers();

    @Test
    @DisplayName("should keep the failure reason out of the response body")
    void shouldNotEchoExceptionMessage() {
        var response = mappers.mapAuthorizationException(
                new AuthorizationException(AuthError.INVALID_ISSUER, "Unexpected issuer '<script>'"));

        assertEquals(401, response.getStatus());
        var problem = (HttpProblem) response.getEntity();
        assertFalse(problem.getDetail().contains("<script>"));
    }

    @Test
    @DisplayName("should map only authorization failures")
    void shouldMapOnlyAuthorizationFailures() {
        var mapped = Arrays.stream(GlobalExceptionMappers.class.getDeclaredMethods())
                .filter(method -> method.isAnnotationPresent(ServerExceptionMapper.class))
                .map(method -> method.getParameterTypes()[0])
                .toList();

        assertEquals(List.of(AuthorizationException.class), mapped);
    }
}
