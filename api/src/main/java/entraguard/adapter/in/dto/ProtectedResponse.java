package entraguard.adapter.in.dto;

/**
 * Body returned by protected endpoints.
 *
 * @param message human readable message
 * @param user    identity of the authenticated caller
 */
public record ProtectedResponse(String message, UserResponse user) {}
