package entraguard.adapter.in.dto;

/**
 * Body returned by endpoints that accept anonymous callers.
 *
 * @param authenticated whether the request carried a valid bearer token
 * @param user          identity of the caller, absent for anonymous requests
 */
public record CallerResponse(boolean authenticated, UserResponse user) {

    public static CallerResponse anonymous() {
        return new CallerResponse(false, null);
    }
}
