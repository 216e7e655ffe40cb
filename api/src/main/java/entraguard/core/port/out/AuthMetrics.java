package entraguard.core.port.out;

import entraguard.core.model.auth.AuthError;

/**
 * Port for recording authorization metrics.
 *
 * <p>Implementations handle the actual metric recording (e.g., Micrometer).
 */
public interface AuthMetrics {

    /**
     * Record the outcome of a metadata and key-set fetch.
     *
     * @param trigger why the fetch was started
     * @param outcome how it ended
     */
    void recordMetadataFetch(RefreshTrigger trigger, FetchOutcome outcome);

    /**
     * Record a request that passed authentication and scope checks.
     */
    void recordSuccess();

    /**
     * Record a refused request.
     *
     * @param error the precise reason, never sent to the client
     */
    void recordRejection(AuthError error);

    enum RefreshTrigger {
        INITIAL,
        EXPIRED,
        UNKNOWN_KEY,
        FORCED
    }

    enum FetchOutcome {
        SUCCESS,
        FAILURE,
        STALE
    }
}
