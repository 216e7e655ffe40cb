package entraguard.adapter.in.dto;

/**
 * Plain message body.
 *
 * @param message human readable message
 */
public record MessageResponse(String message) {}
