package entraguard.adapter.in.dto;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import entraguard.core.model.auth.ValidatedIdentity;

/**
 * Caller identity as exposed by protected endpoints.
 *
 * @param sub                caller subject
 * @param tid                tenant the token was issued by
 * @param oid                directory object id of the caller
 * @param name               display name
 * @param email              email address, if released
 * @param preferredUsername  sign-in name
 * @param upn                user principal name (v1 tokens)
 * @param appId              client application the token was issued to
 * @param scopes             delegated scopes granted to the client
 * @param roles              application roles assigned to the caller
 * @param groups             group object ids
 * @param issuedAt           token issue time
 * @param expiresAt          token expiry
 */
public record UserResponse(
        String sub,
        String tid,
        String oid,
        String name,
        String email,
        String preferredUsername,
        String upn,
        String appId,
        Set<String> scopes,
        List<String> roles,
        List<String> groups,
        Instant issuedAt,
        Instant expiresAt) {

    public static UserResponse from(ValidatedIdentity identity) {
        return new UserResponse(
                identity.subject(),
                identity.tenantId(),
                identity.objectId(),
                identity.name(),
                identity.email(),
                identity.preferredUsername(),
                identity.upn(),
                identity.appId(),
                identity.scopes(),
                identity.roles(),
                identity.groups(),
                identity.issuedAt(),
                identity.expiresAt());
    }
}
