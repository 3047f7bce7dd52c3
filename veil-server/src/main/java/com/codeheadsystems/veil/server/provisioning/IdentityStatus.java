package com.codeheadsystems.veil.server.provisioning;

/**
 * Remote state of an identity that exists on the homeserver.
 *
 * @param identityId  the identity id
 * @param deactivated true once the identity was deactivated
 */
public record IdentityStatus(String identityId, boolean deactivated) {
}
