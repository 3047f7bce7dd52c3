package com.codeheadsystems.veil.model.session;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Describes the chat session bound to the caller's key.
 * <p>
 * When {@code reused} is true the session already existed and {@code identitySecret} is absent.
 * On the creating call the secret is returned once so that a {@code degraded} client (no
 * credential) can still log in to the homeserver itself.
 * <p>
 * Used by: {@code POST /session/start} response
 *
 * @param sessionId          unique session id
 * @param externalIdentityId homeserver user id, e.g. {@code @temp_0a1b2c3d4e5f6a7b:veil.local}
 * @param alias              display alias such as {@code SilentFox0042}
 * @param serverName         homeserver name the identity lives on
 * @param credential         homeserver access token, null when degraded
 * @param identitySecret     homeserver password, only on the creating call
 * @param degraded           true when the identity exists but no credential could be obtained
 * @param reused             true when an existing session was returned unchanged
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SessionStartResponse(
    @JsonProperty("session_id") String sessionId,
    @JsonProperty("external_identity_id") String externalIdentityId,
    @JsonProperty("alias") String alias,
    @JsonProperty("server_name") String serverName,
    @JsonProperty("credential") String credential,
    @JsonProperty("identity_secret") String identitySecret,
    @JsonProperty("degraded") boolean degraded,
    @JsonProperty("reused") boolean reused) {
}
