package com.codeheadsystems.veil.model.session;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Used by: {@code POST /users/lookup} response
 *
 * @param found              whether an active session matched
 * @param externalIdentityId homeserver user id of the match
 * @param alias              alias of the match
 * @param publicKeyBase64    public key of the match
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record UserLookupResponse(
    @JsonProperty("found") boolean found,
    @JsonProperty("external_identity_id") String externalIdentityId,
    @JsonProperty("alias") String alias,
    @JsonProperty("public_key") String publicKeyBase64) {

  /**
   * A response for a query that matched nothing.
   *
   * @return the response
   */
  public static UserLookupResponse notFound() {
    return new UserLookupResponse(false, null, null, null);
  }
}
