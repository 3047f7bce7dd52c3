package com.codeheadsystems.veil.model.session;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Used by: {@code POST /users/lookup}
 *
 * @param query an alias, a public key or a homeserver user id
 */
public record UserLookupRequest(@JsonProperty("query") String query) {
}
