package com.codeheadsystems.veil.model;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.veil.model.auth.ChallengeRequest;
import com.codeheadsystems.veil.model.auth.VerifyRequest;
import com.codeheadsystems.veil.model.key.GeneratedKey;
import com.codeheadsystems.veil.model.key.KeyGenerateResponse;
import com.codeheadsystems.veil.model.session.SessionStartResponse;
import com.codeheadsystems.veil.model.session.UserLookupResponse;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import org.junit.jupiter.api.Test;

class WireFormatTest {

  private final ObjectMapper mapper = new ObjectMapper();

  @Test
  void verifyRequest_readsSnakeCaseFields() throws Exception {
    VerifyRequest request = mapper.readValue(
        "{\"public_key\":\"pk\",\"signature\":\"sig\"}", VerifyRequest.class);

    assertThat(request.publicKeyBase64()).isEqualTo("pk");
    assertThat(request.signatureBase64()).isEqualTo("sig");
  }

  @Test
  void challengeRequest_writesPublicKeyField() throws Exception {
    JsonNode node = mapper.readTree(mapper.writeValueAsString(new ChallengeRequest("pk")));

    assertThat(node.get("public_key").asText()).isEqualTo("pk");
  }

  @Test
  void sessionStartResponse_reusedOmitsSecretAndNullCredential() throws Exception {
    SessionStartResponse response = new SessionStartResponse(
        "sid", "@temp_0011223344556677:veil.local", "SilentFox0042", "veil.local",
        null, null, true, true);

    JsonNode node = mapper.readTree(mapper.writeValueAsString(response));

    assertThat(node.has("identity_secret")).isFalse();
    assertThat(node.has("credential")).isFalse();
    assertThat(node.get("degraded").asBoolean()).isTrue();
    assertThat(node.get("reused").asBoolean()).isTrue();
    assertThat(node.get("external_identity_id").asText()).isEqualTo("@temp_0011223344556677:veil.local");
  }

  @Test
  void userLookupResponse_notFoundCarriesOnlyFlag() throws Exception {
    JsonNode node = mapper.readTree(mapper.writeValueAsString(UserLookupResponse.notFound()));

    assertThat(node.size()).isEqualTo(1);
    assertThat(node.get("found").asBoolean()).isFalse();
  }

  @Test
  void generatedKey_toStringHidesPrivateKey() throws Exception {
    GeneratedKey key = new GeneratedKey("public", "very-private", "2026-01-01T00:00:00Z");
    KeyGenerateResponse response = new KeyGenerateResponse(1, List.of(key));

    assertThat(key.toString()).doesNotContain("very-private");
    assertThat(mapper.readTree(mapper.writeValueAsString(response)).get("keys").get(0)
        .get("private_key").asText()).isEqualTo("very-private");
  }
}
