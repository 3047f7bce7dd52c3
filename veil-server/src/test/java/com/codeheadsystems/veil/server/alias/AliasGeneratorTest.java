package com.codeheadsystems.veil.server.alias;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class AliasGeneratorTest {

  private final AliasGenerator generator = new AliasGenerator();

  @Test
  void generate_isDeterministicForSameSeed() {
    byte[] seed = "pk|session|1700000000000|salt".getBytes(StandardCharsets.UTF_8);

    assertThat(generator.generate(seed)).isEqualTo(generator.generate(seed.clone()));
  }

  @Test
  void generate_producesValidAliasFromVocabulary() {
    for (int i = 0; i < 500; i++) {
      String alias = generator.generate(("seed-" + i).getBytes(StandardCharsets.UTF_8));

      assertThat(generator.isValid(alias)).as(alias).isTrue();
      assertThat(AliasGenerator.ADJECTIVES).anyMatch(alias::startsWith);
      String withoutDigits = alias.substring(0, alias.length() - 4);
      assertThat(AliasGenerator.ANIMALS).anyMatch(withoutDigits::endsWith);
    }
  }

  @Test
  void generate_differentSeedsUsuallyDiffer() {
    String a = generator.generate("a".getBytes(StandardCharsets.UTF_8));
    String b = generator.generate("b".getBytes(StandardCharsets.UTF_8));

    assertThat(a).isNotEqualTo(b);
  }

  @Test
  void isValid_rejectsMalformedAliases() {
    assertThat(generator.isValid("SilentFox0042")).isTrue();
    assertThat(generator.isValid("ShyOwl0001")).isTrue();
    assertThat(generator.isValid("Owl0001")).isFalse();
    assertThat(generator.isValid("SilentFox042")).isFalse();
    assertThat(generator.isValid("SilentFox00420")).isFalse();
    assertThat(generator.isValid("Silent-Fox0042")).isFalse();
    assertThat(generator.isValid("")).isFalse();
    assertThat(generator.isValid(null)).isFalse();
  }
}
