package com.codeheadsystems.veil.model;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import org.junit.jupiter.api.Test;

class VeilConfigurationTest {

  private final ObjectMapper objectMapper = new ObjectMapper();

  @Test
  void defaults() {
    final VeilConfiguration configuration = VeilConfiguration.defaults();

    assertThat(configuration.prefix()).isEqualTo("encrypted_");
    assertThat(configuration.suffix()).isEmpty();
    assertThat(configuration.secretKeyParamName()).isEqualTo("key");
    assertThat(configuration.algorithm()).isEqualTo("aes-256-cbc");
    assertThat(configuration.encode()).isFalse();
    assertThat(configuration.encodeFormat()).isEqualTo("base64");
    assertThat(configuration.marshal()).isFalse();
    assertThat(configuration.allowEmptyValue()).isFalse();
  }

  @Test
  void readValue_fromJson() throws IOException {
    try (InputStream in = getClass().getResourceAsStream("/veil-test.json")) {
      final VeilConfiguration configuration = objectMapper.readValue(in, VeilConfiguration.class);

      assertThat(configuration.prefix()).isEqualTo("secret_");
      assertThat(configuration.suffix()).isEqualTo("_crypted");
      assertThat(configuration.algorithm()).isEqualTo("aes-128-gcm");
      assertThat(configuration.encode()).isTrue();
      assertThat(configuration.encodeFormat()).isEqualTo("hex");
      assertThat(configuration.secretKeyParamName()).isEqualTo("key");
    }
  }
}
