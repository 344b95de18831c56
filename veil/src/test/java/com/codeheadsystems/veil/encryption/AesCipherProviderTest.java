package com.codeheadsystems.veil.encryption;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.veil.ResolvedOptionsFixture;
import com.codeheadsystems.veil.model.ResolvedOptions;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AesCipherProviderTest {

  private AesCipherProvider provider;
  private ResolvedOptions options;

  @BeforeEach
  void setup() {
    provider = new AesCipherProvider();
    options = ResolvedOptionsFixture.builder().build();
  }

  @Test
  void requiresKey_returnsTrue() {
    assertThat(provider.requiresKey()).isTrue();
  }

  @Test
  void encrypt_decrypt_string_roundTrip() {
    final Object encrypted = provider.encrypt("sensitive data", options);
    assertThat(encrypted).isInstanceOf(byte[].class);
    assertThat((byte[]) encrypted).isNotEqualTo("sensitive data".getBytes(StandardCharsets.UTF_8));

    assertThat(provider.decrypt(encrypted, options)).isEqualTo("sensitive data");
  }

  @Test
  void encrypt_decrypt_bytes_roundTrip() {
    final byte[] data = "bytes in".getBytes(StandardCharsets.UTF_8);
    final Object encrypted = provider.encrypt(data, options);
    assertThat(provider.decrypt(encrypted, options)).isEqualTo("bytes in");
  }

  @Test
  void encrypt_isDeterministicForSameKey() {
    assertThat((byte[]) provider.encrypt("same data", options))
        .isEqualTo((byte[]) provider.encrypt("same data", options));
  }

  @Test
  void encrypt_differentKeys_producesDifferentCiphertext() {
    final ResolvedOptions other = ResolvedOptionsFixture.builder().key("another key").build();
    assertThat((byte[]) provider.encrypt("same data", options))
        .isNotEqualTo((byte[]) provider.encrypt("same data", other));
  }

  @Test
  void encrypt_withExactLengthByteKey_roundTrip() {
    final byte[] key = new byte[32];
    Arrays.fill(key, (byte) 42);
    final ResolvedOptions withKey = ResolvedOptionsFixture.builder().key(key).build();

    final Object encrypted = provider.encrypt("test data", withKey);
    assertThat(provider.decrypt(encrypted, withKey)).isEqualTo("test data");
  }

  @Test
  void encrypt_decrypt_gcm_roundTrip() {
    final ResolvedOptions gcm = ResolvedOptionsFixture.builder().algorithm("aes-256-gcm").build();
    final Object encrypted = provider.encrypt("sensitive", gcm);
    assertThat(provider.decrypt(encrypted, gcm)).isEqualTo("sensitive");
  }

  @Test
  void decrypt_gcm_withWrongAttributeName_fails() {
    final ResolvedOptions gcm = ResolvedOptionsFixture.builder().algorithm("aes-256-gcm").build();
    final Object encrypted = provider.encrypt("sensitive", gcm);
    final ResolvedOptions otherAttribute = ResolvedOptionsFixture.builder()
        .algorithm("aes-256-gcm")
        .attributeName("email")
        .build();

    assertThatThrownBy(() -> provider.decrypt(encrypted, otherAttribute))
        .isInstanceOf(CipherException.class)
        .hasMessageContaining("Failed to decrypt attribute");
  }

  @Test
  void encrypt_aes128_roundTrip() {
    final ResolvedOptions aes128 = ResolvedOptionsFixture.builder().algorithm("AES-128-CBC").build();
    final Object encrypted = provider.encrypt("short key", aes128);
    assertThat(provider.decrypt(encrypted, aes128)).isEqualTo("short key");
  }

  @Test
  void encrypt_explicitIv_changesCiphertext() {
    final ResolvedOptions withIv = ResolvedOptionsFixture.builder()
        .extraOptions(Map.of(AesCipherProvider.IV_OPTION, new byte[16]))
        .build();

    final Object encrypted = provider.encrypt("data", withIv);
    assertThat((byte[]) encrypted).isNotEqualTo((byte[]) provider.encrypt("data", options));
    assertThat(provider.decrypt(encrypted, withIv)).isEqualTo("data");
  }

  @Test
  void encrypt_explicitIvOfWrongLength_throwsException() {
    final ResolvedOptions withIv = ResolvedOptionsFixture.builder()
        .extraOptions(Map.of(AesCipherProvider.IV_OPTION, new byte[4]))
        .build();

    assertThatThrownBy(() -> provider.encrypt("data", withIv))
        .isInstanceOf(CipherException.class)
        .hasMessageContaining("must be 16 bytes");
  }

  @Test
  void decrypt_withWrongKey_fails() {
    final ResolvedOptions gcm = ResolvedOptionsFixture.builder().algorithm("aes-256-gcm").build();
    final Object encrypted = provider.encrypt("sensitive", gcm);
    final ResolvedOptions wrongKey = ResolvedOptionsFixture.builder().algorithm("aes-256-gcm").key("wrong").build();

    assertThatThrownBy(() -> provider.decrypt(encrypted, wrongKey))
        .isInstanceOf(CipherException.class)
        .hasMessageContaining("Failed to decrypt attribute: ssn");
  }

  @Test
  void decrypt_nonBinaryValue_throwsException() {
    assertThatThrownBy(() -> provider.decrypt("not encrypted", options))
        .isInstanceOf(CipherException.class)
        .hasMessageContaining("must be binary");
  }

  @Test
  void encrypt_structuredValue_throwsException() {
    assertThatThrownBy(() -> provider.encrypt(Map.of("a", 1), options))
        .isInstanceOf(CipherException.class)
        .hasMessageContaining("enable marshal");
  }

  @Test
  void encrypt_unsupportedAlgorithm_throwsException() {
    final ResolvedOptions des = ResolvedOptionsFixture.builder().algorithm("des-ede3-cbc").build();

    assertThatThrownBy(() -> provider.encrypt("data", des))
        .isInstanceOf(CipherException.class)
        .hasMessageContaining("Unsupported algorithm");
  }

  @Test
  void encrypt_withoutKey_throwsException() {
    final ResolvedOptions noKey = ResolvedOptionsFixture.builder().key(Optional.empty()).build();

    assertThatThrownBy(() -> provider.encrypt("data", noKey))
        .isInstanceOf(CipherException.class)
        .hasMessageContaining("No key supplied");
  }

  @Test
  void encrypt_gcm_distinctPlaintexts_getDistinctIvs() {
    final ResolvedOptions gcm = ResolvedOptionsFixture.builder().algorithm("aes-256-gcm").key("k1").build();

    final byte[] first = (byte[]) provider.encrypt("AAAAAAAAAAAA", gcm);
    final byte[] second = (byte[]) provider.encrypt("secret-value", gcm);

    assertThat(Arrays.copyOfRange(first, 0, 12)).isNotEqualTo(Arrays.copyOfRange(second, 0, 12));
    assertThat((byte[]) provider.encrypt("secret-value", gcm)).isEqualTo(second);
  }

  @Test
  void encrypt_cbc_distinctPlaintexts_getDistinctIvs() {
    final byte[] first = (byte[]) provider.encrypt("first value", options);
    final byte[] second = (byte[]) provider.encrypt("second value", options);

    assertThat(Arrays.copyOfRange(first, 0, 16)).isNotEqualTo(Arrays.copyOfRange(second, 0, 16));
  }

  @Test
  void encrypt_explicitIv_isPrepended() {
    final byte[] iv = new byte[12];
    Arrays.fill(iv, (byte) 7);
    final ResolvedOptions withIv = ResolvedOptionsFixture.builder()
        .algorithm("aes-128-gcm")
        .extraOptions(Map.of(AesCipherProvider.IV_OPTION, iv))
        .build();

    final byte[] encrypted = (byte[]) provider.encrypt("data", withIv);

    assertThat(Arrays.copyOfRange(encrypted, 0, 12)).isEqualTo(iv);
    assertThat(provider.decrypt(encrypted, withIv)).isEqualTo("data");
  }

  @Test
  void decrypt_truncatedValue_throwsException() {
    assertThatThrownBy(() -> provider.decrypt(new byte[20], options))
        .isInstanceOf(CipherException.class)
        .hasMessageContaining("too short");
  }
}
