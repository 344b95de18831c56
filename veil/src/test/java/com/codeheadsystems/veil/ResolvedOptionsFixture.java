package com.codeheadsystems.veil;

import com.codeheadsystems.veil.encryption.AesCipherProvider;
import com.codeheadsystems.veil.model.ImmutableResolvedOptions;
import com.codeheadsystems.veil.transform.CipherInvoker;
import com.codeheadsystems.veil.transform.JacksonMarshaler;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Resolved options with the built-in defaults, for tests that bypass declaration.
 */
public final class ResolvedOptionsFixture {

  private ResolvedOptionsFixture() {
  }

  public static ImmutableResolvedOptions.Builder builder() {
    return ImmutableResolvedOptions.builder()
        .attributeName("ssn")
        .storageAttribute("encrypted_ssn")
        .key("a secret key")
        .secretKeyParamName("key")
        .algorithm("aes-256-cbc")
        .encode(false)
        .encodeFormat("base64")
        .marshal(false)
        .marshaler(new JacksonMarshaler(new ObjectMapper()))
        .allowEmptyValue(false)
        .cipherProvider(new AesCipherProvider())
        .encryptMethod(CipherInvoker.ENCRYPT)
        .decryptMethod(CipherInvoker.DECRYPT);
  }
}
