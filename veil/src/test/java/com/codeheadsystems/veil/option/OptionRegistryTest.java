package com.codeheadsystems.veil.option;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

import com.codeheadsystems.veil.encryption.AesCipherProvider;
import com.codeheadsystems.veil.encryption.PassthroughCipherProvider;
import com.codeheadsystems.veil.exception.DeclarationException;
import com.codeheadsystems.veil.model.AttributeSpec;
import com.codeheadsystems.veil.resolve.Resolvable;
import com.codeheadsystems.veil.transform.CipherInvoker;
import com.codeheadsystems.veil.transform.JacksonMarshaler;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OptionRegistryTest {

  private static final OptionLayer KEYED = OptionLayer.builder().key("k1").build();

  private OptionRegistry registry;

  static class Account {
  }

  static class SavingsAccount extends Account {
  }

  @BeforeEach
  void setup() {
    registry = new OptionRegistry(OptionLayer.builder()
        .prefix("encrypted_")
        .suffix("")
        .secretKeyParamName("key")
        .algorithm("aes-256-cbc")
        .cipherProvider(new AesCipherProvider())
        .encryptMethod(CipherInvoker.ENCRYPT)
        .decryptMethod(CipherInvoker.DECRYPT)
        .marshaler(new JacksonMarshaler(new ObjectMapper()))
        .build());
  }

  @Test
  void declareAttribute_defaultStorageName() {
    final AttributeSpec spec = registry.declareAttribute(Account.class, "email", KEYED);

    assertThat(spec.storageAttribute()).isEqualTo("encrypted_email");
    assertThat(spec.owner()).isEqualTo(Account.class);
    assertThat(spec.declaredOptions()).isEqualTo(KEYED);
  }

  @Test
  void declareAttribute_prefixAndSuffix() {
    final AttributeSpec spec = registry.declareAttribute(Account.class, "email",
        OptionLayer.builder().from(KEYED).prefix("secret_").suffix("_crypted").build());

    assertThat(spec.storageAttribute()).isEqualTo("secret_email_crypted");
  }

  @Test
  void declareAttribute_explicitAttribute() {
    final AttributeSpec spec = registry.declareAttribute(Account.class, "email",
        OptionLayer.builder().from(KEYED).attribute("email_ciphertext").build());

    assertThat(spec.storageAttribute()).isEqualTo("email_ciphertext");
  }

  @Test
  void declareAttribute_storageCollision_throws() {
    registry.declareAttribute(Account.class, "email", KEYED);

    assertThatExceptionOfType(DeclarationException.class)
        .isThrownBy(() -> registry.declareAttribute(Account.class, "phone",
            OptionLayer.builder().from(KEYED).attribute("encrypted_email").build()))
        .withMessageContaining("both store to 'encrypted_email'");
  }

  @Test
  void declareAttributes_collisionWithinOneCall_registersNothing() {
    final OptionLayer shared = OptionLayer.builder().from(KEYED).attribute("secret").build();

    assertThatExceptionOfType(DeclarationException.class)
        .isThrownBy(() -> registry.declareAttributes(Account.class, List.of("a", "b"), shared));
    assertThat(registry.attributes(Account.class)).isEmpty();
  }

  @Test
  void declareAttribute_redeclaration_replaces() {
    registry.declareAttribute(Account.class, "email", KEYED);
    final AttributeSpec replaced = registry.declareAttribute(Account.class, "email",
        OptionLayer.builder().from(KEYED).suffix("_v2").build());

    assertThat(registry.attribute(Account.class, "email")).contains(replaced);
    assertThat(replaced.storageAttribute()).isEqualTo("encrypted_email_v2");
  }

  @Test
  void declareAttribute_withoutKey_throws() {
    assertThatExceptionOfType(DeclarationException.class)
        .isThrownBy(() -> registry.declareAttribute(Account.class, "email", OptionLayer.empty()))
        .withMessageContaining("No key configured");
  }

  @Test
  void declareAttribute_withoutKey_allowedWhenProviderNeedsNone() {
    final AttributeSpec spec = registry.declareAttribute(Account.class, "email",
        OptionLayer.builder().cipherProvider(new PassthroughCipherProvider()).build());

    assertThat(spec.instanceIndependent()).isTrue();
  }

  @Test
  void declareAttribute_unknownEncodeFormat_throws() {
    assertThatExceptionOfType(DeclarationException.class)
        .isThrownBy(() -> registry.declareAttribute(Account.class, "email",
            OptionLayer.builder().from(KEYED).encode("rot13").build()))
        .withMessageContaining("Unknown encode format");
  }

  @Test
  void declareAttributes_emptyNames_throws() {
    assertThatExceptionOfType(DeclarationException.class)
        .isThrownBy(() -> registry.declareAttributes(Account.class, List.of(), KEYED));
  }

  @Test
  void declareAttribute_instanceIndependence() {
    assertThat(registry.declareAttribute(Account.class, "a", KEYED).instanceIndependent()).isTrue();
    assertThat(registry.declareAttribute(Account.class, "b",
        OptionLayer.builder().key(Resolvable.method("key")).build()).instanceIndependent()).isFalse();
    assertThat(registry.declareAttribute(Account.class, "c",
        OptionLayer.builder().from(KEYED).onlyIf(Resolvable.computed(o -> true)).build()).instanceIndependent())
        .isFalse();
    assertThat(registry.declareAttribute(Account.class, "d",
        OptionLayer.builder().from(KEYED).unless(Resolvable.literal(false)).build()).instanceIndependent())
        .isTrue();
  }

  @Test
  void setDefault_class_appliesToLaterDeclarationsOnly() {
    final AttributeSpec before = registry.declareAttribute(Account.class, "email", KEYED);
    registry.setDefault(OptionScope.forClass(Account.class), OptionLayer.builder().encode(true).build());
    final AttributeSpec after = registry.declareAttribute(Account.class, "phone", KEYED);

    assertThat(before.options().get(OptionKey.ENCODE)).isEmpty();
    assertThat(after.options().get(OptionKey.ENCODE)).contains(true);
  }

  @Test
  void setDefault_global_isOverriddenByClassAndAttribute() {
    registry.setDefault(OptionScope.global(), OptionLayer.builder().algorithm("aes-128-cbc").suffix("_g").build());
    registry.setDefault(OptionScope.forClass(Account.class), OptionLayer.builder().algorithm("aes-192-cbc").build());

    final AttributeSpec spec = registry.declareAttribute(Account.class, "email",
        OptionLayer.builder().from(KEYED).algorithm("aes-256-gcm").build());
    final AttributeSpec other = registry.declareAttribute(Account.class, "phone", KEYED);

    assertThat(spec.options().get(OptionKey.ALGORITHM)).contains("aes-256-gcm");
    assertThat(other.options().get(OptionKey.ALGORITHM)).contains("aes-192-cbc");
    assertThat(other.storageAttribute()).isEqualTo("encrypted_phone_g");
  }

  @Test
  void setDefault_class_mergesRepeatedCalls() {
    registry.setDefault(OptionScope.forClass(Account.class), OptionLayer.builder().prefix("x_").build());
    registry.setDefault(OptionScope.forClass(Account.class), OptionLayer.builder().suffix("_y").build());

    assertThat(registry.declareAttribute(Account.class, "email", KEYED).storageAttribute())
        .isEqualTo("x_email_y");
  }

  @Test
  void effectiveLayers_orderedLowestFirst() {
    final OptionLayer accountDefaults = OptionLayer.builder().prefix("a_").build();
    final OptionLayer savingsDefaults = OptionLayer.builder().prefix("s_").build();
    registry.setDefault(OptionScope.forClass(Account.class), accountDefaults);
    registry.setDefault(OptionScope.forClass(SavingsAccount.class), savingsDefaults);
    registry.declareAttribute(SavingsAccount.class, "email", KEYED);

    final List<OptionLayer> layers = registry.effectiveLayers(SavingsAccount.class, "email");

    assertThat(layers).hasSize(4);
    assertThat(layers.subList(1, 4)).containsExactly(accountDefaults, savingsDefaults, KEYED);
    assertThat(registry.attribute(SavingsAccount.class, "email").get().storageAttribute()).isEqualTo("s_email");
  }

  @Test
  void attributes_includeInheritedDeclarations() {
    registry.declareAttribute(Account.class, "email", KEYED);
    registry.declareAttribute(SavingsAccount.class, "iban", KEYED);

    assertThat(registry.attributes(SavingsAccount.class)).containsOnlyKeys("email", "iban");
    assertThat(registry.attributes(Account.class)).containsOnlyKeys("email");
  }

  @Test
  void declareAttribute_collisionWithInheritedAttribute_throws() {
    registry.declareAttribute(Account.class, "email", KEYED);

    assertThatExceptionOfType(DeclarationException.class)
        .isThrownBy(() -> registry.declareAttribute(SavingsAccount.class, "mail",
            OptionLayer.builder().from(KEYED).attribute("encrypted_email").build()));
  }
}
