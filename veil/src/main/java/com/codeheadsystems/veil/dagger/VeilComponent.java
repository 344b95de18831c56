package com.codeheadsystems.veil.dagger;

import com.codeheadsystems.veil.EncryptedAttributes;
import com.codeheadsystems.veil.model.VeilConfiguration;
import dagger.Component;
import javax.inject.Singleton;

/**
 * The interface Veil component.
 */
@Singleton
@Component(modules = {VeilModule.class, ConfigurationModule.class})
public interface VeilComponent {

  /**
   * Instance veil component.
   *
   * @param configuration the configuration
   * @return the veil component
   */
  static VeilComponent instance(final VeilConfiguration configuration) {
    return DaggerVeilComponent.builder().configurationModule(new ConfigurationModule(configuration)).build();
  }

  /**
   * Encrypted attributes.
   *
   * @return the encrypted attributes
   */
  EncryptedAttributes encryptedAttributes();
}
