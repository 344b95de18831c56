package com.codeheadsystems.veil.dagger;

import com.codeheadsystems.veil.encryption.AesCipherProvider;
import com.codeheadsystems.veil.encryption.CipherProvider;
import com.codeheadsystems.veil.model.VeilConfiguration;
import com.codeheadsystems.veil.option.OptionLayer;
import com.codeheadsystems.veil.option.OptionRegistry;
import com.codeheadsystems.veil.transform.CipherInvoker;
import com.codeheadsystems.veil.transform.JacksonMarshaler;
import com.codeheadsystems.veil.transform.Marshaler;
import com.fasterxml.jackson.databind.ObjectMapper;
import dagger.Binds;
import dagger.Module;
import dagger.Provides;
import javax.inject.Named;
import javax.inject.Singleton;

/**
 * The type Veil module.
 */
@Module(includes = VeilModule.Binder.class)
public class VeilModule {

  /**
   * Instantiates a new Veil module.
   */
  public VeilModule() {
    // Default constructor
  }

  /**
   * Object mapper for marshaling.
   *
   * @return the object mapper
   */
  @Provides
  @Singleton
  public ObjectMapper objectMapper() {
    return new ObjectMapper();
  }

  /**
   * The global default layer, built from configuration.
   *
   * @param configuration  the configuration
   * @param cipherProvider the default cipher provider
   * @param marshaler      the default marshaler
   * @return the option layer
   */
  @Provides
  @Singleton
  @Named(OptionRegistry.GLOBAL_DEFAULTS)
  public OptionLayer globalDefaults(final VeilConfiguration configuration,
                                    final CipherProvider cipherProvider,
                                    final Marshaler marshaler) {
    return OptionLayer.builder()
        .prefix(configuration.prefix())
        .suffix(configuration.suffix())
        .secretKeyParamName(configuration.secretKeyParamName())
        .algorithm(configuration.algorithm())
        .encode(configuration.encode())
        .encodeFormat(configuration.encodeFormat())
        .marshal(configuration.marshal())
        .allowEmptyValue(configuration.allowEmptyValue())
        .cipherProvider(cipherProvider)
        .encryptMethod(CipherInvoker.ENCRYPT)
        .decryptMethod(CipherInvoker.DECRYPT)
        .marshaler(marshaler)
        .build();
  }

  /**
   * The interface Binder.
   */
  @Module
  interface Binder {

    /**
     * Default cipher provider.
     *
     * @param provider the provider
     * @return the cipher provider
     */
    @Binds
    CipherProvider cipherProvider(AesCipherProvider provider);

    /**
     * Default marshaler.
     *
     * @param marshaler the marshaler
     * @return the marshaler
     */
    @Binds
    Marshaler marshaler(JacksonMarshaler marshaler);
  }
}
