package com.codeheadsystems.veil.dagger;

import com.codeheadsystems.veil.model.VeilConfiguration;
import dagger.Module;
import dagger.Provides;
import javax.inject.Singleton;

/**
 * The type Configuration module.
 */
@Module
public class ConfigurationModule {

  private final VeilConfiguration configuration;

  /**
   * Instantiates a new Configuration module.
   *
   * @param configuration the configuration
   */
  public ConfigurationModule(final VeilConfiguration configuration) {
    this.configuration = configuration;
  }

  /**
   * Configuration.
   *
   * @return the veil configuration
   */
  @Provides
  @Singleton
  public VeilConfiguration configuration() {
    return configuration;
  }
}
