package com.verlumen.modelfit.config;

import com.google.inject.AbstractModule;

public final class ConfigModule extends AbstractModule {
  public static ConfigModule create() {
    return new ConfigModule();
  }

  private ConfigModule() {}

  @Override
  protected void configure() {
    bind(ParameterGroupLoader.class).to(ParameterGroupLoaderImpl.class);
  }
}
