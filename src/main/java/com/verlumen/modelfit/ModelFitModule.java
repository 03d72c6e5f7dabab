package com.verlumen.modelfit;

import com.google.inject.AbstractModule;
import com.verlumen.modelfit.config.ConfigModule;
import com.verlumen.modelfit.display.DisplayModule;

/** Installs the bindings for loading and displaying model parameters. */
public final class ModelFitModule extends AbstractModule {
  public static ModelFitModule create() {
    return new ModelFitModule();
  }

  private ModelFitModule() {}

  @Override
  protected void configure() {
    install(ConfigModule.create());
    install(DisplayModule.create());
  }
}
