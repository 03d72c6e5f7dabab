package com.verlumen.modelfit.display;

import com.google.inject.AbstractModule;

public final class DisplayModule extends AbstractModule {
  public static DisplayModule create() {
    return new DisplayModule();
  }

  private DisplayModule() {}

  @Override
  protected void configure() {
    bind(ParameterRenderer.class).to(HtmlParameterRenderer.class);
  }
}
