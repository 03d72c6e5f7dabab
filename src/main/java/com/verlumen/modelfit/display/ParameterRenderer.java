package com.verlumen.modelfit.display;

import com.verlumen.modelfit.model.ParameterGroup;
import com.verlumen.modelfit.params.Parameter;

/** Renders parameters for display in a rich front end. */
public interface ParameterRenderer {
  String render(Parameter par);

  /** Renders every parameter of {@code group} that is not hidden. */
  String render(ParameterGroup group);
}
