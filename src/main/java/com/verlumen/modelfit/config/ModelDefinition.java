package com.verlumen.modelfit.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** A model component and its parameters, as read from a JSON or YAML file. */
public final class ModelDefinition implements Serializable {
  private static final long serialVersionUID = 1L;

  private String model;
  private List<ParameterDefinition> parameters = new ArrayList<>();

  public ModelDefinition() {}

  public ModelDefinition(String model, List<ParameterDefinition> parameters) {
    this.model = model;
    this.parameters = parameters;
  }

  public String getModel() {
    return model;
  }

  public void setModel(String model) {
    this.model = model;
  }

  public List<ParameterDefinition> getParameters() {
    return parameters;
  }

  public void setParameters(List<ParameterDefinition> parameters) {
    this.parameters = parameters;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    ModelDefinition that = (ModelDefinition) o;
    return Objects.equals(model, that.model) && Objects.equals(parameters, that.parameters);
  }

  @Override
  public int hashCode() {
    return Objects.hash(model, parameters);
  }

  @Override
  public String toString() {
    return "ModelDefinition{model='" + model + '\'' + ", parameters=" + parameters + '}';
  }
}
