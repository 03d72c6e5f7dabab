package com.verlumen.modelfit.config;

import com.google.common.collect.ImmutableList;
import com.verlumen.modelfit.model.ParameterGroup;
import java.nio.file.Path;
import java.util.List;

/**
 * Builds {@link ParameterGroup}s from JSON or YAML model definitions.
 *
 * <p>Links are resolved after every parameter in the batch exists, so a link may name a
 * parameter defined later, or in another file of the same batch. A link name without a model
 * prefix refers to the parameter's own model.
 */
public interface ParameterGroupLoader {
  /** Loads one file, choosing the format from the {@code .json}, {@code .yaml} or {@code .yml} extension. */
  ParameterGroup load(Path path);

  /** Loads several files as one batch. */
  ImmutableList<ParameterGroup> loadAll(List<Path> paths);

  /** Loads one classpath resource, choosing the format from its extension. */
  ParameterGroup loadResource(String resourcePath);

  ParameterGroup parseJson(String json);

  ParameterGroup parseYaml(String yaml);

  /**
   * @throws IllegalArgumentException if a definition is incomplete or a link expression is
   *     malformed
   * @throws com.verlumen.modelfit.params.ParameterErr if a value, limit or link is invalid
   */
  ImmutableList<ParameterGroup> build(List<ModelDefinition> definitions);
}
