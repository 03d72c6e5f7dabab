package com.verlumen.modelfit.config;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.inject.Inject;
import com.verlumen.modelfit.model.ParameterGroup;
import com.verlumen.modelfit.params.ExpressionParser;
import com.verlumen.modelfit.params.Parameter;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

final class ParameterGroupLoaderImpl implements ParameterGroupLoader {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();
  private static final Gson GSON = new GsonBuilder().create();

  private enum Format {
    JSON,
    YAML
  }

  @Inject
  ParameterGroupLoaderImpl() {}

  @Override
  public ParameterGroup load(Path path) {
    return loadAll(ImmutableList.of(path)).get(0);
  }

  @Override
  public ImmutableList<ParameterGroup> loadAll(List<Path> paths) {
    List<ModelDefinition> definitions = new ArrayList<>();
    for (Path path : paths) {
      logger.atFine().log("Reading model definition from %s", path);
      Format format = formatOf(path.toString());
      try {
        String content = Files.readString(path, StandardCharsets.UTF_8);
        definitions.add(parse(content, format, path.toString()));
      } catch (IOException e) {
        throw new UncheckedIOException("Failed to read model definition from: " + path, e);
      }
    }
    return build(definitions);
  }

  @Override
  public ParameterGroup loadResource(String resourcePath) {
    String normalized = resourcePath.startsWith("/") ? resourcePath : "/" + resourcePath;
    Format format = formatOf(resourcePath);
    try (InputStream is = ParameterGroupLoaderImpl.class.getResourceAsStream(normalized)) {
      if (is == null) {
        throw new IllegalArgumentException("Resource not found: " + resourcePath);
      }
      String content = new String(is.readAllBytes(), StandardCharsets.UTF_8);
      return buildOne(parse(content, format, resourcePath));
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read model definition from: " + resourcePath, e);
    }
  }

  @Override
  public ParameterGroup parseJson(String json) {
    return buildOne(parse(json, Format.JSON, "<json>"));
  }

  @Override
  public ParameterGroup parseYaml(String yaml) {
    return buildOne(parse(yaml, Format.YAML, "<yaml>"));
  }

  private ParameterGroup buildOne(ModelDefinition definition) {
    return build(ImmutableList.of(definition)).get(0);
  }

  @Override
  public ImmutableList<ParameterGroup> build(List<ModelDefinition> definitions) {
    Map<String, ParameterGroup> groups = new HashMap<>();
    ImmutableList.Builder<ParameterGroup> ordered = ImmutableList.builder();
    for (ModelDefinition definition : definitions) {
      ParameterGroup group = createGroup(definition);
      ParameterGroup previous = groups.put(Ascii.toLowerCase(group.getName()), group);
      checkArgument(previous == null, "Model %s is defined more than once", group.getName());
      ordered.add(group);
    }

    for (ModelDefinition definition : definitions) {
      ParameterGroup group = groups.get(Ascii.toLowerCase(definition.getModel()));
      for (ParameterDefinition parDef : definition.getParameters()) {
        if (parDef.getLink() == null) {
          continue;
        }
        Parameter par = group.get(parDef.getName());
        Parameter link =
            ExpressionParser.parse(parDef.getLink(), name -> resolve(name, group, groups));
        par.setLink(link);
        logger.atFine().log("Linked %s to %s", par.getFullName(), link.getFullName());
      }
    }

    ImmutableList<ParameterGroup> result = ordered.build();
    logger.atInfo().log("Loaded %d model definitions", result.size());
    return result;
  }

  private static ParameterGroup createGroup(ModelDefinition definition) {
    String model = definition.getModel();
    checkArgument(model != null && !model.isEmpty(), "Model definition is missing a model name");
    checkArgument(definition.getParameters() != null, "Model %s has no parameter list", model);
    ImmutableList<Parameter> pars =
        definition.getParameters().stream()
            .map(parDef -> createParameter(model, parDef))
            .collect(toImmutableList());
    return ParameterGroup.of(model, pars);
  }

  private static Parameter createParameter(String model, ParameterDefinition definition) {
    checkArgument(definition.getName() != null, "Model %s has a parameter without a name", model);
    checkArgument(
        definition.getVal() != null,
        "Parameter %s.%s is missing a value",
        model,
        definition.getName());

    Parameter.Builder builder = Parameter.builder(model, definition.getName(), definition.getVal());
    Optional.ofNullable(definition.getMin()).ifPresent(builder::setMin);
    Optional.ofNullable(definition.getMax()).ifPresent(builder::setMax);
    Optional.ofNullable(definition.getHardMin()).ifPresent(builder::setHardMin);
    Optional.ofNullable(definition.getHardMax()).ifPresent(builder::setHardMax);
    Optional.ofNullable(definition.getUnits()).ifPresent(builder::setUnits);
    Optional.ofNullable(definition.getFrozen()).ifPresent(builder::setFrozen);
    Optional.ofNullable(definition.getAlwaysFrozen()).ifPresent(builder::setAlwaysFrozen);
    Optional.ofNullable(definition.getHidden()).ifPresent(builder::setHidden);
    Optional.ofNullable(definition.getAliases()).ifPresent(builder::setAliases);
    return builder.build();
  }

  /** Resolves {@code model.name}, or a bare name inside {@code current}. */
  private static Optional<Parameter> resolve(
      String name, ParameterGroup current, Map<String, ParameterGroup> groups) {
    int dot = name.indexOf('.');
    if (dot < 0) {
      return current.find(name);
    }
    ParameterGroup group = groups.get(Ascii.toLowerCase(name.substring(0, dot)));
    if (group == null) {
      return Optional.empty();
    }
    return group.find(name.substring(dot + 1));
  }

  private static ModelDefinition parse(String content, Format format, String source) {
    try {
      ModelDefinition definition;
      if (format == Format.YAML) {
        // SnakeYAML builds plain maps; Gson binds them onto the definition classes.
        Object yaml = new Yaml().load(content);
        definition = GSON.fromJson(GSON.toJson(yaml), ModelDefinition.class);
      } else {
        definition = GSON.fromJson(content, ModelDefinition.class);
      }
      checkArgument(definition != null, "Empty model definition in %s", source);
      return definition;
    } catch (JsonParseException | YAMLException e) {
      throw new IllegalArgumentException("Failed to parse model definition from: " + source, e);
    }
  }

  private static Format formatOf(String path) {
    String lowerPath = Ascii.toLowerCase(path);
    if (lowerPath.endsWith(".yaml") || lowerPath.endsWith(".yml")) {
      return Format.YAML;
    } else if (lowerPath.endsWith(".json")) {
      return Format.JSON;
    }
    throw new IllegalArgumentException(
        "Unsupported file format. Use .json, .yaml, or .yml: " + path);
  }
}
