package com.verlumen.modelfit.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Definition of one model parameter as read from a config file. Only {@code name} and {@code val}
 * are required; unset limits fall back to the parameter defaults.
 */
public final class ParameterDefinition implements Serializable {
  private static final long serialVersionUID = 1L;

  private String name;
  private Double val;
  private Double min;
  private Double max;
  private Double hardMin;
  private Double hardMax;
  private String units;
  private Boolean frozen;
  private Boolean alwaysFrozen;
  private Boolean hidden;
  private List<String> aliases = new ArrayList<>();
  private String link;

  public ParameterDefinition() {}

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public Double getVal() {
    return val;
  }

  public void setVal(Double val) {
    this.val = val;
  }

  public Double getMin() {
    return min;
  }

  public void setMin(Double min) {
    this.min = min;
  }

  public Double getMax() {
    return max;
  }

  public void setMax(Double max) {
    this.max = max;
  }

  public Double getHardMin() {
    return hardMin;
  }

  public void setHardMin(Double hardMin) {
    this.hardMin = hardMin;
  }

  public Double getHardMax() {
    return hardMax;
  }

  public void setHardMax(Double hardMax) {
    this.hardMax = hardMax;
  }

  public String getUnits() {
    return units;
  }

  public void setUnits(String units) {
    this.units = units;
  }

  public Boolean getFrozen() {
    return frozen;
  }

  public void setFrozen(Boolean frozen) {
    this.frozen = frozen;
  }

  public Boolean getAlwaysFrozen() {
    return alwaysFrozen;
  }

  public void setAlwaysFrozen(Boolean alwaysFrozen) {
    this.alwaysFrozen = alwaysFrozen;
  }

  public Boolean getHidden() {
    return hidden;
  }

  public void setHidden(Boolean hidden) {
    this.hidden = hidden;
  }

  public List<String> getAliases() {
    return aliases;
  }

  public void setAliases(List<String> aliases) {
    this.aliases = aliases;
  }

  /** The link expression, for example {@code 2 * gal.nh + 1}, or null when unlinked. */
  public String getLink() {
    return link;
  }

  public void setLink(String link) {
    this.link = link;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    ParameterDefinition that = (ParameterDefinition) o;
    return Objects.equals(name, that.name)
        && Objects.equals(val, that.val)
        && Objects.equals(min, that.min)
        && Objects.equals(max, that.max)
        && Objects.equals(hardMin, that.hardMin)
        && Objects.equals(hardMax, that.hardMax)
        && Objects.equals(units, that.units)
        && Objects.equals(frozen, that.frozen)
        && Objects.equals(alwaysFrozen, that.alwaysFrozen)
        && Objects.equals(hidden, that.hidden)
        && Objects.equals(aliases, that.aliases)
        && Objects.equals(link, that.link);
  }

  @Override
  public int hashCode() {
    return Objects.hash(
        name, val, min, max, hardMin, hardMax, units, frozen, alwaysFrozen, hidden, aliases, link);
  }

  @Override
  public String toString() {
    return "ParameterDefinition{"
        + "name='"
        + name
        + '\''
        + ", val="
        + val
        + ", min="
        + min
        + ", max="
        + max
        + ", link="
        + link
        + '}';
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {
    private final ParameterDefinition definition = new ParameterDefinition();

    private Builder() {}

    public Builder name(String name) {
      definition.setName(name);
      return this;
    }

    public Builder val(double val) {
      definition.setVal(val);
      return this;
    }

    public Builder min(double min) {
      definition.setMin(min);
      return this;
    }

    public Builder max(double max) {
      definition.setMax(max);
      return this;
    }

    public Builder hardMin(double hardMin) {
      definition.setHardMin(hardMin);
      return this;
    }

    public Builder hardMax(double hardMax) {
      definition.setHardMax(hardMax);
      return this;
    }

    public Builder units(String units) {
      definition.setUnits(units);
      return this;
    }

    public Builder frozen(boolean frozen) {
      definition.setFrozen(frozen);
      return this;
    }

    public Builder alwaysFrozen(boolean alwaysFrozen) {
      definition.setAlwaysFrozen(alwaysFrozen);
      return this;
    }

    public Builder hidden(boolean hidden) {
      definition.setHidden(hidden);
      return this;
    }

    public Builder aliases(List<String> aliases) {
      definition.setAliases(new ArrayList<>(aliases));
      return this;
    }

    public Builder link(String link) {
      definition.setLink(link);
      return this;
    }

    public ParameterDefinition build() {
      return definition;
    }
  }
}
