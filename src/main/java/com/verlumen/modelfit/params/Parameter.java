package com.verlumen.modelfit.params;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.collect.ImmutableList.toImmutableList;
import static com.verlumen.modelfit.params.ParameterLimits.HUGE_VAL;

import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import com.google.common.collect.Iterators;
import com.google.common.flogger.FluentLogger;
import java.util.Iterator;
import java.util.Optional;
import java.util.function.Function;
import javax.annotation.Nullable;

/**
 * A named, bounded scalar input to a numeric model.
 *
 * <p>A parameter holds a value that must lie within its soft limits ({@link #getMin()} to
 * {@link #getMax()}), which in turn must lie within its hard limits. The hard limits are fixed
 * when the parameter is created. Setting a value outside the soft limits, or a soft limit outside
 * the hard limits, throws a {@link ParameterErr}.
 *
 * <p>A parameter can instead be linked to another parameter or to an expression built from
 * parameters with the arithmetic methods ({@link #plus(Parameter)}, {@link #times(double)},
 * ...). The value of a linked parameter is computed from the link each time it is read, and the
 * read fails if the result falls outside the soft limits. Linked parameters always report
 * themselves as frozen, so a fit never varies them directly.
 *
 * <pre>{@code
 * Parameter a = new Parameter("mdl", "a", 2);
 * Parameter b = Parameter.builder("mdl", "b", 1).setMin(0).setMax(20).build();
 * b.setLink(Parameters.minus(10, a));
 * b.getVal();  // 8.0
 * }</pre>
 *
 * <p>Parameters are not thread-safe; a single owner is expected to mutate them between fit
 * iterations.
 */
public class Parameter implements Iterable<Parameter> {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private enum Limit {
    MIN,
    MAX,
    DEFAULT_MIN,
    DEFAULT_MAX
  }

  private final String modelName;
  private final String name;
  private final String fullName;
  private final double hardMin;
  private final double hardMax;
  private final String units;
  private final boolean alwaysFrozen;
  private final boolean hidden;
  private final ImmutableList<String> aliases;

  private double val;
  private double defaultVal;
  private double min;
  private double max;
  private double defaultMin;
  private double defaultMax;
  private boolean frozen;
  private boolean guessed;
  @Nullable private Parameter link;

  // Limit auto-repair only applies once construction is complete.
  private boolean initialized;

  public Parameter(String modelName, String name, double val) {
    this(builder(modelName, name, val));
  }

  private Parameter(Builder builder) {
    this(
        builder.modelName,
        builder.name,
        builder.modelName + "." + builder.name,
        builder);
  }

  /** Creates a parameter whose full name is an expression rather than a dotted identifier. */
  Parameter(String expression) {
    this("", expression, expression, builder("", expression, 0.0));
  }

  private Parameter(String modelName, String name, String fullName, Builder builder) {
    this.modelName = checkNotNull(modelName);
    this.name = checkNotNull(name);
    this.fullName = fullName;
    this.hardMin = builder.hardMin;
    this.hardMax = builder.hardMax;
    this.units = builder.units;
    this.alwaysFrozen = builder.alwaysFrozen;
    this.frozen = builder.alwaysFrozen || builder.frozen;
    this.hidden = builder.hidden;
    this.aliases = builder.aliases.stream().map(Ascii::toLowerCase).collect(toImmutableList());

    double initialMin = builder.min == null ? builder.hardMin : builder.min;
    double initialMax = builder.max == null ? builder.hardMax : builder.max;
    setLimit(Limit.MIN, initialMin);
    setLimit(Limit.MAX, initialMax);
    setVal(builder.val);
    setLimit(Limit.DEFAULT_MIN, initialMin);
    setLimit(Limit.DEFAULT_MAX, initialMax);
    setDefaultVal(builder.val);
    this.link = null;
    this.guessed = false;
    this.initialized = true;
  }

  public static Builder builder(String modelName, String name, double val) {
    return new Builder(modelName, name, val);
  }

  public String getModelName() {
    return modelName;
  }

  public String getName() {
    return name;
  }

  /** The {@code model.name} identifier, or the expression text for a composite. */
  public String getFullName() {
    return fullName;
  }

  public String getUnits() {
    return units;
  }

  public boolean isHidden() {
    return hidden;
  }

  /** Alternative names, lower-cased. */
  public ImmutableList<String> getAliases() {
    return aliases;
  }

  public boolean isAlwaysFrozen() {
    return alwaysFrozen;
  }

  public double getHardMin() {
    return hardMin;
  }

  public double getHardMax() {
    return hardMax;
  }

  /**
   * Returns the current value.
   *
   * @throws ParameterErr if the parameter is linked and the link evaluates outside the soft
   *     limits
   */
  public double getVal() {
    if (link == null) {
      return val;
    }
    double linked = link.getVal();
    checkWithinSoftLimits(linked);
    return linked;
  }

  /**
   * Removes any link and stores a new value, which also becomes the default value that
   * {@link #reset()} returns to.
   *
   * @throws ParameterErr if the value is outside the soft limits; the parameter is unchanged
   */
  public void setVal(double val) {
    checkWithinSoftLimits(val);
    this.link = null;
    this.val = val;
    this.defaultVal = val;
  }

  /**
   * Stores a trial value chosen by a fit. Unlike {@link #setVal(double)} the default value is
   * kept, so {@link #reset()} returns to the value from before the fit.
   *
   * @throws ParameterErr if the value is outside the soft limits; the caller should treat the
   *     trial point as rejected
   */
  public void applyFitValue(double val) {
    checkWithinSoftLimits(val);
    this.val = val;
  }

  /** Links this parameter to {@code link}; same as {@link #setLink(Parameter)}. */
  public void setVal(Parameter link) {
    setLink(link);
  }

  public double getDefaultVal() {
    if (link != null) {
      return link.getDefaultVal();
    }
    return defaultVal;
  }

  /**
   * Removes any link and sets the value that {@link #reset()} restores, leaving the current value
   * alone.
   */
  public void setDefaultVal(double defaultVal) {
    checkWithinSoftLimits(defaultVal);
    this.link = null;
    this.defaultVal = defaultVal;
  }

  /** Links this parameter to {@code link}; same as {@link #setLink(Parameter)}. */
  public void setDefaultVal(Parameter link) {
    setLink(link);
  }

  public double getMin() {
    return min;
  }

  /**
   * Sets the soft minimum. If the current value lies below the new minimum it is raised to it.
   *
   * @return the adjustment made to the value, if any
   * @throws ParameterErr if the minimum is outside the hard limits
   */
  public Optional<ValueAdjustment> setMin(double min) {
    return setLimit(Limit.MIN, min);
  }

  public double getMax() {
    return max;
  }

  /**
   * Sets the soft maximum. If the current value lies above the new maximum it is lowered to it.
   *
   * @return the adjustment made to the value, if any
   * @throws ParameterErr if the maximum is outside the hard limits
   */
  public Optional<ValueAdjustment> setMax(double max) {
    return setLimit(Limit.MAX, max);
  }

  public double getDefaultMin() {
    return defaultMin;
  }

  public Optional<ValueAdjustment> setDefaultMin(double defaultMin) {
    return setLimit(Limit.DEFAULT_MIN, defaultMin);
  }

  public double getDefaultMax() {
    return defaultMax;
  }

  public Optional<ValueAdjustment> setDefaultMax(double defaultMax) {
    return setLimit(Limit.DEFAULT_MAX, defaultMax);
  }

  private Optional<ValueAdjustment> setLimit(Limit limit, double value) {
    if (value < hardMin) {
      throw ParameterErr.edge(fullName, "hard minimum", hardMin);
    }
    if (value > hardMax) {
      throw ParameterErr.edge(fullName, "hard maximum", hardMax);
    }

    ValueAdjustment adjustment = null;
    if (initialized) {
      if (limit == Limit.MIN && value > getVal()) {
        adjustment = moveValueTo(ValueAdjustment.Limit.MIN, value);
        logger.atWarning().log(
            "parameter %s less than new %s; %s reset to %s",
            fullName,
            adjustment.limit().getLabel(),
            fullName,
            NumberFormats.formatGeneral(getVal()));
      }
      if (limit == Limit.MAX && value < getVal()) {
        adjustment = moveValueTo(ValueAdjustment.Limit.MAX, value);
        logger.atWarning().log(
            "parameter %s greater than new %s; %s reset to %s",
            fullName,
            adjustment.limit().getLabel(),
            fullName,
            NumberFormats.formatGeneral(getVal()));
      }
    }

    switch (limit) {
      case MIN:
        this.min = value;
        break;
      case MAX:
        this.max = value;
        break;
      case DEFAULT_MIN:
        this.defaultMin = value;
        break;
      case DEFAULT_MAX:
        this.defaultMax = value;
        break;
    }
    return Optional.ofNullable(adjustment);
  }

  private ValueAdjustment moveValueTo(ValueAdjustment.Limit limit, double value) {
    double previous = getVal();
    setVal(value);
    return ValueAdjustment.create(fullName, limit, previous, value);
  }

  private void checkWithinSoftLimits(double value) {
    if (value < min) {
      throw ParameterErr.edge(fullName, "minimum", min);
    }
    if (value > max) {
      throw ParameterErr.edge(fullName, "maximum", max);
    }
  }

  /** Whether a fit should leave this parameter alone. Always true while linked. */
  public boolean isFrozen() {
    if (link != null) {
      return true;
    }
    return frozen;
  }

  /**
   * Sets the stored frozen flag.
   *
   * @throws ParameterErr if thawing a parameter created as always frozen
   */
  public void setFrozen(boolean frozen) {
    if (alwaysFrozen && !frozen) {
      throw ParameterErr.alwaysFrozen(fullName);
    }
    this.frozen = frozen;
  }

  public void freeze() {
    setFrozen(true);
  }

  public void thaw() {
    setFrozen(false);
  }

  @Nullable
  public Parameter getLink() {
    return link;
  }

  /**
   * Defines this parameter's value through {@code link}, or removes the link when {@code null}.
   *
   * <p>A link that refers back to this parameter directly, such as {@code p.times(2).plus(3)},
   * is rejected. When {@code link} is a plain parameter whose own chain of links leads back here,
   * that downstream link is removed instead, see {@link LinkGraph#breakDownstreamCycle}. When
   * {@code link} is a composite whose parts lead back here through other links, there is no single
   * downstream link to remove and the link is rejected, since reading the value would otherwise
   * recurse without end.
   *
   * @throws ParameterErr if this parameter is always frozen, or the link would form a cycle
   */
  public void setLink(@Nullable Parameter link) {
    if (link != null) {
      if (alwaysFrozen) {
        throw ParameterErr.frozenNoLink(fullName);
      }
      if (Iterables.any(link, part -> part == this)) {
        throw ParameterErr.linkCycle();
      }
      if (LinkGraph.reaches(link, this)) {
        if (link instanceof CompositeParameter) {
          throw ParameterErr.linkCycle();
        }
        LinkGraph.breakDownstreamCycle(link);
      }
      logger.atFine().log("linking %s to %s", fullName, link.getFullName());
    }
    this.link = link;
  }

  /**
   * Untyped form of {@link #setLink(Parameter)} for callers holding an arbitrary object.
   *
   * @throws ParameterErr if {@code target} is neither {@code null} nor a parameter
   */
  public void linkTo(@Nullable Object target) {
    if (target != null && alwaysFrozen) {
      throw ParameterErr.frozenNoLink(fullName);
    }
    if (target != null && !(target instanceof Parameter)) {
      throw ParameterErr.notLink();
    }
    setLink((Parameter) target);
  }

  public void unlink() {
    setLink(null);
  }

  /** Whether the soft limits were picked by a heuristic rather than by the user. */
  public boolean isGuessed() {
    return guessed;
  }

  /** Flags the current soft limits as guessed, so {@link #reset()} restores the defaults. */
  public void markGuessed() {
    this.guessed = true;
  }

  /**
   * Restores the value from the default value. Guessed soft limits are also restored from their
   * defaults. The frozen flag and the link are not touched.
   */
  public void reset() {
    if (guessed) {
      this.min = defaultMin;
      this.max = defaultMax;
      this.guessed = false;
    }
    this.val = getDefaultVal();
  }

  /**
   * Applies several settings at once.
   *
   * <p>Widened limits are applied before the values and narrowed limits after them, so that
   * moving the value and its range together does not fail on the intermediate state.
   */
  public void set(ParameterUpdate update) {
    if (update.max().isPresent() && update.max().get() > max) {
      setMax(update.max().get());
    }
    if (update.defaultMax().isPresent() && update.defaultMax().get() > defaultMax) {
      setDefaultMax(update.defaultMax().get());
    }

    if (update.min().isPresent() && update.min().get() < min) {
      setMin(update.min().get());
    }
    if (update.defaultMin().isPresent() && update.defaultMin().get() < defaultMin) {
      setDefaultMin(update.defaultMin().get());
    }

    update.val().ifPresent(v -> setVal(v));
    update.defaultVal().ifPresent(v -> setDefaultVal(v));

    update.min().ifPresent(this::setMin);
    update.max().ifPresent(this::setMax);

    update.defaultMin().ifPresent(this::setDefaultMin);
    update.defaultMax().ifPresent(this::setDefaultMax);

    update.frozen().ifPresent(this::setFrozen);
  }

  /** Captures the stored settings, naming the link target by its full name. */
  public ParameterState snapshot() {
    ParameterState.Builder state =
        ParameterState.builder()
            .setFullName(fullName)
            .setVal(val)
            .setMin(min)
            .setMax(max)
            .setDefaultVal(defaultVal)
            .setDefaultMin(defaultMin)
            .setDefaultMax(defaultMax)
            .setFrozen(frozen)
            .setGuessed(guessed);
    if (link != null) {
      state.setLink(link.getFullName());
    }
    return state.build();
  }

  /**
   * Reapplies the values, limits and flags captured by {@link #snapshot()}, leaving this
   * parameter unlinked.
   *
   * @throws ParameterErr if a setting is no longer valid
   */
  public void restore(ParameterState state) {
    unlink();
    set(
        ParameterUpdate.builder()
            .setMin(state.min())
            .setMax(state.max())
            .setVal(state.val())
            .setDefaultMin(state.defaultMin())
            .setDefaultMax(state.defaultMax())
            .setDefaultVal(state.defaultVal())
            .build());
    if (!alwaysFrozen) {
      setFrozen(state.frozen());
    }
    this.guessed = state.guessed();
  }

  /**
   * Reapplies everything captured by {@link #snapshot()}, including the link.
   *
   * @param resolver maps the full names in the link expression to parameters
   * @throws ParameterErr if a setting is no longer valid, or a name in the link does not resolve
   */
  public void restore(ParameterState state, Function<String, Optional<Parameter>> resolver) {
    restore(state);
    restoreLink(state, resolver);
  }

  /**
   * Reapplies only the link captured by {@link #snapshot()}, parsing it with {@link
   * ExpressionParser}; does nothing if there was no link.
   *
   * @throws ParameterErr if a name in the link does not resolve, or the link forms a cycle
   */
  public void restoreLink(ParameterState state, Function<String, Optional<Parameter>> resolver) {
    if (state.link().isPresent()) {
      setLink(ExpressionParser.parse(state.link().get(), resolver));
    }
  }

  /** A leaf parameter iterates over itself only. */
  @Override
  public Iterator<Parameter> iterator() {
    return Iterators.singletonIterator(this);
  }

  public UnaryOpParameter negate() {
    return UnaryOp.NEGATE.applyTo(this);
  }

  public UnaryOpParameter abs() {
    return UnaryOp.ABS.applyTo(this);
  }

  public BinaryOpParameter plus(Parameter rhs) {
    return BinaryOp.ADD.combine(this, rhs);
  }

  public BinaryOpParameter plus(double rhs) {
    return BinaryOp.ADD.combine(this, rhs);
  }

  public BinaryOpParameter minus(Parameter rhs) {
    return BinaryOp.SUBTRACT.combine(this, rhs);
  }

  public BinaryOpParameter minus(double rhs) {
    return BinaryOp.SUBTRACT.combine(this, rhs);
  }

  public BinaryOpParameter times(Parameter rhs) {
    return BinaryOp.MULTIPLY.combine(this, rhs);
  }

  public BinaryOpParameter times(double rhs) {
    return BinaryOp.MULTIPLY.combine(this, rhs);
  }

  public BinaryOpParameter div(Parameter rhs) {
    return BinaryOp.DIVIDE.combine(this, rhs);
  }

  public BinaryOpParameter div(double rhs) {
    return BinaryOp.DIVIDE.combine(this, rhs);
  }

  public BinaryOpParameter floorDiv(Parameter rhs) {
    return BinaryOp.FLOOR_DIVIDE.combine(this, rhs);
  }

  public BinaryOpParameter floorDiv(double rhs) {
    return BinaryOp.FLOOR_DIVIDE.combine(this, rhs);
  }

  public BinaryOpParameter mod(Parameter rhs) {
    return BinaryOp.MODULO.combine(this, rhs);
  }

  public BinaryOpParameter mod(double rhs) {
    return BinaryOp.MODULO.combine(this, rhs);
  }

  public BinaryOpParameter pow(Parameter rhs) {
    return BinaryOp.POWER.combine(this, rhs);
  }

  public BinaryOpParameter pow(double rhs) {
    return BinaryOp.POWER.combine(this, rhs);
  }

  /** A one-line description such as {@code <Parameter 'eta' of model 'mdl'>}. */
  public String toShortString() {
    StringBuilder sb =
        new StringBuilder("<").append(getClass().getSimpleName()).append(" '").append(name);
    if (!modelName.isEmpty()) {
      sb.append("' of model '").append(modelName);
    }
    return sb.append("'>").toString();
  }

  /**
   * The current settings, one per line.
   *
   * @throws ParameterErr if the parameter is linked and the link evaluates outside the soft
   *     limits
   */
  @Override
  public String toString() {
    String linkText = link == null ? "None" : link.getFullName();
    return String.join(
        "\n",
        "val         = " + NumberFormats.formatShortest(getVal()),
        "min         = " + NumberFormats.formatShortest(min),
        "max         = " + NumberFormats.formatShortest(max),
        "units       = " + units,
        "frozen      = " + (isFrozen() ? "True" : "False"),
        "link        = " + linkText,
        "default_val = " + NumberFormats.formatShortest(getDefaultVal()),
        "default_min = " + NumberFormats.formatShortest(defaultMin),
        "default_max = " + NumberFormats.formatShortest(defaultMax));
  }

  /** Optional settings for a new {@link Parameter}. */
  public static final class Builder {
    private final String modelName;
    private final String name;
    private final double val;
    @Nullable private Double min;
    @Nullable private Double max;
    private double hardMin = -HUGE_VAL;
    private double hardMax = HUGE_VAL;
    private String units = "";
    private boolean frozen;
    private boolean alwaysFrozen;
    private boolean hidden;
    private ImmutableList<String> aliases = ImmutableList.of();

    private Builder(String modelName, String name, double val) {
      this.modelName = checkNotNull(modelName, "modelName");
      this.name = checkNotNull(name, "name");
      this.val = val;
    }

    /** Defaults to the hard minimum. */
    public Builder setMin(double min) {
      this.min = min;
      return this;
    }

    /** Defaults to the hard maximum. */
    public Builder setMax(double max) {
      this.max = max;
      return this;
    }

    public Builder setHardMin(double hardMin) {
      this.hardMin = hardMin;
      return this;
    }

    public Builder setHardMax(double hardMax) {
      this.hardMax = hardMax;
      return this;
    }

    public Builder setUnits(String units) {
      this.units = checkNotNull(units);
      return this;
    }

    public Builder setFrozen(boolean frozen) {
      this.frozen = frozen;
      return this;
    }

    public Builder setAlwaysFrozen(boolean alwaysFrozen) {
      this.alwaysFrozen = alwaysFrozen;
      return this;
    }

    public Builder setHidden(boolean hidden) {
      this.hidden = hidden;
      return this;
    }

    public Builder setAliases(Iterable<String> aliases) {
      this.aliases = ImmutableList.copyOf(aliases);
      return this;
    }

    /**
     * @throws ParameterErr if the limits or value are inconsistent with each other
     */
    public Parameter build() {
      return new Parameter(this);
    }
  }
}
