package com.verlumen.modelfit.params;

import com.google.common.collect.ImmutableList;

/** A literal number lifted into a parameter expression. */
public final class ConstantParameter extends CompositeParameter {
  private final double value;

  public ConstantParameter(double value) {
    super(format(value), ImmutableList.of());
    this.value = value;
  }

  public double getValue() {
    return value;
  }

  @Override
  public double eval() {
    return value;
  }

  /**
   * The expression text of a literal. Integral values print without a fractional part, so
   * {@code 2 * p} reads as {@code (2 * m.p)}; negative values are bracketed, so {@code -2 ** p}
   * reads as {@code ((-2) ** m.p)} and parses back with the same meaning.
   */
  static String format(double value) {
    String text;
    if (value == Math.rint(value) && Math.abs(value) < 1e15) {
      text = Long.toString((long) Math.abs(value));
    } else {
      text = NumberFormats.formatShortest(Math.abs(value));
    }
    return value < 0 ? "(-" + text + ")" : text;
  }
}
