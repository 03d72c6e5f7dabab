package com.verlumen.modelfit.params;

import com.google.auto.value.AutoValue;

/**
 * Records that changing a soft limit moved the parameter value to stay inside the new range.
 *
 * <p>Returned by the limit setters of {@link Parameter} so callers can report the change
 * themselves; the parameter also logs it.
 */
@AutoValue
public abstract class ValueAdjustment {
  /** Which soft limit was being changed. */
  public enum Limit {
    MIN("minimum"),
    MAX("maximum");

    private final String label;

    Limit(String label) {
      this.label = label;
    }

    public String getLabel() {
      return label;
    }
  }

  public abstract String fullName();

  public abstract Limit limit();

  public abstract double previousValue();

  public abstract double newValue();

  static ValueAdjustment create(
      String fullName, Limit limit, double previousValue, double newValue) {
    return new AutoValue_ValueAdjustment(fullName, limit, previousValue, newValue);
  }
}
