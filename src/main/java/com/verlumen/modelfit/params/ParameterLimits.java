package com.verlumen.modelfit.params;

/**
 * Default magnitudes for parameter limits.
 *
 * <p>Values are stored as doubles but the defaults are the single-precision extremes, so that
 * parameters stay usable by model libraries written against 32-bit floats.
 */
public final class ParameterLimits {
  /** Largest finite 32-bit float, the default hard and soft maximum. */
  public static final double HUGE_VAL = Float.MAX_VALUE;

  /** Smallest positive normal 32-bit float. */
  public static final double TINY_VAL = Float.MIN_NORMAL;

  private ParameterLimits() {}
}
