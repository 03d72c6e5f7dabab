package com.verlumen.modelfit.params;

import java.util.function.DoubleBinaryOperator;

/**
 * Two-argument operators available in parameter expressions.
 *
 * <p>Floor division rounds towards negative infinity and the remainder takes the sign of the
 * divisor. Both are derived from the exact remainder {@code a - b * trunc(a / b)}, so that
 * {@code a // b} and {@code a % b} satisfy {@code b * (a // b) + a % b == a} up to rounding of the
 * final sum; {@code 1.0 // 0.1} is therefore 9, not {@code floor(1.0 / 0.1)} which is 10.
 */
public enum BinaryOp {
  ADD("+", (a, b) -> a + b),
  SUBTRACT("-", (a, b) -> a - b),
  MULTIPLY("*", (a, b) -> a * b),
  DIVIDE("/", (a, b) -> a / b),
  FLOOR_DIVIDE("//", BinaryOp::floorDivide),
  MODULO("%", BinaryOp::remainder),
  POWER("**", Math::pow);

  private final String symbol;
  private final DoubleBinaryOperator function;

  BinaryOp(String symbol, DoubleBinaryOperator function) {
    this.symbol = symbol;
    this.function = function;
  }

  public String getSymbol() {
    return symbol;
  }

  public double evaluate(double lhs, double rhs) {
    return function.applyAsDouble(lhs, rhs);
  }

  /**
   * Builds {@code lhs OP rhs}. Either side may be a {@link Parameter} or a number.
   *
   * @throws IllegalArgumentException if a side is neither a parameter nor a number
   */
  public BinaryOpParameter combine(Object lhs, Object rhs) {
    return new BinaryOpParameter(BinaryOpParameter.wrap(lhs), BinaryOpParameter.wrap(rhs), this);
  }

  private static double floorDivide(double a, double b) {
    if (b == 0) {
      return a / b;
    }
    double mod = a % b;
    double div = (a - mod) / b;
    if (mod != 0 && (b < 0) != (mod < 0)) {
      div -= 1;
    }
    if (div == 0) {
      return Math.copySign(0, a / b);
    }
    double floorDiv = Math.floor(div);
    if (div - floorDiv > 0.5) {
      floorDiv += 1;
    }
    return floorDiv;
  }

  private static double remainder(double a, double b) {
    if (b == 0 || Double.isInfinite(a)) {
      return Double.NaN;
    }
    double r = a % b;
    if (r != 0 && (r < 0) != (b < 0)) {
      r += b;
    }
    return r;
  }
}
