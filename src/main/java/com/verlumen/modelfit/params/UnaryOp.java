package com.verlumen.modelfit.params;

import java.util.function.DoubleUnaryOperator;

/** One-argument operators available in parameter expressions. */
public enum UnaryOp {
  NEGATE("-", v -> -v),
  ABS("abs", Math::abs);

  private final String symbol;
  private final DoubleUnaryOperator function;

  UnaryOp(String symbol, DoubleUnaryOperator function) {
    this.symbol = symbol;
    this.function = function;
  }

  public String getSymbol() {
    return symbol;
  }

  public double evaluate(double value) {
    return function.applyAsDouble(value);
  }

  public UnaryOpParameter applyTo(Parameter arg) {
    return new UnaryOpParameter(arg, this);
  }
}
