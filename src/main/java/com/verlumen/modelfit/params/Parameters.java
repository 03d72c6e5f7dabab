package com.verlumen.modelfit.params;

/**
 * Static helpers for expressions whose left-hand side is a plain number, the counterparts of the
 * instance methods on {@link Parameter}. {@code Parameters.minus(10, a)} builds {@code (10 - a)}.
 */
public final class Parameters {
  public static BinaryOpParameter plus(double lhs, Parameter rhs) {
    return BinaryOp.ADD.combine(lhs, rhs);
  }

  public static BinaryOpParameter minus(double lhs, Parameter rhs) {
    return BinaryOp.SUBTRACT.combine(lhs, rhs);
  }

  public static BinaryOpParameter times(double lhs, Parameter rhs) {
    return BinaryOp.MULTIPLY.combine(lhs, rhs);
  }

  public static BinaryOpParameter div(double lhs, Parameter rhs) {
    return BinaryOp.DIVIDE.combine(lhs, rhs);
  }

  public static BinaryOpParameter floorDiv(double lhs, Parameter rhs) {
    return BinaryOp.FLOOR_DIVIDE.combine(lhs, rhs);
  }

  public static BinaryOpParameter mod(double lhs, Parameter rhs) {
    return BinaryOp.MODULO.combine(lhs, rhs);
  }

  public static BinaryOpParameter pow(double lhs, Parameter rhs) {
    return BinaryOp.POWER.combine(lhs, rhs);
  }

  private Parameters() {}
}
