package com.verlumen.modelfit.params;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;

/**
 * Combines two parameter expressions with a {@link BinaryOp}.
 *
 * @see UnaryOpParameter
 */
public final class BinaryOpParameter extends CompositeParameter {
  private final Parameter lhs;
  private final Parameter rhs;
  private final BinaryOp op;

  public BinaryOpParameter(Parameter lhs, Parameter rhs, BinaryOp op) {
    super(
        "(" + checkNotNull(lhs).getFullName() + " " + op.getSymbol() + " "
            + checkNotNull(rhs).getFullName() + ")",
        ImmutableList.of(lhs, rhs));
    this.lhs = lhs;
    this.rhs = rhs;
    this.op = op;
  }

  /**
   * Returns {@code obj} if it is already a parameter, otherwise wraps a number in a
   * {@link ConstantParameter}.
   *
   * @throws IllegalArgumentException if {@code obj} is neither a parameter nor a number
   */
  public static Parameter wrap(Object obj) {
    if (obj instanceof Parameter) {
      return (Parameter) obj;
    }
    if (obj instanceof Number) {
      return new ConstantParameter(((Number) obj).doubleValue());
    }
    throw new IllegalArgumentException(
        "Expected a parameter or a number but got: " + obj);
  }

  public Parameter getLhs() {
    return lhs;
  }

  public Parameter getRhs() {
    return rhs;
  }

  public BinaryOp getOp() {
    return op;
  }

  @Override
  public double eval() {
    return op.evaluate(lhs.getVal(), rhs.getVal());
  }
}
