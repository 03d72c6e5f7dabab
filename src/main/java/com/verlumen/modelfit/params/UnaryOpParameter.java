package com.verlumen.modelfit.params;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;

/**
 * Applies a {@link UnaryOp} to a parameter expression.
 *
 * @see BinaryOpParameter
 */
public final class UnaryOpParameter extends CompositeParameter {
  private final Parameter arg;
  private final UnaryOp op;

  public UnaryOpParameter(Parameter arg, UnaryOp op) {
    super(op.getSymbol() + "(" + checkNotNull(arg).getFullName() + ")", ImmutableList.of(arg));
    this.arg = arg;
    this.op = checkNotNull(op);
  }

  public Parameter getArg() {
    return arg;
  }

  public UnaryOp getOp() {
    return op;
  }

  @Override
  public double eval() {
    return op.evaluate(arg.getVal());
  }
}
