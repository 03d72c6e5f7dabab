package com.verlumen.modelfit.params;

import static com.google.common.base.Verify.verify;

import com.google.common.collect.ImmutableList;
import java.util.Iterator;

/**
 * An expression node combining parameters into a derived value.
 *
 * <p>A composite has no stored value: {@link #getVal()} evaluates the expression every time, so
 * the result always reflects the current values of the parameters it is built from. Its full
 * name is the expression text, for example {@code (mdl.a + mdl.b)}.
 *
 * <p>Iterating a composite walks every part it contains, directly or through nested composites.
 * Direct parts come first, each followed by the parts it contains; duplicates are kept.
 */
public abstract class CompositeParameter extends Parameter {
  private final ImmutableList<Parameter> parts;

  protected CompositeParameter(String expression, ImmutableList<Parameter> parts) {
    super(expression);
    this.parts = parts;
  }

  /** The direct parts of this expression. */
  public ImmutableList<Parameter> getParts() {
    return parts;
  }

  /** Evaluates the expression from the current values of its parts. */
  public abstract double eval();

  @Override
  public final double getVal() {
    return eval();
  }

  @Override
  public final double getDefaultVal() {
    return eval();
  }

  @Override
  public Iterator<Parameter> iterator() {
    return flatten().iterator();
  }

  private ImmutableList<Parameter> flatten() {
    ImmutableList.Builder<Parameter> flattened = ImmutableList.builder();
    for (Parameter part : parts) {
      verify(
          part != this, "'%s' object holds a reference to itself", getClass().getSimpleName());
      flattened.add(part);
      if (part instanceof CompositeParameter) {
        flattened.addAll(((CompositeParameter) part).flatten());
      }
    }
    return flattened.build();
  }
}
