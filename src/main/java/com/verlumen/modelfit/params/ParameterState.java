package com.verlumen.modelfit.params;

import com.google.auto.value.AutoValue;
import java.util.Optional;

/**
 * The stored settings of a {@link Parameter}, detached from the parameter itself.
 *
 * <p>A linked parameter records the full name of its link target rather than the target, so the
 * topology can be rebuilt against a different set of parameter instances.
 */
@AutoValue
public abstract class ParameterState {
  public abstract String fullName();

  public abstract double val();

  public abstract double min();

  public abstract double max();

  public abstract double defaultVal();

  public abstract double defaultMin();

  public abstract double defaultMax();

  /** The stored frozen flag, which may differ from what a linked parameter reports. */
  public abstract boolean frozen();

  public abstract boolean guessed();

  public abstract Optional<String> link();

  public static Builder builder() {
    return new AutoValue_ParameterState.Builder();
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setFullName(String fullName);

    public abstract Builder setVal(double val);

    public abstract Builder setMin(double min);

    public abstract Builder setMax(double max);

    public abstract Builder setDefaultVal(double defaultVal);

    public abstract Builder setDefaultMin(double defaultMin);

    public abstract Builder setDefaultMax(double defaultMax);

    public abstract Builder setFrozen(boolean frozen);

    public abstract Builder setGuessed(boolean guessed);

    public abstract Builder setLink(String link);

    public abstract ParameterState build();
  }
}
