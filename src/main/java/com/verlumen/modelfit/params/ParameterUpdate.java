package com.verlumen.modelfit.params;

import com.google.auto.value.AutoValue;
import java.util.Optional;

/**
 * A batch of settings for {@link Parameter#set(ParameterUpdate)}. Unset fields are left alone.
 */
@AutoValue
public abstract class ParameterUpdate {
  public abstract Optional<Double> val();

  public abstract Optional<Double> min();

  public abstract Optional<Double> max();

  public abstract Optional<Boolean> frozen();

  public abstract Optional<Double> defaultVal();

  public abstract Optional<Double> defaultMin();

  public abstract Optional<Double> defaultMax();

  public static Builder builder() {
    return new AutoValue_ParameterUpdate.Builder();
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setVal(Double val);

    public abstract Builder setMin(Double min);

    public abstract Builder setMax(Double max);

    public abstract Builder setFrozen(Boolean frozen);

    public abstract Builder setDefaultVal(Double defaultVal);

    public abstract Builder setDefaultMin(Double defaultMin);

    public abstract Builder setDefaultMax(Double defaultMax);

    public abstract ParameterUpdate build();
  }
}
