package com.verlumen.modelfit.model;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.FluentLogger;
import com.verlumen.modelfit.params.Parameter;
import com.verlumen.modelfit.params.ParameterState;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * The parameters of one model component, in declaration order.
 *
 * <p>Parameters are looked up by name or alias without regard to case. The thawed parameters,
 * those that are neither frozen nor linked, are the ones a fit is allowed to vary; their values
 * are exchanged with the optimizer as plain lists in declaration order.
 */
public final class ParameterGroup implements Iterable<Parameter> {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final String name;
  private final ImmutableList<Parameter> pars;
  private final ImmutableMap<String, Parameter> byName;

  private ParameterGroup(String name, ImmutableList<Parameter> pars) {
    this.name = checkNotNull(name);
    this.pars = pars;

    Map<String, Parameter> names = new HashMap<>();
    for (Parameter par : pars) {
      checkArgument(
          par.getModelName().equals(name),
          "Parameter %s does not belong to model %s",
          par.getFullName(),
          name);
      addName(names, par.getName(), par);
      for (String alias : par.getAliases()) {
        addName(names, alias, par);
      }
    }
    this.byName = ImmutableMap.copyOf(names);
  }

  private static void addName(Map<String, Parameter> names, String key, Parameter par) {
    Parameter previous = names.put(Ascii.toLowerCase(key), par);
    checkArgument(
        previous == null || previous == par,
        "Name %s is used by both %s and %s",
        key,
        previous == null ? null : previous.getFullName(),
        par.getFullName());
  }

  public static ParameterGroup of(String name, Parameter... pars) {
    return new ParameterGroup(name, ImmutableList.copyOf(pars));
  }

  public static ParameterGroup of(String name, List<Parameter> pars) {
    return new ParameterGroup(name, ImmutableList.copyOf(pars));
  }

  public String getName() {
    return name;
  }

  public ImmutableList<Parameter> getPars() {
    return pars;
  }

  @Override
  public Iterator<Parameter> iterator() {
    return pars.iterator();
  }

  /** Finds a parameter by name or alias, ignoring case. */
  public Optional<Parameter> find(String nameOrAlias) {
    return Optional.ofNullable(byName.get(Ascii.toLowerCase(nameOrAlias)));
  }

  /**
   * Returns the parameter with the given name or alias, ignoring case.
   *
   * @throws IllegalArgumentException if there is no such parameter
   */
  public Parameter get(String nameOrAlias) {
    return find(nameOrAlias)
        .orElseThrow(
            () ->
                new IllegalArgumentException(
                    String.format("Model %s has no parameter %s", name, nameOrAlias)));
  }

  /** The parameters a fit may vary: not frozen and not linked. */
  public ImmutableList<Parameter> getThawedPars() {
    return pars.stream().filter(par -> !par.isFrozen()).collect(toImmutableList());
  }

  public ImmutableList<Double> getThawedParValues() {
    return getThawedPars().stream().map(Parameter::getVal).collect(toImmutableList());
  }

  public ImmutableList<Double> getThawedParMins() {
    return getThawedPars().stream().map(Parameter::getMin).collect(toImmutableList());
  }

  public ImmutableList<Double> getThawedParMaxes() {
    return getThawedPars().stream().map(Parameter::getMax).collect(toImmutableList());
  }

  /**
   * Sets the thawed parameters from {@code values}, in the order of {@link #getThawedPars()}.
   * The default values are kept, so {@link #reset()} undoes the change.
   *
   * @throws IllegalArgumentException if the number of values does not match
   * @throws com.verlumen.modelfit.params.ParameterErr if a value is outside its limits; earlier
   *     parameters keep their new values
   */
  public void setThawedParValues(List<Double> values) {
    ImmutableList<Parameter> thawed = getThawedPars();
    checkArgument(
        values.size() == thawed.size(),
        "Model %s has %s thawed parameters but got %s values",
        name,
        thawed.size(),
        values.size());
    for (int i = 0; i < thawed.size(); i++) {
      thawed.get(i).applyFitValue(values.get(i));
    }
  }

  public void freezeAll() {
    pars.forEach(Parameter::freeze);
  }

  /** Thaws every parameter that is not always frozen. */
  public void thawAll() {
    pars.stream().filter(par -> !par.isAlwaysFrozen()).forEach(Parameter::thaw);
  }

  public void reset() {
    pars.forEach(Parameter::reset);
  }

  public ImmutableList<ParameterState> snapshot() {
    return pars.stream().map(Parameter::snapshot).collect(toImmutableList());
  }

  /**
   * Reapplies a {@link #snapshot()}. Values and limits are restored first and links last, so a
   * link may refer to a parameter restored later in the list.
   *
   * @param resolver maps the full names used in link expressions to parameters
   * @throws IllegalArgumentException if a state names a parameter outside this group
   */
  public void restore(
      List<ParameterState> states, Function<String, Optional<Parameter>> resolver) {
    for (ParameterState state : states) {
      forState(state).restore(state);
    }
    for (ParameterState state : states) {
      if (state.link().isPresent()) {
        Parameter par = forState(state);
        par.restoreLink(state, resolver);
        logger.atFine().log("restored link %s -> %s", par.getFullName(), state.link().get());
      }
    }
  }

  /** Same as {@link #restore(List, Function)} with links resolved inside this group. */
  public void restore(List<ParameterState> states) {
    restore(states, this::resolveLocal);
  }

  private Optional<Parameter> resolveLocal(String fullName) {
    return pars.stream().filter(par -> par.getFullName().equals(fullName)).findFirst();
  }

  private Parameter forState(ParameterState state) {
    return resolveLocal(state.fullName())
        .orElseThrow(
            () ->
                new IllegalArgumentException(
                    String.format(
                        "Model %s has no parameter %s", name, state.fullName())));
  }
}
