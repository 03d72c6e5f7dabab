package com.verlumen.modelfit.params;

/**
 * Thrown when an operation on a {@link Parameter} would break one of its contracts: a value or
 * limit outside its bounds, an invalid link, or an attempt to thaw an always-frozen parameter.
 *
 * <p>The {@link Kind} identifies which contract was violated; callers that treat some violations
 * as recoverable (for example a fit rejecting a trial point) switch on it.
 */
public final class ParameterErr extends RuntimeException {
  private static final long serialVersionUID = 1L;

  /** The reason a parameter operation was rejected. */
  public enum Kind {
    EDGE,
    NOT_LINK,
    FROZEN_NO_LINK,
    LINK_CYCLE,
    ALWAYS_FROZEN
  }

  private final Kind kind;

  private ParameterErr(Kind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public Kind getKind() {
    return kind;
  }

  /**
   * A value or limit lies outside a bound.
   *
   * @param fullName the parameter's full name
   * @param boundKind one of "minimum", "maximum", "hard minimum" or "hard maximum"
   * @param bound the violated bound
   */
  static ParameterErr edge(String fullName, String boundKind, double bound) {
    return new ParameterErr(
        Kind.EDGE,
        String.format(
            "parameter %s has a %s of %s",
            fullName, boundKind, NumberFormats.formatGeneral(bound)));
  }

  static ParameterErr notLink() {
    return new ParameterErr(
        Kind.NOT_LINK, "link value must be a parameter or a parameter expression");
  }

  static ParameterErr frozenNoLink(String fullName) {
    return new ParameterErr(
        Kind.FROZEN_NO_LINK,
        String.format("parameter %s is always frozen and cannot be linked", fullName));
  }

  static ParameterErr linkCycle() {
    return new ParameterErr(
        Kind.LINK_CYCLE, "requested parameter link creates a cyclic reference");
  }

  static ParameterErr alwaysFrozen(String fullName) {
    return new ParameterErr(
        Kind.ALWAYS_FROZEN,
        String.format("parameter %s is always frozen and cannot be thawed", fullName));
  }
}
