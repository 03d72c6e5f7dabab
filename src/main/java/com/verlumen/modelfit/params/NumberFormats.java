package com.verlumen.modelfit.params;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Text forms of parameter values shared by messages, dumps and the HTML renderer.
 *
 * <p>Both forms use a lower-case exponent with a sign and at least two digits ({@code 1e-05},
 * {@code 3.40282e+38}) and write non-finite values as {@code nan}, {@code inf} and {@code -inf}.
 */
public final class NumberFormats {
  private static final MathContext GENERAL_PRECISION = new MathContext(6, RoundingMode.HALF_EVEN);

  /**
   * The shortest text that reads back as {@code value}: {@code 2.0}, {@code 0.1}, {@code 1e-05},
   * {@code 3.4028234663852886e+38}. Plain notation is used for decimal exponents from -4 to 15.
   */
  public static String formatShortest(double value) {
    if (!Double.isFinite(value)) {
      return nonFinite(value);
    }
    BigDecimal digits = new BigDecimal(Double.toString(Math.abs(value))).stripTrailingZeros();
    int exponent = exponentOf(digits);
    String body;
    if (exponent < -4 || exponent >= 16) {
      body = scientific(digits, exponent);
    } else {
      body = digits.toPlainString();
      if (body.indexOf('.') < 0) {
        body += ".0";
      }
    }
    return sign(value) + body;
  }

  /**
   * Six significant digits with trailing zeros removed, the {@code %g} style: {@code 10},
   * {@code 0.25}, {@code 3.40282e+38}. Plain notation is used for decimal exponents from -4 to 5.
   */
  public static String formatGeneral(double value) {
    if (!Double.isFinite(value)) {
      return nonFinite(value);
    }
    if (value == 0) {
      return sign(value) + "0";
    }
    BigDecimal rounded =
        new BigDecimal(Math.abs(value)).round(GENERAL_PRECISION).stripTrailingZeros();
    int exponent = exponentOf(rounded);
    String body =
        exponent < -4 || exponent >= 6 ? scientific(rounded, exponent) : rounded.toPlainString();
    return sign(value) + body;
  }

  /** Decimal exponent of the leading digit. */
  private static int exponentOf(BigDecimal value) {
    return value.precision() - 1 - value.scale();
  }

  private static String scientific(BigDecimal value, int exponent) {
    String digits = value.unscaledValue().toString();
    StringBuilder out = new StringBuilder().append(digits.charAt(0));
    if (digits.length() > 1) {
      out.append('.').append(digits, 1, digits.length());
    }
    out.append('e').append(exponent < 0 ? '-' : '+');
    int magnitude = Math.abs(exponent);
    if (magnitude < 10) {
      out.append('0');
    }
    return out.append(magnitude).toString();
  }

  private static String sign(double value) {
    return Double.doubleToRawLongBits(value) < 0 ? "-" : "";
  }

  private static String nonFinite(double value) {
    if (Double.isNaN(value)) {
      return "nan";
    }
    return value > 0 ? "inf" : "-inf";
  }

  private NumberFormats() {}
}
