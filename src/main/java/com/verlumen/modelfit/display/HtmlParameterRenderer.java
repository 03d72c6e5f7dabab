package com.verlumen.modelfit.display;

import static com.verlumen.modelfit.params.ParameterLimits.HUGE_VAL;
import static com.verlumen.modelfit.params.ParameterLimits.TINY_VAL;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.escape.Escaper;
import com.google.common.html.HtmlEscapers;
import com.google.inject.Inject;
import com.verlumen.modelfit.model.ParameterGroup;
import com.verlumen.modelfit.params.NumberFormats;
import com.verlumen.modelfit.params.Parameter;

/**
 * Renders parameters as HTML tables.
 *
 * <p>The default limits show as {@code MAX}/{@code -MAX}, the smallest normal single-precision
 * value as {@code TINY}/{@code -TINY}, and for angles in radians the values π and 2π are written
 * symbolically. A linked parameter shows its link expression in place of its limits.
 */
final class HtmlParameterRenderer implements ParameterRenderer {
  private static final Escaper ESCAPER = HtmlEscapers.htmlEscaper();
  private static final ImmutableList<String> COLUMNS =
      ImmutableList.of("Component", "Parameter", "Thawed", "Value", "Min", "Max", "Units");
  private static final ImmutableSet<String> RADIAN_UNITS = ImmutableSet.of("radian", "radians");
  private static final String PI = "&#960;";
  // Double left arrow.
  private static final String LINK_ARROW = "&#8656;";

  @Inject
  HtmlParameterRenderer() {}

  @Override
  public String render(Parameter par) {
    StringBuilder out = new StringBuilder();
    appendHeader(out);
    out.append("<tbody>");
    appendRow(out, par, par.getModelName(), 1);
    out.append("</tbody></table>");
    return wrap(par.toShortString(), "Parameter", out.toString());
  }

  @Override
  public String render(ParameterGroup group) {
    ImmutableList<Parameter> shown =
        group.getPars().stream()
            .filter(par -> !par.isHidden())
            .collect(ImmutableList.toImmutableList());
    StringBuilder out = new StringBuilder();
    appendHeader(out);
    out.append("<tbody>");
    boolean first = true;
    for (Parameter par : shown) {
      appendRow(out, par, first ? group.getName() : null, shown.size());
      first = false;
    }
    out.append("</tbody></table>");
    return wrap("<Model '" + group.getName() + "'>", "Model", out.toString());
  }

  private static void appendHeader(StringBuilder out) {
    out.append("<table class=\"model\"><thead><tr>");
    for (String column : COLUMNS) {
      out.append("<th>").append(column).append("</th>");
    }
    out.append("</tr></thead>");
  }

  /** Appends one row; the component cell is only written when {@code component} is non-null. */
  private static void appendRow(StringBuilder out, Parameter par, String component, int rows) {
    out.append("<tr>");
    if (component != null) {
      out.append("<th class=\"model-odd\"");
      if (rows > 1) {
        out.append(" scope=\"rowgroup\" rowspan=").append(rows);
      }
      out.append(">").append(ESCAPER.escape(component)).append("</th>");
    }
    out.append("<td>").append(ESCAPER.escape(par.getName())).append("</td>");

    boolean linked = par.getLink() != null;
    if (linked) {
      out.append("<td>linked</td>");
    } else {
      out.append("<td><input disabled type=\"checkbox\"");
      if (!par.isFrozen()) {
        out.append(" checked");
      }
      out.append("></input></td>");
    }

    appendValue(out, par, par.getVal());
    if (linked) {
      String expression = stripOuterBrackets(par.getLink().getFullName());
      out.append("<td colspan=\"2\">")
          .append(LINK_ARROW)
          .append(" ")
          .append(ESCAPER.escape(expression))
          .append("</td>");
    } else {
      appendValue(out, par, par.getMin());
      appendValue(out, par, par.getMax());
    }

    out.append("<td>").append(ESCAPER.escape(par.getUnits())).append("</td>");
    out.append("</tr>");
  }

  private static void appendValue(StringBuilder out, Parameter par, double value) {
    out.append("<td>").append(formatValue(par, value)).append("</td>");
  }

  static String formatValue(Parameter par, double value) {
    if (value == HUGE_VAL) {
      return "MAX";
    } else if (value == -HUGE_VAL) {
      return "-MAX";
    } else if (value == TINY_VAL) {
      return "TINY";
    } else if (value == -TINY_VAL) {
      return "-TINY";
    }

    if (RADIAN_UNITS.contains(par.getUnits())) {
      double tau = 2 * Math.PI;
      if (value == tau) {
        return "2" + PI;
      } else if (value == -tau) {
        return "-2" + PI;
      } else if (value == Math.PI) {
        return PI;
      } else if (value == -Math.PI) {
        return "-" + PI;
      }
    }

    return NumberFormats.formatShortest(value);
  }

  /** Removes one pair of brackets enclosing the whole expression, if present. */
  static String stripOuterBrackets(String expression) {
    if (!expression.startsWith("(") || !expression.endsWith(")")) {
      return expression;
    }
    int depth = 0;
    for (int i = 0; i < expression.length() - 1; i++) {
      char c = expression.charAt(i);
      if (c == '(') {
        depth++;
      } else if (c == ')') {
        depth--;
      }
      if (depth == 0) {
        // The opening bracket closes before the end.
        return expression;
      }
    }
    return expression.substring(1, expression.length() - 1);
  }

  private static String wrap(String summary, String title, String table) {
    return "<div class=\"modelfit-text-fallback\">"
        + ESCAPER.escape(summary)
        + "</div><div hidden class=\"modelfit\"><details open><summary>"
        + title
        + "</summary>"
        + table
        + "</details></div>";
  }
}
