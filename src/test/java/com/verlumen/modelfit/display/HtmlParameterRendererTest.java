package com.verlumen.modelfit.display;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.verlumen.modelfit.model.ParameterGroup;
import com.verlumen.modelfit.params.Parameter;
import com.verlumen.modelfit.params.ParameterLimits;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class HtmlParameterRendererTest {
  @Inject private ParameterRenderer renderer;

  @Before
  public void setUp() {
    Guice.createInjector(DisplayModule.create()).injectMembers(this);
  }

  @Test
  public void injector_bindsHtmlRenderer() {
    assertThat(renderer).isInstanceOf(HtmlParameterRenderer.class);
  }

  @Test
  public void formatValue_defaultLimits_showAsMax() {
    Parameter par = new Parameter("mdl", "eta", 2);

    assertThat(HtmlParameterRenderer.formatValue(par, par.getMax())).isEqualTo("MAX");
    assertThat(HtmlParameterRenderer.formatValue(par, par.getMin())).isEqualTo("-MAX");
  }

  @Test
  public void formatValue_tinyValues_showAsTiny() {
    Parameter par = new Parameter("mdl", "eta", 2);

    assertThat(HtmlParameterRenderer.formatValue(par, ParameterLimits.TINY_VAL))
        .isEqualTo("TINY");
    assertThat(HtmlParameterRenderer.formatValue(par, -ParameterLimits.TINY_VAL))
        .isEqualTo("-TINY");
  }

  @Test
  public void formatValue_radians_showPiSymbolically() {
    Parameter angle = Parameter.builder("mdl", "theta", 0).setUnits("radians").build();

    assertThat(HtmlParameterRenderer.formatValue(angle, Math.PI)).isEqualTo("&#960;");
    assertThat(HtmlParameterRenderer.formatValue(angle, -Math.PI)).isEqualTo("-&#960;");
    assertThat(HtmlParameterRenderer.formatValue(angle, 2 * Math.PI)).isEqualTo("2&#960;");
    assertThat(HtmlParameterRenderer.formatValue(angle, -2 * Math.PI)).isEqualTo("-2&#960;");
  }

  @Test
  public void formatValue_piWithoutRadians_isNumeric() {
    Parameter par = Parameter.builder("mdl", "theta", 0).setUnits("deg").build();

    assertThat(HtmlParameterRenderer.formatValue(par, Math.PI)).isEqualTo("3.141592653589793");
  }

  @Test
  public void formatValue_smallValue_usesLowerCaseExponent() {
    Parameter par = new Parameter("mdl", "eta", 2);

    assertThat(HtmlParameterRenderer.formatValue(par, 1e-5)).isEqualTo("1e-05");
    assertThat(HtmlParameterRenderer.formatValue(par, 2)).isEqualTo("2.0");
  }

  @Test
  public void stripOuterBrackets_enclosingPair_isRemoved() {
    assertThat(HtmlParameterRenderer.stripOuterBrackets("(a.b + 1)")).isEqualTo("a.b + 1");
    assertThat(HtmlParameterRenderer.stripOuterBrackets("((a.b + 1) * 2)"))
        .isEqualTo("(a.b + 1) * 2");
  }

  @Test
  public void stripOuterBrackets_separatePairs_areKept() {
    assertThat(HtmlParameterRenderer.stripOuterBrackets("(a) + (b)")).isEqualTo("(a) + (b)");
    assertThat(HtmlParameterRenderer.stripOuterBrackets("abs(a.b)")).isEqualTo("abs(a.b)");
    assertThat(HtmlParameterRenderer.stripOuterBrackets("a.b")).isEqualTo("a.b");
  }

  @Test
  public void render_parameter_includesEscapedFallbackText() {
    String html = renderer.render(new Parameter("mdl", "eta", 2));

    assertThat(html)
        .startsWith(
            "<div class=\"modelfit-text-fallback\">"
                + "&lt;Parameter &#39;eta&#39; of model &#39;mdl&#39;&gt;</div>");
    assertThat(html).contains("<details open><summary>Parameter</summary>");
    assertThat(html).endsWith("</details></div>");
  }

  @Test
  public void render_thawedParameter_showsCheckedBoxAndLimits() {
    Parameter par = Parameter.builder("mdl", "eta", 2).setMin(0).setUnits("keV").build();

    String html = renderer.render(par);

    assertThat(html)
        .contains(
            "<tr><th class=\"model-odd\">mdl</th><td>eta</td>"
                + "<td><input disabled type=\"checkbox\" checked></input></td>"
                + "<td>2.0</td><td>0.0</td><td>MAX</td><td>keV</td></tr>");
  }

  @Test
  public void render_frozenParameter_showsUncheckedBox() {
    Parameter par = new Parameter("mdl", "eta", 2);
    par.freeze();

    assertThat(renderer.render(par))
        .contains("<td><input disabled type=\"checkbox\"></input></td>");
  }

  @Test
  public void render_linkedParameter_showsLinkExpression() {
    Parameter source = new Parameter("src", "x", 3);
    Parameter par = new Parameter("mdl", "eta", 2);
    par.setLink(source.plus(1));

    String html = renderer.render(par);

    assertThat(html).contains("<td>linked</td><td>4.0</td>");
    assertThat(html).contains("<td colspan=\"2\">&#8656; src.x + 1</td>");
  }

  @Test
  public void render_group_skipsHiddenParametersAndSpansRows() {
    Parameter a = new Parameter("pl", "a", 1);
    Parameter hidden = Parameter.builder("pl", "h", 1).setHidden(true).build();
    Parameter b = new Parameter("pl", "b", 2);

    String html = renderer.render(ParameterGroup.of("pl", ImmutableList.of(a, hidden, b)));

    assertThat(html).startsWith("<div class=\"modelfit-text-fallback\">&lt;Model &#39;pl&#39;&gt;");
    assertThat(html).contains("<th class=\"model-odd\" scope=\"rowgroup\" rowspan=2>pl</th>");
    assertThat(html).contains("<td>a</td>");
    assertThat(html).contains("<tr><td>b</td>");
    assertThat(html).doesNotContain("<td>h</td>");
  }

  @Test
  public void render_escapesUnits() {
    Parameter par = Parameter.builder("mdl", "eta", 2).setUnits("<b>").build();

    assertThat(renderer.render(par)).contains("<td>&lt;b&gt;</td>");
  }
}
