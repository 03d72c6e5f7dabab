package com.verlumen.modelfit.params;

import static com.google.common.truth.Truth.assertThat;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class NumberFormatsTest {
  @Test
  public void formatShortest_plainRange_keepsOneFractionDigit() {
    assertThat(NumberFormats.formatShortest(2)).isEqualTo("2.0");
    assertThat(NumberFormats.formatShortest(0.1)).isEqualTo("0.1");
    assertThat(NumberFormats.formatShortest(-3.5)).isEqualTo("-3.5");
    assertThat(NumberFormats.formatShortest(0.0001)).isEqualTo("0.0001");
    assertThat(NumberFormats.formatShortest(1.5e15)).isEqualTo("1500000000000000.0");
  }

  @Test
  public void formatShortest_zero_keepsSign() {
    assertThat(NumberFormats.formatShortest(0.0)).isEqualTo("0.0");
    assertThat(NumberFormats.formatShortest(-0.0)).isEqualTo("-0.0");
  }

  @Test
  public void formatShortest_outsidePlainRange_usesExponent() {
    assertThat(NumberFormats.formatShortest(1e-5)).isEqualTo("1e-05");
    assertThat(NumberFormats.formatShortest(2.5e-7)).isEqualTo("2.5e-07");
    assertThat(NumberFormats.formatShortest(1e16)).isEqualTo("1e+16");
    assertThat(NumberFormats.formatShortest(-ParameterLimits.HUGE_VAL))
        .isEqualTo("-3.4028234663852886e+38");
    assertThat(NumberFormats.formatShortest(1e100)).isEqualTo("1e+100");
  }

  @Test
  public void formatGeneral_integral_dropsFraction() {
    assertThat(NumberFormats.formatGeneral(10)).isEqualTo("10");
    assertThat(NumberFormats.formatGeneral(-10)).isEqualTo("-10");
    assertThat(NumberFormats.formatGeneral(0)).isEqualTo("0");
    assertThat(NumberFormats.formatGeneral(123456)).isEqualTo("123456");
  }

  @Test
  public void formatGeneral_roundsToSixDigits() {
    assertThat(NumberFormats.formatGeneral(0.25)).isEqualTo("0.25");
    assertThat(NumberFormats.formatGeneral(Math.PI)).isEqualTo("3.14159");
    assertThat(NumberFormats.formatGeneral(1234567)).isEqualTo("1.23457e+06");
    assertThat(NumberFormats.formatGeneral(999999.5)).isEqualTo("1e+06");
    assertThat(NumberFormats.formatGeneral(ParameterLimits.HUGE_VAL)).isEqualTo("3.40282e+38");
    assertThat(NumberFormats.formatGeneral(1e-5)).isEqualTo("1e-05");
  }

  @Test
  public void nonFinite_usesKeywords() {
    assertThat(NumberFormats.formatShortest(Double.NaN)).isEqualTo("nan");
    assertThat(NumberFormats.formatGeneral(Double.POSITIVE_INFINITY)).isEqualTo("inf");
    assertThat(NumberFormats.formatGeneral(Double.NEGATIVE_INFINITY)).isEqualTo("-inf");
  }
}
