/*
Copyright (c) 2025 James Ahlborn

Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
You may obtain a copy of the License at

    http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/

package com.healthmarketscience.calc.impl.expr;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Formats double values for display, both as final results and as operand
 * values within trace step descriptions.
 *
 * @author James Ahlborn
 */
public class NumberFormatter
{
  public static final RoundingMode ROUND_MODE = RoundingMode.HALF_EVEN;

  public static final int DEFAULT_FRACTION_DIGITS = 6;

  /** results larger than this are displayed in scientific notation */
  private static final double SCI_UPPER_BOUND = 1e10;
  /** non-zero results smaller than this are displayed in scientific
      notation */
  private static final double SCI_LOWER_BOUND = 1e-5;

  private static final String NAN_STR = "NaN";
  private static final String POS_INF_STR = "inf";
  private static final String NEG_INF_STR = "-inf";

  private NumberFormatter() {}

  /**
   * Formats the given result using the default number of fraction digits.
   */
  public static String format(double d) {
    return format(d, DEFAULT_FRACTION_DIGITS);
  }

  /**
   * Formats the given result for display.  Very large and very small values
   * are formatted in scientific notation with exactly the given number of
   * mantissa fraction digits (e.g. "1.234568e10"), all other values are
   * rounded to the given number of fraction digits and trailing zeros are
   * dropped (e.g. "2.5").
   */
  public static String format(double d, int fractionDigits) {
    if(fractionDigits < 0) {
      throw new IllegalArgumentException(
          "Invalid fraction digits " + fractionDigits);
    }

    String specialStr = formatSpecial(d);
    if(specialStr != null) {
      return specialStr;
    }

    double absVal = Math.abs(d);
    if((absVal > SCI_UPPER_BOUND) || ((absVal < SCI_LOWER_BOUND) && (d != 0.0d))) {
      return formatScientific(new BigDecimal(d), fractionDigits);
    }

    BigDecimal bd = new BigDecimal(d).setScale(fractionDigits, ROUND_MODE);
    return trimFraction(bd.toPlainString());
  }

  /**
   * Formats the given value as the shortest decimal string which uniquely
   * identifies it, never using an exponent and dropping any fraction of
   * zero (e.g. "5", "2.5", "0.0000001").
   */
  public static String toPlainString(double d) {

    String specialStr = formatSpecial(d);
    if(specialStr != null) {
      return specialStr;
    }

    if(d == 0.0d) {
      // BigDecimal loses the sign of negative zero
      return ((Double.doubleToRawLongBits(d) < 0) ? "-0" : "0");
    }

    return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
  }

  private static String formatSpecial(double d) {
    if(Double.isNaN(d)) {
      return NAN_STR;
    }
    if(Double.isInfinite(d)) {
      return ((d < 0d) ? NEG_INF_STR : POS_INF_STR);
    }
    return null;
  }

  private static String formatScientific(BigDecimal bd, int fractionDigits) {
    bd = bd.round(new MathContext(fractionDigits + 1, ROUND_MODE));

    // the exponent of the leading digit
    int exp = bd.precision() - bd.scale() - 1;

    BigDecimal mantissa = bd.movePointLeft(exp)
      .setScale(fractionDigits, ROUND_MODE);
    return mantissa.toPlainString() + "e" + exp;
  }

  private static String trimFraction(String str) {
    if(str.indexOf('.') < 0) {
      return str;
    }
    int end = str.length();
    while(str.charAt(end - 1) == '0') {
      --end;
    }
    if(str.charAt(end - 1) == '.') {
      --end;
    }
    str = str.substring(0, end);
    // rounding may leave a negative zero
    return ("-0".equals(str) ? "0" : str);
  }
}
