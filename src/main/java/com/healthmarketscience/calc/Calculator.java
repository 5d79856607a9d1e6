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

package com.healthmarketscience.calc;

import com.healthmarketscience.calc.expr.EvalException;
import com.healthmarketscience.calc.expr.EvalTrace;
import com.healthmarketscience.calc.expr.FunctionLookup;
import com.healthmarketscience.calc.impl.expr.DefaultFunctions;
import com.healthmarketscience.calc.impl.expr.ExpressionFormatter;
import com.healthmarketscience.calc.impl.expr.ExpressionTokenizer;
import com.healthmarketscience.calc.impl.expr.Expressionator;
import com.healthmarketscience.calc.impl.expr.NumberFormatter;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

/**
 * Entry point for evaluating expressions.  A Calculator holds only
 * configuration, every evaluation tokenizes and parses its expression from
 * scratch, so a single instance may be shared by multiple threads once
 * configured.
 * <p/>
 * Simple example usage:
 * <pre>
 *   Evaluation eval = new Calculator().evaluate("2 + 3 * 4");
 *   double result = eval.getValue();
 * </pre>
 * <p/>
 * Traced example usage:
 * <pre>
 *   Evaluation eval = new Calculator().evaluate("sqrt(16) ^ 2", true);
 *   for(EvalTrace.Step step : eval.getSteps()) {
 *     ...
 *   }
 * </pre>
 *
 * @author James Ahlborn
 */
public class Calculator
{
  private static final Log LOG = LogFactory.getLog(Calculator.class);

  /** (boolean) system property which can be used to make expressions traced
   *  by default.  Defaults to {@code false}. */
  public static final String DETAILED_PROPERTY =
    "com.healthmarketscience.calc.detailed";

  /** (int) system property which can be used to set the default number of
   *  fraction digits used when displaying results.  Defaults to
   *  {@value com.healthmarketscience.calc.impl.expr.NumberFormatter#DEFAULT_FRACTION_DIGITS}. */
  public static final String FRACTION_DIGITS_PROPERTY =
    "com.healthmarketscience.calc.fractionDigits";

  /** source of functions and constants */
  private FunctionLookup _lookup = DefaultFunctions.LOOKUP;
  /** whether or not expressions are traced when not otherwise specified */
  private boolean _detailed = getDefaultDetailed();
  /** number of fraction digits used when displaying results */
  private int _fractionDigits = getDefaultFractionDigits();

  public Calculator() {}

  /**
   * Sets the source of functions and constants, if {@code null}, uses the
   * default table.
   */
  public Calculator setFunctionLookup(FunctionLookup lookup) {
    _lookup = ((lookup != null) ? lookup : DefaultFunctions.LOOKUP);
    return this;
  }

  public FunctionLookup getFunctionLookup() {
    return _lookup;
  }

  /**
   * Sets whether or not {@link #evaluate(String)} records trace steps.
   */
  public Calculator setDetailed(boolean detailed) {
    _detailed = detailed;
    return this;
  }

  public boolean isDetailed() {
    return _detailed;
  }

  /**
   * Sets the number of fraction digits used by {@link #formatResult}.
   */
  public Calculator setFractionDigits(int fractionDigits) {
    if(fractionDigits < 0) {
      throw new IllegalArgumentException(
          "Invalid fraction digits " + fractionDigits);
    }
    _fractionDigits = fractionDigits;
    return this;
  }

  public int getFractionDigits() {
    return _fractionDigits;
  }

  /**
   * Evaluates the given expression, tracing according to {@link
   * #isDetailed}.
   */
  public Evaluation evaluate(String exprStr) {
    return evaluate(exprStr, _detailed);
  }

  /**
   * Evaluates the given expression.  Failures are not thrown, they are
   * returned as a failed Evaluation.
   *
   * @param exprStr a bare expression (any shell conventions, like the
   *                "details" keyword, must already be stripped)
   * @param detailed whether or not to record the intermediate computations
   */
  public Evaluation evaluate(String exprStr, boolean detailed) {
    String formatted = ExpressionFormatter.canonicalizeSpacing(
        exprStr, _lookup);
    EvalTrace trace = new EvalTrace(detailed);
    try {
      double result = Expressionator.evaluate(
          ExpressionTokenizer.tokenize(exprStr, _lookup), _lookup, trace);
      return new Evaluation(exprStr, formatted, result, trace.getSteps());
    } catch(EvalException e) {
      if(LOG.isDebugEnabled()) {
        LOG.debug("Failed evaluating '" + exprStr + "': " + e.getReason(), e);
      }
      return new Evaluation(exprStr, formatted, e);
    }
  }

  /**
   * @return the given result formatted for display
   */
  public String formatResult(double result) {
    return NumberFormatter.format(result, _fractionDigits);
  }

  /**
   * Returns the default trace mode.  This is {@code false}, but can be
   * overridden using the system property {@value #DETAILED_PROPERTY}.
   */
  public static boolean getDefaultDetailed()
  {
    String prop = System.getProperty(DETAILED_PROPERTY);
    if(prop != null) {
      return Boolean.TRUE.toString().equalsIgnoreCase(prop.trim());
    }
    return false;
  }

  /**
   * Returns the default number of result fraction digits.  This is {@value
   * com.healthmarketscience.calc.impl.expr.NumberFormatter#DEFAULT_FRACTION_DIGITS},
   * but can be overridden using the system property {@value
   * #FRACTION_DIGITS_PROPERTY}.
   */
  public static int getDefaultFractionDigits()
  {
    String prop = System.getProperty(FRACTION_DIGITS_PROPERTY);
    if(prop != null) {
      prop = prop.trim();
      if(prop.length() > 0) {
        try {
          int digits = Integer.parseInt(prop);
          if(digits >= 0) {
            return digits;
          }
        } catch(NumberFormatException e) {
          // fall through to the warning below
        }
        LOG.warn("Ignoring invalid " + FRACTION_DIGITS_PROPERTY + " value '" +
                 prop + "'");
      }
    }
    return NumberFormatter.DEFAULT_FRACTION_DIGITS;
  }
}
