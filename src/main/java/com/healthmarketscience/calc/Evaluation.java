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

import java.util.Collections;
import java.util.List;

import com.healthmarketscience.calc.expr.EvalException;
import com.healthmarketscience.calc.expr.EvalTrace;
import com.healthmarketscience.calc.impl.CustomToStringStyle;

/**
 * The outcome of evaluating a single expression, either a value (plus any
 * recorded trace steps) or the failure which aborted the evaluation.
 * Evaluations are immutable.
 *
 * @author James Ahlborn
 */
public class Evaluation
{
  private final String _exprStr;
  private final String _formattedExprStr;
  private final double _value;
  private final EvalException _error;
  private final List<EvalTrace.Step> _steps;

  Evaluation(String exprStr, String formattedExprStr, double value,
             List<EvalTrace.Step> steps) {
    _exprStr = exprStr;
    _formattedExprStr = formattedExprStr;
    _value = value;
    _error = null;
    _steps = steps;
  }

  Evaluation(String exprStr, String formattedExprStr, EvalException error) {
    _exprStr = exprStr;
    _formattedExprStr = formattedExprStr;
    _value = Double.NaN;
    _error = error;
    // partial traces are meaningless
    _steps = Collections.emptyList();
  }

  /**
   * @return the expression as given
   */
  public String getExpression() {
    return _exprStr;
  }

  /**
   * @return the expression with canonical spacing, for display
   */
  public String getFormattedExpression() {
    return _formattedExprStr;
  }

  public boolean isSuccess() {
    return (_error == null);
  }

  /**
   * @return the value of the expression
   * @throws IllegalStateException if the evaluation failed
   */
  public double getValue() {
    if(_error != null) {
      throw new IllegalStateException(
          "Evaluation of '" + _exprStr + "' failed", _error);
    }
    return _value;
  }

  /**
   * @return the failure which aborted the evaluation, {@code null} if it
   *         succeeded
   */
  public EvalException getError() {
    return _error;
  }

  /**
   * @return the recorded steps, empty if the evaluation was not traced or
   *         failed
   */
  public List<EvalTrace.Step> getSteps() {
    return _steps;
  }

  @Override
  public String toString() {
    return CustomToStringStyle.builder(this)
      .append("expression", _exprStr)
      .append("value", (isSuccess() ? _value : null))
      .append("error", ((_error != null) ? _error.getReason() : null))
      .append("steps", _steps)
      .toString();
  }
}
