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

import java.util.Locale;

import com.healthmarketscience.calc.impl.CustomToStringStyle;
import org.apache.commons.lang3.StringUtils;

/**
 * A single line of console input, classified as one of the console commands
 * or an expression to evaluate.  An expression may be prefixed or suffixed by
 * the {@value #DETAILS_KEYWORD} keyword to request a step by step trace.
 *
 * @author James Ahlborn
 */
public class CalcInput
{
  public static final String DETAILS_KEYWORD = "details";

  private static final String DETAILS_PREFIX = DETAILS_KEYWORD + " ";
  private static final String DETAILS_SUFFIX = " " + DETAILS_KEYWORD;

  public enum Type {
    /** nothing to do (blank line, or "details" without an expression) */
    EMPTY,
    QUIT,
    CLEAR,
    HELP,
    EXPRESSION;
  }

  private final Type _type;
  private final String _exprStr;
  private final boolean _detailed;

  private CalcInput(Type type, String exprStr, boolean detailed) {
    _type = type;
    _exprStr = exprStr;
    _detailed = detailed;
  }

  public static CalcInput parse(String line) {
    String input = StringUtils.trimToEmpty(line);
    if(input.isEmpty()) {
      return new CalcInput(Type.EMPTY, null, false);
    }

    String lowerInput = input.toLowerCase(Locale.ROOT);
    switch(lowerInput) {
    case "quit":
    case "exit":
    case "q":
      return new CalcInput(Type.QUIT, null, false);
    case "clear":
    case "reset":
      return new CalcInput(Type.CLEAR, null, false);
    case "help":
      return new CalcInput(Type.HELP, null, false);
    case DETAILS_KEYWORD:
      return new CalcInput(Type.EMPTY, null, true);
    default:
      // fall through
    }

    if(lowerInput.startsWith(DETAILS_PREFIX)) {
      return newExpression(input.substring(DETAILS_PREFIX.length()), true);
    }
    if(lowerInput.endsWith(DETAILS_SUFFIX)) {
      return newExpression(
          input.substring(0, input.length() - DETAILS_SUFFIX.length()), true);
    }
    return newExpression(input, false);
  }

  private static CalcInput newExpression(String exprStr, boolean detailed) {
    exprStr = exprStr.trim();
    if(exprStr.isEmpty()) {
      return new CalcInput(Type.EMPTY, null, detailed);
    }
    return new CalcInput(Type.EXPRESSION, exprStr, detailed);
  }

  public Type getType() {
    return _type;
  }

  /**
   * @return the bare expression (with any "details" keyword removed), only
   *         non-{@code null} for {@link Type#EXPRESSION} input
   */
  public String getExpression() {
    return _exprStr;
  }

  /**
   * @return {@code true} if the "details" keyword was given
   */
  public boolean isDetailed() {
    return _detailed;
  }

  @Override
  public String toString() {
    return CustomToStringStyle.valueBuilder(this)
      .append("type", _type)
      .append("expression", _exprStr)
      .append("detailed", _detailed)
      .toString();
  }
}
