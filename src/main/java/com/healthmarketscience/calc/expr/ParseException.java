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

package com.healthmarketscience.calc.expr;

/**
 * Exception thrown when the text of an expression cannot be broken into
 * tokens.
 *
 * @author James Ahlborn
 */
public class ParseException extends EvalException
{
  private static final long serialVersionUID = 20250301L;

  public ParseException(Reason reason, String message) {
    this(reason, message, null);
  }

  public ParseException(Reason reason, String message, Throwable cause) {
    super(checkLexical(reason), message, cause);
  }

  private static Reason checkLexical(Reason reason) {
    if(!reason.isLexical()) {
      throw new IllegalArgumentException(
          "Reason " + reason + " is not a tokenizing failure");
    }
    return reason;
  }
}
