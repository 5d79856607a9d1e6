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
 * Base class for exceptions thrown during expression evaluation.  Every
 * exception carries the {@link Reason} which caused the evaluation to be
 * aborted.
 *
 * @author James Ahlborn
 */
public class EvalException extends IllegalStateException
{
  private static final long serialVersionUID = 20250301L;

  /** the kinds of failures which can abort an evaluation */
  public enum Reason {
    INVALID_NUMBER(true),
    UNKNOWN_CHARACTER(true),
    DIVISION_BY_ZERO(false),
    ZERO_ROOT_DEGREE(false),
    EVEN_ROOT_OF_NEGATIVE(false),
    DOMAIN_ERROR(false),
    UNKNOWN_FUNCTION(false),
    MISSING_PARENTHESES(false),
    UNCLOSED_PARENTHESIS(false),
    UNEXPECTED_TOKEN(false),
    TRAILING_TOKENS(false),
    EMPTY_INPUT(false),
    WRONG_ARITY(false);

    private final boolean _lexical;

    private Reason(boolean lexical) {
      _lexical = lexical;
    }

    /**
     * @return {@code true} if this failure is raised while tokenizing the
     *         expression text, {@code false} if it is raised while parsing
     *         and evaluating the tokens
     */
    public boolean isLexical() {
      return _lexical;
    }
  }

  private final Reason _reason;

  public EvalException(Reason reason, String message) {
    super(message);
    _reason = reason;
  }

  public EvalException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    _reason = reason;
  }

  public Reason getReason() {
    return _reason;
  }
}
