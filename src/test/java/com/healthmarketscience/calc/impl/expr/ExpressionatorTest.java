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

import java.util.List;

import com.healthmarketscience.calc.expr.EvalException;
import com.healthmarketscience.calc.expr.EvalException.Reason;
import com.healthmarketscience.calc.expr.EvalTrace;
import com.healthmarketscience.calc.impl.expr.ExpressionTokenizer.Token;
import static org.junit.jupiter.api.Assertions.*;
import org.junit.jupiter.api.Test;

/**
 *
 * @author James Ahlborn
 */
public class ExpressionatorTest
{
  private static final double DELTA = 1e-9d;

  @Test
  public void testArithmetic() throws Exception
  {
    assertEval(5d, "2 + 3");
    assertEval(14d, "2 + 3 * 4");
    assertEval(20d, "(2 + 3) * 4");
    assertEval(3d, "10 - 4 - 3");
    assertEval(2d, "100 / 10 / 5");
    assertEval(512d, "2 ^ 3 ^ 2");
    assertEval(2d, "8 r 3");
    assertEval(3d, "27r3");
    assertEval(1d, "10 % 3");
    assertEval(1d, "10.7 % 3.2");
    assertEval(-1d, "-7 % 3");
    assertEval(0.5d, "2^-1");
    assertEval(-6d, "2 * -3");
    assertEval(7d, "1 + 2 * 3 ^ 1");
    assertEval(10d, "sqrt(16) + fact(3)");
    assertEval(5d, "mean(1, sqrt(16), (2 + 3) * 2)");
    assertEval(2.5d, "((((2.5))))");
    assertEval(0.0015d, "1.5e-3");
  }

  @Test
  public void testUnary() throws Exception
  {
    // unary binds tighter than '^'
    assertEval(4d, "-2 ^ 2");
    assertEval(-4d, "-(2 ^ 2)");
    assertEval(3d, "--3");
    assertEval(-3d, "+-+3");
    assertEval(3d, "+3");
    assertEval(-Math.PI, "-pi");
    assertEval(1d, "-2 + 3");
  }

  @Test
  public void testConstantsAndFunctions() throws Exception
  {
    assertEval(Math.PI, "pi");
    assertEval(Math.PI, "PI");
    assertEval(Math.E, "e");
    assertEval(2d * Math.PI, "2 * pi");
    assertEval(0.5d, "sin(30)");
    assertEval(0.5d, "SIN(30)");
    assertEval(120d, "fact(5)");
    assertEval(56d, "comb(8, 3)");
    assertEval(720d, "perm(10, 3)");
    assertEval(3d, "mean(1, 2, 3, 4, 5)");
    assertEval(2.5d, "median(1, 2, 3, 4)");
    assertEval(3d, "round(2.5)");
    assertEval(-3d, "round(-2.5)");
    assertEval(2d, "round (2.4)");
    assertEval(4d, "sqrt(sqrt(256))");
  }

  @Test
  public void testRoot() throws Exception
  {
    assertEvalFailure(Reason.EVEN_ROOT_OF_NEGATIVE, "-4 r 2");
    assertEvalFailure(Reason.EVEN_ROOT_OF_NEGATIVE, "-16 r 4.0");
    assertEvalFailure(Reason.ZERO_ROOT_DEGREE, "5 r 0");
    assertEvalFailure(Reason.ZERO_ROOT_DEGREE, "5 r (1 - 1)");

    // odd and fractional degrees of negative bases are not errors
    assertTrue(Double.isNaN(eval("-8 r 3")));

    // root is not associative
    assertEvalFailure(Reason.TRAILING_TOKENS, "16 r 2 r 2");
    assertEval(2d, "(16 r 2) r 2");
  }

  @Test
  public void testFailures() throws Exception
  {
    assertEvalFailure(Reason.DIVISION_BY_ZERO, "5 / 0");
    assertEvalFailure(Reason.DIVISION_BY_ZERO, "5 / (2 - 2)");
    assertEvalFailure(Reason.DIVISION_BY_ZERO, "5 % 0");
    assertEvalFailure(Reason.DIVISION_BY_ZERO, "5 % 0.5");

    assertEvalFailure(Reason.DOMAIN_ERROR, "sqrt(-1)");
    assertEvalFailure(Reason.DOMAIN_ERROR, "asin(2)");
    assertEvalFailure(Reason.DOMAIN_ERROR, "ln(0)");
    assertEvalFailure(Reason.DOMAIN_ERROR, "fact(-1)");

    assertEvalFailure(Reason.MISSING_PARENTHESES, "foo");
    assertEvalFailure(Reason.MISSING_PARENTHESES, "sin 30");
    assertEvalFailure(Reason.MISSING_PARENTHESES, "x r 0");
    assertEvalFailure(Reason.UNKNOWN_FUNCTION, "foo(1)");
    assertEvalFailure(Reason.UNKNOWN_FUNCTION, "foo()");

    assertEvalFailure(Reason.UNCLOSED_PARENTHESIS, "(2 + 3");
    assertEvalFailure(Reason.UNCLOSED_PARENTHESIS, "sin(30");
    assertEvalFailure(Reason.UNCLOSED_PARENTHESIS, "mean(1 2)");

    assertEvalFailure(Reason.TRAILING_TOKENS, "2 3");
    assertEvalFailure(Reason.TRAILING_TOKENS, "2 )");
    assertEvalFailure(Reason.TRAILING_TOKENS, "pi(2)");
    // a called function name starting with 'r' is a single word
    assertEvalFailure(Reason.TRAILING_TOKENS, "2 round(4)");

    assertEvalFailure(Reason.UNEXPECTED_TOKEN, "* 2");
    assertEvalFailure(Reason.UNEXPECTED_TOKEN, "2 +");
    assertEvalFailure(Reason.UNEXPECTED_TOKEN, "()");
    assertEvalFailure(Reason.UNEXPECTED_TOKEN, "2 * , 3");

    assertEvalFailure(Reason.EMPTY_INPUT, "");
    assertEvalFailure(Reason.EMPTY_INPUT, "   ");

    assertEvalFailure(Reason.WRONG_ARITY, "sin()");
    assertEvalFailure(Reason.WRONG_ARITY, "sin(1, 2)");
    assertEvalFailure(Reason.WRONG_ARITY, "perm(5)");
    assertEvalFailure(Reason.WRONG_ARITY, "mean()");
    assertEvalFailure(Reason.WRONG_ARITY, "stdev(1)");

    // the first failure wins
    assertEvalFailure(Reason.DIVISION_BY_ZERO, "1 / 0 + sqrt(-1)");
  }

  @Test
  public void testTrace() throws Exception
  {
    assertSteps("2 + 3 * 4",
                "3 * 4", 12d,
                "2 + 12", 14d);
    assertSteps("(1 + 2) * sqrt(16)",
                "1 + 2", 3d,
                "sqrt(16)", 4d,
                "3 * 4", 12d);
    assertSteps("2 ^ 3 ^ 2",
                "3 ^ 2", 9d,
                "2 ^ 9", 512d);
    assertSteps("-pi",
                "pi", Math.PI,
                "- 3.141592653589793", -Math.PI);
    assertSteps("--5",
                "+ 5", 5d);
    assertSteps("8 r 3",
                "8 r 3", 2d);
    assertSteps("NCR(8, 3)",
                "ncr(8, 3)", 56d);
    assertSteps("2.5 * 2",
                "2.5 * 2", 5d);
    assertSteps("0.0000001 * 10",
                "0.0000001 * 10", 0.000001d);

    // plain values and a unary plus are not steps
    assertSteps("42");
    assertSteps("+5");
    assertSteps("(7)");

    EvalTrace trace = new EvalTrace(false);
    assertEquals(14d, Expressionator.evaluate("2 + 3 * 4 + sin(0)", trace),
                 DELTA);
    assertTrue(trace.getSteps().isEmpty());

    // null trace is allowed
    assertEquals(14d, Expressionator.evaluate("2 + 3 * 4", null), DELTA);
  }

  @Test
  public void testDeterministic() throws Exception
  {
    List<Token> tokens = ExpressionTokenizer.tokenize(
        "stdev(1, 2, 3) * comb(10, 4) - 2 ^ 0.5 r 3");

    EvalTrace trace1 = new EvalTrace(true);
    EvalTrace trace2 = new EvalTrace(true);
    double result1 = Expressionator.evaluate(tokens, trace1);
    double result2 = Expressionator.evaluate(tokens, trace2);

    assertEquals(Double.doubleToLongBits(result1),
                 Double.doubleToLongBits(result2));
    assertEquals(trace1.getSteps().size(), trace2.getSteps().size());
    for(int i = 0; i < trace1.getSteps().size(); ++i) {
      EvalTrace.Step s1 = trace1.getSteps().get(i);
      EvalTrace.Step s2 = trace2.getSteps().get(i);
      assertEquals(s1.getDescription(), s2.getDescription());
      assertEquals(s1.getResult(), s2.getResult(), 0.0d);
    }
  }

  private static double eval(String exprStr) {
    return Expressionator.evaluate(exprStr, new EvalTrace(false));
  }

  private static void assertEval(double expected, String exprStr) {
    assertEquals(expected, eval(exprStr), DELTA, exprStr);
  }

  private static void assertEvalFailure(Reason reason, String exprStr) {
    EvalException ee = assertThrows(EvalException.class, () -> eval(exprStr),
                                    exprStr);
    assertEquals(reason, ee.getReason(), exprStr + ": " + ee.getMessage());
  }

  private static void assertSteps(String exprStr, Object... expected) {
    EvalTrace trace = new EvalTrace(true);
    Expressionator.evaluate(exprStr, trace);

    List<EvalTrace.Step> steps = trace.getSteps();
    assertEquals(expected.length / 2, steps.size(), exprStr + ": " + trace);
    for(int i = 0; i < steps.size(); ++i) {
      EvalTrace.Step step = steps.get(i);
      assertEquals(expected[i * 2], step.getDescription());
      assertEquals(((Double)expected[(i * 2) + 1]).doubleValue(),
                   step.getResult(), DELTA);
    }
  }
}
