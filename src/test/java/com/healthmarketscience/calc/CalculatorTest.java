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
import com.healthmarketscience.calc.expr.Function;
import com.healthmarketscience.calc.expr.FunctionLookup;
import com.healthmarketscience.calc.expr.ParseException;
import com.healthmarketscience.calc.impl.expr.DefaultFunctions;
import com.healthmarketscience.calc.impl.expr.NumberFormatter;
import static org.junit.jupiter.api.Assertions.*;
import org.junit.jupiter.api.Test;

/**
 *
 * @author James Ahlborn
 */
public class CalculatorTest
{

  @Test
  public void testEvaluate() throws Exception
  {
    Calculator calc = new Calculator();

    Evaluation eval = calc.evaluate("2+3*4");
    assertTrue(eval.isSuccess());
    assertEquals(14d, eval.getValue(), 0.0d);
    assertEquals("2+3*4", eval.getExpression());
    assertEquals("2 + 3 * 4", eval.getFormattedExpression());
    assertNull(eval.getError());
    assertTrue(eval.getSteps().isEmpty());

    eval = calc.evaluate("2+3*4", true);
    assertEquals(14d, eval.getValue(), 0.0d);
    assertEquals(2, eval.getSteps().size());
    assertEquals("3 * 4", eval.getSteps().get(0).getDescription());
    assertEquals("2 + 12", eval.getSteps().get(1).getDescription());

    calc.setDetailed(true);
    assertEquals(2, calc.evaluate("2+3*4").getSteps().size());
  }

  @Test
  public void testFailures() throws Exception
  {
    Calculator calc = new Calculator();

    Evaluation eval = calc.evaluate("5 / (1 - 1)", true);
    assertFalse(eval.isSuccess());
    assertEquals(EvalException.Reason.DIVISION_BY_ZERO,
                 eval.getError().getReason());
    assertEquals("Division by zero", eval.getError().getMessage());
    assertEquals("5 / (1 - 1)", eval.getFormattedExpression());
    assertTrue(eval.getSteps().isEmpty());
    IllegalStateException ise = assertThrows(IllegalStateException.class,
                                             eval::getValue);
    assertSame(eval.getError(), ise.getCause());

    eval = calc.evaluate("2 # 3");
    assertFalse(eval.isSuccess());
    assertTrue(eval.getError() instanceof ParseException);
    assertEquals(EvalException.Reason.UNKNOWN_CHARACTER,
                 eval.getError().getReason());
    assertEquals("2 # 3", eval.getFormattedExpression());

    eval = calc.evaluate("");
    assertEquals(EvalException.Reason.EMPTY_INPUT,
                 eval.getError().getReason());

    eval = calc.evaluate(null);
    assertEquals(EvalException.Reason.EMPTY_INPUT,
                 eval.getError().getReason());
    assertEquals("", eval.getFormattedExpression());

    assertTrue(eval.toString().contains("EMPTY_INPUT"), eval.toString());
  }

  @Test
  public void testFunctionLookup() throws Exception
  {
    final Function twice = new Function() {
      public String getName() {
        return "twice";
      }
      public double eval(double... params) {
        return params[0] * 2d;
      }
    };

    FunctionLookup lookup = new FunctionLookup() {
      public Function getFunction(String name) {
        if(twice.getName().equalsIgnoreCase(name)) {
          return twice;
        }
        return DefaultFunctions.LOOKUP.getFunction(name);
      }
      public Double getConstant(String name) {
        if("answer".equalsIgnoreCase(name)) {
          return 42d;
        }
        return DefaultFunctions.LOOKUP.getConstant(name);
      }
    };

    Calculator calc = new Calculator().setFunctionLookup(lookup);
    assertSame(lookup, calc.getFunctionLookup());
    assertEquals(86d, calc.evaluate("twice(answer) + sqrt(4)").getValue(),
                 0.0d);

    // custom functions starting with the root operator char
    FunctionLookup rLookup = new FunctionLookup() {
      public Function getFunction(String name) {
        if("rev".equalsIgnoreCase(name)) {
          return twice;
        }
        return DefaultFunctions.LOOKUP.getFunction(name);
      }
      public Double getConstant(String name) {
        return DefaultFunctions.LOOKUP.getConstant(name);
      }
    };
    calc.setFunctionLookup(rLookup);
    Evaluation eval = calc.evaluate("rev(3)*2");
    assertEquals(12d, eval.getValue(), 0.0d);
    assertEquals("rev(3) * 2", eval.getFormattedExpression());
    assertEquals(EvalException.Reason.UNKNOWN_FUNCTION,
                 calc.evaluate("twice(3)").getError().getReason());

    calc.setFunctionLookup(null);
    assertSame(DefaultFunctions.LOOKUP, calc.getFunctionLookup());
  }

  @Test
  public void testConfig() throws Exception
  {
    Calculator calc = new Calculator();
    assertFalse(calc.isDetailed());
    assertEquals(NumberFormatter.DEFAULT_FRACTION_DIGITS,
                 calc.getFractionDigits());
    assertEquals("0.333333", calc.formatResult(1d / 3d));

    calc.setFractionDigits(2);
    assertEquals("0.33", calc.formatResult(1d / 3d));
    assertEquals("1.23e10", calc.formatResult(12345678901d));
    assertThrows(IllegalArgumentException.class,
                 () -> calc.setFractionDigits(-1));

    try {
      System.setProperty(Calculator.DETAILED_PROPERTY, " TRUE ");
      System.setProperty(Calculator.FRACTION_DIGITS_PROPERTY, " 3");

      Calculator propCalc = new Calculator();
      assertTrue(propCalc.isDetailed());
      assertEquals(3, propCalc.getFractionDigits());
      assertEquals("0.333", propCalc.formatResult(1d / 3d));

      System.setProperty(Calculator.FRACTION_DIGITS_PROPERTY, "lots");
      assertEquals(NumberFormatter.DEFAULT_FRACTION_DIGITS,
                   Calculator.getDefaultFractionDigits());
      System.setProperty(Calculator.FRACTION_DIGITS_PROPERTY, "-4");
      assertEquals(NumberFormatter.DEFAULT_FRACTION_DIGITS,
                   Calculator.getDefaultFractionDigits());
      System.setProperty(Calculator.FRACTION_DIGITS_PROPERTY, "");
      assertEquals(NumberFormatter.DEFAULT_FRACTION_DIGITS,
                   Calculator.getDefaultFractionDigits());

      System.setProperty(Calculator.DETAILED_PROPERTY, "yes");
      assertFalse(Calculator.getDefaultDetailed());
    } finally {
      System.clearProperty(Calculator.DETAILED_PROPERTY);
      System.clearProperty(Calculator.FRACTION_DIGITS_PROPERTY);
    }
  }
}
