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

import com.healthmarketscience.calc.expr.EvalException;
import com.healthmarketscience.calc.expr.EvalException.Reason;

/**
 * Implementations of the arithmetic operators.
 *
 * @author James Ahlborn
 */
public class BuiltinOperators
{

  private BuiltinOperators() {}

  public static double add(double param1, double param2) {
    return param1 + param2;
  }

  public static double subtract(double param1, double param2) {
    return param1 - param2;
  }

  public static double multiply(double param1, double param2) {
    return param1 * param2;
  }

  public static double divide(double param1, double param2) {
    if(param2 == 0.0d) {
      throw new EvalException(Reason.DIVISION_BY_ZERO, "Division by zero");
    }
    return param1 / param2;
  }

  /**
   * Integer remainder: both operands are truncated toward zero to longs
   * before the remainder is taken (so "10.7 % 3.2" is 1).
   */
  public static double mod(double param1, double param2) {
    long lv1 = (long)param1;
    long lv2 = (long)param2;
    if(lv2 == 0L) {
      throw new EvalException(Reason.DIVISION_BY_ZERO, "Division by zero");
    }
    return (double)(lv1 % lv2);
  }

  public static double exp(double param1, double param2) {
    return Math.pow(param1, param2);
  }

  /**
   * Computes the real "degree"th root of the given base as
   * {@code base ^ (1 / degree)}.
   */
  public static double root(double base, double degree) {
    if(degree == 0.0d) {
      throw new EvalException(Reason.ZERO_ROOT_DEGREE,
                              "Root degree cannot be zero");
    }
    // note, any degree which is an exact multiple of 2 counts as even
    if((base < 0.0d) && ((degree % 2.0d) == 0.0d)) {
      throw new EvalException(Reason.EVEN_ROOT_OF_NEGATIVE,
                              "Even root of negative number");
    }
    return Math.pow(base, 1.0d / degree);
  }

  public static double negate(double param1) {
    return -param1;
  }
}
