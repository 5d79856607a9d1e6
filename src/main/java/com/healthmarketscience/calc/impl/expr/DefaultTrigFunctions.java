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

import com.healthmarketscience.calc.expr.Function;
import static com.healthmarketscience.calc.impl.expr.DefaultFunctions.*;
import static com.healthmarketscience.calc.impl.expr.FunctionSupport.*;

/**
 * Trigonometric functions.  All angles, both parameters and results, are in
 * degrees.
 *
 * @author James Ahlborn
 */
public class DefaultTrigFunctions
{

  private DefaultTrigFunctions() {}

  static void init() {
    // dummy method to ensure this class is loaded
  }

  public static final Function SIN = registerFunc(new Func1("sin") {
    @Override
    protected double eval1(double param1) {
      return Math.sin(Math.toRadians(param1));
    }
  });

  public static final Function COS = registerFunc(new Func1("cos") {
    @Override
    protected double eval1(double param1) {
      return Math.cos(Math.toRadians(param1));
    }
  });

  public static final Function TAN = registerFunc(new Func1("tan") {
    @Override
    protected double eval1(double param1) {
      return Math.tan(Math.toRadians(param1));
    }
  });

  public static final Function ASIN = registerFunc(new Func1("asin") {
    @Override
    protected double eval1(double param1) {
      if((param1 < -1.0d) || (param1 > 1.0d)) {
        throw domainError("[-1, 1]");
      }
      return Math.toDegrees(Math.asin(param1));
    }
  });

  public static final Function ACOS = registerFunc(new Func1("acos") {
    @Override
    protected double eval1(double param1) {
      if((param1 < -1.0d) || (param1 > 1.0d)) {
        throw domainError("[-1, 1]");
      }
      return Math.toDegrees(Math.acos(param1));
    }
  });

  public static final Function ATAN = registerFunc(new Func1("atan") {
    @Override
    protected double eval1(double param1) {
      return Math.toDegrees(Math.atan(param1));
    }
  });

}
