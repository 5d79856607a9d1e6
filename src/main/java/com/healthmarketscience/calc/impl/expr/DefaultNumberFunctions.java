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
 * Basic, exponential/logarithmic and hyperbolic functions.
 *
 * @author James Ahlborn
 */
public class DefaultNumberFunctions
{
  private static final double LN_2 = Math.log(2.0d);
  /** above this the hyperbolic inverses are ln(2x) to double precision */
  private static final double LARGE_HYPERBOLIC_ARG = 0x1p28;

  private DefaultNumberFunctions() {}

  static void init() {
    // dummy method to ensure this class is loaded
  }

  public static final Function ABS = registerFunc(new Func1("abs") {
    @Override
    protected double eval1(double param1) {
      return Math.abs(param1);
    }
  });

  public static final Function FLOOR = registerFunc(new Func1("floor") {
    @Override
    protected double eval1(double param1) {
      return Math.floor(param1);
    }
  });

  public static final Function CEIL = registerFunc(new Func1("ceil") {
    @Override
    protected double eval1(double param1) {
      return Math.ceil(param1);
    }
  });

  public static final Function ROUND = registerFunc(new Func1("round") {
    @Override
    protected double eval1(double param1) {
      // halves round away from zero
      double absVal = Math.abs(param1);
      double rounded = Math.floor(absVal);
      if((absVal - rounded) >= 0.5d) {
        rounded += 1.0d;
      }
      return Math.copySign(rounded, param1);
    }
  });

  public static final Function SQRT = registerFunc(new Func1("sqrt") {
    @Override
    protected double eval1(double param1) {
      if(param1 < 0.0d) {
        throw domainError("non-negative numbers");
      }
      return Math.sqrt(param1);
    }
  });

  public static final Function EXP = registerFunc(new Func1("exp") {
    @Override
    protected double eval1(double param1) {
      return Math.exp(param1);
    }
  });

  public static final Function LN = registerFunc(new Func1("ln") {
    @Override
    protected double eval1(double param1) {
      if(param1 <= 0.0d) {
        throw domainError("positive numbers");
      }
      return Math.log(param1);
    }
  });

  public static final Function LOG = registerFunc(new Func1("log") {
    @Override
    protected double eval1(double param1) {
      if(param1 <= 0.0d) {
        throw domainError("positive numbers");
      }
      return Math.log10(param1);
    }
  });

  public static final Function SINH = registerFunc(new Func1("sinh") {
    @Override
    protected double eval1(double param1) {
      return Math.sinh(param1);
    }
  });

  public static final Function COSH = registerFunc(new Func1("cosh") {
    @Override
    protected double eval1(double param1) {
      return Math.cosh(param1);
    }
  });

  public static final Function TANH = registerFunc(new Func1("tanh") {
    @Override
    protected double eval1(double param1) {
      return Math.tanh(param1);
    }
  });

  public static final Function ASINH = registerFunc(new Func1("asinh") {
    @Override
    protected double eval1(double param1) {
      // computed on the magnitude to keep precision for negative values
      double absVal = Math.abs(param1);
      double result = 0.0d;
      if(absVal > LARGE_HYPERBOLIC_ARG) {
        // the +1 term is lost here, asinh(x) == ln(2x)
        result = Math.log(absVal) + LN_2;
      } else {
        double sq = absVal * absVal;
        result = Math.log1p(absVal + (sq / (1.0d + Math.sqrt(1.0d + sq))));
      }
      return Math.copySign(result, param1);
    }
  });

  public static final Function ACOSH = registerFunc(new Func1("acosh") {
    @Override
    protected double eval1(double param1) {
      if(param1 < 1.0d) {
        throw domainError("x >= 1");
      }
      if(param1 > LARGE_HYPERBOLIC_ARG) {
        // the -1 term is lost here, acosh(x) == ln(2x)
        return Math.log(param1) + LN_2;
      }
      double t = param1 - 1.0d;
      return Math.log1p(t + Math.sqrt((2.0d * t) + (t * t)));
    }
  });

  public static final Function ATANH = registerFunc(new Func1("atanh") {
    @Override
    protected double eval1(double param1) {
      if((param1 <= -1.0d) || (param1 >= 1.0d)) {
        throw domainError("|x| < 1");
      }
      return 0.5d * Math.log1p((2.0d * param1) / (1.0d - param1));
    }
  });

}
