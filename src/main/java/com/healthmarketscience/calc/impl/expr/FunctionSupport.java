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
import com.healthmarketscience.calc.expr.Function;

/**
 *
 * @author James Ahlborn
 */
public class FunctionSupport
{

  private FunctionSupport() {}

  public static abstract class BaseFunction implements Function
  {
    private final String _name;
    private final int _minParams;
    private final int _maxParams;

    protected BaseFunction(String name, int minParams, int maxParams)
    {
      _name = name;
      _minParams = minParams;
      _maxParams = maxParams;
    }

    public String getName() {
      return _name;
    }

    public int getMinParams() {
      return _minParams;
    }

    public int getMaxParams() {
      return _maxParams;
    }

    protected void validateNumParams(double[] params) {
      int num = params.length;
      if((num < _minParams) || (num > _maxParams)) {
        String range = ((_minParams == _maxParams) ? "" + _minParams :
                        ((_maxParams == Integer.MAX_VALUE) ?
                         "at least " + _minParams :
                         _minParams + " to " + _maxParams));
        throw new EvalException(
            Reason.WRONG_ARITY, _name + " requires " + range +
            " parameter(s), " + num + " passed");
      }
    }

    /**
     * @return a new exception indicating that the given parameters are
     *         outside of the domain of this function
     */
    protected EvalException domainError(String msg) {
      return new EvalException(Reason.DOMAIN_ERROR, _name + " domain: " + msg);
    }

    /**
     * Verifies that all the given values are non-negative integral counts,
     * throwing a domain error otherwise.
     */
    protected void checkCounts(double... params) {
      for(double param : params) {
        if(param < 0.0d) {
          throw domainError("requires non-negative integers");
        }
      }
      for(double param : params) {
        if(!isIntegral(param)) {
          throw domainError("requires integer arguments");
        }
      }
    }

    @Override
    public String toString() {
      return getName() + "()";
    }
  }

  public static abstract class Func1 extends BaseFunction
  {
    protected Func1(String name) {
      super(name, 1, 1);
    }

    public final double eval(double... params) {
      validateNumParams(params);
      return eval1(params[0]);
    }

    protected abstract double eval1(double param);
  }

  public static abstract class Func2 extends BaseFunction
  {
    protected Func2(String name) {
      super(name, 2, 2);
    }

    public final double eval(double... params) {
      validateNumParams(params);
      return eval2(params[0], params[1]);
    }

    protected abstract double eval2(double param1, double param2);
  }

  public static abstract class FuncVar extends BaseFunction
  {
    protected FuncVar(String name) {
      super(name, 0, Integer.MAX_VALUE);
    }

    protected FuncVar(String name, int minParams) {
      super(name, minParams, Integer.MAX_VALUE);
    }

    public final double eval(double... params) {
      validateNumParams(params);
      return evalVar(params);
    }

    protected abstract double evalVar(double[] params);
  }

  /**
   * Function which is registered under an alternate name, but otherwise
   * behaves exactly like the function it wraps.
   */
  public static class AliasFunction implements Function
  {
    private final String _name;
    private final Function _delegate;

    public AliasFunction(String name, Function delegate) {
      _name = name;
      _delegate = delegate;
    }

    public String getName() {
      return _name;
    }

    public double eval(double... params) {
      return _delegate.eval(params);
    }

    @Override
    public String toString() {
      return getName() + "()";
    }
  }

  static boolean isIntegral(double d) {
    return ((d % 1.0d) == 0.0d);
  }
}
