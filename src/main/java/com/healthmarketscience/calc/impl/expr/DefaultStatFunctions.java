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

import java.util.Arrays;

import com.healthmarketscience.calc.expr.Function;
import static com.healthmarketscience.calc.impl.expr.DefaultFunctions.*;
import static com.healthmarketscience.calc.impl.expr.FunctionSupport.*;

/**
 * Combinatoric and statistical functions.
 *
 * @author James Ahlborn
 */
public class DefaultStatFunctions
{

  private DefaultStatFunctions() {}

  static void init() {
    // dummy method to ensure this class is loaded
  }

  public static final Function FACT = registerFunc(new Func1("fact") {
    @Override
    protected double eval1(double param1) {
      if(param1 < 0.0d) {
        throw domainError("not defined for negative numbers");
      }
      if(!isIntegral(param1)) {
        throw domainError("requires integer argument");
      }
      long n = (long)param1;
      double result = 1.0d;
      for(long i = 1; i <= n; ++i) {
        result *= i;
        if(result == Double.POSITIVE_INFINITY) {
          break;
        }
      }
      return result;
    }
  }, "factorial");

  public static final Function PERM = registerFunc(new Func2("perm") {
    @Override
    protected double eval2(double param1, double param2) {
      checkCounts(param1, param2);
      long n = (long)param1;
      long k = (long)param2;
      if(k > n) {
        throw domainError("k cannot be greater than n");
      }
      double result = 1.0d;
      for(long i = 0; i < k; ++i) {
        result *= (n - i);
        if(result == Double.POSITIVE_INFINITY) {
          break;
        }
      }
      return result;
    }
  }, "npr");

  public static final Function COMB = registerFunc(new Func2("comb") {
    @Override
    protected double eval2(double param1, double param2) {
      checkCounts(param1, param2);
      long n = (long)param1;
      long k = (long)param2;
      if(k > n) {
        throw domainError("k cannot be greater than n");
      }
      // the smaller of k and n-k keeps the intermediate values small
      k = Math.min(k, n - k);
      double result = 1.0d;
      for(long i = 0; i < k; ++i) {
        result *= (double)(n - i) / (double)(i + 1);
        if(result == Double.POSITIVE_INFINITY) {
          break;
        }
      }
      return result;
    }
  }, "ncr");

  public static final Function MEAN = registerFunc(new FuncVar("mean", 1) {
    @Override
    protected double evalVar(double[] params) {
      return sum(params) / params.length;
    }
  });

  public static final Function MEDIAN = registerFunc(new FuncVar("median", 1) {
    @Override
    protected double evalVar(double[] params) {
      double[] sorted = params.clone();
      Arrays.sort(sorted);
      int mid = sorted.length / 2;
      if((sorted.length % 2) == 0) {
        return (sorted[mid - 1] + sorted[mid]) / 2.0d;
      }
      return sorted[mid];
    }
  });

  public static final Function STDEV = registerFunc(new FuncVar("stdev", 2) {
    @Override
    protected double evalVar(double[] params) {
      // sample standard deviation
      double mean = sum(params) / params.length;
      double sumSq = 0.0d;
      for(double d : params) {
        double diff = d - mean;
        sumSq += diff * diff;
      }
      return Math.sqrt(sumSq / (params.length - 1));
    }
  }, "stddev");

  private static double sum(double[] params) {
    double sum = 0.0d;
    for(double d : params) {
      sum += d;
    }
    return sum;
  }
}
