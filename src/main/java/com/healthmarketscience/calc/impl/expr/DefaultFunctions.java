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

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import com.healthmarketscience.calc.expr.Function;
import com.healthmarketscience.calc.expr.FunctionLookup;
import static com.healthmarketscience.calc.impl.expr.FunctionSupport.*;

/**
 * The built-in table of functions and named constants.  The table is built
 * once when this class is loaded and never modified afterwards.
 *
 * @author James Ahlborn
 */
public class DefaultFunctions
{
  private static final Map<String,Function> FUNCS =
    new HashMap<String,Function>();
  private static final Map<String,Double> CONSTS =
    new HashMap<String,Double>();

  static {
    CONSTS.put("pi", Math.PI);
    CONSTS.put("e", Math.E);
  }

  public static final FunctionLookup LOOKUP = new FunctionLookup() {
    public Function getFunction(String name) {
      return FUNCS.get(toLookupName(name));
    }
    public Double getConstant(String name) {
      return CONSTS.get(toLookupName(name));
    }
  };

  static {
    // load all default functions
    DefaultNumberFunctions.init();
    DefaultTrigFunctions.init();
    DefaultStatFunctions.init();
  }

  private DefaultFunctions() {}

  /**
   * @return the names of all the registered functions (including aliases),
   *         sorted
   */
  public static Set<String> getFunctionNames() {
    return Collections.unmodifiableSet(new TreeSet<String>(FUNCS.keySet()));
  }

  /**
   * @return the names of all the registered constants, sorted
   */
  public static Set<String> getConstantNames() {
    return Collections.unmodifiableSet(new TreeSet<String>(CONSTS.keySet()));
  }

  public static String toLookupName(String name) {
    return ((name != null) ? name.toLowerCase(Locale.ROOT) : null);
  }

  static Function registerFunc(Function func, String... aliases) {
    registerFunc(func.getName(), func);
    for(String alias : aliases) {
      registerFunc(alias, new AliasFunction(alias, func));
    }
    return func;
  }

  private static void registerFunc(String name, Function func) {
    String lookupFuncName = toLookupName(name);
    if(FUNCS.put(lookupFuncName, func) != null) {
      throw new IllegalStateException("Duplicate function " + name);
    }
  }
}
