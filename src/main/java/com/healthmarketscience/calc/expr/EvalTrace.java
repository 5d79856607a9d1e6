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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.healthmarketscience.calc.impl.CustomToStringStyle;

/**
 * Records the intermediate computations of a single expression evaluation.
 * A trace which is not "detailed" never records anything.  A trace belongs
 * to exactly one evaluation and is not safe for use by multiple threads.
 *
 * @author James Ahlborn
 */
public class EvalTrace
{
  private final boolean _detailed;
  private final List<Step> _steps;

  public EvalTrace(boolean detailed) {
    _detailed = detailed;
    _steps = (detailed ? new ArrayList<Step>() : Collections.<Step>emptyList());
  }

  public boolean isDetailed() {
    return _detailed;
  }

  /**
   * Appends a step to this trace if it is detailed, otherwise does nothing.
   */
  public void record(String description, double result) {
    if(_detailed) {
      _steps.add(new Step(description, result));
    }
  }

  /**
   * @return the recorded steps in the order in which they were evaluated
   */
  public List<Step> getSteps() {
    return Collections.unmodifiableList(_steps);
  }

  @Override
  public String toString() {
    return CustomToStringStyle.builder(this)
      .append("detailed", _detailed)
      .append("steps", _steps)
      .toString();
  }

  /**
   * A single intermediate computation, the operation performed (with the
   * concrete operand values) and its result.
   */
  public static final class Step
  {
    private final String _description;
    private final double _result;

    public Step(String description, double result) {
      _description = description;
      _result = result;
    }

    public String getDescription() {
      return _description;
    }

    public double getResult() {
      return _result;
    }

    @Override
    public String toString() {
      return CustomToStringStyle.valueBuilder(this)
        .append("description", _description)
        .append("result", _result)
        .toString();
    }
  }
}
