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

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import org.junit.jupiter.api.Test;

/**
 *
 * @author James Ahlborn
 */
public class EvalTraceTest
{

  @Test
  public void testRecord() throws Exception
  {
    EvalTrace trace = new EvalTrace(false);
    assertFalse(trace.isDetailed());
    trace.record("1 + 2", 3d);
    assertTrue(trace.getSteps().isEmpty());

    trace = new EvalTrace(true);
    assertTrue(trace.isDetailed());
    trace.record("1 + 2", 3d);
    trace.record("3 * 4", 12d);

    List<EvalTrace.Step> steps = trace.getSteps();
    assertEquals(2, steps.size());
    assertEquals("1 + 2", steps.get(0).getDescription());
    assertEquals(3d, steps.get(0).getResult(), 0.0d);
    assertEquals("3 * 4", steps.get(1).getDescription());
    assertEquals(12d, steps.get(1).getResult(), 0.0d);

    assertThrows(UnsupportedOperationException.class,
                 () -> steps.add(new EvalTrace.Step("foo", 1d)));

    String traceStr = trace.toString();
    assertTrue(traceStr.startsWith("EvalTrace@"), traceStr);
    assertTrue(traceStr.contains("detailed: true"), traceStr);
    assertTrue(traceStr.contains("description=3 * 4"), traceStr);
  }

  @Test
  public void testReasons() throws Exception
  {
    assertTrue(EvalException.Reason.INVALID_NUMBER.isLexical());
    assertTrue(EvalException.Reason.UNKNOWN_CHARACTER.isLexical());
    assertFalse(EvalException.Reason.DIVISION_BY_ZERO.isLexical());
    assertFalse(EvalException.Reason.WRONG_ARITY.isLexical());

    EvalException ee = new ParseException(
        EvalException.Reason.INVALID_NUMBER, "bad number");
    assertEquals(EvalException.Reason.INVALID_NUMBER, ee.getReason());
    assertEquals("bad number", ee.getMessage());

    assertThrows(IllegalArgumentException.class,
                 () -> new ParseException(EvalException.Reason.DOMAIN_ERROR,
                                          "not lexical"));
  }
}
