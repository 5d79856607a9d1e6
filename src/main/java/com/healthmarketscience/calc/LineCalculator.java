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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.Charset;
import java.util.List;

import com.healthmarketscience.calc.expr.EvalTrace;
import com.healthmarketscience.calc.impl.expr.DefaultFunctions;
import com.healthmarketscience.calc.impl.expr.ExpressionFormatter;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

/**
 * Simple line oriented console which reads expressions (and commands) one
 * line at a time and prints the results.
 *
 * @author James Ahlborn
 */
public class LineCalculator
{
  private static final Log LOG = LogFactory.getLog(LineCalculator.class);

  static final String PROMPT = "Expression: ";
  private static final String INDENT = "  ";

  private final BufferedReader _in;
  private final PrintWriter _out;
  private final Calculator _calc;

  public LineCalculator(BufferedReader in, PrintWriter out, Calculator calc) {
    _in = in;
    _out = out;
    _calc = calc;
  }

  /**
   * Reads and handles input lines until the input is exhausted or a quit
   * command is read.
   */
  public void run() throws IOException {
    printBanner();

    while(true) {
      _out.print(PROMPT);
      _out.flush();

      String line = _in.readLine();
      if(line == null) {
        break;
      }

      CalcInput input = CalcInput.parse(line);
      switch(input.getType()) {
      case EMPTY:
        if(input.isDetailed()) {
          _out.println("Please enter a valid expression after '" +
                       CalcInput.DETAILS_KEYWORD + "'");
        }
        break;
      case QUIT:
        _out.println("Goodbye!");
        _out.flush();
        return;
      case CLEAR:
        // nothing is kept between expressions
        _out.println("History cleared");
        break;
      case HELP:
        printHelp();
        break;
      case EXPRESSION:
        printEvaluation(_calc.evaluate(input.getExpression(),
                                       (input.isDetailed() ||
                                        _calc.isDetailed())));
        break;
      default:
        throw new IllegalStateException("unknown input type " +
                                        input.getType());
      }
      _out.flush();
    }

    _out.flush();
  }

  private void printBanner() {
    _out.println("Console Calculator");
    _out.println("Supports: +, -, *, /, %, ^, r (root), functions (sin, cos, etc.)");
    _out.println("Constants: " + StringUtils.join(
                     DefaultFunctions.getConstantNames(), ", "));
    _out.println("Special commands: 'quit' to exit, 'help' for help");
    _out.println("Add '" + CalcInput.DETAILS_KEYWORD +
                 "' before expression for step-by-step evaluation");
    _out.println();
  }

  void printHelp() {
    _out.println("Operators (lowest to highest precedence):");
    _out.println(INDENT + "+ -      addition, subtraction");
    _out.println(INDENT + "* / %    multiplication, division, integer remainder");
    _out.println(INDENT + "r        root, e.g. 8 r 3 = 2");
    _out.println(INDENT + "^        power (right associative)");
    _out.println(INDENT + "+ -      unary sign");
    _out.println("Functions (angles in degrees):");
    _out.println(INDENT + StringUtils.join(
                     DefaultFunctions.getFunctionNames(), ", "));
    _out.println("Constants:");
    _out.println(INDENT + StringUtils.join(
                     DefaultFunctions.getConstantNames(), ", "));
    _out.println("Commands:");
    _out.println(INDENT + "details <expr> | <expr> details   show each step");
    _out.println(INDENT + "help, clear | reset, quit | exit | q");
    _out.println();
  }

  void printEvaluation(Evaluation eval) {
    if(!eval.isSuccess()) {
      _out.println(INDENT + eval.getFormattedExpression() + " = Error: " +
                   eval.getError().getMessage());
      _out.println();
      return;
    }

    _out.println(INDENT + eval.getFormattedExpression() + " = " +
                 _calc.formatResult(eval.getValue()));

    List<EvalTrace.Step> steps = eval.getSteps();
    if(!steps.isEmpty()) {
      _out.println();
      _out.println(INDENT + "Step-by-step evaluation:");
      int stepNum = 1;
      for(EvalTrace.Step step : steps) {
        _out.println(INDENT + "Step " + stepNum + ": " +
                     ExpressionFormatter.canonicalizeSpacing(
                         step.getDescription(), _calc.getFunctionLookup()) +
                     " = " +
                     _calc.formatResult(step.getResult()));
        ++stepNum;
      }
    }
    _out.println();
  }

  public static void main(String[] args)
  {
    Charset cs = Charset.defaultCharset();
    LineCalculator lineCalc = new LineCalculator(
        new BufferedReader(new InputStreamReader(System.in, cs)),
        new PrintWriter(new OutputStreamWriter(System.out, cs)),
        new Calculator());
    try {
      lineCalc.run();
    } catch(IOException e) {
      LOG.error("Failed reading console input", e);
      System.exit(1);
    }
  }
}
