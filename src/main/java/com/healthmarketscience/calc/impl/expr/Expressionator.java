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

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import com.healthmarketscience.calc.expr.EvalException;
import com.healthmarketscience.calc.expr.EvalException.Reason;
import com.healthmarketscience.calc.expr.EvalTrace;
import com.healthmarketscience.calc.expr.Function;
import com.healthmarketscience.calc.expr.FunctionLookup;
import com.healthmarketscience.calc.impl.expr.ExpressionTokenizer.Token;
import com.healthmarketscience.calc.impl.expr.ExpressionTokenizer.TokenType;


/**
 * Recursive descent parser which evaluates an expression as it is parsed
 * (no expression tree is built).  From lowest to highest precedence:
 * <pre>
 *   expr    := term (('+' | '-') term)*
 *   term    := factor (('*' | '/' | '%') factor)*
 *   factor  := power ('r' power)?
 *   power   := unary ('^' power)?
 *   unary   := ('+' | '-')* primary
 *   primary := number | '(' expr ')' | constant | name '(' [expr (',' expr)*] ')'
 * </pre>
 * Each evaluation walks its own token buffer, so concurrent evaluations
 * share no state.
 *
 * @author James Ahlborn
 */
public class Expressionator
{
  private static final String FUNC_PARAM_SEP = ", ";

  private enum BinaryOp {
    PLUS('+') {
      @Override public double eval(double param1, double param2) {
        return BuiltinOperators.add(param1, param2);
      }
    },
    MINUS('-') {
      @Override public double eval(double param1, double param2) {
        return BuiltinOperators.subtract(param1, param2);
      }
    },
    MULT('*') {
      @Override public double eval(double param1, double param2) {
        return BuiltinOperators.multiply(param1, param2);
      }
    },
    DIV('/') {
      @Override public double eval(double param1, double param2) {
        return BuiltinOperators.divide(param1, param2);
      }
    },
    MOD('%') {
      @Override public double eval(double param1, double param2) {
        return BuiltinOperators.mod(param1, param2);
      }
    },
    EXP('^') {
      @Override public double eval(double param1, double param2) {
        return BuiltinOperators.exp(param1, param2);
      }
    },
    ROOT(ExpressionTokenizer.ROOT_OP_CHAR) {
      @Override public double eval(double param1, double param2) {
        return BuiltinOperators.root(param1, param2);
      }
    };

    private final char _opChar;

    private BinaryOp(char opChar) {
      _opChar = opChar;
    }

    public char getOpChar() {
      return _opChar;
    }

    @Override
    public String toString() {
      return String.valueOf(_opChar);
    }

    public abstract double eval(double param1, double param2);
  }

  private static final BinaryOp[] EXPR_OPS = {BinaryOp.PLUS, BinaryOp.MINUS};
  private static final BinaryOp[] TERM_OPS =
    {BinaryOp.MULT, BinaryOp.DIV, BinaryOp.MOD};

  private Expressionator() {}

  /**
   * Tokenizes and evaluates the given expression using the default function
   * table.
   */
  public static double evaluate(String exprStr, EvalTrace trace) {
    return evaluate(ExpressionTokenizer.tokenize(exprStr), trace);
  }

  /**
   * Evaluates the given tokens using the default function table.
   */
  public static double evaluate(List<Token> tokens, EvalTrace trace) {
    return evaluate(tokens, DefaultFunctions.LOOKUP, trace);
  }

  /**
   * Evaluates the given tokens, recording each intermediate computation in
   * the given trace (in the order in which they are computed).
   *
   * @return the value of the expression
   * @throws EvalException for the first failure encountered, after which the
   *         contents of the trace are incomplete
   */
  public static double evaluate(List<Token> tokens, FunctionLookup lookup,
                                EvalTrace trace) {

    if((tokens == null) || tokens.isEmpty()) {
      throw new EvalException(Reason.EMPTY_INPUT, "Empty expression");
    }

    TokBuf buf = new TokBuf(tokens, lookup, trace);

    double result = parseExpression(buf);

    if(buf.hasNext()) {
      throw new EvalException(
          Reason.TRAILING_TOKENS,
          "Unexpected tokens at end of expression " + buf);
    }

    return result;
  }

  private static double parseExpression(TokBuf buf) {
    double left = parseTerm(buf);

    BinaryOp op = null;
    while((op = buf.maybeNextOp(EXPR_OPS)) != null) {
      double right = parseTerm(buf);
      left = evalBinaryOp(op, left, right, buf);
    }

    return left;
  }

  private static double parseTerm(TokBuf buf) {
    double left = parseFactor(buf);

    BinaryOp op = null;
    while((op = buf.maybeNextOp(TERM_OPS)) != null) {
      double right = parseFactor(buf);
      left = evalBinaryOp(op, left, right, buf);
    }

    return left;
  }

  private static double parseFactor(TokBuf buf) {
    double base = parsePower(buf);

    // root is not associative, at most one per factor
    if(buf.maybeNextOp(BinaryOp.ROOT) != null) {
      double degree = parsePower(buf);
      return evalBinaryOp(BinaryOp.ROOT, base, degree, buf);
    }

    return base;
  }

  private static double parsePower(TokBuf buf) {
    double left = parseUnary(buf);

    if(buf.maybeNextOp(BinaryOp.EXP) != null) {
      // right associative
      double right = parsePower(buf);
      return evalBinaryOp(BinaryOp.EXP, left, right, buf);
    }

    return left;
  }

  private static double parseUnary(TokBuf buf) {
    boolean negate = false;
    boolean foundNeg = false;

    Token t = null;
    while(((t = buf.peekNext()) != null) && (t.isOp('+') || t.isOp('-'))) {
      buf.next();
      if(t.isOp('-')) {
        negate = !negate;
        foundNeg = true;
      }
    }

    double result = parsePrimary(buf);
    if(negate) {
      result = BuiltinOperators.negate(result);
    }

    if(foundNeg && buf.isTracing()) {
      buf.record((negate ? "- " : "+ ") +
                 NumberFormatter.toPlainString(Math.abs(result)), result);
    }

    return result;
  }

  private static double parsePrimary(TokBuf buf) {
    Token t = buf.peekNext();
    if(t == null) {
      throw new EvalException(Reason.UNEXPECTED_TOKEN,
                              "Unexpected end of expression " + buf);
    }

    switch(t.getType()) {
    case NUMBER:
      buf.next();
      return t.getNumber();

    case LEFT_PAREN:
      buf.next();
      double result = parseExpression(buf);
      if(!buf.maybeNext(TokenType.RIGHT_PAREN)) {
        throw new EvalException(Reason.UNCLOSED_PARENTHESIS,
                                "Missing closing ')' " + buf);
      }
      return result;

    case IDENTIFIER:
      buf.next();
      return parseIdentifier(t, buf);

    default:
      throw new EvalException(Reason.UNEXPECTED_TOKEN,
                              "Unexpected token " + t + " " + buf);
    }
  }

  private static double parseIdentifier(Token nameTok, TokBuf buf) {
    String name = DefaultFunctions.toLookupName(nameTok.getValueStr());

    Double constVal = buf.getConstant(name);
    if(constVal != null) {
      buf.record(name, constVal);
      return constVal;
    }

    if(!buf.maybeNext(TokenType.LEFT_PAREN)) {
      throw new EvalException(Reason.MISSING_PARENTHESES,
                              "Function '" + name + "' requires parentheses " +
                              buf);
    }

    List<Double> params = parseFuncParams(buf);

    Function func = buf.getFunction(name);
    if(func == null) {
      throw new EvalException(Reason.UNKNOWN_FUNCTION,
                              "Unknown function '" + name + "'");
    }

    double[] paramVals = toArray(params);
    double result = func.eval(paramVals);

    if(buf.isTracing()) {
      buf.record(funcCallToString(name, paramVals), result);
    }

    return result;
  }

  private static List<Double> parseFuncParams(TokBuf buf) {
    List<Double> params = new ArrayList<Double>(3);

    Token t = null;
    while(((t = buf.peekNext()) != null) &&
          (t.getType() != TokenType.RIGHT_PAREN)) {

      params.add(parseExpression(buf));

      t = buf.peekNext();
      if(t == null) {
        break;
      }
      if(t.getType() == TokenType.SEPARATOR) {
        buf.next();
      } else if(t.getType() != TokenType.RIGHT_PAREN) {
        throw new EvalException(Reason.UNCLOSED_PARENTHESIS,
                                "Expected ',' or ')' " + buf);
      }
    }

    if(!buf.maybeNext(TokenType.RIGHT_PAREN)) {
      throw new EvalException(Reason.UNCLOSED_PARENTHESIS,
                              "Missing closing ')' for function " + buf);
    }

    return params;
  }

  private static double evalBinaryOp(BinaryOp op, double left, double right,
                                     TokBuf buf) {
    double result = op.eval(left, right);
    if(buf.isTracing()) {
      buf.record(NumberFormatter.toPlainString(left) + " " + op + " " +
                 NumberFormatter.toPlainString(right), result);
    }
    return result;
  }

  private static String funcCallToString(String name, double[] params) {
    StringBuilder sb = new StringBuilder().append(name).append("(");
    for(int i = 0; i < params.length; ++i) {
      if(i > 0) {
        sb.append(FUNC_PARAM_SEP);
      }
      sb.append(NumberFormatter.toPlainString(params[i]));
    }
    return sb.append(")").toString();
  }

  private static double[] toArray(List<Double> vals) {
    double[] arr = new double[vals.size()];
    for(int i = 0; i < arr.length; ++i) {
      arr[i] = vals.get(i);
    }
    return arr;
  }

  /**
   * The tokens of a single evaluation along with the current position, which
   * only ever moves forward.
   */
  private static final class TokBuf
  {
    private final List<Token> _tokens;
    private final FunctionLookup _lookup;
    private final EvalTrace _trace;
    private int _pos;

    private TokBuf(List<Token> tokens, FunctionLookup lookup, EvalTrace trace) {
      _tokens = tokens;
      _lookup = lookup;
      _trace = ((trace != null) ? trace : new EvalTrace(false));
    }

    public boolean hasNext() {
      return (_pos < _tokens.size());
    }

    public Token peekNext() {
      if(!hasNext()) {
        return null;
      }
      return _tokens.get(_pos);
    }

    public Token next() {
      if(!hasNext()) {
        throw new EvalException(Reason.UNEXPECTED_TOKEN,
                                "Unexpected end of expression " + this);
      }
      return _tokens.get(_pos++);
    }

    /**
     * Consumes the next token if it is of the given type.
     */
    public boolean maybeNext(TokenType type) {
      Token t = peekNext();
      if((t != null) && (t.getType() == type)) {
        ++_pos;
        return true;
      }
      return false;
    }

    /**
     * Consumes the next token if it is one of the given operators.
     *
     * @return the consumed operator, {@code null} otherwise
     */
    public BinaryOp maybeNextOp(BinaryOp... ops) {
      Token t = peekNext();
      if(t != null) {
        for(BinaryOp op : ops) {
          if(t.isOp(op.getOpChar())) {
            ++_pos;
            return op;
          }
        }
      }
      return null;
    }

    public Function getFunction(String name) {
      return _lookup.getFunction(name);
    }

    public Double getConstant(String name) {
      return _lookup.getConstant(name);
    }

    public boolean isTracing() {
      return _trace.isDetailed();
    }

    public void record(String description, double result) {
      _trace.record(description, result);
    }

    @Override
    public String toString() {

      StringBuilder sb = new StringBuilder()
        .append("[token ").append(_pos).append("] (");

      for(Iterator<Token> iter = _tokens.iterator(); iter.hasNext(); ) {
        Token t = iter.next();
        sb.append("'").append(t.getValueStr()).append("'");
        if(iter.hasNext()) {
          sb.append(",");
        }
      }

      sb.append(")");

      return sb.toString();
    }
  }
}
