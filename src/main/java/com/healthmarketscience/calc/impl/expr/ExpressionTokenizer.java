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
import java.util.Collections;
import java.util.List;

import com.healthmarketscience.calc.expr.EvalException.Reason;
import com.healthmarketscience.calc.expr.FunctionLookup;
import com.healthmarketscience.calc.expr.ParseException;


/**
 * Breaks expression text into the tokens consumed by the {@link
 * Expressionator}.
 *
 * @author James Ahlborn
 */
public class ExpressionTokenizer
{
  private static final int EOF = -1;
  static final char ROOT_OP_CHAR = 'r';
  private static final char DECIMAL_SEP_CHAR = '.';

  private static final byte IS_OP_FLAG =     0x01;
  private static final byte IS_DELIM_FLAG =  0x02;
  private static final byte IS_SPACE_FLAG =  0x04;

  public enum TokenType {
    NUMBER, OP, IDENTIFIER, LEFT_PAREN, RIGHT_PAREN, SEPARATOR;
  }

  private static final byte[] CHAR_FLAGS = new byte[128];

  static {
    setCharFlag(IS_OP_FLAG, '+', '-', '*', '/', '^', '%', ROOT_OP_CHAR);
    setCharFlag(IS_DELIM_FLAG, '(', ')', ',');
    setCharFlag(IS_SPACE_FLAG, ' ', '\t');
  }

  private ExpressionTokenizer() {}

  /**
   * Tokenizes the given expression string using the default function table.
   */
  public static List<Token> tokenize(String exprStr) {
    return tokenize(exprStr, DefaultFunctions.LOOKUP);
  }

  /**
   * Tokenizes the given expression string.  The given lookup is only
   * consulted to decide whether a word starting with the root operator
   * character is actually a function name.
   *
   * @return the tokens, never {@code null} (empty for blank input)
   * @throws ParseException if the string contains an invalid number literal
   *         or a character which cannot start a token
   */
  public static List<Token> tokenize(String exprStr, FunctionLookup lookup) {

    if(exprStr == null) {
      return Collections.emptyList();
    }

    List<Token> tokens = new ArrayList<Token>();

    ExprBuf buf = new ExprBuf(exprStr);

    while(buf.hasNext()) {
      char c = buf.next();

      byte charFlag = getCharFlag(c);
      if(charFlag != 0) {

        switch(charFlag) {
        case IS_OP_FLAG:

          if((c == ROOT_OP_CHAR) && isFunctionWord(buf, lookup)) {
            tokens.add(parseIdentifier(c, buf));
            break;
          }

          // all operator chars are single character operators
          tokens.add(new Token(TokenType.OP, String.valueOf(c)));
          break;

        case IS_DELIM_FLAG:

          tokens.add(parseDelim(c));
          break;

        case IS_SPACE_FLAG:
          // spaces only separate tokens
          break;

        default:
          throw new RuntimeException("unknown char flag " + charFlag);
        }

      } else if(isDigit(c) || (c == DECIMAL_SEP_CHAR)) {

        tokens.add(parseNumberLiteral(c, buf));

      } else if(isIdentifierStart(c)) {

        tokens.add(parseIdentifier(c, buf));

      } else {
        throw new ParseException(Reason.UNKNOWN_CHARACTER,
                                 "Unknown character '" + c + "' " + buf);
      }
    }

    return tokens;
  }

  private static byte getCharFlag(char c) {
    return ((c < 128) ? CHAR_FLAGS[c] : 0);
  }

  private static Token parseDelim(char c) {
    String str = String.valueOf(c);
    switch(c) {
    case '(':
      return new Token(TokenType.LEFT_PAREN, str);
    case ')':
      return new Token(TokenType.RIGHT_PAREN, str);
    default:
      return new Token(TokenType.SEPARATOR, str);
    }
  }

  private static Token parseIdentifier(char firstChar, ExprBuf buf) {
    return new Token(TokenType.IDENTIFIER, scanWord(firstChar, buf));
  }

  /**
   * Scans the rest of a run of letters.  Digits and underscores never extend
   * a word.
   */
  static String scanWord(char firstChar, ExprBuf buf) {
    StringBuilder sb = buf.getScratchBuffer().append(firstChar);
    int c = EOF;
    while(((c = buf.peekNext()) != EOF) && Character.isLetter((char)c)) {
      sb.append((char)c);
      buf.next();
    }
    return sb.toString();
  }

  /**
   * The root operator char never starts a word, unless the run of letters it
   * begins is the name of a known function which is being called,
   * e.g. "round(2.5)".
   */
  static boolean isFunctionWord(ExprBuf buf, FunctionLookup lookup) {
    int startPos = buf.curPos();
    try {
      String word = scanWord(ROOT_OP_CHAR, buf);
      if((word.length() == 1) || (lookup == null) ||
         (lookup.getFunction(word) == null)) {
        return false;
      }
      int c = EOF;
      while(((c = buf.peekNext()) != EOF) &&
            hasFlag(getCharFlag((char)c), IS_SPACE_FLAG)) {
        buf.next();
      }
      return (c == '(');
    } finally {
      buf.reset(startPos);
    }
  }

  private static Token parseNumberLiteral(char firstChar, ExprBuf buf) {
    String numStr = scanNumber(firstChar, buf);
    try {
      return new Token(TokenType.NUMBER, Double.parseDouble(numStr), numStr);
    } catch(NumberFormatException ne) {
      throw new ParseException(Reason.INVALID_NUMBER,
                               "Invalid number '" + numStr + "' " + buf, ne);
    }
  }

  /**
   * Scans a run of digits with at most one decimal separator and at most one
   * exponent marker (optionally followed by a sign).  The run is not
   * validated here.
   */
  static String scanNumber(char firstChar, ExprBuf buf) {
    StringBuilder sb = buf.getScratchBuffer().append(firstChar);
    boolean hasDecimal = (firstChar == DECIMAL_SEP_CHAR);
    boolean hasExp = false;

    int c = EOF;
    while((c = buf.peekNext()) != EOF) {
      if(isDigit(c)) {
        sb.append((char)c);
        buf.next();
      } else if(c == DECIMAL_SEP_CHAR) {
        if(hasDecimal) {
          // a second separator starts the next number
          break;
        }
        hasDecimal = true;
        sb.append((char)c);
        buf.next();
      } else if(!hasExp && ((c == 'e') || (c == 'E'))) {
        hasExp = true;
        sb.append((char)c);
        buf.next();
        c = buf.peekNext();
        if((c == '-') || (c == '+')) {
          sb.append((char)c);
          buf.next();
        }
      } else {
        break;
      }
    }

    return sb.toString();
  }

  static boolean isIdentifierStart(char c) {
    return (((c >= 'a') && (c <= 'z')) || ((c >= 'A') && (c <= 'Z')));
  }

  private static boolean hasFlag(byte charFlag, byte flag) {
    return ((charFlag & flag) != 0);
  }

  private static void setCharFlag(byte flag, char... chars) {
    for(char c : chars) {
      CHAR_FLAGS[c] |= flag;
    }
  }

  static boolean isDigit(int c) {
    return ((c >= '0') && (c <= '9'));
  }

  static final class ExprBuf
  {
    private final String _str;
    private int _pos;
    private final StringBuilder _scratch = new StringBuilder();

    ExprBuf(String str) {
      _str = str;
    }

    private int len() {
      return _str.length();
    }

    public int curPos() {
      return _pos;
    }

    public boolean hasNext() {
      return _pos < len();
    }

    public char next() {
      return _str.charAt(_pos++);
    }

    public int peekNext() {
      if(!hasNext()) {
        return EOF;
      }
      return _str.charAt(_pos);
    }

    public void reset(int pos) {
      _pos = pos;
    }

    public StringBuilder getScratchBuffer() {
      _scratch.setLength(0);
      return _scratch;
    }

    @Override
    public String toString() {
      return "[char " + _pos + "] '" + _str + "'";
    }
  }


  /**
   * A single lexical unit of an expression.  Tokens are immutable.
   */
  public static final class Token
  {
    private final TokenType _type;
    private final double _num;
    private final String _valStr;

    Token(TokenType type, String valStr) {
      this(type, Double.NaN, valStr);
    }

    Token(TokenType type, double num, String valStr) {
      _type = type;
      _num = num;
      _valStr = valStr;
    }

    public TokenType getType() {
      return _type;
    }

    /**
     * @return the parsed value of a {@link TokenType#NUMBER} token
     */
    public double getNumber() {
      return _num;
    }

    /**
     * @return the original text of this token (identifiers keep their
     *         original casing)
     */
    public String getValueStr() {
      return _valStr;
    }

    /**
     * @return {@code true} if this is the operator token for the given char
     */
    public boolean isOp(char opChar) {
      return ((_type == TokenType.OP) && (_valStr.charAt(0) == opChar));
    }

    @Override
    public String toString() {
      return "[" + _type + "] '" + _valStr + "'";
    }
  }

}
