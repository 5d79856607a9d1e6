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
import java.util.List;

import com.healthmarketscience.calc.expr.FunctionLookup;

import static com.healthmarketscience.calc.impl.expr.ExpressionTokenizer.*;

/**
 * Reformats expression text with canonical spacing for display: single
 * spaces around binary operators, none inside parentheses, none between a
 * function name and its open paren, and a single space after argument
 * separators.  Formatting never fails (unrecognized characters are kept as
 * they are) and formatting already formatted text returns it unchanged.
 *
 * @author James Ahlborn
 */
public class ExpressionFormatter
{
  private enum PieceType {
    NUMBER, WORD, BINARY_OP, UNARY_OP, OPEN, CLOSE, COMMA, OTHER;
  }

  private ExpressionFormatter() {}

  /**
   * Canonicalizes the spacing of the given expression using the default
   * function table.
   */
  public static String canonicalizeSpacing(String exprStr) {
    return canonicalizeSpacing(exprStr, DefaultFunctions.LOOKUP);
  }

  /**
   * Canonicalizes the spacing of the given expression.  The given lookup
   * decides which words starting with the root operator character are
   * function names, as when tokenizing.
   */
  public static String canonicalizeSpacing(String exprStr,
                                           FunctionLookup lookup) {
    if(exprStr == null) {
      return "";
    }

    List<Piece> pieces = split(exprStr, lookup);

    StringBuilder sb = new StringBuilder(exprStr.length() + 8);
    Piece prev = null;
    for(Piece p : pieces) {
      if((prev != null) && needsSpace(prev._type, p._type)) {
        sb.append(' ');
      }
      sb.append(p._str);
      prev = p;
    }
    return sb.toString();
  }

  private static boolean needsSpace(PieceType prev, PieceType cur) {
    switch(cur) {
    case CLOSE:
    case COMMA:
      return false;
    case OPEN:
      if(prev == PieceType.WORD) {
        // function call
        return false;
      }
      break;
    default:
      // fall through
    }
    return ((prev != PieceType.OPEN) && (prev != PieceType.UNARY_OP));
  }

  private static List<Piece> split(String exprStr, FunctionLookup lookup) {
    List<Piece> pieces = new ArrayList<Piece>();
    ExprBuf buf = new ExprBuf(exprStr);

    while(buf.hasNext()) {
      char c = buf.next();

      if(Character.isWhitespace(c)) {
        continue;
      }

      PieceType prevType = (pieces.isEmpty() ? null :
                            pieces.get(pieces.size() - 1)._type);

      switch(c) {
      case '(':
        pieces.add(new Piece(PieceType.OPEN, "("));
        break;
      case ')':
        pieces.add(new Piece(PieceType.CLOSE, ")"));
        break;
      case ',':
        pieces.add(new Piece(PieceType.COMMA, ","));
        break;
      case '+':
      case '-':
        pieces.add(new Piece(
                       (isUnaryPosition(prevType) ? PieceType.UNARY_OP :
                        PieceType.BINARY_OP), String.valueOf(c)));
        break;
      case '*':
      case '/':
      case '^':
      case '%':
        pieces.add(new Piece(PieceType.BINARY_OP, String.valueOf(c)));
        break;
      case ROOT_OP_CHAR:
        if(isFunctionWord(buf, lookup)) {
          pieces.add(new Piece(PieceType.WORD, scanWord(c, buf)));
        } else {
          pieces.add(new Piece(PieceType.BINARY_OP, String.valueOf(c)));
        }
        break;
      default:
        if(isDigit(c) || (c == '.')) {
          pieces.add(new Piece(PieceType.NUMBER, scanNumber(c, buf)));
        } else if(Character.isLetter(c)) {
          pieces.add(new Piece(PieceType.WORD, scanWord(c, buf)));
        } else {
          pieces.add(new Piece(PieceType.OTHER, String.valueOf(c)));
        }
      }
    }

    return pieces;
  }

  private static boolean isUnaryPosition(PieceType prevType) {
    return ((prevType == null) || (prevType == PieceType.BINARY_OP) ||
            (prevType == PieceType.UNARY_OP) || (prevType == PieceType.OPEN) ||
            (prevType == PieceType.COMMA));
  }

  private static final class Piece
  {
    private final PieceType _type;
    private final String _str;

    private Piece(PieceType type, String str) {
      _type = type;
      _str = str;
    }
  }
}
