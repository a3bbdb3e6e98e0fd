/*
 * Copyright 2025 The Pyscope Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.pyscope.parser;

import java.util.ArrayList;
import java.util.List;
import org.antlr.v4.runtime.Token;
import org.pyscope.tree.PyTree;
import org.pyscope.tree.PyTree.Expr;

/**
 * Splits the body of an f-string literal into literal text and replacement fields, parsing the
 * expression of each replacement field.
 *
 * <p>A replacement field is {@code {expr}}, optionally followed by {@code =}, then {@code !s},
 * {@code !r} or {@code !a}, then {@code :spec}, where the format spec may itself contain
 * replacement fields. Doubled braces outside of replacement fields stand for literal braces.
 */
final class FStrings {

  /** The f-string literal, used for error locations. */
  private final Token token;

  /** The characters between the quotes. */
  private final String body;

  /** The index in {@link #body} of the next character to be parsed. */
  private int pos;

  FStrings(Token token) {
    this.token = token;
    String text = token.getText();
    int prefixLength = prefixLength(text);
    int quoteLength = 1;
    if (text.startsWith("\"\"\"", prefixLength) || text.startsWith("'''", prefixLength)) {
      quoteLength = 3;
    }
    this.body = text.substring(prefixLength + quoteLength, text.length() - quoteLength);
  }

  /** Returns true if the given string literal has an "f" or "F" prefix. */
  static boolean isFormatted(String literal) {
    String prefix = literal.substring(0, prefixLength(literal));
    return prefix.indexOf('f') >= 0 || prefix.indexOf('F') >= 0;
  }

  private static int prefixLength(String literal) {
    int i = 0;
    while (literal.charAt(i) != '\'' && literal.charAt(i) != '"') {
      i++;
    }
    return i;
  }

  /** Returns the Constants and FormattedValues of the f-string, in order. */
  List<Expr> parse() {
    List<Expr> result = parseParts(false);
    assert pos == body.length();
    return result;
  }

  /**
   * Parses literal text and replacement fields until the end of the body or, if {@code inSpec}, an
   * unmatched '}' (which is not consumed).
   */
  private List<Expr> parseParts(boolean inSpec) {
    List<Expr> result = new ArrayList<>();
    StringBuilder literal = new StringBuilder();
    while (pos < body.length()) {
      char c = body.charAt(pos);
      if (c == '{') {
        if (!inSpec && body.startsWith("{{", pos)) {
          literal.append('{');
          pos += 2;
          continue;
        }
        pos++;
        PyTree.FormattedValue field = parseField(literal);
        flush(literal, result);
        result.add(field);
      } else if (c == '}') {
        if (inSpec) {
          break;
        } else if (!body.startsWith("}}", pos)) {
          throw error("single '}' is not allowed");
        }
        literal.append('}');
        pos += 2;
      } else {
        literal.append(c);
        pos++;
      }
    }
    flush(literal, result);
    return result;
  }

  private static void flush(StringBuilder literal, List<Expr> result) {
    if (literal.length() != 0) {
      result.add(new PyTree.Constant(literal.toString()));
      literal.setLength(0);
    }
  }

  /**
   * Parses a replacement field, starting just after its '{'. The text of a self-documenting field
   * ("{@code x=}") is appended to {@code literal}.
   */
  private PyTree.FormattedValue parseField(StringBuilder literal) {
    int start = pos;
    int end = expressionEnd();
    String exprText = body.substring(start, end);
    if (exprText.isBlank()) {
      throw error("empty expression not allowed");
    }
    Expr value = parseExpression(exprText);
    pos = end;
    char conversion = 0;
    if (body.charAt(pos) == '=') {
      // Self-documenting "{x=}"; with no conversion or spec, it uses repr().
      pos++;
      skipSpaces();
      literal.append(body, start, pos);
      if (pos < body.length() && body.charAt(pos) == '}') {
        conversion = 'r';
      }
    }
    if (pos < body.length() && body.charAt(pos) == '!') {
      pos++;
      if (pos >= body.length() || "sra".indexOf(body.charAt(pos)) < 0) {
        throw error("invalid conversion character: expected 's', 'r', or 'a'");
      }
      conversion = body.charAt(pos++);
    }
    PyTree.JoinedStr formatSpec = null;
    if (pos < body.length() && body.charAt(pos) == ':') {
      pos++;
      formatSpec = new PyTree.JoinedStr(parseParts(true));
    }
    if (pos >= body.length() || body.charAt(pos) != '}') {
      throw error("expecting '}'");
    }
    pos++;
    return new PyTree.FormattedValue(value, conversion, formatSpec);
  }

  private void skipSpaces() {
    while (pos < body.length() && Character.isWhitespace(body.charAt(pos))) {
      pos++;
    }
  }

  /**
   * Returns the index of the character that ends the expression starting at {@link #pos}: a '}',
   * '!', ':' or '=' that is not nested in brackets or a string and is not part of an operator.
   */
  private int expressionEnd() {
    int depth = 0;
    int i = pos;
    while (i < body.length()) {
      char c = body.charAt(i);
      switch (c) {
        case '(':
        case '[':
        case '{':
          depth++;
          break;
        case ')':
        case ']':
          depth--;
          break;
        case '}':
          if (depth == 0) {
            return i;
          }
          depth--;
          break;
        case '\'':
        case '"':
          i = stringEnd(i) - 1;
          break;
        case '!':
          if (depth == 0 && !body.startsWith("!=", i)) {
            return i;
          }
          break;
        case ':':
          if (depth == 0) {
            return i;
          }
          break;
        case '=':
          if (depth == 0
              && !body.startsWith("==", i)
              && "=!<>".indexOf(body.charAt(i - 1)) < 0) {
            return i;
          } else if (body.startsWith("==", i)) {
            i++;
          }
          break;
        default:
          break;
      }
      i++;
    }
    throw error("expecting '}'");
  }

  /** Returns the index just past the end of the string literal that starts at {@code start}. */
  private int stringEnd(int start) {
    char quote = body.charAt(start);
    String delimiter = String.valueOf(quote);
    if (body.startsWith(delimiter.repeat(3), start)) {
      delimiter = delimiter.repeat(3);
    }
    int end = body.indexOf(delimiter, start + delimiter.length());
    if (end < 0) {
      throw error("unterminated string");
    }
    return end + delimiter.length();
  }

  private Expr parseExpression(String exprText) {
    try {
      return PyParser.parseExpression("(" + exprText + ")");
    } catch (ParseError e) {
      throw error(e.msg);
    }
  }

  private ParseError error(String msg) {
    return PyParser.error(token, "f-string: " + msg);
  }
}
