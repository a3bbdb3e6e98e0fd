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

import com.google.errorprone.annotations.FormatMethod;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.pyscope.tree.PyTree;

/** Parses Python source code into a PyTree. */
public final class PyParser {

  // Static methods only
  private PyParser() {}

  /**
   * Parses a Python module.
   *
   * @throws ParseError if the input is not a syntactically valid module
   */
  public static PyTree.Module parse(CharStream input) {
    return new StatementBuilder().module(newParser(input).fileInput());
  }

  /**
   * Parses a Python module.
   *
   * @throws ParseError if the input is not a syntactically valid module
   */
  public static PyTree.Module parse(String code) {
    return parse(CharStreams.fromString(code));
  }

  /** Parses a single expression (or a comma-separated list of them, returned as a Tuple). */
  static PyTree.Expr parseExpression(String code) {
    PythonParser parser = newParser(CharStreams.fromString(code));
    return new ExpressionBuilder().visit(parser.evalInput().testlist());
  }

  /** Errors from the lexer or parser are thrown as ParseErrors. */
  private static final BaseErrorListener THROWING_LISTENER =
      new BaseErrorListener() {
        @Override
        public void syntaxError(
            Recognizer<?, ?> recognizer,
            Object offendingSymbol,
            int lineNum,
            int charPositionInLine,
            String msg,
            RecognitionException e) {
          throw new ParseError(msg, lineNum, charPositionInLine);
        }
      };

  private static PythonParser newParser(CharStream input) {
    PythonLexer lexer = new PythonLexer(input);
    lexer.removeErrorListeners();
    lexer.addErrorListener(THROWING_LISTENER);
    PythonParser parser =
        new PythonParser(new CommonTokenStream(new IndentingTokenSource(lexer)));
    parser.removeErrorListeners();
    parser.addErrorListener(THROWING_LISTENER);
    return parser;
  }

  /** Returns a new ParseError referring to the given token. */
  static ParseError error(Token token, String msg) {
    int lineNum;
    int charPositionInLine;
    if (token != null) {
      lineNum = token.getLine();
      charPositionInLine = token.getCharPositionInLine();
    } else {
      // Shouldn't happen, but 0:0 is less useless than a NullPointerException.
      lineNum = 0;
      charPositionInLine = 0;
    }
    return new ParseError(msg, lineNum, charPositionInLine);
  }

  /** Returns a new ParseError referring to the given token. */
  @FormatMethod
  static ParseError error(Token token, String fmt, Object... fmtArgs) {
    return error(token, String.format(fmt, fmtArgs));
  }
}
