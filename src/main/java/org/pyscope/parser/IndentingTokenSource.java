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

import static org.pyscope.parser.TokenType.DEDENT;
import static org.pyscope.parser.TokenType.INDENT;
import static org.pyscope.parser.TokenType.NEWLINE;

import java.util.ArrayDeque;
import java.util.Deque;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CommonToken;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.TokenFactory;
import org.antlr.v4.runtime.TokenSource;
import org.jspecify.annotations.Nullable;

/**
 * Wraps a PythonLexer to turn its line breaks into the logical-line structure that the parser
 * expects:
 *
 * <ul>
 *   <li>line breaks inside parentheses, brackets or braces are dropped;
 *   <li>line breaks that end a blank or comment-only line are dropped;
 *   <li>a change of indentation after a NEWLINE is reported with INDENT or DEDENT tokens; and
 *   <li>the end of input is preceded by a NEWLINE (if the last line didn't end with one) and by a
 *       DEDENT for each block that is still open.
 * </ul>
 *
 * Indentation widths follow Python's rules: a tab advances to the next multiple of 8 and a form
 * feed resets the width to zero.
 */
final class IndentingTokenSource implements TokenSource {

  private static final int TAB_SIZE = 8;

  private final PythonLexer lexer;

  /** Tokens that are ready to be returned by {@link #nextToken}. */
  private final Deque<Token> pending = new ArrayDeque<>();

  /** The indentation widths of the open blocks, innermost first; the last element is always 0. */
  private final Deque<Integer> indents = new ArrayDeque<>();

  /** If non-null, the next token from the lexer, read early to decide how to handle a NEWLINE. */
  private @Nullable Token lookahead;

  /** The number of unclosed brackets. */
  private int opened;

  /** The type of the last token added to {@link #pending}, or -1 if there have been none. */
  private int lastType = -1;

  IndentingTokenSource(PythonLexer lexer) {
    this.lexer = lexer;
    indents.push(0);
  }

  @Override
  public Token nextToken() {
    while (pending.isEmpty()) {
      fill();
    }
    return pending.poll();
  }

  private void emit(Token token) {
    pending.add(token);
    lastType = token.getType();
  }

  private Token nextRaw() {
    Token result = lookahead;
    if (result == null) {
      return lexer.nextToken();
    }
    lookahead = null;
    return result;
  }

  private Token peekRaw() {
    if (lookahead == null) {
      lookahead = lexer.nextToken();
    }
    return lookahead;
  }

  /** Reads at least one token from the lexer, adding zero or more tokens to {@link #pending}. */
  private void fill() {
    Token token = nextRaw();
    int type = token.getType();
    if (type == Token.EOF) {
      finish(token);
    } else if (type == NEWLINE) {
      newLine(token);
    } else {
      if (lastType == -1 && token.getCharPositionInLine() != 0) {
        throw PyParser.error(token, "unexpected indent");
      }
      if (type == TokenType.LEFT_PAREN
          || type == TokenType.LEFT_SQUARE
          || type == TokenType.LEFT_CURLY) {
        opened++;
      } else if (type == TokenType.RIGHT_PAREN
          || type == TokenType.RIGHT_SQUARE
          || type == TokenType.RIGHT_CURLY) {
        // Unbalanced closers are left for the parser to report.
        if (opened > 0) {
          opened--;
        }
      }
      emit(token);
    }
  }

  private void newLine(Token newLine) {
    if (opened > 0) {
      return;
    }
    Token next = peekRaw();
    if (next.getType() == NEWLINE) {
      // A blank line; the next NEWLINE carries the indentation that matters.
      return;
    }
    int indent = indentation(newLine.getText());
    if (lastType == -1) {
      // Blank lines at the start of the input.
      if (indent != 0 && next.getType() != Token.EOF) {
        throw PyParser.error(next, "unexpected indent");
      }
      return;
    }
    emit(newLine);
    if (next.getType() == Token.EOF) {
      return;
    }
    if (indent > indents.peek()) {
      indents.push(indent);
      emit(synthetic(INDENT, "<INDENT>", next));
    } else {
      while (indent < indents.peek()) {
        indents.pop();
        emit(synthetic(DEDENT, "<DEDENT>", next));
      }
      if (indent != indents.peek()) {
        throw PyParser.error(next, "unindent does not match any outer indentation level");
      }
    }
  }

  private void finish(Token eof) {
    if (lastType != Token.EOF) {
      if (lastType != -1 && lastType != NEWLINE && lastType != DEDENT) {
        emit(synthetic(NEWLINE, "<NEWLINE>", eof));
      }
      while (indents.peek() != 0) {
        indents.pop();
        emit(synthetic(DEDENT, "<DEDENT>", eof));
      }
    }
    emit(eof);
  }

  /** Returns the indentation width at the end of a NEWLINE token's text. */
  private static int indentation(String newLineText) {
    int width = 0;
    for (int i = 0; i < newLineText.length(); i++) {
      switch (newLineText.charAt(i)) {
        case ' ':
          width++;
          break;
        case '\t':
          width = (width / TAB_SIZE + 1) * TAB_SIZE;
          break;
        default:
          // '\r', '\n' or '\f'
          width = 0;
          break;
      }
    }
    return width;
  }

  /** Returns a new token of the given type, positioned at {@code at}. */
  private static Token synthetic(int type, String text, Token at) {
    CommonToken token = new CommonToken(type, text);
    token.setLine(at.getLine());
    token.setCharPositionInLine(at.getCharPositionInLine());
    token.setStartIndex(at.getStartIndex());
    token.setStopIndex(at.getStartIndex() - 1);
    return token;
  }

  @Override
  public int getLine() {
    return lexer.getLine();
  }

  @Override
  public int getCharPositionInLine() {
    return lexer.getCharPositionInLine();
  }

  @Override
  public CharStream getInputStream() {
    return lexer.getInputStream();
  }

  @Override
  public String getSourceName() {
    return lexer.getSourceName();
  }

  @Override
  public void setTokenFactory(TokenFactory<?> factory) {
    lexer.setTokenFactory(factory);
  }

  @Override
  public TokenFactory<?> getTokenFactory() {
    return lexer.getTokenFactory();
  }
}
