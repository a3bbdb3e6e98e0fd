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

import com.google.common.collect.ImmutableMap;
import org.antlr.v4.runtime.Vocabulary;

/**
 * A statics-only class providing convenient access to ANTLR token types (which are just ints).
 *
 * <p>ANTLR's Vocabulary class doesn't seem to provide any direct way to get the token type for a
 * particular token, so we just build a map of them and look up each one we're interested in once.
 */
class TokenType {

  // Statics only
  private TokenType() {}

  /**
   * A Map from token name to token type. Token names are either literals enclosed in single quotes
   * (e.g. "{@code '+'}") or symbolic names (e.g. "{@code NUMBER}").
   */
  static final ImmutableMap<String, Integer> MAP;

  static {
    // We count on token types being densely allocated starting from 1 to find them all.
    Vocabulary vocab = PythonLexer.VOCABULARY;
    ImmutableMap.Builder<String, Integer> builder = ImmutableMap.builder();
    for (int i = 1; i <= vocab.getMaxTokenType(); i++) {
      String s = vocab.getLiteralName(i);
      if (s == null) {
        s = vocab.getSymbolicName(i);
        if (s == null) {
          continue;
        }
      }
      builder.put(s, i);
    }
    MAP = builder.buildOrThrow();
  }

  /**
   * Returns the token type for the given name. Throws an exception if there is no such token name.
   */
  static int of(String name) {
    Integer result = MAP.get(name);
    if (result == null) {
      throw new IllegalArgumentException("No token named " + name);
    }
    return result;
  }

  static final int LEFT_PAREN = of("'('");
  static final int RIGHT_PAREN = of("')'");
  static final int LEFT_SQUARE = of("'['");
  static final int RIGHT_SQUARE = of("']'");
  static final int LEFT_CURLY = of("'{'");
  static final int RIGHT_CURLY = of("'}'");
  static final int NEWLINE = PythonLexer.NEWLINE;
  static final int INDENT = PythonParser.INDENT;
  static final int DEDENT = PythonParser.DEDENT;
}
