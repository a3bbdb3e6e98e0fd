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
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.ParseTree;

/**
 * A base class for ANTLR visitors that provides two useful functions:
 *
 * <ul>
 *   <li>It disables the default "do nothing" behavior for node types that haven't been overridden.
 *       Visiting a node that doesn't have an explicit visit* method will throw an AssertionError.
 *   <li>It provides error() methods that automatically fill in the node currently being visited as
 *       the location of the error.
 * </ul>
 */
class VisitorBase<T> extends PythonBaseVisitor<T> {

  /** The node currently being visited. */
  private ParseTree currentNode;

  @Override
  protected final T defaultResult() {
    // defaultResult() is called by all the default visitXXX() methods defined on
    // PythonBaseVisitor.  Our intent is to override all of the methods that might
    // be called, so we should never get here.
    throw new AssertionError("No visit method for " + currentNode.getClass().getSimpleName());
  }

  /**
   * Visits the given node, binding {@link #currentNode} for the duration of the call.
   *
   * <p>Assumes that if the visit throws an exception, this Visitor will not be used again (no
   * attempt is made to restore the correct currentNode state).
   */
  @Override
  public final T visit(ParseTree tree) {
    ParseTree prevNode = currentNode;
    currentNode = tree;
    T result = super.visit(tree);
    currentNode = prevNode;
    return result;
  }

  /** Returns the first token of the current node. */
  Token currentToken() {
    return ((ParserRuleContext) currentNode).start;
  }

  /** Returns a {@link ParseError} pointing at the current node. */
  ParseError error(String msg) {
    return PyParser.error(currentToken(), msg);
  }

  /** Returns a {@link ParseError} pointing at the current node. */
  @FormatMethod
  ParseError error(String fmt, Object... fmtArgs) {
    return PyParser.error(currentToken(), fmt, fmtArgs);
  }
}
