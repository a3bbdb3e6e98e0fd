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

package org.pyscope.tree;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.pyscope.tree.PyTree.Node;

/**
 * A PyTree.Visitor that visits every node of a tree, children in the order the grammar defines
 * them. Subclasses override the methods for the node kinds they need to handle specially, and call
 * {@link #visitChildren} (or visit selected children themselves) to continue the walk.
 */
public abstract class TreeWalker implements PyTree.Visitor<Void> {

  /** Visits the given node. */
  public final void visit(Node node) {
    node.accept(this);
  }

  /** Visits the given node if it is non-null. */
  protected final void visitIfPresent(@Nullable Node node) {
    if (node != null) {
      node.accept(this);
    }
  }

  /** Visits each of the non-null nodes in the list, in order. */
  protected final void visitAll(List<? extends @Nullable Node> nodes) {
    for (Node node : nodes) {
      visitIfPresent(node);
    }
  }

  /** Visits each of the node's children, in order. */
  protected final void visitChildren(Node node) {
    for (Node child : node.children()) {
      child.accept(this);
    }
  }

  @Override
  public Void visitModule(PyTree.Module node) {
    visitChildren(node);
    return null;
  }

  @Override
  public Void visitFunctionDef(PyTree.FunctionDef node) {
    visitChildren(node);
    return null;
  }

  @Override
  public Void visitClassDef(PyTree.ClassDef node) {
    visitChildren(node);
    return null;
  }

  @Override
  public Void visitReturn(PyTree.Return node) {
    visitChildren(node);
    return null;
  }

  @Override
  public Void visitDelete(PyTree.Delete node) {
    visitChildren(node);
    return null;
  }

  @Override
  public Void visitAssign(PyTree.Assign node) {
    visitChildren(node);
    return null;
  }

  @Override
  public Void visitAugAssign(PyTree.AugAssign node) {
    visitChildren(node);
    return null;
  }

  @Override
  public Void visitAnnAssign(PyTree.AnnAssign node) {
    visitChildren(node);
    return null;
  }

  @Override
  public Void visitFor(PyTree.For node) {
    visitChildren(node);
    return null;
  }

  @Override
  public Void visitWhile(PyTree.While node) {
    visitChildren(node);
    return null;
  }

  @Override
  public Void visitIf(PyTree.If node) {
    visitChildren(node);
    return null;
  }

  @Override
  public Void visitWith(PyTree.With node) {
    visitChildren(node);
    return null;
  }

  @Override
  public Void visitMatch(PyTree.Match node) {
    visitChildren(node);
    return null;
  }

  @Override
  public Void visitRaise(PyTree.Raise node) {
    visitChildren(node);
    return null;
  }

  @Override
  public Void visitTry(PyTree.Try node) {
    visitChildren(node);
    return null;
  }

  @Override
  public Void visitAssert(PyTree.Assert node) {
    visitChildren(node);
    return null;
  }

  @Override
  public Void visitImport(PyTree.Import node) {
    visitChildren(node);
    return null;
  }

  @Override
  public Void visitImportFrom(PyTree.ImportFrom node) {
    visitChildren(node);
    return null;
  }

  @Override
  public Void visitGlobal(PyTree.Global node) {
    visitChildren(node);
    return null;
  }

  @Override
  public Void visitNonlocal(PyTree.Nonlocal node) {
    visitChildren(node);
    return null;
  }

  @Override
  public Void visitExprStmt(PyTree.ExprStmt node) {
    visitChildren(node);
    return null;
  }

  @Override
  public Void visitPass(PyTree.Pass node) {
    visitChildren(node);
    return null;
  }

  @Override
  public Void visitBreak(PyTree.Break node) {
    visitChildren(node);
    return null;
  }

  @Override
  public Void visitContinue(PyTree.Continue node) {
    visitChildren(node);
    return null;
  }

  @Override
  public Void visitBoolOp(PyTree.BoolOp node) {
    visitChildren(node);
    return null;
  }

  @Override
  public Void visitNamedExpr(PyTree.NamedExpr node) {
    visitChildren(node);
    return null;
  }

  /**
   * Left operands that are themselves BinOps are walked in the same loop rather than dispatched, so
   * a long chain such as {@code a + b + ... + z} does not recurse once per operator.
   */
  @Override
  public Void visitBinOp(PyTree.BinOp node) {
    Deque<PyTree.BinOp> spine = new ArrayDeque<>();
    PyTree.Expr left = node;
    while (left instanceof PyTree.BinOp) {
      PyTree.BinOp binOp = (PyTree.BinOp) left;
      spine.push(binOp);
      left = binOp.left;
    }
    left.accept(this);
    while (!spine.isEmpty()) {
      spine.pop().right.accept(this);
    }
    return null;
  }

  @Override
  public Void visitUnaryOp(PyTree.UnaryOp node) {
    visitChildren(node);
    return null;
  }

  @Override
  public Void visitLambda(PyTree.Lambda node) {
    visitChildren(node);
    return null;
  }

  @Override
  public Void visitIfExp(PyTree.IfExp node) {
    visitChildren(node);
    return null;
  }

  @Override
  public Void visitDict(PyTree.Dict node) {
    visitChildren(node);
    return null;
  }

  @Override
  public Void visitSetExpr(PyTree.SetExpr node) {
    visitChildren(node);
    return null;
  }

  @Override
  public Void visitListComp(PyTree.ListComp node) {
    visitChildren(node);
    return null;
  }

  @Override
  public Void visitSetComp(PyTree.SetComp node) {
    visitChildren(node);
    return null;
  }

  @Override
  public Void visitDictComp(PyTree.DictComp node) {
    visitChildren(node);
    return null;
  }

  @Override
  public Void visitGeneratorExp(PyTree.GeneratorExp node) {
    visitChildren(node);
    return null;
  }

  @Override
  public Void visitAwait(PyTree.Await node) {
    visitChildren(node);
    return null;
  }

  @Override
  public Void visitYield(PyTree.Yield node) {
    visitChildren(node);
    return null;
  }

  @Override
  public Void visitYieldFrom(PyTree.YieldFrom node) {
    visitChildren(node);
    return null;
  }

  @Override
  public Void visitCompare(PyTree.Compare node) {
    visitChildren(node);
    return null;
  }

  @Override
  public Void visitCall(PyTree.Call node) {
    visitChildren(node);
    return null;
  }

  @Override
  public Void visitFormattedValue(PyTree.FormattedValue node) {
    visitChildren(node);
    return null;
  }

  @Override
  public Void visitJoinedStr(PyTree.JoinedStr node) {
    visitChildren(node);
    return null;
  }

  @Override
  public Void visitConstant(PyTree.Constant node) {
    visitChildren(node);
    return null;
  }

  @Override
  public Void visitAttribute(PyTree.Attribute node) {
    visitChildren(node);
    return null;
  }

  @Override
  public Void visitSubscript(PyTree.Subscript node) {
    visitChildren(node);
    return null;
  }

  @Override
  public Void visitStarred(PyTree.Starred node) {
    visitChildren(node);
    return null;
  }

  @Override
  public Void visitName(PyTree.Name node) {
    visitChildren(node);
    return null;
  }

  @Override
  public Void visitListExpr(PyTree.ListExpr node) {
    visitChildren(node);
    return null;
  }

  @Override
  public Void visitTuple(PyTree.Tuple node) {
    visitChildren(node);
    return null;
  }

  @Override
  public Void visitSlice(PyTree.Slice node) {
    visitChildren(node);
    return null;
  }

  @Override
  public Void visitArguments(PyTree.Arguments node) {
    visitChildren(node);
    return null;
  }

  @Override
  public Void visitArg(PyTree.Arg node) {
    visitChildren(node);
    return null;
  }

  @Override
  public Void visitKeyword(PyTree.Keyword node) {
    visitChildren(node);
    return null;
  }

  @Override
  public Void visitAlias(PyTree.Alias node) {
    visitChildren(node);
    return null;
  }

  @Override
  public Void visitWithItem(PyTree.WithItem node) {
    visitChildren(node);
    return null;
  }

  @Override
  public Void visitExceptHandler(PyTree.ExceptHandler node) {
    visitChildren(node);
    return null;
  }

  @Override
  public Void visitComprehension(PyTree.Comprehension node) {
    visitChildren(node);
    return null;
  }

  @Override
  public Void visitMatchCase(PyTree.MatchCase node) {
    visitChildren(node);
    return null;
  }

  @Override
  public Void visitMatchValue(PyTree.MatchValue node) {
    visitChildren(node);
    return null;
  }

  @Override
  public Void visitMatchSingleton(PyTree.MatchSingleton node) {
    visitChildren(node);
    return null;
  }

  @Override
  public Void visitMatchSequence(PyTree.MatchSequence node) {
    visitChildren(node);
    return null;
  }

  @Override
  public Void visitMatchMapping(PyTree.MatchMapping node) {
    visitChildren(node);
    return null;
  }

  @Override
  public Void visitMatchClass(PyTree.MatchClass node) {
    visitChildren(node);
    return null;
  }

  @Override
  public Void visitMatchStar(PyTree.MatchStar node) {
    visitChildren(node);
    return null;
  }

  @Override
  public Void visitMatchAs(PyTree.MatchAs node) {
    visitChildren(node);
    return null;
  }

  @Override
  public Void visitMatchOr(PyTree.MatchOr node) {
    visitChildren(node);
    return null;
  }
}
