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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;

/**
 * The PyTree class is just a namespace for the node classes of a Python syntax tree.
 *
 * <p>The node kinds form a closed set: every concrete node is a final nested class of PyTree, and
 * {@link Visitor} has one method for each of them. Nodes are immutable, and each node's children
 * are available (in the order the Python grammar defines its fields) from {@link Node#children},
 * which is what {@link TreeWalker} uses for structural traversal.
 *
 * <p>Constructors check that required children are present; a node that can't be constructed is a
 * bug in whatever is building the tree, so these checks throw NullPointerException or
 * IllegalArgumentException rather than a checked exception.
 */
public final class PyTree {

  // Just a namespace for the contained classes.
  private PyTree() {}

  /** Whether an identifier (or a target containing identifiers) is read, written, or deleted. */
  public enum ExprContext {
    LOAD,
    STORE,
    DEL
  }

  /** The base class of all syntax tree nodes. */
  public abstract static class Node {
    Node() {}

    /** Calls the visitor method corresponding to this node's kind. */
    public abstract <T> T accept(Visitor<T> visitor);

    /** Returns this node's children, in the order the grammar defines them. */
    public abstract ImmutableList<Node> children();

    /**
     * Returns a short description of this node that doesn't include its children, e.g. "{@code
     * FunctionDef f}" or "{@code Name x:STORE}".
     */
    public String label() {
      return getClass().getSimpleName();
    }

    /** Returns a parenthesized dump of this node and its descendants. */
    @Override
    public String toString() {
      ImmutableList<Node> children = children();
      if (children.isEmpty()) {
        return "(" + label() + ")";
      }
      return children.stream()
          .map(Node::toString)
          .collect(Collectors.joining(" ", "(" + label() + " ", ")"));
    }
  }

  /** Statements. */
  public abstract static class Stmt extends Node {
    Stmt() {}
  }

  /** Expressions, including assignment targets. */
  public abstract static class Expr extends Node {
    Expr() {}
  }

  /** The patterns of a {@code case} clause. */
  public abstract static class Pattern extends Node {
    Pattern() {}
  }

  /**
   * Returns the non-null nodes among {@code fields} in order, with each List field replaced by its
   * (non-null) elements.
   */
  static ImmutableList<Node> nodes(@Nullable Object... fields) {
    ImmutableList.Builder<Node> builder = ImmutableList.builder();
    for (Object field : fields) {
      if (field instanceof Node) {
        builder.add((Node) field);
      } else if (field instanceof List) {
        for (Object element : (List<?>) field) {
          if (element != null) {
            builder.add((Node) element);
          }
        }
      } else {
        assert field == null;
      }
    }
    return builder.build();
  }

  /** Returns an unmodifiable copy of a list that may contain nulls. */
  private static <T> List<@Nullable T> copyWithNulls(List<? extends @Nullable T> list) {
    return Collections.unmodifiableList(new ArrayList<@Nullable T>(list));
  }

  /** A parsed source file. */
  public static final class Module extends Node {
    public final ImmutableList<Stmt> body;

    public Module(List<? extends Stmt> body) {
      this.body = ImmutableList.copyOf(body);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitModule(this);
    }

    @Override
    public ImmutableList<Node> children() {
      return nodes(body);
    }
  }

  // Statements

  /** {@code def name(args) -> returns: body} or {@code async def ...}. */
  public static final class FunctionDef extends Stmt {
    public final String name;
    public final Arguments args;
    public final ImmutableList<Stmt> body;
    public final ImmutableList<Expr> decorators;
    public final @Nullable Expr returns;
    public final boolean isAsync;

    public FunctionDef(
        String name,
        Arguments args,
        List<? extends Stmt> body,
        List<? extends Expr> decorators,
        @Nullable Expr returns,
        boolean isAsync) {
      this.name = checkNotNull(name);
      this.args = checkNotNull(args);
      this.body = ImmutableList.copyOf(body);
      this.decorators = ImmutableList.copyOf(decorators);
      this.returns = returns;
      this.isAsync = isAsync;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitFunctionDef(this);
    }

    @Override
    public ImmutableList<Node> children() {
      return nodes(args, body, decorators, returns);
    }

    @Override
    public String label() {
      return (isAsync ? "AsyncFunctionDef " : "FunctionDef ") + name;
    }
  }

  /** {@code class name(bases, keywords): body}. */
  public static final class ClassDef extends Stmt {
    public final String name;
    public final ImmutableList<Expr> bases;
    public final ImmutableList<Keyword> keywords;
    public final ImmutableList<Stmt> body;
    public final ImmutableList<Expr> decorators;

    public ClassDef(
        String name,
        List<? extends Expr> bases,
        List<Keyword> keywords,
        List<? extends Stmt> body,
        List<? extends Expr> decorators) {
      this.name = checkNotNull(name);
      this.bases = ImmutableList.copyOf(bases);
      this.keywords = ImmutableList.copyOf(keywords);
      this.body = ImmutableList.copyOf(body);
      this.decorators = ImmutableList.copyOf(decorators);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitClassDef(this);
    }

    @Override
    public ImmutableList<Node> children() {
      return nodes(bases, keywords, body, decorators);
    }

    @Override
    public String label() {
      return "ClassDef " + name;
    }
  }

  /** {@code return value}. */
  public static final class Return extends Stmt {
    public final @Nullable Expr value;

    public Return(@Nullable Expr value) {
      this.value = value;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitReturn(this);
    }

    @Override
    public ImmutableList<Node> children() {
      return nodes(value);
    }
  }

  /** {@code del targets}. */
  public static final class Delete extends Stmt {
    public final ImmutableList<Expr> targets;

    public Delete(List<? extends Expr> targets) {
      this.targets = ImmutableList.copyOf(targets);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitDelete(this);
    }

    @Override
    public ImmutableList<Node> children() {
      return nodes(targets);
    }
  }

  /** {@code t1 = t2 = ... = value}. */
  public static final class Assign extends Stmt {
    public final ImmutableList<Expr> targets;
    public final Expr value;

    public Assign(List<? extends Expr> targets, Expr value) {
      checkArgument(!targets.isEmpty());
      this.targets = ImmutableList.copyOf(targets);
      this.value = checkNotNull(value);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitAssign(this);
    }

    @Override
    public ImmutableList<Node> children() {
      return nodes(targets, value);
    }
  }

  /** {@code target op= value}, e.g. {@code x += 1}. */
  public static final class AugAssign extends Stmt {
    public final Expr target;
    public final String op;
    public final Expr value;

    public AugAssign(Expr target, String op, Expr value) {
      this.target = checkNotNull(target);
      this.op = checkNotNull(op);
      this.value = checkNotNull(value);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitAugAssign(this);
    }

    @Override
    public ImmutableList<Node> children() {
      return nodes(target, value);
    }

    @Override
    public String label() {
      return "AugAssign " + op;
    }
  }

  /** {@code target: annotation = value}; value may be omitted. */
  public static final class AnnAssign extends Stmt {
    public final Expr target;
    public final Expr annotation;
    public final @Nullable Expr value;

    public AnnAssign(Expr target, Expr annotation, @Nullable Expr value) {
      this.target = checkNotNull(target);
      this.annotation = checkNotNull(annotation);
      this.value = value;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitAnnAssign(this);
    }

    @Override
    public ImmutableList<Node> children() {
      return nodes(target, annotation, value);
    }
  }

  /** {@code for target in iter: body else: orElse}, optionally async. */
  public static final class For extends Stmt {
    public final Expr target;
    public final Expr iter;
    public final ImmutableList<Stmt> body;
    public final ImmutableList<Stmt> orElse;
    public final boolean isAsync;

    public For(
        Expr target,
        Expr iter,
        List<? extends Stmt> body,
        List<? extends Stmt> orElse,
        boolean isAsync) {
      this.target = checkNotNull(target);
      this.iter = checkNotNull(iter);
      this.body = ImmutableList.copyOf(body);
      this.orElse = ImmutableList.copyOf(orElse);
      this.isAsync = isAsync;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitFor(this);
    }

    @Override
    public ImmutableList<Node> children() {
      return nodes(target, iter, body, orElse);
    }

    @Override
    public String label() {
      return isAsync ? "AsyncFor" : "For";
    }
  }

  /** {@code while test: body else: orElse}. */
  public static final class While extends Stmt {
    public final Expr test;
    public final ImmutableList<Stmt> body;
    public final ImmutableList<Stmt> orElse;

    public While(Expr test, List<? extends Stmt> body, List<? extends Stmt> orElse) {
      this.test = checkNotNull(test);
      this.body = ImmutableList.copyOf(body);
      this.orElse = ImmutableList.copyOf(orElse);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitWhile(this);
    }

    @Override
    public ImmutableList<Node> children() {
      return nodes(test, body, orElse);
    }
  }

  /** {@code if test: body else: orElse}; an {@code elif} is an If nested in orElse. */
  public static final class If extends Stmt {
    public final Expr test;
    public final ImmutableList<Stmt> body;
    public final ImmutableList<Stmt> orElse;

    public If(Expr test, List<? extends Stmt> body, List<? extends Stmt> orElse) {
      this.test = checkNotNull(test);
      this.body = ImmutableList.copyOf(body);
      this.orElse = ImmutableList.copyOf(orElse);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitIf(this);
    }

    @Override
    public ImmutableList<Node> children() {
      return nodes(test, body, orElse);
    }
  }

  /** {@code with items: body}, optionally async. */
  public static final class With extends Stmt {
    public final ImmutableList<WithItem> items;
    public final ImmutableList<Stmt> body;
    public final boolean isAsync;

    public With(List<WithItem> items, List<? extends Stmt> body, boolean isAsync) {
      checkArgument(!items.isEmpty());
      this.items = ImmutableList.copyOf(items);
      this.body = ImmutableList.copyOf(body);
      this.isAsync = isAsync;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitWith(this);
    }

    @Override
    public ImmutableList<Node> children() {
      return nodes(items, body);
    }

    @Override
    public String label() {
      return isAsync ? "AsyncWith" : "With";
    }
  }

  /** {@code match subject:} followed by one or more {@code case} clauses. */
  public static final class Match extends Stmt {
    public final Expr subject;
    public final ImmutableList<MatchCase> cases;

    public Match(Expr subject, List<MatchCase> cases) {
      checkArgument(!cases.isEmpty());
      this.subject = checkNotNull(subject);
      this.cases = ImmutableList.copyOf(cases);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitMatch(this);
    }

    @Override
    public ImmutableList<Node> children() {
      return nodes(subject, cases);
    }
  }

  /** {@code raise exc from cause}; both are optional. */
  public static final class Raise extends Stmt {
    public final @Nullable Expr exc;
    public final @Nullable Expr cause;

    public Raise(@Nullable Expr exc, @Nullable Expr cause) {
      checkArgument(exc != null || cause == null);
      this.exc = exc;
      this.cause = cause;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitRaise(this);
    }

    @Override
    public ImmutableList<Node> children() {
      return nodes(exc, cause);
    }
  }

  /** {@code try: body except...: else: orElse finally: finalBody}; isStar for {@code except*}. */
  public static final class Try extends Stmt {
    public final ImmutableList<Stmt> body;
    public final ImmutableList<ExceptHandler> handlers;
    public final ImmutableList<Stmt> orElse;
    public final ImmutableList<Stmt> finalBody;
    public final boolean isStar;

    public Try(
        List<? extends Stmt> body,
        List<ExceptHandler> handlers,
        List<? extends Stmt> orElse,
        List<? extends Stmt> finalBody,
        boolean isStar) {
      checkArgument(!handlers.isEmpty() || !finalBody.isEmpty());
      this.body = ImmutableList.copyOf(body);
      this.handlers = ImmutableList.copyOf(handlers);
      this.orElse = ImmutableList.copyOf(orElse);
      this.finalBody = ImmutableList.copyOf(finalBody);
      this.isStar = isStar;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitTry(this);
    }

    @Override
    public ImmutableList<Node> children() {
      return nodes(body, handlers, orElse, finalBody);
    }

    @Override
    public String label() {
      return isStar ? "TryStar" : "Try";
    }
  }

  /** {@code assert test, msg}. */
  public static final class Assert extends Stmt {
    public final Expr test;
    public final @Nullable Expr msg;

    public Assert(Expr test, @Nullable Expr msg) {
      this.test = checkNotNull(test);
      this.msg = msg;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitAssert(this);
    }

    @Override
    public ImmutableList<Node> children() {
      return nodes(test, msg);
    }
  }

  /** {@code import a.b.c as d, e}. */
  public static final class Import extends Stmt {
    public final ImmutableList<Alias> names;

    public Import(List<Alias> names) {
      checkArgument(!names.isEmpty());
      this.names = ImmutableList.copyOf(names);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitImport(this);
    }

    @Override
    public ImmutableList<Node> children() {
      return nodes(names);
    }
  }

  /**
   * {@code from ..module import names}; {@code module} is null for e.g. {@code from . import x},
   * and {@code level} is the number of leading dots.
   */
  public static final class ImportFrom extends Stmt {
    public final @Nullable String module;
    public final ImmutableList<Alias> names;
    public final int level;

    public ImportFrom(@Nullable String module, List<Alias> names, int level) {
      checkArgument(!names.isEmpty() && level >= 0 && (module != null || level > 0));
      this.module = module;
      this.names = ImmutableList.copyOf(names);
      this.level = level;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitImportFrom(this);
    }

    @Override
    public ImmutableList<Node> children() {
      return nodes(names);
    }

    @Override
    public String label() {
      return "ImportFrom " + ".".repeat(level) + (module == null ? "" : module);
    }
  }

  /** {@code global a, b}. */
  public static final class Global extends Stmt {
    public final ImmutableList<String> names;

    public Global(List<String> names) {
      checkArgument(!names.isEmpty());
      this.names = ImmutableList.copyOf(names);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitGlobal(this);
    }

    @Override
    public ImmutableList<Node> children() {
      return ImmutableList.of();
    }

    @Override
    public String label() {
      return "Global " + String.join(",", names);
    }
  }

  /** {@code nonlocal a, b}. */
  public static final class Nonlocal extends Stmt {
    public final ImmutableList<String> names;

    public Nonlocal(List<String> names) {
      checkArgument(!names.isEmpty());
      this.names = ImmutableList.copyOf(names);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitNonlocal(this);
    }

    @Override
    public ImmutableList<Node> children() {
      return ImmutableList.of();
    }

    @Override
    public String label() {
      return "Nonlocal " + String.join(",", names);
    }
  }

  /** An expression used as a statement. */
  public static final class ExprStmt extends Stmt {
    public final Expr value;

    public ExprStmt(Expr value) {
      this.value = checkNotNull(value);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitExprStmt(this);
    }

    @Override
    public ImmutableList<Node> children() {
      return nodes(value);
    }
  }

  /** {@code pass}. */
  public static final class Pass extends Stmt {
    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitPass(this);
    }

    @Override
    public ImmutableList<Node> children() {
      return ImmutableList.of();
    }
  }

  /** {@code break}. */
  public static final class Break extends Stmt {
    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitBreak(this);
    }

    @Override
    public ImmutableList<Node> children() {
      return ImmutableList.of();
    }
  }

  /** {@code continue}. */
  public static final class Continue extends Stmt {
    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitContinue(this);
    }

    @Override
    public ImmutableList<Node> children() {
      return ImmutableList.of();
    }
  }

  // Expressions

  /** {@code a and b and c} or {@code a or b}. */
  public static final class BoolOp extends Expr {
    public final String op;
    public final ImmutableList<Expr> values;

    public BoolOp(String op, List<? extends Expr> values) {
      checkArgument(values.size() >= 2);
      this.op = checkNotNull(op);
      this.values = ImmutableList.copyOf(values);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitBoolOp(this);
    }

    @Override
    public ImmutableList<Node> children() {
      return nodes(values);
    }

    @Override
    public String label() {
      return "BoolOp " + op;
    }
  }

  /** {@code target := value}. */
  public static final class NamedExpr extends Expr {
    public final Expr target;
    public final Expr value;

    public NamedExpr(Expr target, Expr value) {
      this.target = checkNotNull(target);
      this.value = checkNotNull(value);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitNamedExpr(this);
    }

    @Override
    public ImmutableList<Node> children() {
      return nodes(target, value);
    }
  }

  /** {@code left op right}. */
  public static final class BinOp extends Expr {
    public final Expr left;
    public final String op;
    public final Expr right;

    public BinOp(Expr left, String op, Expr right) {
      this.left = checkNotNull(left);
      this.op = checkNotNull(op);
      this.right = checkNotNull(right);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitBinOp(this);
    }

    @Override
    public ImmutableList<Node> children() {
      return nodes(left, right);
    }

    @Override
    public String label() {
      return "BinOp " + op;
    }
  }

  /** {@code op operand}, where op is one of {@code not + - ~}. */
  public static final class UnaryOp extends Expr {
    public final String op;
    public final Expr operand;

    public UnaryOp(String op, Expr operand) {
      this.op = checkNotNull(op);
      this.operand = checkNotNull(operand);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitUnaryOp(this);
    }

    @Override
    public ImmutableList<Node> children() {
      return nodes(operand);
    }

    @Override
    public String label() {
      return "UnaryOp " + op;
    }
  }

  /** {@code lambda args: body}. */
  public static final class Lambda extends Expr {
    public final Arguments args;
    public final Expr body;

    public Lambda(Arguments args, Expr body) {
      this.args = checkNotNull(args);
      this.body = checkNotNull(body);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitLambda(this);
    }

    @Override
    public ImmutableList<Node> children() {
      return nodes(args, body);
    }
  }

  /** {@code body if test else orElse}. */
  public static final class IfExp extends Expr {
    public final Expr test;
    public final Expr body;
    public final Expr orElse;

    public IfExp(Expr test, Expr body, Expr orElse) {
      this.test = checkNotNull(test);
      this.body = checkNotNull(body);
      this.orElse = checkNotNull(orElse);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitIfExp(this);
    }

    @Override
    public ImmutableList<Node> children() {
      return nodes(test, body, orElse);
    }
  }

  /**
   * {@code {k1: v1, **d}}. {@code keys} and {@code values} have the same length; a null key means
   * the corresponding value is unpacked with {@code **}.
   */
  public static final class Dict extends Expr {
    public final List<@Nullable Expr> keys;
    public final ImmutableList<Expr> values;

    public Dict(List<? extends @Nullable Expr> keys, List<? extends Expr> values) {
      checkArgument(keys.size() == values.size());
      this.keys = copyWithNulls(keys);
      this.values = ImmutableList.copyOf(values);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitDict(this);
    }

    @Override
    public ImmutableList<Node> children() {
      return nodes(keys, values);
    }
  }

  /** {@code {a, b, *c}}. */
  public static final class SetExpr extends Expr {
    public final ImmutableList<Expr> elts;

    public SetExpr(List<? extends Expr> elts) {
      checkArgument(!elts.isEmpty());
      this.elts = ImmutableList.copyOf(elts);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitSetExpr(this);
    }

    @Override
    public ImmutableList<Node> children() {
      return nodes(elts);
    }

    @Override
    public String label() {
      return "Set";
    }
  }

  /** {@code [elt for ... in ... if ...]}. */
  public static final class ListComp extends Expr {
    public final Expr elt;
    public final ImmutableList<Comprehension> generators;

    public ListComp(Expr elt, List<Comprehension> generators) {
      checkArgument(!generators.isEmpty());
      this.elt = checkNotNull(elt);
      this.generators = ImmutableList.copyOf(generators);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitListComp(this);
    }

    @Override
    public ImmutableList<Node> children() {
      return nodes(elt, generators);
    }
  }

  /** {@code {elt for ... in ... if ...}}. */
  public static final class SetComp extends Expr {
    public final Expr elt;
    public final ImmutableList<Comprehension> generators;

    public SetComp(Expr elt, List<Comprehension> generators) {
      checkArgument(!generators.isEmpty());
      this.elt = checkNotNull(elt);
      this.generators = ImmutableList.copyOf(generators);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitSetComp(this);
    }

    @Override
    public ImmutableList<Node> children() {
      return nodes(elt, generators);
    }
  }

  /** {@code {key: value for ... in ... if ...}}. */
  public static final class DictComp extends Expr {
    public final Expr key;
    public final Expr value;
    public final ImmutableList<Comprehension> generators;

    public DictComp(Expr key, Expr value, List<Comprehension> generators) {
      checkArgument(!generators.isEmpty());
      this.key = checkNotNull(key);
      this.value = checkNotNull(value);
      this.generators = ImmutableList.copyOf(generators);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitDictComp(this);
    }

    @Override
    public ImmutableList<Node> children() {
      return nodes(key, value, generators);
    }
  }

  /** {@code (elt for ... in ... if ...)}. */
  public static final class GeneratorExp extends Expr {
    public final Expr elt;
    public final ImmutableList<Comprehension> generators;

    public GeneratorExp(Expr elt, List<Comprehension> generators) {
      checkArgument(!generators.isEmpty());
      this.elt = checkNotNull(elt);
      this.generators = ImmutableList.copyOf(generators);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitGeneratorExp(this);
    }

    @Override
    public ImmutableList<Node> children() {
      return nodes(elt, generators);
    }
  }

  /** {@code await value}. */
  public static final class Await extends Expr {
    public final Expr value;

    public Await(Expr value) {
      this.value = checkNotNull(value);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitAwait(this);
    }

    @Override
    public ImmutableList<Node> children() {
      return nodes(value);
    }
  }

  /** {@code yield value}; value may be omitted. */
  public static final class Yield extends Expr {
    public final @Nullable Expr value;

    public Yield(@Nullable Expr value) {
      this.value = value;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitYield(this);
    }

    @Override
    public ImmutableList<Node> children() {
      return nodes(value);
    }
  }

  /** {@code yield from value}. */
  public static final class YieldFrom extends Expr {
    public final Expr value;

    public YieldFrom(Expr value) {
      this.value = checkNotNull(value);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitYieldFrom(this);
    }

    @Override
    public ImmutableList<Node> children() {
      return nodes(value);
    }
  }

  /** {@code left op1 c1 op2 c2 ...}, e.g. {@code 0 <= x < n}. */
  public static final class Compare extends Expr {
    public final Expr left;
    public final ImmutableList<String> ops;
    public final ImmutableList<Expr> comparators;

    public Compare(Expr left, List<String> ops, List<? extends Expr> comparators) {
      checkArgument(!ops.isEmpty() && ops.size() == comparators.size());
      this.left = checkNotNull(left);
      this.ops = ImmutableList.copyOf(ops);
      this.comparators = ImmutableList.copyOf(comparators);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitCompare(this);
    }

    @Override
    public ImmutableList<Node> children() {
      return nodes(left, comparators);
    }

    @Override
    public String label() {
      return "Compare " + String.join(",", ops);
    }
  }

  /** {@code func(args, keywords)}. */
  public static final class Call extends Expr {
    public final Expr func;
    public final ImmutableList<Expr> args;
    public final ImmutableList<Keyword> keywords;

    public Call(Expr func, List<? extends Expr> args, List<Keyword> keywords) {
      this.func = checkNotNull(func);
      this.args = ImmutableList.copyOf(args);
      this.keywords = ImmutableList.copyOf(keywords);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitCall(this);
    }

    @Override
    public ImmutableList<Node> children() {
      return nodes(func, args, keywords);
    }
  }

  /**
   * A replacement field of an f-string, {@code {value!conversion:formatSpec}}. {@code conversion}
   * is 0 if absent, otherwise one of 's', 'r', 'a'.
   */
  public static final class FormattedValue extends Expr {
    public final Expr value;
    public final char conversion;
    public final @Nullable JoinedStr formatSpec;

    public FormattedValue(Expr value, char conversion, @Nullable JoinedStr formatSpec) {
      this.value = checkNotNull(value);
      this.conversion = conversion;
      this.formatSpec = formatSpec;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitFormattedValue(this);
    }

    @Override
    public ImmutableList<Node> children() {
      return nodes(value, formatSpec);
    }
  }

  /** An f-string: literal text ({@link Constant}s) interleaved with {@link FormattedValue}s. */
  public static final class JoinedStr extends Expr {
    public final ImmutableList<Expr> values;

    public JoinedStr(List<? extends Expr> values) {
      this.values = ImmutableList.copyOf(values);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitJoinedStr(this);
    }

    @Override
    public ImmutableList<Node> children() {
      return nodes(values);
    }
  }

  /**
   * A literal number, string, bytes, {@code None}, {@code True}, {@code False} or {@code ...}. The
   * value is kept as its source text.
   */
  public static final class Constant extends Expr {
    public final String text;

    public Constant(String text) {
      this.text = checkNotNull(text);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitConstant(this);
    }

    @Override
    public ImmutableList<Node> children() {
      return ImmutableList.of();
    }

    @Override
    public String label() {
      return "Constant " + text;
    }
  }

  /** {@code value.attr}. */
  public static final class Attribute extends Expr {
    public final Expr value;
    public final String attr;
    public final ExprContext ctx;

    public Attribute(Expr value, String attr, ExprContext ctx) {
      this.value = checkNotNull(value);
      this.attr = checkNotNull(attr);
      this.ctx = checkNotNull(ctx);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitAttribute(this);
    }

    @Override
    public ImmutableList<Node> children() {
      return nodes(value);
    }

    @Override
    public String label() {
      return "Attribute " + attr + ":" + ctx;
    }
  }

  /** {@code value[slice]}. */
  public static final class Subscript extends Expr {
    public final Expr value;
    public final Expr slice;
    public final ExprContext ctx;

    public Subscript(Expr value, Expr slice, ExprContext ctx) {
      this.value = checkNotNull(value);
      this.slice = checkNotNull(slice);
      this.ctx = checkNotNull(ctx);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitSubscript(this);
    }

    @Override
    public ImmutableList<Node> children() {
      return nodes(value, slice);
    }

    @Override
    public String label() {
      return "Subscript:" + ctx;
    }
  }

  /** {@code *value}. */
  public static final class Starred extends Expr {
    public final Expr value;
    public final ExprContext ctx;

    public Starred(Expr value, ExprContext ctx) {
      this.value = checkNotNull(value);
      this.ctx = checkNotNull(ctx);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitStarred(this);
    }

    @Override
    public ImmutableList<Node> children() {
      return nodes(value);
    }

    @Override
    public String label() {
      return "Starred:" + ctx;
    }
  }

  /** A bare identifier. */
  public static final class Name extends Expr {
    public final String id;
    public final ExprContext ctx;

    public Name(String id, ExprContext ctx) {
      checkArgument(!id.isEmpty());
      this.id = id;
      this.ctx = checkNotNull(ctx);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitName(this);
    }

    @Override
    public ImmutableList<Node> children() {
      return ImmutableList.of();
    }

    @Override
    public String label() {
      return "Name " + id + ":" + ctx;
    }
  }

  /** {@code [a, b, *c]}. */
  public static final class ListExpr extends Expr {
    public final ImmutableList<Expr> elts;
    public final ExprContext ctx;

    public ListExpr(List<? extends Expr> elts, ExprContext ctx) {
      this.elts = ImmutableList.copyOf(elts);
      this.ctx = checkNotNull(ctx);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitListExpr(this);
    }

    @Override
    public ImmutableList<Node> children() {
      return nodes(elts);
    }

    @Override
    public String label() {
      return "List:" + ctx;
    }
  }

  /** {@code (a, b, *c)}, with or without the parentheses. */
  public static final class Tuple extends Expr {
    public final ImmutableList<Expr> elts;
    public final ExprContext ctx;

    public Tuple(List<? extends Expr> elts, ExprContext ctx) {
      this.elts = ImmutableList.copyOf(elts);
      this.ctx = checkNotNull(ctx);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitTuple(this);
    }

    @Override
    public ImmutableList<Node> children() {
      return nodes(elts);
    }

    @Override
    public String label() {
      return "Tuple:" + ctx;
    }
  }

  /** {@code lower:upper:step}, only within a subscript. */
  public static final class Slice extends Expr {
    public final @Nullable Expr lower;
    public final @Nullable Expr upper;
    public final @Nullable Expr step;

    public Slice(@Nullable Expr lower, @Nullable Expr upper, @Nullable Expr step) {
      this.lower = lower;
      this.upper = upper;
      this.step = step;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitSlice(this);
    }

    @Override
    public ImmutableList<Node> children() {
      return nodes(lower, upper, step);
    }
  }

  // Auxiliary nodes

  /**
   * The parameter list of a function or lambda. {@code defaults} are the defaults of the last
   * {@code defaults.size()} positional parameters ({@code posOnlyArgs} followed by {@code args});
   * {@code kwDefaults} has one entry for each of {@code kwOnlyArgs}, null if that parameter has no
   * default.
   */
  public static final class Arguments extends Node {
    public final ImmutableList<Arg> posOnlyArgs;
    public final ImmutableList<Arg> args;
    public final @Nullable Arg varArg;
    public final ImmutableList<Arg> kwOnlyArgs;
    public final List<@Nullable Expr> kwDefaults;
    public final @Nullable Arg kwArg;
    public final ImmutableList<Expr> defaults;

    public Arguments(
        List<Arg> posOnlyArgs,
        List<Arg> args,
        @Nullable Arg varArg,
        List<Arg> kwOnlyArgs,
        List<? extends @Nullable Expr> kwDefaults,
        @Nullable Arg kwArg,
        List<? extends Expr> defaults) {
      checkArgument(kwOnlyArgs.size() == kwDefaults.size());
      checkArgument(defaults.size() <= posOnlyArgs.size() + args.size());
      this.posOnlyArgs = ImmutableList.copyOf(posOnlyArgs);
      this.args = ImmutableList.copyOf(args);
      this.varArg = varArg;
      this.kwOnlyArgs = ImmutableList.copyOf(kwOnlyArgs);
      this.kwDefaults = copyWithNulls(kwDefaults);
      this.kwArg = kwArg;
      this.defaults = ImmutableList.copyOf(defaults);
    }

    /** An empty parameter list. */
    public static Arguments empty() {
      return new Arguments(
          ImmutableList.of(),
          ImmutableList.of(),
          null,
          ImmutableList.of(),
          ImmutableList.of(),
          null,
          ImmutableList.of());
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitArguments(this);
    }

    @Override
    public ImmutableList<Node> children() {
      return nodes(posOnlyArgs, args, varArg, kwOnlyArgs, kwDefaults, kwArg, defaults);
    }
  }

  /** A single parameter, with an optional annotation. */
  public static final class Arg extends Node {
    public final String name;
    public final @Nullable Expr annotation;

    public Arg(String name, @Nullable Expr annotation) {
      this.name = checkNotNull(name);
      this.annotation = annotation;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitArg(this);
    }

    @Override
    public ImmutableList<Node> children() {
      return nodes(annotation);
    }

    @Override
    public String label() {
      return "Arg " + name;
    }
  }

  /** A keyword argument {@code name=value}, or {@code **value} if name is null. */
  public static final class Keyword extends Node {
    public final @Nullable String name;
    public final Expr value;

    public Keyword(@Nullable String name, Expr value) {
      this.name = name;
      this.value = checkNotNull(value);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitKeyword(this);
    }

    @Override
    public ImmutableList<Node> children() {
      return nodes(value);
    }

    @Override
    public String label() {
      return (name == null) ? "Keyword **" : "Keyword " + name;
    }
  }

  /** One imported name, {@code name as asName}; name may be dotted (or "*"). */
  public static final class Alias extends Node {
    public final String name;
    public final @Nullable String asName;

    public Alias(String name, @Nullable String asName) {
      checkArgument(!name.isEmpty());
      this.name = name;
      this.asName = asName;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitAlias(this);
    }

    @Override
    public ImmutableList<Node> children() {
      return ImmutableList.of();
    }

    @Override
    public String label() {
      return (asName == null) ? "Alias " + name : "Alias " + name + " as " + asName;
    }
  }

  /** One item of a with statement, {@code contextExpr as optionalVars}. */
  public static final class WithItem extends Node {
    public final Expr contextExpr;
    public final @Nullable Expr optionalVars;

    public WithItem(Expr contextExpr, @Nullable Expr optionalVars) {
      this.contextExpr = checkNotNull(contextExpr);
      this.optionalVars = optionalVars;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitWithItem(this);
    }

    @Override
    public ImmutableList<Node> children() {
      return nodes(contextExpr, optionalVars);
    }
  }

  /** {@code except type as name: body}; type and name are optional. */
  public static final class ExceptHandler extends Node {
    public final @Nullable Expr type;
    public final @Nullable String name;
    public final ImmutableList<Stmt> body;

    public ExceptHandler(@Nullable Expr type, @Nullable String name, List<? extends Stmt> body) {
      checkArgument(type != null || name == null);
      this.type = type;
      this.name = name;
      this.body = ImmutableList.copyOf(body);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitExceptHandler(this);
    }

    @Override
    public ImmutableList<Node> children() {
      return nodes(type, body);
    }

    @Override
    public String label() {
      return (name == null) ? "ExceptHandler" : "ExceptHandler " + name;
    }
  }

  /** One {@code for target in iter if ifs...} clause of a comprehension, optionally async. */
  public static final class Comprehension extends Node {
    public final Expr target;
    public final Expr iter;
    public final ImmutableList<Expr> ifs;
    public final boolean isAsync;

    public Comprehension(Expr target, Expr iter, List<? extends Expr> ifs, boolean isAsync) {
      this.target = checkNotNull(target);
      this.iter = checkNotNull(iter);
      this.ifs = ImmutableList.copyOf(ifs);
      this.isAsync = isAsync;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitComprehension(this);
    }

    @Override
    public ImmutableList<Node> children() {
      return nodes(target, iter, ifs);
    }
  }

  /** {@code case pattern if guard: body}. */
  public static final class MatchCase extends Node {
    public final Pattern pattern;
    public final @Nullable Expr guard;
    public final ImmutableList<Stmt> body;

    public MatchCase(Pattern pattern, @Nullable Expr guard, List<? extends Stmt> body) {
      this.pattern = checkNotNull(pattern);
      this.guard = guard;
      this.body = ImmutableList.copyOf(body);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitMatchCase(this);
    }

    @Override
    public ImmutableList<Node> children() {
      return nodes(pattern, guard, body);
    }
  }

  // Patterns

  /** A literal or dotted-name value to match, e.g. {@code case 1:} or {@code case a.b:}. */
  public static final class MatchValue extends Pattern {
    public final Expr value;

    public MatchValue(Expr value) {
      this.value = checkNotNull(value);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitMatchValue(this);
    }

    @Override
    public ImmutableList<Node> children() {
      return nodes(value);
    }
  }

  /** {@code None}, {@code True} or {@code False}, compared by identity. */
  public static final class MatchSingleton extends Pattern {
    public final String value;

    public MatchSingleton(String value) {
      this.value = checkNotNull(value);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitMatchSingleton(this);
    }

    @Override
    public ImmutableList<Node> children() {
      return ImmutableList.of();
    }

    @Override
    public String label() {
      return "MatchSingleton " + value;
    }
  }

  /** {@code [p1, p2, *rest]} or {@code (p1, p2)}. */
  public static final class MatchSequence extends Pattern {
    public final ImmutableList<Pattern> patterns;

    public MatchSequence(List<? extends Pattern> patterns) {
      this.patterns = ImmutableList.copyOf(patterns);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitMatchSequence(this);
    }

    @Override
    public ImmutableList<Node> children() {
      return nodes(patterns);
    }
  }

  /** {@code {k1: p1, k2: p2, **rest}}; rest is optional. */
  public static final class MatchMapping extends Pattern {
    public final ImmutableList<Expr> keys;
    public final ImmutableList<Pattern> patterns;
    public final @Nullable String rest;

    public MatchMapping(
        List<? extends Expr> keys, List<? extends Pattern> patterns, @Nullable String rest) {
      checkArgument(keys.size() == patterns.size());
      this.keys = ImmutableList.copyOf(keys);
      this.patterns = ImmutableList.copyOf(patterns);
      this.rest = rest;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitMatchMapping(this);
    }

    @Override
    public ImmutableList<Node> children() {
      return nodes(keys, patterns);
    }

    @Override
    public String label() {
      return (rest == null) ? "MatchMapping" : "MatchMapping **" + rest;
    }
  }

  /** {@code cls(p1, p2, attr1=p3)}. */
  public static final class MatchClass extends Pattern {
    public final Expr cls;
    public final ImmutableList<Pattern> patterns;
    public final ImmutableList<String> kwdAttrs;
    public final ImmutableList<Pattern> kwdPatterns;

    public MatchClass(
        Expr cls,
        List<? extends Pattern> patterns,
        List<String> kwdAttrs,
        List<? extends Pattern> kwdPatterns) {
      checkArgument(kwdAttrs.size() == kwdPatterns.size());
      this.cls = checkNotNull(cls);
      this.patterns = ImmutableList.copyOf(patterns);
      this.kwdAttrs = ImmutableList.copyOf(kwdAttrs);
      this.kwdPatterns = ImmutableList.copyOf(kwdPatterns);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitMatchClass(this);
    }

    @Override
    public ImmutableList<Node> children() {
      return nodes(cls, patterns, kwdPatterns);
    }

    @Override
    public String label() {
      return kwdAttrs.isEmpty() ? "MatchClass" : "MatchClass " + String.join(",", kwdAttrs);
    }
  }

  /** {@code *name} within a sequence pattern; name is null for {@code *_}. */
  public static final class MatchStar extends Pattern {
    public final @Nullable String name;

    public MatchStar(@Nullable String name) {
      this.name = name;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitMatchStar(this);
    }

    @Override
    public ImmutableList<Node> children() {
      return ImmutableList.of();
    }

    @Override
    public String label() {
      return (name == null) ? "MatchStar" : "MatchStar " + name;
    }
  }

  /**
   * {@code pattern as name}. A bare capture pattern {@code name} has a null pattern; the wildcard
   * {@code _} has both null.
   */
  public static final class MatchAs extends Pattern {
    public final @Nullable Pattern pattern;
    public final @Nullable String name;

    public MatchAs(@Nullable Pattern pattern, @Nullable String name) {
      checkArgument(pattern == null || name != null);
      this.pattern = pattern;
      this.name = name;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitMatchAs(this);
    }

    @Override
    public ImmutableList<Node> children() {
      return nodes(pattern);
    }

    @Override
    public String label() {
      return (name == null) ? "MatchAs" : "MatchAs " + name;
    }
  }

  /** {@code p1 | p2 | p3}. */
  public static final class MatchOr extends Pattern {
    public final ImmutableList<Pattern> patterns;

    public MatchOr(List<? extends Pattern> patterns) {
      checkArgument(patterns.size() >= 2);
      this.patterns = ImmutableList.copyOf(patterns);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitMatchOr(this);
    }

    @Override
    public ImmutableList<Node> children() {
      return nodes(patterns);
    }
  }

  /**
   * A Visitor has one method for each kind of node. There are no default implementations, so adding
   * a node kind is a compile error in every Visitor until it is handled; {@link TreeWalker} is a
   * convenient base class for visitors that only care about a few kinds.
   */
  public interface Visitor<T> {
    T visitModule(Module node);

    T visitFunctionDef(FunctionDef node);

    T visitClassDef(ClassDef node);

    T visitReturn(Return node);

    T visitDelete(Delete node);

    T visitAssign(Assign node);

    T visitAugAssign(AugAssign node);

    T visitAnnAssign(AnnAssign node);

    T visitFor(For node);

    T visitWhile(While node);

    T visitIf(If node);

    T visitWith(With node);

    T visitMatch(Match node);

    T visitRaise(Raise node);

    T visitTry(Try node);

    T visitAssert(Assert node);

    T visitImport(Import node);

    T visitImportFrom(ImportFrom node);

    T visitGlobal(Global node);

    T visitNonlocal(Nonlocal node);

    T visitExprStmt(ExprStmt node);

    T visitPass(Pass node);

    T visitBreak(Break node);

    T visitContinue(Continue node);

    T visitBoolOp(BoolOp node);

    T visitNamedExpr(NamedExpr node);

    T visitBinOp(BinOp node);

    T visitUnaryOp(UnaryOp node);

    T visitLambda(Lambda node);

    T visitIfExp(IfExp node);

    T visitDict(Dict node);

    T visitSetExpr(SetExpr node);

    T visitListComp(ListComp node);

    T visitSetComp(SetComp node);

    T visitDictComp(DictComp node);

    T visitGeneratorExp(GeneratorExp node);

    T visitAwait(Await node);

    T visitYield(Yield node);

    T visitYieldFrom(YieldFrom node);

    T visitCompare(Compare node);

    T visitCall(Call node);

    T visitFormattedValue(FormattedValue node);

    T visitJoinedStr(JoinedStr node);

    T visitConstant(Constant node);

    T visitAttribute(Attribute node);

    T visitSubscript(Subscript node);

    T visitStarred(Starred node);

    T visitName(Name node);

    T visitListExpr(ListExpr node);

    T visitTuple(Tuple node);

    T visitSlice(Slice node);

    T visitArguments(Arguments node);

    T visitArg(Arg node);

    T visitKeyword(Keyword node);

    T visitAlias(Alias node);

    T visitWithItem(WithItem node);

    T visitExceptHandler(ExceptHandler node);

    T visitComprehension(Comprehension node);

    T visitMatchCase(MatchCase node);

    T visitMatchValue(MatchValue node);

    T visitMatchSingleton(MatchSingleton node);

    T visitMatchSequence(MatchSequence node);

    T visitMatchMapping(MatchMapping node);

    T visitMatchClass(MatchClass node);

    T visitMatchStar(MatchStar node);

    T visitMatchAs(MatchAs node);

    T visitMatchOr(MatchOr node);
  }
}
