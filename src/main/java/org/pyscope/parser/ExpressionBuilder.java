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

import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.jspecify.annotations.Nullable;
import org.pyscope.parser.PythonParser.AndTestContext;
import org.pyscope.parser.PythonParser.ArglistContext;
import org.pyscope.parser.PythonParser.ArgumentContext;
import org.pyscope.parser.PythonParser.AssignValueContext;
import org.pyscope.parser.PythonParser.AttributeTrailerContext;
import org.pyscope.parser.PythonParser.BinaryExprContext;
import org.pyscope.parser.PythonParser.CallTrailerContext;
import org.pyscope.parser.PythonParser.CompForClauseContext;
import org.pyscope.parser.PythonParser.CompForContext;
import org.pyscope.parser.PythonParser.CompIfClauseContext;
import org.pyscope.parser.PythonParser.CompOpContext;
import org.pyscope.parser.PythonParser.ComparisonContext;
import org.pyscope.parser.PythonParser.DictItemContext;
import org.pyscope.parser.PythonParser.DictOrSetAtomContext;
import org.pyscope.parser.PythonParser.DictOrSetMakerContext;
import org.pyscope.parser.PythonParser.DoubleStarArgumentContext;
import org.pyscope.parser.PythonParser.DoubleStarTypedargContext;
import org.pyscope.parser.PythonParser.DoubleStarVarargContext;
import org.pyscope.parser.PythonParser.EllipsisAtomContext;
import org.pyscope.parser.PythonParser.ExprItemContext;
import org.pyscope.parser.PythonParser.ExprlistContext;
import org.pyscope.parser.PythonParser.IndexSubscriptContext;
import org.pyscope.parser.PythonParser.KeyValueItemContext;
import org.pyscope.parser.PythonParser.KeywordArgumentContext;
import org.pyscope.parser.PythonParser.KeywordAtomContext;
import org.pyscope.parser.PythonParser.LambdefContext;
import org.pyscope.parser.PythonParser.ListAtomContext;
import org.pyscope.parser.PythonParser.ListItemContext;
import org.pyscope.parser.PythonParser.NameAtomContext;
import org.pyscope.parser.PythonParser.NameContext;
import org.pyscope.parser.PythonParser.NamedexprTestContext;
import org.pyscope.parser.PythonParser.NotTestContext;
import org.pyscope.parser.PythonParser.NumberAtomContext;
import org.pyscope.parser.PythonParser.OrTestContext;
import org.pyscope.parser.PythonParser.ParenAtomContext;
import org.pyscope.parser.PythonParser.PlainTypedargContext;
import org.pyscope.parser.PythonParser.PlainVarargContext;
import org.pyscope.parser.PythonParser.PositionalArgumentContext;
import org.pyscope.parser.PythonParser.PrimaryExprContext;
import org.pyscope.parser.PythonParser.SliceSubscriptContext;
import org.pyscope.parser.PythonParser.StarArgumentContext;
import org.pyscope.parser.PythonParser.StarExprContext;
import org.pyscope.parser.PythonParser.StarTypedargContext;
import org.pyscope.parser.PythonParser.StarVarargContext;
import org.pyscope.parser.PythonParser.StringAtomContext;
import org.pyscope.parser.PythonParser.SubjectExprContext;
import org.pyscope.parser.PythonParser.SubjectItemContext;
import org.pyscope.parser.PythonParser.SubscriptTrailerContext;
import org.pyscope.parser.PythonParser.TestContext;
import org.pyscope.parser.PythonParser.TestlistCompContext;
import org.pyscope.parser.PythonParser.TestlistContext;
import org.pyscope.parser.PythonParser.TestlistStarExprContext;
import org.pyscope.parser.PythonParser.TfpdefContext;
import org.pyscope.parser.PythonParser.TrailerContext;
import org.pyscope.parser.PythonParser.TypedargContext;
import org.pyscope.parser.PythonParser.TypedargslistContext;
import org.pyscope.parser.PythonParser.UnaryExprContext;
import org.pyscope.parser.PythonParser.UnpackItemContext;
import org.pyscope.parser.PythonParser.VarargContext;
import org.pyscope.parser.PythonParser.VarargslistContext;
import org.pyscope.parser.PythonParser.YieldExprContext;
import org.pyscope.tree.PyTree.Arg;
import org.pyscope.tree.PyTree.Arguments;
import org.pyscope.tree.PyTree.Comprehension;
import org.pyscope.tree.PyTree.Expr;
import org.pyscope.tree.PyTree.ExprContext;
import org.pyscope.tree.PyTree.Keyword;
import org.pyscope.tree.PyTree.Name;
import org.pyscope.tree.PyTree;

/**
 * Builds the PyTree for an expression. Every expression is built with LOAD context; {@link
 * #asTarget} rebuilds an expression that turns out to be the target of an assignment (or a {@code
 * del}).
 */
class ExpressionBuilder extends VisitorBase<Expr> {

  /** The positional and keyword arguments of a call or class definition. */
  static final class CallArgs {
    final ImmutableList<Expr> args;
    final ImmutableList<Keyword> keywords;

    CallArgs(List<Expr> args, List<Keyword> keywords) {
      this.args = ImmutableList.copyOf(args);
      this.keywords = ImmutableList.copyOf(keywords);
    }

    static final CallArgs EMPTY = new CallArgs(ImmutableList.of(), ImmutableList.of());
  }

  /** Builds each of the given nodes. */
  List<Expr> visitAll(List<? extends ParseTree> nodes) {
    List<Expr> result = new ArrayList<>(nodes.size());
    for (ParseTree node : nodes) {
      result.add(visit(node));
    }
    return result;
  }

  /** Builds the given node if it is non-null. */
  @Nullable Expr visitIfPresent(@Nullable ParseTree node) {
    return (node == null) ? null : visit(node);
  }

  /**
   * Returns a single expression if {@code items} has one element and there was no trailing comma,
   * otherwise a Tuple of them.
   */
  private Expr maybeTuple(List<? extends ParseTree> items, @Nullable Token trailingComma) {
    if (items.size() == 1 && trailingComma == null) {
      return visit(items.get(0));
    }
    return new PyTree.Tuple(visitAll(items), ExprContext.LOAD);
  }

  // Targets

  /**
   * Returns a copy of {@code expr} suitable for use as the target of an assignment or {@code del},
   * or throws a ParseError if it can't be one. Names, and tuples, lists and starred expressions
   * containing them, get the given context; the expressions within attributes and subscripts are
   * unchanged.
   */
  Expr asTarget(Expr expr, ExprContext ctx, ParserRuleContext where) {
    if (expr instanceof Name) {
      return new Name(((Name) expr).id, ctx);
    } else if (expr instanceof PyTree.Attribute) {
      PyTree.Attribute attribute = (PyTree.Attribute) expr;
      return new PyTree.Attribute(attribute.value, attribute.attr, ctx);
    } else if (expr instanceof PyTree.Subscript) {
      PyTree.Subscript subscript = (PyTree.Subscript) expr;
      return new PyTree.Subscript(subscript.value, subscript.slice, ctx);
    } else if (expr instanceof PyTree.Tuple) {
      return new PyTree.Tuple(asTargets(((PyTree.Tuple) expr).elts, ctx, where), ctx);
    } else if (expr instanceof PyTree.ListExpr) {
      return new PyTree.ListExpr(asTargets(((PyTree.ListExpr) expr).elts, ctx, where), ctx);
    } else if (expr instanceof PyTree.Starred && ctx == ExprContext.STORE) {
      return new PyTree.Starred(asTarget(((PyTree.Starred) expr).value, ctx, where), ctx);
    }
    String verb = (ctx == ExprContext.DEL) ? "delete" : "assign to";
    throw PyParser.error(where.start, "cannot %s %s", verb, describe(expr));
  }

  private List<Expr> asTargets(List<Expr> exprs, ExprContext ctx, ParserRuleContext where) {
    List<Expr> result = new ArrayList<>(exprs.size());
    for (Expr expr : exprs) {
      result.add(asTarget(expr, ctx, where));
    }
    return result;
  }

  /** Returns true if {@code expr} is a name, attribute or subscript. */
  static boolean isSingleTarget(Expr expr) {
    return expr instanceof Name
        || expr instanceof PyTree.Attribute
        || expr instanceof PyTree.Subscript;
  }

  /** Returns a phrase describing what kind of expression this is, for error messages. */
  static String describe(Expr expr) {
    if (expr instanceof PyTree.Call) {
      return "function call";
    } else if (expr instanceof PyTree.Constant) {
      return "literal";
    } else if (expr instanceof PyTree.Lambda) {
      return "lambda";
    } else if (expr instanceof PyTree.Yield || expr instanceof PyTree.YieldFrom) {
      return "yield expression";
    } else if (expr instanceof PyTree.Await) {
      return "await expression";
    } else if (expr instanceof PyTree.Starred) {
      return "starred";
    } else if (expr instanceof PyTree.NamedExpr) {
      return "named expression";
    } else if (expr instanceof PyTree.Tuple) {
      return "tuple";
    } else if (expr instanceof PyTree.JoinedStr) {
      return "f-string expression";
    } else if (expr instanceof PyTree.ListComp
        || expr instanceof PyTree.SetComp
        || expr instanceof PyTree.DictComp) {
      return "comprehension";
    } else if (expr instanceof PyTree.GeneratorExp) {
      return "generator expression";
    } else if (expr instanceof PyTree.IfExp) {
      return "conditional expression";
    } else if (expr instanceof PyTree.Compare) {
      return "comparison";
    } else if (expr instanceof PyTree.Dict) {
      return "dict literal";
    } else if (expr instanceof PyTree.SetExpr) {
      return "set display";
    }
    return "expression";
  }

  // Expressions, from lowest to highest precedence

  @Override
  public Expr visitNamedexprTest(NamedexprTestContext ctx) {
    Expr test = visit(ctx.test(0));
    if (ctx.value == null) {
      return test;
    }
    if (!(test instanceof Name)) {
      throw error("cannot use assignment expressions with %s", describe(test));
    }
    return new PyTree.NamedExpr(new Name(((Name) test).id, ExprContext.STORE), visit(ctx.value));
  }

  @Override
  public Expr visitTest(TestContext ctx) {
    if (ctx.lambdef() != null) {
      return visit(ctx.lambdef());
    }
    Expr body = visit(ctx.orTest(0));
    if (ctx.cond == null) {
      return body;
    }
    return new PyTree.IfExp(visit(ctx.cond), body, visit(ctx.orElse));
  }

  @Override
  public Expr visitLambdef(LambdefContext ctx) {
    Arguments args =
        (ctx.varargslist() == null) ? Arguments.empty() : parameters(ctx.varargslist());
    return new PyTree.Lambda(args, visit(ctx.test()));
  }

  @Override
  public Expr visitOrTest(OrTestContext ctx) {
    if (ctx.andTest().size() == 1) {
      return visit(ctx.andTest(0));
    }
    return new PyTree.BoolOp("or", visitAll(ctx.andTest()));
  }

  @Override
  public Expr visitAndTest(AndTestContext ctx) {
    if (ctx.notTest().size() == 1) {
      return visit(ctx.notTest(0));
    }
    return new PyTree.BoolOp("and", visitAll(ctx.notTest()));
  }

  @Override
  public Expr visitNotTest(NotTestContext ctx) {
    if (ctx.comparison() != null) {
      return visit(ctx.comparison());
    }
    return new PyTree.UnaryOp("not", visit(ctx.notTest()));
  }

  @Override
  public Expr visitComparison(ComparisonContext ctx) {
    Expr left = visit(ctx.expr(0));
    if (ctx.compOp().isEmpty()) {
      return left;
    }
    List<String> ops = new ArrayList<>();
    for (CompOpContext op : ctx.compOp()) {
      // "not in" and "is not" are two tokens
      ops.add(
          (op.getChildCount() == 1)
              ? op.getText()
              : op.getChild(0).getText() + " " + op.getChild(1).getText());
    }
    return new PyTree.Compare(left, ops, visitAll(ctx.expr().subList(1, ctx.expr().size())));
  }

  @Override
  public Expr visitStarExpr(StarExprContext ctx) {
    return new PyTree.Starred(visit(ctx.expr()), ExprContext.LOAD);
  }

  @Override
  public Expr visitBinaryExpr(BinaryExprContext ctx) {
    // Left-associative chains nest down their left operands; unwind them with a loop.
    Deque<BinaryExprContext> spine = new ArrayDeque<>();
    ParserRuleContext left = ctx;
    while (left instanceof BinaryExprContext) {
      BinaryExprContext binary = (BinaryExprContext) left;
      spine.push(binary);
      left = binary.expr(0);
    }
    Expr result = visit(left);
    while (!spine.isEmpty()) {
      BinaryExprContext binary = spine.pop();
      result = new PyTree.BinOp(result, binary.op.getText(), visit(binary.expr(1)));
    }
    return result;
  }

  @Override
  public Expr visitUnaryExpr(UnaryExprContext ctx) {
    return new PyTree.UnaryOp(ctx.op.getText(), visit(ctx.expr()));
  }

  @Override
  public Expr visitPrimaryExpr(PrimaryExprContext ctx) {
    Expr result = visit(ctx.atom());
    for (TrailerContext trailer : ctx.trailer()) {
      result = applyTrailer(result, trailer);
    }
    return (ctx.await == null) ? result : new PyTree.Await(result);
  }

  private Expr applyTrailer(Expr base, TrailerContext trailer) {
    if (trailer instanceof CallTrailerContext) {
      ArglistContext arglist = ((CallTrailerContext) trailer).arglist();
      CallArgs callArgs = (arglist == null) ? CallArgs.EMPTY : callArgs(arglist);
      return new PyTree.Call(base, callArgs.args, callArgs.keywords);
    } else if (trailer instanceof SubscriptTrailerContext) {
      SubscriptTrailerContext subscripts = (SubscriptTrailerContext) trailer;
      return new PyTree.Subscript(
          base,
          maybeTuple(subscripts.subscript(), subscripts.trailingComma),
          ExprContext.LOAD);
    } else {
      AttributeTrailerContext attribute = (AttributeTrailerContext) trailer;
      return new PyTree.Attribute(base, attribute.name().getText(), ExprContext.LOAD);
    }
  }

  @Override
  public Expr visitIndexSubscript(IndexSubscriptContext ctx) {
    return visit(ctx.namedexprTest());
  }

  @Override
  public Expr visitSliceSubscript(SliceSubscriptContext ctx) {
    return new PyTree.Slice(
        visitIfPresent(ctx.lower), visitIfPresent(ctx.upper), visitIfPresent(ctx.step));
  }

  // Atoms

  @Override
  public Expr visitParenAtom(ParenAtomContext ctx) {
    if (ctx.yieldExpr() != null) {
      return visit(ctx.yieldExpr());
    }
    TestlistCompContext items = ctx.testlistComp();
    if (items == null) {
      return new PyTree.Tuple(ImmutableList.of(), ExprContext.LOAD);
    } else if (items.compFor() != null) {
      return new PyTree.GeneratorExp(visit(items.listItem(0)), comprehension(items.compFor()));
    }
    Expr result = maybeTuple(items.listItem(), items.trailingComma);
    if (result instanceof PyTree.Starred) {
      throw error("cannot use starred expression here");
    }
    return result;
  }

  @Override
  public Expr visitListAtom(ListAtomContext ctx) {
    TestlistCompContext items = ctx.testlistComp();
    if (items == null) {
      return new PyTree.ListExpr(ImmutableList.of(), ExprContext.LOAD);
    } else if (items.compFor() != null) {
      return new PyTree.ListComp(visit(items.listItem(0)), comprehension(items.compFor()));
    }
    return new PyTree.ListExpr(visitAll(items.listItem()), ExprContext.LOAD);
  }

  @Override
  public Expr visitDictOrSetAtom(DictOrSetAtomContext ctx) {
    DictOrSetMakerContext maker = ctx.dictOrSetMaker();
    if (maker == null) {
      return new PyTree.Dict(ImmutableList.of(), ImmutableList.of());
    } else if (maker.dictItem().isEmpty()) {
      // A set
      if (maker.compFor() != null) {
        return new PyTree.SetComp(visit(maker.listItem(0)), comprehension(maker.compFor()));
      }
      return new PyTree.SetExpr(visitAll(maker.listItem()));
    } else if (maker.compFor() != null) {
      DictItemContext item = maker.dictItem(0);
      if (!(item instanceof KeyValueItemContext)) {
        throw error("dict unpacking cannot be used in dict comprehension");
      }
      KeyValueItemContext keyValue = (KeyValueItemContext) item;
      return new PyTree.DictComp(
          visit(keyValue.key), visit(keyValue.value), comprehension(maker.compFor()));
    }
    List<@Nullable Expr> keys = new ArrayList<>();
    List<Expr> values = new ArrayList<>();
    for (DictItemContext item : maker.dictItem()) {
      if (item instanceof KeyValueItemContext) {
        KeyValueItemContext keyValue = (KeyValueItemContext) item;
        keys.add(visit(keyValue.key));
        values.add(visit(keyValue.value));
      } else {
        keys.add(null);
        values.add(visit(((UnpackItemContext) item).expr()));
      }
    }
    return new PyTree.Dict(keys, values);
  }

  @Override
  public Expr visitNameAtom(NameAtomContext ctx) {
    return visit(ctx.name());
  }

  @Override
  public Expr visitName(NameContext ctx) {
    return new Name(ctx.getText(), ExprContext.LOAD);
  }

  @Override
  public Expr visitNumberAtom(NumberAtomContext ctx) {
    return new PyTree.Constant(ctx.getText());
  }

  @Override
  public Expr visitStringAtom(StringAtomContext ctx) {
    return strings(ctx.STRING());
  }

  @Override
  public Expr visitEllipsisAtom(EllipsisAtomContext ctx) {
    return new PyTree.Constant("...");
  }

  @Override
  public Expr visitKeywordAtom(KeywordAtomContext ctx) {
    return new PyTree.Constant(ctx.getText());
  }

  /**
   * Returns the expression for a sequence of adjacent string literals: a Constant, or a JoinedStr
   * if any of them is an f-string.
   */
  Expr strings(List<TerminalNode> literals) {
    boolean formatted = false;
    for (TerminalNode literal : literals) {
      formatted |= FStrings.isFormatted(literal.getText());
    }
    if (!formatted) {
      StringBuilder text = new StringBuilder();
      for (TerminalNode literal : literals) {
        if (text.length() != 0) {
          text.append(' ');
        }
        text.append(literal.getText());
      }
      return new PyTree.Constant(text.toString());
    }
    List<Expr> values = new ArrayList<>();
    for (TerminalNode literal : literals) {
      Token token = literal.getSymbol();
      if (FStrings.isFormatted(token.getText())) {
        values.addAll(new FStrings(token).parse());
      } else {
        values.add(new PyTree.Constant(token.getText()));
      }
    }
    return new PyTree.JoinedStr(values);
  }

  // Lists

  @Override
  public Expr visitListItem(ListItemContext ctx) {
    return visit(ctx.getChild(0));
  }

  @Override
  public Expr visitExprItem(ExprItemContext ctx) {
    return visit(ctx.getChild(0));
  }

  @Override
  public Expr visitSubjectItem(SubjectItemContext ctx) {
    return visit(ctx.getChild(0));
  }

  @Override
  public Expr visitAssignValue(AssignValueContext ctx) {
    return visit(ctx.getChild(0));
  }

  @Override
  public Expr visitTestlist(TestlistContext ctx) {
    return maybeTuple(ctx.test(), ctx.trailingComma);
  }

  @Override
  public Expr visitTestlistStarExpr(TestlistStarExprContext ctx) {
    Expr result = maybeTuple(ctx.listItem(), ctx.trailingComma);
    // At statement level an assignment expression must be parenthesized.
    for (ListItemContext item : ctx.listItem()) {
      NamedexprTestContext named = item.namedexprTest();
      if (named != null && named.value != null) {
        throw PyParser.error(((TerminalNode) named.getChild(1)).getSymbol(), "invalid syntax");
      }
    }
    return result;
  }

  @Override
  public Expr visitExprlist(ExprlistContext ctx) {
    return maybeTuple(ctx.exprItem(), ctx.trailingComma);
  }

  @Override
  public Expr visitSubjectExpr(SubjectExprContext ctx) {
    return maybeTuple(ctx.subjectItem(), ctx.trailingComma);
  }

  @Override
  public Expr visitYieldExpr(YieldExprContext ctx) {
    if (ctx.test() != null) {
      return new PyTree.YieldFrom(visit(ctx.test()));
    }
    return new PyTree.Yield(visitIfPresent(ctx.testlistStarExpr()));
  }

  // Comprehensions

  /** Returns the generator clauses of a comprehension; each if clause joins the preceding for. */
  List<Comprehension> comprehension(CompForContext ctx) {
    List<Comprehension> result = new ArrayList<>();
    CompForClauseContext forClause = null;
    List<Expr> ifs = new ArrayList<>();
    for (ParseTree clause : ctx.children) {
      if (clause instanceof CompForClauseContext) {
        if (forClause != null) {
          result.add(generator(forClause, ifs));
          ifs.clear();
        }
        forClause = (CompForClauseContext) clause;
      } else {
        ifs.add(visit(((CompIfClauseContext) clause).orTest()));
      }
    }
    result.add(generator(forClause, ifs));
    return result;
  }

  private Comprehension generator(CompForClauseContext ctx, List<Expr> ifs) {
    Expr target = asTarget(visit(ctx.exprlist()), ExprContext.STORE, ctx.exprlist());
    return new Comprehension(target, visit(ctx.orTest()), ifs, ctx.async != null);
  }

  // Calls

  /** Splits the arguments of a call (or the bases of a class) into positional and keyword. */
  CallArgs callArgs(ArglistContext ctx) {
    List<Expr> args = new ArrayList<>();
    List<Keyword> keywords = new ArrayList<>();
    for (ArgumentContext argument : ctx.argument()) {
      if (argument instanceof PositionalArgumentContext) {
        PositionalArgumentContext positional = (PositionalArgumentContext) argument;
        if (!keywords.isEmpty()) {
          throw PyParser.error(
              argument.start,
              keywords.get(keywords.size() - 1).name == null
                  ? "positional argument follows keyword argument unpacking"
                  : "positional argument follows keyword argument");
        }
        if (positional.compFor() != null) {
          if (ctx.argument().size() != 1) {
            throw PyParser.error(argument.start, "Generator expression must be parenthesized");
          }
          args.add(
              new PyTree.GeneratorExp(
                  visit(positional.namedexprTest()), comprehension(positional.compFor())));
        } else {
          args.add(visit(positional.namedexprTest()));
        }
      } else if (argument instanceof StarArgumentContext) {
        if (!keywords.isEmpty() && keywords.get(keywords.size() - 1).name == null) {
          throw PyParser.error(
              argument.start, "iterable argument unpacking follows keyword argument unpacking");
        }
        args.add(
            new PyTree.Starred(visit(((StarArgumentContext) argument).test()), ExprContext.LOAD));
      } else if (argument instanceof KeywordArgumentContext) {
        KeywordArgumentContext keyword = (KeywordArgumentContext) argument;
        keywords.add(new Keyword(keyword.name().getText(), visit(keyword.test())));
      } else {
        keywords.add(new Keyword(null, visit(((DoubleStarArgumentContext) argument).test())));
      }
    }
    return new CallArgs(args, keywords);
  }

  // Parameters

  /** Returns the parameters of a function definition. */
  Arguments parameters(TypedargslistContext ctx) {
    ParameterList params = new ParameterList();
    for (TypedargContext item : ctx.typedarg()) {
      if (item instanceof PlainTypedargContext) {
        PlainTypedargContext plain = (PlainTypedargContext) item;
        params.add(item, arg(plain.tfpdef()), visitIfPresent(plain.test()));
      } else if (item instanceof StarTypedargContext) {
        TfpdefContext tfpdef = ((StarTypedargContext) item).tfpdef();
        params.addStar(item, tfpdef == null ? null : arg(tfpdef));
      } else if (item instanceof DoubleStarTypedargContext) {
        params.addDoubleStar(item, arg(((DoubleStarTypedargContext) item).tfpdef()));
      } else {
        params.addSlash(item);
      }
    }
    return params.build(ctx);
  }

  /** Returns the parameters of a lambda. */
  Arguments parameters(VarargslistContext ctx) {
    ParameterList params = new ParameterList();
    for (VarargContext item : ctx.vararg()) {
      if (item instanceof PlainVarargContext) {
        PlainVarargContext plain = (PlainVarargContext) item;
        params.add(item, new Arg(plain.name().getText(), null), visitIfPresent(plain.test()));
      } else if (item instanceof StarVarargContext) {
        NameContext name = ((StarVarargContext) item).name();
        params.addStar(item, name == null ? null : new Arg(name.getText(), null));
      } else if (item instanceof DoubleStarVarargContext) {
        params.addDoubleStar(
            item, new Arg(((DoubleStarVarargContext) item).name().getText(), null));
      } else {
        params.addSlash(item);
      }
    }
    return params.build(ctx);
  }

  private Arg arg(TfpdefContext ctx) {
    return new Arg(ctx.name().getText(), visitIfPresent(ctx.test()));
  }

  /**
   * Accumulates the parameters of a function or lambda in source order, checking that they are
   * ordered as Python requires.
   */
  private static class ParameterList {
    final List<Arg> posOnlyArgs = new ArrayList<>();
    final List<Arg> args = new ArrayList<>();
    @Nullable Arg varArg;
    final List<Arg> kwOnlyArgs = new ArrayList<>();
    final List<@Nullable Expr> kwDefaults = new ArrayList<>();
    @Nullable Arg kwArg;
    final List<Expr> defaults = new ArrayList<>();
    boolean sawSlash;
    boolean sawStar;
    boolean sawKwArg;

    private void checkNotAfterKwArg(ParserRuleContext item) {
      if (sawKwArg) {
        throw PyParser.error(item.start, "arguments cannot follow var-keyword argument");
      }
    }

    void add(ParserRuleContext item, Arg arg, @Nullable Expr defaultValue) {
      checkNotAfterKwArg(item);
      if (sawStar) {
        kwOnlyArgs.add(arg);
        kwDefaults.add(defaultValue);
        return;
      }
      if (defaultValue != null) {
        defaults.add(defaultValue);
      } else if (!defaults.isEmpty()) {
        throw PyParser.error(item.start, "non-default argument follows default argument");
      }
      args.add(arg);
    }

    void addStar(ParserRuleContext item, @Nullable Arg arg) {
      checkNotAfterKwArg(item);
      if (sawStar) {
        throw PyParser.error(item.start, "* argument may appear only once");
      }
      sawStar = true;
      varArg = arg;
    }

    void addDoubleStar(ParserRuleContext item, Arg arg) {
      checkNotAfterKwArg(item);
      sawKwArg = true;
      kwArg = arg;
    }

    void addSlash(ParserRuleContext item) {
      checkNotAfterKwArg(item);
      if (sawSlash) {
        throw PyParser.error(item.start, "/ may appear only once");
      } else if (sawStar) {
        throw PyParser.error(item.start, "/ must be ahead of *");
      } else if (args.isEmpty()) {
        throw PyParser.error(item.start, "at least one argument must precede /");
      }
      sawSlash = true;
      posOnlyArgs.addAll(args);
      args.clear();
    }

    Arguments build(ParserRuleContext ctx) {
      if (sawStar && varArg == null && kwOnlyArgs.isEmpty()) {
        throw PyParser.error(ctx.start, "named arguments must follow bare *");
      }
      return new Arguments(posOnlyArgs, args, varArg, kwOnlyArgs, kwDefaults, kwArg, defaults);
    }
  }
}
