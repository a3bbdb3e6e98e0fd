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
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.pyscope.parser.PythonParser.AnnAssignStmtContext;
import org.pyscope.parser.PythonParser.AssertStmtContext;
import org.pyscope.parser.PythonParser.AssignStmtContext;
import org.pyscope.parser.PythonParser.AssignValueContext;
import org.pyscope.parser.PythonParser.AsyncStmtContext;
import org.pyscope.parser.PythonParser.AugAssignStmtContext;
import org.pyscope.parser.PythonParser.BlockContext;
import org.pyscope.parser.PythonParser.BreakStmtContext;
import org.pyscope.parser.PythonParser.CaseBlockContext;
import org.pyscope.parser.PythonParser.ClassdefContext;
import org.pyscope.parser.PythonParser.CompoundStmtContext;
import org.pyscope.parser.PythonParser.ContinueStmtContext;
import org.pyscope.parser.PythonParser.DecoratedContext;
import org.pyscope.parser.PythonParser.DecoratorContext;
import org.pyscope.parser.PythonParser.DelStmtContext;
import org.pyscope.parser.PythonParser.DottedAsNameContext;
import org.pyscope.parser.PythonParser.ExceptClauseContext;
import org.pyscope.parser.PythonParser.ExprItemContext;
import org.pyscope.parser.PythonParser.FileInputContext;
import org.pyscope.parser.PythonParser.ForStmtContext;
import org.pyscope.parser.PythonParser.FuncdefContext;
import org.pyscope.parser.PythonParser.GlobalStmtContext;
import org.pyscope.parser.PythonParser.IfStmtContext;
import org.pyscope.parser.PythonParser.ImportAsNameContext;
import org.pyscope.parser.PythonParser.ImportDotContext;
import org.pyscope.parser.PythonParser.ImportFromContext;
import org.pyscope.parser.PythonParser.ImportNameContext;
import org.pyscope.parser.PythonParser.ImportTargetsContext;
import org.pyscope.parser.PythonParser.MatchStmtContext;
import org.pyscope.parser.PythonParser.NameContext;
import org.pyscope.parser.PythonParser.NonlocalStmtContext;
import org.pyscope.parser.PythonParser.PassStmtContext;
import org.pyscope.parser.PythonParser.RaiseStmtContext;
import org.pyscope.parser.PythonParser.ReturnStmtContext;
import org.pyscope.parser.PythonParser.SimpleStmtContext;
import org.pyscope.parser.PythonParser.SimpleStmtsContext;
import org.pyscope.parser.PythonParser.StmtContext;
import org.pyscope.parser.PythonParser.TryStmtContext;
import org.pyscope.parser.PythonParser.WhileStmtContext;
import org.pyscope.parser.PythonParser.WithItemContext;
import org.pyscope.parser.PythonParser.WithStmtContext;
import org.pyscope.tree.PyTree;
import org.pyscope.tree.PyTree.Alias;
import org.pyscope.tree.PyTree.Expr;
import org.pyscope.tree.PyTree.ExprContext;
import org.pyscope.tree.PyTree.Stmt;

/**
 * Builds the PyTree for a module. Visiting a statement returns the corresponding Stmt; {@link
 * #block} and {@link #addStatements} handle rules (such as {@code a = 1; b = 2}) that produce more
 * than one.
 */
class StatementBuilder extends VisitorBase<Stmt> {

  private final ExpressionBuilder exprs = new ExpressionBuilder();

  private final PatternBuilder patterns = new PatternBuilder(exprs);

  /** Returns the module for a parsed file. */
  PyTree.Module module(FileInputContext ctx) {
    List<Stmt> body = new ArrayList<>();
    for (StmtContext stmt : ctx.stmt()) {
      addStatements(stmt, body);
    }
    return new PyTree.Module(body);
  }

  /** Adds the statements for {@code ctx} to {@code out}. */
  private void addStatements(StmtContext ctx, List<Stmt> out) {
    if (ctx.simpleStmts() != null) {
      addStatements(ctx.simpleStmts(), out);
    } else {
      out.add(visit(ctx.compoundStmt()));
    }
  }

  private void addStatements(SimpleStmtsContext ctx, List<Stmt> out) {
    for (SimpleStmtContext stmt : ctx.simpleStmt()) {
      out.add(visit(stmt));
    }
  }

  /** Returns the statements of an indented block (or of the simple statements following a ':'). */
  List<Stmt> block(BlockContext ctx) {
    List<Stmt> result = new ArrayList<>();
    if (ctx.simpleStmts() != null) {
      addStatements(ctx.simpleStmts(), result);
    } else {
      for (StmtContext stmt : ctx.stmt()) {
        addStatements(stmt, result);
      }
    }
    return result;
  }

  /** Returns the statements of an optional block, or an empty list. */
  private List<Stmt> optionalBlock(@Nullable BlockContext ctx) {
    return (ctx == null) ? ImmutableList.of() : block(ctx);
  }

  @Override
  public Stmt visitSimpleStmt(SimpleStmtContext ctx) {
    return visit(ctx.getChild(0));
  }

  @Override
  public Stmt visitCompoundStmt(CompoundStmtContext ctx) {
    return visit(ctx.getChild(0));
  }

  // Simple statements

  @Override
  public Stmt visitAssignStmt(AssignStmtContext ctx) {
    List<AssignValueContext> parts = ctx.assignValue();
    Expr value = exprs.visit(parts.get(parts.size() - 1));
    if (value instanceof PyTree.Starred) {
      throw error("can't use starred expression here");
    } else if (parts.size() == 1) {
      return new PyTree.ExprStmt(value);
    }
    List<Expr> targets = new ArrayList<>();
    for (AssignValueContext part : parts.subList(0, parts.size() - 1)) {
      targets.add(exprs.asTarget(exprs.visit(part), ExprContext.STORE, part));
    }
    return new PyTree.Assign(targets, value);
  }

  @Override
  public Stmt visitAugAssignStmt(AugAssignStmtContext ctx) {
    Expr target = exprs.visit(ctx.testlistStarExpr());
    if (!ExpressionBuilder.isSingleTarget(target)) {
      throw error(
          "'%s' is an illegal expression for augmented assignment",
          ExpressionBuilder.describe(target));
    }
    String op = ctx.augassign().getText();
    Expr value = exprs.visit(ctx.getChild(2));
    return new PyTree.AugAssign(
        exprs.asTarget(target, ExprContext.STORE, ctx.testlistStarExpr()),
        op.substring(0, op.length() - 1),
        value);
  }

  @Override
  public Stmt visitAnnAssignStmt(AnnAssignStmtContext ctx) {
    Expr target = exprs.visit(ctx.testlistStarExpr());
    if (target instanceof PyTree.Tuple) {
      throw error("only single target (not tuple) can be annotated");
    } else if (!ExpressionBuilder.isSingleTarget(target)) {
      throw error("illegal target for annotation");
    }
    return new PyTree.AnnAssign(
        exprs.asTarget(target, ExprContext.STORE, ctx.testlistStarExpr()),
        exprs.visit(ctx.annassign().test()),
        exprs.visitIfPresent(ctx.annassign().assignValue()));
  }

  @Override
  public Stmt visitDelStmt(DelStmtContext ctx) {
    // "del a, b" has two targets, not one tuple
    List<Expr> targets = new ArrayList<>();
    for (ExprItemContext item : ctx.exprlist().exprItem()) {
      targets.add(exprs.asTarget(exprs.visit(item), ExprContext.DEL, item));
    }
    return new PyTree.Delete(targets);
  }

  @Override
  public Stmt visitPassStmt(PassStmtContext ctx) {
    return new PyTree.Pass();
  }

  @Override
  public Stmt visitBreakStmt(BreakStmtContext ctx) {
    return new PyTree.Break();
  }

  @Override
  public Stmt visitContinueStmt(ContinueStmtContext ctx) {
    return new PyTree.Continue();
  }

  @Override
  public Stmt visitReturnStmt(ReturnStmtContext ctx) {
    return new PyTree.Return(exprs.visitIfPresent(ctx.testlistStarExpr()));
  }

  @Override
  public Stmt visitRaiseStmt(RaiseStmtContext ctx) {
    return new PyTree.Raise(exprs.visitIfPresent(ctx.exc), exprs.visitIfPresent(ctx.cause));
  }

  @Override
  public Stmt visitImportName(ImportNameContext ctx) {
    List<Alias> names = new ArrayList<>();
    for (DottedAsNameContext name : ctx.dottedAsName()) {
      names.add(new Alias(name.dottedName().getText(), textOrNull(name.asName)));
    }
    return new PyTree.Import(names);
  }

  @Override
  public Stmt visitImportFrom(ImportFromContext ctx) {
    int level = 0;
    for (ImportDotContext dot : ctx.importDot()) {
      level += dot.getText().length();
    }
    String module = (ctx.dottedName() == null) ? null : ctx.dottedName().getText();
    List<Alias> names = new ArrayList<>();
    ImportTargetsContext targets = ctx.importTargets();
    if (targets.importAsName().isEmpty()) {
      names.add(new Alias("*", null));
    } else {
      for (ImportAsNameContext name : targets.importAsName()) {
        names.add(new Alias(name.name(0).getText(), textOrNull(name.asName)));
      }
    }
    return new PyTree.ImportFrom(module, names, level);
  }

  private static @Nullable String textOrNull(@Nullable NameContext name) {
    return (name == null) ? null : name.getText();
  }

  private static List<String> names(List<NameContext> names) {
    List<String> result = new ArrayList<>(names.size());
    for (NameContext name : names) {
      result.add(name.getText());
    }
    return result;
  }

  @Override
  public Stmt visitGlobalStmt(GlobalStmtContext ctx) {
    return new PyTree.Global(names(ctx.name()));
  }

  @Override
  public Stmt visitNonlocalStmt(NonlocalStmtContext ctx) {
    return new PyTree.Nonlocal(names(ctx.name()));
  }

  @Override
  public Stmt visitAssertStmt(AssertStmtContext ctx) {
    return new PyTree.Assert(exprs.visit(ctx.test(0)), exprs.visitIfPresent(ctx.msg));
  }

  // Compound statements

  @Override
  public Stmt visitIfStmt(IfStmtContext ctx) {
    // Each "elif" is an If nested in the orElse of the previous one.
    List<Stmt> orElse = optionalBlock(ctx.elseBlock);
    for (int i = ctx.tests.size() - 1; ; i--) {
      PyTree.If stmt =
          new PyTree.If(exprs.visit(ctx.tests.get(i)), block(ctx.blocks.get(i)), orElse);
      if (i == 0) {
        return stmt;
      }
      orElse = ImmutableList.of(stmt);
    }
  }

  @Override
  public Stmt visitWhileStmt(WhileStmtContext ctx) {
    return new PyTree.While(
        exprs.visit(ctx.namedexprTest()), block(ctx.body), optionalBlock(ctx.elseBlock));
  }

  @Override
  public Stmt visitForStmt(ForStmtContext ctx) {
    return forStmt(ctx, false);
  }

  private Stmt forStmt(ForStmtContext ctx, boolean isAsync) {
    Expr target = exprs.asTarget(exprs.visit(ctx.exprlist()), ExprContext.STORE, ctx.exprlist());
    return new PyTree.For(
        target,
        exprs.visit(ctx.testlistStarExpr()),
        block(ctx.body),
        optionalBlock(ctx.elseBlock),
        isAsync);
  }

  @Override
  public Stmt visitTryStmt(TryStmtContext ctx) {
    List<PyTree.ExceptHandler> handlers = new ArrayList<>();
    boolean sawStar = false;
    boolean sawPlain = false;
    List<ExceptClauseContext> clauses = ctx.exceptClause();
    for (int i = 0; i < clauses.size(); i++) {
      ExceptClauseContext clause = clauses.get(i);
      if (clause.star != null) {
        sawStar = true;
        if (clause.test() == null) {
          throw PyParser.error(clause.start, "expected one or more exception types");
        }
      } else {
        sawPlain = true;
        if (clause.test() == null && i != clauses.size() - 1) {
          throw PyParser.error(clause.start, "default 'except:' must be last");
        }
      }
      handlers.add(
          new PyTree.ExceptHandler(
              exprs.visitIfPresent(clause.test()),
              textOrNull(clause.name()),
              block(clause.block())));
    }
    if (sawStar && sawPlain) {
      throw error("cannot have both 'except' and 'except*' on the same 'try'");
    }
    return new PyTree.Try(
        block(ctx.body),
        handlers,
        optionalBlock(ctx.elseBlock),
        optionalBlock(ctx.finallyBlock),
        sawStar);
  }

  @Override
  public Stmt visitWithStmt(WithStmtContext ctx) {
    return withStmt(ctx, false);
  }

  private Stmt withStmt(WithStmtContext ctx, boolean isAsync) {
    List<PyTree.WithItem> items = new ArrayList<>();
    for (WithItemContext item : ctx.withItem()) {
      Expr vars = null;
      if (item.expr() != null) {
        vars = exprs.asTarget(exprs.visit(item.expr()), ExprContext.STORE, item.expr());
      }
      items.add(new PyTree.WithItem(exprs.visit(item.test()), vars));
    }
    return new PyTree.With(items, block(ctx.block()), isAsync);
  }

  @Override
  public Stmt visitFuncdef(FuncdefContext ctx) {
    return funcdef(ctx, ImmutableList.of(), false);
  }

  private Stmt funcdef(FuncdefContext ctx, List<Expr> decorators, boolean isAsync) {
    PyTree.Arguments args =
        (ctx.typedargslist() == null)
            ? PyTree.Arguments.empty()
            : exprs.parameters(ctx.typedargslist());
    return new PyTree.FunctionDef(
        ctx.name().getText(),
        args,
        block(ctx.block()),
        decorators,
        exprs.visitIfPresent(ctx.ret),
        isAsync);
  }

  @Override
  public Stmt visitClassdef(ClassdefContext ctx) {
    return classdef(ctx, ImmutableList.of());
  }

  private Stmt classdef(ClassdefContext ctx, List<Expr> decorators) {
    ExpressionBuilder.CallArgs bases =
        (ctx.arglist() == null) ? ExpressionBuilder.CallArgs.EMPTY : exprs.callArgs(ctx.arglist());
    return new PyTree.ClassDef(
        ctx.name().getText(), bases.args, bases.keywords, block(ctx.block()), decorators);
  }

  @Override
  public Stmt visitAsyncStmt(AsyncStmtContext ctx) {
    return asyncStmt(ctx, ImmutableList.of());
  }

  private Stmt asyncStmt(AsyncStmtContext ctx, List<Expr> decorators) {
    if (ctx.funcdef() != null) {
      return funcdef(ctx.funcdef(), decorators, true);
    } else if (!decorators.isEmpty()) {
      throw PyParser.error(ctx.start, "only functions and classes can be decorated");
    } else if (ctx.withStmt() != null) {
      return withStmt(ctx.withStmt(), true);
    } else {
      return forStmt(ctx.forStmt(), true);
    }
  }

  @Override
  public Stmt visitDecorated(DecoratedContext ctx) {
    List<Expr> decorators = new ArrayList<>();
    for (DecoratorContext decorator : ctx.decorator()) {
      decorators.add(exprs.visit(decorator.namedexprTest()));
    }
    if (ctx.classdef() != null) {
      return classdef(ctx.classdef(), decorators);
    } else if (ctx.funcdef() != null) {
      return funcdef(ctx.funcdef(), decorators, false);
    } else {
      return asyncStmt(ctx.asyncStmt(), decorators);
    }
  }

  @Override
  public Stmt visitMatchStmt(MatchStmtContext ctx) {
    List<PyTree.MatchCase> cases = new ArrayList<>();
    for (CaseBlockContext caseBlock : ctx.caseBlock()) {
      cases.add(
          new PyTree.MatchCase(
              patterns.visit(caseBlock.patterns()),
              exprs.visitIfPresent(caseBlock.guard),
              block(caseBlock.block())));
    }
    return new PyTree.Match(exprs.visit(ctx.subjectExpr()), cases);
  }
}
