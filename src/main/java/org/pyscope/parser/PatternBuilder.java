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
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.jspecify.annotations.Nullable;
import org.pyscope.parser.PythonParser.CaptureClosedPatternContext;
import org.pyscope.parser.PythonParser.ClassArgContext;
import org.pyscope.parser.PythonParser.ClassClosedPatternContext;
import org.pyscope.parser.PythonParser.GroupClosedPatternContext;
import org.pyscope.parser.PythonParser.KeywordClassArgContext;
import org.pyscope.parser.PythonParser.ListClosedPatternContext;
import org.pyscope.parser.PythonParser.LiteralClosedPatternContext;
import org.pyscope.parser.PythonParser.LiteralKeyItemContext;
import org.pyscope.parser.PythonParser.LiteralPatternContext;
import org.pyscope.parser.PythonParser.MappingClosedPatternContext;
import org.pyscope.parser.PythonParser.MappingItemContext;
import org.pyscope.parser.PythonParser.MaybeSequencePatternContext;
import org.pyscope.parser.PythonParser.MaybeStarPatternContext;
import org.pyscope.parser.PythonParser.NameContext;
import org.pyscope.parser.PythonParser.NumberPatternContext;
import org.pyscope.parser.PythonParser.OpenSequencePatternContext;
import org.pyscope.parser.PythonParser.OrPatternContext;
import org.pyscope.parser.PythonParser.PatternContext;
import org.pyscope.parser.PythonParser.PatternsContext;
import org.pyscope.parser.PythonParser.PlainPatternContext;
import org.pyscope.parser.PythonParser.PositionalClassArgContext;
import org.pyscope.parser.PythonParser.RestItemContext;
import org.pyscope.parser.PythonParser.StarPatternContext;
import org.pyscope.parser.PythonParser.StringPatternContext;
import org.pyscope.parser.PythonParser.TupleClosedPatternContext;
import org.pyscope.parser.PythonParser.ValueClosedPatternContext;
import org.pyscope.parser.PythonParser.ValueKeyItemContext;
import org.pyscope.tree.PyTree;
import org.pyscope.tree.PyTree.Expr;
import org.pyscope.tree.PyTree.ExprContext;
import org.pyscope.tree.PyTree.Pattern;

/** Builds the PyTree for the pattern of a {@code case} clause. */
class PatternBuilder extends VisitorBase<Pattern> {

  /** The name that matches anything without binding it. */
  private static final String WILDCARD = "_";

  /** Used for the expressions in value patterns and mapping keys. */
  private final ExpressionBuilder exprs;

  PatternBuilder(ExpressionBuilder exprs) {
    this.exprs = exprs;
  }

  private List<Pattern> visitAll(List<? extends ParseTree> nodes) {
    List<Pattern> result = new ArrayList<>(nodes.size());
    for (ParseTree node : nodes) {
      result.add(visit(node));
    }
    return result;
  }

  /** Returns the name bound by a capture target, which may not be the wildcard. */
  private String captureName(NameContext name) {
    String result = name.getText();
    if (result.equals(WILDCARD)) {
      throw PyParser.error(name.start, "cannot use '_' as a target");
    }
    return result;
  }

  @Override
  public Pattern visitPatterns(PatternsContext ctx) {
    return visit(ctx.getChild(0));
  }

  @Override
  public Pattern visitPattern(PatternContext ctx) {
    Pattern pattern = visit(ctx.orPattern());
    if (ctx.name() == null) {
      return pattern;
    }
    return new PyTree.MatchAs(pattern, captureName(ctx.name()));
  }

  @Override
  public Pattern visitOrPattern(OrPatternContext ctx) {
    if (ctx.closedPattern().size() == 1) {
      return visit(ctx.closedPattern(0));
    }
    return new PyTree.MatchOr(visitAll(ctx.closedPattern()));
  }

  @Override
  public Pattern visitLiteralClosedPattern(LiteralClosedPatternContext ctx) {
    LiteralPatternContext literal = ctx.literalPattern();
    Expr value = literal(literal);
    if (value == null) {
      return new PyTree.MatchSingleton(literal.getText());
    }
    return new PyTree.MatchValue(value);
  }

  /**
   * Returns the expression for a numeric or string literal pattern, or null for {@code None},
   * {@code True} and {@code False}.
   */
  private @Nullable Expr literal(LiteralPatternContext ctx) {
    if (ctx instanceof NumberPatternContext) {
      return number((NumberPatternContext) ctx);
    } else if (ctx instanceof StringPatternContext) {
      Expr result = exprs.strings(((StringPatternContext) ctx).STRING());
      if (result instanceof PyTree.JoinedStr) {
        throw PyParser.error(ctx.start, "patterns may only match literals and attribute lookups");
      }
      return result;
    }
    return null;
  }

  /** Handles "1", "-1", and complex literals such as "1 + 2j" or "-1 - 2j". */
  private static Expr number(NumberPatternContext ctx) {
    List<TerminalNode> numbers = ctx.NUMBER();
    Expr result = new PyTree.Constant(numbers.get(0).getText());
    if (ctx.getChild(0).getText().equals("-")) {
      result = new PyTree.UnaryOp("-", result);
    }
    if (numbers.size() == 2) {
      int opIndex = ctx.children.indexOf(numbers.get(1)) - 1;
      result =
          new PyTree.BinOp(
              result,
              ctx.getChild(opIndex).getText(),
              new PyTree.Constant(numbers.get(1).getText()));
    }
    return result;
  }

  /** Returns a Name, or an Attribute chain for a dotted name. */
  private static Expr dottedName(List<NameContext> names) {
    Expr result = new PyTree.Name(names.get(0).getText(), ExprContext.LOAD);
    for (NameContext name : names.subList(1, names.size())) {
      result = new PyTree.Attribute(result, name.getText(), ExprContext.LOAD);
    }
    return result;
  }

  @Override
  public Pattern visitCaptureClosedPattern(CaptureClosedPatternContext ctx) {
    String name = ctx.name().getText();
    return new PyTree.MatchAs(null, name.equals(WILDCARD) ? null : name);
  }

  @Override
  public Pattern visitValueClosedPattern(ValueClosedPatternContext ctx) {
    return new PyTree.MatchValue(dottedName(ctx.name()));
  }

  @Override
  public Pattern visitGroupClosedPattern(GroupClosedPatternContext ctx) {
    return visit(ctx.pattern());
  }

  @Override
  public Pattern visitListClosedPattern(ListClosedPatternContext ctx) {
    return sequence(null, ctx.maybeSequencePattern());
  }

  @Override
  public Pattern visitTupleClosedPattern(TupleClosedPatternContext ctx) {
    OpenSequencePatternContext open = ctx.openSequencePattern();
    return (open == null) ? sequence(null, null) : visit(open);
  }

  @Override
  public Pattern visitOpenSequencePattern(OpenSequencePatternContext ctx) {
    return sequence(ctx.maybeStarPattern(), ctx.maybeSequencePattern());
  }

  private Pattern sequence(
      @Nullable MaybeStarPatternContext first, @Nullable MaybeSequencePatternContext rest) {
    List<Pattern> patterns = new ArrayList<>();
    if (first != null) {
      patterns.add(visit(first));
    }
    if (rest != null) {
      patterns.addAll(visitAll(rest.maybeStarPattern()));
    }
    int stars = 0;
    for (Pattern pattern : patterns) {
      if (pattern instanceof PyTree.MatchStar) {
        stars++;
      }
    }
    if (stars > 1) {
      throw error("multiple starred names in sequence pattern");
    }
    return new PyTree.MatchSequence(patterns);
  }

  @Override
  public Pattern visitStarPattern(StarPatternContext ctx) {
    String name = ctx.name().getText();
    return new PyTree.MatchStar(name.equals(WILDCARD) ? null : name);
  }

  @Override
  public Pattern visitPlainPattern(PlainPatternContext ctx) {
    return visit(ctx.pattern());
  }

  @Override
  public Pattern visitMappingClosedPattern(MappingClosedPatternContext ctx) {
    List<Expr> keys = new ArrayList<>();
    List<Pattern> values = new ArrayList<>();
    String rest = null;
    for (MappingItemContext item : ctx.mappingItem()) {
      if (rest != null) {
        throw PyParser.error(item.start, "double star pattern must be the last item");
      }
      if (item instanceof LiteralKeyItemContext) {
        LiteralKeyItemContext literalItem = (LiteralKeyItemContext) item;
        Expr key = literal(literalItem.literalPattern());
        keys.add(key != null ? key : new PyTree.Constant(literalItem.literalPattern().getText()));
        values.add(visit(literalItem.pattern()));
      } else if (item instanceof ValueKeyItemContext) {
        ValueKeyItemContext valueItem = (ValueKeyItemContext) item;
        keys.add(dottedName(valueItem.name()));
        values.add(visit(valueItem.pattern()));
      } else {
        rest = captureName(((RestItemContext) item).name());
      }
    }
    return new PyTree.MatchMapping(keys, values, rest);
  }

  @Override
  public Pattern visitClassClosedPattern(ClassClosedPatternContext ctx) {
    List<Pattern> patterns = new ArrayList<>();
    List<String> kwdAttrs = new ArrayList<>();
    List<Pattern> kwdPatterns = new ArrayList<>();
    for (ClassArgContext arg : ctx.classArg()) {
      if (arg instanceof KeywordClassArgContext) {
        KeywordClassArgContext keyword = (KeywordClassArgContext) arg;
        kwdAttrs.add(keyword.name().getText());
        kwdPatterns.add(visit(keyword.pattern()));
      } else if (!kwdAttrs.isEmpty()) {
        throw PyParser.error(arg.start, "positional patterns follow keyword patterns");
      } else {
        patterns.add(visit(((PositionalClassArgContext) arg).pattern()));
      }
    }
    return new PyTree.MatchClass(dottedName(ctx.name()), patterns, kwdAttrs, kwdPatterns);
  }
}
