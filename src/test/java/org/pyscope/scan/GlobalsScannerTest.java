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

package org.pyscope.scan;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.Collections;
import java.util.List;
import org.junit.Test;
import org.pyscope.parser.PyParser;
import org.pyscope.tree.PyTree;
import org.pyscope.tree.PyTree.Alias;
import org.pyscope.tree.PyTree.Arg;
import org.pyscope.tree.PyTree.Arguments;
import org.pyscope.tree.PyTree.Comprehension;
import org.pyscope.tree.PyTree.Expr;
import org.pyscope.tree.PyTree.ExprContext;
import org.pyscope.tree.PyTree.Name;
import org.pyscope.tree.PyTree.Stmt;

/** Scans hand-built trees, so that these tests don't depend on the parser. */
public class GlobalsScannerTest {

  private static Name load(String id) {
    return new Name(id, ExprContext.LOAD);
  }

  private static Name store(String id) {
    return new Name(id, ExprContext.STORE);
  }

  private static Stmt assign(String target, Expr value) {
    return new PyTree.Assign(ImmutableList.of(store(target)), value);
  }

  private static Stmt expr(Expr value) {
    return new PyTree.ExprStmt(value);
  }

  private static Expr call(Expr func, Expr... args) {
    return new PyTree.Call(func, ImmutableList.copyOf(args), ImmutableList.of());
  }

  private static Stmt def(String name, Arguments args, Stmt... body) {
    return new PyTree.FunctionDef(
        name, args, ImmutableList.copyOf(body), ImmutableList.of(), null, false);
  }

  private static Arguments params(String... names) {
    ImmutableList.Builder<Arg> args = ImmutableList.builder();
    for (String name : names) {
      args.add(new Arg(name, null));
    }
    return new Arguments(
        ImmutableList.of(),
        args.build(),
        null,
        ImmutableList.of(),
        ImmutableList.of(),
        null,
        ImmutableList.of());
  }

  private static List<Comprehension> forIn(Expr target, Expr iter) {
    return ImmutableList.of(new Comprehension(target, iter, ImmutableList.of(), false));
  }

  private static ScanResult scan(Stmt... body) {
    return Globals.scan(new PyTree.Module(ImmutableList.copyOf(body)), BuiltinNames.none());
  }

  @Test
  public void loadBeforeStore() {
    ScanResult result =
        scan(expr(load("x")), assign("x", new PyTree.Constant("1")), expr(load("x")));
    assertThat(result.referenced).containsExactly("x");
    assertThat(result.defined).containsExactly("x");
  }

  @Test
  public void definitionInAnyEnclosingFrameCounts() {
    // x is global, so the load in f is not free even though f assigns x afterwards.
    ScanResult result =
        scan(
            assign("x", new PyTree.Constant("1")),
            def(
                "f",
                params(),
                assign("y", load("x")),
                assign("x", new PyTree.Constant("2")),
                new PyTree.Return(load("y"))));
    assertThat(result.referenced).isEmpty();
    assertThat(result.defined).containsExactly("f", "x").inOrder();
  }

  @Test
  public void functionFrameIsDiscarded() {
    ScanResult result =
        scan(
            def("f", params("a"), assign("b", load("a"))),
            expr(new PyTree.Tuple(ImmutableList.of(load("a"), load("b")), ExprContext.LOAD)));
    assertThat(result.referenced).containsExactly("a", "b");
    assertThat(result.defined).containsExactly("f");
  }

  @Test
  public void defaultsAreScannedBeforeParametersAreBound() {
    Arguments args =
        new Arguments(
            ImmutableList.of(),
            ImmutableList.of(new Arg("x", null)),
            null,
            ImmutableList.of(new Arg("k", null)),
            ImmutableList.of(load("k")),
            null,
            ImmutableList.of(load("x")));
    ScanResult result = scan(def("f", args, new PyTree.Return(load("x"))));
    assertThat(result.referenced).containsExactly("k", "x");
  }

  @Test
  public void parameterAnnotationsAreNotScanned() {
    Arguments args =
        new Arguments(
            ImmutableList.of(),
            ImmutableList.of(new Arg("a", load("ParamType"))),
            null,
            ImmutableList.of(),
            ImmutableList.of(),
            null,
            ImmutableList.of());
    Stmt f =
        new PyTree.FunctionDef(
            "f",
            args,
            ImmutableList.of(new PyTree.Pass()),
            ImmutableList.of(load("decorator")),
            load("ReturnType"),
            true);
    assertThat(scan(f).referenced).containsExactly("ReturnType", "decorator");
  }

  @Test
  public void comprehensionVariablesDoNotLeak() {
    Expr squares =
        new PyTree.ListComp(
            new PyTree.BinOp(load("n"), "*", load("n")), forIn(store("n"), load("n")));
    ScanResult result = scan(assign("squares", squares), expr(load("n")));
    // The iterable is scanned before the target binds n.
    assertThat(result.referenced).containsExactly("n");
    assertThat(result.defined).containsExactly("squares");
  }

  @Test
  public void walrusBindsInNearestNonComprehensionFrame() {
    Expr walrus = new PyTree.NamedExpr(store("last"), load("cell"));
    Expr inner = new PyTree.ListComp(walrus, forIn(store("cell"), load("row")));
    Expr outer = new PyTree.ListComp(inner, forIn(store("row"), load("grid")));

    ScanResult topLevel = scan(expr(outer));
    assertThat(topLevel.referenced).containsExactly("grid");
    assertThat(topLevel.defined).containsExactly("last");

    ScanResult inFunction = scan(def("f", params(), expr(outer)), expr(load("last")));
    assertThat(inFunction.referenced).containsExactly("grid", "last");
    assertThat(inFunction.defined).containsExactly("f");
  }

  @Test
  public void dictComprehensionScansKeyThenValue() {
    Expr dictComp =
        new PyTree.DictComp(
            new PyTree.NamedExpr(store("k2"), load("k")),
            new PyTree.BinOp(load("k2"), "+", load("v")),
            forIn(
                new PyTree.Tuple(ImmutableList.of(store("k"), store("v")), ExprContext.STORE),
                load("items")));
    ScanResult result = scan(expr(dictComp));
    assertThat(result.referenced).containsExactly("items");
    assertThat(result.defined).containsExactly("k2");
  }

  @Test
  public void importsBindFirstSegmentOrAlias() {
    ScanResult result =
        scan(
            new PyTree.Import(
                ImmutableList.of(new Alias("os.path", null), new Alias("numpy", "np"))),
            new PyTree.ImportFrom(
                "collections",
                ImmutableList.of(new Alias("OrderedDict", null), new Alias("deque", "dq")),
                0));
    assertThat(result.referenced).isEmpty();
    assertThat(result.defined).containsExactly("OrderedDict", "dq", "np", "os");
  }

  @Test
  public void augmentedAssignmentReadsThenWrites() {
    Stmt augmented = new PyTree.AugAssign(store("total"), "+", load("step"));
    ScanResult result = scan(augmented);
    assertThat(result.referenced).containsExactly("step", "total");
    assertThat(result.defined).containsExactly("total");

    Stmt attribute =
        new PyTree.AugAssign(
            new PyTree.Attribute(load("obj"), "count", ExprContext.STORE),
            "+",
            new PyTree.Constant("1"));
    result = scan(attribute);
    assertThat(result.referenced).containsExactly("obj");
    assertThat(result.defined).isEmpty();
  }

  @Test
  public void deleteIsIgnored() {
    ScanResult result =
        scan(new PyTree.Delete(ImmutableList.of(new Name("gone", ExprContext.DEL))));
    assertThat(result.referenced).isEmpty();
    assertThat(result.defined).isEmpty();
  }

  @Test
  public void classBodyHasItsOwnFrame() {
    Stmt cls =
        new PyTree.ClassDef(
            "C",
            ImmutableList.of(load("Base")),
            ImmutableList.of(),
            ImmutableList.of(assign("attr", new PyTree.Constant("1"))),
            ImmutableList.of());
    ScanResult result = scan(cls, expr(load("attr")));
    assertThat(result.referenced).containsExactly("Base", "attr");
    assertThat(result.defined).containsExactly("C");
  }

  @Test
  public void patternsBindCaptures() {
    PyTree.Pattern pattern =
        new PyTree.MatchOr(
            ImmutableList.of(
                new PyTree.MatchSequence(
                    ImmutableList.of(
                        new PyTree.MatchAs(null, "first"), new PyTree.MatchStar("rest"))),
                new PyTree.MatchMapping(
                    ImmutableList.of(new PyTree.Attribute(load("Keys"), "A", ExprContext.LOAD)),
                    ImmutableList.of(
                        new PyTree.MatchClass(
                            load("Point"),
                            ImmutableList.of(),
                            ImmutableList.of("x"),
                            ImmutableList.of(new PyTree.MatchAs(null, "px")))),
                    "others"),
                new PyTree.MatchAs(new PyTree.MatchValue(load("DEFAULT")), "whole")));
    Stmt match =
        new PyTree.Match(
            load("subject"),
            ImmutableList.of(
                new PyTree.MatchCase(pattern, load("first"), ImmutableList.of(new PyTree.Pass()))));
    ScanResult result = scan(match);
    assertThat(result.referenced).containsExactly("DEFAULT", "Keys", "Point", "subject");
    assertThat(result.defined).containsExactly("first", "others", "px", "rest", "whole");
  }

  @Test
  public void exceptionNameIsOnlyBoundInHandler() {
    Stmt handled =
        new PyTree.Try(
            ImmutableList.of(expr(call(load("run")))),
            ImmutableList.of(
                new PyTree.ExceptHandler(
                    load("Failure"), "e", ImmutableList.of(assign("saved", load("e"))))),
            ImmutableList.of(),
            ImmutableList.of(),
            false);
    ScanResult result = scan(handled, expr(load("e")));
    assertThat(result.referenced).containsExactly("Failure", "e", "run");
    assertThat(result.defined).containsExactly("saved");

    result = scan(assign("e", new PyTree.Constant("None")), handled);
    assertThat(result.defined).containsExactly("e", "saved");
  }

  @Test
  public void builtinsAreRemovedFromReferences() {
    PyTree.Module module =
        new PyTree.Module(ImmutableList.of(expr(call(load("print"), load("x")))));
    assertThat(Globals.scan(module, BuiltinNames.none()).referenced).containsExactly("print", "x");
    assertThat(Globals.scan(module, ImmutableSet.of("print")).referenced).containsExactly("x");
    assertThat(Globals.scan(module, BuiltinNames.python()).referenced).containsExactly("x");
  }

  @Test
  public void operandsAreScannedLeftToRight() {
    assertThat(Globals.scan("x = (y := 1) + y * 2 - y\n").referenced).isEmpty();
    assertThat(Globals.scan("x = y + (y := 1) - y\n").referenced).containsExactly("y");
  }

  @Test
  public void longOperatorChainsDoNotOverflowTheStack() {
    String code = "x = " + String.join(" + ", Collections.nCopies(10000, "a")) + " - b\n";
    ScanResult result = Globals.scan(PyParser.parse(code), BuiltinNames.none());
    assertThat(result.referenced).containsExactly("a", "b");
    assertThat(result.defined).containsExactly("x");
  }

  @Test
  public void scanningDoesNotChangeTheTree() {
    PyTree.Module module =
        PyParser.parse(
            "import os\n"
                + "def f(a=b):\n"
                + "    return [c := x for x in a]\n"
                + "for i in range(n):\n"
                + "    total += f(i)\n");
    String before = module.toString();
    ScanResult first = Globals.scan(module, BuiltinNames.python());
    ScanResult second = Globals.scan(module, BuiltinNames.python());
    assertThat(second).isEqualTo(first);
    assertThat(module.toString()).isEqualTo(before);
    assertThat(first.toString()).isEqualTo("referenced: [b, n, total], defined: [f, i, os, total]");
  }

  @Test
  public void scannerIsSingleUse() {
    GlobalsScanner scanner = new GlobalsScanner();
    PyTree.Module module = new PyTree.Module(ImmutableList.of());
    scanner.scan(module);
    assertThrows(IllegalStateException.class, () -> scanner.scan(module));
  }

  @Test
  public void resultRequiresScan() {
    assertThrows(IllegalStateException.class, () -> new GlobalsScanner().result(ImmutableSet.of()));
  }

  @Test
  public void builtinNames() {
    assertThat(BuiltinNames.python()).containsAtLeast("print", "len", "RuntimeError", "__name__");
    assertThat(BuiltinNames.python()).doesNotContain("x");
    assertThat(BuiltinNames.none()).isEmpty();
  }
}
