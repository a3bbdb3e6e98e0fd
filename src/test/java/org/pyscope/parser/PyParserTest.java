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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import java.util.Collections;
import junitparams.JUnitParamsRunner;
import junitparams.Parameters;
import junitparams.naming.TestCaseName;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.pyscope.tree.PyTree;

@RunWith(JUnitParamsRunner.class)
public class PyParserTest {

  /** Returns the dump of a module's single statement. */
  private static String parseOne(String code) {
    PyTree.Module module = PyParser.parse(code);
    assertThat(module.body).hasSize(1);
    return module.body.get(0).toString();
  }

  @SuppressWarnings("unused") // Used by @Parameters
  private static Object[] statements() {
    return new Object[] {
      new Object[] {"x = 1\n", "(Assign (Name x:STORE) (Constant 1))"},
      new Object[] {"x += 1", "(AugAssign + (Name x:STORE) (Constant 1))"},
      new Object[] {"x: int\n", "(AnnAssign (Name x:STORE) (Name int:LOAD))"},
      new Object[] {
        "a, *b = c\n",
        "(Assign (Tuple:STORE (Name a:STORE) (Starred:STORE (Name b:STORE))) (Name c:LOAD))"
      },
      new Object[] {
        "a = b = c\n", "(Assign (Name a:STORE) (Name b:STORE) (Name c:LOAD))"
      },
      new Object[] {
        "o.f[i] = v\n",
        "(Assign (Subscript:STORE (Attribute f:LOAD (Name o:LOAD)) (Name i:LOAD)) (Name v:LOAD))"
      },
      new Object[] {"del a, b.c\n", "(Delete (Name a:DEL) (Attribute c:DEL (Name b:LOAD)))"},
      new Object[] {"import a.b as c, d\n", "(Import (Alias a.b as c) (Alias d))"},
      new Object[] {"from ..m import x\n", "(ImportFrom ..m (Alias x))"},
      new Object[] {"from . import *\n", "(ImportFrom . (Alias *))"},
      new Object[] {"global a, b\n", "(Global a,b)"},
      new Object[] {"raise E from c\n", "(Raise (Name E:LOAD) (Name c:LOAD))"},
      new Object[] {"assert x, 'm'\n", "(Assert (Name x:LOAD) (Constant 'm'))"},
      new Object[] {
        "def f(a, b=1, *c, d, **e): pass\n",
        "(FunctionDef f (Arguments (Arg a) (Arg b) (Arg c) (Arg d) (Arg e) (Constant 1)) (Pass))"
      },
      new Object[] {
        "def f(a, /, b): return\n", "(FunctionDef f (Arguments (Arg a) (Arg b)) (Return))"
      },
      new Object[] {
        "async def f() -> T:\n    await g()\n",
        "(AsyncFunctionDef f (Arguments) (ExprStmt (Await (Call (Name g:LOAD)))) (Name T:LOAD))"
      },
      new Object[] {
        "def f(x) -> int:\n    return x\n",
        "(FunctionDef f (Arguments (Arg x)) (Return (Name x:LOAD)) (Name int:LOAD))"
      },
      new Object[] {
        "@d\nclass C(B, metaclass=M):\n    pass\n",
        "(ClassDef C (Name B:LOAD) (Keyword metaclass (Name M:LOAD)) (Pass) (Name d:LOAD))"
      },
      new Object[] {
        "if a:\n    pass\nelif b:\n    pass\nelse:\n    x = 1\n",
        "(If (Name a:LOAD) (Pass) (If (Name b:LOAD) (Pass) (Assign (Name x:STORE) (Constant 1))))"
      },
      new Object[] {
        "for k, v in d:\n    break\nelse:\n    continue\n",
        "(For (Tuple:STORE (Name k:STORE) (Name v:STORE)) (Name d:LOAD) (Break) (Continue))"
      },
      new Object[] {
        "while x: x -= 1\n", "(While (Name x:LOAD) (AugAssign - (Name x:STORE) (Constant 1)))"
      },
      new Object[] {
        "with a as b, c:\n    pass\n",
        "(With (WithItem (Name a:LOAD) (Name b:STORE)) (WithItem (Name c:LOAD)) (Pass))"
      },
      new Object[] {
        "try:\n    pass\nexcept E as e:\n    pass\nfinally:\n    pass\n",
        "(Try (Pass) (ExceptHandler e (Name E:LOAD) (Pass)) (Pass))"
      },
      new Object[] {
        "try:\n    pass\nexcept* E:\n    pass\n",
        "(TryStar (Pass) (ExceptHandler (Name E:LOAD) (Pass)))"
      },
      new Object[] {"match = 1\n", "(Assign (Name match:STORE) (Constant 1))"},
      new Object[] {
        "match p:\n    case [1, *rest] | {'k': v} if v:\n        pass\n",
        "(Match (Name p:LOAD) (MatchCase (MatchOr (MatchSequence (MatchValue (Constant 1))"
            + " (MatchStar rest)) (MatchMapping (Constant 'k') (MatchAs v))) (Name v:LOAD)"
            + " (Pass)))"
      },
      new Object[] {
        "match p:\n    case Point(0, y=_) as q:\n        pass\n",
        "(Match (Name p:LOAD) (MatchCase (MatchAs q (MatchClass y (Name Point:LOAD)"
            + " (MatchValue (Constant 0)) (MatchAs))) (Pass)))"
      },
      new Object[] {
        "match p:\n    case -1 | None | a.B:\n        pass\n",
        "(Match (Name p:LOAD) (MatchCase (MatchOr (MatchValue (UnaryOp - (Constant 1)))"
            + " (MatchSingleton None) (MatchValue (Attribute B:LOAD (Name a:LOAD)))) (Pass)))"
      },
    };
  }

  @Test
  @Parameters(method = "statements")
  @TestCaseName("statement_{index}")
  public void statement(String code, String expected) {
    assertThat(parseOne(code)).isEqualTo(expected);
  }

  @SuppressWarnings("unused") // Used by @Parameters
  private static Object[] expressions() {
    return new Object[] {
      new Object[] {"1 + 2 * 3", "(BinOp + (Constant 1) (BinOp * (Constant 2) (Constant 3)))"},
      new Object[] {"-x ** 2", "(UnaryOp - (BinOp ** (Name x:LOAD) (Constant 2)))"},
      new Object[] {"2 ** 3 ** 4", "(BinOp ** (Constant 2) (BinOp ** (Constant 3) (Constant 4)))"},
      new Object[] {
        "a - b - c", "(BinOp - (BinOp - (Name a:LOAD) (Name b:LOAD)) (Name c:LOAD))"
      },
      new Object[] {
        "a * b + c * d",
        "(BinOp + (BinOp * (Name a:LOAD) (Name b:LOAD)) (BinOp * (Name c:LOAD) (Name d:LOAD)))"
      },
      new Object[] {
        "a < b <= c", "(Compare <,<= (Name a:LOAD) (Name b:LOAD) (Name c:LOAD))"
      },
      new Object[] {
        "a is not b not in c",
        "(Compare is not,not in (Name a:LOAD) (Name b:LOAD) (Name c:LOAD))"
      },
      new Object[] {
        "not a or b and c",
        "(BoolOp or (UnaryOp not (Name a:LOAD)) (BoolOp and (Name b:LOAD) (Name c:LOAD)))"
      },
      new Object[] {"a if b else c", "(IfExp (Name b:LOAD) (Name a:LOAD) (Name c:LOAD))"},
      new Object[] {
        "lambda x, *, y=1: x",
        "(Lambda (Arguments (Arg x) (Arg y) (Constant 1)) (Name x:LOAD))"
      },
      new Object[] {
        "(y := f(x))", "(NamedExpr (Name y:STORE) (Call (Name f:LOAD) (Name x:LOAD)))"
      },
      new Object[] {
        "f(a, *b, k=c, **d)",
        "(Call (Name f:LOAD) (Name a:LOAD) (Starred:LOAD (Name b:LOAD)) (Keyword k (Name c:LOAD))"
            + " (Keyword ** (Name d:LOAD)))"
      },
      new Object[] {
        "f(x for x in y)",
        "(Call (Name f:LOAD) (GeneratorExp (Name x:LOAD) (Comprehension (Name x:STORE)"
            + " (Name y:LOAD))))"
      },
      new Object[] {
        "a[1:2, ::3]",
        "(Subscript:LOAD (Name a:LOAD) (Tuple:LOAD (Slice (Constant 1) (Constant 2))"
            + " (Slice (Constant 3))))"
      },
      new Object[] {
        "[x for x in y if x]",
        "(ListComp (Name x:LOAD) (Comprehension (Name x:STORE) (Name y:LOAD) (Name x:LOAD)))"
      },
      new Object[] {
        "{k: v for k, v in d}",
        "(DictComp (Name k:LOAD) (Name v:LOAD) (Comprehension (Tuple:STORE (Name k:STORE)"
            + " (Name v:STORE)) (Name d:LOAD)))"
      },
      new Object[] {"{a, *b}", "(Set (Name a:LOAD) (Starred:LOAD (Name b:LOAD)))"},
      new Object[] {
        "{**a, 'k': v}", "(Dict (Constant 'k') (Name a:LOAD) (Name v:LOAD))"
      },
      new Object[] {"()", "(Tuple:LOAD)"},
      new Object[] {"(1,)", "(Tuple:LOAD (Constant 1))"},
      new Object[] {"[]", "(List:LOAD)"},
      new Object[] {"{}", "(Dict)"},
      new Object[] {"...", "(Constant ...)"},
      new Object[] {"'a' \"b\"", "(Constant 'a' \"b\")"},
      new Object[] {
        "f'a{b!r:>{w}}'",
        "(JoinedStr (Constant a) (FormattedValue (Name b:LOAD) (JoinedStr (Constant >)"
            + " (FormattedValue (Name w:LOAD)))))"
      },
      new Object[] {
        "f'{x=}' 'y'",
        "(JoinedStr (Constant x=) (FormattedValue (Name x:LOAD)) (Constant 'y'))"
      },
      new Object[] {
        "f'{{{d[\"k\"]}}}'",
        "(JoinedStr (Constant {) (FormattedValue (Subscript:LOAD (Name d:LOAD)"
            + " (Constant \"k\"))) (Constant }))"
      },
    };
  }

  @Test
  @Parameters(method = "expressions")
  @TestCaseName("expression_{index}")
  public void expression(String code, String expected) {
    assertThat(parseOne(code)).isEqualTo("(ExprStmt " + expected + ")");
  }

  @Test
  public void logicalLines() {
    String code =
        "# leading comment\n"
            + "\n"
            + "x = (1 +\n"
            + "     2)\n"
            + "if x:  # trailing comment\n"
            + "\n"
            + "    y = [\n"
            + "  3]\n"
            + "# comment at another indentation\n"
            + "    z = y \\\n"
            + "        + x\n"
            + "a = 1; b = 2;\n";
    PyTree.Module module = PyParser.parse(code);
    assertThat(module.toString())
        .isEqualTo(
            "(Module (Assign (Name x:STORE) (BinOp + (Constant 1) (Constant 2)))"
                + " (If (Name x:LOAD) (Assign (Name y:STORE) (List:LOAD (Constant 3)))"
                + " (Assign (Name z:STORE) (BinOp + (Name y:LOAD) (Name x:LOAD))))"
                + " (Assign (Name a:STORE) (Constant 1)) (Assign (Name b:STORE) (Constant 2)))");
  }

  @Test
  public void longOperatorChainsNestToTheLeft() {
    String code = String.join(" + ", Collections.nCopies(10000, "a")) + "\n";
    PyTree.Expr expr = ((PyTree.ExprStmt) PyParser.parse(code).body.get(0)).value;
    int depth = 0;
    while (expr instanceof PyTree.BinOp) {
      expr = ((PyTree.BinOp) expr).left;
      depth++;
    }
    assertThat(depth).isEqualTo(9999);
    assertThat(expr.toString()).isEqualTo("(Name a:LOAD)");
  }

  @Test
  public void nestedBlocksCloseAtEndOfInput() {
    String code = "def f():\n\tif a:\n\t\treturn 1\n        return 2";
    assertThat(PyParser.parse(code).toString())
        .isEqualTo(
            "(Module (FunctionDef f (Arguments) (If (Name a:LOAD) (Return (Constant 1)))"
                + " (Return (Constant 2))))");
  }

  @Test
  public void emptyModule() {
    assertThat(PyParser.parse("").body).isEmpty();
    assertThat(PyParser.parse("\n  \n# only a comment\n").body).isEmpty();
  }

  @SuppressWarnings("unused") // Used by @Parameters
  private static Object[] errors() {
    return new Object[] {
      new Object[] {"1 = x\n", "cannot assign to literal (1:0)"},
      new Object[] {
        "x = 1\nf() += 1\n",
        "'function call' is an illegal expression for augmented assignment (2:0)"
      },
      new Object[] {"del f()\n", "cannot delete function call (1:4)"},
      new Object[] {"for 1 in x: pass\n", "cannot assign to literal (1:4)"},
      new Object[] {
        "if x:\n  a\n b\n", "unindent does not match any outer indentation level (3:1)"
      },
      new Object[] {" a\n", "unexpected indent (1:1)"},
      new Object[] {"\n\n   a\n", "unexpected indent (3:3)"},
      new Object[] {
        "def f(a=1, b): pass\n", "non-default argument follows default argument (1:11)"
      },
      new Object[] {"def f(*a, *b): pass\n", "* argument may appear only once (1:10)"},
      new Object[] {"lambda /: 1\n", "at least one argument must precede / (1:7)"},
      new Object[] {
        "f(**a, *b)\n", "iterable argument unpacking follows keyword argument unpacking (1:7)"
      },
      new Object[] {
        "f(**a, b)\n", "positional argument follows keyword argument unpacking (1:7)"
      },
      new Object[] {"x = f'{'\n", "f-string: expecting '}' (1:4)"},
      new Object[] {
        "x = f'{a!x}'\n",
        "f-string: invalid conversion character: expected 's', 'r', or 'a' (1:4)"
      },
      new Object[] {"[*a] = *b\n", "can't use starred expression here (1:0)"},
      new Object[] {"x := 1\n", "invalid syntax (1:2)"},
      new Object[] {"y = x := 1\n", "invalid syntax (1:6)"},
      new Object[] {"def f():\n    return x := 1\n", "invalid syntax (2:13)"},
      new Object[] {"for i in x := y: pass\n", "invalid syntax (1:11)"},
      new Object[] {
        "{**a for a in b}\n", "dict unpacking cannot be used in dict comprehension (1:0)"
      },
      new Object[] {
        "try:\n  pass\nexcept:\n  pass\nexcept E:\n  pass\n",
        "default 'except:' must be last (3:0)"
      },
      new Object[] {
        "match x:\n  case {**r, 'k': v}: pass\n",
        "double star pattern must be the last item (2:13)"
      },
      new Object[] {
        "match x:\n  case C(a=1, b): pass\n", "positional patterns follow keyword patterns (2:14)"
      },
      new Object[] {"match x:\n  case _ as _: pass\n", "cannot use '_' as a target (2:12)"},
      new Object[] {
        "@d\nasync for x in y: pass\n", "only functions and classes can be decorated (2:0)"
      },
    };
  }

  @Test
  @Parameters(method = "errors")
  @TestCaseName("error_{index}")
  public void error(String code, String expected) {
    ParseError e = assertThrows(ParseError.class, () -> PyParser.parse(code));
    assertThat(e).hasMessageThat().isEqualTo(expected);
  }

  @Test
  public void errorInReplacementFieldIsReportedAtTheString() {
    ParseError e = assertThrows(ParseError.class, () -> PyParser.parse("x = 1\ny = f'{a b}'\n"));
    assertThat(e.msg).startsWith("f-string: ");
    assertThat(e.lineNum).isEqualTo(2);
    assertThat(e.charPositionInLine).isEqualTo(4);
  }

  @Test
  public void syntaxErrorsFromTheParserHaveLocations() {
    ParseError e = assertThrows(ParseError.class, () -> PyParser.parse("x = 1\ny = (2,\n"));
    assertThat(e.lineNum).isAtLeast(2);
    e = assertThrows(ParseError.class, () -> PyParser.parse("def f(:\n  pass\n"));
    assertThat(e.lineNum).isEqualTo(1);
    assertThat(e.charPositionInLine).isEqualTo(6);
  }
}
