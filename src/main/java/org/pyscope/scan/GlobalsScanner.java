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

import static com.google.common.base.Preconditions.checkState;

import java.util.HashSet;
import java.util.Set;
import org.pyscope.tree.PyTree;
import org.pyscope.tree.PyTree.Alias;
import org.pyscope.tree.PyTree.Arg;
import org.pyscope.tree.PyTree.Arguments;
import org.pyscope.tree.PyTree.Comprehension;
import org.pyscope.tree.PyTree.Expr;
import org.pyscope.tree.PyTree.Name;
import org.pyscope.tree.TreeWalker;

/**
 * Walks a module, recording each name that is loaded while no enclosing frame defines it.
 *
 * <p>Most node kinds are walked structurally; the overrides below are for the constructs that
 * open a frame, that bind names without a {@link Name} node, or whose evaluation order differs
 * from the order of their fields (e.g. an assignment's value is visited before its targets).
 *
 * <p>A GlobalsScanner is good for a single walk.
 */
final class GlobalsScanner extends TreeWalker {

  /** Names that were loaded while no frame defined them. */
  private final Set<String> refs = new HashSet<>();

  private final ScopeStack scopes = new ScopeStack();

  private boolean started;

  /** Walks {@code module}; may only be called once. */
  void scan(PyTree.Module module) {
    checkState(!started, "GlobalsScanner is single-use");
    started = true;
    visit(module);
    assert scopes.depth() == 1;
  }

  /** The free references found, less {@code builtins}, and the names defined at top level. */
  ScanResult result(Set<String> builtins) {
    checkState(started);
    Set<String> referenced = new HashSet<>(refs);
    referenced.removeAll(builtins);
    return new ScanResult(referenced, scopes.global().defined);
  }

  private void handleRef(String name) {
    if (!scopes.isDefined(name)) {
      refs.add(name);
    }
  }

  @Override
  public Void visitName(Name node) {
    switch (node.ctx) {
      case STORE:
        scopes.define(node.id);
        break;
      case LOAD:
        handleRef(node.id);
        break;
      case DEL:
        break;
    }
    return null;
  }

  @Override
  public Void visitFunctionDef(PyTree.FunctionDef node) {
    scopes.define(node.name);
    scopes.push(false);
    visitChildren(node);
    scopes.pop();
    return null;
  }

  @Override
  public Void visitArguments(Arguments node) {
    // Defaults are evaluated before any parameter is bound.
    visitAll(node.defaults);
    visitAll(node.kwDefaults);
    visitAll(node.posOnlyArgs);
    visitAll(node.args);
    visitIfPresent(node.varArg);
    visitAll(node.kwOnlyArgs);
    visitIfPresent(node.kwArg);
    return null;
  }

  @Override
  public Void visitArg(Arg node) {
    // Annotations are not scanned.
    scopes.define(node.name);
    return null;
  }

  @Override
  public Void visitClassDef(PyTree.ClassDef node) {
    scopes.define(node.name);
    scopes.push(false);
    visitChildren(node);
    scopes.pop();
    return null;
  }

  @Override
  public Void visitLambda(PyTree.Lambda node) {
    scopes.push(false);
    visitChildren(node);
    scopes.pop();
    return null;
  }

  @Override
  public Void visitListComp(PyTree.ListComp node) {
    scopes.push(true);
    visitAll(node.generators);
    visit(node.elt);
    scopes.pop();
    return null;
  }

  @Override
  public Void visitSetComp(PyTree.SetComp node) {
    scopes.push(true);
    visitAll(node.generators);
    visit(node.elt);
    scopes.pop();
    return null;
  }

  @Override
  public Void visitGeneratorExp(PyTree.GeneratorExp node) {
    scopes.push(true);
    visitAll(node.generators);
    visit(node.elt);
    scopes.pop();
    return null;
  }

  @Override
  public Void visitDictComp(PyTree.DictComp node) {
    scopes.push(true);
    visitAll(node.generators);
    visit(node.key);
    visit(node.value);
    scopes.pop();
    return null;
  }

  @Override
  public Void visitComprehension(Comprehension node) {
    visit(node.iter);
    visit(node.target);
    visitAll(node.ifs);
    return null;
  }

  @Override
  public Void visitImport(PyTree.Import node) {
    for (Alias alias : node.names) {
      if (alias.asName != null) {
        scopes.define(alias.asName);
      } else {
        int dot = alias.name.indexOf('.');
        scopes.define(dot < 0 ? alias.name : alias.name.substring(0, dot));
      }
    }
    return null;
  }

  @Override
  public Void visitImportFrom(PyTree.ImportFrom node) {
    for (Alias alias : node.names) {
      scopes.define(alias.asName != null ? alias.asName : alias.name);
    }
    return null;
  }

  @Override
  public Void visitAssign(PyTree.Assign node) {
    visit(node.value);
    visitAll(node.targets);
    return null;
  }

  @Override
  public Void visitAugAssign(PyTree.AugAssign node) {
    visit(node.value);
    // The target's previous value is read before it is rebound.
    if (node.target instanceof Name) {
      handleRef(((Name) node.target).id);
    }
    visit(node.target);
    return null;
  }

  @Override
  public Void visitAnnAssign(PyTree.AnnAssign node) {
    visitIfPresent(node.value);
    visit(node.target);
    return null;
  }

  @Override
  public Void visitNamedExpr(PyTree.NamedExpr node) {
    visit(node.value);
    Expr target = node.target;
    if (scopes.top().isComprehension && target instanceof Name) {
      // Binds in the scope containing the comprehension.
      scopes.nearestNonComprehension().defined.add(((Name) target).id);
    } else {
      visit(target);
    }
    return null;
  }

  @Override
  public Void visitExceptHandler(PyTree.ExceptHandler node) {
    visitIfPresent(node.type);
    if (node.name == null) {
      visitAll(node.body);
    } else {
      // The exception name is unbound again when the handler exits.
      boolean added = scopes.define(node.name);
      visitAll(node.body);
      if (added) {
        scopes.undefine(node.name);
      }
    }
    return null;
  }

  @Override
  public Void visitMatchAs(PyTree.MatchAs node) {
    if (node.name != null) {
      scopes.define(node.name);
    }
    visitIfPresent(node.pattern);
    return null;
  }

  @Override
  public Void visitMatchStar(PyTree.MatchStar node) {
    if (node.name != null) {
      scopes.define(node.name);
    }
    return null;
  }

  @Override
  public Void visitMatchMapping(PyTree.MatchMapping node) {
    visitAll(node.keys);
    visitAll(node.patterns);
    if (node.rest != null) {
      scopes.define(node.rest);
    }
    return null;
  }
}
