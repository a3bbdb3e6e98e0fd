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

import java.util.Set;
import java.util.logging.Logger;
import org.pyscope.parser.PyParser;
import org.pyscope.tree.PyTree;

/** Finds the free references and top-level definitions of a Python module. */
public final class Globals {

  private static final Logger logger = Logger.getLogger(Globals.class.getName());

  // Static methods only
  private Globals() {}

  /**
   * Scans the given module.
   *
   * <p>A name is referenced if it is loaded at a point where no enclosing module, function, class,
   * lambda or comprehension body has defined it (so far); a definition in any enclosing body is
   * enough, even if a closer one rebinds the name later. Names in {@code builtins} are removed from
   * the referenced set. The defined set holds the names bound at top level, including names bound
   * by an assignment expression inside a top-level comprehension.
   *
   * <p>The tree is not modified, so scanning it again returns an equal result.
   */
  public static ScanResult scan(PyTree.Module module, Set<String> builtins) {
    GlobalsScanner scanner = new GlobalsScanner();
    scanner.scan(module);
    ScanResult result = scanner.result(builtins);
    logger.fine(
        () ->
            String.format(
                "scanned %d statements: %d referenced, %d defined",
                module.body.size(), result.referenced.size(), result.defined.size()));
    return result;
  }

  /**
   * Parses and scans the given source code, ignoring references to Python's builtins.
   *
   * @throws org.pyscope.parser.ParseError if {@code code} is not a valid Python module
   */
  public static ScanResult scan(String code) {
    return scan(PyParser.parse(code), BuiltinNames.python());
  }
}
