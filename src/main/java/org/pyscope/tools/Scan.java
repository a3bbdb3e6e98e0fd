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

package org.pyscope.tools;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Set;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.antlr.v4.runtime.CharStreams;
import org.pyscope.parser.ParseError;
import org.pyscope.parser.PyParser;
import org.pyscope.scan.BuiltinNames;
import org.pyscope.scan.Globals;
import org.pyscope.scan.ScanResult;
import org.pyscope.tree.PyTree;

/**
 * A simple command-line tool that prints the free references and top-level definitions of one or
 * more Python files.
 *
 * <p>System properties:
 *
 * <ul>
 *   <li>{@code builtins}: {@code python} (the default) to ignore references to Python's builtins,
 *       {@code none} to report them, or the path of a file listing the names to ignore, one per
 *       line.
 *   <li>{@code verbose}: if {@code true}, log progress to stderr.
 * </ul>
 */
public class Scan {
  private Scan() {}

  private static final Logger logger = Logger.getLogger(Scan.class.getName());

  /** Held so that the level set by {@link #enableVerboseLogging} isn't lost. */
  private static final Logger packageLogger = Logger.getLogger("org.pyscope");

  private static void checkUsage(boolean condition) {
    if (!condition) {
      System.err.println("Use: scan <fileName> [ <fileName> ...]");
      System.exit(1);
    }
  }

  private static void enableVerboseLogging() {
    ConsoleHandler handler = new ConsoleHandler();
    handler.setLevel(Level.FINE);
    packageLogger.addHandler(handler);
    packageLogger.setLevel(Level.FINE);
  }

  /** Returns the builtin names selected by the {@code builtins} property value. */
  static Set<String> builtins(String property) throws IOException {
    switch (property) {
      case "python":
        return BuiltinNames.python();
      case "none":
        return BuiltinNames.none();
      default:
        return BuiltinNames.fromFile(Path.of(property));
    }
  }

  /**
   * Scans one file and prints the result (or the parse error) to {@code out}. Returns false if the
   * file could not be parsed.
   */
  static boolean scanFile(Path file, Set<String> builtins, PrintStream out) throws IOException {
    String fileName = file.getFileName().toString();
    logger.fine(() -> "parsing " + file);
    PyTree.Module module;
    try {
      module = PyParser.parse(CharStreams.fromPath(file));
    } catch (ParseError e) {
      out.printf("/* SCAN %s ERROR %s */\n", fileName, e.getMessage());
      return false;
    }
    ScanResult result = Globals.scan(module, builtins);
    out.printf(
        "/* SCAN %s\n  REFERENCED %s\n  DEFINED %s\n*/\n",
        fileName, result.referenced, result.defined);
    return true;
  }

  public static void main(String[] args) throws IOException {
    if (Boolean.parseBoolean(System.getProperty("verbose", "false"))) {
      enableVerboseLogging();
    }
    Set<String> builtins = builtins(System.getProperty("builtins", "python"));
    checkUsage(args.length != 0);
    boolean ok = true;
    for (String arg : args) {
      ok &= scanFile(Path.of(arg), builtins, System.out);
    }
    if (!ok) {
      System.exit(1);
    }
  }
}
