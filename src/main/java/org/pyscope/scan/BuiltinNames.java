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

import com.google.common.collect.ImmutableSet;
import com.google.common.io.Resources;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/** Sets of predefined names that are not reported as free references. */
public final class BuiltinNames {

  // Static methods only
  private BuiltinNames() {}

  private static final String PYTHON_RESOURCE = "builtins.txt";

  /** Loaded on first use. */
  private static ImmutableSet<String> python;

  /** The names in the namespace of Python's {@code builtins} module. */
  public static synchronized ImmutableSet<String> python() {
    if (python == null) {
      try {
        python =
            parse(
                Resources.readLines(
                    Resources.getResource(BuiltinNames.class, PYTHON_RESOURCE),
                    StandardCharsets.UTF_8));
      } catch (IOException e) {
        throw new UncheckedIOException(e);
      }
    }
    return python;
  }

  /** No predefined names. */
  public static ImmutableSet<String> none() {
    return ImmutableSet.of();
  }

  /** Reads a file with one name per line; blank lines and lines beginning with "#" are ignored. */
  public static ImmutableSet<String> fromFile(Path file) throws IOException {
    return parse(Files.readAllLines(file, StandardCharsets.UTF_8));
  }

  private static ImmutableSet<String> parse(List<String> lines) {
    ImmutableSet.Builder<String> builder = ImmutableSet.builder();
    for (String line : lines) {
      line = line.trim();
      if (!line.isEmpty() && !line.startsWith("#")) {
        builder.add(line);
      }
    }
    return builder.build();
  }
}
