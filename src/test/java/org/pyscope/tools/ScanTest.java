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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableSet;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Set;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.pyscope.scan.BuiltinNames;

public class ScanTest {

  @Rule public final TemporaryFolder tmp = new TemporaryFolder();

  private final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
  private final PrintStream out = new PrintStream(bytes, true, StandardCharsets.UTF_8);

  private File write(String name, String code) throws IOException {
    File file = tmp.newFile(name);
    Files.writeString(file.toPath(), code, StandardCharsets.UTF_8);
    return file;
  }

  private String output() {
    return bytes.toString(StandardCharsets.UTF_8);
  }

  @Test
  public void printsReferencedAndDefined() throws IOException {
    File file = write("prog.py", "import math\ny = math.sqrt(x)\nprint(y)\n");
    assertThat(Scan.scanFile(file.toPath(), BuiltinNames.python(), out)).isTrue();
    assertThat(output())
        .isEqualTo("/* SCAN prog.py\n  REFERENCED [x]\n  DEFINED [math, y]\n*/\n");
  }

  @Test
  public void reportsParseErrors() throws IOException {
    File file = write("bad.py", "x = 1\n  y = 2\n");
    assertThat(Scan.scanFile(file.toPath(), BuiltinNames.python(), out)).isFalse();
    assertThat(output()).startsWith("/* SCAN bad.py ERROR ");
    assertThat(output()).endsWith(" (2:2) */\n");
  }

  @Test
  public void builtinsProperty() throws IOException {
    assertThat(Scan.builtins("python")).isSameInstanceAs(BuiltinNames.python());
    assertThat(Scan.builtins("none")).isEmpty();
    File names = write("names.txt", "# predefined\nspam\n\n  eggs  \n");
    Set<String> fromFile = Scan.builtins(names.getPath());
    assertThat(fromFile).isEqualTo(ImmutableSet.of("spam", "eggs"));

    File file = write("prog.py", "print(spam, ham)\n");
    Scan.scanFile(file.toPath(), fromFile, out);
    assertThat(output()).contains("REFERENCED [ham, print]");
  }
}
