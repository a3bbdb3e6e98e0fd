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

package org.pyscope.testing;

import com.google.common.collect.ImmutableList;
import com.google.testing.junit.testparameterinjector.TestParameterValuesProvider;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import org.jspecify.annotations.Nullable;

/**
 * Provides the programs in a directory of testdata files as test parameters.
 *
 * <p>Each file is split at each match of a comment pattern; the text before a match is one program,
 * and the pattern's first group is the expectation that goes with it. Text after the last match
 * becomes a program with no comment (which the test will presumably reject).
 */
public class TestdataScanner extends TestParameterValuesProvider {

  /**
   * One program from a testdata file. Its name is the file name and the line on which the program
   * starts.
   */
  public record TestProgram(String name, String code, @Nullable String comment) {
    @Override
    public String toString() {
      return name;
    }
  }

  private final Path dir;
  private final Pattern commentPattern;
  private final String suffix;

  /** Scans the {@code .py} files in {@code dir}. */
  protected TestdataScanner(Path dir, Pattern commentPattern) {
    this(dir, commentPattern, ".py");
  }

  protected TestdataScanner(Path dir, Pattern commentPattern, String suffix) {
    this.dir = dir;
    this.commentPattern = commentPattern;
    this.suffix = suffix;
  }

  @Override
  protected List<TestProgram> provideValues(Context context) throws IOException {
    ImmutableList.Builder<TestProgram> result = ImmutableList.builder();
    for (Path file : testFiles()) {
      String text = Files.readString(file, StandardCharsets.UTF_8);
      split(file.getFileName().toString(), text, result);
    }
    return result.build();
  }

  private List<Path> testFiles() throws IOException {
    try (Stream<Path> files = Files.list(dir)) {
      return files
          .filter(f -> f.getFileName().toString().endsWith(suffix))
          .sorted()
          .collect(ImmutableList.toImmutableList());
    }
  }

  private void split(String fileName, String text, ImmutableList.Builder<TestProgram> out) {
    Matcher matcher = commentPattern.matcher(text);
    int start = 0;
    while (matcher.find()) {
      String code = text.substring(start, matcher.start());
      out.add(program(fileName, text, start, code, matcher.group(1)));
      start = matcher.end();
    }
    String rest = text.substring(start);
    if (!rest.isBlank()) {
      out.add(program(fileName, text, start, rest, null));
    }
  }

  private static TestProgram program(
      String fileName, String text, int start, String code, @Nullable String comment) {
    int line = 1;
    for (int i = 0; i < start; i++) {
      if (text.charAt(i) == '\n') {
        line++;
      }
    }
    return new TestProgram(fileName + ":" + line, code, comment);
  }
}
