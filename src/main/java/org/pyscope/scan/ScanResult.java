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

import com.google.common.collect.ImmutableSortedSet;
import java.util.Collection;
import java.util.Objects;

/**
 * The result of scanning a module: the names it references without defining them (less any
 * builtins), and the names it defines at top level.
 */
public final class ScanResult {
  public final ImmutableSortedSet<String> referenced;
  public final ImmutableSortedSet<String> defined;

  public ScanResult(Collection<String> referenced, Collection<String> defined) {
    this.referenced = ImmutableSortedSet.copyOf(referenced);
    this.defined = ImmutableSortedSet.copyOf(defined);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof ScanResult)) {
      return false;
    }
    ScanResult other = (ScanResult) obj;
    return referenced.equals(other.referenced) && defined.equals(other.defined);
  }

  @Override
  public int hashCode() {
    return Objects.hash(referenced, defined);
  }

  @Override
  public String toString() {
    return String.format("referenced: %s, defined: %s", referenced, defined);
  }
}
