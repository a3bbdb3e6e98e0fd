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

import org.junit.Test;

public class ScopeStackTest {

  @Test
  public void startsWithGlobalFrame() {
    ScopeStack scopes = new ScopeStack();
    assertThat(scopes.depth()).isEqualTo(1);
    assertThat(scopes.top()).isSameInstanceAs(scopes.global());
    assertThat(scopes.global().isComprehension).isFalse();
    assertThat(scopes.global().defined).isEmpty();
  }

  @Test
  public void globalFrameCannotBePopped() {
    ScopeStack scopes = new ScopeStack();
    scopes.push(false);
    scopes.pop();
    IllegalStateException e = assertThrows(IllegalStateException.class, scopes::pop);
    assertThat(e).hasMessageThat().isEqualTo("Cannot pop the global frame");
    assertThat(scopes.depth()).isEqualTo(1);
  }

  @Test
  public void defineGoesToInnermostFrame() {
    ScopeStack scopes = new ScopeStack();
    assertThat(scopes.define("a")).isTrue();
    assertThat(scopes.define("a")).isFalse();
    scopes.push(false);
    scopes.define("b");
    assertThat(scopes.top().defined).containsExactly("b");
    assertThat(scopes.global().defined).containsExactly("a");
    scopes.pop();
    assertThat(scopes.global().defined).containsExactly("a");
  }

  @Test
  public void isDefinedChecksEveryFrame() {
    ScopeStack scopes = new ScopeStack();
    scopes.define("outer");
    scopes.push(false);
    scopes.push(true);
    scopes.define("inner");
    assertThat(scopes.isDefined("outer")).isTrue();
    assertThat(scopes.isDefined("inner")).isTrue();
    assertThat(scopes.isDefined("missing")).isFalse();
    scopes.pop();
    assertThat(scopes.isDefined("inner")).isFalse();
    assertThat(scopes.isDefined("outer")).isTrue();
  }

  @Test
  public void undefineOnlyAffectsInnermostFrame() {
    ScopeStack scopes = new ScopeStack();
    scopes.define("e");
    scopes.push(false);
    scopes.define("e");
    scopes.undefine("e");
    assertThat(scopes.top().defined).isEmpty();
    assertThat(scopes.isDefined("e")).isTrue();
  }

  @Test
  public void nearestNonComprehensionSkipsComprehensions() {
    ScopeStack scopes = new ScopeStack();
    assertThat(scopes.nearestNonComprehension()).isSameInstanceAs(scopes.global());
    scopes.push(true);
    scopes.push(true);
    assertThat(scopes.nearestNonComprehension()).isSameInstanceAs(scopes.global());
    scopes.pop();
    scopes.pop();
    scopes.push(false);
    ScopeStack.Frame function = scopes.top();
    scopes.push(true);
    assertThat(scopes.depth()).isEqualTo(3);
    assertThat(scopes.nearestNonComprehension()).isSameInstanceAs(function);
  }
}
