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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/**
 * The lexical frames enclosing the current position of a walk over a syntax tree, innermost last.
 *
 * <p>The global frame is created with the stack and can never be popped, so the stack is never
 * empty. A name counts as defined if any frame on the stack defines it; there is no shadowing.
 */
final class ScopeStack {

  /** The names defined by one module, function, class, lambda or comprehension body. */
  static final class Frame {
    final Set<String> defined = new HashSet<>();

    /** True if this frame is for a comprehension (list, set, dict or generator). */
    final boolean isComprehension;

    Frame(boolean isComprehension) {
      this.isComprehension = isComprehension;
    }
  }

  /** The frames on the stack; the top of the stack is the first element. */
  private final Deque<Frame> frames = new ArrayDeque<>();

  private final Frame global = new Frame(false);

  ScopeStack() {
    frames.push(global);
  }

  /** Pushes a new, empty frame. */
  void push(boolean isComprehension) {
    frames.push(new Frame(isComprehension));
  }

  /** Removes the innermost frame; the global frame may not be removed. */
  void pop() {
    checkState(frames.peek() != global, "Cannot pop the global frame");
    frames.pop();
  }

  /** Returns the innermost frame. */
  Frame top() {
    return frames.peek();
  }

  /** Returns the frame that was created with this stack. */
  Frame global() {
    return global;
  }

  /** Adds {@code name} to the innermost frame; returns false if it was already there. */
  boolean define(String name) {
    return top().defined.add(name);
  }

  /** Removes {@code name} from the innermost frame. */
  void undefine(String name) {
    top().defined.remove(name);
  }

  /** Returns true if any frame on the stack defines {@code name}. */
  boolean isDefined(String name) {
    for (Frame frame : frames) {
      if (frame.defined.contains(name)) {
        return true;
      }
    }
    return false;
  }

  /** Returns the innermost frame that is not a comprehension frame. */
  Frame nearestNonComprehension() {
    for (Frame frame : frames) {
      if (!frame.isComprehension) {
        return frame;
      }
    }
    // The global frame is never a comprehension.
    throw new AssertionError();
  }

  /** Returns the number of frames on the stack, including the global frame. */
  int depth() {
    return frames.size();
  }
}
