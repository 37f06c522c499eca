/*
 * Copyright 2025 The Retrospect Authors
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

package org.pinpoint.impl;

import java.util.Iterator;

/** The state of a {@code for} loop: an iterator over the loop's collection. */
final class IterationState {

  /** Returned by {@link #next} when the iteration is complete. */
  static final Object DONE =
      new Object() {
        @Override
        public String toString() {
          return "#done";
        }
      };

  private final Iterator<Object> iterator;

  IterationState(Iterator<Object> iterator) {
    this.iterator = iterator;
  }

  /** Returns the next element, or {@link #DONE}. */
  Object next() {
    return iterator.hasNext() ? iterator.next() : DONE;
  }
}
