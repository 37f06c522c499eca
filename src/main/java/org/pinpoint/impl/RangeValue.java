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
import java.util.NoSuchElementException;

/** The integers from {@code first} to {@code last}, inclusive; empty if {@code last < first}. */
public record RangeValue(long first, long last) implements Iterable<Object> {

  public long length() {
    return Math.max(0, last - first + 1);
  }

  public long get(long index) {
    if (index < 1 || index > length()) {
      throw ScriptError.Kind.BOUNDS_ERROR.error(
          "attempt to access %s-element Range at index [%s]", length(), index);
    }
    return first + index - 1;
  }

  @Override
  public Iterator<Object> iterator() {
    return new Iterator<>() {
      long next = first;

      @Override
      public boolean hasNext() {
        return next <= last;
      }

      @Override
      public Object next() {
        if (next > last) {
          throw new NoSuchElementException();
        }
        return next++;
      }
    };
  }

  @Override
  public String toString() {
    return first + ":" + last;
  }
}
