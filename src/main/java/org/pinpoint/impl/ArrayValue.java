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

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/** A mutable, 1-based array. */
public final class ArrayValue implements Iterable<Object> {

  private final List<Object> elements;

  public ArrayValue(List<Object> elements) {
    this.elements = new ArrayList<>(elements);
  }

  public int length() {
    return elements.size();
  }

  /**
   * Returns the element at the given (1-based) index.
   *
   * @throws ScriptError if the index is out of bounds
   */
  public Object get(long index) {
    return elements.get(checkIndex(index));
  }

  public void set(long index, Object value) {
    elements.set(checkIndex(index), value);
  }

  public void push(Object value) {
    elements.add(value);
  }

  private int checkIndex(long index) {
    if (index < 1 || index > elements.size()) {
      throw ScriptError.Kind.BOUNDS_ERROR.error(
          "attempt to access %s-element Array at index [%s]", elements.size(), index);
    }
    return (int) (index - 1);
  }

  /** Returns an iterator over the elements; elements pushed while iterating are included. */
  @Override
  public Iterator<Object> iterator() {
    return new Iterator<>() {
      int next = 0;

      @Override
      public boolean hasNext() {
        return next < elements.size();
      }

      @Override
      public Object next() {
        return elements.get(next++);
      }
    };
  }

  @Override
  public String toString() {
    return Values.display(this);
  }
}
