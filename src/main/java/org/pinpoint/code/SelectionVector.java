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

package org.pinpoint.code;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.BitSet;

/**
 * A boolean per instruction of a {@link CodeUnit}, recording which instructions must execute. Marks
 * can be added but never removed.
 */
public final class SelectionVector {
  private final int size;
  private final BitSet marks;

  public SelectionVector(int size) {
    this.size = size;
    this.marks = new BitSet(size);
  }

  public int size() {
    return size;
  }

  public boolean get(int index) {
    return marks.get(index);
  }

  /** Returns the first marked index at or after {@code from}, or -1 if there is none. */
  public int nextSetBit(int from) {
    return marks.nextSetBit(from);
  }

  /** Returns the number of marked instructions. */
  public int count() {
    return marks.cardinality();
  }

  /** Marks the given instruction; returns true if it was not already marked. */
  @CanIgnoreReturnValue
  boolean mark(int index) {
    if (index < 0 || index >= size) {
      throw new IndexOutOfBoundsException(index);
    }
    if (marks.get(index)) {
      return false;
    }
    marks.set(index);
    return true;
  }

  /** Returns e.g. {@code "0110"}, one character per instruction. */
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(size);
    for (int i = 0; i < size; i++) {
      sb.append(marks.get(i) ? '1' : '0');
    }
    return sb.toString();
  }
}
