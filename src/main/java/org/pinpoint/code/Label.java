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

import com.google.common.base.Preconditions;

/**
 * A branch target. A Label is created before the instruction it refers to has been emitted, and
 * is placed (bound to the next instruction index) by {@link CodeBuilder#placeLabel}.
 */
public final class Label {
  private int index = -1;

  /** Returns the index of the instruction this label refers to. */
  public int index() {
    Preconditions.checkState(index >= 0, "Label not placed");
    return index;
  }

  boolean isPlaced() {
    return index >= 0;
  }

  void place(int index) {
    Preconditions.checkState(this.index < 0, "Label placed twice");
    this.index = index;
  }

  @Override
  public String toString() {
    return isPlaced() ? "@" + index : "@?";
  }
}
