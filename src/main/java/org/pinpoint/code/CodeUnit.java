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

import com.google.common.collect.ImmutableList;
import java.nio.file.Path;

/**
 * A compiled statement sequence: either one top-level statement of a source file, or the body of
 * a function. Slots {@code 0 .. numParams-1} hold the arguments; {@link #captureSlots} lists the
 * slots initialized from a closure's captured values.
 */
public final class CodeUnit {
  public final String name;
  public final Path file;
  public final ImmutableList<Instruction> code;
  public final ImmutableList<String> slotNames;
  public final int numParams;
  public final ImmutableList<Integer> captureSlots;

  /** The slot that holds the function itself (for local recursion), or -1. */
  public final int selfSlot;

  CodeUnit(
      String name,
      Path file,
      ImmutableList<Instruction> code,
      ImmutableList<String> slotNames,
      int numParams,
      ImmutableList<Integer> captureSlots,
      int selfSlot) {
    this.name = name;
    this.file = file;
    this.code = code;
    this.slotNames = slotNames;
    this.numParams = numParams;
    this.captureSlots = captureSlots;
    this.selfSlot = selfSlot;
  }

  public int size() {
    return code.size();
  }

  public Instruction get(int index) {
    return code.get(index);
  }

  public int numSlots() {
    return slotNames.size();
  }

  /** Returns a listing of the instructions, one per line, with their indices and lines. */
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(name).append(" (");
    for (int i = 0; i < slotNames.size(); i++) {
      sb.append(i == 0 ? "" : ", ").append('_').append(i).append(':').append(slotNames.get(i));
    }
    sb.append(")\n");
    for (int i = 0; i < code.size(); i++) {
      Instruction inst = code.get(i);
      sb.append(String.format("%4d: ", i));
      if (inst.producesValue()) {
        sb.append('%').append(i).append(" = ");
      }
      sb.append(inst).append("  # ").append(inst.positions()).append('\n');
    }
    return sb.toString();
  }
}
