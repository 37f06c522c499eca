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
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/** Accumulates instructions, slots and labels for a single {@link CodeUnit}. */
public final class CodeBuilder {
  private final Path file;
  private final List<Instruction> code = new ArrayList<>();
  private final List<String> slotNames = new ArrayList<>();
  private final List<Label> labels = new ArrayList<>();
  private ImmutableList<SourcePos> positions = ImmutableList.of();

  public CodeBuilder(Path file) {
    this.file = file;
  }

  public Path file() {
    return file;
  }

  /** Allocates a new slot; {@code name} is used only for listings. */
  public int newSlot(String name) {
    slotNames.add(name);
    return slotNames.size() - 1;
  }

  /**
   * Sets the source lines that will be attached to subsequently emitted instructions. Duplicate
   * lines are dropped; the first line given is the primary one.
   */
  public void setLines(int... lines) {
    ImmutableList.Builder<SourcePos> builder = ImmutableList.builder();
    for (int i = 0; i < lines.length; i++) {
      boolean duplicate = false;
      for (int j = 0; j < i; j++) {
        duplicate |= (lines[j] == lines[i]);
      }
      if (!duplicate) {
        builder.add(new SourcePos(file, lines[i]));
      }
    }
    positions = builder.build();
  }

  /** Returns the lines most recently passed to {@link #setLines}. */
  public int[] lines() {
    return positions.stream().mapToInt(SourcePos::line).toArray();
  }

  /** Appends an instruction; returns an operand referring to its value. */
  @CanIgnoreReturnValue
  public Operand.Ssa emit(Instruction inst) {
    inst.setPositions(positions);
    code.add(inst);
    return new Operand.Ssa(code.size() - 1);
  }

  /** The index that the next emitted instruction will have. */
  public int nextIndex() {
    return code.size();
  }

  public Label newLabel() {
    Label label = new Label();
    labels.add(label);
    return label;
  }

  /** Binds {@code label} to the next instruction to be emitted. */
  public void placeLabel(Label label) {
    label.place(code.size());
  }

  /**
   * Returns the completed CodeUnit. The last instruction must not fall through, and every label
   * must have been placed at an existing instruction.
   */
  public CodeUnit build(
      String name, int numParams, ImmutableList<Integer> captureSlots, int selfSlot) {
    Preconditions.checkState(
        !code.isEmpty() && !code.get(code.size() - 1).fallsThrough(), "Unit must end in a return");
    for (Label label : labels) {
      Preconditions.checkState(label.isPlaced() && label.index() < code.size(), "Bad label");
    }
    return new CodeUnit(
        name,
        file,
        ImmutableList.copyOf(code),
        ImmutableList.copyOf(slotNames),
        numParams,
        captureSlots,
        selfSlot);
  }
}
