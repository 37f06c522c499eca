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
import java.util.ArrayList;
import java.util.List;

/**
 * For each slot of a {@link CodeUnit}, the instructions that read or write it, in instruction
 * order. An instruction that both reads and writes a slot (e.g. {@code _1 = _1}) appears twice,
 * read first.
 */
public final class SlotTable {

  /** One read or write of a slot. */
  public record Access(int instruction, boolean isWrite, int block) {}

  private final ImmutableList<ImmutableList<Access>> accesses;

  private SlotTable(ImmutableList<ImmutableList<Access>> accesses) {
    this.accesses = accesses;
  }

  public static SlotTable build(CodeUnit unit, ControlFlowGraph cfg) {
    List<List<Access>> accesses = new ArrayList<>();
    for (int s = 0; s < unit.numSlots(); s++) {
      accesses.add(new ArrayList<>());
    }
    for (int i = 0; i < unit.size(); i++) {
      Instruction inst = unit.get(i);
      int block = cfg.blockOf(i).index;
      for (Operand operand : inst.operands()) {
        if (operand instanceof Operand.Slot slot) {
          List<Access> list = accesses.get(slot.index());
          // Two operands referring to the same slot are a single read.
          if (list.isEmpty() || list.get(list.size() - 1).instruction() != i) {
            list.add(new Access(i, false, block));
          }
        }
      }
      if (inst.writtenSlot() >= 0) {
        accesses.get(inst.writtenSlot()).add(new Access(i, true, block));
      }
    }
    return new SlotTable(
        accesses.stream().map(ImmutableList::copyOf).collect(ImmutableList.toImmutableList()));
  }

  public int numSlots() {
    return accesses.size();
  }

  /** All reads and writes of the given slot, in instruction order. */
  public ImmutableList<Access> accesses(int slot) {
    return accesses.get(slot);
  }
}
