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

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.BitSet;
import java.util.Collection;
import java.util.List;
import org.pinpoint.code.ControlFlowGraph.BasicBlock;
import org.pinpoint.code.SlotTable.Access;

/**
 * Computes which instructions of a {@link CodeUnit} must execute in order to run the instructions
 * on a given set of source lines.
 *
 * <p>Starting from the instructions on the selected lines, the selection is grown by a set of
 * monotone rules until none of them adds anything:
 *
 * <ul>
 *   <li>the producers of every operand of a selected instruction are selected;
 *   <li>every instruction that uses the value of a selected instruction is selected;
 *   <li>if any read of a slot is selected, the writes of that slot that can reach a selected read
 *       are selected, as are all earlier reads up to the last selected one;
 *   <li>the definition of any struct type named by a selected instruction is selected;
 *   <li>the conditional branches that decide whether a selected instruction executes are
 *       selected; and
 *   <li>the innermost group or assertion Begin enclosing a selected instruction is selected, so
 *       that an error it raises is caught by the same handler as in an unsliced run (the matching
 *       End then follows as a use of the Begin).
 * </ul>
 *
 * Finally the unconditional branches needed to keep the selected control flow intact (loop back
 * edges, jumps over unselected else arms) are added.
 *
 * <p>Instructions that cannot be reached from the start of the unit are never selected.
 */
public final class DependencyClosure {
  private final StatementGraph graph;
  private final SelectionVector selection;

  /** The number of passes made by the last call to {@link #expand}. */
  private int passes;

  public DependencyClosure(StatementGraph graph) {
    this.graph = graph;
    this.selection = new SelectionVector(graph.size());
  }

  /**
   * Returns the selection needed to run the instructions of {@code graph} whose position is on one
   * of {@code lines} of {@code file}.
   */
  public static SelectionVector compute(
      StatementGraph graph, Path file, Collection<Integer> lines) {
    DependencyClosure closure = new DependencyClosure(graph);
    closure.seed(file, lines);
    closure.expand();
    closure.addActiveGotos();
    return closure.selection;
  }

  public SelectionVector selection() {
    return selection;
  }

  /** The number of passes made by the last call to {@link #expand}, including the final one. */
  public int passes() {
    return passes;
  }

  private boolean mark(int index) {
    return graph.cfg.isReachable(index) && selection.mark(index);
  }

  /** Selects every instruction with a position on one of {@code lines} of {@code file}. */
  public void seed(Path file, Collection<Integer> lines) {
    for (int i = 0; i < graph.size(); i++) {
      for (SourcePos pos : graph.unit.get(i).positions()) {
        if (pos.file().equals(file) && lines.contains(pos.line())) {
          mark(i);
        }
      }
    }
  }

  /** Selects a single instruction, without applying any of the expansion rules. */
  void seedInstruction(int index) {
    mark(index);
  }

  /** Applies the expansion rules until none of them changes the selection. */
  public void expand() {
    passes = 0;
    boolean changed = true;
    while (changed) {
      passes++;
      changed = addDataPreds();
      changed |= addDataUses();
      changed |= addSlotDeps();
      changed |= addTypeDefinitions();
      changed |= addControlFlow();
      changed |= addEnclosingHandlers();
    }
  }

  private boolean addDataPreds() {
    boolean changed = false;
    // Iterating backwards lets a chain of predecessors be selected in a single pass.
    for (int i = graph.size() - 1; i >= 0; i--) {
      if (selection.get(i)) {
        for (int pred : graph.defUse.preds(i)) {
          changed |= mark(pred);
        }
      }
    }
    return changed;
  }

  private boolean addDataUses() {
    boolean changed = false;
    for (int i = 0; i < graph.size(); i++) {
      if (selection.get(i)) {
        for (int use : graph.defUse.uses(i)) {
          changed |= mark(use);
        }
      }
    }
    return changed;
  }

  private boolean addSlotDeps() {
    boolean changed = false;
    for (int slot = 0; slot < graph.slots.numSlots(); slot++) {
      List<Access> accesses = graph.slots.accesses(slot);
      int lastRead = -1;
      for (Access access : accesses) {
        if (!access.isWrite() && selection.get(access.instruction())) {
          lastRead = access.instruction();
        }
      }
      if (lastRead < 0) {
        continue;
      }
      for (Access access : accesses) {
        int inst = access.instruction();
        if (selection.get(inst)) {
          continue;
        }
        if (inst < lastRead) {
          changed |= mark(inst);
        } else if (access.isWrite() && reachesSelectedRead(inst, accesses)) {
          // A write after the last selected read can only matter if a loop carries it back.
          changed |= mark(inst);
        }
      }
    }
    return changed;
  }

  private boolean reachesSelectedRead(int write, List<Access> accesses) {
    for (Access access : accesses) {
      if (!access.isWrite()
          && selection.get(access.instruction())
          && graph.cfg.canReach(write, access.instruction())) {
        return true;
      }
    }
    return false;
  }

  private boolean addTypeDefinitions() {
    if (graph.typeDefinitions.isEmpty()) {
      return false;
    }
    boolean changed = false;
    for (int i = 0; i < graph.size(); i++) {
      if (selection.get(i)) {
        for (Operand operand : graph.unit.get(i).operands()) {
          if (operand instanceof Operand.Global global) {
            for (int def : graph.typeDefinitions.definitionOf(global.name())) {
              changed |= mark(def);
            }
          }
        }
      }
    }
    return changed;
  }

  private boolean addControlFlow() {
    boolean changed = false;
    for (int i = 0; i < graph.size(); i++) {
      if (selection.get(i)) {
        for (int branch : graph.controllingBranches(graph.cfg.blockOf(i))) {
          changed |= mark(branch);
        }
      }
    }
    return changed;
  }

  private boolean addEnclosingHandlers() {
    boolean changed = false;
    // Begins precede the instructions they enclose, so iterating backwards selects a chain of
    // nested Begins in a single pass.
    for (int i = graph.size() - 1; i >= 0; i--) {
      if (selection.get(i)) {
        int begin = graph.enclosingHandler(i);
        if (begin >= 0) {
          changed |= mark(begin);
        }
      }
    }
    return changed;
  }

  /**
   * Selects the unconditional branches at the end of every block that can execute given the
   * current selection. Unselected conditional branches and handler Begins fall through when
   * executed, so only their fall-through successor is followed.
   *
   * <p>A backward branch is only selected if some instruction between its target and itself is
   * selected; otherwise the loop it closes has no selected exit test, and taking it would never
   * terminate.
   */
  public void addActiveGotos() {
    ControlFlowGraph cfg = graph.cfg;
    BitSet live = new BitSet(cfg.numBlocks());
    BitSet active = new BitSet(graph.size());
    ArrayDeque<BasicBlock> pending = new ArrayDeque<>();
    live.set(0);
    pending.add(cfg.block(0));
    while (!pending.isEmpty()) {
      BasicBlock block = pending.remove();
      int lastIndex = block.last();
      Instruction last = graph.unit.get(lastIndex);
      boolean taken;
      if (last instanceof Instruction.Goto) {
        taken = isActiveGoto(lastIndex);
        if (taken) {
          active.set(lastIndex);
        }
      } else {
        taken = selection.get(lastIndex);
      }
      List<BasicBlock> next = block.succs();
      if (!taken && last instanceof Instruction.Goto && block.end < graph.size()) {
        // An unselected Goto is stepped over like any other instruction.
        next = List.of(cfg.blockOf(block.end));
      }
      for (BasicBlock succ : next) {
        boolean followed = taken || last.branchTarget() < 0 || succ.start == block.end;
        if (followed && !live.get(succ.index)) {
          live.set(succ.index);
          pending.add(succ);
        }
      }
    }
    for (int i = active.nextSetBit(0); i >= 0; i = active.nextSetBit(i + 1)) {
      mark(i);
    }
  }

  private boolean isActiveGoto(int index) {
    int target = graph.unit.get(index).branchTarget();
    if (target > index) {
      return true;
    }
    int selected = selection.nextSetBit(target);
    return selected >= 0 && selected < index;
  }
}
