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
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.pinpoint.code.ControlFlowGraph.BasicBlock;

/**
 * Everything the dependency closure needs to know about one {@link CodeUnit}: its control-flow
 * graph, post-dominator tree, def-use graph, slot table and type definitions, plus the conditional
 * branches that each block is control dependent on and the handler region enclosing each
 * instruction.
 *
 * <p>A StatementGraph is built once per unit and never shared between units.
 */
public final class StatementGraph {
  public final CodeUnit unit;
  public final ControlFlowGraph cfg;
  public final PostDominatorTree postDominators;
  public final DefUseGraph defUse;
  public final SlotTable slots;
  public final TypeDefinitions typeDefinitions;

  /** For each block, the indices of the GotoIfNot instructions it is control dependent on. */
  private final ImmutableList<ImmutableList<Integer>> controllingBranches;

  /**
   * For each instruction, the index of the innermost HandlerBegin whose region (up to and including
   * its End) contains it, or -1.
   */
  private final int[] enclosingHandlers;

  private StatementGraph(CodeUnit unit) {
    this.unit = unit;
    this.cfg = ControlFlowGraph.build(unit);
    this.postDominators = PostDominatorTree.build(cfg);
    this.defUse = DefUseGraph.build(unit);
    this.slots = SlotTable.build(unit, cfg);
    this.typeDefinitions = TypeDefinitions.build(unit, defUse);
    this.controllingBranches = computeControllingBranches(cfg, postDominators);
    this.enclosingHandlers = computeEnclosingHandlers(unit);
  }

  public static StatementGraph build(CodeUnit unit) {
    return new StatementGraph(unit);
  }

  private static ImmutableList<ImmutableList<Integer>> computeControllingBranches(
      ControlFlowGraph cfg, PostDominatorTree pdt) {
    List<ImmutableList.Builder<Integer>> builders = new ArrayList<>(cfg.numBlocks());
    for (int b = 0; b < cfg.numBlocks(); b++) {
      builders.add(ImmutableList.builder());
    }
    for (BasicBlock block : cfg.blocks()) {
      // Only conditional branches decide whether a block executes; the second successor of a
      // handler Begin is only taken when an error is thrown.
      if (cfg.unit().get(block.last()) instanceof Instruction.GotoIfNot) {
        for (int dependent : pdt.controlDependents(block)) {
          builders.get(dependent).add(block.last());
        }
      }
    }
    ImmutableList.Builder<ImmutableList<Integer>> result = ImmutableList.builder();
    for (ImmutableList.Builder<Integer> builder : builders) {
      result.add(builder.build());
    }
    return result.build();
  }

  private static int[] computeEnclosingHandlers(CodeUnit unit) {
    int[] result = new int[unit.size()];
    // Handler regions are properly nested, so the open regions form a stack.
    Deque<Integer> open = new ArrayDeque<>();
    for (int i = 0; i < unit.size(); i++) {
      while (!open.isEmpty() && unit.get(open.peek()).branchTarget() < i) {
        open.pop();
      }
      result[i] = open.isEmpty() ? -1 : open.peek();
      if (unit.get(i) instanceof Instruction.HandlerBegin) {
        open.push(i);
      }
    }
    return result;
  }

  /** The GotoIfNot instructions that decide whether the given block executes. */
  public ImmutableList<Integer> controllingBranches(BasicBlock block) {
    return controllingBranches.get(block.index);
  }

  /**
   * Returns the index of the innermost group or assertion Begin whose region contains instruction
   * {@code index}, or -1 if it is not inside one. An End is inside the region of its own Begin.
   */
  public int enclosingHandler(int index) {
    return enclosingHandlers[index];
  }

  public int size() {
    return unit.size();
  }
}
