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
import java.util.BitSet;
import java.util.List;

/**
 * Partitions a {@link CodeUnit} into basic blocks connected by fall-through and branch edges.
 *
 * <p>A block starts at index 0, at every branch target, and after every instruction that branches,
 * returns, or begins an error handler. A handler Begin has two successors: the next instruction
 * and its End (where control lands if an error is thrown inside the handler).
 */
public final class ControlFlowGraph {

  /** A maximal run of instructions with a single entry and a single exit. */
  public static final class BasicBlock {
    public final int index;

    /** The first instruction of this block. */
    public final int start;

    /** One more than the last instruction of this block. */
    public final int end;

    final List<BasicBlock> succs = new ArrayList<>(2);
    final List<BasicBlock> preds = new ArrayList<>();

    BasicBlock(int index, int start, int end) {
      this.index = index;
      this.start = start;
      this.end = end;
    }

    /** The index of this block's last instruction. */
    public int last() {
      return end - 1;
    }

    public List<BasicBlock> succs() {
      return succs;
    }

    public List<BasicBlock> preds() {
      return preds;
    }

    /** True if control leaves the unit from this block. */
    public boolean isExit() {
      return succs.isEmpty();
    }

    @Override
    public String toString() {
      return String.format("B%s[%s..%s)", index, start, end);
    }
  }

  private final CodeUnit unit;
  private final ImmutableList<BasicBlock> blocks;

  /** Maps each instruction index to the index of the block containing it. */
  private final int[] blockOf;

  /** The blocks that can be reached from the entry block. */
  private final BitSet reachable;

  private ControlFlowGraph(CodeUnit unit, ImmutableList<BasicBlock> blocks, int[] blockOf) {
    this.unit = unit;
    this.blocks = blocks;
    this.blockOf = blockOf;
    this.reachable = forwardClosure(blocks.get(0));
  }

  /** Builds the control-flow graph of {@code unit}. */
  public static ControlFlowGraph build(CodeUnit unit) {
    int size = unit.size();
    BitSet leaders = new BitSet(size);
    leaders.set(0);
    for (int i = 0; i < size; i++) {
      Instruction inst = unit.get(i);
      int target = inst.branchTarget();
      if (target >= 0) {
        leaders.set(target);
      }
      if (target >= 0 || !inst.fallsThrough()) {
        leaders.set(i + 1);
      }
    }
    leaders.clear(size);
    ImmutableList.Builder<BasicBlock> builder = ImmutableList.builder();
    int[] blockOf = new int[size];
    int numBlocks = 0;
    for (int start = 0; start < size; ) {
      int end = leaders.nextSetBit(start + 1);
      if (end < 0) {
        end = size;
      }
      builder.add(new BasicBlock(numBlocks, start, end));
      for (int i = start; i < end; i++) {
        blockOf[i] = numBlocks;
      }
      numBlocks++;
      start = end;
    }
    ImmutableList<BasicBlock> blocks = builder.build();
    for (BasicBlock block : blocks) {
      Instruction last = unit.get(block.last());
      if (last.fallsThrough() && block.end < size) {
        addEdge(block, blocks.get(blockOf[block.end]));
      }
      int target = last.branchTarget();
      if (target >= 0) {
        addEdge(block, blocks.get(blockOf[target]));
      }
    }
    return new ControlFlowGraph(unit, blocks, blockOf);
  }

  private static void addEdge(BasicBlock from, BasicBlock to) {
    if (!from.succs.contains(to)) {
      from.succs.add(to);
      to.preds.add(from);
    }
  }

  public CodeUnit unit() {
    return unit;
  }

  public ImmutableList<BasicBlock> blocks() {
    return blocks;
  }

  public int numBlocks() {
    return blocks.size();
  }

  public BasicBlock block(int index) {
    return blocks.get(index);
  }

  /** Returns the block containing the given instruction. */
  public BasicBlock blockOf(int instruction) {
    return blocks.get(blockOf[instruction]);
  }

  /** True if the given instruction can be reached from the start of the unit. */
  public boolean isReachable(int instruction) {
    return reachable.get(blockOf[instruction]);
  }

  /**
   * True if execution can continue from instruction {@code from} to instruction {@code to}, i.e.
   * {@code to} follows {@code from} in the same block, or the block containing {@code to} can be
   * reached from a successor of the block containing {@code from}.
   */
  public boolean canReach(int from, int to) {
    BasicBlock fromBlock = blockOf(from);
    BasicBlock toBlock = blockOf(to);
    if (fromBlock == toBlock && from < to) {
      return true;
    }
    for (BasicBlock succ : fromBlock.succs) {
      if (forwardClosure(succ).get(toBlock.index)) {
        return true;
      }
    }
    return false;
  }

  /** Returns the indices of all blocks reachable from {@code start}, including itself. */
  private static BitSet forwardClosure(BasicBlock start) {
    BitSet seen = new BitSet();
    ArrayDeque<BasicBlock> pending = new ArrayDeque<>();
    seen.set(start.index);
    pending.add(start);
    while (!pending.isEmpty()) {
      for (BasicBlock succ : pending.remove().succs) {
        if (!seen.get(succ.index)) {
          seen.set(succ.index);
          pending.add(succ);
        }
      }
    }
    return seen;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    for (BasicBlock block : blocks) {
      sb.append(block).append(" ->");
      for (BasicBlock succ : block.succs) {
        sb.append(" B").append(succ.index);
      }
      sb.append('\n');
    }
    return sb.toString();
  }
}
