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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.pinpoint.code.ControlFlowGraph.BasicBlock;

/**
 * The post-dominator tree of a {@link ControlFlowGraph}: block B post-dominates block A if every
 * path from A to the exit passes through B.
 *
 * <p>Computed with the Cooper, Harvey and Kennedy iterative dominator algorithm applied to the
 * reversed graph, rooted at a virtual exit node that succeeds every block with no successors.
 * Blocks that cannot reach the exit (e.g. the body of a loop that never terminates) are treated
 * as immediately post-dominated by the exit.
 */
public final class PostDominatorTree {
  private final ControlFlowGraph cfg;

  /** The index used for the virtual exit node. */
  public final int exit;

  /** The immediate post-dominator of each block; {@code ipdom[exit] == exit}. */
  private final int[] ipdom;

  private PostDominatorTree(ControlFlowGraph cfg, int[] ipdom) {
    this.cfg = cfg;
    this.exit = cfg.numBlocks();
    this.ipdom = ipdom;
  }

  /** Computes the post-dominator tree of {@code cfg}. */
  public static PostDominatorTree build(ControlFlowGraph cfg) {
    int n = cfg.numBlocks();
    int exit = n;
    // Postorder numbering of the reversed graph, by depth-first search from the exit.
    int[] postorder = new int[n + 1];
    Arrays.fill(postorder, -1);
    List<Integer> order = new ArrayList<>();
    boolean[] visited = new boolean[n + 1];
    dfs(cfg, exit, visited, order);
    for (int i = 0; i < order.size(); i++) {
      postorder[order.get(i)] = i;
    }
    int[] ipdom = new int[n + 1];
    Arrays.fill(ipdom, -1);
    ipdom[exit] = exit;
    boolean changed = true;
    while (changed) {
      changed = false;
      // Reverse postorder, skipping the root.
      for (int i = order.size() - 2; i >= 0; i--) {
        int b = order.get(i);
        int newIpdom = -1;
        for (int p : reversePreds(cfg, b)) {
          if (ipdom[p] < 0) {
            continue;
          }
          newIpdom = (newIpdom < 0) ? p : intersect(p, newIpdom, ipdom, postorder);
        }
        if (newIpdom >= 0 && ipdom[b] != newIpdom) {
          ipdom[b] = newIpdom;
          changed = true;
        }
      }
    }
    for (int b = 0; b < n; b++) {
      if (ipdom[b] < 0) {
        ipdom[b] = exit;
      }
    }
    return new PostDominatorTree(cfg, ipdom);
  }

  /**
   * The predecessors of node {@code b} in the reversed graph, i.e. its successors in the original
   * graph (or the virtual exit, for exit blocks).
   */
  private static int[] reversePreds(ControlFlowGraph cfg, int b) {
    BasicBlock block = cfg.block(b);
    if (block.isExit()) {
      return new int[] {cfg.numBlocks()};
    }
    return block.succs().stream().mapToInt(s -> s.index).toArray();
  }

  /** The successors of node {@code b} in the reversed graph. */
  private static List<Integer> reverseSuccs(ControlFlowGraph cfg, int b) {
    List<Integer> result = new ArrayList<>();
    if (b == cfg.numBlocks()) {
      for (BasicBlock block : cfg.blocks()) {
        if (block.isExit()) {
          result.add(block.index);
        }
      }
    } else {
      cfg.block(b).preds().forEach(p -> result.add(p.index));
    }
    return result;
  }

  private static void dfs(ControlFlowGraph cfg, int b, boolean[] visited, List<Integer> order) {
    visited[b] = true;
    for (int s : reverseSuccs(cfg, b)) {
      if (!visited[s]) {
        dfs(cfg, s, visited, order);
      }
    }
    order.add(b);
  }

  private static int intersect(int b1, int b2, int[] ipdom, int[] postorder) {
    while (b1 != b2) {
      while (postorder[b1] < postorder[b2]) {
        b1 = ipdom[b1];
      }
      while (postorder[b2] < postorder[b1]) {
        b2 = ipdom[b2];
      }
    }
    return b1;
  }

  public ControlFlowGraph cfg() {
    return cfg;
  }

  /** Returns the immediate post-dominator of the given block, possibly {@link #exit}. */
  public int ipdom(int block) {
    return ipdom[block];
  }

  /** True if block {@code a} post-dominates block {@code b}. Every block post-dominates itself. */
  public boolean postDominates(int a, int b) {
    for (int x = b; ; x = ipdom[x]) {
      if (x == a) {
        return true;
      } else if (x == exit) {
        return a == exit;
      }
    }
  }

  /**
   * Returns the blocks that are control dependent on the branch at the end of {@code branch}: those
   * that post-dominate one of its successors but do not strictly post-dominate it.
   */
  public List<Integer> controlDependents(BasicBlock branch) {
    List<Integer> result = new ArrayList<>();
    int stop = ipdom[branch.index];
    for (BasicBlock succ : branch.succs()) {
      for (int x = succ.index; x != stop && x != exit; x = ipdom[x]) {
        if (!result.contains(x)) {
          result.add(x);
        }
      }
    }
    return result;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    for (int b = 0; b < exit; b++) {
      sb.append('B').append(b).append(" <- ");
      sb.append(ipdom[b] == exit ? "exit" : "B" + ipdom[b]).append('\n');
    }
    return sb.toString();
  }
}
