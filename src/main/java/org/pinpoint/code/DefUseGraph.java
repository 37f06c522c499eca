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
 * Def-use edges between the instructions of a {@link CodeUnit}: instruction {@code i} is a
 * predecessor of instruction {@code j} if {@code j} has an {@link Operand.Ssa} operand referring to
 * {@code i}, and {@code j} is then a use of {@code i}.
 */
public final class DefUseGraph {
  private final ImmutableList<ImmutableList<Integer>> preds;
  private final ImmutableList<ImmutableList<Integer>> uses;

  private DefUseGraph(
      ImmutableList<ImmutableList<Integer>> preds, ImmutableList<ImmutableList<Integer>> uses) {
    this.preds = preds;
    this.uses = uses;
  }

  public static DefUseGraph build(CodeUnit unit) {
    int size = unit.size();
    List<List<Integer>> uses = new ArrayList<>(size);
    for (int i = 0; i < size; i++) {
      uses.add(new ArrayList<>());
    }
    ImmutableList.Builder<ImmutableList<Integer>> preds = ImmutableList.builder();
    for (int i = 0; i < size; i++) {
      ImmutableList.Builder<Integer> instPreds = ImmutableList.builder();
      for (Operand operand : unit.get(i).operands()) {
        if (operand instanceof Operand.Ssa ssa) {
          instPreds.add(ssa.index());
          uses.get(ssa.index()).add(i);
        }
      }
      preds.add(instPreds.build());
    }
    return new DefUseGraph(
        preds.build(),
        uses.stream().map(ImmutableList::copyOf).collect(ImmutableList.toImmutableList()));
  }

  /** The instructions whose values are operands of instruction {@code i}. */
  public ImmutableList<Integer> preds(int i) {
    return preds.get(i);
  }

  /** The instructions that have the value of instruction {@code i} as an operand. */
  public ImmutableList<Integer> uses(int i) {
    return uses.get(i);
  }
}
