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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import java.nio.file.Path;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.pinpoint.compiler.Compiler;
import org.pinpoint.compiler.Lowering;
import org.pinpoint.compiler.SourceFile;

@RunWith(JUnit4.class)
public class DependencyClosureTest {

  private static final Path FILE = Path.of("closure.pp").toAbsolutePath();

  private static final String SLOTS =
      String.join(
          "\n",
          "testgroup \"g\" {",
          "  y = 5",
          "  x = 1",
          "  a = x + 1",
          "  b = x + 2",
          "}");

  private static final String BRANCHES =
      String.join(
          "\n",
          "testgroup \"g\" {",
          "  c = f()",
          "  if c {",
          "    y = 1",
          "  } else {",
          "    y = 2",
          "  }",
          "  z = 3",
          "}");

  private static final String UNREACHABLE =
      String.join(
          "\n",
          "testgroup \"g\" {",
          "  x = 0",
          "  while true {",
          "    x = x + 1",
          "    break",
          "    x = 100",
          "  }",
          "  assert x == 1",
          "}");

  private static final String LOOP =
      String.join(
          "\n",
          "testgroup \"g\" {",
          "  n = 0",
          "  while n < 3 {",
          "    n = n + 1",
          "  }",
          "  assert true",
          "}");

  private static final String TYPES =
      String.join(
          "\n", "testgroup \"g\" {", "  struct P(a)", "  q = 1", "  p = P(1)", "}");

  private static StatementGraph graph(String text) {
    SourceFile source = SourceFile.of(FILE, text);
    return StatementGraph.build(Lowering.lowerFragment(source, Compiler.parse(source).child(0)));
  }

  /** Returns the primary line of each selected instruction. */
  private static ImmutableSortedSet<Integer> selectedLines(
      StatementGraph graph, SelectionVector selection) {
    ImmutableSortedSet.Builder<Integer> lines = ImmutableSortedSet.naturalOrder();
    for (int i = 0; i < selection.size(); i++) {
      if (selection.get(i)) {
        lines.add(graph.unit.get(i).line());
      }
    }
    return lines.build();
  }

  private static ImmutableSortedSet<Integer> select(String text, Integer... lines) {
    StatementGraph graph = graph(text);
    return selectedLines(graph, DependencyClosure.compute(graph, FILE, List.of(lines)));
  }

  @Test
  public void slotWritesAndEarlierReadsAreSelected() {
    // The unrelated "y = 5" is left out; lines 1 and 6 are the group's Begin and End.
    assertThat(select(SLOTS, 5)).containsExactly(1, 3, 4, 5, 6).inOrder();
    assertThat(select(SLOTS, 3)).containsExactly(1, 3, 6).inOrder();
  }

  @Test
  public void linesInOtherFilesAreIgnored() {
    StatementGraph graph = graph(SLOTS);
    SelectionVector selection =
        DependencyClosure.compute(graph, Path.of("other.pp").toAbsolutePath(), List.of(5));
    assertThat(selection.count()).isEqualTo(0);
  }

  @Test
  public void controllingBranchIsSelected() {
    StatementGraph graph = graph(BRANCHES);
    SelectionVector selection = DependencyClosure.compute(graph, FILE, List.of(4));
    assertThat(selectedLines(graph, selection)).containsExactly(1, 2, 3, 4, 9).inOrder();
    // The jump over the else arm is needed to skip it when the condition is true.
    for (int i = 0; i < graph.size(); i++) {
      if (graph.unit.get(i) instanceof Instruction.Goto) {
        assertThat(selection.get(i)).isTrue();
      }
    }
  }

  @Test
  public void typeDefinitionIsSelected() {
    assertThat(select(TYPES, 4)).containsExactly(1, 2, 4, 5).inOrder();
  }

  @Test
  public void unreachableInstructionsAreNeverSelected() {
    ImmutableSortedSet<Integer> lines = select(UNREACHABLE, 8);
    assertThat(lines).containsAtLeast(2, 3, 4, 5, 8);
    assertThat(lines).doesNotContain(6);
  }

  @Test
  public void loopWithoutSelectedInstructionsIsNotEntered() {
    assertThat(select(LOOP, 6)).containsExactly(1, 6, 7).inOrder();
  }

  @Test
  public void loopWithSelectedBodyKeepsItsBackEdge() {
    StatementGraph graph = graph(LOOP);
    SelectionVector selection = DependencyClosure.compute(graph, FILE, List.of(4));
    assertThat(selectedLines(graph, selection)).containsExactly(1, 2, 3, 4, 7).inOrder();
    int backEdges = 0;
    for (int i = 0; i < graph.size(); i++) {
      Instruction inst = graph.unit.get(i);
      if (inst instanceof Instruction.Goto && inst.branchTarget() < i) {
        assertThat(selection.get(i)).isTrue();
        backEdges++;
      }
    }
    assertThat(backEdges).isEqualTo(1);
  }

  @Test
  public void valuesFlowToTheirUses() {
    StatementGraph graph = graph(BRANCHES);
    DependencyClosure closure = new DependencyClosure(graph);
    // Instruction 1 is the call of f, whose value is assigned to c.
    closure.seedInstruction(1);
    closure.expand();
    ImmutableList.Builder<Integer> selected = ImmutableList.builder();
    for (int i = 0; i < graph.size(); i++) {
      if (closure.selection().get(i)) {
        selected.add(i);
      }
    }
    // Instruction 0 is the group's Begin, which encloses both; its End uses its value.
    assertThat(selected.build()).containsExactly(0, 1, 2, groupEnd(graph)).inOrder();
  }

  private static int groupEnd(StatementGraph graph) {
    for (int i = 0; i < graph.size(); i++) {
      if (graph.unit.get(i) instanceof Instruction.GroupEnd) {
        return i;
      }
    }
    throw new AssertionError("No GroupEnd");
  }

  @Test
  public void enclosingHandlersAreSelected() {
    StatementGraph graph =
        graph(
            String.join(
                "\n",
                "testgroup \"outer\" {",
                "  testgroup \"inner\" {",
                "    x = div(1, 0)",
                "  }",
                "  assert true",
                "}"));
    SelectionVector selection = DependencyClosure.compute(graph, FILE, List.of(3));
    int begins = 0;
    int ends = 0;
    for (int i = 0; i < graph.size(); i++) {
      Instruction inst = graph.unit.get(i);
      if (inst instanceof Instruction.GroupBegin) {
        assertThat(selection.get(i)).isTrue();
        begins++;
      } else if (inst instanceof Instruction.GroupEnd) {
        assertThat(selection.get(i)).isTrue();
        ends++;
      } else if (inst instanceof Instruction.AssertBegin) {
        assertThat(selection.get(i)).isFalse();
      }
    }
    assertThat(begins).isEqualTo(2);
    assertThat(ends).isEqualTo(2);
    assertThat(selectedLines(graph, selection)).containsExactly(1, 2, 3, 4, 6).inOrder();
  }

  @Test
  public void enclosingHandlerOfEachInstruction() {
    StatementGraph graph = graph(SLOTS);
    assertThat(graph.unit.get(0)).isInstanceOf(Instruction.GroupBegin.class);
    assertThat(graph.enclosingHandler(0)).isEqualTo(-1);
    int end = groupEnd(graph);
    for (int i = 1; i <= end; i++) {
      assertThat(graph.enclosingHandler(i)).isEqualTo(0);
    }
    // The fragment's final Return follows the group.
    for (int i = end + 1; i < graph.size(); i++) {
      assertThat(graph.enclosingHandler(i)).isEqualTo(-1);
    }
  }

  @Test
  public void selectionGrowsWithTheSeed() {
    for (String text : List.of(SLOTS, BRANCHES, UNREACHABLE, LOOP, TYPES)) {
      StatementGraph graph = graph(text);
      int lastLine = text.split("\n").length;
      for (int line = 1; line <= lastLine; line++) {
        SelectionVector small = DependencyClosure.compute(graph, FILE, List.of(line));
        for (int other = 1; other <= lastLine; other++) {
          SelectionVector large = DependencyClosure.compute(graph, FILE, List.of(line, other));
          for (int i = 0; i < graph.size(); i++) {
            if (small.get(i)) {
              assertThat(large.get(i)).isTrue();
            }
          }
        }
      }
    }
  }

  @Test
  public void expansionConverges() {
    for (String text : List.of(SLOTS, BRANCHES, UNREACHABLE, LOOP, TYPES)) {
      StatementGraph graph = graph(text);
      DependencyClosure closure = new DependencyClosure(graph);
      closure.seed(FILE, List.of(1, 2, 3, 4, 5, 6, 7, 8, 9));
      closure.expand();
      assertThat(closure.passes()).isAtMost(graph.size() + 1);
      int count = closure.selection().count();
      closure.expand();
      assertThat(closure.selection().count()).isEqualTo(count);
      assertThat(closure.passes()).isEqualTo(1);
    }
  }
}
