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

package org.pinpoint.impl;

import com.google.common.collect.ImmutableList;
import java.util.EnumMap;
import java.util.Map;

/**
 * The results of a test group: the outcomes of the assertions directly within it, and the results
 * of its nested groups. Immutable.
 */
public final class TestGroupResult {

  public final String name;
  public final ImmutableList<TestGroupResult> children;
  public final ImmutableList<TestOutcome> outcomes;

  private final Map<TestOutcome.Kind, Integer> counts = new EnumMap<>(TestOutcome.Kind.class);
  private final Map<TestOutcome.Kind, Integer> totals = new EnumMap<>(TestOutcome.Kind.class);

  public TestGroupResult(
      String name, ImmutableList<TestGroupResult> children, ImmutableList<TestOutcome> outcomes) {
    this.name = name;
    this.children = children;
    this.outcomes = outcomes;
    for (TestOutcome.Kind kind : TestOutcome.Kind.values()) {
      int count = (int) outcomes.stream().filter(o -> o.kind() == kind).count();
      counts.put(kind, count);
      totals.put(kind, count + children.stream().mapToInt(c -> c.total(kind)).sum());
    }
  }

  /** The number of outcomes of the given kind directly in this group. */
  public int count(TestOutcome.Kind kind) {
    return counts.get(kind);
  }

  /** The number of outcomes of the given kind in this group and all nested groups. */
  public int total(TestOutcome.Kind kind) {
    return totals.get(kind);
  }

  public int passed() {
    return count(TestOutcome.Kind.PASS);
  }

  public int failed() {
    return count(TestOutcome.Kind.FAIL);
  }

  public int errored() {
    return count(TestOutcome.Kind.ERROR);
  }

  public int broken() {
    return count(TestOutcome.Kind.BROKEN);
  }

  public int skipped() {
    return count(TestOutcome.Kind.SKIP);
  }

  /** True if any outcome in this group or a nested group is a failure or an error. */
  public boolean anyNonPass() {
    return total(TestOutcome.Kind.FAIL) + total(TestOutcome.Kind.ERROR) > 0;
  }

  /** Returns the nested group with the given name; throws if there is none. */
  public TestGroupResult child(String name) {
    return children.stream()
        .filter(c -> c.name.equals(name))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("No group named " + name));
  }

  /** Returns the diagnostics of every non-passing outcome, in this group and nested groups. */
  public ImmutableList<Diagnostic> diagnostics() {
    ImmutableList.Builder<Diagnostic> builder = ImmutableList.builder();
    addDiagnostics(builder);
    return builder.build();
  }

  private void addDiagnostics(ImmutableList.Builder<Diagnostic> builder) {
    for (TestOutcome outcome : outcomes) {
      if (outcome.diagnostic() != null) {
        builder.add(outcome.diagnostic());
      }
    }
    children.forEach(c -> c.addDiagnostics(builder));
  }

  /**
   * Returns a summary with one line per group, e.g. {@code basic: 2 passed, 1 failed}; nested
   * groups are indented and show their cumulative counts.
   */
  public String summary() {
    StringBuilder sb = new StringBuilder();
    appendSummary(sb, 0);
    return sb.toString();
  }

  private void appendSummary(StringBuilder sb, int indent) {
    sb.append("  ".repeat(indent)).append(name).append(':');
    boolean any = false;
    for (TestOutcome.Kind kind : TestOutcome.Kind.values()) {
      int n = total(kind);
      if (n != 0) {
        sb.append(any ? ", " : " ").append(n).append(' ').append(label(kind));
        any = true;
      }
    }
    if (!any) {
      sb.append(" no tests");
    }
    sb.append(System.lineSeparator());
    children.forEach(c -> c.appendSummary(sb, indent + 1));
  }

  private static String label(TestOutcome.Kind kind) {
    return switch (kind) {
      case PASS -> "passed";
      case FAIL -> "failed";
      case ERROR -> "errored";
      case BROKEN -> "broken";
      case SKIP -> "skipped";
    };
  }

  @Override
  public String toString() {
    return summary();
  }
}
