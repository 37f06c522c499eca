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

package org.pinpoint.match;

import com.google.common.collect.DiscreteDomain;
import com.google.common.collect.ImmutableRangeSet;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Range;
import com.google.common.collect.RangeSet;
import com.google.common.collect.TreeRangeSet;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;
import org.jspecify.annotations.Nullable;
import org.pinpoint.compiler.Node;

/**
 * Resolves patterns to the set of source lines they select in a parsed file.
 *
 * <p>Line and line range patterns select their lines directly, except that a line inside a test
 * group selects the whole of the innermost group containing it. All other patterns are tested
 * against every node of the syntax tree, and each match selects the lines spanned by the matching
 * node.
 */
public final class SyntaxMatcher {

  private final Node root;

  /** The test groups of the file, in pre-order; a nested group follows its enclosing group. */
  private final List<Node> groups = new ArrayList<>();

  private final TreeSet<Integer> lines = new TreeSet<>();

  private SyntaxMatcher(Node root) {
    this.root = root;
    root.forEachPreOrder(
        node -> {
          if (node.kind == Node.Kind.TESTGROUP) {
            groups.add(node);
          }
        });
  }

  /**
   * Returns the lines of {@code root} selected by {@code patterns}.
   *
   * @param filter if non-null, a syntax match is only recorded if the matching node spans at least
   *     one of these lines; line patterns are not filtered
   */
  public static ImmutableSortedSet<Integer> matchedLines(
      Node root, List<Pattern> patterns, @Nullable RangeSet<Integer> filter) {
    SyntaxMatcher matcher = new SyntaxMatcher(root);
    List<Pattern> syntaxPatterns = new ArrayList<>();
    for (Pattern pattern : patterns) {
      if (pattern instanceof Pattern.Line line) {
        matcher.addLine(line.line());
      } else if (pattern instanceof Pattern.LineRange range) {
        // Lines past the end of the file select nothing.
        int last = Math.min(range.last(), root.lastLine);
        for (int i = range.first(); i <= last; i++) {
          matcher.addLine(i);
        }
      } else {
        syntaxPatterns.add(pattern);
      }
    }
    if (!syntaxPatterns.isEmpty()) {
      root.forEachPreOrder(
          node -> {
            for (Pattern pattern : syntaxPatterns) {
              if (matches(pattern, node)) {
                matcher.addSpan(node, filter);
              }
            }
          });
    }
    return ImmutableSortedSet.copyOf(matcher.lines);
  }

  /** True if {@code node} matches {@code pattern}, which must not be a line pattern. */
  static boolean matches(Pattern pattern, Node node) {
    if (pattern instanceof Pattern.Name name) {
      return node.kind == Node.Kind.TESTGROUP && node.text.equals(name.name());
    } else if (pattern instanceof Pattern.Regex regex) {
      return node.kind == Node.Kind.TESTGROUP && regex.regex().matcher(node.text).find();
    } else if (pattern instanceof Pattern.Structural structural) {
      return Unifier.matches(structural.template(), node);
    }
    throw new IllegalArgumentException("Not a syntax pattern: " + pattern);
  }

  private void addLine(int line) {
    lines.add(line);
    if (line > root.lastLine) {
      return;
    }
    Node group = innermostGroup(line);
    if (group != null) {
      addSpan(group, null);
    }
  }

  private @Nullable Node innermostGroup(int line) {
    Node result = null;
    for (Node group : groups) {
      if (group.coversLine(line)) {
        result = group;
      }
    }
    return result;
  }

  private void addSpan(Node node, @Nullable RangeSet<Integer> filter) {
    if (filter != null && !filter.intersects(Range.closed(node.firstLine, node.lastLine))) {
      return;
    }
    for (int i = node.firstLine; i <= node.lastLine; i++) {
      lines.add(i);
    }
  }

  /** Returns the set of line ranges covering exactly {@code lines}. */
  public static ImmutableRangeSet<Integer> rangesOf(Collection<Integer> lines) {
    RangeSet<Integer> ranges = TreeRangeSet.create();
    for (int line : lines) {
      ranges.add(Range.singleton(line).canonical(DiscreteDomain.integers()));
    }
    return ImmutableRangeSet.copyOf(ranges);
  }
}
