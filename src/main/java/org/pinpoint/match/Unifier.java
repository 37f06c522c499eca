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

import com.google.common.collect.ImmutableList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.pinpoint.compiler.Node;

/**
 * Unifies a structural template with a syntax tree. A Unifier is used for a single attempt: the
 * variable bindings it accumulates are only meaningful for one {@link #unify} call.
 */
final class Unifier {

  private final Map<String, Node> bindings = new HashMap<>();
  private final Map<String, ImmutableList<Node>> splats = new HashMap<>();

  /** True if {@code template} unifies with {@code node}. */
  static boolean matches(Node template, Node node) {
    return new Unifier().unify(template, node);
  }

  /** True if {@code name} is a variable that matches any single subtree. */
  static boolean isCapture(String name) {
    return name.length() > 1 && name.endsWith("_") && !isSplat(name);
  }

  /** True if {@code name} is a variable that matches any number of subtrees. */
  static boolean isSplat(String name) {
    return name.length() > 2 && name.endsWith("__");
  }

  private boolean unify(Node template, Node node) {
    if (template.kind == Node.Kind.NAME && isCapture(template.text)) {
      Node bound = bindings.putIfAbsent(template.text, node);
      return bound == null || bound.equivalent(node);
    }
    return template.kind == node.kind
        && template.text.equals(node.text)
        && unifyChildren(template.children, node.children);
  }

  private boolean unifyChildren(List<Node> templates, List<Node> nodes) {
    int splat = splatIndex(templates);
    if (splat < 0) {
      return templates.size() == nodes.size() && unifyEach(templates, 0, nodes, 0, nodes.size());
    }
    int suffix = templates.size() - splat - 1;
    if (nodes.size() < splat + suffix) {
      return false;
    }
    int splatEnd = nodes.size() - suffix;
    if (!unifyEach(templates, 0, nodes, 0, splat)
        || !unifyEach(templates, splat + 1, nodes, splatEnd, suffix)) {
      return false;
    }
    ImmutableList<Node> matched = ImmutableList.copyOf(nodes.subList(splat, splatEnd));
    ImmutableList<Node> bound = splats.putIfAbsent(templates.get(splat).text, matched);
    return bound == null || equivalent(bound, matched);
  }

  /** Unifies {@code count} templates from {@code tStart} with nodes from {@code nStart}. */
  private boolean unifyEach(
      List<Node> templates, int tStart, List<Node> nodes, int nStart, int count) {
    for (int i = 0; i < count; i++) {
      if (!unify(templates.get(tStart + i), nodes.get(nStart + i))) {
        return false;
      }
    }
    return true;
  }

  /** Returns the index of the first splat variable in {@code templates}, or -1. */
  private static int splatIndex(List<Node> templates) {
    for (int i = 0; i < templates.size(); i++) {
      Node t = templates.get(i);
      if (t.kind == Node.Kind.NAME && isSplat(t.text)) {
        return i;
      }
    }
    return -1;
  }

  private static boolean equivalent(List<Node> a, List<Node> b) {
    if (a.size() != b.size()) {
      return false;
    }
    for (int i = 0; i < a.size(); i++) {
      if (!a.get(i).equivalent(b.get(i))) {
        return false;
      }
    }
    return true;
  }
}
