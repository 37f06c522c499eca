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

package org.pinpoint.compiler;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.function.Consumer;

/**
 * An immutable node of the syntax tree built from a source file (or from the text of a structural
 * pattern). Each node has a kind, an optional text payload (a name, operator, literal value or
 * assertion keyword), its children, and the span of source it was parsed from.
 *
 * <p>Nodes compare by identity; use {@link #equivalent} to compare shapes without regard to where
 * they came from.
 */
public final class Node {

  /** The kinds of syntax node. The comment on each kind describes its text and children. */
  public enum Kind {
    /** children: top-level statements */
    UNIT,
    /** children: statements */
    BLOCK,
    /** text: namespace name; children: [BLOCK] */
    NAMESPACE,
    /** text: function name; children: [PARAMS, BLOCK] */
    FUNCTION,
    /** text: struct name; children: [PARAMS] */
    STRUCT,
    /** text: constant name; children: [value] */
    CONST,
    /** text: group name; children: [BLOCK] */
    TESTGROUP,
    /** text: assertion keyword; children: [expression] */
    ASSERT,
    /** children: [condition, BLOCK] or [condition, BLOCK, BLOCK or IF] */
    IF,
    /** children: [condition, BLOCK] */
    WHILE,
    /** text: loop variable; children: [iterable, BLOCK] */
    FOR,
    /** children: [] or [value] */
    RETURN,
    BREAK,
    CONTINUE,
    /** text: variable name; children: [value] */
    ASSIGN,
    /** text: variable name; children: [index..., value] */
    INDEX_ASSIGN,
    /** children: [callee, arg...] */
    CALL,
    /** children: [target, index...] */
    INDEX,
    /** text: field name; children: [target] */
    FIELD,
    /** text: operator; children: [operand] */
    UNARY,
    /** text: operator; children: [left, right] */
    BINARY,
    /** children: [left, right] */
    AND,
    /** children: [left, right] */
    OR,
    /** text: the literal as written */
    NUMBER,
    /** text: the unescaped value */
    STRING,
    /** text: "true" or "false" */
    BOOL,
    NOTHING,
    /** text: the name */
    NAME,
    /** children: elements */
    ARRAY,
    /** children: NAME per parameter */
    PARAMS
  }

  public final Kind kind;
  public final String text;
  public final ImmutableList<Node> children;

  /** First and last (1-based) source lines covered by this node. */
  public final int firstLine;

  public final int lastLine;

  /** Character offsets of the first and last characters of this node in the source text. */
  public final int startIndex;

  public final int stopIndex;

  public Node(
      Kind kind,
      String text,
      ImmutableList<Node> children,
      int firstLine,
      int lastLine,
      int startIndex,
      int stopIndex) {
    checkArgument(firstLine <= lastLine, "bad span %s..%s", firstLine, lastLine);
    this.kind = kind;
    this.text = text;
    this.children = children;
    this.firstLine = firstLine;
    this.lastLine = lastLine;
    this.startIndex = startIndex;
    this.stopIndex = stopIndex;
  }

  public Node child(int i) {
    return children.get(i);
  }

  public int numChildren() {
    return children.size();
  }

  /** True if {@code line} is within this node's span. */
  public boolean coversLine(int line) {
    return line >= firstLine && line <= lastLine;
  }

  /** True if this node is a test group or an assertion. */
  public boolean isTestDeclaration() {
    return kind == Kind.TESTGROUP || kind == Kind.ASSERT;
  }

  /** Calls {@code visitor} with this node and each of its descendants, in pre-order. */
  public void forEachPreOrder(Consumer<Node> visitor) {
    visitor.accept(this);
    for (Node child : children) {
      child.forEachPreOrder(visitor);
    }
  }

  /** True if {@code other} has the same kind, text and (recursively) children as this node. */
  public boolean equivalent(Node other) {
    if (kind != other.kind
        || !text.equals(other.text)
        || children.size() != other.children.size()) {
      return false;
    }
    for (int i = 0; i < children.size(); i++) {
      if (!children.get(i).equivalent(other.children.get(i))) {
        return false;
      }
    }
    return true;
  }

  /** Returns a Lisp-style rendering of this node, e.g. {@code (CALL (NAME f) (NUMBER 1))}. */
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    appendTo(sb);
    return sb.toString();
  }

  private void appendTo(StringBuilder sb) {
    sb.append('(').append(kind);
    if (!text.isEmpty()) {
      sb.append(' ').append(kind == Kind.STRING ? '"' + text + '"' : text);
    }
    for (Node child : children) {
      sb.append(' ');
      child.appendTo(sb);
    }
    sb.append(')');
  }
}
