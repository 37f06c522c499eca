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

import com.google.common.base.Preconditions;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * A namespace: a set of bindings from names to values. Each context other than the builtin context
 * has a parent; names that are not bound in a context are looked up in its parent.
 *
 * <p>A namespace declared within a context is a child context, bound in its parent under its own
 * name. Assignments in a child context never affect the parent.
 */
public final class Context {

  private final String name;
  private final @Nullable Context parent;
  private final Map<String, Object> bindings = new LinkedHashMap<>();
  private final Set<String> constants = new HashSet<>();

  /** The children created by {@link #namespace}, which are reused if the namespace is reopened. */
  private final Map<String, Context> namespaces = new HashMap<>();

  /** True for the builtin context, which may not be modified once it is initialized. */
  private boolean frozen;

  private Context(String name, @Nullable Context parent) {
    this.name = name;
    this.parent = parent;
  }

  /** Returns a new top-level context, whose parent is the builtin context. */
  public static Context newRoot(String name) {
    return new Context(name, Builtins.CONTEXT);
  }

  /** Returns a new, empty, parentless context to be filled with builtins. */
  static Context newBuiltinContext() {
    return new Context("Builtins", null);
  }

  void freeze() {
    frozen = true;
  }

  public String name() {
    return name;
  }

  public @Nullable Context parent() {
    return parent;
  }

  /** Returns the name of this context qualified by its ancestors, e.g. {@code Main.A}. */
  public String qualifiedName() {
    return (parent == null || parent.parent == null) ? name : parent.qualifiedName() + "." + name;
  }

  /**
   * Returns the value bound to {@code name} in this context or the nearest ancestor that binds it.
   *
   * @throws ScriptError if no ancestor binds it
   */
  public Object lookup(String name) {
    for (Context c = this; c != null; c = c.parent) {
      Object value = c.bindings.get(name);
      if (value != null) {
        return value;
      }
    }
    throw ScriptError.Kind.UNDEF_VAR_ERROR.error("%s not defined", name);
  }

  /**
   * Returns the value bound to {@code name} in this context (ignoring its ancestors).
   *
   * @throws ScriptError if there is no such binding
   */
  public Object member(String name) {
    Object value = bindings.get(name);
    if (value == null) {
      throw ScriptError.Kind.UNDEF_VAR_ERROR.error("%s.%s not defined", qualifiedName(), name);
    }
    return value;
  }

  /** True if {@code name} is bound in this context (ignoring its ancestors). */
  public boolean isBound(String name) {
    return bindings.containsKey(name);
  }

  /**
   * Binds {@code name} in this context.
   *
   * @param constant if true, later attempts to rebind {@code name} will fail
   * @throws ScriptError if {@code name} is already bound to a constant, or if {@code constant} is
   *     true and {@code name} is already bound
   */
  public void define(String name, Object value, boolean constant) {
    Preconditions.checkState(!frozen, "Builtin context is read-only");
    if (constants.contains(name)) {
      throw ScriptError.Kind.ERROR_EXCEPTION.error("invalid redefinition of constant %s", name);
    } else if (constant && bindings.containsKey(name)) {
      throw ScriptError.Kind.ERROR_EXCEPTION.error(
          "cannot declare %s constant; it already has a value", name);
    }
    bindings.put(name, value);
    if (constant) {
      constants.add(name);
    }
  }

  /**
   * Returns the child namespace with the given name, creating and binding it if this is the first
   * time it has been declared.
   */
  public Context namespace(String name) {
    Context child = namespaces.get(name);
    if (child == null) {
      child = new Context(name, this);
      define(name, child, false);
      namespaces.put(name, child);
    }
    return child;
  }

  @Override
  public String toString() {
    return qualifiedName();
  }
}
