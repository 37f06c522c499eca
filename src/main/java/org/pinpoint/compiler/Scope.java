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

import java.util.HashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.pinpoint.code.Operand;

/**
 * A Scope maps variable names to slots of the unit being lowered. Scopes nest: a name that is not
 * found in a scope is looked up in its parent, and a name that is not found in any enclosing scope
 * refers to a global.
 *
 * <p>Assignment to a name that is not yet visible either creates a new slot in the innermost scope
 * or (if {@link #assignsGlobals}) binds a global. Top-level statements assign globals; test group
 * and function bodies have their own locals.
 *
 * <p>The {@link ForFunction} subclass is used for function bodies. A function body may read the
 * slots of the scopes it is nested in; each such variable becomes a closure variable, whose value
 * is captured when the function value is created.
 */
class Scope {

  /** Maps each variable declared in this scope to its slot. */
  private final Map<String, Integer> entries = new HashMap<>();

  final @Nullable Scope parent;

  /** The unit that allocates the slots of this scope. */
  final Lowering.Unit unit;

  /** If true, assigning a name that is not already a local binds a global. */
  final boolean assignsGlobals;

  Scope(@Nullable Scope parent, Lowering.Unit unit, boolean assignsGlobals) {
    this.parent = parent;
    this.unit = unit;
    this.assignsGlobals = assignsGlobals;
  }

  /** Returns a new scope nested in this one, belonging to the same unit. */
  Scope nested(boolean assignsGlobals) {
    return new Scope(this, unit, assignsGlobals);
  }

  /** Creates a new slot for {@code name} in this scope, hiding any outer variable of that name. */
  int declare(String name) {
    int slot = unit.cb.newSlot(name);
    entries.put(name, slot);
    return slot;
  }

  /**
   * Returns the slot operand for reading {@code name}, or null if it should be read as a global.
   */
  Operand.@Nullable Slot lookup(String name) {
    Integer slot = entries.get(name);
    if (slot != null) {
      return new Operand.Slot(slot);
    }
    return lookupInParent(name);
  }

  Operand.@Nullable Slot lookupInParent(String name) {
    return (parent == null) ? null : parent.lookup(name);
  }

  /**
   * Returns the slot to assign for {@code name}, creating it if necessary, or null if the
   * assignment should bind a global.
   */
  Operand.@Nullable Slot getSlotForWrite(String name) {
    for (Scope scope = this; scope != null && scope.unit == unit; scope = scope.parent) {
      Integer slot = scope.entries.get(name);
      if (slot != null) {
        return new Operand.Slot(slot);
      }
    }
    return assignsGlobals ? null : new Operand.Slot(declare(name));
  }

  /** The outermost scope of a function body. */
  static class ForFunction extends Scope {
    /** The name the function is defined with; references to it in the body are to itself. */
    private final String selfName;

    /**
     * @param definedIn the scope in which the function statement appears
     */
    ForFunction(Scope definedIn, Lowering.Unit unit, String selfName) {
      super(definedIn, unit, false);
      this.selfName = selfName;
    }

    @Override
    Operand.@Nullable Slot lookupInParent(String name) {
      if (name.equals(selfName)) {
        int slot = declare(name);
        unit.selfSlot = slot;
        return new Operand.Slot(slot);
      }
      Operand.Slot outer = (parent == null) ? null : parent.lookup(name);
      if (outer == null) {
        return null;
      }
      // Inherit the variable as a closure variable.
      int slot = declare(name);
      unit.addCapture(slot, outer);
      return new Operand.Slot(slot);
    }
  }
}
