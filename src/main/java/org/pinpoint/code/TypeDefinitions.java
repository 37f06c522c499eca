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
import com.google.common.collect.ImmutableMap;
import java.util.HashMap;
import java.util.Map;

/**
 * The struct definitions in a {@link CodeUnit}, keyed by the global name they are bound to. Each
 * definition consists of a {@link Instruction.NewStruct} and the {@link Instruction.SetGlobal}
 * that binds it.
 */
public final class TypeDefinitions {
  private final ImmutableMap<String, ImmutableList<Integer>> definitions;

  private TypeDefinitions(ImmutableMap<String, ImmutableList<Integer>> definitions) {
    this.definitions = definitions;
  }

  public static TypeDefinitions build(CodeUnit unit, DefUseGraph defUse) {
    Map<String, ImmutableList<Integer>> definitions = new HashMap<>();
    for (int i = 0; i < unit.size(); i++) {
      if (unit.get(i) instanceof Instruction.NewStruct) {
        for (int use : defUse.uses(i)) {
          if (unit.get(use) instanceof Instruction.SetGlobal setGlobal) {
            definitions.put(setGlobal.name, ImmutableList.of(i, use));
          }
        }
      }
    }
    return new TypeDefinitions(ImmutableMap.copyOf(definitions));
  }

  /** The instructions defining the type bound to {@code name}, or an empty list. */
  public ImmutableList<Integer> definitionOf(String name) {
    return definitions.getOrDefault(name, ImmutableList.of());
  }

  public boolean isEmpty() {
    return definitions.isEmpty();
  }
}
