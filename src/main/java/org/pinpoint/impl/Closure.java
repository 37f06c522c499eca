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

import org.jspecify.annotations.Nullable;
import org.pinpoint.code.CodeUnit;

/**
 * A function defined by a script: a lowered function body together with the values of its closure
 * variables and the context in which it was defined (used to resolve the globals it refers to).
 *
 * <p>Calling a Closure always runs its whole body; function bodies are never sliced.
 */
public final class Closure implements Callable {

  private final CodeUnit unit;
  private final @Nullable Object[] captured;
  private final Context context;

  /**
   * @param captured the values for the unit's capture slots; an element is null if the variable
   *     had not been assigned when the closure was created
   */
  Closure(CodeUnit unit, @Nullable Object[] captured, Context context) {
    this.unit = unit;
    this.captured = captured;
    this.context = context;
  }

  @Override
  public String name() {
    return unit.name;
  }

  @Override
  public Object call(Invocation invocation, Object[] args) {
    if (args.length != unit.numParams) {
      throw Values.noMethod(unit.name, args);
    }
    Executor executor = new Executor(unit, context, invocation.recorder(), null, Executor.NATIVE);
    for (int i = 0; i < args.length; i++) {
      executor.setSlot(i, args[i]);
    }
    for (int i = 0; i < captured.length; i++) {
      executor.setSlot(unit.captureSlots.get(i), captured[i]);
    }
    if (unit.selfSlot >= 0) {
      executor.setSlot(unit.selfSlot, this);
    }
    return executor.run();
  }

  @Override
  public String toString() {
    return unit.name + " (generic function)";
  }
}
