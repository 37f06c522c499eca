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

/**
 * An operand of an {@link Instruction}: a reference to the value produced by an earlier
 * instruction, a local variable slot, a global name, or a constant.
 */
public sealed interface Operand {

  /** The value produced by the instruction at {@code index} of the same {@link CodeUnit}. */
  record Ssa(int index) implements Operand {
    @Override
    public String toString() {
      return "%" + index;
    }
  }

  /** The current value of a local variable. */
  record Slot(int index) implements Operand {
    @Override
    public String toString() {
      return "_" + index;
    }
  }

  /** The value bound to {@code name} in the executing context (or one of its parents). */
  record Global(String name) implements Operand {
    @Override
    public String toString() {
      return name;
    }
  }

  /** A constant; {@code value} is a runtime value (number, string, builtin function, ...). */
  record Const(Object value) implements Operand {
    @Override
    public String toString() {
      return (value instanceof String s) ? '"' + s + '"' : String.valueOf(value);
    }
  }
}
