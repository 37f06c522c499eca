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

import java.util.ArrayDeque;
import java.util.Deque;
import org.jspecify.annotations.Nullable;
import org.pinpoint.code.CodeUnit;
import org.pinpoint.code.Instruction;
import org.pinpoint.code.Operand;
import org.pinpoint.code.SelectionVector;
import org.pinpoint.code.SourcePos;
import org.pinpoint.compiler.SyntaxError;

/**
 * Executes a {@link CodeUnit}, optionally restricted to the instructions in a {@link
 * SelectionVector}; unselected instructions are stepped over without being evaluated.
 *
 * <p>Each executed group or assertion Begin installs an error handler. If a {@link ScriptError} is
 * thrown while a handler is installed, the innermost handler is removed, the error is captured by
 * the {@link TestRecorder}, and execution resumes at the matching End. Errors thrown with no
 * handler installed propagate to the caller of {@link #run}.
 *
 * <p>An Executor runs its unit once.
 */
public final class Executor {

  /** Evaluates the calls made by executed code. */
  @FunctionalInterface
  public interface CallHandler {
    Object call(Invocation invocation, Object callee, Object[] args);
  }

  /** A CallHandler that just calls the callee. */
  public static final CallHandler NATIVE =
      (invocation, callee, args) -> Values.asCallable(callee).call(invocation, args);

  private final CodeUnit unit;
  private final Context context;
  private final TestRecorder recorder;
  private final @Nullable SelectionVector selection;
  private final CallHandler callHandler;

  /** The value of each executed instruction that produces one. */
  private final @Nullable Object[] values;

  private final @Nullable Object[] slots;

  /** The indices of the Begin instructions whose handlers are installed, innermost first. */
  private final Deque<Integer> handlers = new ArrayDeque<>();

  /**
   * @param selection the instructions to execute, or null to execute all of them
   */
  public Executor(
      CodeUnit unit,
      Context context,
      TestRecorder recorder,
      @Nullable SelectionVector selection,
      CallHandler callHandler) {
    this.unit = unit;
    this.context = context;
    this.recorder = recorder;
    this.selection = selection;
    this.callHandler = callHandler;
    this.values = new Object[unit.size()];
    this.slots = new Object[unit.numSlots()];
  }

  /** Sets the initial value of a slot. */
  public void setSlot(int slot, @Nullable Object value) {
    slots[slot] = value;
  }

  /**
   * Executes the unit, returning the value it returns.
   *
   * @throws ScriptError if an error is thrown outside any group or assertion
   */
  public Object run() {
    int pc = 0;
    for (; ; ) {
      Instruction inst = unit.get(pc);
      if (selection != null && !selection.get(pc)) {
        if (inst instanceof Instruction.Return) {
          return Nothing.INSTANCE;
        }
        pc++;
        continue;
      }
      try {
        if (inst instanceof Instruction.Return ret) {
          return (ret.value == null) ? Nothing.INSTANCE : get(ret.value);
        }
        pc = execute(pc, inst);
      } catch (SyntaxError e) {
        throw e;
      } catch (RuntimeException e) {
        ScriptError error = (e instanceof ScriptError se) ? se : ScriptError.wrap(e);
        error.addTrace(unit.name, position(inst));
        if (handlers.isEmpty()) {
          throw error;
        }
        int begin = handlers.pop();
        values[begin] = error;
        recorder.captureException(error);
        pc = ((Instruction.HandlerBegin) unit.get(begin)).end.index();
      }
    }
  }

  /** Executes a single instruction and returns the index of the next instruction to execute. */
  private int execute(int pc, Instruction inst) {
    if (inst instanceof Instruction.Call call) {
      Object callee = get(call.callee);
      Object[] args = new Object[call.args.size()];
      for (int i = 0; i < args.length; i++) {
        args[i] = get(call.args.get(i));
      }
      Invocation invocation = new Invocation(recorder, context, unit.file, inst.line());
      values[pc] = callHandler.call(invocation, callee, args);
    } else if (inst instanceof Instruction.Assign assign) {
      slots[assign.slot] = get(assign.value);
    } else if (inst instanceof Instruction.SetGlobal setGlobal) {
      context.define(setGlobal.name, get(setGlobal.value), setGlobal.constant);
    } else if (inst instanceof Instruction.NewStruct newStruct) {
      values[pc] = new StructType(newStruct.name, newStruct.fields);
    } else if (inst instanceof Instruction.MakeClosure makeClosure) {
      Object[] captured = new Object[makeClosure.captures.size()];
      for (int i = 0; i < captured.length; i++) {
        Operand capture = makeClosure.captures.get(i);
        captured[i] = (capture instanceof Operand.Slot slot) ? slots[slot.index()] : get(capture);
      }
      values[pc] = new Closure(makeClosure.unit, captured, context);
    } else if (inst instanceof Instruction.Goto jump) {
      return jump.target.index();
    } else if (inst instanceof Instruction.GotoIfNot branch) {
      Object condition = get(branch.condition);
      if (!(condition instanceof Boolean b)) {
        throw ScriptError.Kind.TYPE_ERROR.error(
            "non-boolean (%s) used in boolean context", Values.typeName(condition));
      }
      return b ? pc + 1 : branch.target.index();
    } else if (inst instanceof Instruction.GroupBegin group) {
      recorder.beginGroup(group.name);
      beginHandler(pc);
    } else if (inst instanceof Instruction.GroupEnd end) {
      ScriptError error = endHandler(end.begin);
      if (error != null) {
        Instruction.GroupBegin begin = (Instruction.GroupBegin) unit.get(end.begin);
        recorder.recordGroupError(begin.name, error, errorPosition(error, inst));
      }
      recorder.endGroup();
    } else if (inst instanceof Instruction.AssertBegin) {
      beginHandler(pc);
    } else if (inst instanceof Instruction.AssertEnd end) {
      ScriptError error = endHandler(end.begin);
      Object value = (error != null || end.resultSlot < 0) ? null : slots[end.resultSlot];
      recorder.recordAssertion(end.kind, value, error, position(inst), end.expression);
    } else {
      throw new AssertionError("Unexpected instruction: " + inst);
    }
    return pc + 1;
  }

  private void beginHandler(int pc) {
    values[pc] = null;
    handlers.push(pc);
  }

  /**
   * Called when the End matching the Begin at {@code begin} is reached. Returns the error caught by
   * the handler, or null (after removing the handler) if the End was reached normally.
   */
  private @Nullable ScriptError endHandler(int begin) {
    ScriptError error = (ScriptError) values[begin];
    if (error == null) {
      int top = handlers.pop();
      assert top == begin;
    }
    return error;
  }

  /** Returns the current value of {@code operand}. */
  private Object get(Operand operand) {
    if (operand instanceof Operand.Ssa ssa) {
      Object value = values[ssa.index()];
      assert value != null : "Unexecuted " + ssa;
      return value;
    } else if (operand instanceof Operand.Slot slot) {
      Object value = slots[slot.index()];
      if (value == null) {
        throw ScriptError.Kind.UNDEF_VAR_ERROR.error(
            "%s not defined", unit.slotNames.get(slot.index()));
      }
      return value;
    } else if (operand instanceof Operand.Global global) {
      return context.lookup(global.name());
    }
    return ((Operand.Const) operand).value();
  }

  private SourcePos position(Instruction inst) {
    return inst.positions().isEmpty()
        ? new SourcePos(unit.file, 0)
        : inst.positions().get(inst.positions().size() - 1);
  }

  /**
   * Returns the position to report for an error caught by a group's handler: where the error was
   * raised within this unit, if that is known.
   */
  private SourcePos errorPosition(ScriptError error, Instruction groupEnd) {
    SourcePos pos = error.lastPosition();
    return (pos != null) ? pos : position(groupEnd);
  }
}
