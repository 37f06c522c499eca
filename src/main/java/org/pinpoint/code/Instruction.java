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
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;

/**
 * One element of a {@link CodeUnit}. The concrete subclasses are
 *
 * <ul>
 *   <li>{@link Call}, {@link Assign}, {@link SetGlobal}, {@link NewStruct} and {@link MakeClosure},
 *       which evaluate operands and (except for the assignments) produce a value;
 *   <li>{@link Goto}, {@link GotoIfNot} and {@link Return}, which transfer control; and
 *   <li>{@link GroupBegin}/{@link GroupEnd} and {@link AssertBegin}/{@link AssertEnd}, which
 *       bracket a test group or assertion. Each Begin installs an error handler that lands on its
 *       End.
 * </ul>
 *
 * <p>Each instruction records the source positions it was lowered from; there is usually one, but
 * an instruction lowered from a continuation line of a multi-line statement has two.
 */
public abstract class Instruction {
  private ImmutableList<SourcePos> positions = ImmutableList.of();

  /** Called by {@link CodeBuilder} when the instruction is emitted. */
  void setPositions(ImmutableList<SourcePos> positions) {
    this.positions = positions;
  }

  public final ImmutableList<SourcePos> positions() {
    return positions;
  }

  /** Returns the primary source line of this instruction, or 0 if it has no position. */
  public final int line() {
    return positions.isEmpty() ? 0 : positions.get(0).line();
  }

  /** The operands read by this instruction, in evaluation order. */
  public abstract ImmutableList<Operand> operands();

  /** True if other instructions may refer to this one with an {@link Operand.Ssa}. */
  public boolean producesValue() {
    return false;
  }

  /** The slot written by this instruction, or -1 if it does not write a slot. */
  public int writtenSlot() {
    return -1;
  }

  /** True if execution may continue with the next instruction. */
  public boolean fallsThrough() {
    return true;
  }

  /** If this instruction may branch, the index it branches to; otherwise -1. */
  public int branchTarget() {
    return -1;
  }

  private static String join(ImmutableList<Operand> operands) {
    return operands.stream().map(String::valueOf).collect(Collectors.joining(", "));
  }

  /** Calls {@code callee} with {@code args}. */
  public static final class Call extends Instruction {
    public final Operand callee;
    public final ImmutableList<Operand> args;

    public Call(Operand callee, ImmutableList<Operand> args) {
      this.callee = callee;
      this.args = args;
    }

    @Override
    public ImmutableList<Operand> operands() {
      return ImmutableList.<Operand>builder().add(callee).addAll(args).build();
    }

    @Override
    public boolean producesValue() {
      return true;
    }

    @Override
    public String toString() {
      return String.format("call %s(%s)", callee, join(args));
    }
  }

  /** Stores a value in a slot. */
  public static final class Assign extends Instruction {
    public final int slot;
    public final Operand value;

    public Assign(int slot, Operand value) {
      this.slot = slot;
      this.value = value;
    }

    @Override
    public ImmutableList<Operand> operands() {
      return ImmutableList.of(value);
    }

    @Override
    public int writtenSlot() {
      return slot;
    }

    @Override
    public String toString() {
      return String.format("_%s = %s", slot, value);
    }
  }

  /** Binds a name in the executing context. */
  public static final class SetGlobal extends Instruction {
    public final String name;
    public final Operand value;

    /** If true, the binding may not be changed by a later SetGlobal. */
    public final boolean constant;

    public SetGlobal(String name, Operand value, boolean constant) {
      this.name = name;
      this.value = value;
      this.constant = constant;
    }

    @Override
    public ImmutableList<Operand> operands() {
      return ImmutableList.of(value);
    }

    @Override
    public String toString() {
      return String.format("%s%s = %s", constant ? "const " : "", name, value);
    }
  }

  /** Creates a new struct type; the type is the value of this instruction. */
  public static final class NewStruct extends Instruction {
    public final String name;
    public final ImmutableList<String> fields;

    public NewStruct(String name, ImmutableList<String> fields) {
      this.name = name;
      this.fields = fields;
    }

    @Override
    public ImmutableList<Operand> operands() {
      return ImmutableList.of();
    }

    @Override
    public boolean producesValue() {
      return true;
    }

    @Override
    public String toString() {
      return String.format("struct %s(%s)", name, String.join(", ", fields));
    }
  }

  /**
   * Creates a function value from {@code unit}, capturing the current values of {@code captures}
   * (which are stored in the unit's capture slots when it is called).
   */
  public static final class MakeClosure extends Instruction {
    public final CodeUnit unit;
    public final ImmutableList<Operand> captures;

    public MakeClosure(CodeUnit unit, ImmutableList<Operand> captures) {
      this.unit = unit;
      this.captures = captures;
    }

    @Override
    public ImmutableList<Operand> operands() {
      return captures;
    }

    @Override
    public boolean producesValue() {
      return true;
    }

    @Override
    public String toString() {
      return String.format("closure %s(%s)", unit.name, join(captures));
    }
  }

  /** An unconditional branch. */
  public static final class Goto extends Instruction {
    public final Label target;

    public Goto(Label target) {
      this.target = target;
    }

    @Override
    public ImmutableList<Operand> operands() {
      return ImmutableList.of();
    }

    @Override
    public boolean fallsThrough() {
      return false;
    }

    @Override
    public int branchTarget() {
      return target.index();
    }

    @Override
    public String toString() {
      return "goto " + target;
    }
  }

  /** Branches to {@code target} if {@code condition} is false; it must be a boolean. */
  public static final class GotoIfNot extends Instruction {
    public final Operand condition;
    public final Label target;

    public GotoIfNot(Operand condition, Label target) {
      this.condition = condition;
      this.target = target;
    }

    @Override
    public ImmutableList<Operand> operands() {
      return ImmutableList.of(condition);
    }

    @Override
    public int branchTarget() {
      return target.index();
    }

    @Override
    public String toString() {
      return String.format("goto %s unless %s", target, condition);
    }
  }

  /** Returns from the unit; {@code value} is null if the result is {@code nothing}. */
  public static final class Return extends Instruction {
    public final @Nullable Operand value;

    public Return(@Nullable Operand value) {
      this.value = value;
    }

    @Override
    public ImmutableList<Operand> operands() {
      return (value == null) ? ImmutableList.of() : ImmutableList.of(value);
    }

    @Override
    public boolean fallsThrough() {
      return false;
    }

    @Override
    public String toString() {
      return (value == null) ? "return" : "return " + value;
    }
  }

  /**
   * The start of a region protected by an error handler. If an error is thrown while the handler
   * is active, execution continues at {@link #end}.
   */
  public abstract static class HandlerBegin extends Instruction {
    public final Label end;

    HandlerBegin(Label end) {
      this.end = end;
    }

    @Override
    public ImmutableList<Operand> operands() {
      return ImmutableList.of();
    }

    @Override
    public boolean producesValue() {
      return true;
    }

    @Override
    public int branchTarget() {
      return end.index();
    }
  }

  /** The end of a region begun by a {@link HandlerBegin}; also where its handler lands. */
  public abstract static class HandlerEnd extends Instruction {
    /** The index of the matching HandlerBegin. */
    public final int begin;

    HandlerEnd(int begin) {
      this.begin = begin;
    }
  }

  /** Opens a test group. */
  public static final class GroupBegin extends HandlerBegin {
    public final String name;

    public GroupBegin(String name, Label end) {
      super(end);
      this.name = name;
    }

    @Override
    public String toString() {
      return String.format("group \"%s\" (handler %s)", name, end);
    }
  }

  /** Closes a test group, recording an error if the group's handler caught one. */
  public static final class GroupEnd extends HandlerEnd {
    public GroupEnd(int begin) {
      super(begin);
    }

    @Override
    public ImmutableList<Operand> operands() {
      return ImmutableList.of(new Operand.Ssa(begin));
    }

    @Override
    public String toString() {
      return "end group %" + begin;
    }
  }

  /** The kinds of assertion. */
  public enum AssertKind {
    ASSERT("assert"),
    BROKEN("assert_broken"),
    SKIP("assert_skip"),
    THROWS("assert_throws");

    public final String keyword;

    AssertKind(String keyword) {
      this.keyword = keyword;
    }

    /** Returns the AssertKind with the given keyword. */
    public static AssertKind fromKeyword(String keyword) {
      for (AssertKind kind : values()) {
        if (kind.keyword.equals(keyword)) {
          return kind;
        }
      }
      throw new IllegalArgumentException("Not an assertion keyword: " + keyword);
    }
  }

  /** Starts evaluating the expression of an assertion. */
  public static final class AssertBegin extends HandlerBegin {
    public final AssertKind kind;

    public AssertBegin(AssertKind kind, Label end) {
      super(end);
      this.kind = kind;
    }

    @Override
    public String toString() {
      return String.format("%s (handler %s)", kind.keyword, end);
    }
  }

  /**
   * Records the outcome of an assertion, using the value left in {@link #resultSlot} (or the error
   * caught by the handler).
   */
  public static final class AssertEnd extends HandlerEnd {
    public final AssertKind kind;

    /** The slot holding the expression's value, or -1 for {@link AssertKind#SKIP}. */
    public final int resultSlot;

    /** The source text of the asserted expression. */
    public final String expression;

    public AssertEnd(AssertKind kind, int begin, int resultSlot, String expression) {
      super(begin);
      this.kind = kind;
      this.resultSlot = resultSlot;
      this.expression = expression;
    }

    @Override
    public ImmutableList<Operand> operands() {
      Operand beginRef = new Operand.Ssa(begin);
      return (resultSlot < 0)
          ? ImmutableList.of(beginRef)
          : ImmutableList.of(beginRef, new Operand.Slot(resultSlot));
    }

    @Override
    public String toString() {
      return String.format("end %s %%%s [%s]", kind.keyword, begin, expression);
    }
  }
}
