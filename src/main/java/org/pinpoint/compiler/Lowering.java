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

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.FormatMethod;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.pinpoint.code.CodeBuilder;
import org.pinpoint.code.CodeUnit;
import org.pinpoint.code.Instruction;
import org.pinpoint.code.Instruction.AssertKind;
import org.pinpoint.code.Label;
import org.pinpoint.code.Operand;

/**
 * Lowers the syntax tree of a single top-level statement into a {@link CodeUnit}. Function
 * definitions within the statement are lowered into their own CodeUnits, referenced from the
 * {@link Instruction.MakeClosure} that creates them.
 *
 * <p>Operators and the other primitive operations that have no syntax of their own are lowered to
 * calls of reserved global names (e.g. {@code +}, {@code #getindex}) that cannot be written as
 * identifiers; the runtime binds them in its root context.
 */
public final class Lowering {

  /** Global names of the primitive operations that lowered code calls. */
  public static final String GET_INDEX = "#getindex";

  public static final String SET_INDEX = "#setindex";
  public static final String GET_FIELD = "#getfield";
  public static final String NEGATE = "#neg";
  public static final String NEW_ARRAY = "#vect";
  public static final String ITERATE = "#iterate";
  public static final String NEXT = "#next";
  public static final String HAS_VALUE = "#hasvalue";

  /** The global name that {@code nothing} is lowered to. */
  public static final String NOTHING = "nothing";

  /** The name given to the CodeUnit of a top-level statement. */
  public static final String TOP_LEVEL = "top-level scope";

  private final SourceFile source;

  private Lowering(SourceFile source) {
    this.source = source;
  }

  /**
   * Lowers {@code statement}, a top-level statement of {@code source} (other than a namespace).
   *
   * @throws SyntaxError if the statement uses a construct in a place where it is not allowed
   */
  public static CodeUnit lowerFragment(SourceFile source, Node statement) {
    Lowering lowering = new Lowering(source);
    if (statement.kind == Node.Kind.NAMESPACE) {
      throw lowering.error(statement, "A namespace is not a fragment");
    }
    Unit unit = lowering.new Unit(false);
    Scope scope = new Scope(null, unit, true);
    lowering.statement(statement, scope);
    unit.cb.setLines(statement.lastLine);
    unit.cb.emit(new Instruction.Return(null));
    return unit.build(TOP_LEVEL, 0);
  }

  /** The state of one CodeUnit while its statements are being lowered. */
  final class Unit {
    final CodeBuilder cb = new CodeBuilder(source.path);
    final boolean isFunction;

    /** The number of test groups and assertions enclosing the current statement. */
    int handlerDepth;

    final Deque<Loop> loops = new ArrayDeque<>();

    /** Slots that are initialized from the function value's captured values. */
    private final List<Integer> captureSlots = new ArrayList<>();

    /** For each capture slot, the operand (in the defining unit) that provides its value. */
    final List<Operand> captureOperands = new ArrayList<>();

    /** Set by {@link Scope.ForFunction} if the body refers to the function itself. */
    int selfSlot = -1;

    /** The statement currently being lowered; its first line is attached to each instruction. */
    private Node statement;

    Unit(boolean isFunction) {
      this.isFunction = isFunction;
    }

    void addCapture(int slot, Operand outer) {
      captureSlots.add(slot);
      captureOperands.add(outer);
    }

    CodeUnit build(String name, int numParams) {
      return cb.build(name, numParams, ImmutableList.copyOf(captureSlots), selfSlot);
    }

    /** Sets the positions for instructions lowered from {@code node}. */
    void at(Node node) {
      cb.setLines(statement.firstLine, node.firstLine);
    }
  }

  /** A loop enclosing the current statement, with the targets for break and continue. */
  private record Loop(Label continueTarget, Label breakTarget, int handlerDepth) {}

  private void statement(Node node, Scope scope) {
    Unit unit = scope.unit;
    Node saved = unit.statement;
    unit.statement = node;
    try {
      lowerStatement(node, scope);
    } finally {
      unit.statement = saved;
    }
  }

  private void block(Node block, Scope scope) {
    for (Node child : block.children) {
      statement(child, scope);
    }
  }

  private void lowerStatement(Node node, Scope scope) {
    Unit unit = scope.unit;
    CodeBuilder cb = unit.cb;
    switch (node.kind) {
      case NAMESPACE -> throw error(node, "A namespace may only be declared at top level");
      case FUNCTION -> {
        Instruction.MakeClosure closure = function(node, scope);
        unit.at(node);
        assign(node.text, cb.emit(closure), scope);
      }
      case STRUCT -> {
        if (unit.isFunction) {
          throw error(node, "A struct may not be defined inside a function");
        }
        ImmutableList<String> fields =
            node.child(0).children.stream()
                .map(n -> n.text)
                .collect(ImmutableList.toImmutableList());
        unit.at(node);
        Operand type = cb.emit(new Instruction.NewStruct(node.text, fields));
        cb.emit(new Instruction.SetGlobal(node.text, type, false));
      }
      case CONST -> {
        if (unit.isFunction || scope.parent != null) {
          throw error(node, "A const may only be declared at top level");
        }
        Operand value = expression(node.child(0), scope);
        unit.at(node);
        cb.emit(new Instruction.SetGlobal(node.text, value, true));
      }
      case TESTGROUP -> testgroup(node, scope);
      case ASSERT -> assertion(node, scope);
      case IF -> ifStatement(node, scope);
      case WHILE -> whileStatement(node, scope);
      case FOR -> forStatement(node, scope);
      case RETURN -> {
        if (!unit.isFunction) {
          throw error(node, "return is only allowed inside a function");
        } else if (unit.handlerDepth != 0) {
          throw error(node, "return may not exit a testgroup or assertion");
        }
        Operand value = (node.numChildren() == 0) ? null : expression(node.child(0), scope);
        unit.at(node);
        cb.emit(new Instruction.Return(value));
      }
      case BREAK, CONTINUE -> {
        Loop loop = unit.loops.peek();
        String keyword = (node.kind == Node.Kind.BREAK) ? "break" : "continue";
        if (loop == null) {
          throw error(node, "%s is only allowed inside a loop", keyword);
        } else if (loop.handlerDepth != unit.handlerDepth) {
          throw error(node, "%s may not exit a testgroup or assertion", keyword);
        }
        unit.at(node);
        Label target = (node.kind == Node.Kind.BREAK) ? loop.breakTarget : loop.continueTarget;
        cb.emit(new Instruction.Goto(target));
      }
      case ASSIGN -> {
        Operand value = expression(node.child(0), scope);
        unit.at(node);
        assign(node.text, value, scope);
      }
      case INDEX_ASSIGN -> {
        int n = node.numChildren();
        Operand target = variable(node.text, scope);
        List<Operand> args = new ArrayList<>();
        args.add(target);
        args.add(expression(node.child(n - 1), scope));
        for (int i = 0; i < n - 1; i++) {
          args.add(expression(node.child(i), scope));
        }
        unit.at(node);
        cb.emit(new Instruction.Call(new Operand.Global(SET_INDEX), ImmutableList.copyOf(args)));
      }
      default -> expression(node, scope);
    }
  }

  private void assign(String name, Operand value, Scope scope) {
    Operand.Slot slot = scope.getSlotForWrite(name);
    if (slot == null) {
      scope.unit.cb.emit(new Instruction.SetGlobal(name, value, false));
    } else {
      scope.unit.cb.emit(new Instruction.Assign(slot.index(), value));
    }
  }

  /** Lowers a function definition, returning the instruction that creates the function value. */
  private Instruction.MakeClosure function(Node node, Scope definedIn) {
    Unit unit = new Unit(true);
    Scope.ForFunction scope = new Scope.ForFunction(definedIn, unit, node.text);
    Node params = node.child(0);
    for (Node param : params.children) {
      scope.declare(param.text);
    }
    unit.statement = node;
    block(node.child(1), scope);
    unit.cb.setLines(node.lastLine);
    unit.cb.emit(new Instruction.Return(null));
    CodeUnit code = unit.build(node.text, params.numChildren());
    return new Instruction.MakeClosure(code, ImmutableList.copyOf(unit.captureOperands));
  }

  private void testgroup(Node node, Scope scope) {
    Unit unit = scope.unit;
    CodeBuilder cb = unit.cb;
    Label end = cb.newLabel();
    cb.setLines(node.firstLine);
    Operand.Ssa begin = cb.emit(new Instruction.GroupBegin(node.text, end));
    unit.handlerDepth++;
    block(node.child(0), scope.nested(false));
    unit.handlerDepth--;
    cb.setLines(node.lastLine);
    cb.placeLabel(end);
    cb.emit(new Instruction.GroupEnd(begin.index()));
  }

  private void assertion(Node node, Scope scope) {
    Unit unit = scope.unit;
    CodeBuilder cb = unit.cb;
    AssertKind kind = AssertKind.fromKeyword(node.text);
    Node expr = node.child(0);
    Label end = cb.newLabel();
    cb.setLines(node.firstLine);
    Operand.Ssa begin = cb.emit(new Instruction.AssertBegin(kind, end));
    int resultSlot = -1;
    if (kind != AssertKind.SKIP) {
      unit.handlerDepth++;
      Operand value = expression(expr, scope);
      unit.handlerDepth--;
      resultSlot = cb.newSlot("#" + kind.keyword);
      cb.setLines(node.firstLine);
      cb.emit(new Instruction.Assign(resultSlot, value));
    }
    cb.setLines(node.firstLine);
    cb.placeLabel(end);
    cb.emit(new Instruction.AssertEnd(kind, begin.index(), resultSlot, source.textOf(expr)));
  }

  private void ifStatement(Node node, Scope scope) {
    Unit unit = scope.unit;
    CodeBuilder cb = unit.cb;
    Operand condition = expression(node.child(0), scope);
    Label otherwise = cb.newLabel();
    unit.at(node);
    cb.emit(new Instruction.GotoIfNot(condition, otherwise));
    Node then = node.child(1);
    block(then, scope);
    if (node.numChildren() == 2) {
      cb.placeLabel(otherwise);
      return;
    }
    Label done = cb.newLabel();
    cb.setLines(node.firstLine, then.lastLine);
    cb.emit(new Instruction.Goto(done));
    cb.placeLabel(otherwise);
    Node alternative = node.child(2);
    if (alternative.kind == Node.Kind.IF) {
      statement(alternative, scope);
    } else {
      block(alternative, scope);
    }
    cb.placeLabel(done);
  }

  private void whileStatement(Node node, Scope scope) {
    Unit unit = scope.unit;
    CodeBuilder cb = unit.cb;
    Label head = cb.newLabel();
    Label exit = cb.newLabel();
    cb.placeLabel(head);
    Operand condition = expression(node.child(0), scope);
    unit.at(node);
    cb.emit(new Instruction.GotoIfNot(condition, exit));
    loopBody(node, scope.nested(scope.assignsGlobals), head, exit);
    cb.placeLabel(exit);
  }

  /**
   * Lowers a for loop. The iterator is advanced by a single instruction whose value is either the
   * next element or a marker, so that any dependence on the loop also keeps it advancing.
   */
  private void forStatement(Node node, Scope scope) {
    Unit unit = scope.unit;
    CodeBuilder cb = unit.cb;
    Operand iterable = expression(node.child(0), scope);
    unit.at(node);
    Operand iterator = cb.emit(call(ITERATE, iterable));
    int iteratorSlot = cb.newSlot("#iterator");
    cb.emit(new Instruction.Assign(iteratorSlot, iterator));
    Label head = cb.newLabel();
    Label exit = cb.newLabel();
    cb.placeLabel(head);
    Operand next = cb.emit(call(NEXT, new Operand.Slot(iteratorSlot)));
    Operand hasValue = cb.emit(call(HAS_VALUE, next));
    cb.emit(new Instruction.GotoIfNot(hasValue, exit));
    Scope body = scope.nested(scope.assignsGlobals);
    cb.emit(new Instruction.Assign(body.declare(node.text), next));
    loopBody(node, body, head, exit);
    cb.placeLabel(exit);
  }

  private void loopBody(Node loop, Scope body, Label head, Label exit) {
    Unit unit = body.unit;
    unit.loops.push(new Loop(head, exit, unit.handlerDepth));
    block(loop.child(1), body);
    unit.loops.pop();
    unit.cb.setLines(loop.firstLine, loop.lastLine);
    unit.cb.emit(new Instruction.Goto(head));
  }

  private static Instruction.Call call(String primitive, Operand... args) {
    return new Instruction.Call(new Operand.Global(primitive), ImmutableList.copyOf(args));
  }

  /** Returns the operand for reading a variable. */
  private static Operand variable(String name, Scope scope) {
    Operand.Slot slot = scope.lookup(name);
    return (slot != null) ? slot : new Operand.Global(name);
  }

  /** Emits the instructions to evaluate {@code node} and returns an operand for its value. */
  private Operand expression(Node node, Scope scope) {
    Unit unit = scope.unit;
    CodeBuilder cb = unit.cb;
    switch (node.kind) {
      case NUMBER -> {
        return new Operand.Const(
            SyntaxBuilder.isInteger(node.text)
                ? (Object) Long.parseLong(node.text)
                : (Object) Double.parseDouble(node.text));
      }
      case STRING -> {
        return new Operand.Const(node.text);
      }
      case BOOL -> {
        return new Operand.Const(Boolean.parseBoolean(node.text));
      }
      case NOTHING -> {
        return new Operand.Global(NOTHING);
      }
      case NAME -> {
        return variable(node.text, scope);
      }
      case CALL -> {
        Operand callee = expression(node.child(0), scope);
        ImmutableList<Operand> args =
            expressions(node.children.subList(1, node.numChildren()), scope);
        unit.at(node);
        return cb.emit(new Instruction.Call(callee, args));
      }
      case INDEX -> {
        ImmutableList<Operand> args = expressions(node.children, scope);
        unit.at(node);
        return cb.emit(new Instruction.Call(new Operand.Global(GET_INDEX), args));
      }
      case FIELD -> {
        Operand target = expression(node.child(0), scope);
        unit.at(node);
        return cb.emit(call(GET_FIELD, target, new Operand.Const(node.text)));
      }
      case UNARY -> {
        Operand operand = expression(node.child(0), scope);
        unit.at(node);
        return cb.emit(call(node.text.equals("-") ? NEGATE : node.text, operand));
      }
      case BINARY -> {
        Operand left = expression(node.child(0), scope);
        Operand right = expression(node.child(1), scope);
        unit.at(node);
        return cb.emit(call(node.text, left, right));
      }
      case AND, OR -> {
        return shortCircuit(node, scope);
      }
      case ARRAY -> {
        ImmutableList<Operand> elements = expressions(node.children, scope);
        unit.at(node);
        return cb.emit(new Instruction.Call(new Operand.Global(NEW_ARRAY), elements));
      }
      default -> throw error(node, "Unexpected %s in expression", node.kind);
    }
  }

  private ImmutableList<Operand> expressions(List<Node> nodes, Scope scope) {
    ImmutableList.Builder<Operand> result = ImmutableList.builder();
    for (Node node : nodes) {
      result.add(expression(node, scope));
    }
    return result.build();
  }

  /**
   * Lowers {@code a && b} or {@code a || b}. The result is left in a fresh slot: {@code b} is only
   * evaluated if {@code a} does not determine the result.
   */
  private Operand shortCircuit(Node node, Scope scope) {
    Unit unit = scope.unit;
    CodeBuilder cb = unit.cb;
    boolean isAnd = (node.kind == Node.Kind.AND);
    int result = cb.newSlot(isAnd ? "#and" : "#or");
    Label done = cb.newLabel();
    Operand left = expression(node.child(0), scope);
    unit.at(node);
    cb.emit(new Instruction.Assign(result, left));
    if (isAnd) {
      cb.emit(new Instruction.GotoIfNot(left, done));
    } else {
      Label evaluateRight = cb.newLabel();
      cb.emit(new Instruction.GotoIfNot(left, evaluateRight));
      cb.emit(new Instruction.Goto(done));
      cb.placeLabel(evaluateRight);
    }
    Operand right = expression(node.child(1), scope);
    unit.at(node);
    cb.emit(new Instruction.Assign(result, right));
    cb.placeLabel(done);
    return new Operand.Slot(result);
  }

  @FormatMethod
  private SyntaxError error(Node node, String fmt, Object... fmtArgs) {
    return Compiler.error(source.displayName(), node, fmt, fmtArgs);
  }
}
