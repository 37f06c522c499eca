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

import java.nio.file.Path;
import java.util.Arrays;
import java.util.Iterator;
import java.util.function.DoubleBinaryOperator;
import java.util.function.DoubleUnaryOperator;
import java.util.function.LongBinaryOperator;
import java.util.stream.Collectors;
import org.pinpoint.compiler.Lowering;

/**
 * The builtin functions and constants, and the primitive operations that lowered code calls by
 * reserved names. All are bound in {@link #CONTEXT}, the parent of every root context.
 */
public final class Builtins {

  /** The {@code include} builtin, which callers may need to recognize. */
  public static final Builtin INCLUDE = new Builtin("include", 1, 2, Builtins::include);

  /** The context containing every builtin; it cannot be modified. */
  static final Context CONTEXT = createContext();

  // Static fields only
  private Builtins() {}

  private static Context createContext() {
    Context c = Context.newBuiltinContext();
    c.define("pi", Math.PI, true);
    c.define("Inf", Double.POSITIVE_INFINITY, true);
    c.define("NaN", Double.NaN, true);
    c.define(Lowering.NOTHING, Nothing.INSTANCE, true);

    arithmetic(c, "+", (x, y) -> x + y, (x, y) -> x + y);
    arithmetic(c, "-", (x, y) -> x - y, (x, y) -> x - y);
    define(c, "*", 2, 2, (inv, args) -> multiply(args[0], args[1]));
    define(c, "/", 2, 2, (inv, args) -> divide(args[0], args[1]));
    define(c, "%", 2, 2, (inv, args) -> remainder(args[0], args[1]));
    comparison(c, "<", r -> r < 0);
    comparison(c, "<=", r -> r <= 0);
    comparison(c, ">", r -> r > 0);
    comparison(c, ">=", r -> r >= 0);
    define(c, "==", 2, 2, (inv, args) -> Values.equal(args[0], args[1]));
    define(c, "!=", 2, 2, (inv, args) -> !Values.equal(args[0], args[1]));
    define(c, "~=", 2, 2, (inv, args) -> Values.isApprox(args[0], args[1]));
    define(c, "!", 1, 1, (inv, args) -> !asBoolean("!", args[0]));
    define(c, Lowering.NEGATE, 1, 1, (inv, args) -> negate(args[0]));

    define(c, Lowering.GET_INDEX, 2, 2, (inv, args) -> getIndex(args[0], args[1]));
    define(c, Lowering.SET_INDEX, 3, 3, (inv, args) -> setIndex(args[0], args[1], args[2]));
    define(c, Lowering.GET_FIELD, 2, 2, (inv, args) -> getField(args[0], (String) args[1]));
    define(c, Lowering.NEW_ARRAY, 0, -1, (inv, args) -> new ArrayValue(Arrays.asList(args)));
    define(c, Lowering.ITERATE, 1, 1, (inv, args) -> new IterationState(iterator(args[0])));
    define(c, Lowering.NEXT, 1, 1, (inv, args) -> ((IterationState) args[0]).next());
    define(c, Lowering.HAS_VALUE, 1, 1, (inv, args) -> args[0] != IterationState.DONE);

    define(c, "length", 1, 1, (inv, args) -> length(args[0]));
    define(c, "push", 2, -1, Builtins::push);
    define(c, "sum", 1, 1, (inv, args) -> sum(args[0]));
    define(c, "range", 2, 2, (inv, args) -> range(args[0], args[1]));
    define(c, "sqrt", 1, 1, (inv, args) -> sqrt(args[0]));
    define(c, "abs", 1, 1, (inv, args) -> abs(args[0]));
    trigonometric(c, "sin", Math::sin);
    trigonometric(c, "cos", Math::cos);
    define(c, "div", 2, 2, (inv, args) -> div(args[0], args[1]));
    define(
        c,
        "string",
        0,
        -1,
        (inv, args) -> Arrays.stream(args).map(Values::display).collect(Collectors.joining()));
    define(
        c, "uppercase", 1, 1, (inv, args) -> Values.asString("uppercase", args[0]).toUpperCase());
    define(
        c,
        "startswith",
        2,
        2,
        (inv, args) ->
            Values.asString("startswith", args[0])
                .startsWith(Values.asString("startswith", args[1])));
    define(
        c,
        "error",
        1,
        1,
        (inv, args) -> {
          throw ScriptError.Kind.ERROR_EXCEPTION.error("%s", Values.display(args[0]));
        });
    define(c, "isnothing", 1, 1, (inv, args) -> args[0] == Nothing.INSTANCE);
    define(c, "println", 0, -1, Builtins::println);
    define(c, "identity", 1, 1, (inv, args) -> args[0]);
    c.define(INCLUDE.name(), INCLUDE, true);
    c.freeze();
    return c;
  }

  private static void define(Context c, String name, int minArgs, int maxArgs, Builtin.Body body) {
    c.define(name, new Builtin(name, minArgs, maxArgs, body), true);
  }

  /** Defines an operator that produces an integer if both arguments are integers. */
  private static void arithmetic(
      Context c, String name, LongBinaryOperator onLongs, DoubleBinaryOperator onDoubles) {
    define(
        c,
        name,
        2,
        2,
        (inv, args) -> {
          Object x = args[0];
          Object y = args[1];
          if (x instanceof Long a && y instanceof Long b) {
            return onLongs.applyAsLong(a, b);
          } else if (Values.isNumber(x) && Values.isNumber(y)) {
            return onDoubles.applyAsDouble(Values.toDouble(x), Values.toDouble(y));
          }
          throw Values.noMethod(name, args);
        });
  }

  private interface ComparisonResult {
    boolean test(int cmp);
  }

  private static void comparison(Context c, String name, ComparisonResult result) {
    define(
        c,
        name,
        2,
        2,
        (inv, args) -> {
          Object x = args[0];
          Object y = args[1];
          if (x instanceof Long a && y instanceof Long b) {
            return result.test(Long.compare(a, b));
          } else if (Values.isNumber(x) && Values.isNumber(y)) {
            double a = Values.toDouble(x);
            double b = Values.toDouble(y);
            // Every comparison involving NaN is false.
            return !Double.isNaN(a) && !Double.isNaN(b) && result.test(Double.compare(a, b));
          } else if (x instanceof String a && y instanceof String b) {
            return result.test(a.compareTo(b));
          }
          throw Values.noMethod(name, args);
        });
  }

  private static void trigonometric(Context c, String name, DoubleUnaryOperator fn) {
    define(
        c,
        name,
        1,
        1,
        (inv, args) -> {
          if (!Values.isNumber(args[0])) {
            throw Values.noMethod(name, args);
          }
          double x = Values.toDouble(args[0]);
          if (Double.isInfinite(x)) {
            throw ScriptError.Kind.DOMAIN_ERROR.error(
                "%s(x) is only defined for finite x, got %s", name, Values.repr(x));
          }
          return fn.applyAsDouble(x);
        });
  }

  private static Object multiply(Object x, Object y) {
    if (x instanceof Long a && y instanceof Long b) {
      return a * b;
    } else if (Values.isNumber(x) && Values.isNumber(y)) {
      return Values.toDouble(x) * Values.toDouble(y);
    } else if (x instanceof String a && y instanceof String b) {
      return a + b;
    }
    throw Values.noMethod("*", new Object[] {x, y});
  }

  /** Division always produces a double, but integer division by zero is an error. */
  private static Object divide(Object x, Object y) {
    if (x instanceof Long && y instanceof Long b && b == 0) {
      throw ScriptError.Kind.DIVIDE_ERROR.error("integer division error");
    } else if (Values.isNumber(x) && Values.isNumber(y)) {
      return Values.toDouble(x) / Values.toDouble(y);
    }
    throw Values.noMethod("/", new Object[] {x, y});
  }

  private static Object remainder(Object x, Object y) {
    if (x instanceof Long a && y instanceof Long b) {
      if (b == 0) {
        throw ScriptError.Kind.DIVIDE_ERROR.error("integer division error");
      }
      return a % b;
    } else if (Values.isNumber(x) && Values.isNumber(y)) {
      return Values.toDouble(x) % Values.toDouble(y);
    }
    throw Values.noMethod("%", new Object[] {x, y});
  }

  /** Integer division, truncating towards zero. */
  private static Object div(Object x, Object y) {
    if (x instanceof Long a && y instanceof Long b) {
      if (b == 0) {
        throw ScriptError.Kind.DIVIDE_ERROR.error("integer division error");
      }
      return a / b;
    } else if (Values.isNumber(x) && Values.isNumber(y)) {
      double b = Values.toDouble(y);
      if (b == 0) {
        throw ScriptError.Kind.DIVIDE_ERROR.error("integer division error");
      }
      double q = Values.toDouble(x) / b;
      return q < 0 ? Math.ceil(q) : Math.floor(q);
    }
    throw Values.noMethod("div", new Object[] {x, y});
  }

  private static Object negate(Object x) {
    if (x instanceof Long a) {
      return -a;
    } else if (x instanceof Double d) {
      return -d;
    }
    throw Values.noMethod("-", new Object[] {x});
  }

  private static boolean asBoolean(String fn, Object value) {
    if (value instanceof Boolean b) {
      return b;
    }
    throw Values.noMethod(fn, new Object[] {value});
  }

  private static Object range(Object first, Object last) {
    return new RangeValue(Values.asLong("range", first), Values.asLong("range", last));
  }

  private static Object sqrt(Object x) {
    if (!Values.isNumber(x)) {
      throw Values.noMethod("sqrt", new Object[] {x});
    }
    double d = Values.toDouble(x);
    if (d < 0) {
      throw ScriptError.Kind.DOMAIN_ERROR.error(
          "sqrt was called with a negative real argument %s", Values.repr(x));
    }
    return Math.sqrt(d);
  }

  private static Object abs(Object x) {
    if (x instanceof Long a) {
      return Math.abs(a);
    } else if (x instanceof Double d) {
      return Math.abs(d);
    }
    throw Values.noMethod("abs", new Object[] {x});
  }

  private static Object length(Object x) {
    if (x instanceof ArrayValue array) {
      return (long) array.length();
    } else if (x instanceof RangeValue range) {
      return range.length();
    } else if (x instanceof String s) {
      return (long) s.codePointCount(0, s.length());
    }
    throw Values.noMethod("length", new Object[] {x});
  }

  private static Object push(Invocation inv, Object[] args) {
    if (!(args[0] instanceof ArrayValue array)) {
      throw Values.noMethod("push", args);
    }
    for (int i = 1; i < args.length; i++) {
      array.push(args[i]);
    }
    return array;
  }

  private static Object sum(Object x) {
    Object total = 0L;
    Iterator<Object> it = iterator(x);
    while (it.hasNext()) {
      Object element = it.next();
      if (total instanceof Long a && element instanceof Long b) {
        total = a + b;
      } else if (Values.isNumber(element)) {
        total = Values.toDouble(total) + Values.toDouble(element);
      } else {
        throw Values.noMethod("+", new Object[] {total, element});
      }
    }
    return total;
  }

  private static Iterator<Object> iterator(Object x) {
    if (x instanceof ArrayValue array) {
      return array.iterator();
    } else if (x instanceof RangeValue range) {
      return range.iterator();
    } else if (x instanceof String s) {
      return s.codePoints().mapToObj(cp -> (Object) Character.toString(cp)).iterator();
    }
    throw Values.noMethod("iterate", new Object[] {x});
  }

  private static Object getIndex(Object target, Object index) {
    if (target instanceof ArrayValue array) {
      return array.get(Values.asLong("getindex", index));
    } else if (target instanceof RangeValue range) {
      return range.get(Values.asLong("getindex", index));
    }
    throw Values.noMethod("getindex", new Object[] {target, index});
  }

  private static Object setIndex(Object target, Object value, Object index) {
    if (target instanceof ArrayValue array) {
      array.set(Values.asLong("setindex!", index), value);
      return value;
    }
    throw Values.noMethod("setindex!", new Object[] {target, value, index});
  }

  private static Object getField(Object target, String name) {
    if (target instanceof StructValue struct) {
      return struct.field(name);
    } else if (target instanceof Context namespace) {
      return namespace.member(name);
    }
    throw ScriptError.Kind.ERROR_EXCEPTION.error(
        "type %s has no field %s", Values.typeName(target), name);
  }

  private static Object println(Invocation inv, Object[] args) {
    System.out.println(Arrays.stream(args).map(Values::display).collect(Collectors.joining()));
    return Nothing.INSTANCE;
  }

  /**
   * Runs another file, in full: {@code include(path)} runs it in the calling context, and {@code
   * include(namespace, path)} in the given namespace. The path is resolved relative to the
   * directory of the calling file.
   */
  private static Object include(Invocation inv, Object[] args) {
    Context target;
    Object path;
    if (args.length == 1) {
      target = inv.context();
      path = args[0];
    } else if (args[0] instanceof Context namespace) {
      target = namespace;
      path = args[1];
    } else if (args[0] instanceof Callable) {
      throw ScriptError.Kind.ARGUMENT_ERROR.error(
          "include with a mapping function is not supported");
    } else {
      throw Values.noMethod("include", args);
    }
    if (!(path instanceof String name)) {
      throw Values.noMethod("include", args);
    }
    Path file = SelectiveInterpreter.resolveInclude(inv.file(), name);
    new SelectiveInterpreter().runFile(Session.runEverything(file, target, inv.recorder()));
    return Nothing.INSTANCE;
  }
}
