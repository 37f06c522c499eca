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

import java.util.Arrays;
import java.util.Iterator;
import java.util.Objects;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;

/**
 * Static helpers for working with script values.
 *
 * <p>Script values are represented by {@link Long} (integers), {@link Double}, {@link String},
 * {@link Boolean}, {@link Nothing}, {@link ArrayValue}, {@link RangeValue}, {@link StructValue},
 * {@link Context} (a namespace) and {@link Callable} (functions and struct types).
 */
public final class Values {

  /** The relative tolerance used by {@code ~=}. */
  static final double APPROX_TOLERANCE = 1e-8;

  // Static methods only
  private Values() {}

  /** Returns the name of the script-level type of {@code value}. */
  public static String typeName(@Nullable Object value) {
    if (value instanceof Long) {
      return "Int64";
    } else if (value instanceof Double) {
      return "Float64";
    } else if (value instanceof String) {
      return "String";
    } else if (value instanceof Boolean) {
      return "Bool";
    } else if (value instanceof ArrayValue) {
      return "Array";
    } else if (value instanceof RangeValue) {
      return "Range";
    } else if (value instanceof StructValue struct) {
      return struct.type().name();
    } else if (value instanceof StructType) {
      return "DataType";
    } else if (value instanceof Context) {
      return "Module";
    } else if (value instanceof Callable) {
      return "Function";
    }
    return "Nothing";
  }

  /** Returns a string for {@code value} as it would be printed; strings are not quoted. */
  public static String display(@Nullable Object value) {
    return (value instanceof String s) ? s : repr(value);
  }

  /** Returns a string for {@code value} as it would appear in source; strings are quoted. */
  public static String repr(@Nullable Object value) {
    if (value instanceof String s) {
      return '"' + s.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n") + '"';
    } else if (value instanceof Double d) {
      if (d.isNaN()) {
        return "NaN";
      } else if (d.isInfinite()) {
        return d > 0 ? "Inf" : "-Inf";
      }
      return d.toString();
    } else if (value instanceof ArrayValue array) {
      StringBuilder sb = new StringBuilder("[");
      for (Object element : array) {
        if (sb.length() > 1) {
          sb.append(", ");
        }
        sb.append(repr(element));
      }
      return sb.append(']').toString();
    }
    return String.valueOf(value == null ? Nothing.INSTANCE : value);
  }

  /** Script equality ({@code ==}): numbers compare by value, collections element-wise. */
  public static boolean equal(Object a, Object b) {
    if (isNumber(a) && isNumber(b)) {
      if (a instanceof Long x && b instanceof Long y) {
        return x.longValue() == y.longValue();
      }
      return toDouble(a) == toDouble(b);
    } else if (a instanceof ArrayValue x && b instanceof ArrayValue y) {
      return x.length() == y.length() && allPairs(x, y, Values::equal);
    }
    return Objects.equals(a, b);
  }

  /** Approximate equality ({@code ~=}). */
  public static boolean isApprox(Object a, Object b) {
    if (isNumber(a) && isNumber(b)) {
      double x = toDouble(a);
      double y = toDouble(b);
      return x == y || Math.abs(x - y) <= APPROX_TOLERANCE * Math.max(Math.abs(x), Math.abs(y));
    } else if (a instanceof ArrayValue x && b instanceof ArrayValue y) {
      return x.length() == y.length() && allPairs(x, y, Values::isApprox);
    }
    throw noMethod("isapprox", new Object[] {a, b});
  }

  private interface Comparison {
    boolean test(Object a, Object b);
  }

  private static boolean allPairs(ArrayValue x, ArrayValue y, Comparison comparison) {
    Iterator<Object> ix = x.iterator();
    Iterator<Object> iy = y.iterator();
    while (ix.hasNext()) {
      if (!comparison.test(ix.next(), iy.next())) {
        return false;
      }
    }
    return true;
  }

  public static boolean isNumber(Object value) {
    return value instanceof Long || value instanceof Double;
  }

  static double toDouble(Object value) {
    return ((Number) value).doubleValue();
  }

  /** Returns {@code value} as a long, or throws a MethodError naming {@code fn}. */
  static long asLong(String fn, Object value) {
    if (value instanceof Long n) {
      return n;
    }
    throw noMethod(fn, new Object[] {value});
  }

  static String asString(String fn, Object value) {
    if (value instanceof String s) {
      return s;
    }
    throw noMethod(fn, new Object[] {value});
  }

  /** Returns {@code value} as a Callable, or throws a MethodError if it cannot be called. */
  public static Callable asCallable(Object value) {
    if (value instanceof Callable callable) {
      return callable;
    }
    throw ScriptError.Kind.METHOD_ERROR.error(
        "objects of type %s are not callable", typeName(value));
  }

  /** Returns a MethodError for a call of {@code fn} with arguments of unsupported types. */
  public static ScriptError noMethod(String fn, Object[] args) {
    return ScriptError.Kind.METHOD_ERROR.error(
        "no method matching %s(%s)",
        fn,
        Arrays.stream(args).map(Values::typeName).collect(Collectors.joining(", ")));
  }
}
