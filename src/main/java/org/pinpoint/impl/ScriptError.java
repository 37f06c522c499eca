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

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.FormatMethod;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.pinpoint.code.SourcePos;

/**
 * An error raised while running a script. Each ScriptError has a {@link Kind} (the script-level
 * type of the error) and accumulates a script stack trace as it propagates out of the units being
 * executed.
 */
public class ScriptError extends RuntimeException {

  /** The script-level error types. */
  public enum Kind {
    ERROR_EXCEPTION("ErrorException"),
    DIVIDE_ERROR("DivideError"),
    DOMAIN_ERROR("DomainError"),
    BOUNDS_ERROR("BoundsError"),
    UNDEF_VAR_ERROR("UndefVarError"),
    METHOD_ERROR("MethodError"),
    ARGUMENT_ERROR("ArgumentError"),
    TYPE_ERROR("TypeError"),
    LOAD_ERROR("LoadError"),
    /** A Java exception escaped from the implementation of a builtin. */
    INTERNAL_ERROR("InternalError");

    /** The name by which scripts and reports refer to this kind of error. */
    public final String typeName;

    Kind(String typeName) {
      this.typeName = typeName;
    }

    /** Returns a new ScriptError of this kind. */
    @FormatMethod
    public ScriptError error(String fmt, Object... fmtArgs) {
      return new ScriptError(this, String.format(fmt, fmtArgs), null);
    }
  }

  public final Kind kind;

  /** The script-level message, without the kind. */
  public final String msg;

  /** One entry of the script stack trace. */
  private record Frame(String unitName, SourcePos pos) {
    @Override
    public String toString() {
      return String.format("%s at %s", unitName, pos);
    }
  }

  private final List<Frame> stack = new ArrayList<>();

  ScriptError(Kind kind, String msg, @Nullable Throwable cause) {
    super(kind.typeName + ": " + msg, cause);
    this.kind = kind;
    this.msg = msg;
  }

  /** Returns a ScriptError of kind {@link Kind#INTERNAL_ERROR} that wraps {@code e}. */
  public static ScriptError wrap(RuntimeException e) {
    return new ScriptError(Kind.INTERNAL_ERROR, String.valueOf(e), e);
  }

  /** Adds an entry to the script stack trace; entries are added innermost first. */
  void addTrace(String unitName, SourcePos pos) {
    stack.add(new Frame(unitName, pos));
  }

  /** Returns the position most recently added to the stack trace, or null if there is none. */
  @Nullable SourcePos lastPosition() {
    return stack.isEmpty() ? null : stack.get(stack.size() - 1).pos;
  }

  /**
   * Returns the script stack trace: one entry for each unit the error propagated through, starting
   * with the unit in which it was raised.
   */
  public ImmutableList<String> stack() {
    return stack.stream().map(Frame::toString).collect(ImmutableList.toImmutableList());
  }
}
