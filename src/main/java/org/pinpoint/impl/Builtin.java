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

/** A function implemented in Java. */
public final class Builtin implements Callable {

  /** The implementation of a builtin; the number of arguments has already been checked. */
  @FunctionalInterface
  interface Body {
    Object apply(Invocation invocation, Object[] args);
  }

  private final String name;
  private final int minArgs;

  /** The maximum number of arguments, or -1 if there is no limit. */
  private final int maxArgs;

  private final Body body;

  Builtin(String name, int minArgs, int maxArgs, Body body) {
    this.name = name;
    this.minArgs = minArgs;
    this.maxArgs = maxArgs;
    this.body = body;
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public Object call(Invocation invocation, Object[] args) {
    if (args.length < minArgs || (maxArgs >= 0 && args.length > maxArgs)) {
      throw Values.noMethod(name, args);
    }
    return body.apply(invocation, args);
  }

  @Override
  public String toString() {
    return name;
  }
}
