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

/** A struct type; calling it constructs an instance from one argument per field. */
public final class StructType implements Callable {

  private final String name;
  public final ImmutableList<String> fields;

  public StructType(String name, ImmutableList<String> fields) {
    this.name = name;
    this.fields = fields;
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public Object call(Invocation invocation, Object[] args) {
    if (args.length != fields.size()) {
      throw Values.noMethod(name, args);
    }
    return new StructValue(this, ImmutableList.copyOf(args));
  }

  @Override
  public String toString() {
    return name;
  }
}
