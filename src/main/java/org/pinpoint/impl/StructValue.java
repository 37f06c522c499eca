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
import java.util.stream.Collectors;

/** An instance of a {@link StructType}. Instances are immutable. */
public record StructValue(StructType type, ImmutableList<Object> values) {

  /**
   * Returns the value of the named field.
   *
   * @throws ScriptError if the type has no such field
   */
  public Object field(String name) {
    int i = type.fields.indexOf(name);
    if (i < 0) {
      throw ScriptError.Kind.ERROR_EXCEPTION.error("type %s has no field %s", type.name(), name);
    }
    return values.get(i);
  }

  @Override
  public String toString() {
    return type.name()
        + values.stream().map(Values::display).collect(Collectors.joining(", ", "(", ")"));
  }
}
