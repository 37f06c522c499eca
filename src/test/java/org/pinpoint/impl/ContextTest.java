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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ContextTest {

  @Test
  public void lookupFallsBackToParent() {
    Context main = Context.newRoot("Main");
    main.define("x", 1L, false);
    Context a = main.namespace("A");
    a.define("y", 2L, false);
    assertThat(a.lookup("x")).isEqualTo(1L);
    assertThat(a.lookup("y")).isEqualTo(2L);
    assertThat(main.isBound("y")).isFalse();
    ScriptError e = assertThrows(ScriptError.class, () -> main.lookup("y"));
    assertThat(e.kind).isEqualTo(ScriptError.Kind.UNDEF_VAR_ERROR);
  }

  @Test
  public void assignmentInChildShadowsParent() {
    Context main = Context.newRoot("Main");
    main.define("x", 1L, false);
    Context a = main.namespace("A");
    a.define("x", 5L, false);
    assertThat(a.lookup("x")).isEqualTo(5L);
    assertThat(main.lookup("x")).isEqualTo(1L);
  }

  @Test
  public void memberIgnoresAncestors() {
    Context main = Context.newRoot("Main");
    main.define("x", 1L, false);
    Context a = main.namespace("A");
    ScriptError e = assertThrows(ScriptError.class, () -> a.member("x"));
    assertThat(e).hasMessageThat().isEqualTo("UndefVarError: Main.A.x not defined");
  }

  @Test
  public void namespacesAreReopened() {
    Context main = Context.newRoot("Main");
    Context a = main.namespace("A");
    assertThat(main.namespace("A")).isSameInstanceAs(a);
    assertThat(main.member("A")).isSameInstanceAs(a);
    assertThat(a.namespace("B").qualifiedName()).isEqualTo("Main.A.B");
    assertThat(main.qualifiedName()).isEqualTo("Main");
  }

  @Test
  public void constants() {
    Context main = Context.newRoot("Main");
    main.define("K", 1L, true);
    ScriptError e = assertThrows(ScriptError.class, () -> main.define("K", 2L, false));
    assertThat(e).hasMessageThat().contains("invalid redefinition of constant K");
    main.define("v", 1L, false);
    e = assertThrows(ScriptError.class, () -> main.define("v", 2L, true));
    assertThat(e).hasMessageThat().contains("cannot declare v constant");
  }

  @Test
  public void builtinsAreVisible() {
    Context main = Context.newRoot("Main");
    assertThat(main.lookup("div")).isNotNull();
    assertThat(main.isBound("div")).isFalse();
  }
}
