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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/** The text of a source file, with the (absolute, normalized) path it was read from. */
public final class SourceFile {
  public final Path path;
  public final String text;

  private SourceFile(Path path, String text) {
    this.path = path;
    this.text = text;
  }

  /** Returns a SourceFile with the given contents; {@code path} is used only for identification. */
  public static SourceFile of(Path path, String text) {
    return new SourceFile(path.toAbsolutePath().normalize(), text);
  }

  /** Reads the file at {@code path}. */
  public static SourceFile read(Path path) throws IOException {
    return of(path, Files.readString(path));
  }

  /** Returns the source text spanned by {@code node}. */
  public String textOf(Node node) {
    return text.substring(node.startIndex, node.stopIndex + 1);
  }

  /** The file name, without its directory; used in error messages. */
  public String displayName() {
    Path name = path.getFileName();
    return (name == null) ? path.toString() : name.toString();
  }

  @Override
  public String toString() {
    return path.toString();
  }
}
