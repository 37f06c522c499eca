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
import com.google.common.collect.ImmutableSortedSet;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.stream.Collectors;
import org.apache.log4j.Logger;
import org.jspecify.annotations.Nullable;
import org.pinpoint.code.CodeUnit;
import org.pinpoint.code.DependencyClosure;
import org.pinpoint.code.SelectionVector;
import org.pinpoint.code.StatementGraph;
import org.pinpoint.compiler.Compiler;
import org.pinpoint.compiler.Lowering;
import org.pinpoint.compiler.Node;
import org.pinpoint.compiler.SourceFile;
import org.pinpoint.match.Pattern;
import org.pinpoint.match.SyntaxMatcher;
import org.pinpoint.util.Logging;

/**
 * Runs a file one top-level statement at a time. Statements that are not test declarations (the
 * file's dependencies) are always run in full. A test declaration is skipped unless the session has
 * patterns for the file; if it does, only the instructions needed to run the selected lines of the
 * statement are executed.
 *
 * <p>Calls made by executed instructions go through {@link #evaluateCall}, which runs {@code
 * include} calls selectively (with the same session) and everything else natively.
 */
public class SelectiveInterpreter {

  private static final Logger logger = Logging.getLogger();

  /**
   * Processes {@code session.file}.
   *
   * @throws ScriptError if a dependency statement raises an error, or the file cannot be read
   * @throws org.pinpoint.compiler.SyntaxError if the file cannot be parsed
   */
  public void runFile(Session session) {
    SourceFile source;
    try {
      source = SourceFile.read(session.file);
    } catch (IOException e) {
      throw new ScriptError(
          ScriptError.Kind.LOAD_ERROR,
          String.format("could not open file %s (%s)", session.file, e),
          e);
    }
    Node root = Compiler.parse(source);
    ImmutableSortedSet<Integer> lines = ImmutableSortedSet.of();
    ImmutableList<Pattern> patterns = session.patternsForFile();
    if (!session.runEverything && patterns != null && !patterns.isEmpty()) {
      lines = SyntaxMatcher.matchedLines(root, patterns, session.filterForFile());
      if (logger.isDebugEnabled()) {
        logger.debug(String.format("%s: matched lines %s", source.displayName(), lines));
      }
    }
    for (Node statement : root.children) {
      runStatement(session, source, statement, lines);
    }
  }

  private void runStatement(
      Session session, SourceFile source, Node statement, ImmutableSortedSet<Integer> lines) {
    if (statement.kind == Node.Kind.NAMESPACE) {
      Session inner = session.withContext(session.context.namespace(statement.text));
      for (Node child : statement.child(0).children) {
        runStatement(inner, source, child, lines);
      }
      return;
    }
    if (session.runEverything || !statement.isTestDeclaration()) {
      execute(session, Lowering.lowerFragment(source, statement), null);
      return;
    }
    ImmutableList<Pattern> patterns = session.patternsForFile();
    if (patterns == null || patterns.isEmpty()) {
      if (logger.isDebugEnabled()) {
        logger.debug(
            String.format(
                "%s:%s: skipping %s (no patterns)",
                source.displayName(), statement.firstLine, describe(statement)));
      }
      return;
    }
    if (lines.subSet(statement.firstLine, true, statement.lastLine, true).isEmpty()) {
      if (logger.isDebugEnabled()) {
        logger.debug(
            String.format(
                "%s:%s: skipping %s (not selected)",
                source.displayName(), statement.firstLine, describe(statement)));
      }
      return;
    }
    CodeUnit unit = Lowering.lowerFragment(source, statement);
    StatementGraph graph = StatementGraph.build(unit);
    SelectionVector selection = DependencyClosure.compute(graph, source.path, lines);
    if (logger.isDebugEnabled()) {
      logger.debug(
          String.format(
              "%s:%s: running %s of %s instructions of %s: %s",
              source.displayName(),
              statement.firstLine,
              selection.count(),
              selection.size(),
              describe(statement),
              selection));
    }
    execute(session, unit, selection);
  }

  private void execute(Session session, CodeUnit unit, @Nullable SelectionVector selection) {
    new Executor(
            unit,
            session.context,
            session.recorder,
            selection,
            (invocation, callee, args) -> evaluateCall(session, invocation, callee, args))
        .run();
  }

  private static String describe(Node statement) {
    return (statement.kind == Node.Kind.TESTGROUP)
        ? String.format("testgroup \"%s\"", statement.text)
        : statement.text;
  }

  /**
   * Evaluates a call made by selectively executed code. Calls of {@code include} are run
   * selectively in {@code session}; all other calls are evaluated natively.
   */
  protected Object evaluateCall(
      Session session, Invocation invocation, Object callee, Object[] args) {
    if (callee == Builtins.INCLUDE) {
      if (args.length == 1 && args[0] instanceof String path) {
        return include(session, invocation.context(), path);
      } else if (args.length == 2 && args[0] instanceof Context namespace
          && args[1] instanceof String path) {
        return include(session, namespace, path);
      } else if (args.length == 2 && args[0] instanceof Callable) {
        Logging.uniqueWarn(
            "include with a mapping function cannot be run selectively; evaluating it natively");
      } else {
        Logging.uniqueWarn(
            "include with arguments of types "
                + Arrays.stream(args).map(Values::typeName).collect(Collectors.toList())
                + " cannot be run selectively; evaluating it natively");
      }
    }
    return Executor.NATIVE.call(invocation, callee, args);
  }

  private Object include(Session session, Context context, String path) {
    Path file = resolveInclude(session.file, path);
    if (logger.isDebugEnabled()) {
      logger.debug(String.format("%s: including %s", session.file.getFileName(), file));
    }
    runFile(session.withFile(file).withContext(context));
    return Nothing.INSTANCE;
  }

  /** Resolves the path given to {@code include} relative to the directory of the including file. */
  static Path resolveInclude(Path includingFile, String path) {
    Path dir = Session.normalize(includingFile).getParent();
    return Session.normalize(dir.resolve(path));
  }
}
