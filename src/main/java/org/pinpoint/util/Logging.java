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

package org.pinpoint.util;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;

/** Access to the logger shared by all of Pinpoint. */
public final class Logging {

  private static final String LOGGER_NAME = "org.pinpoint";

  /** Messages already emitted, keyed by level. */
  private static final Set<Map.Entry<Level, String>> emitted = new HashSet<>();

  // Static methods only
  private Logging() {}

  public static Logger getLogger() {
    return Logger.getLogger(LOGGER_NAME);
  }

  /** Makes the Pinpoint logger emit debug output (or returns it to its configured level). */
  public static void setVerbose(boolean verbose) {
    getLogger().setLevel(verbose ? Level.DEBUG : null);
  }

  /** Returns true if {@code msg} has not previously been emitted at {@code level}. */
  public static synchronized boolean addEmitted(Level level, String msg) {
    return emitted.add(Map.entry(level, msg));
  }

  /** Logs a warning, unless the same warning has already been logged by this process. */
  public static void uniqueWarn(String msg) {
    if (addEmitted(Level.WARN, msg)) {
      getLogger().warn(msg);
    } else {
      getLogger().debug("Duplicate warning: " + msg);
    }
  }
}
