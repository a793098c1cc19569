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

package org.memmerge.coalesce;

import com.google.errorprone.annotations.FormatMethod;
import java.io.PrintStream;

/**
 * Receives a line of text for each decision the coalescing analysis makes (a candidate
 * registered, promoted or failed, a fixed-point iteration finished). Tracing is for humans
 * debugging the analysis; nothing depends on its output.
 */
public interface Tracer {

  /** A Tracer that discards everything. */
  Tracer NONE =
      new Tracer() {
        @Override
        public boolean enabled() {
          return false;
        }

        @Override
        public void trace(String fmt, Object... args) {}
      };

  /** False if calls to {@link #trace} will be ignored, so callers can skip building arguments. */
  boolean enabled();

  @FormatMethod
  void trace(String fmt, Object... args);

  /** Returns a Tracer that prints each line to {@code out}, prefixed with {@code "** "}. */
  static Tracer to(PrintStream out) {
    return new Tracer() {
      @Override
      public boolean enabled() {
        return true;
      }

      @Override
      @FormatMethod
      public void trace(String fmt, Object... args) {
        out.print("** " + String.format(fmt, args) + "\n");
      }
    };
  }
}
