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

/**
 * Thrown when the analysis finds its own state inconsistent, e.g. a candidate still pending when
 * the whole function has been traversed. This indicates a bug in the analysis or malformed input,
 * never an unsafe program.
 */
public class CoalescingInvariantException extends RuntimeException {
  public final String function;

  public CoalescingInvariantException(String function, String msg) {
    super(msg);
    this.function = function;
  }

  @Override
  public String getMessage() {
    return String.format("%s (in %s)", super.getMessage(), function);
  }
}
