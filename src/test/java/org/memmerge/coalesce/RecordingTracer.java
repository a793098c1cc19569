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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** A Tracer that keeps the lines it is given. */
final class RecordingTracer implements Tracer {
  final List<String> lines = Collections.synchronizedList(new ArrayList<>());

  @Override
  public boolean enabled() {
    return true;
  }

  @Override
  public void trace(String fmt, Object... args) {
    lines.add(String.format(fmt, args));
  }
}
