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
 * Configuration for {@link MemoryBlockMerging}.
 *
 * <p>{@link #fromSystemProperties} reads {@code memmerge.trace} (print a trace of every decision
 * to stderr) and {@code memmerge.parallel} (analyze the functions of a program concurrently).
 * Both default to false.
 */
public final class CoalescingOptions {

  public static final CoalescingOptions DEFAULT = new CoalescingOptions(Tracer.NONE, false);

  public final Tracer tracer;
  public final boolean parallelFunctions;

  public CoalescingOptions(Tracer tracer, boolean parallelFunctions) {
    this.tracer = tracer;
    this.parallelFunctions = parallelFunctions;
  }

  public static CoalescingOptions fromSystemProperties() {
    boolean trace = Boolean.parseBoolean(System.getProperty("memmerge.trace", "false"));
    boolean parallel = Boolean.parseBoolean(System.getProperty("memmerge.parallel", "false"));
    return new CoalescingOptions(trace ? Tracer.to(System.err) : Tracer.NONE, parallel);
  }

  public CoalescingOptions withTracer(Tracer tracer) {
    return new CoalescingOptions(tracer, parallelFunctions);
  }

  public CoalescingOptions withParallelFunctions(boolean parallelFunctions) {
    return new CoalescingOptions(tracer, parallelFunctions);
  }
}
