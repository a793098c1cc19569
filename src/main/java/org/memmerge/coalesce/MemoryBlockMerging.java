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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableMap;
import java.util.stream.Stream;
import org.memmerge.ir.FunDef;
import org.memmerge.ir.Prog;
import org.memmerge.liveness.LastUse;
import org.memmerge.liveness.LastUseAnalysis;

/**
 * The memory-block merging pass: runs {@link ArrayCoalescing} on every function of a program and
 * returns each function's committed coalescings.
 *
 * <p>Functions are analyzed independently (concurrently, if {@link
 * CoalescingOptions#parallelFunctions} is set). If the analysis of a function finds its own state
 * inconsistent, that function is reported with no coalescings rather than failing the whole pass;
 * doing nothing is always safe.
 */
public final class MemoryBlockMerging {

  public static final String NAME = "merge memory blocks";
  public static final String DESCRIPTION =
      "Transform program to reuse non-interfering memory blocks";

  /** The per-function analysis; {@link ArrayCoalescing#analyze} except in tests. */
  @VisibleForTesting
  interface FunctionAnalysis {
    CoalescingResult analyze(FunDef fun, LastUse lastUse, CoalescingOptions options);
  }

  private final CoalescingOptions options;
  private final FunctionAnalysis analysis;

  @VisibleForTesting
  MemoryBlockMerging(CoalescingOptions options, FunctionAnalysis analysis) {
    this.options = options;
    this.analysis = analysis;
  }

  public MemoryBlockMerging(CoalescingOptions options) {
    this(options, ArrayCoalescing::analyze);
  }

  public MemoryBlockMerging() {
    this(CoalescingOptions.fromSystemProperties());
  }

  /** Returns a map from function name to that function's success table, in program order. */
  public ImmutableMap<String, CoalsTable> run(Prog prog) {
    Stream<FunDef> functions =
        options.parallelFunctions
            ? prog.functions().parallelStream()
            : prog.functions().stream();
    return functions.collect(ImmutableMap.toImmutableMap(FunDef::name, this::analyzeFunction));
  }

  private CoalsTable analyzeFunction(FunDef fun) {
    Tracer tracer = options.tracer;
    LastUse lastUse = LastUseAnalysis.analyze(fun);
    try {
      CoalescingResult result = analysis.analyze(fun, lastUse, options);
      if (tracer.enabled()) {
        tracer.trace("%s", CoalescingReport.format(fun, lastUse, result));
      }
      return result.success();
    } catch (CoalescingInvariantException e) {
      tracer.trace("skipping %s: %s", fun.name(), e.getMessage());
      return CoalsTable.EMPTY;
    }
  }
}
