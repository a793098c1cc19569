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
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.Map;
import org.memmerge.ir.FunDef;
import org.memmerge.ir.MemId;
import org.memmerge.ir.Param;
import org.memmerge.ir.Scope;
import org.memmerge.ir.VarId;
import org.memmerge.liveness.LastUse;
import org.memmerge.liveness.LastUseAnalysis;

/**
 * Array coalescing: finds arrays whose memory block can be replaced by (a region of) the block of
 * the array they are eventually copied into, so that the copy becomes a no-op.
 *
 * <p>Each traversal of the function body may fail candidates that an earlier decision relied on,
 * so the analysis runs to a fixed point: after each traversal, the failures it recorded are added
 * to the inhibition table and the body is traversed again, with the inhibited pairs no longer
 * considered. Since inhibitions only grow and there are finitely many pairs of blocks, this
 * terminates; the success table of the first traversal that adds no new inhibition is the result.
 *
 * <p>Within a traversal, a committed candidate can also depend on others (recorded in {@link
 * CoalsEntry#optDeps}), e.g. the source of an in-place update into an array that is itself
 * coalesced. After the traversal, candidates whose dependencies were dropped are dropped in turn,
 * until nothing changes.
 */
public final class ArrayCoalescing {

  private ArrayCoalescing() {}

  public static CoalescingResult analyze(FunDef fun) {
    return analyze(fun, LastUseAnalysis.analyze(fun), CoalescingOptions.DEFAULT);
  }

  public static CoalescingResult analyze(FunDef fun, LastUse lastUse, CoalescingOptions options) {
    Tracer tracer = options.tracer;
    BodyTraversal traversal = new BodyTraversal(lastUse, tracer, fun.name());
    Scope scope = Scope.EMPTY.withParams(fun.params());
    ImmutableList<MemId> paramMems =
        fun.params().stream()
            .filter(p -> p.mem() != null)
            .map(p -> p.mem().mem())
            .collect(ImmutableList.toImmutableList());
    ImmutableSet<MemId> uniqueMems =
        fun.params().stream()
            .filter(ArrayCoalescing::isDestinationParam)
            .map(p -> p.mem().mem())
            .collect(ImmutableSet.toImmutableSet());
    MemRelation inhibited = MemRelation.EMPTY;
    for (int iteration = 1; ; iteration++) {
      TopDownEnv td = TopDownEnv.initial(scope, uniqueMems, inhibited);
      BottomUpEnv env = traversal.analyzeBody(fun.body(), td, BottomUpEnv.EMPTY);
      // Parameters are never defined in the body, so their candidates can't be decided.
      for (MemId mem : paramMems) {
        env = env.markFailed(mem, tracer, "source is a function parameter");
      }
      if (!env.active.isEmpty()) {
        throw new CoalescingInvariantException(
            fun.name(), "candidates still pending after traversal: " + env.active.keys());
      }
      for (MemId mem : paramMems) {
        env = env.markCommittedFailed(mem);
      }
      env = filterDependencies(env, tracer);
      MemRelation merged = inhibited.union(env.inhibit);
      if (tracer.enabled()) {
        tracer.trace(
            "%s: iteration %s, %s committed, %s inhibited",
            fun.name(), iteration, env.success.size(), merged.pairCount());
      }
      if (merged.equals(inhibited)) {
        return new CoalescingResult(env.success, merged, iteration);
      }
      inhibited = merged;
    }
  }

  /**
   * Repeatedly drops committed candidates that depend on a variable no longer recorded by the
   * entry it was expected in, until the success table stops shrinking.
   */
  @VisibleForTesting
  static BottomUpEnv filterDependencies(BottomUpEnv env, Tracer tracer) {
    BottomUpEnv result = env;
    int before;
    do {
      before = result.success.size();
      for (MemId mem : result.success.keys()) {
        CoalsEntry entry = result.success.get(mem);
        if (entry != null && !dependenciesHold(entry, result.success)) {
          if (tracer.enabled()) {
            tracer.trace("failed %s -> %s: dependency dropped", mem, entry.dstMem);
          }
          result = result.markCommittedFailed(mem);
        }
      }
    } while (result.success.size() != before);
    return result;
  }

  private static boolean dependenciesHold(CoalsEntry entry, CoalsTable success) {
    for (Map.Entry<VarId, MemId> dep : entry.optDeps.entrySet()) {
      CoalsEntry other = success.get(dep.getValue());
      if (other == null || !other.vars.containsKey(dep.getKey())) {
        return false;
      }
    }
    return true;
  }

  /** True if {@code param}'s block could serve as a coalescing destination. */
  private static boolean isDestinationParam(Param param) {
    return param.unique() && param.mem() != null;
  }
}
