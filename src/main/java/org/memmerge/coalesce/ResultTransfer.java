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

import com.google.common.collect.ImmutableMap;
import org.jspecify.annotations.Nullable;
import org.memmerge.ir.IxFun;
import org.memmerge.ir.MemBinding;
import org.memmerge.ir.MemId;
import org.memmerge.ir.PatElem;
import org.memmerge.ir.Scope;
import org.memmerge.ir.VarId;

/**
 * Moves a candidate for the pattern element of a branch or loop statement onto the array that
 * supplies its value (a body result, a loop parameter or a loop initializer).
 */
final class ResultTransfer {

  private ResultTransfer() {}

  /**
   * Connects pattern variable {@code patVar} (in {@code patMem}) to {@code resVar}, which lives at
   * {@code resMem}; {@code resBase} is where {@code resMem}'s base goes if the candidate succeeds.
   */
  record Link(VarId patVar, MemId patMem, VarId resVar, MemBinding resMem, IxFun resBase) {}

  /**
   * Returns the link from {@code pe} to {@code resVar}, or null if {@code pe} has no active
   * candidate or {@code resVar} isn't an array whose layout can follow it.
   */
  static @Nullable Link link(CoalsTable active, PatElem pe, @Nullable VarId resVar, Scope scope) {
    if (pe.mem == null || resVar == null) {
      return null;
    }
    CoalsEntry entry = active.get(pe.mem.mem());
    Coalesced coal = (entry == null) ? null : entry.vars.get(pe.name);
    MemBinding resMem = scope.memOf(resVar);
    if (coal == null || resMem == null) {
      return null;
    }
    IxFun base = IxFun.solveBase(coal.target().ixfun(), resMem.ixfun());
    return (base == null) ? null : new Link(pe.name, pe.mem.mem(), resVar, resMem, base);
  }

  /**
   * Records {@code link.resVar} in the active table, at the same destination as {@code
   * link.patVar}. If the two share a block the variable is added to that block's entry; otherwise
   * the result's block gets its own entry, depending on the pattern's.
   */
  static BottomUpEnv transfer(BottomUpEnv env, Link link, Tracer tracer, String function) {
    CoalsEntry entry = env.active.get(link.patMem());
    Coalesced coal = (entry == null) ? null : entry.vars.get(link.patVar());
    if (coal == null) {
      throw new CoalescingInvariantException(
          function, "no active candidate for " + link.patVar() + " in " + link.patMem());
    }
    MemId resMem = link.resMem().mem();
    if (resMem.equals(link.patMem())) {
      CoalsEntry updated = entry.withOptDep(link.resVar(), resMem).withVar(link.resVar(), coal);
      return env.withActive(env.active.with(resMem, updated));
    }
    CoalsEntry resEntry =
        new CoalsEntry(
                entry.dstMem, link.resBase(), entry.aliasedMems, ImmutableMap.of(), entry.optDeps)
            .withVar(link.resVar(), coal)
            .withOptDep(link.patVar(), link.patMem());
    BottomUpEnv result =
        env.withActive(
            env.active.with(link.patMem(), entry.withOptDep(link.resVar(), resMem)));
    CoalsEntry existing = result.active.get(resMem);
    if (existing != null) {
      if (existing.conflictsWith(resEntry)) {
        result = result.markFailed(resMem, tracer, "conflicting candidate for " + link.resVar());
      } else {
        resEntry = existing.union(resEntry);
      }
    }
    return result.withActive(result.active.with(resMem, resEntry));
  }
}
