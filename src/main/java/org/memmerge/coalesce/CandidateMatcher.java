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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import org.memmerge.ir.Exp;
import org.memmerge.ir.IxFun;
import org.memmerge.ir.MemBinding;
import org.memmerge.ir.MemId;
import org.memmerge.ir.PatElem;
import org.memmerge.ir.PrimExp;
import org.memmerge.ir.Scope;
import org.memmerge.ir.Stm;
import org.memmerge.ir.VarId;
import org.memmerge.liveness.LastUse;

/**
 * Recognizes the statements that make a memory block a coalescing candidate, and registers new
 * candidates in the active table.
 *
 * <p>Three shapes of statement are recognized:
 *
 * <ul>
 *   <li>{@code x = copy(b)}: b's block may be placed where x lives.
 *   <li>{@code x' = x with [slice] <- b} (b copied or referenced): b's block may be placed at the
 *       slice of x.
 *   <li>{@code x = concat(b_1, ..., b_n)}: each b_i's block may be placed at its offset in x.
 * </ul>
 *
 * In each case b must be last-used by the statement (safety condition 1).
 */
final class CandidateMatcher {

  private CandidateMatcher() {}

  /** A proposal to store {@code src} (in its whole block) at {@code dst}. */
  record Candidate(
      CoalescedKind kind, VarId dstVar, MemBinding dst, VarId srcVar, MemBinding src) {}

  static ImmutableList<Candidate> match(Stm.Let stm, LastUse lastUse, Scope scope) {
    if (stm.pattern.values().size() != 1) {
      return ImmutableList.of();
    }
    PatElem x = stm.pattern.values().get(0);
    if (x.mem == null) {
      return ImmutableList.of();
    }
    if (x.isInPlace()) {
      VarId b;
      if (stm.exp instanceof Exp.Copy copy) {
        b = copy.src;
      } else if (stm.exp instanceof Exp.VarRef ref) {
        b = ref.var;
      } else {
        return ImmutableList.of();
      }
      MemBinding dst = new MemBinding(x.mem.mem(), x.mem.ixfun().slice(x.update.slice()));
      return single(CoalescedKind.IN_PLACE, stm, x.update.source(), dst, b, lastUse, scope);
    } else if (stm.exp instanceof Exp.Copy copy) {
      return single(CoalescedKind.COPY, stm, x.name, x.mem, copy.src, lastUse, scope);
    } else if (stm.exp instanceof Exp.Concat concat) {
      return concat(stm, x, concat, lastUse, scope);
    }
    return ImmutableList.of();
  }

  private static ImmutableList<Candidate> single(
      CoalescedKind kind,
      Stm stm,
      VarId dstVar,
      MemBinding dst,
      VarId b,
      LastUse lastUse,
      Scope scope) {
    MemBinding src = scope.memOf(b);
    if (src == null || !lastUse.isLastUse(stm, b)) {
      return ImmutableList.of();
    }
    return ImmutableList.of(new Candidate(kind, dstVar, dst, b, src));
  }

  /**
   * Each operand of a concatenation that is last-used here is a candidate, placed at the running
   * total of the leading dimensions of the operands before it.
   */
  private static ImmutableList<Candidate> concat(
      Stm.Let stm, PatElem x, Exp.Concat concat, LastUse lastUse, Scope scope) {
    ImmutableList.Builder<Candidate> result = ImmutableList.builder();
    PrimExp offset = PrimExp.ZERO;
    for (VarId b : concat.args) {
      Scope.NameInfo info = scope.get(b);
      if (info == null || info.mem() == null || !info.type().isArray()) {
        break;
      }
      if (lastUse.isLastUse(stm, b)) {
        MemBinding dst = new MemBinding(x.mem.mem(), x.mem.ixfun().offsetIndex(offset));
        result.add(new Candidate(CoalescedKind.CONCAT, x.name, dst, b, info.mem()));
      }
      offset = PrimExp.add(offset, info.type().shape().get(0));
    }
    return result.build();
  }

  /**
   * Adds an active entry for each candidate of {@code stm} that passes the registration checks,
   * and returns the updated active table.
   *
   * <p>If the candidate's destination block is itself the source of an entry (in the active table
   * for in-place updates, in the success table otherwise), the candidate is redirected to that
   * entry's destination, and inherits its aliased blocks and dependencies.
   */
  static CoalsTable register(
      Stm.Let stm,
      LastUse lastUse,
      TopDownEnv td,
      CoalsTable success,
      CoalsTable active,
      Tracer tracer) {
    CoalsTable result = active;
    for (Candidate c : match(stm, lastUse, td.scope)) {
      MemId srcMem = c.src().mem();
      // A block is in at most one of the active and success tables.
      if (result.contains(srcMem) || success.contains(srcMem)) {
        continue;
      }
      MemId dstMem = c.dst().mem();
      IxFun dstIxFun = c.dst().ixfun();
      Set<MemId> aliases = ImmutableSet.of(dstMem);
      Map<VarId, MemId> deps = ImmutableMap.of();
      CoalsEntry parent =
          (c.kind() == CoalescedKind.IN_PLACE ? result : success).get(c.dst().mem());
      if (parent != null) {
        IxFun rebased = IxFun.rebase(parent.dstIxFun, dstIxFun);
        if (rebased == null) {
          continue;
        }
        dstMem = parent.dstMem;
        dstIxFun = rebased;
        aliases =
            ImmutableSet.<MemId>builder().addAll(parent.aliasedMems).add(c.dst().mem()).build();
        deps = parent.optDeps;
      }
      IxFun base = IxFun.solveBase(dstIxFun, c.src().ixfun());
      if (base == null || srcMem.equals(dstMem) || !td.alloc.contains(dstMem)) {
        continue;
      }
      if (td.inhibited.contains(srcMem, dstMem)) {
        if (tracer.enabled()) {
          tracer.trace("inhibited %s -> %s", srcMem, dstMem);
        }
        continue;
      }
      ImmutableSet.Builder<MemId> allAliases = ImmutableSet.<MemId>builder().addAll(aliases);
      aliases.forEach(m -> allAliases.addAll(td.loops.get(m)));
      Map<VarId, MemId> allDeps = new HashMap<>(deps);
      if (!dstMem.equals(c.dst().mem())) {
        allDeps.put(c.dstVar(), c.dst().mem());
      }
      Coalesced coal = new Coalesced(c.kind(), new MemBinding(dstMem, dstIxFun));
      CoalsEntry entry =
          new CoalsEntry(
              dstMem, base, allAliases.build(), ImmutableMap.of(c.srcVar(), coal), allDeps);
      if (tracer.enabled()) {
        tracer.trace("candidate %s (%s) -> %s", srcMem, c.srcVar(), dstMem);
      }
      result = result.with(srcMem, entry);
    }
    return result;
  }
}
