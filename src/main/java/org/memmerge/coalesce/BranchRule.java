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
import com.google.common.collect.Sets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.memmerge.ir.Body;
import org.memmerge.ir.Exp;
import org.memmerge.ir.MemId;
import org.memmerge.ir.PatElem;
import org.memmerge.ir.Pattern;
import org.memmerge.ir.PrimExp;
import org.memmerge.ir.Scope;
import org.memmerge.ir.Stm;
import org.memmerge.ir.VarId;

/**
 * Handles {@code let b = if c then {... r1} else {... r2}}.
 *
 * <p>A candidate for b succeeds only if it can be pushed into both branches: r1 and r2 must each
 * be coalesced into b's destination by their branch. The one exception is when b, r1 and r2 all
 * share a block (typically a chain of in-place updates), in which case the candidate stays active
 * until that block's original array is defined.
 */
final class BranchRule {
  private final BodyTraversal traversal;

  BranchRule(BodyTraversal traversal) {
    this.traversal = traversal;
  }

  /** The links from one pattern element to the corresponding result of each branch. */
  private record Arms(ResultTransfer.Link then, ResultTransfer.Link otherwise) {
    MemId patMem() {
      return then.patMem();
    }
  }

  BottomUpEnv analyze(Stm.Let stm, Exp.If exp, TopDownEnv td, BottomUpEnv bu) {
    Tracer tracer = traversal.tracer;
    Pattern pattern = stm.pattern;
    BottomUpEnv env = SafetyChecks.filterAllocAndIxFun(pattern.values(), td, bu, tracer);
    env = SafetyChecks.filterExistential(pattern, env, tracer);

    // Find the branch results of each pattern element with an active candidate.
    int nCtx = pattern.context().size();
    Scope thenScope = td.scope.withStms(exp.thenBody.stms());
    Scope elseScope = td.scope.withStms(exp.elseBody.stms());
    List<Arms> arms = new ArrayList<>();
    List<MemId> unlinked = new ArrayList<>();
    for (int i = 0; i < pattern.values().size(); i++) {
      PatElem pe = pattern.values().get(i);
      if (pe.mem == null || !env.active.contains(pe.mem.mem())) {
        continue;
      }
      ResultTransfer.Link thenLink =
          ResultTransfer.link(env.active, pe, result(exp.thenBody, nCtx + i), thenScope);
      ResultTransfer.Link elseLink =
          ResultTransfer.link(env.active, pe, result(exp.elseBody, nCtx + i), elseScope);
      if (thenLink == null || elseLink == null) {
        unlinked.add(pe.mem.mem());
      } else {
        arms.add(new Arms(thenLink, elseLink));
      }
    }
    for (MemId mem : unlinked) {
      env = env.markFailed(mem, tracer, "branch results cannot follow the pattern");
    }
    CoalsTable activeBefore = env.active;
    arms.removeIf(a -> !activeBefore.contains(a.patMem()));

    // Push the candidates into each branch.
    BottomUpEnv thenStart = env;
    BottomUpEnv elseStart = env;
    for (Arms a : arms) {
      thenStart = ResultTransfer.transfer(thenStart, a.then, tracer, traversal.function);
      elseStart = ResultTransfer.transfer(elseStart, a.otherwise, tracer, traversal.function);
    }
    // The pattern's own entry is settled below, after both branches are done.
    for (Arms a : arms) {
      if (!a.then.resMem().mem().equals(a.patMem())) {
        thenStart = thenStart.withActive(thenStart.active.without(a.patMem()));
      }
      if (!a.otherwise.resMem().mem().equals(a.patMem())) {
        elseStart = elseStart.withActive(elseStart.active.without(a.patMem()));
      }
    }
    BottomUpEnv thenEnv = traversal.analyzeBody(exp.thenBody, td, thenStart);
    BottomUpEnv elseEnv = traversal.analyzeBody(exp.elseBody, td, elseStart);

    // Settle each pattern element's candidate.
    for (Arms a : arms) {
      env = settle(a, env, thenEnv, elseEnv, tracer);
    }

    // Candidates still pending must be pending on both paths.
    CoalsTable active = thenEnv.active.intersect(elseEnv.active.intersect(env.active));
    MemRelation inhibit = env.inhibit.union(thenEnv.inhibit).union(elseEnv.inhibit);
    inhibit = thenEnv.active.minus(active).recordFailures(inhibit);
    inhibit = elseEnv.active.minus(active).recordFailures(inhibit);

    // Merge the committed candidates, rejecting any block the branches sent to different places.
    CoalsTable success = env.success;
    List<MemId> conflicts = new ArrayList<>();
    for (CoalsTable branchSuccess : ImmutableList.of(thenEnv.success, elseEnv.success)) {
      for (Map.Entry<MemId, CoalsEntry> e : branchSuccess.entries().entrySet()) {
        CoalsEntry prev = success.get(e.getKey());
        if (prev == null) {
          success = success.with(e.getKey(), e.getValue());
        } else if (prev.conflictsWith(e.getValue())) {
          conflicts.add(e.getKey());
          inhibit = inhibit.add(e.getKey(), prev.dstMem).add(e.getKey(), e.getValue().dstMem);
        } else {
          success = success.with(e.getKey(), prev.union(e.getValue()));
        }
      }
    }
    for (MemId mem : conflicts) {
      if (tracer.enabled()) {
        tracer.trace("failed %s: branches disagree on its destination", mem);
      }
      success = success.without(mem);
    }

    Set<VarId> bodyUses = Sets.union(exp.thenBody.freeVars(), exp.elseBody.freeVars());
    BottomUpEnv result = new BottomUpEnv(bu.scalars, active, success, inhibit);
    return SafetyChecks.filterByUses(pattern, bodyUses, td.scope, result, tracer);
  }

  private static @Nullable VarId result(Body body, int index) {
    ImmutableList<PrimExp> results = body.result();
    return (index < results.size()) ? results.get(index).asVar() : null;
  }

  /**
   * Promotes the pattern element's candidate if both branch results were committed, keeps it
   * pending if all three share a block that is still pending in both branches, and fails it
   * otherwise.
   */
  private static BottomUpEnv settle(
      Arms a, BottomUpEnv env, BottomUpEnv thenEnv, BottomUpEnv elseEnv, Tracer tracer) {
    MemId mb = a.patMem();
    CoalsEntry info = env.active.get(mb);
    if (info == null) {
      return env;
    }
    MemId mr1 = a.then.resMem().mem();
    MemId mr2 = a.otherwise.resMem().mem();
    if (thenEnv.success.contains(mr1) && elseEnv.success.contains(mr2)) {
      CoalsEntry promoted =
          info.withOptDep(a.then.resVar(), mr1).withOptDep(a.otherwise.resVar(), mr2);
      return env.markSuccess(mb, a.then.patVar(), promoted, tracer);
    } else if (mb.equals(mr1) && mb.equals(mr2)) {
      CoalsEntry thenInfo = thenEnv.active.get(mr1);
      CoalsEntry elseInfo = elseEnv.active.get(mr2);
      if (thenInfo != null
          && elseInfo != null
          && !info.conflictsWith(thenInfo)
          && !info.conflictsWith(elseInfo)) {
        return env.withActive(env.active.with(mb, info.union(thenInfo.union(elseInfo))));
      }
    }
    return env.markFailed(mb, tracer, "branch results were not both coalesced");
  }
}
