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
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.memmerge.ir.Body;
import org.memmerge.ir.Exp;
import org.memmerge.ir.IxFun;
import org.memmerge.ir.MemBinding;
import org.memmerge.ir.PatElem;
import org.memmerge.ir.Pattern;
import org.memmerge.ir.PrimExp;
import org.memmerge.ir.Scope;
import org.memmerge.ir.Stm;
import org.memmerge.ir.VarId;
import org.memmerge.liveness.LastUse;

/**
 * One pass of the coalescing analysis over a function body.
 *
 * <p>Statements are visited first to last to build the {@link TopDownEnv} seen by each one, then
 * last to first to thread the {@link BottomUpEnv}: a candidate is registered at the statement that
 * copies its source, and is promoted or failed at the statement that defines the source, with
 * every statement in between checked against it. Branches and loops are handled by {@link
 * BranchRule} and {@link LoopRule}, which call back into {@link #analyzeBody} for their bodies.
 */
final class BodyTraversal {
  final LastUse lastUse;
  final Tracer tracer;
  final String function;
  private final BranchRule branchRule;
  private final LoopRule loopRule;

  BodyTraversal(LastUse lastUse, Tracer tracer, String function) {
    this.lastUse = lastUse;
    this.tracer = tracer;
    this.function = function;
    this.branchRule = new BranchRule(this);
    this.loopRule = new LoopRule(this);
  }

  BottomUpEnv analyzeBody(Body body, TopDownEnv td, BottomUpEnv bu) {
    ImmutableList<Stm> stms = body.stms();
    List<TopDownEnv> envs = new ArrayList<>(stms.size());
    TopDownEnv current = td;
    for (Stm stm : stms) {
      current = topDown(stm, current);
      envs.add(current);
    }
    BottomUpEnv result = bu;
    for (int i = stms.size() - 1; i >= 0; i--) {
      result = analyzeStm(stms.get(i), envs.get(i), result);
    }
    return result;
  }

  private static TopDownEnv topDown(Stm stm, TopDownEnv td) {
    if (stm instanceof Stm.Alloc alloc) {
      return td.withAlloc(alloc.mem);
    }
    return td.withScope(td.scope.with(((Stm.Let) stm).pattern));
  }

  private BottomUpEnv analyzeStm(Stm stm, TopDownEnv td, BottomUpEnv bu) {
    if (!(stm instanceof Stm.Let let)) {
      // Allocations don't use any arrays.
      return bu;
    }
    Pattern pattern = let.pattern;
    boolean anyInPlace = pattern.elements().anyMatch(PatElem::isInPlace);
    if (pattern.context().isEmpty() && pattern.values().size() == 1 && !anyInPlace) {
      PrimExp scalar = asScalar(let.exp, td.scope, bu);
      if (scalar != null) {
        return bu.withScalar(pattern.values().get(0).name, scalar);
      }
    }
    if (let.exp instanceof Exp.If ifExp && !anyInPlace) {
      return branchRule.analyze(let, ifExp, td, bu);
    } else if (let.exp instanceof Exp.Loop loop && !anyInPlace) {
      return loopRule.analyze(let, loop, td, bu);
    }
    return analyzeLet(let, td, bu);
  }

  /**
   * If {@code exp} is a scalar computation, returns it as a PrimExp over variables in scope,
   * expanding any variables that are already in the scalar table.
   */
  private static @Nullable PrimExp asScalar(Exp exp, Scope scope, BottomUpEnv bu) {
    PrimExp pe;
    if (exp instanceof Exp.ScalarExp scalar) {
      pe = scalar.exp;
    } else if (exp instanceof Exp.VarRef ref && scope.isScalar(ref.var)) {
      pe = PrimExp.var(ref.var);
    } else {
      return null;
    }
    for (VarId v : pe.freeVars()) {
      if (!bu.scalars.containsKey(v) && !scope.isScalar(v)) {
        return null;
      }
    }
    return pe.substitute(bu.scalars);
  }

  /**
   * Any statement other than a scalar binding, a branch or a loop: check the statement's uses
   * against the active candidates, promote or fail the candidates whose sources it defines, and
   * register any new candidates it creates.
   */
  private BottomUpEnv analyzeLet(Stm.Let stm, TopDownEnv td, BottomUpEnv bu) {
    BottomUpEnv env = SafetyChecks.filterByUses(stm.pattern, stm.freeVars(), td.scope, bu, tracer);
    for (PatElem pe : stm.pattern.arrayElems()) {
      env = defineArray(stm, pe, td, env);
    }
    CoalsTable active =
        CandidateMatcher.register(stm, lastUse, td, env.success, env.active, tracer);
    return env.withActive(active);
  }

  /** Handles the definition of {@code pe} by {@code stm}. */
  private BottomUpEnv defineArray(Stm.Let stm, PatElem pe, TopDownEnv td, BottomUpEnv env) {
    MemBinding mb = pe.mem;
    CoalsEntry entry = env.active.get(mb.mem());
    if (entry == null) {
      CoalsEntry committed = env.success.get(mb.mem());
      if (committed != null && !(pe.isInPlace() && committed.vars.containsKey(pe.name))) {
        // The block already holds the promoted array; this is an earlier, different use of it.
        if (tracer.enabled()) {
          tracer.trace("failed %s: block reused by %s", mb.mem(), pe.name);
        }
        return env.markCommittedFailed(mb.mem());
      }
      return env;
    }
    Coalesced coal = entry.vars.get(pe.name);
    if (coal == null) {
      // pe is another view of the block, defined before the candidate's source.
      IxFun rebased = IxFun.rebase(entry.dstIxFun, mb.ixfun());
      SafetyChecks.Translation t =
          (rebased == null) ? null : SafetyChecks.translate(rebased, td.scope, env.scalars);
      if (t == null) {
        return env.markFailed(mb.mem(), tracer, "cannot place alias " + pe.name);
      }
      Coalesced alias =
          new Coalesced(
              CoalescedKind.TRANSITIVE,
              new MemBinding(entry.dstMem, t.ixfun()),
              t.substitutions());
      return env.withActive(env.active.with(mb.mem(), entry.withVar(pe.name, alias)));
    } else if (pe.isInPlace()) {
      // Recorded by SafetyChecks.filterByUses.
      return env;
    }
    boolean allocated = td.alloc.contains(entry.dstMem);
    SafetyChecks.Translation t =
        SafetyChecks.translate(coal.target().ixfun(), td.scope, env.scalars);
    VarId aliasOf = stm.exp.shapeAlias();
    if (!allocated) {
      return env.markFailed(mb.mem(), tracer, "destination not allocated before " + pe.name);
    } else if (t == null) {
      return env.markFailed(mb.mem(), tracer, "index function not expressible at " + pe.name);
    }
    CoalsEntry updated = entry.withVar(pe.name, coal.withIxFun(t.ixfun(), t.substitutions()));
    if (aliasOf == null) {
      if (!stm.exp.createsNewArray()) {
        return env.markFailed(mb.mem(), tracer, pe.name + " is not a fresh array");
      }
      return env.markSuccess(mb.mem(), pe.name, updated, tracer);
    }
    // pe is a reshaped or permuted view of aliasOf: carry the candidate over to aliasOf, whose
    // definition (earlier) will decide it.
    MemBinding aliasMem = td.scope.memOf(aliasOf);
    if (aliasMem == null || !aliasMem.mem().equals(mb.mem())) {
      return env.markFailed(mb.mem(), tracer, pe.name + " is a view of another block");
    }
    IxFun rebased = IxFun.rebase(entry.dstIxFun, aliasMem.ixfun());
    if (rebased == null) {
      return env.markFailed(mb.mem(), tracer, "cannot place " + aliasOf);
    }
    updated =
        updated.withVar(
            aliasOf, new Coalesced(coal.kind(), new MemBinding(entry.dstMem, rebased)));
    return env.withActive(env.active.with(mb.mem(), updated));
  }
}
