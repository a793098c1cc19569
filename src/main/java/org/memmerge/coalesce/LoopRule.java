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

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Iterables;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.memmerge.ir.Exp;
import org.memmerge.ir.MemBinding;
import org.memmerge.ir.MemId;
import org.memmerge.ir.PatElem;
import org.memmerge.ir.Pattern;
import org.memmerge.ir.PrimExp;
import org.memmerge.ir.Scope;
import org.memmerge.ir.Stm;
import org.memmerge.ir.VarId;

/**
 * Handles {@code let b = loop (a = a0) ... do {... r}}.
 *
 * <p>A candidate for b is pushed onto the body result r, the parameter a and the initializer a0,
 * which all stand for the same array at different iterations. It succeeds if r is coalesced by
 * the body and a0's candidate is still pending (to be decided at a0's definition). The loop table
 * records that r's block is aliased with the blocks of b, a and a0, so that the body can't use one
 * of them while a candidate into r's destination is live.
 */
final class LoopRule {
  private final BodyTraversal traversal;

  LoopRule(BodyTraversal traversal) {
    this.traversal = traversal;
  }

  /** A loop value: links from the pattern element to the body result, parameter and initializer. */
  private record Links(
      ResultTransfer.Link result, ResultTransfer.Link param, ResultTransfer.Link init) {}

  BottomUpEnv analyze(Stm.Let stm, Exp.Loop loop, TopDownEnv td, BottomUpEnv bu) {
    Tracer tracer = traversal.tracer;
    Pattern pattern = stm.pattern;
    Scope loopScope = td.scope.withLoop(loop);
    Scope bodyScope = loopScope.withStms(loop.body.stms());
    List<PrimExp> results = loop.valueResults();
    int n = Math.min(pattern.values().size(), Math.min(loop.vals.size(), results.size()));

    MemRelation loops = td.loops;
    for (int i = 0; i < n; i++) {
      PatElem pe = pattern.values().get(i);
      MemBinding[] mems = loopMems(pe, loop.vals.get(i), results.get(i), bodyScope);
      if (mems != null) {
        loops =
            loops.addAll(
                mems[2].mem(), ImmutableSet.of(pe.mem.mem(), mems[0].mem(), mems[1].mem()));
      }
    }

    BottomUpEnv env = SafetyChecks.filterAllocAndIxFun(pattern.values(), td, bu, tracer);
    env = SafetyChecks.filterExistential(pattern, env, tracer);
    Set<VarId> loopUses = new HashSet<>(loop.body.freeVars());
    loop.vals.forEach(p -> loopUses.addAll(p.init().freeVars()));
    env = SafetyChecks.filterByUses(pattern, loopUses, td.scope, env, tracer);

    List<Links> links = new ArrayList<>();
    for (int i = 0; i < n; i++) {
      Links l =
          links(stm, pattern.values().get(i), loop.vals.get(i), results.get(i), bodyScope, td, env);
      if (l != null) {
        links.add(l);
      }
    }
    Set<VarId> linked = new HashSet<>();
    links.forEach(l -> linked.add(l.result.patVar()));
    for (PatElem pe : pattern.arrayElems()) {
      if (!linked.contains(pe.name)) {
        env = env.markFailed(pe.mem.mem(), tracer, "loop value " + pe.name + " cannot be followed");
      }
    }
    CoalsTable activeBefore = env.active;
    links.removeIf(l -> !activeBefore.contains(l.result.patMem()));

    String fn = traversal.function;
    for (Links l : links) {
      env = ResultTransfer.transfer(env, l.result, tracer, fn);
    }
    for (Links l : links) {
      env = ResultTransfer.transfer(env, l.param, tracer, fn);
    }
    for (Links l : links) {
      env = ResultTransfer.transfer(env, l.init, tracer, fn);
    }
    // Writing r's block must not clobber a, which the same iteration may still read.
    for (Links l : links) {
      MemId mr = l.result.resMem().mem();
      MemId ma = l.param.resMem().mem();
      CoalsEntry entry = env.active.get(mr);
      if (!mr.equals(ma) && entry != null) {
        env = env.withActive(env.active.with(mr, entry.withAliasedMem(ma)));
      }
    }

    TopDownEnv bodyTd = td.withScope(loopScope).withLoops(loops);
    BottomUpEnv res = traversal.analyzeBody(loop.body, bodyTd, env);

    for (Links l : links) {
      res = promote(l.result.patVar(), l.result.patMem(), l, res, tracer);
    }
    for (Links l : links) {
      res = promote(l.param.resVar(), l.param.resMem().mem(), l, res, tracer);
    }
    // Nothing else can define the loop parameters, so any other candidate for their blocks fails.
    Set<MemId> pending = new HashSet<>();
    links.forEach(l -> pending.add(l.init.resMem().mem()));
    for (Exp.LoopParam p : Iterables.concat(loop.ctx, loop.vals)) {
      MemBinding mem = p.param().mem();
      if (mem != null && !pending.contains(mem.mem())) {
        res = res.markFailed(mem.mem(), tracer, "candidate for loop parameter " + p.name());
      }
    }
    return new BottomUpEnv(bu.scalars, res.active, res.success, res.inhibit);
  }

  /**
   * Returns the memory of the parameter, initializer and body result for a loop value, or null if
   * any of them is not an array variable.
   */
  private static MemBinding @Nullable [] loopMems(
      PatElem pe, Exp.LoopParam param, PrimExp result, Scope bodyScope) {
    VarId a0 = param.init().asVar();
    VarId r = result.asVar();
    if (pe.mem == null || pe.isInPlace() || a0 == null || r == null) {
      return null;
    }
    MemBinding ma = bodyScope.memOf(param.name());
    MemBinding ma0 = bodyScope.memOf(a0);
    MemBinding mr = bodyScope.memOf(r);
    if (ma == null || ma0 == null || mr == null) {
      return null;
    }
    return new MemBinding[] {ma, ma0, mr};
  }

  /**
   * Returns the links for one loop value if its pattern element has a candidate that can be
   * pushed into the loop: the initializer must be last-used by the loop (or already live in the
   * parameter's place), and the body result's block must be allocated before the loop.
   */
  private @Nullable Links links(
      Stm.Let stm,
      PatElem pe,
      Exp.LoopParam param,
      PrimExp result,
      Scope bodyScope,
      TopDownEnv td,
      BottomUpEnv env) {
    MemBinding[] mems = loopMems(pe, param, result, bodyScope);
    if (mems == null) {
      return null;
    }
    MemBinding ma = mems[0];
    MemBinding ma0 = mems[1];
    MemBinding mr = mems[2];
    VarId a0 = param.init().asVar();
    boolean initLastUsed =
        (ma.mem().equals(ma0.mem()) && ma.ixfun().equals(ma0.ixfun()))
            || traversal.lastUse.isLastUse(stm, a0);
    if (!initLastUsed || !td.alloc.contains(mr.mem())) {
      return null;
    }
    ResultTransfer.Link resultLink =
        ResultTransfer.link(env.active, pe, result.asVar(), bodyScope);
    ResultTransfer.Link paramLink = ResultTransfer.link(env.active, pe, param.name(), bodyScope);
    ResultTransfer.Link initLink = ResultTransfer.link(env.active, pe, a0, bodyScope);
    if (resultLink == null || paramLink == null || initLink == null) {
      return null;
    }
    return new Links(resultLink, paramLink, initLink);
  }

  /**
   * Decides the candidate for {@code var} (the pattern element or the parameter of {@code l}):
   * promoted if the body result was coalesced and the initializer's candidate is pending; kept
   * pending if all three share a block (an in-place loop, decided at the initializer); failed
   * otherwise.
   */
  private static BottomUpEnv promote(
      VarId var, MemId mb, Links l, BottomUpEnv env, Tracer tracer) {
    CoalsEntry info = env.active.get(mb);
    if (info == null) {
      return env;
    }
    MemId mr = l.result.resMem().mem();
    MemId mi = l.init.resMem().mem();
    boolean resultDone = env.success.contains(mr);
    boolean initPending = env.active.contains(mi);
    if (!mb.equals(mi) && !mb.equals(mr) && initPending && resultDone) {
      return env.markSuccess(mb, var, info.withOptDep(l.init.resVar(), mi), tracer);
    } else if (mb.equals(mr)
        && mr.equals(mi)
        && (resultDone || env.active.contains(mr))
        && initPending) {
      return env;
    }
    return env.markFailed(mb, tracer, "loop value " + var + " not coalesced by the body");
  }
}
