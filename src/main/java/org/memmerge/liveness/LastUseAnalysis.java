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

package org.memmerge.liveness;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.memmerge.ir.Body;
import org.memmerge.ir.Exp;
import org.memmerge.ir.FunDef;
import org.memmerge.ir.PrimExp;
import org.memmerge.ir.Stm;
import org.memmerge.ir.VarId;

/**
 * Computes last uses by a single backward pass over each body, tracking the set of variables that
 * are live after each statement.
 *
 * <p>The results of a body are live at its end. Variables that a loop body reads but does not
 * bind stay live throughout the body, since the next iteration may read them again. Loop
 * parameters are not live at the end of the body: they are rebound from its results.
 */
public final class LastUseAnalysis implements LastUse {

  private final ImmutableMap<Stm, ImmutableSet<VarId>> table;

  private LastUseAnalysis(Map<Stm, ImmutableSet<VarId>> table) {
    this.table = ImmutableMap.copyOf(table);
  }

  public static LastUseAnalysis analyze(FunDef fun) {
    Map<Stm, ImmutableSet<VarId>> table = new IdentityHashMap<>();
    analyzeBody(fun.body(), ImmutableSet.of(), table);
    return new LastUseAnalysis(table);
  }

  @Override
  public ImmutableSet<VarId> lastUses(Stm stm) {
    return table.getOrDefault(stm, ImmutableSet.of());
  }

  /**
   * Records the last uses of every statement in {@code body} (and the bodies nested in it), given
   * the variables live after the body. Returns the variables live before it.
   */
  private static Set<VarId> analyzeBody(
      Body body, Set<VarId> liveOut, Map<Stm, ImmutableSet<VarId>> table) {
    Set<VarId> live = new HashSet<>(liveOut);
    live.addAll(PrimExp.freeVars(body.result()));
    List<Stm> stms = body.stms();
    for (int i = stms.size() - 1; i >= 0; i--) {
      Stm stm = stms.get(i);
      if (stm instanceof Stm.Let let) {
        analyzeNested(let.exp, live, table);
      }
      ImmutableSet<VarId> uses = stm.freeVars();
      table.put(stm, ImmutableSet.copyOf(Sets.difference(uses, live)));
      live.removeAll(stm.boundVars());
      live.addAll(uses);
    }
    return live;
  }

  private static void analyzeNested(
      Exp exp, Set<VarId> liveAfter, Map<Stm, ImmutableSet<VarId>> table) {
    if (exp instanceof Exp.If ifExp) {
      analyzeBody(ifExp.thenBody, liveAfter, table);
      analyzeBody(ifExp.elseBody, liveAfter, table);
    } else if (exp instanceof Exp.Loop loop) {
      Set<VarId> liveInBody = new HashSet<>(liveAfter);
      liveInBody.addAll(loop.freeVars());
      analyzeBody(loop.body, liveInBody, table);
    }
  }
}
