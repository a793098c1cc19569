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
import java.util.Map;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import org.memmerge.ir.Body;
import org.memmerge.ir.Exp;
import org.memmerge.ir.FunDef;
import org.memmerge.ir.MemId;
import org.memmerge.ir.Stm;
import org.memmerge.liveness.LastUse;

/** Renders the inputs and outputs of the analysis of one function as text, for debugging. */
public final class CoalescingReport {

  private CoalescingReport() {}

  public static String format(FunDef fun, LastUse lastUse, CoalescingResult result) {
    StringBuilder sb = new StringBuilder();
    sb.append("== ").append(fun.name()).append(" ==\n");
    sb.append("last uses:\n");
    List<MemId> allocs = new ArrayList<>();
    forEachStm(
        fun.body(),
        stm -> {
          if (stm instanceof Stm.Alloc alloc) {
            allocs.add(alloc.mem);
          } else if (!lastUse.lastUses(stm).isEmpty()) {
            sb.append("  ")
                .append(label(stm))
                .append(": ")
                .append(ImmutableList.sortedCopyOf(lastUse.lastUses(stm)))
                .append('\n');
          }
        });
    sb.append("allocations: ").append(allocs).append('\n');
    sb.append("coalescing (").append(result.iterations()).append(" iterations):\n");
    for (Map.Entry<MemId, CoalsEntry> e : result.success().entries().entrySet()) {
      sb.append("  ").append(e.getKey()).append(" -> ").append(e.getValue()).append('\n');
    }
    sb.append("inhibited: ").append(result.inhibited()).append('\n');
    return sb.toString();
  }

  private static String label(Stm stm) {
    Stm.Let let = (Stm.Let) stm;
    return let.pattern.values().stream()
        .map(pe -> pe.name.toString())
        .collect(Collectors.joining(", "));
  }

  /** Calls {@code action} on each statement, including those in nested bodies, in order. */
  private static void forEachStm(Body body, Consumer<Stm> action) {
    for (Stm stm : body.stms()) {
      action.accept(stm);
      if (stm instanceof Stm.Let let) {
        if (let.exp instanceof Exp.If ifExp) {
          forEachStm(ifExp.thenBody, action);
          forEachStm(ifExp.elseBody, action);
        } else if (let.exp instanceof Exp.Loop loop) {
          forEachStm(loop.body, action);
        }
      }
    }
  }
}
