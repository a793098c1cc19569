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
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.memmerge.ir.IxFun;
import org.memmerge.ir.MemBinding;
import org.memmerge.ir.MemId;
import org.memmerge.ir.PatElem;
import org.memmerge.ir.Pattern;
import org.memmerge.ir.PrimExp;
import org.memmerge.ir.Scope;
import org.memmerge.ir.VarId;

/**
 * The filters that drop active candidates violating one of the safety conditions:
 *
 * <ol>
 *   <li>the source is last-used by the statement that creates the candidate (checked when the
 *       candidate is created, see {@link CandidateMatcher});
 *   <li>the destination block is allocated before the source is defined;
 *   <li>neither the destination nor any block aliased with it is used while the source is live;
 *   <li>the source is defined by an expression that creates a fresh array (checked in {@link
 *       BodyTraversal});
 *   <li>every variable in the new index function is in scope at the source's definition, or can
 *       be replaced by an equivalent expression that is.
 * </ol>
 */
final class SafetyChecks {

  private SafetyChecks() {}

  /** An index function made valid at some program point, and the replacements that required. */
  record Translation(IxFun ixfun, ImmutableMap<VarId, PrimExp> substitutions) {}

  /**
   * Rewrites {@code ixfun} so that it only refers to variables in {@code scope}, replacing any
   * other variable with its definition from the scalar table. Returns null if some variable is
   * neither in scope nor replaceable by an expression over variables in scope.
   */
  static @Nullable Translation translate(
      IxFun ixfun, Scope scope, Map<VarId, PrimExp> scalars) {
    Map<VarId, PrimExp> subst = new LinkedHashMap<>();
    for (VarId v : ixfun.freeVars()) {
      if (scope.contains(v)) {
        continue;
      }
      PrimExp replacement = scalars.get(v);
      if (replacement == null || !replacement.freeVars().stream().allMatch(scope::contains)) {
        return null;
      }
      subst.put(v, replacement);
    }
    return new Translation(ixfun.substitute(subst), ImmutableMap.copyOf(subst));
  }

  /**
   * Returns the memory blocks that the given variables live in, including the blocks of any
   * variables they are declared to alias.
   */
  static ImmutableSet<MemId> memsOf(Set<VarId> vars, Scope scope) {
    ImmutableSet.Builder<MemId> builder = ImmutableSet.builder();
    for (VarId v : vars) {
      Scope.NameInfo info = scope.get(v);
      if (info == null) {
        continue;
      }
      if (info.mem() != null) {
        builder.add(info.mem().mem());
      }
      for (VarId alias : info.aliases()) {
        MemBinding aliasMem = scope.memOf(alias);
        if (aliasMem != null) {
          builder.add(aliasMem.mem());
        }
      }
    }
    return builder.build();
  }

  /**
   * Safety condition 3: fails every active candidate whose aliased blocks intersect the blocks
   * used by a statement (the blocks of {@code usedVars} and of the pattern's arrays).
   *
   * <p>Also handles in-place updates: if a pattern element {@code x' = x with [...] <- ...} is
   * recorded in an active entry, {@code x} is recorded there too (it lives in the same place).
   */
  static BottomUpEnv filterByUses(
      Pattern pattern, Set<VarId> usedVars, Scope scope, BottomUpEnv bu, Tracer tracer) {
    ImmutableSet<MemId> patternMems =
        pattern.arrayElems().stream()
            .map(pe -> pe.mem.mem())
            .collect(ImmutableSet.toImmutableSet());
    Set<MemId> stmMems = Sets.union(memsOf(usedVars, scope), patternMems);
    BottomUpEnv result = bu;
    for (Map.Entry<MemId, CoalsEntry> e : bu.active.entries().entrySet()) {
      if (!Sets.intersection(e.getValue().aliasedMems, stmMems).isEmpty()) {
        result = result.markFailed(e.getKey(), tracer, "destination used during source lifetime");
      }
    }
    for (PatElem pe : pattern.arrayElems()) {
      MemId mem = pe.mem.mem();
      CoalsEntry entry = result.active.get(mem);
      if (entry == null) {
        continue;
      }
      Coalesced coal = entry.vars.get(pe.name);
      if (coal == null) {
        if (pe.isInPlace()) {
          result = result.markFailed(mem, tracer, "in-place update of untracked " + pe.name);
        }
        continue;
      } else if (!pe.isInPlace()) {
        continue;
      }
      Translation t = translate(coal.target().ixfun(), scope, bu.scalars);
      if (t == null) {
        result = result.markFailed(mem, tracer, "index function not expressible at " + pe.name);
        continue;
      }
      Coalesced updated = coal.withIxFun(t.ixfun(), t.substitutions());
      entry = entry.withVar(pe.update.source(), updated).withVar(pe.name, updated);
      result = result.withActive(result.active.with(mem, entry));
    }
    return result;
  }

  /**
   * Safety conditions 2 and 5, for statements (branches and loops) whose pattern elements get
   * their values from nested bodies: each active candidate for a pattern element must have its
   * destination allocated already, and an index function expressible here.
   */
  static BottomUpEnv filterAllocAndIxFun(
      List<PatElem> elems, TopDownEnv td, BottomUpEnv bu, Tracer tracer) {
    BottomUpEnv result = bu;
    for (PatElem pe : elems) {
      if (pe.mem == null) {
        continue;
      }
      MemId mem = pe.mem.mem();
      CoalsEntry entry = result.active.get(mem);
      if (entry == null) {
        continue;
      }
      Coalesced coal = entry.vars.get(pe.name);
      if (coal == null) {
        result = result.markFailed(mem, tracer, pe.name + " is not tracked by its block's entry");
        continue;
      }
      Translation t = translate(coal.target().ixfun(), td.scope, result.scalars);
      if (t == null) {
        result = result.markFailed(mem, tracer, "index function not expressible at " + pe.name);
      } else if (!td.alloc.contains(entry.dstMem)) {
        result = result.markFailed(mem, tracer, "destination not allocated before " + pe.name);
      } else {
        Coalesced updated = coal.withIxFun(t.ixfun(), t.substitutions());
        result = result.withActive(result.active.with(mem, entry.withVar(pe.name, updated)));
      }
    }
    return result;
  }

  /**
   * Fails candidates for value elements whose types refer to the pattern's own context
   * (existentially-sized results); their size is not known until the statement completes.
   */
  static BottomUpEnv filterExistential(Pattern pattern, BottomUpEnv bu, Tracer tracer) {
    Set<VarId> ctx = pattern.contextNames();
    if (ctx.isEmpty()) {
      return bu;
    }
    BottomUpEnv result = bu;
    for (PatElem pe : pattern.arrayElems()) {
      if (!Sets.intersection(pe.type.freeVars(), ctx).isEmpty()) {
        result = result.markFailed(pe.mem.mem(), tracer, pe.name + " has an existential size");
      }
    }
    return result;
  }
}
