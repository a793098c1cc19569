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

import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.ImmutableSortedSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import org.memmerge.ir.IxFun;
import org.memmerge.ir.MemId;
import org.memmerge.ir.VarId;

/**
 * Everything known about one candidate (or committed) coalescing of a source memory block into a
 * destination block.
 *
 * <ul>
 *   <li>{@link #dstMem} and {@link #dstIxFun}: the destination block, and the layout within it
 *       that the source block's base is placed at.
 *   <li>{@link #aliasedMems}: blocks that must not be used while the candidate is being tracked;
 *       always includes {@link #dstMem}.
 *   <li>{@link #vars}: each variable living in the source block, with its new location.
 *   <li>{@link #optDeps}: other coalescings this one relies on; each maps a variable to the source
 *       block of the entry that must still record that variable when the analysis finishes.
 * </ul>
 *
 * <p>CoalsEntries are immutable.
 */
public final class CoalsEntry {
  public final MemId dstMem;
  public final IxFun dstIxFun;
  public final ImmutableSortedSet<MemId> aliasedMems;
  public final ImmutableSortedMap<VarId, Coalesced> vars;
  public final ImmutableSortedMap<VarId, MemId> optDeps;

  public CoalsEntry(
      MemId dstMem,
      IxFun dstIxFun,
      Set<MemId> aliasedMems,
      Map<VarId, Coalesced> vars,
      Map<VarId, MemId> optDeps) {
    this.dstMem = dstMem;
    this.dstIxFun = dstIxFun;
    this.aliasedMems = ImmutableSortedSet.copyOf(aliasedMems);
    this.vars = ImmutableSortedMap.copyOf(vars);
    this.optDeps = ImmutableSortedMap.copyOf(optDeps);
  }

  private static <K extends Comparable<K>, V> ImmutableSortedMap<K, V> put(
      ImmutableSortedMap<K, V> map, K key, V value) {
    TreeMap<K, V> updated = new TreeMap<>(map);
    updated.put(key, value);
    return ImmutableSortedMap.copyOfSorted(updated);
  }

  public CoalsEntry withVar(VarId var, Coalesced coalesced) {
    return new CoalsEntry(dstMem, dstIxFun, aliasedMems, put(vars, var, coalesced), optDeps);
  }

  public CoalsEntry withOptDep(VarId var, MemId mem) {
    return new CoalsEntry(dstMem, dstIxFun, aliasedMems, vars, put(optDeps, var, mem));
  }

  public CoalsEntry withAliasedMem(MemId mem) {
    if (aliasedMems.contains(mem)) {
      return this;
    }
    return new CoalsEntry(
        dstMem,
        dstIxFun,
        ImmutableSortedSet.<MemId>naturalOrder().addAll(aliasedMems).add(mem).build(),
        vars,
        optDeps);
  }

  /**
   * Combines two entries for the same source block. Where both record the same variable or
   * dependency, this entry's record wins; callers that need to reject such disagreements check
   * {@link #conflictsWith} first.
   */
  public CoalsEntry union(CoalsEntry other) {
    TreeMap<VarId, Coalesced> newVars = new TreeMap<>(other.vars);
    newVars.putAll(vars);
    TreeMap<VarId, MemId> newDeps = new TreeMap<>(other.optDeps);
    newDeps.putAll(optDeps);
    return new CoalsEntry(
        dstMem,
        dstIxFun,
        ImmutableSortedSet.<MemId>naturalOrder()
            .addAll(aliasedMems)
            .addAll(other.aliasedMems)
            .build(),
        newVars,
        newDeps);
  }

  /**
   * True if the two entries disagree about where the source block goes: different destinations,
   * or the same variable sent to different places.
   */
  public boolean conflictsWith(CoalsEntry other) {
    if (!dstMem.equals(other.dstMem)) {
      return true;
    }
    for (Map.Entry<VarId, Coalesced> e : vars.entrySet()) {
      Coalesced otherCoal = other.vars.get(e.getKey());
      if (otherCoal != null && !otherCoal.target().equals(e.getValue().target())) {
        return true;
      }
    }
    return false;
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof CoalsEntry e
        && e.dstMem.equals(dstMem)
        && e.dstIxFun.equals(dstIxFun)
        && e.aliasedMems.equals(aliasedMems)
        && e.vars.equals(vars)
        && e.optDeps.equals(optDeps);
  }

  @Override
  public int hashCode() {
    return Objects.hash(dstMem, dstIxFun, aliasedMems, vars, optDeps);
  }

  @Override
  public String toString() {
    return String.format(
        "{dst: %s %s, aliased: %s, vars: %s, deps: %s}",
        dstMem, dstIxFun, aliasedMems, vars, optDeps);
  }
}
