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
import java.util.Set;
import java.util.TreeMap;
import org.memmerge.ir.MemId;

/**
 * An immutable relation between memory blocks, stored as a map from each block to the set of
 * blocks it is related to. Used for the inhibition table (source block to the destinations it
 * must not be coalesced into) and for the loop table (a loop body's result block to the blocks
 * that stand for the same array across iterations).
 */
public final class MemRelation {

  public static final MemRelation EMPTY = new MemRelation(ImmutableSortedMap.of());

  private final ImmutableSortedMap<MemId, ImmutableSortedSet<MemId>> map;

  private MemRelation(ImmutableSortedMap<MemId, ImmutableSortedSet<MemId>> map) {
    this.map = map;
  }

  /** Returns the blocks related to {@code mem}; empty if there are none. */
  public ImmutableSortedSet<MemId> get(MemId mem) {
    ImmutableSortedSet<MemId> result = map.get(mem);
    return (result == null) ? ImmutableSortedSet.of() : result;
  }

  public boolean contains(MemId from, MemId to) {
    return get(from).contains(to);
  }

  public boolean isEmpty() {
    return map.isEmpty();
  }

  public ImmutableSortedSet<MemId> keys() {
    return map.keySet();
  }

  /** The number of related pairs. */
  public int pairCount() {
    return map.values().stream().mapToInt(Set::size).sum();
  }

  public MemRelation add(MemId from, MemId to) {
    if (contains(from, to)) {
      return this;
    }
    return addAll(from, ImmutableSortedSet.of(to));
  }

  public MemRelation addAll(MemId from, Set<MemId> to) {
    if (to.isEmpty() || get(from).containsAll(to)) {
      return this;
    }
    ImmutableSortedSet<MemId> merged =
        ImmutableSortedSet.<MemId>naturalOrder().addAll(get(from)).addAll(to).build();
    TreeMap<MemId, ImmutableSortedSet<MemId>> updated = new TreeMap<>(map);
    updated.put(from, merged);
    return new MemRelation(ImmutableSortedMap.copyOfSorted(updated));
  }

  public MemRelation union(MemRelation other) {
    MemRelation result = this;
    for (Map.Entry<MemId, ImmutableSortedSet<MemId>> e : other.map.entrySet()) {
      result = result.addAll(e.getKey(), e.getValue());
    }
    return result;
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof MemRelation r && r.map.equals(map);
  }

  @Override
  public int hashCode() {
    return map.hashCode();
  }

  @Override
  public String toString() {
    return map.toString();
  }
}
