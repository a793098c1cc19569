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
import java.util.TreeMap;
import org.jspecify.annotations.Nullable;
import org.memmerge.ir.MemId;

/**
 * An immutable map from source memory blocks to their {@link CoalsEntry}. The analysis keeps two
 * of these: the <i>active</i> table of candidates whose safety is still being established, and
 * the <i>success</i> table of candidates that have passed every check.
 */
public final class CoalsTable {

  public static final CoalsTable EMPTY = new CoalsTable(ImmutableSortedMap.of());

  private final ImmutableSortedMap<MemId, CoalsEntry> entries;

  private CoalsTable(ImmutableSortedMap<MemId, CoalsEntry> entries) {
    this.entries = entries;
  }

  public static CoalsTable of(Map<MemId, CoalsEntry> entries) {
    return entries.isEmpty() ? EMPTY : new CoalsTable(ImmutableSortedMap.copyOf(entries));
  }

  public @Nullable CoalsEntry get(MemId mem) {
    return entries.get(mem);
  }

  public boolean contains(MemId mem) {
    return entries.containsKey(mem);
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }

  public int size() {
    return entries.size();
  }

  public ImmutableSortedSet<MemId> keys() {
    return entries.keySet();
  }

  public ImmutableSortedMap<MemId, CoalsEntry> entries() {
    return entries;
  }

  /** Returns a table with {@code mem} mapped to {@code entry}, replacing any previous entry. */
  public CoalsTable with(MemId mem, CoalsEntry entry) {
    TreeMap<MemId, CoalsEntry> updated = new TreeMap<>(entries);
    updated.put(mem, entry);
    return new CoalsTable(ImmutableSortedMap.copyOfSorted(updated));
  }

  public CoalsTable without(MemId mem) {
    if (!entries.containsKey(mem)) {
      return this;
    }
    ImmutableSortedMap.Builder<MemId, CoalsEntry> builder = ImmutableSortedMap.naturalOrder();
    entries.forEach(
        (k, v) -> {
          if (!k.equals(mem)) {
            builder.put(k, v);
          }
        });
    return new CoalsTable(builder.buildOrThrow());
  }

  /** Adds {@code entry}, combining it with any entry already present for {@code mem}. */
  public CoalsTable append(MemId mem, CoalsEntry entry) {
    CoalsEntry prev = entries.get(mem);
    return with(mem, (prev == null) ? entry : prev.union(entry));
  }

  /**
   * Returns the entries whose keys appear in both tables, each combined with {@link
   * CoalsEntry#union} (this table's entry first).
   */
  public CoalsTable intersect(CoalsTable other) {
    ImmutableSortedMap.Builder<MemId, CoalsEntry> builder = ImmutableSortedMap.naturalOrder();
    entries.forEach(
        (k, v) -> {
          CoalsEntry otherEntry = other.entries.get(k);
          if (otherEntry != null) {
            builder.put(k, v.union(otherEntry));
          }
        });
    return new CoalsTable(builder.buildOrThrow());
  }

  /** Returns the entries of this table whose keys do not appear in {@code other}. */
  public CoalsTable minus(CoalsTable other) {
    ImmutableSortedMap.Builder<MemId, CoalsEntry> builder = ImmutableSortedMap.naturalOrder();
    entries.forEach(
        (k, v) -> {
          if (!other.entries.containsKey(k)) {
            builder.put(k, v);
          }
        });
    return new CoalsTable(builder.buildOrThrow());
  }

  /** Adds {@code mem -> entry.dstMem} to {@code inhibit} for every entry in this table. */
  public MemRelation recordFailures(MemRelation inhibit) {
    MemRelation result = inhibit;
    for (Map.Entry<MemId, CoalsEntry> e : entries.entrySet()) {
      result = result.add(e.getKey(), e.getValue().dstMem);
    }
    return result;
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof CoalsTable t && t.entries.equals(entries);
  }

  @Override
  public int hashCode() {
    return entries.hashCode();
  }

  @Override
  public String toString() {
    return entries.toString();
  }
}
