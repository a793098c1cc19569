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
import org.memmerge.ir.MemId;
import org.memmerge.ir.PrimExp;
import org.memmerge.ir.VarId;

/**
 * The information accumulated while walking statements from last to first: the scalar table, the
 * active and success tables, and the inhibitions recorded so far.
 *
 * <p>A block is in at most one of {@link #active} and {@link #success}. Entries leave the active
 * table only through {@link #markFailed} (which records the inhibition) or {@link #markSuccess}.
 */
final class BottomUpEnv {
  static final BottomUpEnv EMPTY =
      new BottomUpEnv(ImmutableMap.of(), CoalsTable.EMPTY, CoalsTable.EMPTY, MemRelation.EMPTY);

  /** Scalar variables whose definitions could be expressed as PrimExps. */
  final ImmutableMap<VarId, PrimExp> scalars;

  final CoalsTable active;
  final CoalsTable success;
  final MemRelation inhibit;

  BottomUpEnv(
      ImmutableMap<VarId, PrimExp> scalars,
      CoalsTable active,
      CoalsTable success,
      MemRelation inhibit) {
    this.scalars = scalars;
    this.active = active;
    this.success = success;
    this.inhibit = inhibit;
  }

  BottomUpEnv withScalar(VarId var, PrimExp exp) {
    return new BottomUpEnv(
        ImmutableMap.<VarId, PrimExp>builder().putAll(scalars).put(var, exp).buildKeepingLast(),
        active,
        success,
        inhibit);
  }

  BottomUpEnv withActive(CoalsTable newActive) {
    return new BottomUpEnv(scalars, newActive, success, inhibit);
  }

  BottomUpEnv withSuccess(CoalsTable newSuccess) {
    return new BottomUpEnv(scalars, active, newSuccess, inhibit);
  }

  /**
   * Drops the active candidate for {@code mem} (if any), recording that it must not be coalesced
   * into its destination on later iterations.
   */
  BottomUpEnv markFailed(MemId mem) {
    CoalsEntry entry = active.get(mem);
    if (entry == null) {
      return this;
    }
    return new BottomUpEnv(scalars, active.without(mem), success, inhibit.add(mem, entry.dstMem));
  }

  /** Like {@link #markFailed}, tracing the reason. */
  BottomUpEnv markFailed(MemId mem, Tracer tracer, String reason) {
    CoalsEntry entry = active.get(mem);
    if (entry != null && tracer.enabled()) {
      tracer.trace("failed %s -> %s: %s", mem, entry.dstMem, reason);
    }
    return markFailed(mem);
  }

  /** Like {@link #markFailed}, but for a candidate that had already been promoted. */
  BottomUpEnv markCommittedFailed(MemId mem) {
    CoalsEntry entry = success.get(mem);
    if (entry == null) {
      return this;
    }
    return new BottomUpEnv(scalars, active, success.without(mem), inhibit.add(mem, entry.dstMem));
  }

  /**
   * Moves {@code mem} from the active table to the success table, with the given entry (recorded
   * on behalf of {@code var}, for tracing).
   *
   * <p>If {@code mem} has already been committed to a coalescing that {@code entry} conflicts with,
   * neither can be kept: both are dropped and both destinations are inhibited.
   */
  BottomUpEnv markSuccess(MemId mem, VarId var, CoalsEntry entry, Tracer tracer) {
    CoalsEntry prev = success.get(mem);
    if (prev != null && prev.conflictsWith(entry)) {
      if (tracer.enabled()) {
        tracer.trace(
            "failed %s -> %s: %s", mem, entry.dstMem, "conflicts with promotion to " + prev.dstMem);
      }
      return new BottomUpEnv(
          scalars,
          active.without(mem),
          success.without(mem),
          inhibit.add(mem, prev.dstMem).add(mem, entry.dstMem));
    }
    if (tracer.enabled()) {
      tracer.trace("promoted %s (%s) -> %s", mem, var, entry.dstMem);
    }
    return new BottomUpEnv(scalars, active.without(mem), success.append(mem, entry), inhibit);
  }
}
