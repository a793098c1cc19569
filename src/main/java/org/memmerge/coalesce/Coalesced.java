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
import java.util.Map;
import org.memmerge.ir.IxFun;
import org.memmerge.ir.MemBinding;
import org.memmerge.ir.PrimExp;
import org.memmerge.ir.VarId;

/**
 * Where one variable will live if its block is coalesced: the destination block and the index
 * function within it. {@code substitutions} records the scalar variables that had to be replaced
 * (using the scalar table) to make the index function valid at the variable's definition.
 */
public record Coalesced(
    CoalescedKind kind, MemBinding target, ImmutableMap<VarId, PrimExp> substitutions) {

  public Coalesced(CoalescedKind kind, MemBinding target) {
    this(kind, target, ImmutableMap.of());
  }

  /** Returns a copy with the target's index function replaced. */
  Coalesced withIxFun(IxFun ixfun, Map<VarId, PrimExp> newSubstitutions) {
    return new Coalesced(
        kind, new MemBinding(target.mem(), ixfun), ImmutableMap.copyOf(newSubstitutions));
  }

  @Override
  public String toString() {
    String result = kind + " " + target;
    return substitutions.isEmpty() ? result : result + " " + substitutions;
  }
}
