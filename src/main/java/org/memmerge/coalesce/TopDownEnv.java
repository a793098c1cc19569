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
import org.memmerge.ir.MemId;
import org.memmerge.ir.Scope;

/**
 * The information passed down into each statement: the blocks allocated so far, the variables in
 * scope, the inhibitions inherited from earlier fixed-point iterations, and the loop table of the
 * enclosing loops.
 */
final class TopDownEnv {
  final ImmutableSet<MemId> alloc;
  final Scope scope;
  final MemRelation inhibited;
  final MemRelation loops;

  TopDownEnv(ImmutableSet<MemId> alloc, Scope scope, MemRelation inhibited, MemRelation loops) {
    this.alloc = alloc;
    this.scope = scope;
    this.inhibited = inhibited;
    this.loops = loops;
  }

  static TopDownEnv initial(Scope scope, ImmutableSet<MemId> alloc, MemRelation inhibited) {
    return new TopDownEnv(alloc, scope, inhibited, MemRelation.EMPTY);
  }

  TopDownEnv withAlloc(MemId mem) {
    return new TopDownEnv(
        ImmutableSet.<MemId>builder().addAll(alloc).add(mem).build(), scope, inhibited, loops);
  }

  TopDownEnv withScope(Scope newScope) {
    return new TopDownEnv(alloc, newScope, inhibited, loops);
  }

  TopDownEnv withLoops(MemRelation newLoops) {
    return new TopDownEnv(alloc, scope, inhibited, newLoops);
  }
}
