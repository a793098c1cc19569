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

import com.google.common.collect.ImmutableSet;
import org.memmerge.ir.Stm;
import org.memmerge.ir.VarId;

/** Answers which variables a statement uses for the last time. */
public interface LastUse {

  /**
   * Returns the variables used by {@code stm} that are not live after it. A variable used only
   * inside a nested body of {@code stm} (a branch or loop body) counts as used by {@code stm}.
   */
  ImmutableSet<VarId> lastUses(Stm stm);

  default boolean isLastUse(Stm stm, VarId var) {
    return lastUses(stm).contains(var);
  }
}
