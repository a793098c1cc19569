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

package org.memmerge.ir;

import com.google.common.collect.ImmutableSet;

/** How a loop iterates: a counted {@code for} or a {@code while} on a condition parameter. */
public abstract class LoopForm {

  /** Variables bound by the form inside the loop body. */
  public abstract ImmutableSet<VarId> boundVars();

  public abstract ImmutableSet<VarId> freeVars();

  public static LoopForm forLoop(String index, PrimExp bound) {
    return new For(VarId.of(index), bound);
  }

  public static LoopForm whileLoop(String cond) {
    return new While(VarId.of(cond));
  }

  /** {@code for index < bound}. */
  public static final class For extends LoopForm {
    public final VarId index;
    public final PrimExp bound;

    For(VarId index, PrimExp bound) {
      this.index = index;
      this.bound = bound;
    }

    @Override
    public ImmutableSet<VarId> boundVars() {
      return ImmutableSet.of(index);
    }

    @Override
    public ImmutableSet<VarId> freeVars() {
      return bound.freeVars();
    }

    @Override
    public String toString() {
      return "for " + index + " < " + bound;
    }
  }

  /** {@code while cond}, where cond is one of the loop's parameters. */
  public static final class While extends LoopForm {
    public final VarId cond;

    While(VarId cond) {
      this.cond = cond;
    }

    @Override
    public ImmutableSet<VarId> boundVars() {
      return ImmutableSet.of();
    }

    @Override
    public ImmutableSet<VarId> freeVars() {
      return ImmutableSet.of();
    }

    @Override
    public String toString() {
      return "while " + cond;
    }
  }
}
