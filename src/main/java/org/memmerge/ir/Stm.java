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

/**
 * A statement in a {@link Body}. Statements are compared by identity, so that per-statement
 * information (such as last uses) can be keyed by the statement itself.
 */
public abstract class Stm {

  /** The variables this statement reads, including those read by any nested bodies. */
  public abstract ImmutableSet<VarId> freeVars();

  /** The variables this statement binds. */
  public abstract ImmutableSet<VarId> boundVars();

  /** Allocates a memory block of the given size in bytes. */
  public static final class Alloc extends Stm {
    public final MemId mem;
    public final PrimExp size;

    public Alloc(MemId mem, PrimExp size) {
      this.mem = mem;
      this.size = size;
    }

    @Override
    public ImmutableSet<VarId> freeVars() {
      return size.freeVars();
    }

    @Override
    public ImmutableSet<VarId> boundVars() {
      return ImmutableSet.of();
    }

    @Override
    public String toString() {
      return "let " + mem + " = alloc(" + size + ")";
    }
  }

  /** Binds the result of an expression to a pattern. */
  public static final class Let extends Stm {
    public final Pattern pattern;
    public final Exp exp;
    private final ImmutableSet<VarId> freeVars;

    public Let(Pattern pattern, Exp exp) {
      this.pattern = pattern;
      this.exp = exp;
      ImmutableSet.Builder<VarId> builder = ImmutableSet.<VarId>builder().addAll(exp.freeVars());
      pattern
          .elements()
          .filter(PatElem::isInPlace)
          .forEach(
              pe -> {
                builder.add(pe.update.source());
                pe.update.slice().forEach(d -> builder.addAll(d.freeVars()));
              });
      this.freeVars = builder.build();
    }

    @Override
    public ImmutableSet<VarId> freeVars() {
      return freeVars;
    }

    @Override
    public ImmutableSet<VarId> boundVars() {
      return pattern.names();
    }

    @Override
    public String toString() {
      return "let " + pattern.values() + " = " + exp;
    }
  }
}
