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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/** A sequence of statements followed by a list of results. */
public final class Body {
  private final ImmutableList<Stm> stms;
  private final ImmutableList<PrimExp> result;
  private final ImmutableSet<VarId> freeVars;

  public Body(List<Stm> stms, List<PrimExp> result) {
    this.stms = ImmutableList.copyOf(stms);
    this.result = ImmutableList.copyOf(result);
    Set<VarId> used = new HashSet<>();
    Set<VarId> bound = new HashSet<>();
    for (Stm stm : this.stms) {
      used.addAll(stm.freeVars());
      bound.addAll(stm.boundVars());
    }
    used.addAll(PrimExp.freeVars(this.result));
    this.freeVars = ImmutableSet.copyOf(Sets.difference(used, bound));
  }

  public ImmutableList<Stm> stms() {
    return stms;
  }

  public ImmutableList<PrimExp> result() {
    return result;
  }

  /** Variables used by this body but not bound by any of its statements. */
  public ImmutableSet<VarId> freeVars() {
    return freeVars;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Accumulates statements; mostly useful for constructing test programs. */
  public static final class Builder {
    private final List<Stm> stms = new ArrayList<>();

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder add(Stm stm) {
      stms.add(stm);
      return this;
    }

    /** Adds an allocation statement and returns the new block. */
    public MemId alloc(String name, PrimExp size) {
      MemId mem = MemId.of(name);
      stms.add(new Stm.Alloc(mem, size));
      return mem;
    }

    /** Adds an i64 scalar binding. */
    public VarId scalar(String name, PrimExp exp) {
      return let(PatElem.scalar(name, PrimType.I64), new Exp.ScalarExp(exp));
    }

    /** Adds a single-element binding and returns the bound variable. */
    public VarId let(PatElem elem, Exp exp) {
      stms.add(new Stm.Let(Pattern.of(elem), exp));
      return elem.name;
    }

    /** Adds a binding and returns the statement. */
    public Stm.Let let(Pattern pattern, Exp exp) {
      Stm.Let stm = new Stm.Let(pattern, exp);
      stms.add(stm);
      return stm;
    }

    /** The most recently added statement. */
    public Stm last() {
      Preconditions.checkState(!stms.isEmpty());
      return stms.get(stms.size() - 1);
    }

    public Body build(PrimExp... result) {
      return new Body(stms, Arrays.asList(result));
    }

    public Body build(VarId... result) {
      return build(Arrays.stream(result).map(PrimExp::var).toArray(PrimExp[]::new));
    }
  }
}
