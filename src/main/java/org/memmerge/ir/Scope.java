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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * What is known about each variable in scope: its type, its memory (for arrays), and the
 * variables it may alias. Scopes are immutable; the {@code with} methods return extended copies.
 */
public final class Scope {

  /** The information recorded for one variable. */
  public record NameInfo(Type type, @Nullable MemBinding mem, ImmutableSet<VarId> aliases) {}

  public static final Scope EMPTY = new Scope(ImmutableMap.of());

  private final ImmutableMap<VarId, NameInfo> names;

  private Scope(ImmutableMap<VarId, NameInfo> names) {
    this.names = names;
  }

  private Scope extend(ImmutableMap.Builder<VarId, NameInfo> added) {
    ImmutableMap<VarId, NameInfo> newNames = added.buildKeepingLast();
    if (newNames.isEmpty()) {
      return this;
    }
    return new Scope(
        ImmutableMap.<VarId, NameInfo>builder()
            .putAll(names)
            .putAll(newNames)
            .buildKeepingLast());
  }

  public Scope with(Pattern pattern) {
    ImmutableMap.Builder<VarId, NameInfo> builder = ImmutableMap.builder();
    pattern
        .elements()
        .forEach(pe -> builder.put(pe.name, new NameInfo(pe.type, pe.mem, pe.aliases)));
    return extend(builder);
  }

  public Scope withParams(List<Param> params) {
    ImmutableMap.Builder<VarId, NameInfo> builder = ImmutableMap.builder();
    for (Param p : params) {
      builder.put(p.name(), new NameInfo(p.type(), p.mem(), ImmutableSet.of()));
    }
    return extend(builder);
  }

  /** Adds the loop's parameters and the index variable of its form. */
  public Scope withLoop(Exp.Loop loop) {
    ImmutableMap.Builder<VarId, NameInfo> builder = ImmutableMap.builder();
    for (Exp.LoopParam p : loop.ctx) {
      builder.put(p.name(), new NameInfo(p.param().type(), p.param().mem(), ImmutableSet.of()));
    }
    for (Exp.LoopParam p : loop.vals) {
      builder.put(p.name(), new NameInfo(p.param().type(), p.param().mem(), ImmutableSet.of()));
    }
    for (VarId v : loop.form.boundVars()) {
      builder.put(v, new NameInfo(Type.scalar(PrimType.I64), null, ImmutableSet.of()));
    }
    return extend(builder);
  }

  /** Adds everything bound by the given statements (but not by bodies nested in them). */
  public Scope withStms(List<Stm> stms) {
    Scope result = this;
    for (Stm stm : stms) {
      if (stm instanceof Stm.Let let) {
        result = result.with(let.pattern);
      }
    }
    return result;
  }

  public boolean contains(VarId var) {
    return names.containsKey(var);
  }

  public @Nullable NameInfo get(VarId var) {
    return names.get(var);
  }

  /** Returns the memory binding of an array variable, or null for scalars and unknown names. */
  public @Nullable MemBinding memOf(VarId var) {
    NameInfo info = names.get(var);
    return (info == null) ? null : info.mem();
  }

  public boolean isScalar(VarId var) {
    NameInfo info = names.get(var);
    return info != null && !info.type().isArray();
  }
}
