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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.Arrays;
import org.jspecify.annotations.Nullable;

/**
 * One variable bound by a pattern. Array-typed elements carry a {@link MemBinding}; an element may
 * also be an in-place update of an existing array ({@code x' = x with [slice] <- ...}), in which
 * case {@link #update} names the array being updated.
 */
public final class PatElem {

  /** The array updated by an in-place binding and the slice that is overwritten. */
  public record InPlace(VarId source, ImmutableList<DimIndex> slice) {}

  public final VarId name;
  public final Type type;
  public final @Nullable MemBinding mem;
  public final @Nullable InPlace update;

  /** Variables whose memory this one may share. */
  public final ImmutableSet<VarId> aliases;

  public PatElem(
      VarId name,
      Type type,
      @Nullable MemBinding mem,
      @Nullable InPlace update,
      ImmutableSet<VarId> aliases) {
    this.name = name;
    this.type = type;
    this.mem = mem;
    this.update = update;
    this.aliases = aliases;
  }

  public static PatElem scalar(String name, PrimType type) {
    return new PatElem(VarId.of(name), Type.scalar(type), null, null, ImmutableSet.of());
  }

  /** An array in a fresh row-major layout of {@code mem}. */
  public static PatElem array(String name, Type type, MemId mem) {
    return array(name, type, mem, IxFun.iota(type.shape()));
  }

  public static PatElem array(String name, Type type, MemId mem, IxFun ixfun) {
    return new PatElem(
        VarId.of(name), type, new MemBinding(mem, ixfun), null, ImmutableSet.of());
  }

  /** Returns a copy of this element that updates {@code source} in place at {@code slice}. */
  public PatElem inPlace(VarId source, DimIndex... slice) {
    return new PatElem(
        name, type, mem, new InPlace(source, ImmutableList.copyOf(slice)), aliases);
  }

  public PatElem withAliases(VarId... vars) {
    return new PatElem(name, type, mem, update, ImmutableSet.copyOf(Arrays.asList(vars)));
  }

  public boolean isInPlace() {
    return update != null;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder().append(name).append(": ").append(type);
    if (mem != null) {
      sb.append(" @ ").append(mem);
    }
    if (update != null) {
      sb.append(" <- ").append(update.source()).append(update.slice());
    }
    return sb.toString();
  }
}
