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

/** One element of an array slice: either a fixed index or a strided range. */
public abstract class DimIndex {

  public abstract ImmutableSet<VarId> freeVars();

  public static DimIndex fix(PrimExp index) {
    return new Fix(index);
  }

  public static DimIndex range(PrimExp start, PrimExp length, PrimExp stride) {
    return new Range(start, length, stride);
  }

  /** Selects a single position, removing the dimension. */
  public static final class Fix extends DimIndex {
    public final PrimExp index;

    Fix(PrimExp index) {
      this.index = index;
    }

    @Override
    public ImmutableSet<VarId> freeVars() {
      return index.freeVars();
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof Fix fix && fix.index.equals(index);
    }

    @Override
    public int hashCode() {
      return index.hashCode();
    }

    @Override
    public String toString() {
      return index.toString();
    }
  }

  /** Selects {@code length} positions starting at {@code start}, {@code stride} apart. */
  public static final class Range extends DimIndex {
    public final PrimExp start;
    public final PrimExp length;
    public final PrimExp stride;

    Range(PrimExp start, PrimExp length, PrimExp stride) {
      this.start = start;
      this.length = length;
      this.stride = stride;
    }

    @Override
    public ImmutableSet<VarId> freeVars() {
      return ImmutableSet.<VarId>builder()
          .addAll(start.freeVars())
          .addAll(length.freeVars())
          .addAll(stride.freeVars())
          .build();
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof Range r
          && r.start.equals(start)
          && r.length.equals(length)
          && r.stride.equals(stride);
    }

    @Override
    public int hashCode() {
      return start.hashCode() + 31 * (length.hashCode() + 31 * stride.hashCode());
    }

    @Override
    public String toString() {
      return String.format("%s:+%s*%s", start, length, stride);
    }
  }
}
