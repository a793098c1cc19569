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
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A linear memory access descriptor: an offset plus, for each dimension, a stride and a size. An
 * Lmad maps a multi-index {@code (i_0, ..., i_k)} to {@code offset + sum(stride_j * i_j)}.
 */
public final class Lmad {

  /** One dimension of an Lmad. */
  public record Dim(PrimExp stride, PrimExp shape) {
    @Override
    public String toString() {
      return shape + ":" + stride;
    }
  }

  public final PrimExp offset;
  public final ImmutableList<Dim> dims;

  public Lmad(PrimExp offset, List<Dim> dims) {
    this.offset = offset;
    this.dims = ImmutableList.copyOf(dims);
  }

  /** The contiguous row-major layout of an array with the given shape, starting at 0. */
  public static Lmad rowMajor(List<PrimExp> shape) {
    return new Lmad(PrimExp.ZERO, rowMajorDims(shape));
  }

  static ImmutableList<Dim> rowMajorDims(List<PrimExp> shape) {
    List<PrimExp> strides = rowMajorStrides(shape);
    ImmutableList.Builder<Dim> builder = ImmutableList.builder();
    for (int i = 0; i < shape.size(); i++) {
      builder.add(new Dim(strides.get(i), shape.get(i)));
    }
    return builder.build();
  }

  /** The strides of a contiguous row-major array with the given shape. */
  public static ImmutableList<PrimExp> rowMajorStrides(List<PrimExp> shape) {
    PrimExp[] strides = new PrimExp[shape.size()];
    PrimExp stride = PrimExp.ONE;
    for (int i = shape.size() - 1; i >= 0; i--) {
      strides[i] = stride;
      stride = PrimExp.mul(stride, shape.get(i));
    }
    return ImmutableList.copyOf(strides);
  }

  public int rank() {
    return dims.size();
  }

  public ImmutableList<PrimExp> shape() {
    return dims.stream().map(Dim::shape).collect(ImmutableList.toImmutableList());
  }

  /** True if this Lmad's strides are exactly the row-major strides of its shape. */
  public boolean isContiguousRowMajor() {
    List<PrimExp> expected = rowMajorStrides(shape());
    for (int i = 0; i < dims.size(); i++) {
      if (!dims.get(i).stride.equals(expected.get(i))) {
        return false;
      }
    }
    return true;
  }

  /** Returns the (symbolic) offset of the element at the given multi-index. */
  public PrimExp apply(List<PrimExp> index) {
    Preconditions.checkArgument(index.size() == dims.size(), "rank mismatch");
    PrimExp result = offset;
    for (int i = 0; i < dims.size(); i++) {
      result = PrimExp.add(result, PrimExp.mul(dims.get(i).stride, index.get(i)));
    }
    return result;
  }

  /**
   * Restricts this Lmad by a slice. Dimensions beyond the end of the slice are kept whole; fixed
   * indices drop their dimension.
   */
  public Lmad slice(List<DimIndex> slice) {
    Preconditions.checkArgument(slice.size() <= dims.size(), "slice longer than rank");
    PrimExp newOffset = offset;
    List<Dim> newDims = new ArrayList<>();
    for (int i = 0; i < dims.size(); i++) {
      Dim dim = dims.get(i);
      if (i >= slice.size()) {
        newDims.add(dim);
      } else if (slice.get(i) instanceof DimIndex.Fix fix) {
        newOffset = PrimExp.add(newOffset, PrimExp.mul(fix.index, dim.stride));
      } else {
        DimIndex.Range range = (DimIndex.Range) slice.get(i);
        newOffset = PrimExp.add(newOffset, PrimExp.mul(range.start, dim.stride));
        newDims.add(new Dim(PrimExp.mul(dim.stride, range.stride), range.length));
      }
    }
    return new Lmad(newOffset, newDims);
  }

  /** Reorders the dimensions: dimension {@code i} of the result is dimension {@code perm[i]}. */
  public Lmad permute(List<Integer> perm) {
    Preconditions.checkArgument(perm.size() == dims.size(), "permutation of wrong rank");
    return new Lmad(offset, perm.stream().map(dims::get).collect(ImmutableList.toImmutableList()));
  }

  public Lmad withOffset(PrimExp newOffset) {
    return new Lmad(newOffset, dims);
  }

  public Lmad substitute(Map<VarId, PrimExp> subst) {
    return new Lmad(
        offset.substitute(subst),
        dims.stream()
            .map(d -> new Dim(d.stride.substitute(subst), d.shape.substitute(subst)))
            .collect(ImmutableList.toImmutableList()));
  }

  public ImmutableSet<VarId> freeVars() {
    ImmutableSet.Builder<VarId> builder = ImmutableSet.builder();
    builder.addAll(offset.freeVars());
    for (Dim d : dims) {
      builder.addAll(d.stride.freeVars()).addAll(d.shape.freeVars());
    }
    return builder.build();
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof Lmad lmad && lmad.offset.equals(offset) && lmad.dims.equals(dims);
  }

  @Override
  public int hashCode() {
    return Objects.hash(offset, dims);
  }

  @Override
  public String toString() {
    return offset + "+" + dims;
  }
}
