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
import com.google.common.collect.Iterables;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * An index function maps the multi-index of an array element to its offset in the array's memory
 * block.
 *
 * <p>An IxFun has a <i>base</i> shape (the shape of the block's row-major layout) and a non-empty
 * chain of {@link Lmad}s. The first Lmad produces an offset into the row-major layout of the base.
 * Each later Lmad produces an offset into the row-major layout of the previous Lmad's shape; that
 * offset is unflattened and fed to the previous Lmad. The last Lmad's shape is the array's shape.
 *
 * <p>Most index functions have a single Lmad. Chains arise from reshapes of non-contiguous views
 * and from {@link #rebase} when the two layouts cannot be fused.
 */
public final class IxFun {

  public final ImmutableList<PrimExp> base;
  public final ImmutableList<Lmad> lmads;

  public IxFun(List<PrimExp> base, List<Lmad> lmads) {
    Preconditions.checkArgument(!lmads.isEmpty(), "an index function needs at least one Lmad");
    this.base = ImmutableList.copyOf(base);
    this.lmads = ImmutableList.copyOf(lmads);
  }

  /** The identity index function of a fresh row-major array with the given shape. */
  public static IxFun iota(List<PrimExp> shape) {
    return new IxFun(shape, ImmutableList.of(Lmad.rowMajor(shape)));
  }

  public static IxFun iota(PrimExp... shape) {
    return iota(Arrays.asList(shape));
  }

  private Lmad last() {
    return Iterables.getLast(lmads);
  }

  private IxFun withLast(Lmad lmad) {
    List<Lmad> newLmads = new ArrayList<>(lmads.subList(0, lmads.size() - 1));
    newLmads.add(lmad);
    return new IxFun(base, newLmads);
  }

  public int rank() {
    return last().rank();
  }

  public ImmutableList<PrimExp> shape() {
    return last().shape();
  }

  /**
   * True if this is the row-major layout of its base, i.e. the array covers its whole block in
   * the natural order.
   */
  public boolean isDirect() {
    Lmad lmad = last();
    return lmads.size() == 1
        && lmad.offset.isConst(0)
        && lmad.isContiguousRowMajor()
        && lmad.shape().equals(base);
  }

  public IxFun slice(List<DimIndex> slice) {
    return withLast(last().slice(slice));
  }

  /**
   * Returns the layout of the sub-array that starts {@code offset} elements into the leading
   * dimension of this one. Used to place the operands of a concatenation.
   */
  public IxFun offsetIndex(PrimExp offset) {
    if (rank() == 0 || offset.isConst(0)) {
      return this;
    }
    PrimExp n = shape().get(0);
    return slice(ImmutableList.of(DimIndex.range(offset, PrimExp.sub(n, offset), PrimExp.ONE)));
  }

  /** Reorders the dimensions: dimension {@code i} of the result is dimension {@code perm[i]}. */
  public IxFun permute(List<Integer> perm) {
    return withLast(last().permute(perm));
  }

  /** Returns the layout of this array reshaped to {@code newShape} (same element count). */
  public IxFun reshape(List<PrimExp> newShape) {
    Lmad lmad = last();
    if (lmad.isContiguousRowMajor()) {
      return withLast(new Lmad(lmad.offset, Lmad.rowMajorDims(newShape)));
    }
    List<Lmad> newLmads = new ArrayList<>(lmads);
    newLmads.add(Lmad.rowMajor(newShape));
    return new IxFun(base, newLmads);
  }

  /**
   * Places {@code inner} on top of {@code outer}: the result addresses the same elements as
   * {@code inner}, but within the memory described by {@code outer} instead of within the
   * row-major layout of {@code inner}'s base. Returns null if the rank of {@code outer} is not
   * the rank of {@code inner}'s base.
   */
  public static @Nullable IxFun rebase(IxFun outer, IxFun inner) {
    if (outer.rank() != inner.base.size()) {
      return null;
    }
    if (inner.isDirect()) {
      return outer;
    }
    Lmad top = outer.last();
    Lmad first = inner.lmads.get(0);
    List<Lmad> result = new ArrayList<>(outer.lmads.subList(0, outer.lmads.size() - 1));
    if (top.isContiguousRowMajor() && sameTrailingDims(top.shape(), inner.base)) {
      // The linear offsets that first produces are exactly the offsets within top.
      result.add(first.withOffset(PrimExp.add(top.offset, first.offset)));
    } else {
      result.add(top);
      result.add(first);
    }
    result.addAll(inner.lmads.subList(1, inner.lmads.size()));
    return new IxFun(outer.base, result);
  }

  private static boolean sameTrailingDims(List<PrimExp> x, List<PrimExp> y) {
    return x.size() == y.size()
        && (x.isEmpty() || x.subList(1, x.size()).equals(y.subList(1, y.size())));
  }

  /**
   * Finds a layout {@code B} for the base of {@code view} such that {@code rebase(B, view)}
   * addresses the same locations as {@code target}. Succeeds when {@code view} is the direct
   * layout of its base, a permutation of it, or a reshape of it; returns null otherwise.
   */
  public static @Nullable IxFun solveBase(IxFun target, IxFun view) {
    if (target.rank() != view.rank() || view.lmads.size() != 1) {
      return null;
    }
    Lmad lmad = view.last();
    if (!lmad.offset.isConst(0)) {
      return null;
    } else if (view.isDirect()) {
      return target;
    }
    int[] perm = findPermutation(lmad, view.base);
    if (perm != null) {
      List<Integer> inverse = new ArrayList<>(perm.length);
      for (int i = 0; i < perm.length; i++) {
        inverse.add(0);
      }
      for (int i = 0; i < perm.length; i++) {
        inverse.set(perm[i], i);
      }
      return target.permute(inverse);
    }
    if (lmad.isContiguousRowMajor()
        && PrimExp.product(lmad.shape()).equals(PrimExp.product(view.base))) {
      return target.reshape(view.base);
    }
    return null;
  }

  /**
   * If lmad's dimensions are a permutation of the row-major dimensions of base, returns {@code
   * perm} such that dimension {@code i} of lmad is dimension {@code perm[i]} of base.
   */
  private static int[] findPermutation(Lmad lmad, List<PrimExp> base) {
    if (lmad.rank() != base.size()) {
      return null;
    }
    List<Lmad.Dim> baseDims = Lmad.rowMajorDims(base);
    int[] perm = new int[lmad.rank()];
    boolean[] used = new boolean[lmad.rank()];
    for (int i = 0; i < perm.length; i++) {
      int found = -1;
      for (int j = 0; j < baseDims.size() && found < 0; j++) {
        if (!used[j] && baseDims.get(j).equals(lmad.dims.get(i))) {
          found = j;
        }
      }
      if (found < 0) {
        return null;
      }
      used[found] = true;
      perm[i] = found;
    }
    return perm;
  }

  /**
   * Returns the symbolic offset of the element at {@code index}, by applying each Lmad in turn
   * from the last to the first.
   */
  public PrimExp index(List<PrimExp> index) {
    PrimExp offset = last().apply(index);
    for (int i = lmads.size() - 2; i >= 0; i--) {
      Lmad lmad = lmads.get(i);
      offset = lmad.apply(unflatten(offset, lmad.shape()));
    }
    return offset;
  }

  private static List<PrimExp> unflatten(PrimExp offset, List<PrimExp> shape) {
    List<PrimExp> strides = Lmad.rowMajorStrides(shape);
    List<PrimExp> result = new ArrayList<>(shape.size());
    for (int i = 0; i < shape.size(); i++) {
      PrimExp q = PrimExp.div(offset, strides.get(i));
      result.add(i == 0 ? q : PrimExp.mod(q, shape.get(i)));
    }
    return result;
  }

  public IxFun substitute(Map<VarId, PrimExp> subst) {
    if (subst.isEmpty()) {
      return this;
    }
    return new IxFun(
        PrimExp.substitute(base, subst),
        lmads.stream().map(l -> l.substitute(subst)).collect(ImmutableList.toImmutableList()));
  }

  public ImmutableSet<VarId> freeVars() {
    ImmutableSet.Builder<VarId> builder = ImmutableSet.builder();
    builder.addAll(PrimExp.freeVars(base));
    lmads.forEach(l -> builder.addAll(l.freeVars()));
    return builder.build();
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof IxFun ixfun && ixfun.base.equals(base) && ixfun.lmads.equals(lmads);
  }

  @Override
  public int hashCode() {
    return Objects.hash(base, lmads);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("ixfun(");
    base.forEach(d -> sb.append('[').append(d).append(']'));
    lmads.forEach(l -> sb.append("; ").append(l));
    return sb.append(')').toString();
  }
}
