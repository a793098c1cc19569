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

import com.google.common.collect.ImmutableList;
import org.memmerge.ir.Body;
import org.memmerge.ir.DimIndex;
import org.memmerge.ir.Exp;
import org.memmerge.ir.FunDef;
import org.memmerge.ir.FunctionBuilder;
import org.memmerge.ir.IxFun;
import org.memmerge.ir.LoopForm;
import org.memmerge.ir.MemId;
import org.memmerge.ir.Param;
import org.memmerge.ir.PatElem;
import org.memmerge.ir.PrimExp;
import org.memmerge.ir.PrimType;
import org.memmerge.ir.Type;
import org.memmerge.ir.VarId;

/** Small functions exercising each of the coalescing rules. */
final class Programs {
  private Programs() {}

  static final PrimExp N = PrimExp.var("n");
  static final PrimExp M = PrimExp.var("m");
  static final Type VEC = Type.array(PrimType.I32, "n");
  static final Type MAT = Type.array(PrimType.I32, "n", "n");
  static final Type CUBE = Type.array(PrimType.I32, "n", "n", "n");

  static MemId mem(String name) {
    return MemId.of(name);
  }

  static VarId var(String name) {
    return VarId.of(name);
  }

  static PatElem vec(String name, String mem) {
    return PatElem.array(name, VEC, mem(mem));
  }

  static PrimExp bytes(Type type) {
    return PrimExp.mul(PrimExp.product(type.shape()), PrimExp.constant(4));
  }

  /** Every program above, in each of its variants. */
  static ImmutableList<FunDef> all() {
    return ImmutableList.of(
        copyOfFreshArray(false),
        copyOfFreshArray(true),
        copyOfLiveArray(),
        updateRow(false),
        updateRow(true),
        updateRowWhileAliasIsRead(false),
        updateRowWhileAliasIsRead(true),
        reusedSourceBlock(),
        copyOfView(),
        updateAtComputedIndex(false),
        updateAtComputedIndex(true),
        loopAccumulator(),
        branchResults(),
        branchesDisagree(),
        inPlaceChain(),
        concat(),
        transposeCopy());
  }

  /**
   * <pre>
   *   t0 = map(ns) @ m_t0
   *   t1 = copy(t0) @ m_t1
   * </pre>
   *
   * with m_t1 allocated before or after t0.
   */
  static FunDef copyOfFreshArray(boolean allocBeforeSource) {
    FunctionBuilder fb = new FunctionBuilder("copyOfFreshArray");
    fb.scalarParam("n", PrimType.I64);
    VarId ns = fb.arrayParam("ns", VEC, mem("m_ns"), false);
    Body.Builder b = Body.builder();
    if (allocBeforeSource) {
      b.alloc("m_t1", bytes(VEC));
    }
    b.alloc("m_t0", bytes(VEC));
    VarId t0 = b.let(vec("t0", "m_t0"), new Exp.Apply("map", PrimExp.var(ns)));
    if (!allocBeforeSource) {
      b.alloc("m_t1", bytes(VEC));
    }
    VarId t1 = b.let(vec("t1", "m_t1"), new Exp.Copy(t0));
    return fb.build(b.build(t1));
  }

  /** Like {@link #copyOfFreshArray}, but t0 is returned too. */
  static FunDef copyOfLiveArray() {
    FunctionBuilder fb = new FunctionBuilder("copyOfLiveArray");
    fb.scalarParam("n", PrimType.I64);
    VarId ns = fb.arrayParam("ns", VEC, mem("m_ns"), false);
    Body.Builder b = Body.builder();
    b.alloc("m_t1", bytes(VEC));
    b.alloc("m_t0", bytes(VEC));
    VarId t0 = b.let(vec("t0", "m_t0"), new Exp.Apply("map", PrimExp.var(ns)));
    VarId t1 = b.let(vec("t1", "m_t1"), new Exp.Copy(t0));
    return fb.build(b.build(t0, t1));
  }

  /**
   * <pre>
   *   ys = map(n) @ m_ys
   *   xi = xs[i] @ m_xs          (if readRow)
   *   zs = map(xi) @ m_zs        (if readRow)
   *   xs' = xs with [i] <- copy(ys)
   * </pre>
   *
   * where xs is a unique [n][n] parameter.
   */
  static FunDef updateRow(boolean readRow) {
    FunctionBuilder fb = new FunctionBuilder("updateRow");
    fb.scalarParam("n", PrimType.I64);
    VarId i = fb.scalarParam("i", PrimType.I64);
    VarId xs = fb.arrayParam("xs", MAT, mem("m_xs"), true);
    Body.Builder b = Body.builder();
    b.alloc("m_ys", bytes(VEC));
    VarId ys = b.let(vec("ys", "m_ys"), new Exp.Apply("map", N));
    ImmutableList.Builder<VarId> results = ImmutableList.builder();
    DimIndex row = DimIndex.fix(PrimExp.var(i));
    if (readRow) {
      IxFun rowIxFun = IxFun.iota(N, N).slice(ImmutableList.of(row));
      VarId xi =
          b.let(
              PatElem.array("xi", VEC, mem("m_xs"), rowIxFun),
              new Exp.Index(xs, ImmutableList.of(row)));
      b.alloc("m_zs", bytes(VEC));
      results.add(b.let(vec("zs", "m_zs"), new Exp.Apply("map", PrimExp.var(xi))));
    }
    VarId xs2 =
        b.let(PatElem.array("xs2", MAT, mem("m_xs")).inPlace(xs, row), new Exp.Copy(ys));
    results.add(xs2);
    return fb.build(b.build(results.build().toArray(new VarId[0])));
  }

  /**
   * <pre>
   *   v = view(n) @ m_v          (declared to alias xs if viaAlias)
   *   ys = map(n) @ m_ys
   *   s = sum(v)
   *   xs' = xs with [i] <- copy(ys)
   * </pre>
   *
   * where xs is a unique [n][n] parameter.
   */
  static FunDef updateRowWhileAliasIsRead(boolean viaAlias) {
    FunctionBuilder fb = new FunctionBuilder("updateRowWhileAliasIsRead");
    fb.scalarParam("n", PrimType.I64);
    VarId i = fb.scalarParam("i", PrimType.I64);
    VarId xs = fb.arrayParam("xs", MAT, mem("m_xs"), true);
    Body.Builder b = Body.builder();
    b.alloc("m_v", bytes(VEC));
    PatElem v = vec("v", "m_v");
    VarId vv = b.let(viaAlias ? v.withAliases(xs) : v, new Exp.Apply("view", N));
    b.alloc("m_ys", bytes(VEC));
    VarId ys = b.let(vec("ys", "m_ys"), new Exp.Apply("map", N));
    b.let(PatElem.scalar("s", PrimType.I64), new Exp.Apply("sum", PrimExp.var(vv)));
    DimIndex row = DimIndex.fix(PrimExp.var(i));
    VarId xs2 =
        b.let(PatElem.array("xs2", MAT, mem("m_xs")).inPlace(xs, row), new Exp.Copy(ys));
    return fb.build(b.build(xs2));
  }

  /**
   * <pre>
   *   b1 = map(zs) @ m_b
   *   y = copy(b1) @ m_y
   *   b2 = map(zs) @ m_b
   *   z = copy(b2) @ m_z
   * </pre>
   */
  static FunDef reusedSourceBlock() {
    FunctionBuilder fb = new FunctionBuilder("reusedSourceBlock");
    fb.scalarParam("n", PrimType.I64);
    VarId zs = fb.arrayParam("zs", VEC, mem("m_zs"), false);
    Body.Builder b = Body.builder();
    b.alloc("m_y", bytes(VEC));
    b.alloc("m_z", bytes(VEC));
    b.alloc("m_b", bytes(VEC));
    VarId b1 = b.let(vec("b1", "m_b"), new Exp.Apply("map", PrimExp.var(zs)));
    VarId y = b.let(vec("y", "m_y"), new Exp.Copy(b1));
    VarId b2 = b.let(vec("b2", "m_b"), new Exp.Apply("map", PrimExp.var(zs)));
    VarId z = b.let(vec("z", "m_z"), new Exp.Copy(b2));
    return fb.build(b.build(y, z));
  }

  /**
   * <pre>
   *   xs = map(n) @ m_xs
   *   t0 = xs[0:n] @ m_xs
   *   t1 = copy(t0) @ m_t1
   * </pre>
   */
  static FunDef copyOfView() {
    FunctionBuilder fb = new FunctionBuilder("copyOfView");
    fb.scalarParam("n", PrimType.I64);
    Body.Builder b = Body.builder();
    b.alloc("m_t1", bytes(MAT));
    b.alloc("m_xs", bytes(MAT));
    VarId xs = b.let(PatElem.array("xs", MAT, mem("m_xs")), new Exp.Apply("map", N));
    ImmutableList<DimIndex> all =
        ImmutableList.of(DimIndex.range(PrimExp.ZERO, N, PrimExp.ONE));
    VarId t0 =
        b.let(
            PatElem.array("t0", MAT, mem("m_xs"), IxFun.iota(N, N).slice(all)),
            new Exp.Index(xs, all));
    VarId t1 = b.let(PatElem.array("t1", MAT, mem("m_t1")), new Exp.Copy(t0));
    return fb.build(b.build(t1));
  }

  /**
   * <pre>
   *   b = map(zs) @ m_b
   *   j = argmax(zs)     or     j = n - 1
   *   ys' = ys with [j] <- copy(b)
   * </pre>
   *
   * where ys is a unique [n][n] parameter.
   */
  static FunDef updateAtComputedIndex(boolean indexIsScalarExp) {
    FunctionBuilder fb = new FunctionBuilder("updateAtComputedIndex");
    VarId n = fb.scalarParam("n", PrimType.I64);
    VarId zs = fb.arrayParam("zs", VEC, mem("m_zs"), false);
    VarId ys = fb.arrayParam("ys", MAT, mem("m_ys"), true);
    Body.Builder b = Body.builder();
    b.alloc("m_b", bytes(VEC));
    VarId vb = b.let(vec("b", "m_b"), new Exp.Apply("map", PrimExp.var(zs)));
    VarId j;
    if (indexIsScalarExp) {
      j = b.scalar("j", PrimExp.sub(PrimExp.var(n), PrimExp.ONE));
    } else {
      j = b.let(PatElem.scalar("j", PrimType.I64), new Exp.Apply("argmax", PrimExp.var(zs)));
    }
    VarId ys2 =
        b.let(
            PatElem.array("ys2", MAT, mem("m_ys")).inPlace(ys, DimIndex.fix(PrimExp.var(j))),
            new Exp.Copy(vb));
    return fb.build(b.build(ys2));
  }

  /**
   * <pre>
   *   a0 = replicate(n) @ m_a0
   *   b = loop (a @ m_a = a0) for i < n {
   *     x = map(a) @ m_x
   *     r = copy(x) @ m_r
   *   } @ m_b
   *   z = copy(b) @ m_z
   * </pre>
   */
  static FunDef loopAccumulator() {
    FunctionBuilder fb = new FunctionBuilder("loopAccumulator");
    fb.scalarParam("n", PrimType.I64);
    Body.Builder body = Body.builder();
    body.alloc("m_x", bytes(VEC));
    VarId x = body.let(vec("x", "m_x"), new Exp.Apply("map", PrimExp.var("a")));
    VarId r = body.let(vec("r", "m_r"), new Exp.Copy(x));

    Body.Builder b = Body.builder();
    b.alloc("m_z", bytes(VEC));
    b.alloc("m_a0", bytes(VEC));
    b.alloc("m_r", bytes(VEC));
    VarId a0 = b.let(vec("a0", "m_a0"), new Exp.Apply("replicate", N));
    Param a = Param.array("a", VEC, mem("m_a"), false);
    VarId vb =
        b.let(
            vec("b", "m_b"),
            Exp.Loop.of(
                new Exp.LoopParam(a, PrimExp.var(a0)),
                LoopForm.forLoop("i", N),
                body.build(r)));
    VarId z = b.let(vec("z", "m_z"), new Exp.Copy(vb));
    return fb.build(b.build(z));
  }

  /**
   * <pre>
   *   b = if c then { r1 = map(xs) @ m_r1 } else { r2 = map(xs) @ m_r2 } @ m_b
   *   y = copy(b) @ m_y
   * </pre>
   */
  static FunDef branchResults() {
    FunctionBuilder fb = new FunctionBuilder("branchResults");
    fb.scalarParam("n", PrimType.I64);
    VarId c = fb.scalarParam("c", PrimType.BOOL);
    VarId xs = fb.arrayParam("xs", VEC, mem("m_xs"), false);
    Body.Builder then = Body.builder();
    VarId r1 = then.let(vec("r1", "m_r1"), new Exp.Apply("map", PrimExp.var(xs)));
    Body.Builder otherwise = Body.builder();
    VarId r2 = otherwise.let(vec("r2", "m_r2"), new Exp.Apply("map", PrimExp.var(xs)));

    Body.Builder b = Body.builder();
    b.alloc("m_y", bytes(VEC));
    b.alloc("m_r1", bytes(VEC));
    b.alloc("m_r2", bytes(VEC));
    VarId vb =
        b.let(vec("b", "m_b"), new Exp.If(PrimExp.var(c), then.build(r1), otherwise.build(r2)));
    VarId y = b.let(vec("y", "m_y"), new Exp.Copy(vb));
    return fb.build(b.build(y));
  }

  /**
   * <pre>
   *   b = if c then { t = map(xs) @ m_s; p = copy(t) @ m_p }
   *       else { u = map(xs) @ m_s; q = copy(u) @ m_q } @ m_b
   * </pre>
   */
  static FunDef branchesDisagree() {
    FunctionBuilder fb = new FunctionBuilder("branchesDisagree");
    fb.scalarParam("n", PrimType.I64);
    VarId c = fb.scalarParam("c", PrimType.BOOL);
    VarId xs = fb.arrayParam("xs", VEC, mem("m_xs"), false);
    Body.Builder then = Body.builder();
    VarId t = then.let(vec("t", "m_s"), new Exp.Apply("map", PrimExp.var(xs)));
    VarId p = then.let(vec("p", "m_p"), new Exp.Copy(t));
    Body.Builder otherwise = Body.builder();
    VarId u = otherwise.let(vec("u", "m_s"), new Exp.Apply("map", PrimExp.var(xs)));
    VarId q = otherwise.let(vec("q", "m_q"), new Exp.Copy(u));

    Body.Builder b = Body.builder();
    b.alloc("m_s", bytes(VEC));
    b.alloc("m_p", bytes(VEC));
    b.alloc("m_q", bytes(VEC));
    b.alloc("m_b", bytes(VEC));
    VarId vb =
        b.let(vec("b", "m_b"), new Exp.If(PrimExp.var(c), then.build(p), otherwise.build(q)));
    return fb.build(b.build(vb));
  }

  /**
   * <pre>
   *   x0 = replicate(n) @ m_x
   *   b = map(zs) @ m_b
   *   x1 = x0 with [j] <- copy(b)
   *   y' = y with [i] <- copy(x1)
   * </pre>
   *
   * where y is a unique [n][n][n] parameter.
   */
  static FunDef inPlaceChain() {
    FunctionBuilder fb = new FunctionBuilder("inPlaceChain");
    fb.scalarParam("n", PrimType.I64);
    VarId i = fb.scalarParam("i", PrimType.I64);
    VarId j = fb.scalarParam("j", PrimType.I64);
    VarId zs = fb.arrayParam("zs", VEC, mem("m_zs"), false);
    VarId y = fb.arrayParam("y", CUBE, mem("m_y"), true);
    Body.Builder b = Body.builder();
    b.alloc("m_x", bytes(MAT));
    b.alloc("m_b", bytes(VEC));
    VarId x0 = b.let(PatElem.array("x0", MAT, mem("m_x")), new Exp.Apply("replicate", N));
    VarId vb = b.let(vec("b", "m_b"), new Exp.Apply("map", PrimExp.var(zs)));
    VarId x1 =
        b.let(
            PatElem.array("x1", MAT, mem("m_x")).inPlace(x0, DimIndex.fix(PrimExp.var(j))),
            new Exp.Copy(vb));
    VarId y2 =
        b.let(
            PatElem.array("y2", CUBE, mem("m_y")).inPlace(y, DimIndex.fix(PrimExp.var(i))),
            new Exp.Copy(x1));
    return fb.build(b.build(y2));
  }

  /**
   * <pre>
   *   a = map(zs) @ m_a
   *   b = map(zs) @ m_b
   *   c = concat(a, b) @ m_c
   * </pre>
   */
  static FunDef concat() {
    FunctionBuilder fb = new FunctionBuilder("concat");
    fb.scalarParam("n", PrimType.I64);
    VarId zs = fb.arrayParam("zs", VEC, mem("m_zs"), false);
    Type both = Type.array(PrimType.I32, PrimExp.add(N, N));
    Body.Builder b = Body.builder();
    b.alloc("m_c", bytes(both));
    VarId a = b.let(vec("a", "m_a"), new Exp.Apply("map", PrimExp.var(zs)));
    VarId vb = b.let(vec("b", "m_b"), new Exp.Apply("map", PrimExp.var(zs)));
    VarId c = b.let(PatElem.array("c", both, mem("m_c")), new Exp.Concat(ImmutableList.of(a, vb)));
    return fb.build(b.build(c));
  }

  /**
   * <pre>
   *   a = map(zs) @ m_a            [n][m]
   *   b = rearrange(a, 1, 0) @ m_a [m][n]
   *   y = copy(b) @ m_y            [m][n]
   * </pre>
   */
  static FunDef transposeCopy() {
    FunctionBuilder fb = new FunctionBuilder("transposeCopy");
    fb.scalarParam("n", PrimType.I64);
    fb.scalarParam("m", PrimType.I64);
    VarId zs = fb.arrayParam("zs", VEC, mem("m_zs"), false);
    Type nm = Type.array(PrimType.I32, "n", "m");
    Type mn = Type.array(PrimType.I32, "m", "n");
    Body.Builder b = Body.builder();
    b.alloc("m_y", bytes(mn));
    VarId a = b.let(PatElem.array("a", nm, mem("m_a")), new Exp.Apply("map", PrimExp.var(zs)));
    IxFun transposed = IxFun.iota(N, M).permute(ImmutableList.of(1, 0));
    VarId vb = b.let(PatElem.array("b", mn, mem("m_a"), transposed), new Exp.Rearrange(a, 1, 0));
    VarId y = b.let(PatElem.array("y", mn, mem("m_y")), new Exp.Copy(vb));
    return fb.build(b.build(y));
  }
}
