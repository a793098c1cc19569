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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;
import static org.memmerge.coalesce.Programs.mem;
import static org.memmerge.coalesce.Programs.var;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.memmerge.ir.FunDef;
import org.memmerge.ir.IxFun;
import org.memmerge.ir.MemBinding;
import org.memmerge.ir.MemId;
import org.memmerge.ir.PrimExp;
import org.memmerge.ir.VarId;
import org.memmerge.liveness.LastUseAnalysis;

@RunWith(JUnit4.class)
public class ArrayCoalescingTest {

  private static final ImmutableMap<VarId, Long> ENV =
      ImmutableMap.of(var("n"), 3L, var("m"), 4L, var("i"), 1L, var("j"), 2L);

  private static long offsetOf(Coalesced coal, long index) {
    PrimExp offset = coal.target().ixfun().index(ImmutableList.of(PrimExp.constant(index)));
    return offset.evaluate(ENV::get);
  }

  @Test
  public void loopValueFollowsResultParameterAndInitializer() {
    CoalescingResult result = ArrayCoalescing.analyze(Programs.loopAccumulator());
    CoalsTable success = result.success();
    assertThat(success.keys())
        .containsExactly(mem("m_a"), mem("m_a0"), mem("m_b"), mem("m_r"))
        .inOrder();
    for (CoalsEntry entry : success.entries().values()) {
      assertThat(entry.dstMem).isEqualTo(mem("m_z"));
    }
    assertThat(success.get(mem("m_r")).vars.keySet()).containsExactly(var("r"));
    assertThat(success.get(mem("m_b")).optDeps)
        .containsExactly(var("r"), mem("m_r"), var("a"), mem("m_a"), var("a0"), mem("m_a0"));
    // x is read while r's destination holds a, so it can't share the block.
    assertThat(result.inhibited().get(mem("m_x"))).containsExactly(mem("m_z"));
    assertThat(result.iterations()).isEqualTo(2);
  }

  @Test
  public void branchValueFollowsBothResults() {
    CoalescingResult result = ArrayCoalescing.analyze(Programs.branchResults());
    assertThat(result.success().keys())
        .containsExactly(mem("m_b"), mem("m_r1"), mem("m_r2"))
        .inOrder();
    for (CoalsEntry entry : result.success().entries().values()) {
      assertThat(entry.dstMem).isEqualTo(mem("m_y"));
    }
    assertThat(result.success().get(mem("m_b")).optDeps)
        .containsExactly(var("r1"), mem("m_r1"), var("r2"), mem("m_r2"));
    assertThat(result.success().get(mem("m_r1")).optDeps).containsExactly(var("b"), mem("m_b"));
    assertThat(result.inhibited().isEmpty()).isTrue();
    assertThat(result.iterations()).isEqualTo(1);
  }

  @Test
  public void branchesDisagreeingOnDestination() {
    CoalescingResult result = ArrayCoalescing.analyze(Programs.branchesDisagree());
    assertThat(result.success().contains(mem("m_s"))).isFalse();
    assertThat(result.inhibited().get(mem("m_s"))).containsExactly(mem("m_p"), mem("m_q"));
    assertThat(result.iterations()).isEqualTo(2);
  }

  @Test
  public void inPlaceUpdatesChain() {
    CoalescingResult result = ArrayCoalescing.analyze(Programs.inPlaceChain());
    CoalsTable success = result.success();
    assertThat(success.keys()).containsExactly(mem("m_b"), mem("m_x")).inOrder();
    CoalsEntry x = success.get(mem("m_x"));
    assertThat(x.dstMem).isEqualTo(mem("m_y"));
    assertThat(x.vars.keySet()).containsExactly(var("x0"), var("x1"));
    CoalsEntry b = success.get(mem("m_b"));
    assertThat(b.dstMem).isEqualTo(mem("m_y"));
    assertThat(b.optDeps).containsExactly(var("x0"), mem("m_x"));
    assertThat(b.aliasedMems).containsExactly(mem("m_x"), mem("m_y"));
    // b lands in row j of plane i of y: (i * n * n) + (j * n).
    assertThat(offsetOf(b.vars.get(var("b")), 0)).isEqualTo(15);
    assertThat(offsetOf(b.vars.get(var("b")), 2)).isEqualTo(17);
  }

  @Test
  public void concatOperandsTakeConsecutiveRanges() {
    CoalescingResult result = ArrayCoalescing.analyze(Programs.concat());
    CoalsTable success = result.success();
    assertThat(success.keys()).containsExactly(mem("m_a"), mem("m_b")).inOrder();
    Coalesced a = success.get(mem("m_a")).vars.get(var("a"));
    Coalesced b = success.get(mem("m_b")).vars.get(var("b"));
    assertThat(a.kind()).isEqualTo(CoalescedKind.CONCAT);
    assertThat(a.target().mem()).isEqualTo(mem("m_c"));
    assertThat(offsetOf(a, 0)).isEqualTo(0);
    assertThat(offsetOf(b, 0)).isEqualTo(3);
  }

  @Test
  public void transposedViewPlacesItsSource() {
    CoalescingResult result = ArrayCoalescing.analyze(Programs.transposeCopy());
    CoalsEntry entry = result.success().get(mem("m_a"));
    assertThat(entry.dstMem).isEqualTo(mem("m_y"));
    assertThat(entry.vars.keySet()).containsExactly(var("a"), var("b"));
    assertThat(entry.vars.get(var("b")).target().ixfun())
        .isEqualTo(IxFun.iota(Programs.M, Programs.N));
    assertThat(entry.vars.get(var("a")).target().ixfun().lmads.get(0).dims.toString())
        .isEqualTo("[n:1, m:n]");
  }

  @Test
  public void reusedSourceBlockIsPlacedOnce() {
    CoalescingResult result = ArrayCoalescing.analyze(Programs.reusedSourceBlock());
    // b2 is placed in m_z first, but b1 shares m_b and is defined earlier, so that fails; on the
    // next pass b1 is placed in m_y instead.
    assertThat(result.success().keys()).containsExactly(mem("m_b"));
    CoalsEntry entry = result.success().get(mem("m_b"));
    assertThat(entry.dstMem).isEqualTo(mem("m_y"));
    assertThat(entry.vars.keySet()).containsExactly(var("b1"));
    assertThat(result.inhibited().get(mem("m_b"))).containsExactly(mem("m_z"));
    assertThat(result.iterations()).isEqualTo(2);
  }

  @Test
  public void committedEntriesAgreeWithTheirVariables() {
    for (FunDef fun : Programs.all()) {
      CoalsTable success = ArrayCoalescing.analyze(fun).success();
      for (CoalsEntry entry : success.entries().values()) {
        for (Coalesced coal : entry.vars.values()) {
          assertThat(coal.target().mem()).isEqualTo(entry.dstMem);
        }
      }
    }
  }

  @Test
  public void fixedPointTerminatesDespiteCyclicDependencies() {
    FunDef fun = Programs.loopAccumulator();
    CoalescingResult result = ArrayCoalescing.analyze(fun);
    // b's placement relies on r and a, which stand for b itself on other iterations.
    assertThat(result.success().get(mem("m_b")).optDeps).containsKey(var("r"));
    assertThat(result.success().get(mem("m_a")).vars).isNotEmpty();
    assertThat(result.inhibited().get(mem("m_x"))).containsExactly(mem("m_z"));
    // Six blocks, so at most 36 pairs; every iteration but the last adds one.
    assertThat(result.iterations()).isAtMost(result.inhibited().pairCount() + 1);
    assertThat(result.iterations()).isAtMost(37);
    for (int i = 0; i < 3; i++) {
      assertThat(ArrayCoalescing.analyze(fun)).isEqualTo(result);
    }
  }

  @Test
  public void everyIterationButTheLastAddsAnInhibition() {
    for (FunDef fun : Programs.all()) {
      CoalescingResult result = ArrayCoalescing.analyze(fun);
      assertThat(result.iterations()).isAtMost(result.inhibited().pairCount() + 1);
    }
  }

  @Test
  public void analysisIsDeterministic() {
    for (FunDef fun :
        ImmutableList.of(
            Programs.loopAccumulator(),
            Programs.branchesDisagree(),
            Programs.inPlaceChain(),
            Programs.updateRow(true))) {
      assertThat(ArrayCoalescing.analyze(fun)).isEqualTo(ArrayCoalescing.analyze(fun));
    }
  }

  @Test
  public void tracing() {
    RecordingTracer tracer = new RecordingTracer();
    FunDef fun = Programs.copyOfFreshArray(true);
    ArrayCoalescing.analyze(
        fun, LastUseAnalysis.analyze(fun), CoalescingOptions.DEFAULT.withTracer(tracer));
    assertThat(tracer.lines)
        .containsExactly(
            "candidate m_t0 (t0) -> m_t1",
            "promoted m_t0 (t0) -> m_t1",
            "copyOfFreshArray: iteration 1, 1 committed, 0 inhibited")
        .inOrder();
  }

  @Test
  public void droppedDependenciesPropagate() {
    MemId mx = mem("m_x");
    MemId my = mem("m_y");
    Coalesced coal = new Coalesced(CoalescedKind.IN_PLACE, new MemBinding(my, IxFun.iota()));
    CoalsEntry dependsOnX =
        new CoalsEntry(
            my,
            IxFun.iota(),
            ImmutableSet.of(my),
            ImmutableMap.of(var("b"), coal),
            ImmutableMap.of(var("x0"), mx));
    CoalsEntry dependsOnB =
        new CoalsEntry(
            my,
            IxFun.iota(),
            ImmutableSet.of(my),
            ImmutableMap.of(var("c"), coal),
            ImmutableMap.of(var("b"), mem("m_b")));
    BottomUpEnv env =
        BottomUpEnv.EMPTY.withSuccess(
            CoalsTable.EMPTY.with(mem("m_b"), dependsOnX).with(mem("m_c"), dependsOnB));

    BottomUpEnv filtered = ArrayCoalescing.filterDependencies(env, Tracer.NONE);
    assertThat(filtered.success.isEmpty()).isTrue();
    assertThat(filtered.inhibit.get(mem("m_b"))).containsExactly(my);
    assertThat(filtered.inhibit.get(mem("m_c"))).containsExactly(my);

    // With m_x recording x0, both hold.
    CoalsEntry x =
        new CoalsEntry(
            my,
            IxFun.iota(),
            ImmutableSet.of(my),
            ImmutableMap.of(var("x0"), coal),
            ImmutableMap.of());
    BottomUpEnv complete = env.withSuccess(env.success.with(mx, x));
    assertThat(ArrayCoalescing.filterDependencies(complete, Tracer.NONE).success)
        .isEqualTo(complete.success);
  }

  @Test
  public void transferWithoutCandidateIsAnInvariantViolation() {
    ResultTransfer.Link link =
        new ResultTransfer.Link(
            var("b"),
            mem("m_b"),
            var("r"),
            new MemBinding(mem("m_r"), IxFun.iota()),
            IxFun.iota());
    CoalescingInvariantException e =
        assertThrows(
            CoalescingInvariantException.class,
            () -> ResultTransfer.transfer(BottomUpEnv.EMPTY, link, Tracer.NONE, "f"));
    assertThat(e.function).isEqualTo("f");
    assertThat(e).hasMessageThat().isEqualTo("no active candidate for b in m_b (in f)");
  }
}
