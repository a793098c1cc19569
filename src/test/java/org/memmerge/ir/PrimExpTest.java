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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Map;
import junitparams.JUnitParamsRunner;
import junitparams.Parameters;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(JUnitParamsRunner.class)
public class PrimExpTest {

  private static final PrimExp N = PrimExp.var("n");
  private static final PrimExp I = PrimExp.var("i");

  private static long eval(PrimExp e, Map<String, Long> env) {
    return e.evaluate(v -> env.get(v.name()));
  }

  @Test
  public void identitiesFold() {
    assertSame(N, PrimExp.add(N, PrimExp.ZERO));
    assertSame(N, PrimExp.add(PrimExp.ZERO, N));
    assertSame(N, PrimExp.mul(PrimExp.ONE, N));
    assertSame(N, PrimExp.sub(N, PrimExp.ZERO));
    assertThat(PrimExp.mul(N, PrimExp.ZERO)).isEqualTo(PrimExp.ZERO);
    assertThat(PrimExp.sub(N, N)).isEqualTo(PrimExp.ZERO);
    assertThat(PrimExp.min(N, N)).isEqualTo(N);
    assertThat(PrimExp.equal(N, N)).isEqualTo(PrimExp.ONE);
  }

  @Test
  public void constantsFold() {
    assertThat(PrimExp.add(PrimExp.constant(2), PrimExp.constant(3)))
        .isEqualTo(PrimExp.constant(5));
    assertThat(PrimExp.mul(PrimExp.constant(4), PrimExp.constant(-2)))
        .isEqualTo(PrimExp.constant(-8));
    assertThat(PrimExp.lessThan(PrimExp.constant(1), PrimExp.constant(2)))
        .isEqualTo(PrimExp.ONE);
    assertThat(PrimExp.product(ImmutableList.of())).isEqualTo(PrimExp.ONE);
    assertThat(PrimExp.constant(7).isConst(7)).isTrue();
  }

  @Test
  public void printing() {
    assertThat(PrimExp.add(N, PrimExp.ONE).toString()).isEqualTo("(n + 1)");
    assertThat(PrimExp.min(N, I).toString()).isEqualTo("min(n, i)");
    assertThat(PrimExp.product(ImmutableList.of(N, I, N)).toString()).isEqualTo("((n * i) * n)");
  }

  @Test
  public void substitute() {
    PrimExp e = PrimExp.mul(I, N);
    PrimExp nMinus1 = PrimExp.sub(N, PrimExp.ONE);
    assertThat(e.substitute(ImmutableMap.of(VarId.of("i"), nMinus1)).toString())
        .isEqualTo("((n - 1) * n)");
    // Substitution refolds the result.
    assertThat(e.substitute(ImmutableMap.of(VarId.of("i"), PrimExp.ZERO)))
        .isEqualTo(PrimExp.ZERO);
    assertSame(e, e.substitute(ImmutableMap.of(VarId.of("k"), N)));
  }

  @Test
  public void freeVars() {
    PrimExp e = PrimExp.add(PrimExp.mul(I, N), PrimExp.var("j"));
    assertThat(e.freeVars())
        .containsExactly(VarId.of("i"), VarId.of("n"), VarId.of("j"))
        .inOrder();
    assertThat(PrimExp.constant(3).freeVars()).isEmpty();
    assertThat(N.asVar()).isEqualTo(VarId.of("n"));
    assertThat(e.asVar()).isNull();
  }

  @Test
  @Parameters({
    "ADD, 7, 2, 9",
    "SUB, 7, 2, 5",
    "MUL, -7, 2, -14",
    "DIV, -7, 2, -4",
    "MOD, -7, 2, 1",
    "MIN, -7, 2, -7",
    "MAX, -7, 2, 2",
    "LT, -7, 2, 1",
    "EQ, -7, 2, 0",
  })
  public void evaluate(PrimExp.Op op, long x, long y, long expected) {
    PrimExp e = PrimExp.apply(op, PrimExp.var("x"), PrimExp.var("y"));
    assertThat(eval(e, ImmutableMap.of("x", x, "y", y))).isEqualTo(expected);
  }

  @Test
  public void evaluateErrors() {
    PrimExp byZero = PrimExp.div(N, PrimExp.ZERO);
    assertThrows(ArithmeticException.class, () -> eval(byZero, ImmutableMap.of("n", 3L)));
    assertThrows(IllegalArgumentException.class, () -> eval(N, ImmutableMap.of()));
  }
}
