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
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import org.jspecify.annotations.Nullable;

/**
 * A side-effect-free scalar expression over variables and integer constants. PrimExps are used
 * for array sizes, index-function offsets and strides, and for the scalar table that the
 * coalescing analysis builds as it walks a function body.
 *
 * <p>PrimExps are immutable and compared structurally. The factory methods ({@link #add}, {@link
 * #mul}, etc.) fold constants and drop identities, so that index functions built up from many
 * small steps stay readable.
 */
public abstract class PrimExp {

  public static final PrimExp ZERO = new Const(0);
  public static final PrimExp ONE = new Const(1);

  /** Returns the variables this expression refers to. */
  public abstract ImmutableSet<VarId> freeVars();

  /** Returns this expression with each variable in {@code subst} replaced by its image. */
  public abstract PrimExp substitute(Map<VarId, PrimExp> subst);

  /**
   * Evaluates this expression, using {@code env} to find the values of its variables. Throws an
   * ArithmeticException on division by zero.
   */
  public abstract long evaluate(Function<VarId, Long> env);

  /** If this expression is a single variable, returns it. */
  public @Nullable VarId asVar() {
    return null;
  }

  /** Returns true if this expression is the given integer constant. */
  public boolean isConst(long value) {
    return false;
  }

  public static PrimExp constant(long value) {
    if (value == 0) {
      return ZERO;
    } else if (value == 1) {
      return ONE;
    }
    return new Const(value);
  }

  public static PrimExp var(VarId var) {
    return new Leaf(var);
  }

  public static PrimExp var(String name) {
    return new Leaf(VarId.of(name));
  }

  public static PrimExp add(PrimExp x, PrimExp y) {
    if (x.isConst(0)) {
      return y;
    } else if (y.isConst(0)) {
      return x;
    }
    return binary(Op.ADD, x, y);
  }

  public static PrimExp sub(PrimExp x, PrimExp y) {
    if (y.isConst(0)) {
      return x;
    } else if (x.equals(y)) {
      return ZERO;
    }
    return binary(Op.SUB, x, y);
  }

  public static PrimExp mul(PrimExp x, PrimExp y) {
    if (x.isConst(0) || y.isConst(0)) {
      return ZERO;
    } else if (x.isConst(1)) {
      return y;
    } else if (y.isConst(1)) {
      return x;
    }
    return binary(Op.MUL, x, y);
  }

  public static PrimExp div(PrimExp x, PrimExp y) {
    if (y.isConst(1)) {
      return x;
    } else if (y.isConst(0)) {
      // Leave it for evaluate() to report.
      return new BinOp(Op.DIV, x, y);
    }
    return binary(Op.DIV, x, y);
  }

  public static PrimExp mod(PrimExp x, PrimExp y) {
    if (y.isConst(1)) {
      return ZERO;
    } else if (y.isConst(0)) {
      return new BinOp(Op.MOD, x, y);
    }
    return binary(Op.MOD, x, y);
  }

  public static PrimExp min(PrimExp x, PrimExp y) {
    return x.equals(y) ? x : binary(Op.MIN, x, y);
  }

  public static PrimExp max(PrimExp x, PrimExp y) {
    return x.equals(y) ? x : binary(Op.MAX, x, y);
  }

  public static PrimExp lessThan(PrimExp x, PrimExp y) {
    return binary(Op.LT, x, y);
  }

  public static PrimExp equal(PrimExp x, PrimExp y) {
    return x.equals(y) ? ONE : binary(Op.EQ, x, y);
  }

  /** Returns the product of the given expressions, or 1 if there are none. */
  public static PrimExp product(Iterable<PrimExp> factors) {
    PrimExp result = ONE;
    for (PrimExp factor : factors) {
      result = mul(result, factor);
    }
    return result;
  }

  /** Rebuilds a binary expression through the folding factories. */
  public static PrimExp apply(Op op, PrimExp x, PrimExp y) {
    return switch (op) {
      case ADD -> add(x, y);
      case SUB -> sub(x, y);
      case MUL -> mul(x, y);
      case DIV -> div(x, y);
      case MOD -> mod(x, y);
      case MIN -> min(x, y);
      case MAX -> max(x, y);
      case LT -> lessThan(x, y);
      case EQ -> equal(x, y);
    };
  }

  private static PrimExp binary(Op op, PrimExp x, PrimExp y) {
    if (x instanceof Const cx && y instanceof Const cy) {
      return constant(op.apply(cx.value, cy.value));
    }
    return new BinOp(op, x, y);
  }

  /** The binary operators supported by PrimExp. */
  public enum Op {
    ADD("+"),
    SUB("-"),
    MUL("*"),
    DIV("/"),
    MOD("%"),
    MIN("min"),
    MAX("max"),
    LT("<"),
    EQ("==");

    final String symbol;

    Op(String symbol) {
      this.symbol = symbol;
    }

    long apply(long x, long y) {
      return switch (this) {
        case ADD -> x + y;
        case SUB -> x - y;
        case MUL -> x * y;
        case DIV -> Math.floorDiv(x, y);
        case MOD -> Math.floorMod(x, y);
        case MIN -> Math.min(x, y);
        case MAX -> Math.max(x, y);
        case LT -> (x < y) ? 1 : 0;
        case EQ -> (x == y) ? 1 : 0;
      };
    }

    boolean isFunction() {
      return this == MIN || this == MAX;
    }
  }

  /** An integer constant. */
  public static final class Const extends PrimExp {
    public final long value;

    private Const(long value) {
      this.value = value;
    }

    @Override
    public ImmutableSet<VarId> freeVars() {
      return ImmutableSet.of();
    }

    @Override
    public PrimExp substitute(Map<VarId, PrimExp> subst) {
      return this;
    }

    @Override
    public long evaluate(Function<VarId, Long> env) {
      return value;
    }

    @Override
    public boolean isConst(long value) {
      return this.value == value;
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof Const c && c.value == value;
    }

    @Override
    public int hashCode() {
      return Long.hashCode(value);
    }

    @Override
    public String toString() {
      return String.valueOf(value);
    }
  }

  /** A reference to a scalar variable. */
  public static final class Leaf extends PrimExp {
    public final VarId var;

    private Leaf(VarId var) {
      this.var = var;
    }

    @Override
    public ImmutableSet<VarId> freeVars() {
      return ImmutableSet.of(var);
    }

    @Override
    public PrimExp substitute(Map<VarId, PrimExp> subst) {
      PrimExp replacement = subst.get(var);
      return (replacement == null) ? this : replacement;
    }

    @Override
    public long evaluate(Function<VarId, Long> env) {
      Long value = env.apply(var);
      if (value == null) {
        throw new IllegalArgumentException("No value for " + var);
      }
      return value;
    }

    @Override
    public VarId asVar() {
      return var;
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof Leaf leaf && leaf.var.equals(var);
    }

    @Override
    public int hashCode() {
      return var.hashCode();
    }

    @Override
    public String toString() {
      return var.toString();
    }
  }

  /** A binary operation. */
  public static final class BinOp extends PrimExp {
    public final Op op;
    public final PrimExp x;
    public final PrimExp y;

    private BinOp(Op op, PrimExp x, PrimExp y) {
      this.op = op;
      this.x = x;
      this.y = y;
    }

    @Override
    public ImmutableSet<VarId> freeVars() {
      return ImmutableSet.<VarId>builder().addAll(x.freeVars()).addAll(y.freeVars()).build();
    }

    @Override
    public PrimExp substitute(Map<VarId, PrimExp> subst) {
      PrimExp newX = x.substitute(subst);
      PrimExp newY = y.substitute(subst);
      return (newX == x && newY == y) ? this : apply(op, newX, newY);
    }

    @Override
    public long evaluate(Function<VarId, Long> env) {
      return op.apply(x.evaluate(env), y.evaluate(env));
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof BinOp b && b.op == op && b.x.equals(x) && b.y.equals(y);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, x, y);
    }

    @Override
    public String toString() {
      if (op.isFunction()) {
        return String.format("%s(%s, %s)", op.symbol, x, y);
      }
      return String.format("(%s %s %s)", x, op.symbol, y);
    }
  }

  /** Returns the variables referenced by any of the given expressions. */
  public static ImmutableSet<VarId> freeVars(Iterable<PrimExp> exps) {
    ImmutableSet.Builder<VarId> builder = ImmutableSet.builder();
    exps.forEach(e -> builder.addAll(e.freeVars()));
    return builder.build();
  }

  /** Applies {@link #substitute} to each element. */
  public static ImmutableList<PrimExp> substitute(
      Iterable<PrimExp> exps, Map<VarId, PrimExp> subst) {
    ImmutableList.Builder<PrimExp> builder = ImmutableList.builder();
    exps.forEach(e -> builder.add(e.substitute(subst)));
    return builder.build();
  }
}
