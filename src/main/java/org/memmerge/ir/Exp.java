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
import com.google.common.collect.Sets;
import java.util.Arrays;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** The right-hand side of a {@link Stm.Let}. */
public abstract class Exp {

  /** Returns the variables this expression reads. */
  public abstract ImmutableSet<VarId> freeVars();

  /**
   * True if evaluating this expression writes a fresh array into its result's memory, rather than
   * returning a view of an existing array.
   */
  public boolean createsNewArray() {
    return false;
  }

  /**
   * If this expression only changes the shape or layout of an existing array (the result shares
   * the argument's memory), returns the argument.
   */
  public @Nullable VarId shapeAlias() {
    return null;
  }

  /** A scalar computation. */
  public static final class ScalarExp extends Exp {
    public final PrimExp exp;

    public ScalarExp(PrimExp exp) {
      this.exp = exp;
    }

    @Override
    public ImmutableSet<VarId> freeVars() {
      return exp.freeVars();
    }

    @Override
    public String toString() {
      return exp.toString();
    }
  }

  /** A reference to another variable, scalar or array; an array result aliases its argument. */
  public static final class VarRef extends Exp {
    public final VarId var;

    public VarRef(VarId var) {
      this.var = var;
    }

    @Override
    public ImmutableSet<VarId> freeVars() {
      return ImmutableSet.of(var);
    }

    @Override
    public VarId shapeAlias() {
      return var;
    }

    @Override
    public String toString() {
      return var.toString();
    }
  }

  /** Copies an array into the result's memory. */
  public static final class Copy extends Exp {
    public final VarId src;

    public Copy(VarId src) {
      this.src = src;
    }

    @Override
    public ImmutableSet<VarId> freeVars() {
      return ImmutableSet.of(src);
    }

    @Override
    public boolean createsNewArray() {
      return true;
    }

    @Override
    public String toString() {
      return "copy(" + src + ")";
    }
  }

  /** Concatenates arrays along their outermost dimension. */
  public static final class Concat extends Exp {
    public final ImmutableList<VarId> args;

    public Concat(List<VarId> args) {
      this.args = ImmutableList.copyOf(args);
    }

    @Override
    public ImmutableSet<VarId> freeVars() {
      return ImmutableSet.copyOf(args);
    }

    @Override
    public boolean createsNewArray() {
      return true;
    }

    @Override
    public String toString() {
      return "concat" + args;
    }
  }

  /** A slice of an array; the result is a view sharing the array's memory. */
  public static final class Index extends Exp {
    public final VarId src;
    public final ImmutableList<DimIndex> slice;

    public Index(VarId src, List<DimIndex> slice) {
      this.src = src;
      this.slice = ImmutableList.copyOf(slice);
    }

    @Override
    public ImmutableSet<VarId> freeVars() {
      ImmutableSet.Builder<VarId> builder = ImmutableSet.<VarId>builder().add(src);
      slice.forEach(d -> builder.addAll(d.freeVars()));
      return builder.build();
    }

    @Override
    public String toString() {
      return src + "" + slice;
    }
  }

  /** Views an array with a different shape but the same elements in the same order. */
  public static final class Reshape extends Exp {
    public final VarId src;
    public final ImmutableList<PrimExp> newShape;

    public Reshape(VarId src, List<PrimExp> newShape) {
      this.src = src;
      this.newShape = ImmutableList.copyOf(newShape);
    }

    @Override
    public ImmutableSet<VarId> freeVars() {
      return Sets.union(ImmutableSet.of(src), PrimExp.freeVars(newShape)).immutableCopy();
    }

    @Override
    public VarId shapeAlias() {
      return src;
    }

    @Override
    public String toString() {
      return "reshape(" + src + ", " + newShape + ")";
    }
  }

  /** Views an array with its dimensions permuted. */
  public static final class Rearrange extends Exp {
    public final VarId src;
    public final ImmutableList<Integer> perm;

    public Rearrange(VarId src, Integer... perm) {
      this.src = src;
      this.perm = ImmutableList.copyOf(perm);
    }

    @Override
    public ImmutableSet<VarId> freeVars() {
      return ImmutableSet.of(src);
    }

    @Override
    public VarId shapeAlias() {
      return src;
    }

    @Override
    public String toString() {
      return "rearrange(" + src + ", " + perm + ")";
    }
  }

  /**
   * Any other array-producing operation (map, replicate, iota, a call, ...). Its result is
   * always written to fresh memory, and it reads all of its arguments.
   */
  public static final class Apply extends Exp {
    public final String op;
    public final ImmutableList<PrimExp> args;

    public Apply(String op, PrimExp... args) {
      this.op = op;
      this.args = ImmutableList.copyOf(args);
    }

    @Override
    public ImmutableSet<VarId> freeVars() {
      return PrimExp.freeVars(args);
    }

    @Override
    public boolean createsNewArray() {
      return true;
    }

    @Override
    public String toString() {
      return op + args;
    }
  }

  /** A two-way branch. Each body yields one result per element of the statement's pattern. */
  public static final class If extends Exp {
    public final PrimExp cond;
    public final Body thenBody;
    public final Body elseBody;

    public If(PrimExp cond, Body thenBody, Body elseBody) {
      this.cond = cond;
      this.thenBody = thenBody;
      this.elseBody = elseBody;
    }

    @Override
    public ImmutableSet<VarId> freeVars() {
      return ImmutableSet.<VarId>builder()
          .addAll(cond.freeVars())
          .addAll(thenBody.freeVars())
          .addAll(elseBody.freeVars())
          .build();
    }

    @Override
    public String toString() {
      return "if " + cond;
    }
  }

  /** A loop parameter with its initial value. */
  public record LoopParam(Param param, PrimExp init) {
    public VarId name() {
      return param.name();
    }
  }

  /**
   * A sequential loop. The body's results are the context parameters' next values followed by
   * the value parameters' next values; the loop statement's pattern binds the final values.
   */
  public static final class Loop extends Exp {
    public final ImmutableList<LoopParam> ctx;
    public final ImmutableList<LoopParam> vals;
    public final LoopForm form;
    public final Body body;
    private final ImmutableSet<VarId> freeVars;

    public Loop(List<LoopParam> ctx, List<LoopParam> vals, LoopForm form, Body body) {
      this.ctx = ImmutableList.copyOf(ctx);
      this.vals = ImmutableList.copyOf(vals);
      this.form = form;
      this.body = body;
      ImmutableSet<VarId> bound = boundVars();
      ImmutableSet.Builder<VarId> builder = ImmutableSet.builder();
      this.ctx.forEach(p -> builder.addAll(p.init.freeVars()));
      this.vals.forEach(p -> builder.addAll(p.init.freeVars()));
      builder.addAll(form.freeVars());
      builder.addAll(Sets.difference(body.freeVars(), bound));
      this.freeVars = builder.build();
    }

    public static Loop of(List<LoopParam> vals, LoopForm form, Body body) {
      return new Loop(ImmutableList.of(), vals, form, body);
    }

    public static Loop of(LoopParam val, LoopForm form, Body body) {
      return of(Arrays.asList(val), form, body);
    }

    /** The loop parameters and the form's index variable. */
    public ImmutableSet<VarId> boundVars() {
      ImmutableSet.Builder<VarId> builder = ImmutableSet.builder();
      ctx.forEach(p -> builder.add(p.name()));
      vals.forEach(p -> builder.add(p.name()));
      return builder.addAll(form.boundVars()).build();
    }

    /** The body results that feed the value parameters. */
    public ImmutableList<PrimExp> valueResults() {
      ImmutableList<PrimExp> results = body.result();
      return results.subList(Math.min(ctx.size(), results.size()), results.size());
    }

    @Override
    public ImmutableSet<VarId> freeVars() {
      return freeVars;
    }

    @Override
    public String toString() {
      return "loop " + form;
    }
  }
}
