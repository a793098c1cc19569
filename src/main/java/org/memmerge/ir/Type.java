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

/** The type of a variable: an element type and a (possibly empty) list of dimension sizes. */
public record Type(PrimType elem, ImmutableList<PrimExp> shape) {

  public static Type scalar(PrimType elem) {
    return new Type(elem, ImmutableList.of());
  }

  public static Type array(PrimType elem, PrimExp... shape) {
    return new Type(elem, ImmutableList.copyOf(shape));
  }

  public static Type array(PrimType elem, Iterable<PrimExp> shape) {
    return new Type(elem, ImmutableList.copyOf(shape));
  }

  public int rank() {
    return shape.size();
  }

  public boolean isArray() {
    return !shape.isEmpty();
  }

  /** The variables used in this type's dimensions. */
  public ImmutableSet<VarId> freeVars() {
    return PrimExp.freeVars(shape);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    shape.forEach(d -> sb.append('[').append(d).append(']'));
    return sb.append(elem).toString();
  }

  /** Convenience for tests: the shape {@code [dims[0]][dims[1]]...} with named dimensions. */
  public static Type array(PrimType elem, String... dims) {
    return array(elem, Arrays.stream(dims).map(PrimExp::var).toArray(PrimExp[]::new));
  }
}
