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
import java.util.stream.Stream;

/**
 * The variables bound by a statement. Context elements are the existential sizes and memory
 * blocks that the value elements' types and layouts may refer to.
 */
public record Pattern(ImmutableList<PatElem> context, ImmutableList<PatElem> values) {

  public static Pattern of(PatElem... values) {
    return new Pattern(ImmutableList.of(), ImmutableList.copyOf(values));
  }

  public Stream<PatElem> elements() {
    return Stream.concat(context.stream(), values.stream());
  }

  public ImmutableSet<VarId> names() {
    return elements().map(pe -> pe.name).collect(ImmutableSet.toImmutableSet());
  }

  public ImmutableSet<VarId> contextNames() {
    return context.stream().map(pe -> pe.name).collect(ImmutableSet.toImmutableSet());
  }

  /** The value elements that live in memory. */
  public ImmutableList<PatElem> arrayElems() {
    return values.stream().filter(pe -> pe.mem != null).collect(ImmutableList.toImmutableList());
  }
}
