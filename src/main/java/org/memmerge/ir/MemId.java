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

/**
 * The name of a memory block. Memory blocks are introduced by {@link Stm.Alloc} statements, by
 * function parameters, or implicitly by the patterns of {@code if} and loop statements.
 */
public record MemId(String name) implements Comparable<MemId> {

  public MemId {
    Preconditions.checkArgument(!name.isEmpty(), "empty memory name");
  }

  public static MemId of(String name) {
    return new MemId(name);
  }

  @Override
  public int compareTo(MemId other) {
    return name.compareTo(other.name);
  }

  @Override
  public String toString() {
    return name;
  }
}
