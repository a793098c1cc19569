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

import org.jspecify.annotations.Nullable;

/**
 * A function or loop parameter. A unique array parameter's memory may be overwritten by the
 * function, so its block may serve as a coalescing destination.
 */
public record Param(VarId name, Type type, @Nullable MemBinding mem, boolean unique) {

  public static Param scalar(String name, PrimType type) {
    return new Param(VarId.of(name), Type.scalar(type), null, false);
  }

  public static Param array(String name, Type type, MemId mem, boolean unique) {
    return new Param(VarId.of(name), type, new MemBinding(mem, IxFun.iota(type.shape())), unique);
  }

  public static Param array(String name, Type type, MemBinding mem) {
    return new Param(VarId.of(name), type, mem, false);
  }
}
