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
import java.util.ArrayList;
import java.util.List;

/** Collects the parameters of a function under construction. */
public final class FunctionBuilder {
  private final String name;
  private final List<Param> params = new ArrayList<>();

  public FunctionBuilder(String name) {
    this.name = name;
  }

  public VarId scalarParam(String name, PrimType type) {
    Param param = Param.scalar(name, type);
    params.add(param);
    return param.name();
  }

  /** Adds an array parameter stored row-major in {@code mem}. */
  public VarId arrayParam(String name, Type type, MemId mem, boolean unique) {
    Param param = Param.array(name, type, mem, unique);
    params.add(param);
    return param.name();
  }

  public FunDef build(Body body) {
    return new FunDef(name, ImmutableList.copyOf(params), body);
  }
}
