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

/** The element types of scalars and arrays. */
public enum PrimType {
  BOOL("bool"),
  I32("i32"),
  I64("i64"),
  F32("f32"),
  F64("f64");

  private final String name;

  PrimType(String name) {
    this.name = name;
  }

  @Override
  public String toString() {
    return name;
  }
}
