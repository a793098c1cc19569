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

/** The kind of statement that made a memory block a coalescing candidate. */
public enum CoalescedKind {
  /** {@code x = copy(b)} */
  COPY,
  /** {@code x = concat(..., b, ...)} */
  CONCAT,
  /** {@code x' = x with [slice] <- b} */
  IN_PLACE,
  /** A variable that shares the candidate's block, carried along with it. */
  TRANSITIVE
}
