/*
 * Copyright 2026 The membersynth Authors. All Rights Reserved.
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

package org.membersynth.binder.sym;

import com.google.errorprone.annotations.Immutable;
import org.jspecify.annotations.Nullable;

/**
 * A stable handle to a declaration in a {@link org.membersynth.binder.env.DeclArena}.
 *
 * <p>Ids hold no semantic information, they are only an index into the arena that owns the
 * declaration. Cross references between declarations (owning scope, overridden entity, accessor
 * slots) are stored as ids so the declaration graph has no owning cycles.
 */
@Immutable
public final class DeclId implements Comparable<DeclId> {

  private final int idx;

  public DeclId(int idx) {
    this.idx = idx;
  }

  /** The index of the declaration in its arena. */
  public int index() {
    return idx;
  }

  @Override
  public int compareTo(DeclId other) {
    return Integer.compare(idx, other.idx);
  }

  @Override
  public int hashCode() {
    return Integer.hashCode(idx);
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    return obj instanceof DeclId && ((DeclId) obj).idx == idx;
  }

  @Override
  public String toString() {
    return "#" + idx;
  }
}
