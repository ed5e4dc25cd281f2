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

package org.membersynth.model;

/** How a storage declaration's value is held and accessed. */
public enum StorageKind {
  /** Plain storage with no accessors. */
  STORED,
  /** Plain storage with synthesized load/store accessors. */
  STORED_WITH_TRIVIAL_ACCESSORS,
  /** Storage with willSet/didSet hooks. */
  STORED_WITH_OBSERVERS,
  /** An override that adds willSet/didSet hooks to inherited storage. */
  INHERITED_WITH_OBSERVERS,
  /** Storage reached through addressors. */
  ADDRESSED,
  ADDRESSED_WITH_TRIVIAL_ACCESSORS,
  /** Storage with user-written accessors and no backing value. */
  COMPUTED,
  /** A computed getter paired with a mutable addressor. */
  COMPUTED_WITH_MUTABLE_ADDRESS;

  public boolean hasObservers() {
    return this == STORED_WITH_OBSERVERS || this == INHERITED_WITH_OBSERVERS;
  }

  /** Returns true if the declaration has its own storage or addressors. */
  public boolean hasStorage() {
    switch (this) {
      case STORED:
      case STORED_WITH_TRIVIAL_ACCESSORS:
      case STORED_WITH_OBSERVERS:
      case ADDRESSED:
      case ADDRESSED_WITH_TRIVIAL_ACCESSORS:
        return true;
      case INHERITED_WITH_OBSERVERS:
      case COMPUTED:
      case COMPUTED_WITH_MUTABLE_ADDRESS:
        return false;
    }
    throw new AssertionError(this);
  }
}
