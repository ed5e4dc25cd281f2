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

/** Accessor function kinds. */
public enum AccessorKind {
  GETTER("get"),
  SETTER("set"),
  MATERIALIZE_FOR_SET("materializeForSet"),
  WILL_SET("willSet"),
  DID_SET("didSet"),
  ADDRESSOR("unsafeAddress"),
  MUTABLE_ADDRESSOR("unsafeMutableAddress");

  private final String prefix;

  AccessorKind(String prefix) {
    this.prefix = prefix;
  }

  /** The name of an accessor of this kind for the given storage, e.g. {@code get:count}. */
  public String accessorName(String storageName) {
    return prefix + ":" + storageName;
  }

  @Override
  public String toString() {
    return prefix;
  }
}
