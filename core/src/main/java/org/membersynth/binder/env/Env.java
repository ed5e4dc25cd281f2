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

package org.membersynth.binder.env;

import org.jspecify.annotations.Nullable;

/**
 * An environment that maps keys {@code K} to nodes {@code V}.
 *
 * <p>Declarations refer to each other by key, and the environment resolves those keys. The
 * indirection lets the declaration graph contain cycles (a storage and its accessors, a class and
 * its members) without owning references.
 */
public interface Env<K, V> {
  /** Returns the information associated with the given key in this environment. */
  @Nullable V get(K key);

  default V getNonNull(K key) {
    V result = get(key);
    if (result == null) {
      throw new NullPointerException(key.toString());
    }
    return result;
  }
}
