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

package org.membersynth.tree;

/** How a storage reference in a synthesized body is resolved. */
public enum AccessSemantics {
  /** Normal, possibly dynamically dispatched, access through the accessors. */
  ORDINARY,
  /** Access to the underlying storage, bypassing any accessors or overrides. */
  DIRECT_TO_STORAGE,
  /** A call to this declaration's own accessors, bypassing overrides. */
  DIRECT_TO_ACCESSOR
}
