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

package org.membersynth.binder;

/** What a synthesis request asks for. */
public enum SynthesisIntent {
  /** Trivial getter and setter for stored or addressed storage, or lazy accessor shells. */
  NEEDS_BASIC_ACCESSORS,
  /** A materializeForSet accessor for settable storage. */
  NEEDS_MATERIALIZE_FOR_SET,
  /** Bodies for the getter and setter of a variable with willSet/didSet hooks. */
  NEEDS_OBSERVING_ACCESSORS,
  /** Backing storage and memoizing accessors for a lazy variable. */
  LAZY,
  /** The implicit default or memberwise initializer of a type. */
  NEEDS_IMPLICIT_CONSTRUCTOR,
  /** Overrides of the superclass's designated initializers. */
  NEEDS_INHERITED_INITIALIZER,
  /** The implicit destructor of a class. */
  NEEDS_DESTRUCTOR,
  /** Accessors for storage that witnesses a protocol requirement. */
  WITNESS_ACCESSORS,
  /** A getter for a stored variable requirement of a protocol. */
  PROTOCOL_REQUIREMENT,
  /** The setter of computed storage with a mutable addressor. */
  MUTABLE_ADDRESS_SETTER,
}
