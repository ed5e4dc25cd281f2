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

/**
 * Declaration attribute bits.
 *
 * <p>Storage, function, parameter and type declarations share one flag space; not every bit is
 * meaningful on every declaration kind.
 */
public final class SynthFlag {
  public static final int ACC_STATIC = 0x0001;
  public static final int ACC_FINAL = 0x0002;
  public static final int ACC_LET = 0x0004;
  public static final int ACC_DYNAMIC = 0x0008;
  public static final int ACC_OBJC = 0x0010;
  public static final int ACC_IMPLICIT = 0x0020;
  public static final int ACC_INVALID = 0x0040;
  public static final int ACC_MUTATING = 0x0080;
  public static final int ACC_NONMUTATING = 0x0100;
  public static final int ACC_TRANSPARENT = 0x0200;
  public static final int ACC_FORCED_STATIC_DISPATCH = 0x0400;
  public static final int ACC_VARIADIC = 0x0800;
  public static final int ACC_INHERITED = 0x1000;
  public static final int ACC_OVERRIDE = 0x2000;
  public static final int ACC_REQUIRED = 0x4000;
  public static final int ACC_THROWS = 0x8000;

  /** Lazily initialized variables. */
  public static final int ACC_LAZY = 1 << 16;

  /** Variables whose assigned values are copied through the runtime copying protocol. */
  public static final int ACC_COPY_ON_ASSIGN = 1 << 17;

  /** Class storage whose accessors are provided by an external object manager. */
  public static final int ACC_MANAGED = 1 << 18;

  /** Declarations imported from a foreign module. */
  public static final int ACC_FOREIGN = 1 << 19;

  /** Storage whose getter is declared mutating. */
  public static final int ACC_GETTER_MUTATING = 1 << 20;

  /** Storage whose setter is declared nonmutating. */
  public static final int ACC_SETTER_NONMUTATING = 1 << 21;

  /** Nominal types and globals with a fixed (non-resilient) layout. */
  public static final int ACC_FIXED_LAYOUT = 1 << 22;

  /** Memberwise initializers. */
  public static final int ACC_MEMBERWISE = 1 << 23;

  /** Initializers whose body traps at runtime. */
  public static final int ACC_STUB = 1 << 24;

  /** Storage hidden from name lookup. */
  public static final int ACC_USER_INACCESSIBLE = 1 << 25;

  /** Generic declarations. */
  public static final int ACC_GENERIC = 1 << 26;

  private SynthFlag() {}
}
