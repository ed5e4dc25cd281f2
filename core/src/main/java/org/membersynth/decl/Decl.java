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

package org.membersynth.decl;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import org.membersynth.binder.sym.DeclId;
import org.membersynth.model.Accessibility;
import org.membersynth.model.AvailabilityAttr;
import org.membersynth.model.SynthFlag;
import org.jspecify.annotations.Nullable;

/**
 * A declaration.
 *
 * <p>Declarations are mutable arena nodes: synthesis fills in accessor slots, bodies and flags of
 * existing declarations as it creates new ones. References to other declarations are {@link
 * DeclId}s resolved through the owning {@link org.membersynth.binder.env.DeclArena}.
 */
public abstract class Decl {

  private final DeclId id;
  private final int position;
  private @Nullable DeclId parent;
  private int flags;
  private Accessibility accessibility = Accessibility.INTERNAL;
  private AvailabilityAttr availability = AvailabilityAttr.ALWAYS;

  protected Decl(DeclId id, int position, @Nullable DeclId parent) {
    this.id = id;
    this.position = position;
    this.parent = parent;
  }

  public abstract DeclKind kind();

  public DeclId id() {
    return id;
  }

  public int position() {
    return position;
  }

  /** The declaration context this declaration is nested in, or {@code null} for source files. */
  public @Nullable DeclId parent() {
    return parent;
  }

  public void setParent(DeclId parent) {
    this.parent = parent;
  }

  /** The access flags, see {@link SynthFlag}. */
  public int flags() {
    return flags;
  }

  public boolean hasFlag(int flag) {
    return (flags & flag) == flag;
  }

  @CanIgnoreReturnValue
  public Decl addFlags(int flag) {
    flags |= flag;
    return this;
  }

  @CanIgnoreReturnValue
  public Decl clearFlags(int flag) {
    flags &= ~flag;
    return this;
  }

  public boolean isImplicit() {
    return hasFlag(SynthFlag.ACC_IMPLICIT);
  }

  public boolean isInvalid() {
    return hasFlag(SynthFlag.ACC_INVALID);
  }

  public boolean isStatic() {
    return hasFlag(SynthFlag.ACC_STATIC);
  }

  public boolean isFinal() {
    return hasFlag(SynthFlag.ACC_FINAL);
  }

  public boolean isForeign() {
    return hasFlag(SynthFlag.ACC_FOREIGN);
  }

  public Accessibility accessibility() {
    return accessibility;
  }

  public void setAccessibility(Accessibility accessibility) {
    this.accessibility = accessibility;
  }

  public AvailabilityAttr availability() {
    return availability;
  }

  public void setAvailability(AvailabilityAttr availability) {
    this.availability = availability;
  }

  @Override
  public String toString() {
    return kind() + " " + id;
  }
}
