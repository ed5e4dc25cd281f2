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

import java.util.EnumMap;
import java.util.Map;
import org.membersynth.binder.sym.DeclId;
import org.membersynth.model.AccessorKind;
import org.membersynth.model.Accessibility;
import org.membersynth.model.StorageKind;
import org.membersynth.model.SynthFlag;
import org.membersynth.type.Type;
import org.jspecify.annotations.Nullable;

/** A variable or subscript: a declaration whose value can be read and possibly written. */
public abstract class AbstractStorageDecl extends Decl {

  private final String name;
  private StorageKind storageKind;
  private @Nullable DeclId overridden;
  private final Map<AccessorKind, DeclId> accessors = new EnumMap<>(AccessorKind.class);
  private @Nullable Accessibility setterAccessibility;
  private boolean beingTypeChecked;

  protected AbstractStorageDecl(
      DeclId id, int position, DeclId parent, String name, StorageKind storageKind) {
    super(id, position, parent);
    this.name = name;
    this.storageKind = storageKind;
  }

  public String name() {
    return name;
  }

  /** The type of the value stored or produced, as written in the declaration. */
  public abstract Type valueType();

  public StorageKind storageKind() {
    return storageKind;
  }

  public void setStorageKind(StorageKind storageKind) {
    this.storageKind = storageKind;
  }

  /** The superclass storage this declaration overrides. */
  public @Nullable DeclId overridden() {
    return overridden;
  }

  public void setOverridden(@Nullable DeclId overridden) {
    this.overridden = overridden;
  }

  public boolean isLet() {
    return hasFlag(SynthFlag.ACC_LET);
  }

  public boolean isDynamic() {
    return hasFlag(SynthFlag.ACC_DYNAMIC);
  }

  public boolean isObjC() {
    return hasFlag(SynthFlag.ACC_OBJC);
  }

  public boolean hasObservers() {
    return storageKind.hasObservers();
  }

  public @Nullable DeclId accessor(AccessorKind kind) {
    return accessors.get(kind);
  }

  public void setAccessor(AccessorKind kind, DeclId accessor) {
    accessors.put(kind, accessor);
  }

  public @Nullable DeclId getter() {
    return accessor(AccessorKind.GETTER);
  }

  public @Nullable DeclId setter() {
    return accessor(AccessorKind.SETTER);
  }

  public @Nullable DeclId materializeForSet() {
    return accessor(AccessorKind.MATERIALIZE_FOR_SET);
  }

  public @Nullable DeclId willSet() {
    return accessor(AccessorKind.WILL_SET);
  }

  public @Nullable DeclId didSet() {
    return accessor(AccessorKind.DID_SET);
  }

  public @Nullable DeclId mutableAddressor() {
    return accessor(AccessorKind.MUTABLE_ADDRESSOR);
  }

  /** Records synthesized load/store accessors for stored or addressed storage. */
  public void addTrivialAccessors(DeclId getter, @Nullable DeclId setter) {
    switch (storageKind) {
      case STORED:
        storageKind = StorageKind.STORED_WITH_TRIVIAL_ACCESSORS;
        break;
      case ADDRESSED:
        storageKind = StorageKind.ADDRESSED_WITH_TRIVIAL_ACCESSORS;
        break;
      default:
        throw new IllegalStateException(name + " is " + storageKind);
    }
    setAccessor(AccessorKind.GETTER, getter);
    if (setter != null) {
      setAccessor(AccessorKind.SETTER, setter);
    }
  }

  /** Turns this declaration into computed storage with the given accessors. */
  public void makeComputed(DeclId getter, @Nullable DeclId setter) {
    storageKind = StorageKind.COMPUTED;
    setAccessor(AccessorKind.GETTER, getter);
    if (setter != null) {
      setAccessor(AccessorKind.SETTER, setter);
    }
  }

  /** The accessibility of the setter, which may be narrower than the declaration's. */
  public Accessibility setterAccessibility() {
    return setterAccessibility != null ? setterAccessibility : accessibility();
  }

  public void setSetterAccessibility(Accessibility setterAccessibility) {
    this.setterAccessibility = setterAccessibility;
  }

  /** True while the declaration is being type-checked or having members synthesized. */
  public boolean isBeingTypeChecked() {
    return beingTypeChecked;
  }

  public void setBeingTypeChecked(boolean beingTypeChecked) {
    this.beingTypeChecked = beingTypeChecked;
  }
}
