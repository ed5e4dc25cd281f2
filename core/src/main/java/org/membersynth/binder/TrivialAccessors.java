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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import org.membersynth.binder.env.DeclArena;
import org.membersynth.binder.services.SynthContext;
import org.membersynth.binder.sym.DeclId;
import org.membersynth.decl.AbstractStorageDecl;
import org.membersynth.decl.FuncDecl;
import org.membersynth.decl.ParamDecl;
import org.membersynth.decl.VarDecl;
import org.membersynth.model.StorageKind;
import org.membersynth.model.SynthFlag;
import org.membersynth.tree.AccessSemantics;
import org.membersynth.tree.Tree;
import org.jspecify.annotations.Nullable;

/**
 * Synthesizes accessors that load and store a value with no other behavior.
 *
 * <p>Stored properties get such accessors when their storage must be hidden behind an abstraction:
 * to witness a protocol requirement, to be overridable, or because the containing type's layout
 * may change.
 */
public class TrivialAccessors {

  private final SynthContext ctx;
  private final DeclArena arena;
  private final SkeletonBuilder skeleton;
  private final StorageReferences refs;
  private final MaterializeForSet materializeForSet;

  public TrivialAccessors(
      SynthContext ctx,
      SkeletonBuilder skeleton,
      StorageReferences refs,
      MaterializeForSet materializeForSet) {
    this.ctx = ctx;
    this.arena = ctx.arena();
    this.skeleton = skeleton;
    this.refs = refs;
    this.materializeForSet = materializeForSet;
  }

  /** Fills in {@code return storage}, or a call of the superclass getter for overrides. */
  public void synthesizeTrivialGetter(FuncDecl getter, AbstractStorageDecl storage) {
    Tree.Expr result = refs.createLoad(getter, storage);
    getter.setBody(
        new Tree.Brace(
            storage.position(),
            ImmutableList.of(new Tree.Return(storage.position(), result))));
    SynthSupport.maybeMarkTransparent(ctx, getter, storage);
    SynthSupport.registerExternalIfNeeded(ctx, getter, storage);
  }

  /**
   * Fills in {@code storage = value}, or a call of the superclass setter for overrides. Invalid
   * storage is left without a setter body.
   */
  public void synthesizeTrivialSetter(
      FuncDecl setter, AbstractStorageDecl storage, DeclId valueParam) {
    if (storage.isInvalid()) {
      return;
    }
    ParamDecl value = arena.get(valueParam, ParamDecl.class);
    Tree.Expr valueRef =
        new Tree.DeclRef(-1, valueParam, value.name(), AccessSemantics.ORDINARY);
    setter.setBody(
        new Tree.Brace(
            storage.position(), ImmutableList.of(refs.createStore(setter, valueRef, storage))));
    SynthSupport.maybeMarkTransparent(ctx, setter, storage);
    SynthSupport.registerExternalIfNeeded(ctx, setter, storage);
  }

  /**
   * Returns true if storage without accessors needs a setter: stored variables unless they are
   * constants, and addressed storage with a mutable addressor.
   */
  static boolean doesStorageNeedSetter(AbstractStorageDecl storage) {
    checkState(storage.getter() == null, "%s already has accessors", storage.name());
    switch (storage.storageKind()) {
      case STORED:
        return !storage.isLet();
      case ADDRESSED:
        return storage.mutableAddressor() != null;
      case STORED_WITH_TRIVIAL_ACCESSORS:
      case STORED_WITH_OBSERVERS:
      case INHERITED_WITH_OBSERVERS:
      case ADDRESSED_WITH_TRIVIAL_ACCESSORS:
      case COMPUTED_WITH_MUTABLE_ADDRESS:
        throw new IllegalStateException(storage.name() + " already has accessor functions");
      case COMPUTED:
        throw new IllegalStateException(storage.name() + " is not stored");
    }
    throw new AssertionError(storage.storageKind());
  }

  /**
   * Adds a trivial getter, and a trivial setter if the storage is mutable, to stored or addressed
   * storage. Settable members of polymorphic types and native structs also get a
   * materializeForSet accessor.
   *
   * @return the synthesized accessors, empty if the signature could not be represented
   */
  public ImmutableList<FuncDecl> addTrivialAccessorsToStorage(AbstractStorageDecl storage) {
    checkState(storage.getter() == null, "%s already has accessors", storage.name());

    FuncDecl getter = skeleton.createGetterPrototype(storage);
    if (getter == null) {
      return ImmutableList.of();
    }
    FuncDecl setter = null;
    if (doesStorageNeedSetter(storage)) {
      setter = skeleton.createSetterPrototype(storage);
      if (setter == null) {
        return ImmutableList.of();
      }
    }

    storage.addTrivialAccessors(getter.id(), setter != null ? setter.id() : null);

    boolean isDynamic = storage.isDynamic() && storage.isObjC();
    if (isDynamic) {
      getter.addFlags(SynthFlag.ACC_DYNAMIC);
    }

    synthesizeTrivialGetter(getter, storage);
    SynthSupport.typeCheckBothPasses(ctx, getter);

    if (setter != null) {
      if (isDynamic) {
        setter.addFlags(SynthFlag.ACC_DYNAMIC);
      }
      synthesizeTrivialSetter(setter, storage, setter.params().get(0));
      SynthSupport.typeCheckBothPasses(ctx, setter);
    }

    DeclId context = SynthSupport.contextOf(storage);
    SynthSupport.addMemberToContextIfNeeded(ctx, getter, context);
    if (setter == null) {
      return ImmutableList.of(getter);
    }
    SynthSupport.addMemberToContextIfNeeded(ctx, setter, context);

    // Global stored properties don't get a materializeForSet, nor do members that cannot be
    // mutated through an abstraction boundary.
    if (arena.isTypeContext(context) && materializeForSet.needsMaterializeForSet(storage)) {
      FuncDecl mfs = materializeForSet.addMaterializeForSet(storage);
      if (mfs != null) {
        materializeForSet.synthesizeMaterializeForSet(mfs, storage);
        SynthSupport.typeCheck(ctx, mfs, /* firstPass= */ false);
        return ImmutableList.of(getter, setter, mfs);
      }
    }
    return ImmutableList.of(getter, setter);
  }

  /** Fills in the setter of computed storage whose value is reached through a mutable address. */
  public FuncDecl synthesizeSetterForMutableAddressedStorage(AbstractStorageDecl storage) {
    checkState(
        storage.storageKind() == StorageKind.COMPUTED_WITH_MUTABLE_ADDRESS,
        "%s is %s",
        storage.name(),
        storage.storageKind());
    DeclId setterId = storage.setter();
    checkState(setterId != null, "%s has no setter", storage.name());
    FuncDecl setter = arena.get(setterId, FuncDecl.class);
    checkState(setter.body() == null, "%s already has a body", setter.name());

    synthesizeTrivialSetter(setter, storage, setter.params().get(0));
    SynthSupport.typeCheckBothPasses(ctx, setter);
    return setter;
  }

  /** Turns a stored variable requirement of a protocol into a getter-only computed requirement. */
  public @Nullable FuncDecl convertStoredVarInProtocolToComputed(VarDecl var) {
    FuncDecl getter = skeleton.createGetterPrototype(var);
    if (getter == null) {
      return null;
    }
    var.makeComputed(getter.id(), null);
    SynthSupport.addMemberToContextIfNeeded(ctx, getter, SynthSupport.contextOf(var));
    SynthSupport.typeCheckBothPasses(ctx, getter);
    return getter;
  }

  /**
   * Turns class storage whose value is managed by an external object store into computed storage.
   * The accessors have no bodies; the object store provides them at runtime.
   */
  public ImmutableList<FuncDecl> convertManagedStoredVarToComputed(VarDecl var) {
    checkState(var.storageKind() == StorageKind.STORED, "%s is %s", var.name(), var.storageKind());
    FuncDecl getter = skeleton.createGetterPrototype(var);
    FuncDecl setter = skeleton.createSetterPrototype(var);
    if (getter == null || setter == null) {
      return ImmutableList.of();
    }
    var.makeComputed(getter.id(), setter.id());

    ctx.typeResolver().validate(getter);
    ctx.typeResolver().validate(setter);

    DeclId context = SynthSupport.contextOf(var);
    SynthSupport.addMemberToContextIfNeeded(ctx, getter, context);
    SynthSupport.addMemberToContextIfNeeded(ctx, setter, context);
    return ImmutableList.of(getter, setter);
  }
}
