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

import com.google.common.collect.ImmutableList;
import org.membersynth.binder.env.DeclArena;
import org.membersynth.binder.services.SynthContext;
import org.membersynth.binder.sym.DeclId;
import org.membersynth.decl.AbstractStorageDecl;
import org.membersynth.decl.Decl;
import org.membersynth.decl.FuncDecl;
import org.membersynth.decl.NominalTypeDecl;
import org.membersynth.model.AccessorKind;
import org.membersynth.model.NominalKind;
import org.membersynth.model.SynthFlag;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Synthesizes materializeForSet accessors.
 *
 * <p>A materializeForSet accessor lets code that cannot see how storage is implemented mutate it
 * in place: it returns the address of the value, either the storage itself or a temporary in the
 * caller-provided buffer, and optionally a callback that writes the temporary back through the
 * setter. Its body is emitted by code generation, so synthesis only produces the declaration.
 */
public class MaterializeForSet {

  private final Logger logger = LoggerFactory.getLogger(MaterializeForSet.class);

  private final SynthContext ctx;
  private final DeclArena arena;
  private final SkeletonBuilder skeleton;

  public MaterializeForSet(SynthContext ctx, SkeletonBuilder skeleton) {
    this.ctx = ctx;
    this.arena = ctx.arena();
    this.skeleton = skeleton;
  }

  /**
   * Creates the materializeForSet declaration for {@code storage}, whose setter must exist.
   * Returns {@code null} if the signature cannot be represented.
   */
  public @Nullable FuncDecl createMaterializeForSet(AbstractStorageDecl storage) {
    FuncDecl setter = arena.get(requireSetter(storage), FuncDecl.class);
    DeclId setterContext = SynthSupport.contextOf(setter);
    boolean mutating =
        arena.nominalKindOf(setterContext) == NominalKind.PROTOCOL
            || (!setter.hasFlag(SynthFlag.ACC_NONMUTATING)
                && !storage.hasFlag(SynthFlag.ACC_SETTER_NONMUTATING));
    FuncDecl materializeForSet =
        skeleton.createMaterializeForSetPrototype(storage, setter, mutating);
    if (materializeForSet == null) {
      return null;
    }
    if (storage.isDynamic() || storage.isForeign()) {
      materializeForSet.addFlags(SynthFlag.ACC_FORCED_STATIC_DISPATCH);
    }

    ImmutableList.Builder<Decl> asAvailableAs = ImmutableList.<Decl>builder().add(storage);
    DeclId getter = storage.getter();
    if (getter != null) {
      asAvailableAs.add(arena.getNonNull(getter));
    }
    asAvailableAs.add(setter);
    materializeForSet.setAvailability(
        ctx.availability().inferredAvailability(materializeForSet, asAvailableAs.build()));

    SynthSupport.registerExternalIfNeeded(ctx, materializeForSet, storage);
    return materializeForSet;
  }

  /**
   * Adds a materializeForSet accessor to {@code storage} right after its setter, and records it
   * on the storage.
   */
  public @Nullable FuncDecl addMaterializeForSet(AbstractStorageDecl storage) {
    FuncDecl materializeForSet = createMaterializeForSet(storage);
    if (materializeForSet == null) {
      logger.debug("cannot represent materializeForSet of {}", storage.name());
      return null;
    }
    SynthSupport.addMemberToContextIfNeeded(
        ctx, materializeForSet, SynthSupport.contextOf(storage), storage.setter());
    storage.setAccessor(AccessorKind.MATERIALIZE_FOR_SET, materializeForSet.id());
    ctx.typeResolver().validate(materializeForSet);
    return materializeForSet;
  }

  /** Completes a materializeForSet declaration; its body is owed by code generation. */
  public void synthesizeMaterializeForSet(FuncDecl materializeForSet, AbstractStorageDecl storage) {
    SynthSupport.maybeMarkTransparent(ctx, materializeForSet, storage);
    SynthSupport.typeCheck(ctx, materializeForSet, /* firstPass= */ true);
    SynthSupport.registerExternalIfNeeded(ctx, materializeForSet, storage);
    materializeForSet.setBodyOwedExternally(true);
  }

  /**
   * Adds and completes a materializeForSet accessor for storage with accessors, if it lives in a
   * context where mutation may go through an abstraction boundary. Returns the new accessor, or
   * {@code null} if none was needed or one already exists.
   */
  public @Nullable FuncDecl maybeAddMaterializeForSet(AbstractStorageDecl storage) {
    if (!needsMaterializeForSet(storage)) {
      return null;
    }
    FuncDecl materializeForSet = addMaterializeForSet(storage);
    if (materializeForSet != null) {
      synthesizeMaterializeForSet(materializeForSet, storage);
    }
    return materializeForSet;
  }

  /**
   * Returns true if {@code storage} lacks a materializeForSet accessor and needs one: it is
   * settable, valid, and a member of a non-ObjC protocol (outside extensions), a non-final class
   * member (or a final one overriding storage that has one), or a member of a native struct.
   */
  boolean needsMaterializeForSet(AbstractStorageDecl storage) {
    if (storage.materializeForSet() != null) {
      return false;
    }
    if (storage.setter() == null) {
      return false;
    }
    if (storage.isInvalid()) {
      return false;
    }
    DeclId context = SynthSupport.contextOf(storage);
    NominalTypeDecl container = arena.nominalOf(context);
    if (container == null) {
      return false;
    }
    switch (container.nominalKind()) {
      case PROTOCOL:
        return !container.hasFlag(SynthFlag.ACC_OBJC) && !arena.isProtocolExtension(context);
      case CLASS:
        if (storage.isFinal()) {
          DeclId overridden = storage.overridden();
          return overridden != null
              && arena.get(overridden, AbstractStorageDecl.class).materializeForSet() != null;
        }
        return true;
      case ENUM:
        return false;
      case STRUCT:
        return !container.isForeign();
    }
    throw new AssertionError(container.nominalKind());
  }

  /**
   * Ensures storage that witnesses a protocol requirement has a full set of accessors: stored
   * witnesses get trivial accessors, and a settable non-ObjC requirement gets a materializeForSet.
   */
  public ImmutableList<FuncDecl> synthesizeWitnessAccessorsForStorage(
      AbstractStorageDecl requirement, AbstractStorageDecl storage, TrivialAccessors trivial) {
    ImmutableList.Builder<FuncDecl> result = ImmutableList.builder();
    if (storage.getter() == null) {
      result.addAll(trivial.addTrivialAccessorsToStorage(storage));
    }
    if (!requirement.isObjC()
        && requirement.setter() != null
        && storage.setter() != null
        && storage.materializeForSet() == null) {
      FuncDecl materializeForSet = addMaterializeForSet(storage);
      if (materializeForSet != null) {
        synthesizeMaterializeForSet(materializeForSet, storage);
        SynthSupport.typeCheck(ctx, materializeForSet, /* firstPass= */ false);
        result.add(materializeForSet);
      }
    }
    return result.build();
  }

  private static DeclId requireSetter(AbstractStorageDecl storage) {
    DeclId setter = storage.setter();
    if (setter == null) {
      throw new IllegalStateException(storage.name() + " has no setter");
    }
    return setter;
  }
}
