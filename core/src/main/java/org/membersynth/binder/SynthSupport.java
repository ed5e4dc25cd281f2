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

import org.membersynth.binder.env.DeclArena;
import org.membersynth.binder.services.SynthContext;
import org.membersynth.binder.sym.DeclId;
import org.membersynth.decl.AbstractStorageDecl;
import org.membersynth.decl.ContextDecl;
import org.membersynth.decl.Decl;
import org.membersynth.decl.NominalTypeDecl;
import org.membersynth.model.NominalKind;
import org.membersynth.model.SynthFlag;
import org.jspecify.annotations.Nullable;

/** Bookkeeping shared by the synthesizers. */
final class SynthSupport {

  /**
   * Adds a synthesized declaration to the member list of {@code context}, right after {@code
   * hint} if given. Declarations in function bodies are not members of anything.
   */
  static void addMemberToContextIfNeeded(
      SynthContext ctx, Decl decl, DeclId context, @Nullable DeclId hint) {
    Decl owner = ctx.arena().getNonNull(context);
    switch (owner.kind()) {
      case NOMINAL:
      case EXTENSION:
      case SOURCE_FILE:
        ((ContextDecl) owner).addMember(decl.id(), hint);
        break;
      case FUNC:
      case CONSTRUCTOR:
      case DESTRUCTOR:
        break;
      default:
        throw new AssertionError(owner.kind());
    }
  }

  static void addMemberToContextIfNeeded(SynthContext ctx, Decl decl, DeclId context) {
    addMemberToContextIfNeeded(ctx, decl, context, null);
  }

  /**
   * Marks an accessor transparent if its storage lives in a fixed-layout nominal type, where the
   * accessor only exists to make access uniform.
   */
  static void maybeMarkTransparent(SynthContext ctx, Decl accessor, AbstractStorageDecl storage) {
    NominalTypeDecl nominal = ctx.arena().nominalOf(contextOf(storage));
    if (nominal != null && nominal.hasFlag(SynthFlag.ACC_FIXED_LAYOUT)) {
      accessor.addFlags(SynthFlag.ACC_TRANSPARENT);
    }
  }

  /**
   * Returns true if accessors of {@code storage} must be emitted into the current module because
   * the storage, or the nominal type directly containing it, was imported.
   */
  static boolean needsToBeRegisteredAsExternalDecl(SynthContext ctx, AbstractStorageDecl storage) {
    if (storage.isForeign()) {
      return true;
    }
    Decl owner = ctx.arena().getNonNull(contextOf(storage));
    return owner instanceof NominalTypeDecl && owner.isForeign();
  }

  static void registerExternalIfNeeded(
      SynthContext ctx, Decl accessor, AbstractStorageDecl storage) {
    if (needsToBeRegisteredAsExternalDecl(ctx, storage)) {
      ctx.externalDecls().registerExternal(accessor.id());
    }
  }

  /** Hands a synthesized declaration to the type checker, unless deferred by the options. */
  static void typeCheck(SynthContext ctx, Decl decl, boolean firstPass) {
    if (ctx.options().typeCheckSynthesized()) {
      ctx.typeResolver().typeCheck(decl, firstPass);
    }
  }

  static void typeCheckBothPasses(SynthContext ctx, Decl decl) {
    typeCheck(ctx, decl, /* firstPass= */ true);
    typeCheck(ctx, decl, /* firstPass= */ false);
  }

  /** Returns true if the context is a class or an extension of one. */
  static boolean isClassOrClassExtension(DeclArena arena, DeclId context) {
    return arena.nominalKindOf(context) == NominalKind.CLASS;
  }

  static DeclId contextOf(Decl decl) {
    DeclId parent = decl.parent();
    if (parent == null) {
      throw new IllegalArgumentException(decl + " has no declaration context");
    }
    return parent;
  }

  private SynthSupport() {}
}
