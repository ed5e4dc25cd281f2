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

import static com.google.common.base.Preconditions.checkState;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import org.membersynth.binder.sym.DeclId;
import org.membersynth.decl.ContextDecl;
import org.membersynth.decl.Decl;
import org.membersynth.decl.DeclKind;
import org.membersynth.decl.ExtensionDecl;
import org.membersynth.decl.NominalTypeDecl;
import org.membersynth.decl.SourceFileDecl;
import org.membersynth.model.NominalKind;
import org.jspecify.annotations.Nullable;

/**
 * The declarations of one compilation unit.
 *
 * <p>Declarations are appended and never removed, so a {@link DeclId} stays valid for the lifetime
 * of the arena.
 */
public class DeclArena implements Env<DeclId, Decl> {

  private final List<Decl> decls = new ArrayList<>();

  /** Creates a declaration with a fresh id and adds it to the arena. */
  public <T extends Decl> T create(Function<DeclId, T> factory) {
    DeclId id = new DeclId(decls.size());
    T decl = factory.apply(id);
    checkState(decl.id().equals(id), "%s was created with id %s", decl, id);
    decls.add(decl);
    return decl;
  }

  @Override
  public @Nullable Decl get(DeclId id) {
    int idx = id.index();
    return idx >= 0 && idx < decls.size() ? decls.get(idx) : null;
  }

  /** Returns the declaration with the given id, which must be of the given class. */
  public <T extends Decl> T get(DeclId id, Class<T> clazz) {
    return clazz.cast(getNonNull(id));
  }

  public int size() {
    return decls.size();
  }

  /** Returns the context declaration that owns {@code decl}. */
  public ContextDecl owner(Decl decl) {
    DeclId parent = decl.parent();
    if (parent == null) {
      throw new IllegalArgumentException(decl + " has no owner");
    }
    return get(parent, ContextDecl.class);
  }

  /**
   * Returns the nominal type a context declaration contributes members to: the nominal itself, or
   * the extended type of an extension. Returns {@code null} for other contexts.
   */
  public @Nullable NominalTypeDecl nominalOf(DeclId context) {
    Decl decl = getNonNull(context);
    switch (decl.kind()) {
      case NOMINAL:
        return (NominalTypeDecl) decl;
      case EXTENSION:
        return get(((ExtensionDecl) decl).extended(), NominalTypeDecl.class);
      default:
        return null;
    }
  }

  /** Returns true if the context is a nominal type or an extension of one. */
  public boolean isTypeContext(DeclId context) {
    return nominalOf(context) != null;
  }

  /** Returns true if the context is a function body. */
  public boolean isLocalContext(DeclId context) {
    switch (getNonNull(context).kind()) {
      case FUNC:
      case CONSTRUCTOR:
      case DESTRUCTOR:
        return true;
      default:
        return false;
    }
  }

  public boolean isProtocolExtension(DeclId context) {
    Decl decl = getNonNull(context);
    return decl.kind() == DeclKind.EXTENSION
        && nominalKindOf(context) == NominalKind.PROTOCOL;
  }

  /** Returns the kind of the nominal type the context contributes to, or {@code null}. */
  public @Nullable NominalKind nominalKindOf(DeclId context) {
    NominalTypeDecl nominal = nominalOf(context);
    return nominal != null ? nominal.nominalKind() : null;
  }

  /** Returns the source file that (transitively) contains {@code decl}. */
  public SourceFileDecl sourceFileOf(Decl decl) {
    Decl curr = decl;
    while (curr.kind() != DeclKind.SOURCE_FILE) {
      DeclId parent = curr.parent();
      if (parent == null) {
        throw new IllegalArgumentException(decl + " is not in a source file");
      }
      curr = getNonNull(parent);
    }
    return (SourceFileDecl) curr;
  }
}
