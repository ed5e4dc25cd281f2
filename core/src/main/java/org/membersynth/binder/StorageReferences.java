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
import org.membersynth.decl.DeclKind;
import org.membersynth.decl.FuncDecl;
import org.membersynth.decl.ParamDecl;
import org.membersynth.decl.VarDecl;
import org.membersynth.diag.SynthError.ErrorKind;
import org.membersynth.model.AccessorKind;
import org.membersynth.model.SynthFlag;
import org.membersynth.tree.AccessSemantics;
import org.membersynth.tree.Tree;
import org.membersynth.type.Type;
import org.jspecify.annotations.Nullable;

/** Builds the expressions synthesized bodies use to read and write storage. */
public class StorageReferences {

  /** Whether a reference through {@code self} may be redirected to the overridden storage. */
  public enum SelfAccessKind {
    /** Access this type's own member. */
    PEER,
    /** Access the superclass's implementation, if the storage overrides one. */
    SUPER
  }

  private final SynthContext ctx;
  private final DeclArena arena;

  public StorageReferences(SynthContext ctx) {
    this.ctx = ctx;
    this.arena = ctx.arena();
  }

  /**
   * Builds a reference to {@code storage} from the body of {@code accessor}.
   *
   * <p>Without a self parameter the storage is referenced directly. A {@link SelfAccessKind#SUPER}
   * reference to overriding storage is re-targeted to the overridden storage through {@code super}
   * with ordinary semantics, and degrades to {@link SelfAccessKind#PEER} otherwise.
   */
  public Tree.Expr buildStorageReference(
      FuncDecl accessor,
      AbstractStorageDecl storage,
      AccessSemantics semantics,
      SelfAccessKind selfAccessKind) {
    DeclId selfDecl = accessor.selfParam();
    if (selfDecl == null) {
      return new Tree.DeclRef(storage.position(), storage.id(), storage.name(), semantics);
    }

    if (selfAccessKind == SelfAccessKind.SUPER) {
      DeclId overridden = storage.overridden();
      if (overridden != null) {
        storage = arena.get(overridden, AbstractStorageDecl.class);
        semantics = AccessSemantics.ORDINARY;
      } else {
        selfAccessKind = SelfAccessKind.PEER;
      }
    }

    Tree.Expr self = buildSelfReference(selfDecl, selfAccessKind);
    if (storage.kind() == DeclKind.SUBSCRIPT) {
      Tree.TupleExpr indices = buildSubscriptIndexReference(accessor);
      return new Tree.Subscript(storage.position(), self, indices, storage.id(), semantics);
    }
    return new Tree.MemberRef(storage.position(), self, storage.id(), storage.name(), semantics);
  }

  /**
   * Loads the value of {@code storage}: directly from storage, or through the superclass getter
   * if the storage is an override.
   */
  public Tree.Expr createLoad(FuncDecl accessor, AbstractStorageDecl storage) {
    return buildStorageReference(
        accessor, storage, AccessSemantics.DIRECT_TO_STORAGE, SelfAccessKind.SUPER);
  }

  /**
   * Stores {@code value} into {@code storage}: directly, or through the superclass setter if the
   * storage is an override. Copy-on-assign variables store a copy of the value.
   */
  public Tree.Expr createStore(FuncDecl accessor, Tree.Expr value, AbstractStorageDecl storage) {
    if (storage.kind() == DeclKind.VAR && storage.hasFlag(SynthFlag.ACC_COPY_ON_ASSIGN)) {
      value = synthesizeCopyCall(value, (VarDecl) storage);
    }
    Tree.Expr dest =
        buildStorageReference(
            accessor, storage, AccessSemantics.DIRECT_TO_STORAGE, SelfAccessKind.SUPER);
    return new Tree.Assign(storage.position(), dest, value);
  }

  /**
   * Wraps {@code value} in a call to {@code copy(with: nil)} cast back to the variable's type.
   * Optional values are only copied if they hold a value.
   */
  private Tree.Expr synthesizeCopyCall(Tree.Expr value, VarDecl var) {
    Type underlying = ctx.typeResolver().typeOfStorageValue(var);
    boolean isOptional = false;
    if (underlying.tyKind() == Type.TyKind.OPTIONAL_TY) {
      underlying = ((Type.OptionalTy) underlying).wrapped();
      isOptional = true;
    }

    DeclId copying = ctx.knownDecls().copyingProtocol();
    DeclId context = arena.owner(var).id();
    if (copying == null || !ctx.conformance().conformsTo(underlying, copying, context)) {
      ctx.log().error(var.id(), var.position(), ErrorKind.COPYING_DOES_NOT_CONFORM, var.name());
      return value;
    }

    int pos = var.position();
    if (isOptional) {
      value = new Tree.BindOptional(pos, value);
    }
    Tree.Expr call =
        new Tree.Call(
            pos,
            new Tree.UnresolvedDot(pos, value, "copy"),
            new Tree.TupleExpr(
                pos, ImmutableList.of(new Tree.NilLiteral(pos)), ImmutableList.of("with")));
    if (!isOptional) {
      return new Tree.CheckedCast(pos, call, underlying, /* conditional= */ false);
    }
    return new Tree.OptionalEvaluation(
        pos, new Tree.CheckedCast(pos, call, underlying, /* conditional= */ true));
  }

  Tree.Expr buildSelfReference(DeclId selfDecl, SelfAccessKind selfAccessKind) {
    switch (selfAccessKind) {
      case PEER:
        return new Tree.DeclRef(-1, selfDecl, "self", AccessSemantics.ORDINARY);
      case SUPER:
        return new Tree.SuperRef(-1, selfDecl);
    }
    throw new AssertionError(selfAccessKind);
  }

  /** Forwards an accessor's index parameters, skipping its value or buffer parameters. */
  private Tree.TupleExpr buildSubscriptIndexReference(FuncDecl accessor) {
    ImmutableList<DeclId> params = accessor.params();
    AccessorKind kind = accessor.accessorKind();
    if (kind != AccessorKind.GETTER) {
      params = params.subList(1, params.size());
    }
    if (kind == AccessorKind.MATERIALIZE_FOR_SET) {
      params = params.subList(1, params.size());
    }
    Tree.TupleExpr result = buildArgumentForwarding(params);
    checkState(result != null, "cannot forward variadic indices of %s", accessor.name());
    return result;
  }

  /**
   * Builds an argument list that passes each parameter on under its argument label, with in/out
   * parameters passed in/out. Returns {@code null} if a parameter is variadic.
   */
  public Tree.@Nullable TupleExpr buildArgumentForwarding(ImmutableList<DeclId> params) {
    ImmutableList.Builder<Tree.Expr> args = ImmutableList.builder();
    ImmutableList.Builder<String> labels = ImmutableList.builder();
    for (DeclId id : params) {
      ParamDecl param = arena.get(id, ParamDecl.class);
      if (param.isVariadic()) {
        return null;
      }
      Tree.Expr ref = new Tree.DeclRef(-1, id, param.name(), AccessSemantics.ORDINARY);
      if (param.isInOut()) {
        ref = new Tree.InOut(-1, ref);
      }
      args.add(ref);
      labels.add(param.argumentName());
    }
    return new Tree.TupleExpr(-1, args.build(), labels.build());
  }
}
