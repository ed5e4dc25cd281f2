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
import org.membersynth.decl.ConstructorDecl;
import org.membersynth.decl.DeclKind;
import org.membersynth.decl.DestructorDecl;
import org.membersynth.decl.FuncDecl;
import org.membersynth.decl.NominalTypeDecl;
import org.membersynth.decl.ParamDecl;
import org.membersynth.decl.SubscriptDecl;
import org.membersynth.model.AccessorKind;
import org.membersynth.model.Failability;
import org.membersynth.model.NominalKind;
import org.membersynth.model.SynthFlag;
import org.membersynth.type.Type;
import org.membersynth.type.Type.BuiltinTy;
import org.membersynth.type.Type.FunctionTy;
import org.membersynth.type.Type.InOutTy;
import org.membersynth.type.Type.MetatypeTy;
import org.membersynth.type.Type.OptionalTy;
import org.membersynth.type.Type.TupleTy;
import org.jspecify.annotations.Nullable;

/**
 * Builds the signatures of synthesized members: parameter lists and bodiless accessor,
 * initializer and destructor declarations.
 *
 * <p>Nothing built here is added to a member list; callers decide where the declarations go.
 */
public class SkeletonBuilder {

  private final SynthContext ctx;
  private final DeclArena arena;

  public SkeletonBuilder(SynthContext ctx) {
    this.ctx = ctx;
    this.arena = ctx.arena();
  }

  /**
   * Creates the implicit {@code self} parameter of a member of {@code context}.
   *
   * <p>Its type is the context's declared type (the protocol {@code Self} type inside protocols),
   * the metatype of that type for static members, and in/out for mutating members of value types.
   */
  public ParamDecl createSelf(DeclId context, boolean isStatic, boolean isInOut) {
    NominalTypeDecl nominal = arena.nominalOf(context);
    Type declared = nominal != null ? nominal.declaredType() : Type.VOID;
    Type type;
    if (isStatic) {
      type = MetatypeTy.create(declared);
    } else if (isInOut && nominal != null && nominal.nominalKind() != NominalKind.CLASS) {
      type = InOutTy.create(declared);
    } else {
      type = declared;
    }
    ParamDecl self = arena.create(id -> new ParamDecl(id, -1, context, "", "self", type));
    self.addFlags(SynthFlag.ACC_IMPLICIT);
    return self;
  }

  /**
   * Returns {@code prefix} followed by fresh copies of the storage's index parameters, or {@code
   * null} if an index cannot be forwarded by a synthesized accessor.
   */
  public @Nullable ImmutableList<DeclId> buildIndexForwardingParamList(
      AbstractStorageDecl storage, ImmutableList<DeclId> prefix) {
    if (storage.kind() != DeclKind.SUBSCRIPT) {
      return prefix;
    }
    ImmutableList.Builder<DeclId> result = ImmutableList.<DeclId>builder().addAll(prefix);
    for (DeclId index : ((SubscriptDecl) storage).indices()) {
      ParamDecl original = arena.get(index, ParamDecl.class);
      if (original.type().tyKind() == Type.TyKind.ERROR_TY || original.isVariadic()) {
        return null;
      }
      result.add(cloneParam(original, SynthFlag.ACC_IMPLICIT).id());
    }
    return result.build();
  }

  /** Creates a copy of a parameter, with the given extra flags. */
  ParamDecl cloneParam(ParamDecl original, int extraFlags) {
    ParamDecl clone =
        arena.create(
            id ->
                new ParamDecl(
                    id,
                    original.position(),
                    null,
                    original.argumentName(),
                    original.name(),
                    original.type()));
    clone.addFlags(
        (original.flags() & (SynthFlag.ACC_VARIADIC | SynthFlag.ACC_LET)) | extraFlags);
    return clone;
  }

  private ParamDecl buildArgument(AbstractStorageDecl storage, String name, Type type) {
    ParamDecl param =
        arena.create(id -> new ParamDecl(id, storage.position(), null, "", name, type));
    param.addFlags(SynthFlag.ACC_IMPLICIT);
    return param;
  }

  /** Creates a bodiless getter for {@code storage}, or {@code null} if indices can't be cloned. */
  public @Nullable FuncDecl createGetterPrototype(AbstractStorageDecl storage) {
    ImmutableList<DeclId> params = buildIndexForwardingParamList(storage, ImmutableList.of());
    if (params == null) {
      return null;
    }
    boolean mutating = storage.hasFlag(SynthFlag.ACC_GETTER_MUTATING);
    Type result = ctx.typeResolver().typeOfStorageValue(storage);
    FuncDecl getter = createAccessor(storage, AccessorKind.GETTER, mutating, params, result);
    getter.setAccessibility(storage.accessibility());
    return getter;
  }

  /**
   * Creates a bodiless setter for {@code storage}; its first parameter is the new value. Returns
   * {@code null} if indices can't be cloned.
   */
  public @Nullable FuncDecl createSetterPrototype(AbstractStorageDecl storage) {
    ParamDecl value =
        buildArgument(storage, "value", ctx.typeResolver().typeOfStorageValue(storage));
    value.addFlags(SynthFlag.ACC_LET);
    ImmutableList<DeclId> params =
        buildIndexForwardingParamList(storage, ImmutableList.of(value.id()));
    if (params == null) {
      return null;
    }
    boolean mutating = !storage.hasFlag(SynthFlag.ACC_SETTER_NONMUTATING);
    FuncDecl setter = createAccessor(storage, AccessorKind.SETTER, mutating, params, Type.VOID);
    setter.setAccessibility(storage.setterAccessibility());
    return setter;
  }

  /**
   * Creates a bodiless materializeForSet accessor for {@code storage}, whose setter must already
   * exist. Returns {@code null} if indices can't be cloned.
   *
   * <p>The accessor takes {@code (buffer: RawPointer, inout callbackStorage: UnsafeValueBuffer,
   * indices...)} and returns the address of the value together with an optional callback that
   * commits a value written through the address.
   */
  public @Nullable FuncDecl createMaterializeForSetPrototype(
      AbstractStorageDecl storage, FuncDecl setter, boolean mutating) {
    ParamDecl buffer = buildArgument(storage, "buffer", BuiltinTy.RAW_POINTER);
    buffer.addFlags(SynthFlag.ACC_LET);
    ParamDecl callbackStorage =
        buildArgument(
            storage, "callbackStorage", InOutTy.create(BuiltinTy.UNSAFE_VALUE_BUFFER));
    ImmutableList<DeclId> params =
        buildIndexForwardingParamList(
            storage, ImmutableList.of(buffer.id(), callbackStorage.id()));
    if (params == null) {
      return null;
    }
    FuncDecl materializeForSet =
        createAccessor(
            storage,
            AccessorKind.MATERIALIZE_FOR_SET,
            mutating,
            params,
            materializeForSetResultType(storage));
    materializeForSet.clearFlags(SynthFlag.ACC_STATIC);
    if (setter.isStatic()) {
      materializeForSet.addFlags(SynthFlag.ACC_STATIC);
    }
    materializeForSet.setAccessibility(storage.setterAccessibility());
    return materializeForSet;
  }

  private Type materializeForSetResultType(AbstractStorageDecl storage) {
    DeclId context = storage.parent();
    NominalTypeDecl nominal = context != null ? arena.nominalOf(context) : null;
    if (nominal != null && nominal.declaredType().tyKind() == Type.TyKind.ERROR_TY) {
      return Type.ERROR;
    }
    Type selfType;
    if (nominal == null) {
      selfType = Type.VOID;
    } else if (storage.isStatic()) {
      selfType = MetatypeTy.create(nominal.declaredType());
    } else {
      selfType = nominal.declaredType();
    }
    Type callback =
        FunctionTy.create(
            TupleTy.of(
                BuiltinTy.RAW_POINTER,
                InOutTy.create(BuiltinTy.UNSAFE_VALUE_BUFFER),
                InOutTy.create(selfType),
                MetatypeTy.create(selfType)),
            Type.VOID,
            FunctionTy.Representation.THIN,
            /* throwing= */ false);
    return TupleTy.of(BuiltinTy.RAW_POINTER, OptionalTy.create(callback));
  }

  private FuncDecl createAccessor(
      AbstractStorageDecl storage,
      AccessorKind accessorKind,
      boolean mutating,
      ImmutableList<DeclId> params,
      Type resultType) {
    DeclId context = storage.parent();
    ParamDecl self =
        context != null && arena.isTypeContext(context)
            ? createSelf(context, storage.isStatic(), mutating)
            : null;
    FuncDecl accessor =
        arena.create(
            id ->
                new FuncDecl(
                    id,
                    storage.position(),
                    context,
                    accessorKind.accessorName(storage.name()),
                    accessorKind,
                    storage.id(),
                    self != null ? self.id() : null,
                    params,
                    resultType));
    adopt(accessor.id(), self, params);
    int flags = SynthFlag.ACC_IMPLICIT;
    if (mutating) {
      flags |= SynthFlag.ACC_MUTATING;
    }
    if (storage.isFinal()) {
      flags |= SynthFlag.ACC_FINAL;
    }
    if (storage.isStatic()) {
      flags |= SynthFlag.ACC_STATIC;
    }
    accessor.addFlags(flags);
    return accessor;
  }

  /** Creates a bodiless implicit initializer of {@code nominal} with the given parameters. */
  public ConstructorDecl createConstructorShell(
      NominalTypeDecl nominal,
      int position,
      ImmutableList<DeclId> params,
      Failability failability) {
    ParamDecl self =
        createSelf(
            nominal.id(), /* isStatic= */ false, nominal.nominalKind() != NominalKind.CLASS);
    ConstructorDecl ctor =
        arena.create(
            id -> new ConstructorDecl(id, position, nominal.id(), self.id(), params, failability));
    adopt(ctor.id(), self, params);
    ctor.addFlags(SynthFlag.ACC_IMPLICIT);
    return ctor;
  }

  /** Creates a bodiless implicit destructor of {@code nominal}. */
  public DestructorDecl createDestructorShell(NominalTypeDecl nominal) {
    ParamDecl self = createSelf(nominal.id(), /* isStatic= */ false, /* isInOut= */ false);
    DestructorDecl destructor =
        arena.create(id -> new DestructorDecl(id, nominal.position(), nominal.id(), self.id()));
    adopt(destructor.id(), self, ImmutableList.of());
    destructor.addFlags(SynthFlag.ACC_IMPLICIT);
    return destructor;
  }

  private void adopt(DeclId owner, @Nullable ParamDecl self, ImmutableList<DeclId> params) {
    if (self != null) {
      self.setParent(owner);
    }
    for (DeclId param : params) {
      arena.getNonNull(param).setParent(owner);
    }
  }
}
