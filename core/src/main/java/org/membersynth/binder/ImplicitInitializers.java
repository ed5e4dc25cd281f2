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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import org.membersynth.binder.env.DeclArena;
import org.membersynth.binder.services.SynthContext;
import org.membersynth.binder.sym.DeclId;
import org.membersynth.decl.ConstructorDecl;
import org.membersynth.decl.Decl;
import org.membersynth.decl.DestructorDecl;
import org.membersynth.decl.NominalTypeDecl;
import org.membersynth.decl.ParamDecl;
import org.membersynth.decl.VarDecl;
import org.membersynth.diag.SynthError.ErrorKind;
import org.membersynth.model.Accessibility;
import org.membersynth.model.DesignatedInitKind;
import org.membersynth.model.Failability;
import org.membersynth.model.ImplicitConstructorKind;
import org.membersynth.model.NominalKind;
import org.membersynth.model.SynthFlag;
import org.membersynth.tree.AccessSemantics;
import org.membersynth.tree.Tree;
import org.membersynth.type.Type;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Synthesizes implicit initializers, inherited initializer overrides and destructors. */
public class ImplicitInitializers {

  private final Logger logger = LoggerFactory.getLogger(ImplicitInitializers.class);

  private final SynthContext ctx;
  private final DeclArena arena;
  private final SkeletonBuilder skeleton;
  private final StorageReferences refs;
  private final LazyProperties lazy;

  public ImplicitInitializers(
      SynthContext ctx, SkeletonBuilder skeleton, StorageReferences refs, LazyProperties lazy) {
    this.ctx = ctx;
    this.arena = ctx.arena();
    this.skeleton = skeleton;
    this.refs = refs;
    this.lazy = lazy;
  }

  /**
   * Creates the implicit default or memberwise initializer of {@code nominal}. The initializer is
   * not added to the type's members.
   *
   * <p>A memberwise initializer takes one argument per stored instance variable, in declaration
   * order. Constants with an initial value are skipped, and lazy variables are initialized through
   * their optional backing storage.
   */
  public ConstructorDecl createImplicitConstructor(
      NominalTypeDecl nominal, ImplicitConstructorKind kind) {
    Accessibility access = nominal.accessibility();
    if (!nominal.isForeign()) {
      access = Accessibility.min(access, Accessibility.INTERNAL);
    }

    ImmutableList.Builder<DeclId> params = ImmutableList.builder();
    ImmutableList.Builder<VarDecl> initialized = ImmutableList.builder();
    if (kind == ImplicitConstructorKind.MEMBERWISE) {
      checkArgument(
          nominal.nominalKind() == NominalKind.STRUCT,
          "only structs have memberwise initializers: %s",
          nominal.name());
      for (VarDecl var : storedProperties(nominal)) {
        if (var.isImplicit()) {
          continue;
        }
        ctx.typeResolver().validate(var);
        if (var.isLet() && var.initializer() != null) {
          continue;
        }
        access = Accessibility.min(access, var.accessibility());

        Type type = ctx.typeResolver().typeOfStorageValue(var);
        if (var.hasFlag(SynthFlag.ACC_LAZY)) {
          type = Type.OptionalTy.create(type);
        }
        Type paramType = type;
        ParamDecl param =
            arena.create(
                id ->
                    new ParamDecl(
                        id, nominal.position(), null, var.name(), var.name(), paramType));
        param.addFlags(SynthFlag.ACC_LET | SynthFlag.ACC_IMPLICIT);
        params.add(param.id());
        initialized.add(var);
      }
    }

    ConstructorDecl ctor =
        skeleton.createConstructorShell(
            nominal, nominal.position(), params.build(), Failability.NONE);
    ctor.setAccessibility(access);
    ctor.setImplicitKind(kind);
    if (kind == ImplicitConstructorKind.MEMBERWISE) {
      ctor.addFlags(SynthFlag.ACC_MEMBERWISE);
    }
    ctor.setBody(memberwiseBody(ctor, initialized.build()));

    if (nominal.nominalKind() == NominalKind.CLASS && nominal.superclass() != null) {
      ctor.addFlags(SynthFlag.ACC_OVERRIDE);
    }

    SynthSupport.typeCheck(ctx, ctor, /* firstPass= */ true);

    if (nominal.isForeign()) {
      ctx.externalDecls().registerExternal(ctor.id());
    }
    return ctor;
  }

  private ImmutableList<VarDecl> storedProperties(NominalTypeDecl nominal) {
    ImmutableList.Builder<VarDecl> result = ImmutableList.builder();
    for (DeclId member : nominal.members()) {
      Decl decl = arena.getNonNull(member);
      if (!(decl instanceof VarDecl)) {
        continue;
      }
      VarDecl var = (VarDecl) decl;
      if (var.isStatic()) {
        continue;
      }
      if (var.storageKind().hasStorage() || var.hasFlag(SynthFlag.ACC_LAZY)) {
        result.add(var);
      }
    }
    return result.build();
  }

  /**
   * Assigns each argument to the variable it is named after, in order. Arguments for lazy
   * variables fill their backing storage.
   */
  private Tree.Brace memberwiseBody(ConstructorDecl ctor, ImmutableList<VarDecl> vars) {
    ImmutableList.Builder<Tree> body = ImmutableList.builder();
    Tree.Expr self =
        refs.buildSelfReference(ctor.selfParam(), StorageReferences.SelfAccessKind.PEER);
    for (int i = 0; i < vars.size(); i++) {
      VarDecl var = vars.get(i);
      DeclId paramId = ctor.params().get(i);
      ParamDecl param = arena.get(paramId, ParamDecl.class);
      VarDecl target = var.hasFlag(SynthFlag.ACC_LAZY) ? lazy.backingStorage(var) : var;
      Tree.Expr dest =
          new Tree.MemberRef(
              ctor.position(),
              self,
              target.id(),
              target.name(),
              AccessSemantics.DIRECT_TO_STORAGE);
      Tree.Expr src = new Tree.DeclRef(-1, paramId, param.name(), AccessSemantics.ORDINARY);
      body.add(new Tree.Assign(ctor.position(), dest, src));
    }
    return new Tree.Brace(ctor.position(), body.build());
  }

  /**
   * Creates an initializer of {@code classDecl} that overrides the designated initializer {@code
   * superCtor} of its superclass, either as a stub that traps or by chaining to {@code
   * super.init}. The initializer is not added to the class's members.
   *
   * @return the override, or {@code null} if its signature cannot be represented
   */
  public @Nullable ConstructorDecl createDesignatedInitOverride(
      NominalTypeDecl classDecl, ConstructorDecl superCtor, DesignatedInitKind kind) {
    if (superCtor.hasFlag(SynthFlag.ACC_GENERIC) || classDecl.hasFlag(SynthFlag.ACC_GENERIC)) {
      logger.debug("not overriding generic initializer {} in {}", superCtor, classDecl.name());
      return null;
    }

    ImmutableList.Builder<DeclId> params = ImmutableList.builder();
    for (DeclId param : superCtor.params()) {
      ParamDecl original = arena.get(param, ParamDecl.class);
      params.add(
          skeleton.cloneParam(original, SynthFlag.ACC_IMPLICIT | SynthFlag.ACC_INHERITED).id());
    }
    ConstructorDecl ctor =
        skeleton.createConstructorShell(
            classDecl, classDecl.position(), params.build(), superCtor.failability());
    ctor.setAccessibility(
        Accessibility.min(classDecl.accessibility(), superCtor.accessibility()));
    ctor.setAvailability(
        ctx.availability().inferredAvailability(ctor, ImmutableList.of(superCtor)));
    if (superCtor.isThrowing()) {
      ctor.addFlags(SynthFlag.ACC_THROWS);
    }
    if (superCtor.isRequired()) {
      ctor.addFlags(SynthFlag.ACC_REQUIRED);
    }
    if (superCtor.hasFlag(SynthFlag.ACC_OBJC)) {
      ctor.addFlags(SynthFlag.ACC_OBJC);
    }
    ctor.addFlags(SynthFlag.ACC_OVERRIDE);
    ctor.setOverridden(superCtor.id());

    switch (kind) {
      case STUB:
        createStubBody(ctor, classDecl);
        return ctor;
      case CHAINING:
        break;
    }

    Tree.TupleExpr args = refs.buildArgumentForwarding(ctor.params());
    if (args == null) {
      ctx.log()
          .error(
              classDecl.id(),
              classDecl.position(),
              ErrorKind.UNSUPPORTED_SYNTHESIZE_INIT_VARIADIC,
              classDecl.name());
      ctx.log()
          .note(superCtor.id(), superCtor.position(), ErrorKind.VARIADIC_SUPERCLASS_INIT_HERE);
      createStubBody(ctor, classDecl);
      return ctor;
    }

    Tree.Expr superInit =
        new Tree.UnresolvedDot(-1, new Tree.SuperRef(-1, ctor.selfParam()), "init");
    Tree.Expr call = new Tree.Call(-1, superInit, args);
    if (superCtor.isThrowing()) {
      call = new Tree.Try(-1, call);
    }
    ctor.setBody(new Tree.Brace(-1, ImmutableList.of(call)));
    ctor.setDesignatedKind(DesignatedInitKind.CHAINING);
    return ctor;
  }

  /** Makes {@code ctor} trap with the qualified class name when it is called. */
  private void createStubBody(ConstructorDecl ctor, NominalTypeDecl classDecl) {
    DeclId unimplemented = ctx.knownDecls().unimplementedInitializer();
    if (unimplemented == null) {
      ctx.log()
          .error(
              classDecl.id(),
              classDecl.position(),
              ErrorKind.MISSING_UNIMPLEMENTED_INIT_RUNTIME);
      return;
    }
    int pos = classDecl.position();
    Tree.Expr fn =
        new Tree.DeclRef(pos, unimplemented, "unimplementedInitializer", AccessSemantics.ORDINARY);
    Tree.Expr className =
        new Tree.StringLiteral(pos, ctx.knownDecls().moduleName() + "." + classDecl.name());
    Tree.Expr call =
        new Tree.Call(pos, fn, Tree.TupleExpr.unlabeled(pos, ImmutableList.of(className)));
    ctor.setBody(new Tree.Brace(-1, ImmutableList.of(call)));
    ctor.addFlags(SynthFlag.ACC_STUB);
    ctor.setDesignatedKind(DesignatedInitKind.STUB);
  }

  /**
   * Adds an implicit destructor with an empty body to a class that has none.
   *
   * @return the destructor, or {@code null} if the class has one or is invalid
   */
  public @Nullable DestructorDecl addImplicitDestructor(NominalTypeDecl classDecl) {
    if (classDecl.hasDestructor() || classDecl.isInvalid()) {
      return null;
    }
    DestructorDecl destructor = skeleton.createDestructorShell(classDecl);
    SynthSupport.typeCheck(ctx, destructor, /* firstPass= */ true);
    destructor.setBody(new Tree.Brace(classDecl.position(), ImmutableList.of()));
    classDecl.addMember(destructor.id());
    classDecl.setHasDestructor(true);
    return destructor;
  }
}
