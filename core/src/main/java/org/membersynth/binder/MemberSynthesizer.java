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
import java.util.HashSet;
import java.util.Set;
import java.util.function.Supplier;
import org.membersynth.binder.SynthesisOutcome.Status;
import org.membersynth.binder.env.DeclArena;
import org.membersynth.binder.services.SynthContext;
import org.membersynth.binder.sym.DeclId;
import org.membersynth.decl.AbstractStorageDecl;
import org.membersynth.decl.ConstructorDecl;
import org.membersynth.decl.Decl;
import org.membersynth.decl.DestructorDecl;
import org.membersynth.decl.FuncDecl;
import org.membersynth.decl.NominalTypeDecl;
import org.membersynth.decl.SourceFileDecl;
import org.membersynth.decl.VarDecl;
import org.membersynth.model.ImplicitConstructorKind;
import org.membersynth.model.NominalKind;
import org.membersynth.model.SynthFlag;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Synthesizes implicit members on request.
 *
 * <p>Each request names one subject declaration and a {@link SynthesisIntent}. Synthesis may type
 * check the members it creates, and type checking may request synthesis again. A request for a
 * subject whose synthesis is already under way reports {@link Status#ALREADY_HANDLED} without
 * creating anything; storage subjects carry the in-progress mark on the declaration itself.
 */
public class MemberSynthesizer {

  private final Logger logger = LoggerFactory.getLogger(MemberSynthesizer.class);

  private final SynthContext ctx;
  private final DeclArena arena;
  private final MaterializeForSet materializeForSet;
  private final TrivialAccessors trivial;
  private final ObservingAccessors observing;
  private final LazyProperties lazy;
  private final ImplicitInitializers initializers;

  /** Nominal types whose initializers or destructor are being synthesized. */
  private final Set<DeclId> typesInProgress = new HashSet<>();

  public MemberSynthesizer(SynthContext ctx) {
    this.ctx = ctx;
    this.arena = ctx.arena();
    SkeletonBuilder skeleton = new SkeletonBuilder(ctx);
    StorageReferences refs = new StorageReferences(ctx);
    this.materializeForSet = new MaterializeForSet(ctx, skeleton);
    this.trivial = new TrivialAccessors(ctx, skeleton, refs, materializeForSet);
    this.observing = new ObservingAccessors(ctx, refs, trivial);
    this.lazy = new LazyProperties(ctx, skeleton, refs, trivial);
    this.initializers = new ImplicitInitializers(ctx, skeleton, refs, lazy);
  }

  public SynthContext context() {
    return ctx;
  }

  public SynthesisOutcome synthesize(DeclId subject, SynthesisIntent intent) {
    return synthesize(SynthesisRequest.of(subject, intent));
  }

  public SynthesisOutcome synthesize(SynthesisRequest request) {
    Decl subject = arena.getNonNull(request.subject());
    if (subject.isInvalid()) {
      logger.debug("skipping {} of invalid {}", request.intent(), subject);
      return SynthesisOutcome.of(Status.SKIPPED);
    }
    switch (request.intent()) {
      case NEEDS_BASIC_ACCESSORS:
        return addBasicAccessors(storage(subject));
      case NEEDS_MATERIALIZE_FOR_SET:
        return addMaterializeForSet(storage(subject));
      case NEEDS_OBSERVING_ACCESSORS:
        return completeObservingAccessors(variable(subject));
      case LAZY:
        return completeLazyVariable(variable(subject));
      case NEEDS_IMPLICIT_CONSTRUCTOR:
        return addImplicitConstructor(nominal(subject), request.constructorKind());
      case NEEDS_INHERITED_INITIALIZER:
        return addInheritedInitializers(nominal(subject), request);
      case NEEDS_DESTRUCTOR:
        return addDestructor(nominal(subject));
      case WITNESS_ACCESSORS:
        return addWitnessAccessors(storage(subject), request.related());
      case PROTOCOL_REQUIREMENT:
        return convertProtocolRequirement(variable(subject));
      case MUTABLE_ADDRESS_SETTER:
        return completeMutableAddressSetter(storage(subject));
    }
    throw new AssertionError(request.intent());
  }

  /**
   * Adds whatever accessors a variable needs before it can be type checked: trivial accessors for
   * stored variables whose storage is abstracted, accessor shells for lazy variables, and
   * bodiless accessors for managed class storage.
   */
  public SynthesisOutcome maybeAddAccessorsToVariable(VarDecl var) {
    if (var.getter() != null || var.isBeingTypeChecked()) {
      return SynthesisOutcome.of(Status.ALREADY_HANDLED);
    }
    DeclId context = SynthSupport.contextOf(var);
    if (arena.isLocalContext(context)) {
      return skip(var, "local variable");
    }
    if (var.hasFlag(SynthFlag.ACC_LAZY)) {
      return guarded(var, () -> SynthesisOutcome.synthesized(lazy.addLazyAccessorShells(var)));
    }
    if (var.isImplicit()) {
      return skip(var, "implicit variable");
    }
    NominalTypeDecl nominal = arena.nominalOf(context);
    if (nominal == null && var.hasFlag(SynthFlag.ACC_FIXED_LAYOUT)) {
      return skip(var, "fixed-layout global");
    }
    if (nominal != null && nominal.nominalKind() == NominalKind.PROTOCOL) {
      return skip(var, "protocol requirement");
    }
    if (nominal != null
        && nominal.nominalKind() == NominalKind.CLASS
        && var.hasFlag(SynthFlag.ACC_MANAGED)) {
      return guarded(
          var, () -> SynthesisOutcome.synthesized(trivial.convertManagedStoredVarToComputed(var)));
    }
    if (nominal != null && nominal.nominalKind() == NominalKind.STRUCT && nominal.isForeign()) {
      return skip(var, "member of an imported struct");
    }
    if (ctx.options().skipSilFiles()
        && arena.sourceFileOf(var).fileKind() == SourceFileDecl.FileKind.SIL) {
      return skip(var, "variable in an intermediate-language file");
    }
    return guarded(
        var, () -> SynthesisOutcome.synthesized(trivial.addTrivialAccessorsToStorage(var)));
  }

  private SynthesisOutcome addBasicAccessors(AbstractStorageDecl storage) {
    if (storage instanceof VarDecl) {
      return maybeAddAccessorsToVariable((VarDecl) storage);
    }
    if (storage.getter() != null || storage.isBeingTypeChecked()) {
      return SynthesisOutcome.of(Status.ALREADY_HANDLED);
    }
    if (!storage.storageKind().hasStorage()) {
      return skip(storage, "computed storage");
    }
    return guarded(
        storage, () -> SynthesisOutcome.synthesized(trivial.addTrivialAccessorsToStorage(storage)));
  }

  private SynthesisOutcome addMaterializeForSet(AbstractStorageDecl storage) {
    if (storage.materializeForSet() != null || storage.isBeingTypeChecked()) {
      return SynthesisOutcome.of(Status.ALREADY_HANDLED);
    }
    if (!materializeForSet.needsMaterializeForSet(storage)) {
      return skip(storage, "storage without abstracted mutation");
    }
    return guarded(
        storage,
        () -> {
          FuncDecl added = materializeForSet.maybeAddMaterializeForSet(storage);
          return added != null
              ? SynthesisOutcome.synthesized(ImmutableList.of(added))
              : SynthesisOutcome.of(Status.NOT_SYNTHESIZED);
        });
  }

  private SynthesisOutcome completeObservingAccessors(VarDecl var) {
    if (hasBody(var.getter()) || var.isBeingTypeChecked()) {
      return SynthesisOutcome.of(Status.ALREADY_HANDLED);
    }
    return guarded(
        var,
        () -> {
          observing.synthesizeObservingAccessors(var);
          return SynthesisOutcome.synthesized(accessors(var));
        });
  }

  private SynthesisOutcome completeLazyVariable(VarDecl var) {
    checkArgument(var.hasFlag(SynthFlag.ACC_LAZY), "%s is not lazy", var.name());
    if (hasBody(var.getter()) || var.isBeingTypeChecked()) {
      return SynthesisOutcome.of(Status.ALREADY_HANDLED);
    }
    return guarded(
        var,
        () -> {
          ImmutableList.Builder<Decl> decls = ImmutableList.builder();
          if (var.getter() == null) {
            ImmutableList<FuncDecl> shells = lazy.addLazyAccessorShells(var);
            if (shells.isEmpty()) {
              return SynthesisOutcome.of(Status.NOT_SYNTHESIZED);
            }
          }
          decls.add(lazy.completeLazyVarImplementation(var));
          decls.addAll(accessors(var));
          return SynthesisOutcome.synthesized(decls.build());
        });
  }

  private SynthesisOutcome addImplicitConstructor(
      NominalTypeDecl nominal, @Nullable ImplicitConstructorKind requested) {
    switch (nominal.nominalKind()) {
      case STRUCT:
      case CLASS:
        break;
      case ENUM:
      case PROTOCOL:
        return skip(nominal, "type without implicit initializers");
    }
    ImplicitConstructorKind kind =
        requested != null ? requested : defaultConstructorKind(nominal);
    for (ConstructorDecl existing : constructors(nominal)) {
      if (existing.implicitKind() == kind) {
        return SynthesisOutcome.of(Status.ALREADY_HANDLED);
      }
    }
    return guardedType(
        nominal,
        () -> {
          ConstructorDecl ctor = initializers.createImplicitConstructor(nominal, kind);
          nominal.addMember(ctor.id());
          return SynthesisOutcome.synthesized(ImmutableList.of(ctor));
        });
  }

  private static ImplicitConstructorKind defaultConstructorKind(NominalTypeDecl nominal) {
    return nominal.nominalKind() == NominalKind.STRUCT
        ? ImplicitConstructorKind.MEMBERWISE
        : ImplicitConstructorKind.DEFAULT;
  }

  private SynthesisOutcome addInheritedInitializers(
      NominalTypeDecl classDecl, SynthesisRequest request) {
    checkArgument(
        classDecl.nominalKind() == NominalKind.CLASS, "%s is not a class", classDecl.name());
    DeclId superclass = classDecl.superclass();
    if (superclass == null) {
      return skip(classDecl, "root class");
    }
    ImmutableList<ConstructorDecl> inherited;
    DeclId related = request.related();
    if (related != null) {
      inherited = ImmutableList.of(arena.get(related, ConstructorDecl.class));
    } else {
      inherited = constructors(arena.get(superclass, NominalTypeDecl.class));
    }
    return guardedType(
        classDecl,
        () -> {
          ImmutableList.Builder<Decl> created = ImmutableList.builder();
          boolean anyPending = false;
          for (ConstructorDecl superCtor : inherited) {
            if (overrides(classDecl, superCtor)) {
              continue;
            }
            anyPending = true;
            ConstructorDecl ctor =
                initializers.createDesignatedInitOverride(
                    classDecl, superCtor, request.designatedInitKind());
            if (ctor != null) {
              classDecl.addMember(ctor.id());
              created.add(ctor);
            }
          }
          if (!anyPending) {
            return SynthesisOutcome.of(Status.ALREADY_HANDLED);
          }
          return SynthesisOutcome.synthesized(created.build());
        });
  }

  private SynthesisOutcome addDestructor(NominalTypeDecl classDecl) {
    checkArgument(
        classDecl.nominalKind() == NominalKind.CLASS, "%s is not a class", classDecl.name());
    if (classDecl.hasDestructor()) {
      return SynthesisOutcome.of(Status.ALREADY_HANDLED);
    }
    return guardedType(
        classDecl,
        () -> {
          DestructorDecl destructor = initializers.addImplicitDestructor(classDecl);
          return destructor != null
              ? SynthesisOutcome.synthesized(ImmutableList.of(destructor))
              : SynthesisOutcome.of(Status.ALREADY_HANDLED);
        });
  }

  private SynthesisOutcome addWitnessAccessors(
      AbstractStorageDecl storage, @Nullable DeclId requirement) {
    checkArgument(
        requirement != null, "witness request for %s has no requirement", storage.name());
    if (storage.isBeingTypeChecked()) {
      return SynthesisOutcome.of(Status.ALREADY_HANDLED);
    }
    AbstractStorageDecl req = arena.get(requirement, AbstractStorageDecl.class);
    return guarded(
        storage,
        () -> {
          ImmutableList<FuncDecl> added =
              materializeForSet.synthesizeWitnessAccessorsForStorage(req, storage, trivial);
          if (added.isEmpty() && storage.getter() != null) {
            return SynthesisOutcome.of(Status.ALREADY_HANDLED);
          }
          return SynthesisOutcome.synthesized(added);
        });
  }

  private SynthesisOutcome convertProtocolRequirement(VarDecl var) {
    checkArgument(
        arena.nominalKindOf(SynthSupport.contextOf(var)) == NominalKind.PROTOCOL,
        "%s is not a protocol requirement",
        var.name());
    if (var.getter() != null || var.isBeingTypeChecked()) {
      return SynthesisOutcome.of(Status.ALREADY_HANDLED);
    }
    return guarded(
        var,
        () -> {
          FuncDecl getter = trivial.convertStoredVarInProtocolToComputed(var);
          return getter != null
              ? SynthesisOutcome.synthesized(ImmutableList.of(getter))
              : SynthesisOutcome.of(Status.NOT_SYNTHESIZED);
        });
  }

  private SynthesisOutcome completeMutableAddressSetter(AbstractStorageDecl storage) {
    if (hasBody(storage.setter()) || storage.isBeingTypeChecked()) {
      return SynthesisOutcome.of(Status.ALREADY_HANDLED);
    }
    return guarded(
        storage,
        () ->
            SynthesisOutcome.synthesized(
                ImmutableList.of(trivial.synthesizeSetterForMutableAddressedStorage(storage))));
  }

  /** Runs {@code action} with {@code storage} marked as being type checked. */
  private SynthesisOutcome guarded(
      AbstractStorageDecl storage, Supplier<SynthesisOutcome> action) {
    storage.setBeingTypeChecked(true);
    try {
      return action.get();
    } finally {
      storage.setBeingTypeChecked(false);
    }
  }

  private SynthesisOutcome guardedType(
      NominalTypeDecl nominal, Supplier<SynthesisOutcome> action) {
    if (!typesInProgress.add(nominal.id())) {
      logger.debug("re-entrant request for {}", nominal.name());
      return SynthesisOutcome.of(Status.ALREADY_HANDLED);
    }
    try {
      return action.get();
    } finally {
      typesInProgress.remove(nominal.id());
    }
  }

  private SynthesisOutcome skip(Decl subject, String reason) {
    logger.debug("no synthesized members for {}: {}", subject, reason);
    return SynthesisOutcome.of(Status.SKIPPED);
  }

  private boolean overrides(NominalTypeDecl classDecl, ConstructorDecl superCtor) {
    for (ConstructorDecl ctor : constructors(classDecl)) {
      if (superCtor.id().equals(ctor.overridden())) {
        return true;
      }
    }
    return false;
  }

  private ImmutableList<ConstructorDecl> constructors(NominalTypeDecl nominal) {
    ImmutableList.Builder<ConstructorDecl> result = ImmutableList.builder();
    for (DeclId member : nominal.members()) {
      Decl decl = arena.getNonNull(member);
      if (decl instanceof ConstructorDecl) {
        result.add((ConstructorDecl) decl);
      }
    }
    return result.build();
  }

  private ImmutableList<FuncDecl> accessors(AbstractStorageDecl storage) {
    ImmutableList.Builder<FuncDecl> result = ImmutableList.builder();
    DeclId getter = storage.getter();
    if (getter != null) {
      result.add(arena.get(getter, FuncDecl.class));
    }
    DeclId setter = storage.setter();
    if (setter != null) {
      result.add(arena.get(setter, FuncDecl.class));
    }
    return result.build();
  }

  private boolean hasBody(@Nullable DeclId function) {
    return function != null && arena.get(function, FuncDecl.class).body() != null;
  }

  private static AbstractStorageDecl storage(Decl subject) {
    checkArgument(subject instanceof AbstractStorageDecl, "%s is not storage", subject);
    return (AbstractStorageDecl) subject;
  }

  private static VarDecl variable(Decl subject) {
    checkArgument(subject instanceof VarDecl, "%s is not a variable", subject);
    return (VarDecl) subject;
  }

  private static NominalTypeDecl nominal(Decl subject) {
    checkArgument(subject instanceof NominalTypeDecl, "%s is not a nominal type", subject);
    return (NominalTypeDecl) subject;
  }
}
