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
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import org.membersynth.binder.env.DeclArena;
import org.membersynth.binder.services.SynthContext;
import org.membersynth.binder.sym.DeclId;
import org.membersynth.decl.ContextDecl;
import org.membersynth.decl.Decl;
import org.membersynth.decl.FuncDecl;
import org.membersynth.decl.VarDecl;
import org.membersynth.model.Accessibility;
import org.membersynth.model.StorageKind;
import org.membersynth.model.SynthFlag;
import org.membersynth.tree.AccessSemantics;
import org.membersynth.tree.Tree;
import org.membersynth.type.Type;
import org.jspecify.annotations.Nullable;

/**
 * Synthesizes lazily initialized variables.
 *
 * <p>A lazy variable becomes computed storage backed by a hidden optional variable. Its getter
 * evaluates the original initializer on first access and caches the result:
 *
 * <pre>{@code
 * get {
 *   let tmp1 = storage
 *   if tmp1 != nil { return tmp1! }
 *   let tmp2: T = <initializer>
 *   storage = tmp2
 *   return tmp2
 * }
 * }</pre>
 *
 * <p>The generated code does not synchronize the first access.
 */
public class LazyProperties {

  private final SynthContext ctx;
  private final DeclArena arena;
  private final SkeletonBuilder skeleton;
  private final StorageReferences refs;
  private final TrivialAccessors trivial;

  public LazyProperties(
      SynthContext ctx,
      SkeletonBuilder skeleton,
      StorageReferences refs,
      TrivialAccessors trivial) {
    this.ctx = ctx;
    this.arena = ctx.arena();
    this.skeleton = skeleton;
    this.refs = refs;
    this.trivial = trivial;
  }

  /**
   * Creates bodiless getter and setter declarations for a lazy variable, turning it into computed
   * storage. The getter is mutating unless the variable is a class member.
   */
  public ImmutableList<FuncDecl> addLazyAccessorShells(VarDecl var) {
    checkArgument(var.hasFlag(SynthFlag.ACC_LAZY), "%s is not lazy", var.name());
    DeclId context = SynthSupport.contextOf(var);
    FuncDecl getter = skeleton.createGetterPrototype(var);
    FuncDecl setter = skeleton.createSetterPrototype(var);
    if (getter == null || setter == null) {
      return ImmutableList.of();
    }
    if (!SynthSupport.isClassOrClassExtension(arena, context)) {
      getter.addFlags(SynthFlag.ACC_MUTATING);
    }
    getter.setAccessibility(var.accessibility());
    var.makeComputed(getter.id(), setter.id());

    ctx.typeResolver().validate(getter);
    ctx.typeResolver().validate(setter);

    SynthSupport.addMemberToContextIfNeeded(ctx, getter, context);
    SynthSupport.addMemberToContextIfNeeded(ctx, setter, context);
    return ImmutableList.of(getter, setter);
  }

  /**
   * Creates the backing storage of a lazy variable whose accessor shells exist, and fills in the
   * accessor bodies. The variable's initializer moves into the getter.
   *
   * @return the backing storage
   */
  public VarDecl completeLazyVarImplementation(VarDecl var) {
    checkArgument(!var.isStatic(), "static variable %s is already lazily initialized", var.name());
    checkState(var.hasFlag(SynthFlag.ACC_LAZY), "%s is not lazy", var.name());
    checkState(
        var.storageKind() == StorageKind.COMPUTED, "variable %s not validated yet", var.name());
    DeclId getterId = var.getter();
    DeclId setterId = var.setter();
    checkState(getterId != null && setterId != null, "%s has no accessors", var.name());
    Tree.Expr init = var.initializer();
    checkState(init != null, "lazy variable %s has no initializer", var.name());

    DeclId context = SynthSupport.contextOf(var);
    VarDecl storage = backingStorage(var);

    FuncDecl getter = arena.get(getterId, FuncDecl.class);
    ctx.typeResolver().validate(getter);
    completeLazyPropertyGetter(var, storage, getter, init);

    FuncDecl setter = arena.get(setterId, FuncDecl.class);
    ctx.typeResolver().validate(setter);
    trivial.synthesizeTrivialSetter(setter, storage, setter.params().get(0));

    // After the accessors are built, so the setter doesn't inherit these from the storage.
    if (SynthSupport.isClassOrClassExtension(arena, context)) {
      storage.addFlags(SynthFlag.ACC_FINAL);
    }
    storage.setAccessibility(Accessibility.PRIVATE);
    storage.setSetterAccessibility(Accessibility.PRIVATE);

    SynthSupport.typeCheckBothPasses(ctx, getter);
    SynthSupport.typeCheckBothPasses(ctx, setter);
    return storage;
  }

  /**
   * Returns the hidden optional storage of a lazy variable, creating it right after the variable
   * if it does not exist yet. The storage starts out empty.
   */
  public VarDecl backingStorage(VarDecl var) {
    checkArgument(var.hasFlag(SynthFlag.ACC_LAZY), "%s is not lazy", var.name());
    DeclId context = SynthSupport.contextOf(var);
    String storageName = var.name() + ctx.options().lazyStorageSuffix();
    Decl owner = arena.getNonNull(context);
    if (owner instanceof ContextDecl) {
      for (DeclId member : ((ContextDecl) owner).members()) {
        Decl decl = arena.getNonNull(member);
        if (decl instanceof VarDecl
            && decl.hasFlag(SynthFlag.ACC_USER_INACCESSIBLE)
            && ((VarDecl) decl).name().equals(storageName)) {
          return (VarDecl) decl;
        }
      }
    }
    Type storageType = Type.OptionalTy.create(var.type());
    VarDecl storage =
        arena.create(
            id ->
                new VarDecl(
                    id, var.position(), context, storageName, StorageKind.STORED, storageType));
    storage.addFlags(SynthFlag.ACC_USER_INACCESSIBLE | SynthFlag.ACC_IMPLICIT);
    storage.setInitializer(new Tree.NilLiteral(var.position()));
    SynthSupport.addMemberToContextIfNeeded(ctx, storage, context, var.id());
    return storage;
  }

  private void completeLazyPropertyGetter(
      VarDecl var, VarDecl storage, FuncDecl getter, Tree.Expr init) {
    int pos = var.position();
    ImmutableList.Builder<Tree> body = ImmutableList.builder();

    VarDecl tmp1 = createTemporary(getter, "tmp1", storage.type());
    Tree.Expr load = refs.createLoad(getter, storage);
    body.add(new Tree.PatternBinding(pos, tmp1.id(), tmp1.name(), null, load));

    Tree.Stmt earlyReturn =
        new Tree.Brace(
            pos,
            ImmutableList.of(new Tree.Return(pos, new Tree.ForceValue(pos, directRef(tmp1)))));
    body.add(new Tree.If(pos, new Tree.HasValue(pos, directRef(tmp1)), earlyReturn, null));

    var.setInitializer(null);
    init.accept(new ClosureRecontextualizer(arena, getter.id()), null);

    VarDecl tmp2 = createTemporary(getter, "tmp2", var.type());
    body.add(new Tree.PatternBinding(init.position(), tmp2.id(), tmp2.name(), var.type(), init));
    body.add(refs.createStore(getter, directRef(tmp2), storage));
    body.add(new Tree.Return(pos, directRef(tmp2)));

    getter.setBody(new Tree.Brace(pos, body.build()));
  }

  private VarDecl createTemporary(FuncDecl owner, String name, Type type) {
    VarDecl tmp =
        arena.create(id -> new VarDecl(id, -1, owner.id(), name, StorageKind.STORED, type));
    tmp.addFlags(SynthFlag.ACC_LET | SynthFlag.ACC_IMPLICIT);
    return tmp;
  }

  private static Tree.Expr directRef(VarDecl local) {
    return new Tree.DeclRef(-1, local.id(), local.name(), AccessSemantics.DIRECT_TO_STORAGE);
  }

  /**
   * Moves the closures of an expression into a new declaration context.
   *
   * <p>Closures are re-parented but not entered, since their contents stay owned by the closure.
   * Capture list variables are re-parented too. Statements are not entered.
   */
  static class ClosureRecontextualizer
      implements Tree.Visitor<@Nullable Void, @Nullable Void> {

    private final DeclArena arena;
    private final DeclId newContext;

    ClosureRecontextualizer(DeclArena arena, DeclId newContext) {
      this.arena = arena;
      this.newContext = newContext;
    }

    private void scan(Tree.@Nullable Expr expr) {
      if (expr != null) {
        expr.accept(this, null);
      }
    }

    @Override
    public @Nullable Void visitClosure(Tree.Closure closure, @Nullable Void input) {
      closure.setParent(newContext);
      return null;
    }

    @Override
    public @Nullable Void visitCaptureList(Tree.CaptureList captureList, @Nullable Void input) {
      for (DeclId capture : captureList.captures()) {
        arena.getNonNull(capture).setParent(newContext);
      }
      scan(captureList.closure());
      return null;
    }

    @Override
    public @Nullable Void visitDeclRef(Tree.DeclRef declRef, @Nullable Void input) {
      return null;
    }

    @Override
    public @Nullable Void visitSuperRef(Tree.SuperRef superRef, @Nullable Void input) {
      return null;
    }

    @Override
    public @Nullable Void visitMemberRef(Tree.MemberRef memberRef, @Nullable Void input) {
      scan(memberRef.base());
      return null;
    }

    @Override
    public @Nullable Void visitSubscript(Tree.Subscript subscript, @Nullable Void input) {
      scan(subscript.base());
      scan(subscript.indices());
      return null;
    }

    @Override
    public @Nullable Void visitTuple(Tree.TupleExpr tuple, @Nullable Void input) {
      for (Tree.Expr element : tuple.elements()) {
        scan(element);
      }
      return null;
    }

    @Override
    public @Nullable Void visitInOut(Tree.InOut inOut, @Nullable Void input) {
      scan(inOut.sub());
      return null;
    }

    @Override
    public @Nullable Void visitCall(Tree.Call call, @Nullable Void input) {
      scan(call.callee());
      scan(call.args());
      return null;
    }

    @Override
    public @Nullable Void visitDotSyntaxCall(
        Tree.DotSyntaxCall dotSyntaxCall, @Nullable Void input) {
      scan(dotSyntaxCall.fn());
      scan(dotSyntaxCall.self());
      return null;
    }

    @Override
    public @Nullable Void visitUnresolvedDot(
        Tree.UnresolvedDot unresolvedDot, @Nullable Void input) {
      scan(unresolvedDot.base());
      return null;
    }

    @Override
    public @Nullable Void visitAssign(Tree.Assign assign, @Nullable Void input) {
      scan(assign.dest());
      scan(assign.src());
      return null;
    }

    @Override
    public @Nullable Void visitStringLiteral(
        Tree.StringLiteral stringLiteral, @Nullable Void input) {
      return null;
    }

    @Override
    public @Nullable Void visitIntLiteral(Tree.IntLiteral intLiteral, @Nullable Void input) {
      return null;
    }

    @Override
    public @Nullable Void visitNilLiteral(Tree.NilLiteral nilLiteral, @Nullable Void input) {
      return null;
    }

    @Override
    public @Nullable Void visitForceValue(Tree.ForceValue forceValue, @Nullable Void input) {
      scan(forceValue.sub());
      return null;
    }

    @Override
    public @Nullable Void visitBindOptional(
        Tree.BindOptional bindOptional, @Nullable Void input) {
      scan(bindOptional.sub());
      return null;
    }

    @Override
    public @Nullable Void visitOptionalEvaluation(
        Tree.OptionalEvaluation optionalEvaluation, @Nullable Void input) {
      scan(optionalEvaluation.sub());
      return null;
    }

    @Override
    public @Nullable Void visitCheckedCast(Tree.CheckedCast checkedCast, @Nullable Void input) {
      scan(checkedCast.sub());
      return null;
    }

    @Override
    public @Nullable Void visitHasValue(Tree.HasValue hasValue, @Nullable Void input) {
      scan(hasValue.sub());
      return null;
    }

    @Override
    public @Nullable Void visitTry(Tree.Try tryExpr, @Nullable Void input) {
      scan(tryExpr.sub());
      return null;
    }

    @Override
    public @Nullable Void visitBrace(Tree.Brace brace, @Nullable Void input) {
      return null;
    }

    @Override
    public @Nullable Void visitReturn(Tree.Return ret, @Nullable Void input) {
      return null;
    }

    @Override
    public @Nullable Void visitIf(Tree.If ifStmt, @Nullable Void input) {
      return null;
    }

    @Override
    public @Nullable Void visitPatternBinding(
        Tree.PatternBinding patternBinding, @Nullable Void input) {
      return null;
    }
  }
}
