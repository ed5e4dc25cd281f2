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
import org.membersynth.decl.FuncDecl;
import org.membersynth.decl.ParamDecl;
import org.membersynth.decl.VarDecl;
import org.membersynth.model.StorageKind;
import org.membersynth.model.SynthFlag;
import org.membersynth.tree.AccessSemantics;
import org.membersynth.tree.Tree;
import org.jspecify.annotations.Nullable;

/**
 * Synthesizes the getter and setter of a variable with {@code willSet} and/or {@code didSet}
 * hooks.
 *
 * <p>The setter reads the old value when there is a {@code didSet}, calls {@code willSet} with the
 * new value, stores it, then calls {@code didSet} with the old value.
 */
public class ObservingAccessors {

  private final SynthContext ctx;
  private final DeclArena arena;
  private final StorageReferences refs;
  private final TrivialAccessors trivial;

  public ObservingAccessors(SynthContext ctx, StorageReferences refs, TrivialAccessors trivial) {
    this.ctx = ctx;
    this.arena = ctx.arena();
    this.refs = refs;
    this.trivial = trivial;
  }

  public void synthesizeObservingAccessors(VarDecl var) {
    checkState(var.hasObservers(), "%s has no observers", var.name());
    DeclId getterId = var.getter();
    DeclId setterId = var.setter();
    checkState(
        getterId != null && setterId != null,
        "%s is missing its accessor declarations",
        var.name());
    FuncDecl getter = arena.get(getterId, FuncDecl.class);
    FuncDecl setter = arena.get(setterId, FuncDecl.class);
    checkState(
        getter.body() == null && setter.body() == null,
        "willSet/didSet variable %s already has a getter or setter body",
        var.name());

    trivial.synthesizeTrivialGetter(getter, var);

    int pos = var.position();
    DeclId self = setter.selfParam();
    DeclId valueParam = setter.params().get(0);
    String valueName = arena.get(valueParam, ParamDecl.class).name();
    boolean inClass = SynthSupport.isClassOrClassExtension(arena, SynthSupport.contextOf(var));
    ImmutableList.Builder<Tree> body = ImmutableList.builder();

    DeclId didSet = var.didSet();
    VarDecl oldValue = null;
    if (didSet != null) {
      Tree.Expr oldValueExpr = refs.createLoad(setter, var);
      oldValue = createTemporary(setter, "tmp", var);
      body.add(new Tree.PatternBinding(pos, oldValue.id(), oldValue.name(), null, oldValueExpr));
    }

    DeclId willSet = var.willSet();
    if (willSet != null) {
      Tree.Expr newValue = new Tree.DeclRef(-1, valueParam, valueName, AccessSemantics.ORDINARY);
      body.add(callHook(pos, willSet, self, newValue));
      if (inClass) {
        arena.getNonNull(willSet).addFlags(SynthFlag.ACC_FINAL);
      }
    }

    Tree.Expr value = new Tree.DeclRef(-1, valueParam, valueName, AccessSemantics.ORDINARY);
    body.add(refs.createStore(setter, value, var));

    if (didSet != null && oldValue != null) {
      Tree.Expr old =
          new Tree.DeclRef(-1, oldValue.id(), oldValue.name(), AccessSemantics.DIRECT_TO_STORAGE);
      body.add(callHook(pos, didSet, self, old));
      if (inClass) {
        arena.getNonNull(didSet).addFlags(SynthFlag.ACC_FINAL);
      }
    }

    setter.setBody(new Tree.Brace(pos, body.build()));

    SynthSupport.typeCheckBothPasses(ctx, getter);
    SynthSupport.typeCheckBothPasses(ctx, setter);
  }

  /** Calls {@code self.hook(arg)}, or {@code hook(arg)} outside type contexts. */
  private Tree.Expr callHook(int pos, DeclId hook, @Nullable DeclId self, Tree.Expr arg) {
    FuncDecl hookDecl = arena.get(hook, FuncDecl.class);
    Tree.Expr callee = new Tree.DeclRef(pos, hook, hookDecl.name(), AccessSemantics.ORDINARY);
    if (self != null) {
      Tree.Expr selfRef = new Tree.DeclRef(-1, self, "self", AccessSemantics.ORDINARY);
      callee = new Tree.DotSyntaxCall(pos, callee, selfRef);
    }
    return new Tree.Call(pos, callee, Tree.TupleExpr.unlabeled(pos, ImmutableList.of(arg)));
  }

  private VarDecl createTemporary(FuncDecl owner, String name, VarDecl like) {
    VarDecl tmp =
        arena.create(
            id -> new VarDecl(id, -1, owner.id(), name, StorageKind.STORED, like.type()));
    tmp.addFlags(SynthFlag.ACC_LET | SynthFlag.ACC_IMPLICIT);
    return tmp;
  }
}
