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

import com.google.common.collect.HashMultiset;
import com.google.common.collect.Multiset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.membersynth.binder.env.DeclArena;
import org.membersynth.binder.sym.DeclId;
import org.membersynth.decl.ConstructorDecl;
import org.membersynth.decl.Decl;
import org.membersynth.decl.FuncDecl;
import org.membersynth.decl.NominalTypeDecl;
import org.membersynth.decl.VarDecl;
import org.membersynth.tree.Tree;
import org.jspecify.annotations.Nullable;

/**
 * Runs synthesized bodies over a toy object model, so tests can observe what the code does rather
 * than how it is spelled.
 *
 * <p>Instances are maps from storage declarations to values. Optionals are represented by their
 * payload, or {@link #NIL}. Functions without bodies are looked up in {@link #functions}.
 */
class TreeEvaluator implements Tree.Visitor<Map<DeclId, Object>, @Nullable Object> {

  static final Object NIL =
      new Object() {
        @Override
        public String toString() {
          return "nil";
        }
      };

  /** An object instance. */
  static class Instance {
    final Map<DeclId, Object> fields = new LinkedHashMap<>();
  }

  private static class Returned {
    final @Nullable Object value;

    Returned(@Nullable Object value) {
      this.value = value;
    }
  }

  private final DeclArena arena;
  final Map<DeclId, Function<List<Object>, Object>> functions = new HashMap<>();
  final Map<DeclId, Object> globals = new HashMap<>();

  /** Number of times each storage declaration was read. */
  final Multiset<DeclId> reads = HashMultiset.create();

  TreeEvaluator(DeclArena arena) {
    this.arena = arena;
  }

  /** Creates an instance whose stored fields hold their initial values. */
  Instance newInstance(NominalTypeDecl nominal) {
    Instance instance = new Instance();
    for (DeclId member : nominal.members()) {
      Decl decl = arena.getNonNull(member);
      if (!(decl instanceof VarDecl)) {
        continue;
      }
      VarDecl var = (VarDecl) decl;
      if (var.isStatic() || !var.storageKind().hasStorage()) {
        continue;
      }
      Tree.Expr init = var.initializer();
      instance.fields.put(var.id(), init != null ? init.accept(this, new HashMap<>()) : NIL);
    }
    return instance;
  }

  @Nullable Object call(FuncDecl fn, @Nullable Object self, Object... args) {
    Tree.Brace body = fn.body();
    checkState(body != null, "%s has no body", fn.name());
    return run(body, fn.selfParam(), fn.params(), self, args);
  }

  /** Runs an initializer over an existing instance. */
  void initialize(ConstructorDecl ctor, Instance self, Object... args) {
    Tree.Brace body = ctor.body();
    checkState(body != null, "initializer has no body");
    run(body, ctor.selfParam(), ctor.params(), self, args);
  }

  private @Nullable Object run(
      Tree.Brace body,
      @Nullable DeclId selfParam,
      List<DeclId> params,
      @Nullable Object self,
      Object... args) {
    Map<DeclId, Object> frame = new HashMap<>();
    if (selfParam != null && self != null) {
      frame.put(selfParam, self);
    }
    for (int i = 0; i < args.length; i++) {
      frame.put(params.get(i), args[i]);
    }
    Object result = body.accept(this, frame);
    return result instanceof Returned ? ((Returned) result).value : null;
  }

  private Object eval(Tree.Expr expr, Map<DeclId, Object> frame) {
    Object value = expr.accept(this, frame);
    checkState(value != null, "%s has no value", expr);
    return value;
  }

  private List<Object> evalArgs(Tree.TupleExpr args, Map<DeclId, Object> frame) {
    List<Object> values = new ArrayList<>();
    for (Tree.Expr arg : args.elements()) {
      values.add(eval(arg, frame));
    }
    return values;
  }

  private Instance instance(Tree.Expr base, Map<DeclId, Object> frame) {
    Object value = eval(base, frame);
    checkState(value instanceof Instance, "%s is not an instance", base);
    return (Instance) value;
  }

  @Override
  public Object visitDeclRef(Tree.DeclRef declRef, Map<DeclId, Object> frame) {
    if (frame.containsKey(declRef.decl())) {
      return frame.get(declRef.decl());
    }
    checkState(globals.containsKey(declRef.decl()), "unbound %s", declRef.name());
    reads.add(declRef.decl());
    return globals.get(declRef.decl());
  }

  @Override
  public Object visitSuperRef(Tree.SuperRef superRef, Map<DeclId, Object> frame) {
    return frame.get(superRef.self());
  }

  @Override
  public Object visitMemberRef(Tree.MemberRef memberRef, Map<DeclId, Object> frame) {
    Instance instance = instance(memberRef.base(), frame);
    checkState(instance.fields.containsKey(memberRef.member()), "no field %s", memberRef.name());
    reads.add(memberRef.member());
    return instance.fields.get(memberRef.member());
  }

  @Override
  public @Nullable Object visitAssign(Tree.Assign assign, Map<DeclId, Object> frame) {
    Object value = eval(assign.src(), frame);
    Tree.Expr dest = assign.dest();
    switch (dest.kind()) {
      case MEMBER_REF:
        Tree.MemberRef member = (Tree.MemberRef) dest;
        instance(member.base(), frame).fields.put(member.member(), value);
        return null;
      case DECL_REF:
        DeclId target = ((Tree.DeclRef) dest).decl();
        if (frame.containsKey(target)) {
          frame.put(target, value);
        } else {
          globals.put(target, value);
        }
        return null;
      default:
        throw new UnsupportedOperationException(dest.kind().toString());
    }
  }

  @Override
  public Object visitCall(Tree.Call call, Map<DeclId, Object> frame) {
    Tree.Expr callee = call.callee();
    if (callee instanceof Tree.DotSyntaxCall) {
      callee = ((Tree.DotSyntaxCall) callee).fn();
    }
    checkState(callee instanceof Tree.DeclRef, "cannot call %s", callee);
    DeclId fn = ((Tree.DeclRef) callee).decl();
    Function<List<Object>, Object> impl = functions.get(fn);
    checkState(impl != null, "no implementation of %s", callee);
    return impl.apply(evalArgs(call.args(), frame));
  }

  @Override
  public Object visitIntLiteral(Tree.IntLiteral intLiteral, Map<DeclId, Object> frame) {
    return intLiteral.value();
  }

  @Override
  public Object visitStringLiteral(Tree.StringLiteral stringLiteral, Map<DeclId, Object> frame) {
    return stringLiteral.value();
  }

  @Override
  public Object visitNilLiteral(Tree.NilLiteral nilLiteral, Map<DeclId, Object> frame) {
    return NIL;
  }

  @Override
  public Object visitHasValue(Tree.HasValue hasValue, Map<DeclId, Object> frame) {
    return eval(hasValue.sub(), frame) != NIL;
  }

  @Override
  public Object visitForceValue(Tree.ForceValue forceValue, Map<DeclId, Object> frame) {
    Object value = eval(forceValue.sub(), frame);
    checkState(value != NIL, "force unwrapped nil");
    return value;
  }

  @Override
  public Object visitTry(Tree.Try tryExpr, Map<DeclId, Object> frame) {
    return eval(tryExpr.sub(), frame);
  }

  @Override
  public @Nullable Object visitBrace(Tree.Brace brace, Map<DeclId, Object> frame) {
    for (Tree element : brace.elements()) {
      Object result = element.accept(this, frame);
      if (result instanceof Returned) {
        return result;
      }
    }
    return null;
  }

  @Override
  public Object visitReturn(Tree.Return ret, Map<DeclId, Object> frame) {
    Tree.Expr result = ret.result();
    return new Returned(result != null ? eval(result, frame) : null);
  }

  @Override
  public @Nullable Object visitIf(Tree.If ifStmt, Map<DeclId, Object> frame) {
    if (Boolean.TRUE.equals(eval(ifStmt.cond(), frame))) {
      return ifStmt.then().accept(this, frame);
    }
    Tree.Stmt otherwise = ifStmt.otherwise();
    return otherwise != null ? otherwise.accept(this, frame) : null;
  }

  @Override
  public @Nullable Object visitPatternBinding(
      Tree.PatternBinding patternBinding, Map<DeclId, Object> frame) {
    frame.put(patternBinding.var(), eval(patternBinding.init(), frame));
    return null;
  }

  @Override
  public Object visitSubscript(Tree.Subscript subscript, Map<DeclId, Object> frame) {
    throw new UnsupportedOperationException("subscript");
  }

  @Override
  public Object visitTuple(Tree.TupleExpr tuple, Map<DeclId, Object> frame) {
    throw new UnsupportedOperationException("tuple");
  }

  @Override
  public Object visitInOut(Tree.InOut inOut, Map<DeclId, Object> frame) {
    return eval(inOut.sub(), frame);
  }

  @Override
  public Object visitDotSyntaxCall(Tree.DotSyntaxCall dotSyntaxCall, Map<DeclId, Object> frame) {
    throw new UnsupportedOperationException("unapplied method reference");
  }

  @Override
  public Object visitUnresolvedDot(Tree.UnresolvedDot unresolvedDot, Map<DeclId, Object> frame) {
    throw new UnsupportedOperationException("unresolved member " + unresolvedDot.name());
  }

  @Override
  public Object visitBindOptional(Tree.BindOptional bindOptional, Map<DeclId, Object> frame) {
    throw new UnsupportedOperationException("optional chaining");
  }

  @Override
  public Object visitOptionalEvaluation(
      Tree.OptionalEvaluation optionalEvaluation, Map<DeclId, Object> frame) {
    throw new UnsupportedOperationException("optional chaining");
  }

  @Override
  public Object visitCheckedCast(Tree.CheckedCast checkedCast, Map<DeclId, Object> frame) {
    return eval(checkedCast.sub(), frame);
  }

  @Override
  public Object visitClosure(Tree.Closure closure, Map<DeclId, Object> frame) {
    throw new UnsupportedOperationException("closure");
  }

  @Override
  public Object visitCaptureList(Tree.CaptureList captureList, Map<DeclId, Object> frame) {
    throw new UnsupportedOperationException("closure");
  }
}
