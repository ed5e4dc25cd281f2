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

package org.membersynth.tree;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import org.membersynth.binder.sym.DeclId;
import org.membersynth.type.Type;
import org.jspecify.annotations.Nullable;

/** A body node: an expression or a statement of a function body. */
public abstract class Tree {

  public abstract Kind kind();

  public abstract <I extends @Nullable Object, O extends @Nullable Object> O accept(
      Visitor<I, O> visitor, I input);

  private final int position;

  protected Tree(int position) {
    this.position = position;
  }

  public int position() {
    return position;
  }

  @Override
  public String toString() {
    return Pretty.pretty(this);
  }

  /** Tree kind. */
  public enum Kind {
    DECL_REF,
    SUPER_REF,
    MEMBER_REF,
    SUBSCRIPT,
    TUPLE,
    INOUT,
    CALL,
    DOT_SYNTAX_CALL,
    UNRESOLVED_DOT,
    ASSIGN,
    STRING_LITERAL,
    INT_LITERAL,
    NIL_LITERAL,
    FORCE_VALUE,
    BIND_OPTIONAL,
    OPTIONAL_EVALUATION,
    CHECKED_CAST,
    HAS_VALUE,
    TRY,
    CLOSURE,
    CAPTURE_LIST,
    BRACE,
    RETURN,
    IF,
    PATTERN_BINDING
  }

  /** An expression. */
  public abstract static class Expr extends Tree {
    protected Expr(int position) {
      super(position);
    }
  }

  /** A statement. */
  public abstract static class Stmt extends Tree {
    protected Stmt(int position) {
      super(position);
    }
  }

  /** A reference to a declaration by identity. */
  public static class DeclRef extends Expr {
    private final DeclId decl;
    private final String name;
    private final AccessSemantics semantics;

    public DeclRef(int position, DeclId decl, String name, AccessSemantics semantics) {
      super(position);
      this.decl = decl;
      this.name = name;
      this.semantics = semantics;
    }

    @Override
    public Kind kind() {
      return Kind.DECL_REF;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitDeclRef(this, input);
    }

    public DeclId decl() {
      return decl;
    }

    public String name() {
      return name;
    }

    public AccessSemantics semantics() {
      return semantics;
    }
  }

  /** The implicit self parameter, viewed as an instance of the superclass. */
  public static class SuperRef extends Expr {
    private final DeclId self;

    public SuperRef(int position, DeclId self) {
      super(position);
      this.self = self;
    }

    @Override
    public Kind kind() {
      return Kind.SUPER_REF;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitSuperRef(this, input);
    }

    /** The self parameter being re-typed as the superclass. */
    public DeclId self() {
      return self;
    }
  }

  /** A reference to a member of a base expression. */
  public static class MemberRef extends Expr {
    private final Expr base;
    private final DeclId member;
    private final String name;
    private final AccessSemantics semantics;

    public MemberRef(
        int position, Expr base, DeclId member, String name, AccessSemantics semantics) {
      super(position);
      this.base = base;
      this.member = member;
      this.name = name;
      this.semantics = semantics;
    }

    @Override
    public Kind kind() {
      return Kind.MEMBER_REF;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitMemberRef(this, input);
    }

    public Expr base() {
      return base;
    }

    public DeclId member() {
      return member;
    }

    public String name() {
      return name;
    }

    public AccessSemantics semantics() {
      return semantics;
    }
  }

  /** A subscript access with forwarded index arguments. */
  public static class Subscript extends Expr {
    private final Expr base;
    private final TupleExpr indices;
    private final DeclId subscript;
    private final AccessSemantics semantics;

    public Subscript(
        int position, Expr base, TupleExpr indices, DeclId subscript, AccessSemantics semantics) {
      super(position);
      this.base = base;
      this.indices = indices;
      this.subscript = subscript;
      this.semantics = semantics;
    }

    @Override
    public Kind kind() {
      return Kind.SUBSCRIPT;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitSubscript(this, input);
    }

    public Expr base() {
      return base;
    }

    public TupleExpr indices() {
      return indices;
    }

    public DeclId subscript() {
      return subscript;
    }

    public AccessSemantics semantics() {
      return semantics;
    }
  }

  /** A possibly labeled argument tuple. */
  public static class TupleExpr extends Expr {
    private final ImmutableList<Expr> elements;
    private final ImmutableList<String> labels;

    public TupleExpr(int position, ImmutableList<Expr> elements, ImmutableList<String> labels) {
      super(position);
      checkArgument(elements.size() == labels.size(), "%s != %s", elements, labels);
      this.elements = elements;
      this.labels = labels;
    }

    /** Creates an unlabeled tuple. */
    public static TupleExpr unlabeled(int position, ImmutableList<Expr> elements) {
      ImmutableList.Builder<String> labels = ImmutableList.builder();
      for (int i = 0; i < elements.size(); i++) {
        labels.add("");
      }
      return new TupleExpr(position, elements, labels.build());
    }

    @Override
    public Kind kind() {
      return Kind.TUPLE;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitTuple(this, input);
    }

    public ImmutableList<Expr> elements() {
      return elements;
    }

    /** The element labels; unlabeled elements have an empty label. */
    public ImmutableList<String> labels() {
      return labels;
    }
  }

  /** An argument passed in/out. */
  public static class InOut extends Expr {
    private final Expr sub;

    public InOut(int position, Expr sub) {
      super(position);
      this.sub = sub;
    }

    @Override
    public Kind kind() {
      return Kind.INOUT;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitInOut(this, input);
    }

    public Expr sub() {
      return sub;
    }
  }

  /** A call. */
  public static class Call extends Expr {
    private final Expr callee;
    private final TupleExpr args;

    public Call(int position, Expr callee, TupleExpr args) {
      super(position);
      this.callee = callee;
      this.args = args;
    }

    @Override
    public Kind kind() {
      return Kind.CALL;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitCall(this, input);
    }

    public Expr callee() {
      return callee;
    }

    public TupleExpr args() {
      return args;
    }
  }

  /** A method reference bound to a self argument. */
  public static class DotSyntaxCall extends Expr {
    private final Expr fn;
    private final Expr self;

    public DotSyntaxCall(int position, Expr fn, Expr self) {
      super(position);
      this.fn = fn;
      this.self = self;
    }

    @Override
    public Kind kind() {
      return Kind.DOT_SYNTAX_CALL;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitDotSyntaxCall(this, input);
    }

    public Expr fn() {
      return fn;
    }

    public Expr self() {
      return self;
    }
  }

  /** A member access to be resolved by the type checker. */
  public static class UnresolvedDot extends Expr {
    private final Expr base;
    private final String name;

    public UnresolvedDot(int position, Expr base, String name) {
      super(position);
      this.base = base;
      this.name = name;
    }

    @Override
    public Kind kind() {
      return Kind.UNRESOLVED_DOT;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitUnresolvedDot(this, input);
    }

    public Expr base() {
      return base;
    }

    public String name() {
      return name;
    }
  }

  /** An assignment. */
  public static class Assign extends Expr {
    private final Expr dest;
    private final Expr src;

    public Assign(int position, Expr dest, Expr src) {
      super(position);
      this.dest = dest;
      this.src = src;
    }

    @Override
    public Kind kind() {
      return Kind.ASSIGN;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitAssign(this, input);
    }

    public Expr dest() {
      return dest;
    }

    public Expr src() {
      return src;
    }
  }

  /** A string literal. */
  public static class StringLiteral extends Expr {
    private final String value;

    public StringLiteral(int position, String value) {
      super(position);
      this.value = value;
    }

    @Override
    public Kind kind() {
      return Kind.STRING_LITERAL;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitStringLiteral(this, input);
    }

    public String value() {
      return value;
    }
  }

  /** An integer literal. */
  public static class IntLiteral extends Expr {
    private final long value;

    public IntLiteral(int position, long value) {
      super(position);
      this.value = value;
    }

    @Override
    public Kind kind() {
      return Kind.INT_LITERAL;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitIntLiteral(this, input);
    }

    public long value() {
      return value;
    }
  }

  /** The empty optional value. */
  public static class NilLiteral extends Expr {
    public NilLiteral(int position) {
      super(position);
    }

    @Override
    public Kind kind() {
      return Kind.NIL_LITERAL;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitNilLiteral(this, input);
    }
  }

  /** Unwraps an optional, trapping if it is empty. */
  public static class ForceValue extends Expr {
    private final Expr sub;

    public ForceValue(int position, Expr sub) {
      super(position);
      this.sub = sub;
    }

    @Override
    public Kind kind() {
      return Kind.FORCE_VALUE;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitForceValue(this, input);
    }

    public Expr sub() {
      return sub;
    }
  }

  /**
   * Unwraps an optional, short-circuiting the nearest enclosing {@link OptionalEvaluation} if it
   * is empty.
   */
  public static class BindOptional extends Expr {
    private final Expr sub;

    public BindOptional(int position, Expr sub) {
      super(position);
      this.sub = sub;
    }

    @Override
    public Kind kind() {
      return Kind.BIND_OPTIONAL;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitBindOptional(this, input);
    }

    public Expr sub() {
      return sub;
    }
  }

  /** The scope of {@link BindOptional} short-circuiting. */
  public static class OptionalEvaluation extends Expr {
    private final Expr sub;

    public OptionalEvaluation(int position, Expr sub) {
      super(position);
      this.sub = sub;
    }

    @Override
    public Kind kind() {
      return Kind.OPTIONAL_EVALUATION;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitOptionalEvaluation(this, input);
    }

    public Expr sub() {
      return sub;
    }
  }

  /** A checked downcast, either forced or conditional. */
  public static class CheckedCast extends Expr {
    private final Expr sub;
    private final Type type;
    private final boolean conditional;

    public CheckedCast(int position, Expr sub, Type type, boolean conditional) {
      super(position);
      this.sub = sub;
      this.type = type;
      this.conditional = conditional;
    }

    @Override
    public Kind kind() {
      return Kind.CHECKED_CAST;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitCheckedCast(this, input);
    }

    public Expr sub() {
      return sub;
    }

    public Type type() {
      return type;
    }

    public boolean conditional() {
      return conditional;
    }
  }

  /** Tests whether an optional holds a value. */
  public static class HasValue extends Expr {
    private final Expr sub;

    public HasValue(int position, Expr sub) {
      super(position);
      this.sub = sub;
    }

    @Override
    public Kind kind() {
      return Kind.HAS_VALUE;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitHasValue(this, input);
    }

    public Expr sub() {
      return sub;
    }
  }

  /** Propagates a failure raised by the sub-expression to the enclosing function's caller. */
  public static class Try extends Expr {
    private final Expr sub;

    public Try(int position, Expr sub) {
      super(position);
      this.sub = sub;
    }

    @Override
    public Kind kind() {
      return Kind.TRY;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitTry(this, input);
    }

    public Expr sub() {
      return sub;
    }
  }

  /**
   * A closure expression.
   *
   * <p>A closure is a declaration context of its own: locals it declares and values it captures
   * are owned by it, and it is owned by the declaration it is lexically nested in. The owner is
   * mutable because synthesis may move an expression into a different function.
   */
  public static class Closure extends Expr {
    private DeclId parent;
    private final Expr body;

    public Closure(int position, DeclId parent, Expr body) {
      super(position);
      this.parent = parent;
      this.body = body;
    }

    @Override
    public Kind kind() {
      return Kind.CLOSURE;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitClosure(this, input);
    }

    /** The declaration context the closure is nested in. */
    public DeclId parent() {
      return parent;
    }

    public void setParent(DeclId parent) {
      this.parent = parent;
    }

    public Expr body() {
      return body;
    }
  }

  /** A closure together with the variables it captures by value. */
  public static class CaptureList extends Expr {
    private final ImmutableList<DeclId> captures;
    private final Closure closure;

    public CaptureList(int position, ImmutableList<DeclId> captures, Closure closure) {
      super(position);
      this.captures = captures;
      this.closure = closure;
    }

    @Override
    public Kind kind() {
      return Kind.CAPTURE_LIST;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitCaptureList(this, input);
    }

    /** The capture variables, each initialized by its own initializer expression. */
    public ImmutableList<DeclId> captures() {
      return captures;
    }

    public Closure closure() {
      return closure;
    }
  }

  /** A braced statement list. */
  public static class Brace extends Stmt {
    private final ImmutableList<Tree> elements;

    public Brace(int position, ImmutableList<Tree> elements) {
      super(position);
      this.elements = elements;
    }

    @Override
    public Kind kind() {
      return Kind.BRACE;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitBrace(this, input);
    }

    /** Statements and expressions, in evaluation order. */
    public ImmutableList<Tree> elements() {
      return elements;
    }
  }

  /** A return statement. */
  public static class Return extends Stmt {
    private final @Nullable Expr result;

    public Return(int position, @Nullable Expr result) {
      super(position);
      this.result = result;
    }

    @Override
    public Kind kind() {
      return Kind.RETURN;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitReturn(this, input);
    }

    public @Nullable Expr result() {
      return result;
    }
  }

  /** An if statement. */
  public static class If extends Stmt {
    private final Expr cond;
    private final Stmt then;
    private final @Nullable Stmt otherwise;

    public If(int position, Expr cond, Stmt then, @Nullable Stmt otherwise) {
      super(position);
      this.cond = cond;
      this.then = then;
      this.otherwise = otherwise;
    }

    @Override
    public Kind kind() {
      return Kind.IF;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitIf(this, input);
    }

    public Expr cond() {
      return cond;
    }

    public Stmt then() {
      return then;
    }

    public @Nullable Stmt otherwise() {
      return otherwise;
    }
  }

  /** Binds a local variable to the value of an expression. */
  public static class PatternBinding extends Stmt {
    private final DeclId var;
    private final String name;
    private final @Nullable Type annotatedType;
    private final Expr init;

    public PatternBinding(
        int position, DeclId var, String name, @Nullable Type annotatedType, Expr init) {
      super(position);
      this.var = var;
      this.name = name;
      this.annotatedType = annotatedType;
      this.init = init;
    }

    @Override
    public Kind kind() {
      return Kind.PATTERN_BINDING;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitPatternBinding(this, input);
    }

    public DeclId var() {
      return var;
    }

    public String name() {
      return name;
    }

    /** The explicit type of the binding, if any. */
    public @Nullable Type annotatedType() {
      return annotatedType;
    }

    public Expr init() {
      return init;
    }
  }

  /** A visitor for {@link Tree}s. */
  public interface Visitor<I extends @Nullable Object, O extends @Nullable Object> {
    O visitDeclRef(DeclRef declRef, I input);

    O visitSuperRef(SuperRef superRef, I input);

    O visitMemberRef(MemberRef memberRef, I input);

    O visitSubscript(Subscript subscript, I input);

    O visitTuple(TupleExpr tuple, I input);

    O visitInOut(InOut inOut, I input);

    O visitCall(Call call, I input);

    O visitDotSyntaxCall(DotSyntaxCall dotSyntaxCall, I input);

    O visitUnresolvedDot(UnresolvedDot unresolvedDot, I input);

    O visitAssign(Assign assign, I input);

    O visitStringLiteral(StringLiteral stringLiteral, I input);

    O visitIntLiteral(IntLiteral intLiteral, I input);

    O visitNilLiteral(NilLiteral nilLiteral, I input);

    O visitForceValue(ForceValue forceValue, I input);

    O visitBindOptional(BindOptional bindOptional, I input);

    O visitOptionalEvaluation(OptionalEvaluation optionalEvaluation, I input);

    O visitCheckedCast(CheckedCast checkedCast, I input);

    O visitHasValue(HasValue hasValue, I input);

    O visitTry(Try tryExpr, I input);

    O visitClosure(Closure closure, I input);

    O visitCaptureList(CaptureList captureList, I input);

    O visitBrace(Brace brace, I input);

    O visitReturn(Return ret, I input);

    O visitIf(If ifStmt, I input);

    O visitPatternBinding(PatternBinding patternBinding, I input);
  }
}
