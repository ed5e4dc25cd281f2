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

import com.google.common.base.Joiner;
import com.google.common.base.Strings;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import org.jspecify.annotations.Nullable;

/** A pretty-printer for synthesized bodies. */
public class Pretty implements Tree.Visitor<@Nullable Void, @Nullable Void> {

  public static String pretty(Tree tree) {
    Pretty pretty = new Pretty();
    tree.accept(pretty, null);
    return pretty.sb.toString();
  }

  private final StringBuilder sb = new StringBuilder();
  int indent = 0;
  boolean newLine = false;

  void printLine() {
    append('\n');
    newLine = true;
  }

  @CanIgnoreReturnValue
  Pretty append(char c) {
    if (c == '\n') {
      newLine = true;
    } else if (newLine) {
      sb.append(Strings.repeat(" ", indent * 2));
      newLine = false;
    }
    sb.append(c);
    return this;
  }

  @CanIgnoreReturnValue
  Pretty append(String s) {
    if (newLine) {
      sb.append(Strings.repeat(" ", indent * 2));
      newLine = false;
    }
    sb.append(s);
    return this;
  }

  @Override
  public @Nullable Void visitDeclRef(Tree.DeclRef declRef, @Nullable Void input) {
    append(declRef.name());
    return null;
  }

  @Override
  public @Nullable Void visitSuperRef(Tree.SuperRef superRef, @Nullable Void input) {
    append("super");
    return null;
  }

  @Override
  public @Nullable Void visitMemberRef(Tree.MemberRef memberRef, @Nullable Void input) {
    memberRef.base().accept(this, null);
    append('.').append(memberRef.name());
    return null;
  }

  @Override
  public @Nullable Void visitSubscript(Tree.Subscript subscript, @Nullable Void input) {
    subscript.base().accept(this, null);
    append('[');
    printElements(subscript.indices());
    append(']');
    return null;
  }

  @Override
  public @Nullable Void visitTuple(Tree.TupleExpr tuple, @Nullable Void input) {
    append('(');
    printElements(tuple);
    append(')');
    return null;
  }

  private void printElements(Tree.TupleExpr tuple) {
    boolean first = true;
    for (int i = 0; i < tuple.elements().size(); i++) {
      if (!first) {
        append(", ");
      }
      String label = tuple.labels().get(i);
      if (!label.isEmpty()) {
        append(label).append(": ");
      }
      tuple.elements().get(i).accept(this, null);
      first = false;
    }
  }

  @Override
  public @Nullable Void visitInOut(Tree.InOut inOut, @Nullable Void input) {
    append('&');
    inOut.sub().accept(this, null);
    return null;
  }

  @Override
  public @Nullable Void visitCall(Tree.Call call, @Nullable Void input) {
    call.callee().accept(this, null);
    call.args().accept(this, null);
    return null;
  }

  @Override
  public @Nullable Void visitDotSyntaxCall(
      Tree.DotSyntaxCall dotSyntaxCall, @Nullable Void input) {
    dotSyntaxCall.self().accept(this, null);
    append('.');
    dotSyntaxCall.fn().accept(this, null);
    return null;
  }

  @Override
  public @Nullable Void visitUnresolvedDot(
      Tree.UnresolvedDot unresolvedDot, @Nullable Void input) {
    unresolvedDot.base().accept(this, null);
    append('.').append(unresolvedDot.name());
    return null;
  }

  @Override
  public @Nullable Void visitAssign(Tree.Assign assign, @Nullable Void input) {
    assign.dest().accept(this, null);
    append(" = ");
    assign.src().accept(this, null);
    return null;
  }

  @Override
  public @Nullable Void visitStringLiteral(
      Tree.StringLiteral stringLiteral, @Nullable Void input) {
    append('"').append(stringLiteral.value()).append('"');
    return null;
  }

  @Override
  public @Nullable Void visitIntLiteral(Tree.IntLiteral intLiteral, @Nullable Void input) {
    append(String.valueOf(intLiteral.value()));
    return null;
  }

  @Override
  public @Nullable Void visitNilLiteral(Tree.NilLiteral nilLiteral, @Nullable Void input) {
    append("nil");
    return null;
  }

  @Override
  public @Nullable Void visitForceValue(Tree.ForceValue forceValue, @Nullable Void input) {
    forceValue.sub().accept(this, null);
    append('!');
    return null;
  }

  @Override
  public @Nullable Void visitBindOptional(Tree.BindOptional bindOptional, @Nullable Void input) {
    bindOptional.sub().accept(this, null);
    append('?');
    return null;
  }

  @Override
  public @Nullable Void visitOptionalEvaluation(
      Tree.OptionalEvaluation optionalEvaluation, @Nullable Void input) {
    optionalEvaluation.sub().accept(this, null);
    return null;
  }

  @Override
  public @Nullable Void visitCheckedCast(Tree.CheckedCast checkedCast, @Nullable Void input) {
    append('(');
    checkedCast.sub().accept(this, null);
    append(checkedCast.conditional() ? " as? " : " as! ");
    append(checkedCast.type().toString());
    append(')');
    return null;
  }

  @Override
  public @Nullable Void visitHasValue(Tree.HasValue hasValue, @Nullable Void input) {
    hasValue.sub().accept(this, null);
    append(" != nil");
    return null;
  }

  @Override
  public @Nullable Void visitTry(Tree.Try tryExpr, @Nullable Void input) {
    append("try ");
    tryExpr.sub().accept(this, null);
    return null;
  }

  @Override
  public @Nullable Void visitClosure(Tree.Closure closure, @Nullable Void input) {
    append("{ ");
    closure.body().accept(this, null);
    append(" }");
    return null;
  }

  @Override
  public @Nullable Void visitCaptureList(Tree.CaptureList captureList, @Nullable Void input) {
    append('[').append(Joiner.on(", ").join(captureList.captures())).append("] ");
    captureList.closure().accept(this, null);
    return null;
  }

  @Override
  public @Nullable Void visitBrace(Tree.Brace brace, @Nullable Void input) {
    append('{');
    printLine();
    indent++;
    for (Tree element : brace.elements()) {
      element.accept(this, null);
      printLine();
    }
    indent--;
    append('}');
    return null;
  }

  @Override
  public @Nullable Void visitReturn(Tree.Return ret, @Nullable Void input) {
    append("return");
    if (ret.result() != null) {
      append(' ');
      ret.result().accept(this, null);
    }
    return null;
  }

  @Override
  public @Nullable Void visitIf(Tree.If ifStmt, @Nullable Void input) {
    append("if ");
    ifStmt.cond().accept(this, null);
    append(' ');
    ifStmt.then().accept(this, null);
    if (ifStmt.otherwise() != null) {
      append(" else ");
      ifStmt.otherwise().accept(this, null);
    }
    return null;
  }

  @Override
  public @Nullable Void visitPatternBinding(
      Tree.PatternBinding patternBinding, @Nullable Void input) {
    append("let ").append(patternBinding.name());
    if (patternBinding.annotatedType() != null) {
      append(": ").append(patternBinding.annotatedType().toString());
    }
    append(" = ");
    patternBinding.init().accept(this, null);
    return null;
  }
}
