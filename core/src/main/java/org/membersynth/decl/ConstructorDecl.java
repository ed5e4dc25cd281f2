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

package org.membersynth.decl;

import com.google.common.collect.ImmutableList;
import org.membersynth.binder.sym.DeclId;
import org.membersynth.model.DesignatedInitKind;
import org.membersynth.model.Failability;
import org.membersynth.model.ImplicitConstructorKind;
import org.membersynth.model.SynthFlag;
import org.membersynth.tree.Tree;
import org.jspecify.annotations.Nullable;

/** An initializer. */
public class ConstructorDecl extends Decl {

  private final DeclId selfParam;
  private final ImmutableList<DeclId> params;
  private final Failability failability;
  private @Nullable ImplicitConstructorKind implicitKind;
  private @Nullable DesignatedInitKind designatedKind;
  private @Nullable DeclId overridden;
  private Tree.@Nullable Brace body;

  public ConstructorDecl(
      DeclId id,
      int position,
      DeclId parent,
      DeclId selfParam,
      ImmutableList<DeclId> params,
      Failability failability) {
    super(id, position, parent);
    this.selfParam = selfParam;
    this.params = params;
    this.failability = failability;
  }

  @Override
  public DeclKind kind() {
    return DeclKind.CONSTRUCTOR;
  }

  public DeclId selfParam() {
    return selfParam;
  }

  public ImmutableList<DeclId> params() {
    return params;
  }

  public Failability failability() {
    return failability;
  }

  public boolean isThrowing() {
    return hasFlag(SynthFlag.ACC_THROWS);
  }

  public boolean isRequired() {
    return hasFlag(SynthFlag.ACC_REQUIRED);
  }

  /** How an implicit initializer was derived from the type's members, if it was. */
  public @Nullable ImplicitConstructorKind implicitKind() {
    return implicitKind;
  }

  public void setImplicitKind(@Nullable ImplicitConstructorKind implicitKind) {
    this.implicitKind = implicitKind;
  }

  /** How an inherited designated initializer override was synthesized, if it was. */
  public @Nullable DesignatedInitKind designatedKind() {
    return designatedKind;
  }

  public void setDesignatedKind(@Nullable DesignatedInitKind designatedKind) {
    this.designatedKind = designatedKind;
  }

  /** The superclass initializer this one overrides. */
  public @Nullable DeclId overridden() {
    return overridden;
  }

  public void setOverridden(@Nullable DeclId overridden) {
    this.overridden = overridden;
  }

  public Tree.@Nullable Brace body() {
    return body;
  }

  public void setBody(Tree.@Nullable Brace body) {
    this.body = body;
  }
}
