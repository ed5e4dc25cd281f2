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
import org.membersynth.model.AccessorKind;
import org.membersynth.model.SynthFlag;
import org.membersynth.tree.Tree;
import org.membersynth.type.Type;
import org.jspecify.annotations.Nullable;

/** A function, possibly an accessor of a storage declaration. */
public class FuncDecl extends Decl {

  private final String name;
  private final @Nullable AccessorKind accessorKind;
  private final @Nullable DeclId storage;
  private final @Nullable DeclId selfParam;
  private final ImmutableList<DeclId> params;
  private final Type resultType;
  private Tree.@Nullable Brace body;
  private boolean bodyOwedExternally;

  public FuncDecl(
      DeclId id,
      int position,
      DeclId parent,
      String name,
      @Nullable AccessorKind accessorKind,
      @Nullable DeclId storage,
      @Nullable DeclId selfParam,
      ImmutableList<DeclId> params,
      Type resultType) {
    super(id, position, parent);
    this.name = name;
    this.accessorKind = accessorKind;
    this.storage = storage;
    this.selfParam = selfParam;
    this.params = params;
    this.resultType = resultType;
  }

  @Override
  public DeclKind kind() {
    return DeclKind.FUNC;
  }

  public String name() {
    return name;
  }

  /** The accessor kind, or {@code null} for ordinary functions. */
  public @Nullable AccessorKind accessorKind() {
    return accessorKind;
  }

  /** The storage declaration this accessor belongs to. */
  public @Nullable DeclId storage() {
    return storage;
  }

  /** The implicit self parameter of members; {@code null} outside type contexts. */
  public @Nullable DeclId selfParam() {
    return selfParam;
  }

  public ImmutableList<DeclId> params() {
    return params;
  }

  public Type resultType() {
    return resultType;
  }

  public Tree.@Nullable Brace body() {
    return body;
  }

  public void setBody(Tree.@Nullable Brace body) {
    this.body = body;
  }

  /** True if the body is not a tree but will be emitted directly by code generation. */
  public boolean bodyOwedExternally() {
    return bodyOwedExternally;
  }

  public void setBodyOwedExternally(boolean bodyOwedExternally) {
    this.bodyOwedExternally = bodyOwedExternally;
  }

  public boolean isMutating() {
    return hasFlag(SynthFlag.ACC_MUTATING);
  }
}
