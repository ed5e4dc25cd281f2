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

import org.membersynth.binder.sym.DeclId;
import org.membersynth.model.StorageKind;
import org.membersynth.tree.Tree;
import org.membersynth.type.Type;
import org.jspecify.annotations.Nullable;

/** A variable or constant. */
public class VarDecl extends AbstractStorageDecl {

  private final Type type;
  private Tree.@Nullable Expr initializer;

  public VarDecl(
      DeclId id, int position, DeclId parent, String name, StorageKind storageKind, Type type) {
    super(id, position, parent, name, storageKind);
    this.type = type;
  }

  @Override
  public DeclKind kind() {
    return DeclKind.VAR;
  }

  public Type type() {
    return type;
  }

  @Override
  public Type valueType() {
    return type;
  }

  /** The inline initializer expression, if any. */
  public Tree.@Nullable Expr initializer() {
    return initializer;
  }

  public void setInitializer(Tree.@Nullable Expr initializer) {
    this.initializer = initializer;
  }
}
