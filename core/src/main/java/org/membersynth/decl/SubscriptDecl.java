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
import org.membersynth.model.StorageKind;
import org.membersynth.type.Type;

/** A subscript: storage addressed by index parameters. */
public class SubscriptDecl extends AbstractStorageDecl {

  private final ImmutableList<DeclId> indices;
  private final Type elementType;

  public SubscriptDecl(
      DeclId id,
      int position,
      DeclId parent,
      StorageKind storageKind,
      ImmutableList<DeclId> indices,
      Type elementType) {
    super(id, position, parent, "subscript", storageKind);
    this.indices = indices;
    this.elementType = elementType;
  }

  @Override
  public DeclKind kind() {
    return DeclKind.SUBSCRIPT;
  }

  /** The index parameters. */
  public ImmutableList<DeclId> indices() {
    return indices;
  }

  public Type elementType() {
    return elementType;
  }

  @Override
  public Type valueType() {
    return elementType;
  }
}
