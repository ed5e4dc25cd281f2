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
import org.membersynth.model.NominalKind;
import org.membersynth.type.Type;
import org.jspecify.annotations.Nullable;

/** A struct, enum, class or protocol declaration. */
public class NominalTypeDecl extends ContextDecl {

  private final String name;
  private final NominalKind nominalKind;
  private @Nullable DeclId superclass;
  private Type declaredType;
  private boolean hasDestructor;

  public NominalTypeDecl(
      DeclId id, int position, DeclId parent, String name, NominalKind nominalKind) {
    super(id, position, parent);
    this.name = name;
    this.nominalKind = nominalKind;
    this.declaredType =
        nominalKind == NominalKind.PROTOCOL
            ? Type.SelfTy.create(id)
            : Type.NominalTy.create(id, name);
  }

  @Override
  public DeclKind kind() {
    return DeclKind.NOMINAL;
  }

  public String name() {
    return name;
  }

  public NominalKind nominalKind() {
    return nominalKind;
  }

  /** The superclass declaration of a class, if it has one. */
  public @Nullable DeclId superclass() {
    return superclass;
  }

  public void setSuperclass(@Nullable DeclId superclass) {
    this.superclass = superclass;
  }

  /**
   * The type of {@code self} in instance members: the nominal type, or the protocol's {@code Self}
   * type. An error type if the declaration could not be resolved.
   */
  public Type declaredType() {
    return declaredType;
  }

  public void setDeclaredType(Type declaredType) {
    this.declaredType = declaredType;
  }

  public boolean hasDestructor() {
    return hasDestructor;
  }

  public void setHasDestructor(boolean hasDestructor) {
    this.hasDestructor = hasDestructor;
  }
}
