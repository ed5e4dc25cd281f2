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
import org.membersynth.model.SynthFlag;
import org.membersynth.type.Type;
import org.jspecify.annotations.Nullable;

/** A function, initializer or subscript parameter, including implicit {@code self}. */
public class ParamDecl extends Decl {

  private final String argumentName;
  private final String name;
  private final Type type;

  public ParamDecl(
      DeclId id,
      int position,
      @Nullable DeclId parent,
      String argumentName,
      String name,
      Type type) {
    super(id, position, parent);
    this.argumentName = argumentName;
    this.name = name;
    this.type = type;
  }

  @Override
  public DeclKind kind() {
    return DeclKind.PARAM;
  }

  /** The argument label callers write, or the empty string. */
  public String argumentName() {
    return argumentName;
  }

  public String name() {
    return name;
  }

  /** The parameter type; in/out parameters have an {@link Type.InOutTy}. */
  public Type type() {
    return type;
  }

  public boolean isInOut() {
    return type.tyKind() == Type.TyKind.INOUT_TY;
  }

  public boolean isVariadic() {
    return hasFlag(SynthFlag.ACC_VARIADIC);
  }
}
