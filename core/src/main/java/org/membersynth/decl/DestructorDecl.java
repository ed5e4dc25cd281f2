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
import org.membersynth.tree.Tree;
import org.jspecify.annotations.Nullable;

/** A class destructor. */
public class DestructorDecl extends Decl {

  private final DeclId selfParam;
  private Tree.@Nullable Brace body;

  public DestructorDecl(DeclId id, int position, DeclId parent, DeclId selfParam) {
    super(id, position, parent);
    this.selfParam = selfParam;
  }

  @Override
  public DeclKind kind() {
    return DeclKind.DESTRUCTOR;
  }

  public DeclId selfParam() {
    return selfParam;
  }

  public Tree.@Nullable Brace body() {
    return body;
  }

  public void setBody(Tree.@Nullable Brace body) {
    this.body = body;
  }
}
