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

/** An extension adding members to a nominal type declared elsewhere. */
public class ExtensionDecl extends ContextDecl {

  private final DeclId extended;

  public ExtensionDecl(DeclId id, int position, DeclId parent, DeclId extended) {
    super(id, position, parent);
    this.extended = extended;
  }

  @Override
  public DeclKind kind() {
    return DeclKind.EXTENSION;
  }

  /** The extended nominal type. */
  public DeclId extended() {
    return extended;
  }
}
