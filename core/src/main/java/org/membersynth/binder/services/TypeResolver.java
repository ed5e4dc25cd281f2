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

package org.membersynth.binder.services;

import org.membersynth.decl.AbstractStorageDecl;
import org.membersynth.decl.Decl;
import org.membersynth.type.Type;

/** The type checker, as seen by member synthesis. */
public interface TypeResolver {

  /** Returns the type of the value a storage declaration holds, after resolution. */
  Type typeOfStorageValue(AbstractStorageDecl storage);

  /**
   * Type-checks a declaration. The first pass checks the signature, the second the body.
   *
   * <p>Type checking may request synthesis for the same declaration again.
   */
  void typeCheck(Decl decl, boolean firstPass);

  /** Validates a declaration's signature and attributes. */
  void validate(Decl decl);
}
