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

import com.google.common.collect.ImmutableList;
import java.util.LinkedHashSet;
import java.util.Set;
import org.membersynth.binder.sym.DeclId;

/**
 * Synthesized declarations whose owner came from a foreign module, and which must be emitted
 * into the current module.
 */
public class ExternalDecls {

  private final Set<DeclId> decls = new LinkedHashSet<>();

  public void registerExternal(DeclId decl) {
    decls.add(decl);
  }

  public boolean contains(DeclId decl) {
    return decls.contains(decl);
  }

  /** The registered declarations, in registration order. */
  public ImmutableList<DeclId> decls() {
    return ImmutableList.copyOf(decls);
  }
}
