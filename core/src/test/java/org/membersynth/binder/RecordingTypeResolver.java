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

package org.membersynth.binder;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import org.membersynth.binder.services.TypeResolver;
import org.membersynth.decl.AbstractStorageDecl;
import org.membersynth.decl.Decl;
import org.membersynth.type.Type;
import org.jspecify.annotations.Nullable;

/** A type resolver that records what it was asked to check, and can request more synthesis. */
class RecordingTypeResolver implements TypeResolver {

  final List<String> events = new ArrayList<>();

  /** Runs on every type check, before it is recorded. */
  @Nullable Consumer<Decl> onTypeCheck;

  @Override
  public Type typeOfStorageValue(AbstractStorageDecl storage) {
    return storage.valueType();
  }

  @Override
  public void typeCheck(Decl decl, boolean firstPass) {
    if (onTypeCheck != null) {
      onTypeCheck.accept(decl);
    }
    events.add((firstPass ? "check1 " : "check2 ") + describe(decl));
  }

  @Override
  public void validate(Decl decl) {
    events.add("validate " + describe(decl));
  }

  static String describe(Decl decl) {
    return SynthFixture.nameOf(decl);
  }
}
