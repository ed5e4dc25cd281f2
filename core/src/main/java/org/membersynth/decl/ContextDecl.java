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
import java.util.ArrayList;
import java.util.List;
import org.membersynth.binder.sym.DeclId;
import org.jspecify.annotations.Nullable;

/** A declaration that owns an ordered list of member declarations. */
public abstract class ContextDecl extends Decl {

  private final List<DeclId> members = new ArrayList<>();

  protected ContextDecl(DeclId id, int position, @Nullable DeclId parent) {
    super(id, position, parent);
  }

  public ImmutableList<DeclId> members() {
    return ImmutableList.copyOf(members);
  }

  /**
   * Adds a member. If {@code hint} is a member of this context the new member is inserted
   * immediately after it, otherwise it is appended.
   */
  public void addMember(DeclId member, @Nullable DeclId hint) {
    int idx = hint != null ? members.indexOf(hint) : -1;
    if (idx == -1) {
      members.add(member);
    } else {
      members.add(idx + 1, member);
    }
  }

  public void addMember(DeclId member) {
    addMember(member, null);
  }
}
