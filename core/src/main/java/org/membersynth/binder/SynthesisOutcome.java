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

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import org.membersynth.decl.Decl;

/** The result of a synthesis request. */
@AutoValue
public abstract class SynthesisOutcome {

  /** A request status. */
  public enum Status {
    /** Members were created or completed. */
    SYNTHESIZED,
    /** The members exist already, or are being synthesized by an enclosing request. */
    ALREADY_HANDLED,
    /** The members could not be represented; nothing was added. */
    NOT_SYNTHESIZED,
    /** The subject never gets these members, or is invalid. */
    SKIPPED,
  }

  public abstract Status status();

  /** The declarations created or given bodies by the request, in creation order. */
  public abstract ImmutableList<Decl> decls();

  public static SynthesisOutcome synthesized(ImmutableList<? extends Decl> decls) {
    if (decls.isEmpty()) {
      return of(Status.NOT_SYNTHESIZED);
    }
    return new AutoValue_SynthesisOutcome(Status.SYNTHESIZED, ImmutableList.copyOf(decls));
  }

  public static SynthesisOutcome of(Status status) {
    return new AutoValue_SynthesisOutcome(status, ImmutableList.of());
  }

  public boolean isSynthesized() {
    return status() == Status.SYNTHESIZED;
  }
}
