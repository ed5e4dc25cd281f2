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
import org.membersynth.binder.sym.DeclId;
import org.membersynth.model.DesignatedInitKind;
import org.membersynth.model.ImplicitConstructorKind;
import org.jspecify.annotations.Nullable;

/** A request to synthesize members for one subject declaration. */
@AutoValue
public abstract class SynthesisRequest {

  /** The declaration members are synthesized for. */
  public abstract DeclId subject();

  public abstract SynthesisIntent intent();

  /**
   * A second declaration the intent needs: the protocol requirement for {@link
   * SynthesisIntent#WITNESS_ACCESSORS}, or a single superclass initializer for {@link
   * SynthesisIntent#NEEDS_INHERITED_INITIALIZER}.
   */
  public abstract @Nullable DeclId related();

  /** How inherited initializers are overridden. */
  public abstract DesignatedInitKind designatedInitKind();

  /** The implicit initializer to create; derived from the type when unset. */
  public abstract @Nullable ImplicitConstructorKind constructorKind();

  public static SynthesisRequest of(DeclId subject, SynthesisIntent intent) {
    return builder().setSubject(subject).setIntent(intent).build();
  }

  public static Builder builder() {
    return new AutoValue_SynthesisRequest.Builder()
        .setDesignatedInitKind(DesignatedInitKind.CHAINING);
  }

  public abstract Builder toBuilder();

  /** A builder for {@link SynthesisRequest}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setSubject(DeclId subject);

    public abstract Builder setIntent(SynthesisIntent intent);

    public abstract Builder setRelated(@Nullable DeclId related);

    public abstract Builder setDesignatedInitKind(DesignatedInitKind designatedInitKind);

    public abstract Builder setConstructorKind(@Nullable ImplicitConstructorKind constructorKind);

    public abstract SynthesisRequest build();
  }
}
