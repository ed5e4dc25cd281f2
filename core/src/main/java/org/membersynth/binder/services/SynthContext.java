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

import com.google.auto.value.AutoValue;
import org.membersynth.binder.env.DeclArena;
import org.membersynth.diag.SynthLog;
import org.membersynth.options.SynthOptions;

/**
 * Everything synthesis reads and writes for one compilation unit.
 *
 * <p>A context is not thread-safe: the arena, log and external declaration list are mutated in
 * place.
 */
@AutoValue
public abstract class SynthContext {

  public abstract DeclArena arena();

  public abstract SynthLog log();

  public abstract SynthOptions options();

  public abstract TypeResolver typeResolver();

  public abstract AvailabilityInference availability();

  public abstract ConformanceChecker conformance();

  public abstract KnownDecls knownDecls();

  public abstract ExternalDecls externalDecls();

  public static Builder builder() {
    return new AutoValue_SynthContext.Builder()
        .setLog(new SynthLog())
        .setOptions(SynthOptions.defaults())
        .setAvailability(new IntersectingAvailability())
        .setExternalDecls(new ExternalDecls());
  }

  /** A builder for {@link SynthContext}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setArena(DeclArena arena);

    public abstract Builder setLog(SynthLog log);

    public abstract Builder setOptions(SynthOptions options);

    public abstract Builder setTypeResolver(TypeResolver typeResolver);

    public abstract Builder setAvailability(AvailabilityInference availability);

    public abstract Builder setConformance(ConformanceChecker conformance);

    public abstract Builder setKnownDecls(KnownDecls knownDecls);

    public abstract Builder setExternalDecls(ExternalDecls externalDecls);

    public abstract SynthContext build();
  }
}
