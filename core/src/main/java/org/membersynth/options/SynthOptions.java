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

package org.membersynth.options;

import com.google.auto.value.AutoValue;

/** Options controlling implicit member synthesis. */
@AutoValue
public abstract class SynthOptions {

  /**
   * If true, variables declared in intermediate-language files get no synthesized accessors,
   * since those files spell out every accessor explicitly.
   */
  public abstract boolean skipSilFiles();

  /** If true, synthesized members are handed to the type checker as soon as they are built. */
  public abstract boolean typeCheckSynthesized();

  /** The suffix appended to a lazy variable's name to form the name of its backing storage. */
  public abstract String lazyStorageSuffix();

  public static SynthOptions defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new AutoValue_SynthOptions.Builder()
        .setSkipSilFiles(true)
        .setTypeCheckSynthesized(true)
        .setLazyStorageSuffix(".storage");
  }

  public abstract Builder toBuilder();

  /** A builder for {@link SynthOptions}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setSkipSilFiles(boolean skipSilFiles);

    public abstract Builder setTypeCheckSynthesized(boolean typeCheckSynthesized);

    public abstract Builder setLazyStorageSuffix(String lazyStorageSuffix);

    public abstract SynthOptions build();
  }
}
