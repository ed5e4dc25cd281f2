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

package org.membersynth.diag;

import static java.util.stream.Collectors.joining;

import com.google.common.collect.ImmutableList;

/** Errors raised while synthesizing implicit members. */
public class SynthError extends Error {

  /** A diagnostic kind. */
  public enum ErrorKind {
    COPYING_DOES_NOT_CONFORM(
        "'copy-on-assign' requires property '%s' to have a type that conforms to the copying"
            + " protocol"),
    MISSING_UNIMPLEMENTED_INIT_RUNTIME(
        "standard library error: missing runtime function for unimplemented initializers"),
    UNSUPPORTED_SYNTHESIZE_INIT_VARIADIC(
        "synthesizing a variadic inherited initializer for subclass '%s' is unsupported"),
    VARIADIC_SUPERCLASS_INIT_HERE("variadic superclass initializer defined here");

    private final String message;

    ErrorKind(String message) {
      this.message = message;
    }

    String format(Object... args) {
      return String.format(message, args);
    }
  }

  private final ImmutableList<SynthDiagnostic> diagnostics;

  public SynthError(ImmutableList<SynthDiagnostic> diagnostics) {
    this.diagnostics = diagnostics;
  }

  @Override
  public String getMessage() {
    return diagnostics.stream().map(d -> d.diagnostic()).collect(joining(System.lineSeparator()));
  }

  public ImmutableList<SynthDiagnostic> diagnostics() {
    return diagnostics;
  }
}
