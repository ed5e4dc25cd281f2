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

import com.google.common.collect.ImmutableList;
import java.util.LinkedHashSet;
import java.util.Set;
import javax.tools.Diagnostic;
import org.membersynth.binder.sym.DeclId;
import org.membersynth.diag.SynthError.ErrorKind;

/** A log that collects diagnostics. */
public class SynthLog {

  private final Set<SynthDiagnostic> diagnostics = new LinkedHashSet<>();

  public ImmutableList<SynthDiagnostic> diagnostics() {
    return ImmutableList.copyOf(diagnostics);
  }

  public void maybeThrow() {
    if (anyErrors()) {
      throw new SynthError(diagnostics());
    }
  }

  public boolean anyErrors() {
    for (SynthDiagnostic error : diagnostics) {
      if (error.isError()) {
        return true;
      }
    }
    return false;
  }

  public void diagnostic(
      Diagnostic.Kind severity, DeclId decl, int position, ErrorKind kind, Object... args) {
    diagnostics.add(SynthDiagnostic.format(severity, decl, position, kind, args));
  }

  public void error(DeclId decl, int position, ErrorKind kind, Object... args) {
    diagnostic(Diagnostic.Kind.ERROR, decl, position, kind, args);
  }

  public void note(DeclId decl, int position, ErrorKind kind, Object... args) {
    diagnostic(Diagnostic.Kind.NOTE, decl, position, kind, args);
  }
}
