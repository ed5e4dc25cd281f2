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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.Objects;
import javax.tools.Diagnostic;
import org.membersynth.binder.sym.DeclId;
import org.membersynth.diag.SynthError.ErrorKind;
import org.jspecify.annotations.Nullable;

/** A diagnostic attached to a declaration. */
public class SynthDiagnostic {

  private final Diagnostic.Kind severity;
  private final ErrorKind kind;
  private final ImmutableList<Object> args;
  private final @Nullable DeclId decl;
  private final int position;

  private SynthDiagnostic(
      Diagnostic.Kind severity,
      ErrorKind kind,
      ImmutableList<Object> args,
      @Nullable DeclId decl,
      int position) {
    this.severity = requireNonNull(severity);
    this.kind = requireNonNull(kind);
    this.args = requireNonNull(args);
    this.decl = decl;
    this.position = position;
  }

  /** The diagnostic kind. */
  public ErrorKind kind() {
    return kind;
  }

  /** The diagnostic severity; synthesis only reports errors and notes attached to them. */
  public Diagnostic.Kind severity() {
    return severity;
  }

  boolean isError() {
    return severity.equals(Diagnostic.Kind.ERROR);
  }

  /** The declaration the diagnostic is reported against, if any. */
  public @Nullable DeclId decl() {
    return decl;
  }

  /** The source position, or {@code -1}. */
  public int position() {
    return position;
  }

  /** The diagnostic arguments. */
  public ImmutableList<Object> args() {
    return args;
  }

  /** The formatted message, without location. */
  public String message() {
    return kind.format(args.toArray());
  }

  /** The diagnostic message. */
  public String diagnostic() {
    StringBuilder sb = new StringBuilder();
    sb.append(decl != null ? decl.toString() : "<>");
    if (position != -1) {
      sb.append(':').append(position);
    }
    sb.append(severity.equals(Diagnostic.Kind.NOTE) ? ": note: " : ": error: ");
    sb.append(message());
    return sb.toString();
  }

  /**
   * Formats a diagnostic.
   *
   * @param severity the diagnostic severity
   * @param decl the declaration the diagnostic is reported against
   * @param position the diagnostic position
   * @param kind the error kind
   * @param args format args
   */
  public static SynthDiagnostic format(
      Diagnostic.Kind severity,
      @Nullable DeclId decl,
      int position,
      ErrorKind kind,
      Object... args) {
    switch (kind) {
      case COPYING_DOES_NOT_CONFORM:
      case UNSUPPORTED_SYNTHESIZE_INIT_VARIADIC:
        checkArgument(args.length == 1, "diagnostic (%s) has invalid arguments", kind);
        break;
      case MISSING_UNIMPLEMENTED_INIT_RUNTIME:
      case VARIADIC_SUPERCLASS_INIT_HERE:
        checkArgument(args.length == 0, "diagnostic (%s) has invalid arguments", kind);
        break;
    }
    return new SynthDiagnostic(severity, kind, ImmutableList.copyOf(args), decl, position);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, decl, position);
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    if (!(obj instanceof SynthDiagnostic)) {
      return false;
    }
    SynthDiagnostic that = (SynthDiagnostic) obj;
    return severity.equals(that.severity)
        && kind.equals(that.kind)
        && args.equals(that.args)
        && Objects.equals(decl, that.decl)
        && position == that.position;
  }

  @Override
  public String toString() {
    return diagnostic();
  }
}
