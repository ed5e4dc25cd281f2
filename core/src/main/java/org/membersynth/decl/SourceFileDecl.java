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

import org.membersynth.binder.sym.DeclId;

/** A source file: the outermost declaration context. */
public class SourceFileDecl extends ContextDecl {

  /** Source file kinds. */
  public enum FileKind {
    /** A file with top-level code. */
    MAIN,
    LIBRARY,
    /** An intermediate-language file, whose declarations are already lowered. */
    SIL
  }

  private final String path;
  private final FileKind fileKind;

  public SourceFileDecl(DeclId id, String path, FileKind fileKind) {
    super(id, -1, null);
    this.path = path;
    this.fileKind = fileKind;
  }

  @Override
  public DeclKind kind() {
    return DeclKind.SOURCE_FILE;
  }

  public String path() {
    return path;
  }

  public FileKind fileKind() {
    return fileKind;
  }
}
