/*
 * Copyright 2026 The Pasta Authors. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.devtools.pasta.base;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Thrown when a parsed tree cannot be aligned with the token stream it was parsed from. This
 * indicates a construct whose positions the parser did not report faithfully.
 */
public final class AnnotationException extends PastaException {
  private final @Nullable NodeKind kind;
  private final int offset;

  public AnnotationException(String message, @Nullable NodeKind kind, int offset) {
    super(message);
    this.kind = kind;
    this.offset = offset;
  }

  /** Returns the kind of the node being annotated when alignment failed, if any. */
  public @Nullable NodeKind getKind() {
    return kind;
  }

  /** Returns the char offset of the token stream cursor when alignment failed. */
  public int getOffset() {
    return offset;
  }
}
