/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.planasm.ast;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Kind of anchor.
 *
 * <p>Each kind has its own counter during assembly, its own declaration
 * statement, and its own members in the plan document.
 */
public enum AnchorKind {
  /** Extension URI, declared by "{@code using}". */
  URI(Op.USING_DECL, "extensionUriAnchor", null, "extension URI"),

  /** Extension type, declared by "{@code type}". */
  TYPE(Op.TYPE_DECL, "typeAnchor", "extensionType", "type"),

  /** Extension type variation, declared by "{@code type_variation}". */
  TYPE_VARIATION(
      Op.TYPE_VARIATION_DECL,
      "typeVariationAnchor",
      "extensionTypeVariation",
      "type variation"),

  /** Extension function, declared by "{@code function}". */
  FUNCTION(Op.FUNCTION_DECL, "functionAnchor", "extensionFunction", "function");

  /** Statement that declares an anchor of this kind. */
  public final Op op;

  /** Name of the member that holds the anchor in a declaration. */
  public final String anchorField;

  /**
   * Key of the wrapper object of an entry in the "extensions" array; null for
   * {@link #URI}, whose entries live in "extension_uris".
   */
  public final @Nullable String extensionKey;

  /** Description, for error messages. */
  public final String description;

  AnchorKind(
      Op op,
      String anchorField,
      @Nullable String extensionKey,
      String description) {
    this.op = requireNonNull(op);
    this.anchorField = requireNonNull(anchorField);
    this.extensionKey = extensionKey;
    this.description = requireNonNull(description);
    checkArgument(op.isStatement());
  }

  /** Returns the kind whose extension wrapper has a given key, or null. */
  public static @Nullable AnchorKind ofExtensionKey(String key) {
    for (AnchorKind kind : values()) {
      if (key.equals(kind.extensionKey)) {
        return kind;
      }
    }
    return null;
  }
}

// End AnchorKind.java
