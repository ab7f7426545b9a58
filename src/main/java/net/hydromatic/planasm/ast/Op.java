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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableSet;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Sub-types of {@link AstNode}. */
public enum Op {
  // identifiers
  ID,

  // literals
  STRING_LITERAL,
  NUMBER_LITERAL,

  // value constructors
  ARRAY,
  OBJECT,

  // statements
  USING_DECL("using"),
  FUNCTION_DECL("function"),
  TYPE_DECL("type"),
  TYPE_VARIATION_DECL("type_variation"),
  PROTO_EXTENSION_DECL("proto_extension"),
  ENHANCEMENT_DECL("enhancement"),
  OPTIMIZATION_DECL("optimization"),
  EXECUTE("execute"),
  RAW("raw"),

  PROGRAM;

  /** Keyword that starts a statement, or null if this is not a statement. */
  public final @Nullable String keyword;

  /** All keywords of the language. None of them is a valid identifier. */
  public static final ImmutableSet<String> KEYWORDS;

  static {
    final ImmutableSet.Builder<String> b = ImmutableSet.builder();
    for (Op op : values()) {
      if (op.keyword != null) {
        b.add(op.keyword);
      }
    }
    KEYWORDS = b.build();
  }

  Op() {
    this.keyword = null;
  }

  Op(String keyword) {
    this.keyword = requireNonNull(keyword);
  }

  /** Returns whether this operator is a statement. */
  public boolean isStatement() {
    return keyword != null;
  }
}

// End Op.java
