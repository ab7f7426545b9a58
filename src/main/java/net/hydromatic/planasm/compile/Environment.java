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
package net.hydromatic.planasm.compile;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableSet;
import java.util.LinkedHashMap;
import java.util.Map;
import net.hydromatic.planasm.ast.Ast;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Symbol table for assembly.
 *
 * <p>Maps each identifier to the JSON value most recently bound to it. A
 * binding is visible to every statement after the one that created it,
 * until the identifier is bound again.
 *
 * <p>An environment belongs to a single assembly run, and is discarded when
 * the run finishes.
 */
public class Environment {
  /** Words that evaluate to JSON literals, and so cannot be bound. */
  public static final ImmutableSet<String> RESERVED =
      ImmutableSet.of("true", "false", "null");

  private final Map<String, JsonNode> values = new LinkedHashMap<>();

  /**
   * Binds an identifier to a value, replacing any previous binding.
   *
   * @throws AssembleException if the identifier is a reserved word
   */
  public void bind(Ast.Id id, JsonNode value) {
    if (RESERVED.contains(id.name)) {
      throw new AssembleException(
          "cannot bind reserved word '" + id.name + "'", id.pos);
    }
    values.put(id.name, value);
  }

  /** Returns the value bound to {@code name}, or null if not bound. */
  public @Nullable JsonNode getOpt(String name) {
    return values.get(name);
  }

  /**
   * Returns the value bound to an identifier.
   *
   * @throws UnboundIdentifierException if the identifier is not bound
   */
  public JsonNode get(Ast.Id id) {
    final JsonNode value = values.get(id.name);
    if (value == null) {
      throw new UnboundIdentifierException(id.name, id.pos);
    }
    return value;
  }

  /** Returns the number of bound identifiers. */
  public int size() {
    return values.size();
  }
}

// End Environment.java
