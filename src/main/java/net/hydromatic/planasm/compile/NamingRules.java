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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import net.hydromatic.planasm.ast.AnchorKind;
import net.hydromatic.planasm.util.Prop;

/**
 * Rules by which the disassembler chooses identifiers.
 *
 * <p>An identifier is a prefix followed by a name derived from the thing it
 * identifies: the base name of an extension URI, the name of an extension,
 * or the ordinal of a relation.
 */
public class NamingRules {
  /** Names to use in identifiers of functions whose names are operators. */
  public static final ImmutableMap<String, String> DEFAULT_ALIASES =
      ImmutableMap.<String, String>builder()
          .put("+", "add")
          .put("-", "sub")
          .put("*", "mult")
          .put("/", "div")
          .put("=", "equal")
          .put("<", "lt")
          .put("<=", "lte")
          .put(">", "gt")
          .put(">=", "gte")
          .put("!=", "not_equal")
          .put("<>", "not_equal")
          .build();

  /** Rules with default prefixes and aliases. */
  public static final NamingRules DEFAULT = of(ImmutableMap.of());

  public final String uriPrefix;
  public final String functionPrefix;
  public final String typePrefix;
  public final String typeVariationPrefix;
  public final String relationPrefix;
  public final ImmutableMap<String, String> aliases;

  private NamingRules(
      String uriPrefix,
      String functionPrefix,
      String typePrefix,
      String typeVariationPrefix,
      String relationPrefix,
      ImmutableMap<String, String> aliases) {
    this.uriPrefix = requireNonNull(uriPrefix);
    this.functionPrefix = requireNonNull(functionPrefix);
    this.typePrefix = requireNonNull(typePrefix);
    this.typeVariationPrefix = requireNonNull(typeVariationPrefix);
    this.relationPrefix = requireNonNull(relationPrefix);
    this.aliases = requireNonNull(aliases);
  }

  /** Creates rules from a map of properties, with the default aliases. */
  public static NamingRules of(Map<Prop, Object> map) {
    return new NamingRules(
        Prop.URI_PREFIX.stringValue(map),
        Prop.FUNCTION_PREFIX.stringValue(map),
        Prop.TYPE_PREFIX.stringValue(map),
        Prop.TYPE_VARIATION_PREFIX.stringValue(map),
        Prop.RELATION_PREFIX.stringValue(map),
        DEFAULT_ALIASES);
  }

  /** Returns a copy of these rules with an additional alias. */
  public NamingRules withAlias(String name, String alias) {
    final Map<String, String> map = new LinkedHashMap<>(aliases);
    map.put(name, alias);
    return new NamingRules(uriPrefix, functionPrefix, typePrefix,
        typeVariationPrefix, relationPrefix, ImmutableMap.copyOf(map));
  }

  /** Returns the prefix for identifiers of a given kind of anchor. */
  public String prefix(AnchorKind kind) {
    switch (kind) {
    case URI:
      return uriPrefix;
    case FUNCTION:
      return functionPrefix;
    case TYPE:
      return typePrefix;
    case TYPE_VARIATION:
      return typeVariationPrefix;
    default:
      throw new AssertionError(kind);
    }
  }

  /** Returns the name to use in the identifier of an extension. */
  public String alias(String name) {
    return aliases.getOrDefault(name, name);
  }

  /**
   * Returns the base name of a URI: the part after the last "/", up to
   * but not including the first ".".
   *
   * <p>For example, the base name of
   * "https://example.com/functions_arithmetic.yaml" is
   * "functions_arithmetic".
   */
  public static String baseName(String uri) {
    final String last = uri.substring(uri.lastIndexOf('/') + 1);
    final int dot = last.indexOf('.');
    return dot < 0 ? last : last.substring(0, dot);
  }

  /** Returns the preferred identifier of an extension URI. */
  public String uriName(String uri) {
    return NameGenerator.makeIdentifier(uriPrefix, baseName(uri));
  }

  /** Returns the preferred identifier of an extension. */
  public String extensionName(AnchorKind kind, String name) {
    return NameGenerator.makeIdentifier(prefix(kind), alias(name));
  }

  /** Returns the preferred identifier of the relation with a given
   * ordinal. */
  public String relationName(int ordinal) {
    return NameGenerator.makeIdentifier(
        relationPrefix, Integer.toString(ordinal));
  }
}

// End NamingRules.java
