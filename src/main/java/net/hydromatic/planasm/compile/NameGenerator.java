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

import static com.google.common.base.Preconditions.checkArgument;

import java.util.HashSet;
import java.util.Set;
import java.util.regex.Pattern;
import net.hydromatic.planasm.parse.Parsers;

/**
 * Generates unique identifiers.
 *
 * <p>Keeps track of the identifiers that have been issued in this program,
 * so that a name that is already in use can be given a numeric suffix.
 */
public class NameGenerator {
  private static final Pattern IDENTIFIER =
      Pattern.compile("[a-zA-Z_][a-zA-Z0-9_]*");
  private static final Pattern UNSAFE_CHAR = Pattern.compile("[^a-zA-Z0-9_]");
  private static final Pattern MULTI_UNDERSCORE = Pattern.compile("_+");

  private final Set<String> names = new HashSet<>();

  /**
   * Creates an identifier from components.
   *
   * <p>Joins the components with "_", replaces each character that cannot
   * occur in an identifier with "_", collapses runs of "_", removes a
   * trailing "_", and adds a leading "_" if the result is empty or starts
   * with a digit. For example, {@code makeIdentifier("fn", "is_not_null")}
   * returns "fn_is_not_null" and {@code makeIdentifier("uri", "")} returns
   * "uri".
   */
  public static String makeIdentifier(String... components) {
    String name = String.join("_", components);
    name = UNSAFE_CHAR.matcher(name).replaceAll("_");
    name = MULTI_UNDERSCORE.matcher(name).replaceAll("_");
    if (name.endsWith("_")) {
      name = name.substring(0, name.length() - 1);
    }
    if (name.isEmpty() || Character.isDigit(name.charAt(0))) {
      name = "_" + name;
    }
    return name;
  }

  /**
   * Returns {@code name} if it has not been issued, otherwise the first of
   * "name_2", "name_3", ... that has not been issued; and marks the result
   * as issued.
   *
   * <p>Keywords and the reserved words "true", "false" and "null" are
   * treated as if they had already been issued.
   */
  public String uniquify(String name) {
    checkArgument(
        IDENTIFIER.matcher(name).matches(), "not an identifier: %s", name);
    if (isAvailable(name)) {
      names.add(name);
      return name;
    }
    for (int i = 2;; i++) {
      final String uniquified = name + "_" + i;
      if (isAvailable(uniquified)) {
        names.add(uniquified);
        return uniquified;
      }
    }
  }

  private boolean isAvailable(String name) {
    return Parsers.isIdentifier(name)
        && !Environment.RESERVED.contains(name)
        && !names.contains(name);
  }

  /** Returns the number of identifiers issued. */
  public int size() {
    return names.size();
  }
}

// End NameGenerator.java
