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
package net.hydromatic.planasm;

import com.fasterxml.jackson.databind.JsonNode;
import net.hydromatic.planasm.ast.Pos;
import net.hydromatic.planasm.json.Json;
import net.hydromatic.planasm.util.PlanException;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.hamcrest.CustomTypeSafeMatcher;
import org.hamcrest.Matcher;

/** Matchers for use in planasm tests. */
public abstract class Matchers {
  private Matchers() {}

  /** Matches a throwable of a given class whose message matches. */
  static <T extends Throwable> Matcher<Throwable> throwsA(
      Class<T> clazz, Matcher<String> messageMatcher) {
    return new CustomTypeSafeMatcher<Throwable>(
        clazz + " with message " + messageMatcher) {
      @Override
      protected boolean matchesSafely(Throwable item) {
        return clazz.isInstance(item)
            && messageMatcher.matches(item.getMessage());
      }
    };
  }

  /**
   * Matches a throwable of a given class whose message contains a given
   * string and, if {@code pos} is not null, whose position is {@code pos}.
   */
  static <T extends Throwable> Matcher<Throwable> throwsA(
      Class<T> clazz, String message, @Nullable Pos pos) {
    return new CustomTypeSafeMatcher<Throwable>(
        clazz + " with message '" + message + "' at " + pos) {
      @Override
      protected boolean matchesSafely(Throwable item) {
        if (!clazz.isInstance(item)
            || item.getMessage() == null
            || !item.getMessage().contains(message)) {
          return false;
        }
        return pos == null
            || item instanceof PlanException
                && ((PlanException) item).pos().equals(pos);
      }
    };
  }

  /** Matches a JSON value that is structurally equal to the JSON text
   * {@code expected}. */
  static Matcher<JsonNode> isJson(String expected) {
    final JsonNode expectedNode = Json.parse(expected);
    return new CustomTypeSafeMatcher<JsonNode>("JSON " + expected) {
      @Override
      protected boolean matchesSafely(JsonNode item) {
        return Json.equalsStructurally(expectedNode, item);
      }
    };
  }
}

// End Matchers.java
