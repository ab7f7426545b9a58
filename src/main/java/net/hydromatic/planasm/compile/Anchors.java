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

import java.util.EnumMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import net.hydromatic.planasm.ast.AnchorKind;
import net.hydromatic.planasm.ast.Pos;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Anchor counters, one per {@link AnchorKind}.
 *
 * <p>Each counter starts at 0. By default, allocation increments the counter
 * and returns the new value, so the first anchor of each kind is 1. An
 * explicit anchor N resets the counter to N - 1 before incrementing, so that
 * the anchor is N and the next default anchor is N + 1.
 *
 * <p>An anchor value is never allocated twice for the same kind; an
 * allocation that would reuse a value is an error.
 */
public class Anchors {
  private final Map<AnchorKind, Integer> counters = new EnumMap<>(AnchorKind.class);
  private final Map<AnchorKind, Set<Integer>> allocated =
      new EnumMap<>(AnchorKind.class);

  public Anchors() {
    for (AnchorKind kind : AnchorKind.values()) {
      counters.put(kind, 0);
      allocated.put(kind, new HashSet<>());
    }
  }

  /**
   * Computes the next value of a counter, which is also the anchor that is
   * allocated.
   *
   * @param counter Current value of the counter
   * @param override Explicit anchor, or null
   * @return New value of the counter
   */
  public static int allocate(int counter, @Nullable Integer override) {
    if (override != null) {
      checkArgument(override >= 0, "anchor must not be negative");
      return override;
    }
    if (counter == Integer.MAX_VALUE) {
      throw new IllegalStateException("anchor counter overflow");
    }
    return counter + 1;
  }

  /**
   * Allocates an anchor of a given kind.
   *
   * @param kind Kind of anchor
   * @param override Explicit anchor, or null
   * @param pos Position of the declaration, for error messages
   * @return Allocated anchor
   * @throws AssembleException if the anchor has already been allocated
   */
  public int allocate(AnchorKind kind, @Nullable Integer override, Pos pos) {
    final int anchor;
    try {
      anchor = allocate(counters.get(kind), override);
    } catch (IllegalStateException e) {
      throw new AssembleException(e.getMessage(), pos, e);
    }
    if (!allocated.get(kind).add(anchor)) {
      throw new AssembleException(
          kind.description + " anchor " + anchor + " is already declared",
          pos);
    }
    counters.put(kind, anchor);
    return anchor;
  }

  /** Returns the current value of a counter. */
  public int current(AnchorKind kind) {
    return counters.get(kind);
  }
}

// End Anchors.java
