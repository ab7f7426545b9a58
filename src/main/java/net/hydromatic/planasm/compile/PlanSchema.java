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
import net.hydromatic.planasm.ast.AnchorKind;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Knowledge about the messages of a plan document that the disassembler
 * needs in order to walk it.
 *
 * <p>The JSON encoding of a plan does not say what type of message each
 * object is. A schema tells the disassembler which keys introduce a
 * relation, which fields of a message hold relations, and which fields hold
 * anchor references.
 *
 * @see StandardPlanSchema
 */
public interface PlanSchema {
  /** Returns whether {@code type} is the key of a relation, such as
   * "{@code filter}" in {@code {"filter": {...}}}. */
  boolean isRelationType(String type);

  /**
   * Classifies a field.
   *
   * @param messageKey Key under which the enclosing object sits; for the
   *     body of a relation, the relation type
   * @param field Name of the field
   * @param value Value of the field
   * @return Kind of field; never null
   */
  FieldKind classify(String messageKey, String field, JsonNode value);

  /** Kind of a field in a plan document. */
  enum FieldKind {
    /** The field holds a relation. */
    RELATION(null),
    /** The field holds an array of relations. */
    RELATION_LIST(null),
    /** The field holds the anchor of an extension function. */
    FUNCTION_ANCHOR(AnchorKind.FUNCTION),
    /** The field holds the anchor of an extension type. */
    TYPE_ANCHOR(AnchorKind.TYPE),
    /** The field holds the anchor of an extension type variation. */
    TYPE_VARIATION_ANCHOR(AnchorKind.TYPE_VARIATION),
    /** Any other field. */
    PLAIN(null);

    /** Kind of anchor that the field references, or null. */
    public final @Nullable AnchorKind anchorKind;

    FieldKind(@Nullable AnchorKind anchorKind) {
      this.anchorKind = anchorKind;
    }

    /** Returns the kind of field that references a given kind of anchor. */
    public static FieldKind anchor(AnchorKind anchorKind) {
      for (FieldKind fieldKind : values()) {
        if (fieldKind.anchorKind == anchorKind) {
          return fieldKind;
        }
      }
      throw new IllegalArgumentException("no field kind for " + anchorKind);
    }
  }
}

// End PlanSchema.java
