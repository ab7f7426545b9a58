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

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import net.hydromatic.planasm.ast.AnchorKind;

/**
 * Plan schema that is configured by tables of relation types and field
 * names.
 *
 * <p>{@link #INSTANCE} knows the relations of Substrait, the subqueries that
 * can occur within expressions, and the fields that reference extension
 * functions, types and type variations. To describe another version of the
 * message format, start from {@link #toBuilder()} or {@link #builder()}.
 *
 * <p>A field that is registered as an anchor reference is only classified
 * as one if its value is a scalar; an object or array under the same name is
 * a different message, and is {@link PlanSchema.FieldKind#PLAIN}.
 */
public class StandardPlanSchema implements PlanSchema {
  public static final StandardPlanSchema INSTANCE =
      builder()
          .relation("read")
          .relation("filter", "input")
          .relation("fetch", "input")
          .relation("aggregate", "input")
          .relation("sort", "input")
          .relation("project", "input")
          .relation("join", "left", "right")
          .relationList("set", "inputs")
          .relation("extensionSingle", "input")
          .relationList("extensionMulti", "inputs")
          .relation("extensionLeaf")
          .relation("cross", "left", "right")
          .relation("reference")
          .relation("write", "input")
          .relation("ddl", "viewDefinition")
          .relation("update")
          .relation("hashJoin", "left", "right")
          .relation("mergeJoin", "left", "right")
          .relation("nestedLoopJoin", "left", "right")
          .relation("window", "input")
          .relation("exchange", "input")
          .relation("expand", "input")
          .field("scalar", "input", FieldKind.RELATION)
          .field("inPredicate", "haystack", FieldKind.RELATION)
          .field("setPredicate", "tuples", FieldKind.RELATION)
          .field("setComparison", "right", FieldKind.RELATION)
          .anchor("functionReference", AnchorKind.FUNCTION)
          .anchor("comparisonFunctionReference", AnchorKind.FUNCTION)
          .anchor("typeReference", AnchorKind.TYPE)
          .anchor("userDefinedTypeReference", AnchorKind.TYPE)
          .anchor("typeVariationReference", AnchorKind.TYPE_VARIATION)
          .build();

  private final ImmutableSet<String> relationTypes;
  private final ImmutableMap<String, ImmutableMap<String, FieldKind>> fields;
  private final ImmutableMap<String, AnchorKind> anchorFields;

  private StandardPlanSchema(
      ImmutableSet<String> relationTypes,
      ImmutableMap<String, ImmutableMap<String, FieldKind>> fields,
      ImmutableMap<String, AnchorKind> anchorFields) {
    this.relationTypes = requireNonNull(relationTypes);
    this.fields = requireNonNull(fields);
    this.anchorFields = requireNonNull(anchorFields);
  }

  /** Creates a builder with no relation types and no fields. */
  public static Builder builder() {
    return new Builder();
  }

  /** Creates a builder that is initialized with this schema's tables. */
  public Builder toBuilder() {
    final Builder builder = new Builder();
    builder.relationTypes.addAll(relationTypes);
    fields.forEach((messageKey, map) ->
        builder.fields.put(messageKey, new LinkedHashMap<>(map)));
    builder.anchorFields.putAll(anchorFields);
    return builder;
  }

  @Override
  public boolean isRelationType(String type) {
    return relationTypes.contains(type);
  }

  @Override
  public FieldKind classify(String messageKey, String field, JsonNode value) {
    final ImmutableMap<String, FieldKind> map = fields.get(messageKey);
    if (map != null) {
      final FieldKind fieldKind = map.get(field);
      if (fieldKind != null) {
        return fieldKind;
      }
    }
    final AnchorKind anchorKind = anchorFields.get(field);
    if (anchorKind != null && !value.isContainerNode()) {
      return FieldKind.anchor(anchorKind);
    }
    return FieldKind.PLAIN;
  }

  /** Builder for {@link StandardPlanSchema}. */
  public static class Builder {
    private final Set<String> relationTypes = new LinkedHashSet<>();
    private final Map<String, Map<String, FieldKind>> fields =
        new LinkedHashMap<>();
    private final Map<String, AnchorKind> anchorFields = new HashMap<>();

    private Builder() {}

    /** Registers a relation type whose given fields each hold a relation. */
    public Builder relation(String type, String... relationFields) {
      relationTypes.add(type);
      for (String field : relationFields) {
        field(type, field, FieldKind.RELATION);
      }
      return this;
    }

    /** Registers a relation type whose given fields each hold an array of
     * relations. */
    public Builder relationList(String type, String... relationFields) {
      relationTypes.add(type);
      for (String field : relationFields) {
        field(type, field, FieldKind.RELATION_LIST);
      }
      return this;
    }

    /** Sets the kind of a field within a message. */
    public Builder field(String messageKey, String field, FieldKind kind) {
      fields.computeIfAbsent(messageKey, k -> new LinkedHashMap<>())
          .put(field, kind);
      return this;
    }

    /** Registers a field, in any message, that references an anchor. */
    public Builder anchor(String field, AnchorKind kind) {
      if (kind == AnchorKind.URI) {
        throw new IllegalArgumentException(
            "extension URI anchors are not referenced from relations");
      }
      anchorFields.put(field, kind);
      return this;
    }

    public StandardPlanSchema build() {
      final ImmutableMap.Builder<String, ImmutableMap<String, FieldKind>> b =
          ImmutableMap.builder();
      fields.forEach((messageKey, map) ->
          b.put(messageKey, ImmutableMap.copyOf(map)));
      return new StandardPlanSchema(
          ImmutableSet.copyOf(relationTypes),
          b.build(),
          ImmutableMap.copyOf(anchorFields));
    }
  }
}

// End StandardPlanSchema.java
