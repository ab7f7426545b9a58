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
import static net.hydromatic.planasm.ast.AstBuilder.ast;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import net.hydromatic.planasm.ast.AnchorKind;
import net.hydromatic.planasm.ast.Ast;
import net.hydromatic.planasm.ast.Op;
import net.hydromatic.planasm.ast.Pos;
import net.hydromatic.planasm.json.Json;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts a plan document into a program in the plan assembly language.
 *
 * <p>The program, when assembled, produces a document equal to the original
 * (except that a member that the original omits, such as an anchor with the
 * default value 0, may become explicit).
 *
 * <p>Statements are generated in a fixed order: extension URIs, extensions,
 * protobuf type URLs, advanced extensions, and then, for each relation in the
 * "relations" array, one "{@code raw}" statement for each relation node in
 * depth-first post-order followed by an "{@code execute}" statement.
 * Identifiers are chosen by {@link NamingRules} and made unique by
 * {@link NameGenerator}; a given document always produces the same program.
 */
public class Disassembler {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(Disassembler.class);

  /** Top-level keys, in both their snake_case and camelCase spellings. */
  private static final ImmutableMap<String, String> TOP_LEVEL_KEYS =
      ImmutableMap.<String, String>builder()
          .put(Assembler.EXTENSION_URIS, Assembler.EXTENSION_URIS)
          .put("extensionUris", Assembler.EXTENSION_URIS)
          .put(Assembler.EXTENSIONS, Assembler.EXTENSIONS)
          .put(Assembler.RELATIONS, Assembler.RELATIONS)
          .put(Assembler.ADVANCED_EXTENSIONS, Assembler.ADVANCED_EXTENSIONS)
          .put("advancedExtensions", Assembler.ADVANCED_EXTENSIONS)
          .put(Assembler.EXPECTED_TYPE_URLS, Assembler.EXPECTED_TYPE_URLS)
          .put("expectedTypeUrls", Assembler.EXPECTED_TYPE_URLS)
          .build();

  private static final String ENHANCEMENT = "enhancement";
  private static final String OPTIMIZATION = "optimization";

  private final NamingRules rules;
  private final PlanSchema schema;
  private final boolean strict;
  private final String file;

  /** Creates a disassembler.
   *
   * @param rules Rules for choosing identifiers
   * @param schema Schema of the messages in the document
   * @param strict Whether to throw {@link SchemaException} if the schema
   *     cannot classify a relation or field; if false, such values are copied
   *     unchanged
   * @param file Name of the document, for error messages
   */
  public Disassembler(NamingRules rules, PlanSchema schema, boolean strict,
      String file) {
    this.rules = requireNonNull(rules);
    this.schema = requireNonNull(schema);
    this.strict = strict;
    this.file = requireNonNull(file);
  }

  /** Creates a non-strict disassembler with default naming rules and the
   * standard schema. */
  public static Disassembler create() {
    return new Disassembler(
        NamingRules.DEFAULT, StandardPlanSchema.INSTANCE, false, "");
  }

  /**
   * Disassembles a plan document.
   *
   * @throws DisassembleException if the document is malformed
   * @throws SchemaException if the schema cannot classify a relation or
   *     a field
   */
  public Ast.Program disassemble(JsonNode document) {
    final Run run = new Run();
    final Ast.Program program = run.disassemble(document);
    LOGGER.debug(
        "disassembled plan: {} statements, {} relation nodes",
        program.statements.size(),
        run.relationCount);
    return program;
  }

  /** State of one disassembly. */
  private class Run {
    final Pos pos = new Pos(file, 1, 1, 1, 2);
    final NameGenerator names = new NameGenerator();
    final Map<AnchorKind, Map<Integer, String>> reverseIndex =
        new EnumMap<>(AnchorKind.class);
    final List<Ast.Statement> statements = new ArrayList<>();
    int relationCount = 0;

    Run() {
      for (AnchorKind kind : AnchorKind.values()) {
        reverseIndex.put(kind, new HashMap<>());
      }
    }

    Ast.Program disassemble(JsonNode document) {
      if (!document.isObject()) {
        throw error("plan must be an object", "");
      }
      final Map<String, JsonNode> members = new HashMap<>();
      final Iterator<Map.Entry<String, JsonNode>> fields = document.fields();
      while (fields.hasNext()) {
        final Map.Entry<String, JsonNode> field = fields.next();
        final String key = TOP_LEVEL_KEYS.get(field.getKey());
        if (key == null) {
          throw error("unknown key '" + field.getKey() + "'", "");
        }
        if (members.put(key, field.getValue()) != null) {
          throw error("key '" + key + "' occurs more than once", "");
        }
      }

      int i = 0;
      for (JsonNode entry
          : elements(members.get(Assembler.EXTENSION_URIS),
              Assembler.EXTENSION_URIS)) {
        extensionUri(entry, Assembler.EXTENSION_URIS + "[" + i++ + "]");
      }
      i = 0;
      for (JsonNode entry
          : elements(members.get(Assembler.EXTENSIONS),
              Assembler.EXTENSIONS)) {
        extension(entry, Assembler.EXTENSIONS + "[" + i++ + "]");
      }
      for (JsonNode url
          : elements(members.get(Assembler.EXPECTED_TYPE_URLS),
              Assembler.EXPECTED_TYPE_URLS)) {
        if (!url.isTextual()) {
          throw error("type URL must be a string",
              Assembler.EXPECTED_TYPE_URLS);
        }
        statements.add(ast.protoExtensionDecl(pos, url.textValue()));
      }
      advancedExtensions(members.get(Assembler.ADVANCED_EXTENSIONS));
      i = 0;
      for (JsonNode entry
          : elements(members.get(Assembler.RELATIONS), Assembler.RELATIONS)) {
        planRelation(entry, Assembler.RELATIONS + "[" + i++ + "]");
      }
      return ast.program(statements);
    }

    /** Returns the elements of an optional array member. */
    List<JsonNode> elements(@Nullable JsonNode node, String path) {
      if (node == null) {
        return ImmutableList.of();
      }
      if (!node.isArray()) {
        throw error("expected an array", path);
      }
      return ImmutableList.copyOf(node);
    }

    void extensionUri(JsonNode entry, String path) {
      final Map<String, JsonNode> members =
          members(entry, path, AnchorKind.URI.anchorField, Assembler.URI);
      final int anchor =
          declaredAnchor(AnchorKind.URI, members.get(AnchorKind.URI.anchorField),
              path);
      final JsonNode uri = members.get(Assembler.URI);
      if (uri == null || !uri.isTextual()) {
        throw error("extension URI must have a string 'uri'", path);
      }
      final String name = names.uniquify(rules.uriName(uri.textValue()));
      statements.add(
          ast.usingDecl(pos, ast.id(pos, name), uri.textValue(), anchor));
      reverseIndex.get(AnchorKind.URI).put(anchor, name);
    }

    void extension(JsonNode entry, String path) {
      if (!entry.isObject() || entry.size() != 1) {
        throw error("extension must be an object with a single key", path);
      }
      final String key = entry.fieldNames().next();
      final AnchorKind kind = AnchorKind.ofExtensionKey(key);
      if (kind == null) {
        throw error("unknown extension kind '" + key + "'", path);
      }
      final String path2 = path + "." + key;
      final Map<String, JsonNode> members =
          members(entry.get(key), path2, Assembler.EXTENSION_URI_REFERENCE,
              kind.anchorField, Assembler.NAME);
      final JsonNode uriReference =
          members.get(Assembler.EXTENSION_URI_REFERENCE);
      Ast.Exp uriRef = null;
      if (uriReference != null) {
        if (!isAnchor(uriReference)) {
          throw error("extension URI reference must be a non-negative "
              + "integer", path2);
        }
        uriRef = reference(AnchorKind.URI, uriReference);
      }
      final int anchor =
          declaredAnchor(kind, members.get(kind.anchorField), path2);
      final JsonNode name = members.get(Assembler.NAME);
      if (name == null || !name.isTextual()) {
        throw error("extension must have a string 'name'", path2);
      }
      final String id =
          names.uniquify(rules.extensionName(kind, name.textValue()));
      statements.add(
          ast.extensionDecl(pos, kind, ast.id(pos, id), uriRef,
              name.textValue(), anchor));
      reverseIndex.get(kind).put(anchor, id);
    }

    void advancedExtensions(@Nullable JsonNode node) {
      if (node == null) {
        return;
      }
      final Map<String, JsonNode> members =
          members(node, Assembler.ADVANCED_EXTENSIONS, ENHANCEMENT,
              OPTIMIZATION);
      final JsonNode enhancement = members.get(ENHANCEMENT);
      if (enhancement != null) {
        statements.add(
            ast.advancedExtensionDecl(pos, Op.ENHANCEMENT_DECL,
                exp(ENHANCEMENT, enhancement, ENHANCEMENT)));
      }
      final JsonNode optimization = members.get(OPTIMIZATION);
      if (optimization != null) {
        statements.add(
            ast.advancedExtensionDecl(pos, Op.OPTIMIZATION_DECL,
                exp(OPTIMIZATION, optimization, OPTIMIZATION)));
      }
    }

    /** Handles an element of the "relations" array: a "root" or "rel"
     * wrapper. */
    void planRelation(JsonNode entry, String path) {
      if (!entry.isObject() || entry.size() != 1) {
        throw error("relation must be an object with a single key", path);
      }
      final String key = entry.fieldNames().next();
      final JsonNode value = entry.get(key);
      switch (key) {
      case Assembler.ROOT:
        final String path2 = path + "." + Assembler.ROOT;
        final Map<String, JsonNode> members =
            members(value, path2, Assembler.INPUT, Assembler.NAMES);
        final JsonNode input = members.get(Assembler.INPUT);
        if (input == null) {
          throw error("root relation must have an 'input'", path2);
        }
        final List<String> outputNames = new ArrayList<>();
        for (JsonNode name
            : elements(members.get(Assembler.NAMES),
                path2 + "." + Assembler.NAMES)) {
          if (!name.isTextual()) {
            throw error("relation root names must be strings", path2);
          }
          outputNames.add(name.textValue());
        }
        final String root = relation(input, path2 + "." + Assembler.INPUT);
        statements.add(ast.execute(pos, ast.id(pos, root), outputNames));
        break;

      case Assembler.REL:
        final String rel = relation(value, path + "." + Assembler.REL);
        statements.add(ast.execute(pos, ast.id(pos, rel), null));
        break;

      default:
        throw error("unknown relation wrapper '" + key + "'", path);
      }
    }

    /** Returns whether a value is a relation that the schema knows: an
     * object with a single key that is a relation type. */
    boolean isRelation(JsonNode node) {
      return node.isObject()
          && node.size() == 1
          && schema.isRelationType(node.fieldNames().next());
    }

    /** Emits a "raw" statement for a relation node, after first emitting
     * statements for the relations it contains; returns its identifier. */
    String relation(JsonNode node, String path) {
      final Ast.Exp value;
      if (isRelation(node)) {
        final String type = node.fieldNames().next();
        final Ast.Exp body = exp(type, node.get(type), path + "." + type);
        value =
            ast.object(pos,
                ImmutableList.of(Maps.immutableEntry(type, body)));
      } else {
        checkRelation(node, path);
        value = exp("", node, path);
      }
      final String name = names.uniquify(rules.relationName(relationCount++));
      statements.add(ast.raw(pos, ast.id(pos, name), value));
      return name;
    }

    /** Throws if the schema does not recognize a relation, unless
     * disassembly is not strict. */
    void checkRelation(JsonNode node, String path) {
      if (!strict) {
        return;
      }
      if (!node.isObject() || node.size() != 1) {
        throw schemaError(
            "relation must be an object with a single key", path);
      }
      throw schemaError(
          "unknown relation type '" + node.fieldNames().next() + "'", path);
    }

    /** Converts a value to an expression, replacing relations and anchor
     * references by identifiers. */
    Ast.Exp exp(String messageKey, JsonNode node, String path) {
      switch (node.getNodeType()) {
      case OBJECT:
        final List<Map.Entry<String, Ast.Exp>> members = new ArrayList<>();
        final Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
          final Map.Entry<String, JsonNode> field = fields.next();
          final String key = field.getKey();
          final JsonNode value = field.getValue();
          final String path2 = path + "." + key;
          members.add(
              Maps.immutableEntry(key, member(messageKey, key, value, path2)));
        }
        return ast.object(pos, members);

      case ARRAY:
        final List<Ast.Exp> elements = new ArrayList<>();
        for (int i = 0; i < node.size(); i++) {
          elements.add(exp(messageKey, node.get(i), path + "[" + i + "]"));
        }
        return ast.array(pos, elements);

      case STRING:
        return ast.stringLiteral(pos, node.textValue());

      case NUMBER:
        return literal(node, path);

      case BOOLEAN:
        return ast.id(pos, node.booleanValue() ? "true" : "false");

      case NULL:
        return ast.id(pos, "null");

      default:
        throw error("unexpected value " + node, path);
      }
    }

    /** Converts the value of a field, according to how the schema
     * classifies it. */
    Ast.Exp member(String messageKey, String key, JsonNode value,
        String path) {
      final PlanSchema.FieldKind fieldKind =
          schema.classify(messageKey, key, value);
      switch (fieldKind) {
      case RELATION:
        if (isRelation(value)) {
          return ast.id(pos, relation(value, path));
        }
        checkRelation(value, path);
        break;

      case RELATION_LIST:
        if (value.isArray()) {
          final List<Ast.Exp> elements = new ArrayList<>();
          for (int i = 0; i < value.size(); i++) {
            final JsonNode element = value.get(i);
            final String path2 = path + "[" + i + "]";
            elements.add(
                isRelation(element)
                    ? ast.id(pos, relation(element, path2))
                    : opaque(element, path2));
          }
          return ast.array(pos, elements);
        }
        if (strict) {
          throw schemaError("expected an array of relations", path);
        }
        break;

      case FUNCTION_ANCHOR:
      case TYPE_ANCHOR:
      case TYPE_VARIATION_ANCHOR:
        if (value.isIntegralNumber()) {
          return reference(requireNonNull(fieldKind.anchorKind), value);
        }
        if (strict) {
          throw schemaError("anchor reference must be an integer", path);
        }
        break;

      case PLAIN:
        break;

      default:
        throw new AssertionError(fieldKind);
      }
      return exp(key, value, path);
    }

    /** Converts an element of a relation list that the schema does not
     * recognize as a relation. */
    Ast.Exp opaque(JsonNode node, String path) {
      checkRelation(node, path);
      return exp("", node, path);
    }

    /** Returns the identifier declared for an anchor, or the anchor as an
     * integer literal if none was declared. */
    Ast.Exp reference(AnchorKind kind, JsonNode anchor) {
      if (anchor.canConvertToInt()) {
        final String name = reverseIndex.get(kind).get(anchor.intValue());
        if (name != null) {
          return ast.id(pos, name);
        }
      }
      return ast.numberLiteral(pos, anchor.bigIntegerValue());
    }

    Ast.Literal literal(JsonNode node, String path) {
      if (node.isIntegralNumber()) {
        return ast.numberLiteral(pos, node.bigIntegerValue());
      }
      if (!Double.isFinite(node.doubleValue())) {
        throw error("number out of range", path);
      }
      if (Json.isNegativeZero(node)) {
        return ast.negativeZero(pos);
      }
      return ast.numberLiteral(pos, node.decimalValue());
    }

    /** Returns the anchor declared by an extension URI or extension; if the
     * member is absent, the anchor is 0. */
    int declaredAnchor(AnchorKind kind, @Nullable JsonNode node,
        String path) {
      if (node != null && !isAnchor(node)) {
        throw error(kind.description + " anchor must be a non-negative "
            + "integer", path);
      }
      final int anchor = node == null ? 0 : node.intValue();
      if (reverseIndex.get(kind).containsKey(anchor)) {
        throw error(kind.description + " anchor " + anchor
            + " is declared more than once", path);
      }
      return anchor;
    }

    /** Checks that a value is an object whose keys are among those given,
     * and returns its members. */
    Map<String, JsonNode> members(JsonNode node, String path,
        String... keys) {
      if (!node.isObject()) {
        throw error("expected an object", path);
      }
      final List<String> keyList = ImmutableList.copyOf(keys);
      final Map<String, JsonNode> members = new HashMap<>();
      final Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
      while (fields.hasNext()) {
        final Map.Entry<String, JsonNode> field = fields.next();
        if (!keyList.contains(field.getKey())) {
          throw error("unknown key '" + field.getKey() + "'", path);
        }
        members.put(field.getKey(), field.getValue());
      }
      return members;
    }

    DisassembleException error(String message, String path) {
      return new DisassembleException(message, path, pos);
    }

    SchemaException schemaError(String message, String path) {
      return new SchemaException(message, path, pos);
    }
  }

  /** Returns whether a value is a valid anchor: an integer between 0 and
   * 2<sup>31</sup> - 1. */
  static boolean isAnchor(JsonNode node) {
    return node.isIntegralNumber()
        && node.canConvertToInt()
        && node.intValue() >= 0;
  }
}

// End Disassembler.java
