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
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import net.hydromatic.planasm.ast.AnchorKind;
import net.hydromatic.planasm.ast.Ast;
import net.hydromatic.planasm.ast.Visitor;
import net.hydromatic.planasm.json.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts a program in the plan assembly language into a plan document.
 *
 * <p>Statements are executed in document order. Each call to
 * {@link #assemble} has its own symbol table, anchor counters and document,
 * so an assembler may be used by several threads at once.
 */
public class Assembler {
  private static final Logger LOGGER = LoggerFactory.getLogger(Assembler.class);

  public static final String EXTENSION_URIS = "extension_uris";
  public static final String EXTENSIONS = "extensions";
  public static final String RELATIONS = "relations";
  public static final String ADVANCED_EXTENSIONS = "advanced_extensions";
  public static final String EXPECTED_TYPE_URLS = "expected_type_urls";

  static final String URI = "uri";
  static final String EXTENSION_URI_REFERENCE = "extensionUriReference";
  static final String NAME = "name";
  static final String ROOT = "root";
  static final String REL = "rel";
  static final String INPUT = "input";
  static final String NAMES = "names";

  /** Assembles a program. */
  public ObjectNode assemble(Ast.Program program) {
    return assemble(program.statements);
  }

  /**
   * Assembles a list of statements.
   *
   * @throws AssembleException if a statement cannot be executed
   */
  public ObjectNode assemble(List<? extends Ast.Statement> statements) {
    final Run run = new Run();
    final ObjectNode document = run.execute(statements);
    if (LOGGER.isDebugEnabled()) {
      LOGGER.debug(
          "assembled {} statements: {} extension URIs, {} extensions, "
              + "{} relations",
          statements.size(),
          run.extensionUris.size(),
          run.extensions.size(),
          run.relations.size());
    }
    return document;
  }

  /** State of one assembly. */
  private static class Run extends Visitor {
    final Environment env = new Environment();
    final Anchors anchors = new Anchors();
    final ArrayNode extensionUris = Json.factory().arrayNode();
    final ArrayNode extensions = Json.factory().arrayNode();
    final ArrayNode relations = Json.factory().arrayNode();
    final ObjectNode advancedExtensions = Json.object();
    final ArrayNode expectedTypeUrls = Json.factory().arrayNode();

    ObjectNode execute(List<? extends Ast.Statement> statements) {
      for (Ast.Statement statement : statements) {
        if (LOGGER.isTraceEnabled()) {
          LOGGER.trace("{}: {}", statement.pos, statement);
        }
        accept(statement);
      }
      final ObjectNode document = Json.object();
      document.set(EXTENSION_URIS, extensionUris);
      document.set(EXTENSIONS, extensions);
      document.set(RELATIONS, relations);
      document.set(ADVANCED_EXTENSIONS, advancedExtensions);
      document.set(EXPECTED_TYPE_URLS, expectedTypeUrls);
      return document;
    }

    @Override
    protected void visit(Ast.UsingDecl usingDecl) {
      final int anchor =
          anchors.allocate(AnchorKind.URI, usingDecl.anchor, usingDecl.pos);
      final ObjectNode entry = extensionUris.addObject();
      entry.put(AnchorKind.URI.anchorField, anchor);
      entry.put(URI, usingDecl.uri);
      env.bind(usingDecl.id, Json.factory().numberNode(anchor));
    }

    @Override
    protected void visit(Ast.ExtensionDecl extensionDecl) {
      Integer uriReference = null;
      if (extensionDecl.uriRef != null) {
        final JsonNode node = eval(extensionDecl.uriRef);
        if (!Json.isInt(node) || node.intValue() < 0) {
          throw new AssembleException(
              "extension URI reference must be a non-negative integer, "
                  + "was "
                  + node,
              extensionDecl.uriRef.pos);
        }
        uriReference = node.intValue();
      }
      final AnchorKind kind = extensionDecl.kind;
      final int anchor =
          anchors.allocate(kind, extensionDecl.anchor, extensionDecl.pos);
      final ObjectNode body =
          extensions.addObject().putObject(requireNonNull(kind.extensionKey));
      if (uriReference != null) {
        body.put(EXTENSION_URI_REFERENCE, uriReference.intValue());
      }
      body.put(kind.anchorField, anchor);
      body.put(NAME, extensionDecl.name);
      env.bind(extensionDecl.id, Json.factory().numberNode(anchor));
    }

    @Override
    protected void visit(Ast.ProtoExtensionDecl protoExtensionDecl) {
      expectedTypeUrls.add(protoExtensionDecl.url);
    }

    @Override
    protected void visit(Ast.AdvancedExtensionDecl advancedExtensionDecl) {
      advancedExtensions.set(
          advancedExtensionDecl.fieldName(),
          eval(advancedExtensionDecl.value));
    }

    @Override
    protected void visit(Ast.Execute execute) {
      final JsonNode relation = eval(execute.relation);
      final ObjectNode entry = relations.addObject();
      if (execute.names != null) {
        final ObjectNode root = entry.putObject(ROOT);
        root.set(INPUT, relation);
        final ArrayNode names = root.putArray(NAMES);
        execute.names.forEach(names::add);
      } else {
        entry.set(REL, relation);
      }
    }

    @Override
    protected void visit(Ast.Raw raw) {
      env.bind(raw.id, eval(raw.value));
    }

    /** Evaluates a JSON expression. The result is a new tree that shares no
     * nodes with the symbol table. */
    JsonNode eval(Ast.Exp exp) {
      switch (exp.op) {
      case ID:
        final Ast.Id id = (Ast.Id) exp;
        switch (id.name) {
        case "true":
          return Json.factory().booleanNode(true);
        case "false":
          return Json.factory().booleanNode(false);
        case "null":
          return Json.factory().nullNode();
        default:
          return env.get(id).deepCopy();
        }

      case STRING_LITERAL:
        return Json.factory().textNode((String) ((Ast.Literal) exp).value);

      case NUMBER_LITERAL:
        final Object value = ((Ast.Literal) exp).value;
        if (value instanceof BigInteger) {
          return Json.number((BigInteger) value);
        }
        if (value instanceof Double) {
          return Json.number((Double) value);
        }
        try {
          return Json.number((BigDecimal) value);
        } catch (IllegalArgumentException e) {
          throw new AssembleException(e.getMessage(), exp.pos, e);
        }

      case ARRAY:
        final ArrayNode array = Json.factory().arrayNode();
        for (Ast.Exp element : ((Ast.ArrayExp) exp).elements) {
          array.add(eval(element));
        }
        return array;

      case OBJECT:
        final ObjectNode object = Json.object();
        for (Map.Entry<String, Ast.Exp> member
            : ((Ast.ObjectExp) exp).members) {
          object.set(member.getKey(), eval(member.getValue()));
        }
        return object;

      default:
        throw new AssertionError("unexpected " + exp.op);
      }
    }
  }
}

// End Assembler.java
