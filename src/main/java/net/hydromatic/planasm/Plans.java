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
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableMap;
import java.util.Map;
import net.hydromatic.planasm.ast.Ast;
import net.hydromatic.planasm.ast.AstWriter;
import net.hydromatic.planasm.ast.Pos;
import net.hydromatic.planasm.compile.Assembler;
import net.hydromatic.planasm.compile.DisassembleException;
import net.hydromatic.planasm.compile.Disassembler;
import net.hydromatic.planasm.compile.NamingRules;
import net.hydromatic.planasm.compile.StandardPlanSchema;
import net.hydromatic.planasm.json.Json;
import net.hydromatic.planasm.parse.Parsers;
import net.hydromatic.planasm.util.Prop;

/** Entry points that convert between the text of a program and the text of
 * a plan document. */
public final class Plans {
  private Plans() {}

  /** Parses a program. */
  public static Ast.Program parse(String text, String file) {
    return Parsers.parseProgram(text, file);
  }

  /** Assembles the text of a program into a plan document. */
  public static ObjectNode assemble(String text) {
    return assemble(text, "");
  }

  /** Assembles the text of a program into a plan document; errors refer to
   * {@code file}. */
  public static ObjectNode assemble(String text, String file) {
    return new Assembler().assemble(parse(text, file));
  }

  /**
   * Assembles the text of a program, and returns the text of the plan
   * document followed by a newline.
   *
   * <p>The {@link Prop#PRETTY_JSON} property controls the layout.
   */
  public static String assembleToString(
      String text, String file, Map<Prop, Object> propMap) {
    final ObjectNode document = assemble(text, file);
    return (Prop.PRETTY_JSON.booleanValue(propMap)
            ? Json.toPrettyString(document)
            : Json.toCompactString(document))
        + "\n";
  }

  /** Disassembles the text of a plan document, with default properties. */
  public static String disassemble(String json) {
    return disassemble(json, "", ImmutableMap.of());
  }

  /**
   * Disassembles the text of a plan document, and returns the text of a
   * program.
   *
   * <p>The naming properties ({@link Prop#URI_PREFIX} etc.) control the
   * identifiers, {@link Prop#STRICT} controls how values that are not
   * recognized as relations are handled, and {@link Prop#SECTION_COMMENTS}
   * controls the layout.
   *
   * @throws DisassembleException if the text is not valid JSON or is not a
   *     valid plan
   */
  public static String disassemble(
      String json, String file, Map<Prop, Object> propMap) {
    final JsonNode document;
    try {
      document = Json.parse(json);
    } catch (IllegalArgumentException e) {
      throw new DisassembleException(
          e.getMessage(), "", new Pos(file, 1, 1, 1, 2));
    }
    return render(disassemble(document, file, propMap), propMap);
  }

  /** Disassembles a plan document into a program. */
  public static Ast.Program disassemble(
      JsonNode document, String file, Map<Prop, Object> propMap) {
    final Disassembler disassembler =
        new Disassembler(
            NamingRules.of(propMap),
            StandardPlanSchema.INSTANCE,
            Prop.STRICT.booleanValue(propMap),
            file);
    return disassembler.disassemble(document);
  }

  /** Renders a program as text. */
  public static String render(Ast.Program program, Map<Prop, Object> propMap) {
    return program.unparse(
        new AstWriter(Prop.SECTION_COMMENTS.booleanValue(propMap)));
  }
}

// End Plans.java
