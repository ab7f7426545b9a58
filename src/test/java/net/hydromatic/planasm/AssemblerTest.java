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

import static net.hydromatic.planasm.Asm.asm;
import static net.hydromatic.planasm.Asm.asmE;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;
import net.hydromatic.planasm.compile.AssembleException;
import net.hydromatic.planasm.compile.UnboundIdentifierException;
import net.hydromatic.planasm.json.Json;
import org.junit.jupiter.api.Test;

/** Tests the assembler. */
public class AssemblerTest {
  /** The example from the documentation: one extension URI, one function
   * and one root relation. */
  @Test
  void testEndToEnd() {
    final String text = "using u = \"functions.yaml\";\n"
        + "function f = u::\"add\";\n"
        + "raw lit = {\"literal\": {\"i32\": 1}};\n"
        + "execute lit(\"out\");\n";
    asm(text)
        .assertAssemble("{\n"
            + "  \"extension_uris\": [\n"
            + "    {\"extensionUriAnchor\": 1, \"uri\": \"functions.yaml\"}\n"
            + "  ],\n"
            + "  \"extensions\": [\n"
            + "    {\"extensionFunction\": {\"extensionUriReference\": 1,\n"
            + "      \"functionAnchor\": 1, \"name\": \"add\"}}\n"
            + "  ],\n"
            + "  \"relations\": [\n"
            + "    {\"root\": {\"input\": {\"literal\": {\"i32\": 1}},\n"
            + "      \"names\": [\"out\"]}}\n"
            + "  ],\n"
            + "  \"advanced_extensions\": {},\n"
            + "  \"expected_type_urls\": []\n"
            + "}")
        .assertRoundTrip();
  }

  @Test
  void testEmptyProgram() {
    asm("")
        .assertAssemble("{\"extension_uris\": [], \"extensions\": [],"
            + " \"relations\": [], \"advanced_extensions\": {},"
            + " \"expected_type_urls\": []}");
  }

  /** The top-level members are always present, in a fixed order. */
  @Test
  void testTopLevelOrder() {
    final ObjectNode document =
        asm("proto_extension \"p\"; raw r = 1; execute r;").assemble();
    assertThat(ImmutableList.copyOf(document.fieldNames()),
        is(
            ImmutableList.of("extension_uris", "extensions", "relations",
                "advanced_extensions", "expected_type_urls")));
  }

  @Test
  void testAnchorOverride() {
    asm("using a = \"x.yaml\";\n"
            + "using b = \"y.yaml\" = 5;\n"
            + "using c = \"z.yaml\";\n"
            + "raw r = [a, b, c];\n"
            + "execute r;")
        .assertAssemble(document -> {
          final JsonNode uris = document.get("extension_uris");
          assertThat(uris.size(), is(3));
          assertThat(uris.get(0).get("extensionUriAnchor").intValue(), is(1));
          assertThat(uris.get(1).get("extensionUriAnchor").intValue(), is(5));
          assertThat(uris.get(2).get("extensionUriAnchor").intValue(), is(6));
          assertThat(uris.get(2).get("uri").textValue(), is("z.yaml"));
          assertThat(Json.toCompactString(document.get("relations")),
              is("[{\"rel\":[1,5,6]}]"));
        });
  }

  /** Each kind of anchor has its own counter. */
  @Test
  void testAnchorKinds() {
    asm("using u = \"u.yaml\";\n"
            + "function f = u::f;\n"
            + "type t = u::t;\n"
            + "type_variation v = u::v;\n"
            + "function g = u::g = 10;\n"
            + "function h = u::h;\n"
            + "raw r = [u, f, t, v, g, h];\n"
            + "execute r;")
        .assertAssemble("{\n"
            + "  \"extension_uris\": [{\"extensionUriAnchor\": 1,"
            + " \"uri\": \"u.yaml\"}],\n"
            + "  \"extensions\": [\n"
            + "    {\"extensionFunction\": {\"extensionUriReference\": 1,"
            + " \"functionAnchor\": 1, \"name\": \"f\"}},\n"
            + "    {\"extensionType\": {\"extensionUriReference\": 1,"
            + " \"typeAnchor\": 1, \"name\": \"t\"}},\n"
            + "    {\"extensionTypeVariation\": {\"extensionUriReference\": 1,"
            + " \"typeVariationAnchor\": 1, \"name\": \"v\"}},\n"
            + "    {\"extensionFunction\": {\"extensionUriReference\": 1,"
            + " \"functionAnchor\": 10, \"name\": \"g\"}},\n"
            + "    {\"extensionFunction\": {\"extensionUriReference\": 1,"
            + " \"functionAnchor\": 11, \"name\": \"h\"}}\n"
            + "  ],\n"
            + "  \"relations\": [{\"rel\": [1, 1, 1, 1, 10, 11]}],\n"
            + "  \"advanced_extensions\": {},\n"
            + "  \"expected_type_urls\": []\n"
            + "}")
        .assertRoundTrip();
  }

  @Test
  void testUriReferences() {
    // No URI reference; the member is omitted
    asm("function f = g;")
        .assertAssemble(document ->
            assertThat(Json.toCompactString(document.get("extensions")),
                is("[{\"extensionFunction\":"
                    + "{\"functionAnchor\":1,\"name\":\"g\"}}]")));
    // Integer URI reference, and explicit anchor 0
    asm("function f = 0::g = 0;")
        .assertAssemble(document ->
            assertThat(Json.toCompactString(document.get("extensions")),
                is("[{\"extensionFunction\":{\"extensionUriReference\":0,"
                    + "\"functionAnchor\":0,\"name\":\"g\"}}]")));
    // A "raw" binding that holds an integer may be used as a reference
    asm("raw x = 7; function f = x::g;")
        .assertAssemble(document ->
            assertThat(
                document.get("extensions").get(0).get("extensionFunction")
                    .get("extensionUriReference").intValue(),
                is(7)));
    asmE("raw x = \"s\"; function f = $x$::g;")
        .assertAssembleThrows(AssembleException.class,
            "extension URI reference must be a non-negative integer");
    asmE("raw x = -1; type t = $x$::g;")
        .assertAssembleThrows(AssembleException.class,
            "extension URI reference must be a non-negative integer");
    asmE("function f = $u$::g;")
        .assertAssembleThrows(UnboundIdentifierException.class,
            "unbound identifier: u");
  }

  @Test
  void testForwardReference() {
    asmE("execute $r$; raw r = {};")
        .assertAssembleThrows(UnboundIdentifierException.class,
            "unbound identifier: r");
    asmE("raw x = {\"a\": [1, $y$]}; raw y = 2;")
        .assertAssembleThrows(UnboundIdentifierException.class,
            "unbound identifier: y");
    asmE("enhancement $e$;")
        .assertAssembleThrows(UnboundIdentifierException.class,
            "unbound identifier: e");
  }

  @Test
  void testRedefinition() {
    asm("raw x = 1; raw y = x; raw x = 2; raw z = x; raw r = [y, z];"
            + " execute r;")
        .assertAssemble(document ->
            assertThat(Json.toCompactString(document.get("relations")),
                is("[{\"rel\":[1,2]}]")));
  }

  @Test
  void testTrailingCommas() {
    final JsonNode x =
        asm("raw x = [1, 2, 3,]; execute x;").assemble().get("relations");
    final JsonNode y =
        asm("raw y = [1, 2, 3]; execute y;").assemble().get("relations");
    assertThat(x, is(y));
    asm("raw x = {\"a\": 1, \"b\": [true,],}; execute x;")
        .assertAssemble("{\"extension_uris\": [], \"extensions\": [],"
            + " \"relations\": [{\"rel\": {\"a\": 1, \"b\": [true]}}],"
            + " \"advanced_extensions\": {}, \"expected_type_urls\": []}");
  }

  @Test
  void testReservedWords() {
    asm("raw x = [true, false, null]; execute x;")
        .assertAssemble(document ->
            assertThat(Json.toCompactString(document.get("relations")),
                is("[{\"rel\":[true,false,null]}]")));
    asmE("raw $true$ = 1;")
        .assertAssembleThrows(AssembleException.class,
            "cannot bind reserved word 'true'");
    asmE("using $null$ = \"u\";")
        .assertAssembleThrows(AssembleException.class,
            "cannot bind reserved word 'null'");
  }

  /** If an object has the same key twice, the last value wins. */
  @Test
  void testDuplicateKey() {
    asm("raw x = {\"a\": 1, \"b\": 2, \"a\": 3}; execute x;")
        .assertAssemble(document ->
            assertThat(Json.toCompactString(document.get("relations")),
                is("[{\"rel\":{\"a\":3,\"b\":2}}]")));
  }

  @Test
  void testAnchorCollision() {
    asmE("using a = \"a\" = 2; $using b = \"b\" = 2;$")
        .assertAssembleThrows(AssembleException.class,
            "extension URI anchor 2 is already declared");
    asmE("function f = g = 3; function g = h = 1; function h = i = 2;"
            + " $function i = j;$")
        .assertAssembleThrows(AssembleException.class,
            "function anchor 3 is already declared");
  }

  @Test
  void testExecute() {
    asm("raw r = {}; execute r(); execute r(\"a\", \"b\"); execute r;")
        .assertAssemble(document ->
            assertThat(Json.toCompactString(document.get("relations")),
                is("[{\"root\":{\"input\":{},\"names\":[]}},"
                    + "{\"root\":{\"input\":{},\"names\":[\"a\",\"b\"]}},"
                    + "{\"rel\":{}}]")));
  }

  @Test
  void testAdvancedExtensions() {
    asm("enhancement 1; optimization []; enhancement {\"x\": 2};"
            + " proto_extension \"a\"; proto_extension \"b\";")
        .assertAssemble("{\"extension_uris\": [], \"extensions\": [],"
            + " \"relations\": [],"
            + " \"advanced_extensions\": {\"enhancement\": {\"x\": 2},"
            + " \"optimization\": []},"
            + " \"expected_type_urls\": [\"a\", \"b\"]}")
        .assertRoundTrip();
  }

  /** Numbers are represented the same way that Jackson reads them. */
  @Test
  void testNumbers() {
    final JsonNode rel =
        asm("raw x = [1, 2147483648, 12345678901234567890, 1.5, -0.25e2];"
                + " execute x;")
            .assemble().get("relations").get(0).get("rel");
    assertThat(rel.get(0).isInt(), is(true));
    assertThat(rel.get(1).isLong(), is(true));
    assertThat(rel.get(2).isBigInteger(), is(true));
    assertThat(rel.get(3).isDouble(), is(true));
    assertThat(rel.get(4).doubleValue(), is(-25d));
    assertThat(rel,
        is(Json.parse("[1, 2147483648, 12345678901234567890, 1.5, -25.0]")));
    asmE("raw x = $1e400$;")
        .assertAssembleThrows(AssembleException.class, "number out of range");
  }

  /** Negative zero keeps its sign, as it does when Jackson reads it. */
  @Test
  void testNegativeZero() {
    final JsonNode rel =
        asm("raw z = [-0.0, 0.0, -0, -0e3]; execute z;")
            .assemble().get("relations").get(0).get("rel");
    assertThat(rel, is(Json.parse("[-0.0, 0.0, -0, -0e3]")));
    assertThat(Json.isNegativeZero(rel.get(0)), is(true));
    assertThat(Json.isNegativeZero(rel.get(1)), is(false));
    assertThat(rel.get(2).isInt(), is(true));
    assertThat(Json.isNegativeZero(rel.get(3)), is(true));
    asm("raw z = [-0.0, 0.0]; execute z;").assertRoundTrip();
  }

  /** A value bound by "raw" is copied each time it is used. */
  @Test
  void testBindingsAreCopied() {
    final ObjectNode document =
        asm("raw a = {\"x\": [1]}; raw b = [a, a]; execute b; execute a;")
            .assemble();
    final JsonNode relations = document.get("relations");
    assertThat(relations.get(0).get("rel").get(0)
        == relations.get(0).get("rel").get(1), is(false));
    assertThat(relations.get(1).get("rel"),
        is(relations.get(0).get("rel").get(0)));
  }

  @Test
  void testDeterministic() {
    final String text = "using u = \"u\"; function f = u::f;"
        + " raw r = {\"read\": {\"f\": f}}; execute r(\"a\");";
    final String json0 = Json.toPrettyString(asm(text).assemble());
    final String json1 = Json.toPrettyString(asm(text).assemble());
    assertThat(json1, is(json0));
  }
}

// End AssemblerTest.java
