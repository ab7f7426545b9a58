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

import static java.nio.charset.StandardCharsets.UTF_8;
import static net.hydromatic.planasm.Asm.asm;
import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableMap;
import com.google.common.io.Resources;
import java.io.IOException;
import net.hydromatic.planasm.compile.Assembler;
import net.hydromatic.planasm.json.Json;
import net.hydromatic.planasm.util.Prop;
import org.junit.jupiter.api.Test;

/** Tests that disassembling a plan and assembling the result gives the
 * original plan. */
public class RoundTripTest {
  private static String resource(String name) throws IOException {
    return Resources.toString(Resources.getResource(name), UTF_8);
  }

  /** Plan of TPC-H query 1, whose members are in camelCase. */
  @Test
  void testTpchQ1() throws IOException {
    final String json = resource("plans/tpch_q1.json");
    final JsonNode original = Json.parse(json);
    final String text = Plans.disassemble(json);
    assertThat(text,
        containsString("function fn_lessthanequal = 0::lessthanequal = 0;\n"));
    assertThat(text, containsString("function fn_mult = 0::\"*\" = 3;\n"));
    assertThat(text, containsString("function fn_sub = 0::\"-\" = 4;\n"));
    assertThat(text, containsString("function fn_add = 0::\"+\" = 6;\n"));
    assertThat(text, containsString("\"functionReference\": fn_and,\n"));
    assertThat(text, containsString("// Relation 0\n"));
    assertThat(text, containsString("execute rel_4;\n"));

    final ObjectNode document = Plans.assemble(text);
    assertThat(document.get(Assembler.EXTENSION_URIS),
        is(original.get("extensionUris")));
    assertThat(document.get(Assembler.EXTENSIONS),
        is(original.get(Assembler.EXTENSIONS)));
    assertThat(document.get(Assembler.RELATIONS),
        is(original.get(Assembler.RELATIONS)));
    assertThat(document.get(Assembler.EXPECTED_TYPE_URLS),
        is(original.get("expectedTypeUrls")));

    // Disassembling the reassembled plan gives the same program
    assertThat(Plans.disassemble(Json.toPrettyString(document)), is(text));
  }

  /** Strict disassembly accepts a plan that contains only known
   * relations. */
  @Test
  void testTpchQ1Strict() throws IOException {
    final String json = resource("plans/tpch_q1.json");
    final String text =
        Plans.disassemble(json, "tpch_q1.json",
            ImmutableMap.of(Prop.STRICT, true));
    assertThat(text, is(Plans.disassemble(json)));
  }

  @Test
  void testPrograms() {
    asm("").assertRoundTrip();
    asm("raw r = {}; execute r;").assertRoundTrip();
    asm("using a = \"https://x/a.yaml\" = 3;\n"
            + "function f = a::\"f:i32\" = 7;\n"
            + "type t = a::point;\n"
            + "raw read = {\"read\": {\"baseSchema\": {\"struct\": {\"types\":"
            + " [{\"userDefinedType\": {\"typeReference\": t}}]}}}};\n"
            + "raw filter = {\"filter\": {\"input\": read,"
            + " \"condition\": {\"scalarFunction\": {\"functionReference\": f,"
            + " \"arguments\": ["
            + "{\"value\": {\"literal\": {\"fp64\": 1.5}}},"
            + " {\"value\": {\"literal\": {\"string\":"
            + " \"caf\\u00e9 \\\"x\\\"\\n\"}}}]}}}};\n"
            + "execute filter(\"a\", \"b\");\n"
            + "enhancement {\"@type\": \"t\","
            + " \"value\": [1, 2147483648, -3, 1e300, true, null]};\n"
            + "proto_extension \"type.googleapis.com/x\";\n")
        .assertRoundTrip();
    // Extension that references a URI that is not declared
    asm("function f = 5::f; type t = g; raw r = {\"read\": {\"x\": [f, t]}};"
            + " execute r(\"a\",);")
        .assertRoundTrip();
    // Several plans that share relations
    asm("raw a = {\"read\": {}};\n"
            + "raw j = {\"join\": {\"left\": a, \"right\": a}};\n"
            + "execute j;\n"
            + "execute a;\n"
            + "raw s = {\"set\": {\"inputs\": [a, j, {\"virtual\": 1}]}};\n"
            + "execute s(\"x\");\n")
        .assertRoundTrip();
  }

  @Test
  void testProgramsWithProperties() {
    asm("function f = g; raw r = {\"read\": {\"f\": f}}; execute r;")
        .withProp(Prop.FUNCTION_PREFIX, "func")
        .withProp(Prop.RELATION_PREFIX, "")
        .withProp(Prop.SECTION_COMMENTS, false)
        .assertDisassemble("function func_g = g = 1;\n"
            + "\n"
            + "raw _0 = {\n"
            + "  \"read\": {\n"
            + "    \"f\": 1\n"
            + "  }\n"
            + "};\n"
            + "\n"
            + "execute _0;\n")
        .assertRoundTrip();
  }
}

// End RoundTripTest.java
