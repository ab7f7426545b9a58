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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.fail;

import com.fasterxml.jackson.databind.JsonNode;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import net.hydromatic.planasm.ast.Ast;
import net.hydromatic.planasm.ast.Pos;
import net.hydromatic.planasm.ast.Visitor;
import net.hydromatic.planasm.json.Json;
import net.hydromatic.planasm.parse.Parsers;
import net.hydromatic.planasm.util.Prop;
import org.junit.jupiter.api.Test;

/** Tests for various utility classes. */
public class UtilTest {
  /** Unit tests for {@link Pos}. */
  @Test
  void testPos() {
    final BiConsumer<String, String> check =
        (s, posString) -> {
          final Map.Entry<String, Pos> pos = Pos.split(s, '$', "stdIn");
          assertThat(pos.getKey(), is("abcdefgh"));
          assertThat(pos.getValue(), notNullValue());
          assertThat(pos.getValue(), hasToString(posString));
        };
    // starts and ends in middle
    check.accept("abc$def$gh", "stdIn:1.4-1.7");
    // ends at end
    check.accept("abc$defgh$", "stdIn:1.4-1.9");
    // starts at start
    check.accept("$abc$defgh", "stdIn:1.1-1.4");
    // one character long
    check.accept("abc$d$efgh", "stdIn:1.4");

    // spans multiple lines
    final Map.Entry<String, Pos> pos =
        Pos.split("abc\nd$e\n\nfg$h", '$', "stdIn");
    assertThat(pos.getKey(), is("abc\nde\n\nfgh"));
    assertThat(pos.getValue(), hasToString("stdIn:2.2-4.3"));

    // too many, too few
    Consumer<String> checkTooFew =
        s -> {
          try {
            final Map.Entry<String, Pos> pos4 = Pos.split(s, '$', "stdIn");
            fail("expected error, got " + pos4);
          } catch (IllegalArgumentException e) {
            assertThat(
                e.getMessage(),
                is("expected exactly two occurrences of delimiter, '$'"));
          }
        };
    checkTooFew.accept("$abc$de$f");
    checkTooFew.accept("abc$def");
    checkTooFew.accept("abcdef");

    // no file name
    assertThat(new Pos("", 3, 4, 3, 5), hasToString("3.4"));
  }

  /** Tests {@link Parsers#isIdentifier(String)}. */
  @Test
  void testIsIdentifier() {
    assertThat(Parsers.isIdentifier("x"), is(true));
    assertThat(Parsers.isIdentifier("_0"), is(true));
    assertThat(Parsers.isIdentifier("fn_add_2"), is(true));
    assertThat(Parsers.isIdentifier("true"), is(true));
    assertThat(Parsers.isIdentifier(""), is(false));
    assertThat(Parsers.isIdentifier("0x"), is(false));
    assertThat(Parsers.isIdentifier("a-b"), is(false));
    assertThat(Parsers.isIdentifier("raw"), is(false));
    assertThat(Parsers.isIdentifier("type_variation"), is(false));
    assertThat(Parsers.isIdentifier("Raw"), is(true));
  }

  /** Tests {@link Parsers#quoteString(String)} and
   * {@link Parsers#unquoteString(String)}. */
  @Test
  void testQuote() {
    assertThat(Parsers.quoteString("abc"), is("\"abc\""));
    assertThat(Parsers.quoteString("a\"b\\c\n\t"),
        is("\"a\\\"b\\\\c\\n\\t\""));
    assertThat(Parsers.quoteString("caf\u00e9 \u0001"),
        is("\"caf\\u00E9 \\u0001\""));
    assertThat(Parsers.quoteString("a/b"), is("\"a/b\""));

    assertThat(Parsers.unquoteString("\"abc\""), is("abc"));
    assertThat(Parsers.unquoteString("\"a\\/b\\u00e9\\\"\""), is("a/b\u00e9\""));
    assertThat(Parsers.unquoteString("\"\\b\\f\\r\""), is("\b\f\r"));

    final String s = "x \"y\" \\ \u00ff \u20ac \n";
    assertThat(Parsers.unquoteString(Parsers.quoteString(s)), is(s));

    assertThrows(IllegalArgumentException.class,
        () -> Parsers.unquoteString("\"\\q\""));
    assertThrows(IllegalArgumentException.class,
        () -> Parsers.unquoteString("abc"));
  }

  /** Tests {@link Json}. */
  @Test
  void testJson() {
    assertThat(Json.number(BigInteger.valueOf(5)).isInt(), is(true));
    assertThat(Json.number(BigInteger.valueOf(-5_000_000_000L)).isLong(),
        is(true));
    assertThat(Json.number(BigInteger.TEN.pow(20)).isBigInteger(), is(true));
    assertThat(Json.number(new BigDecimal("2.5")).isDouble(), is(true));
    assertThrows(IllegalArgumentException.class,
        () -> Json.number(new BigDecimal("1e999")));

    assertThat(Json.isInt(Json.parse("3")), is(true));
    assertThat(Json.isInt(Json.parse("3.0")), is(false));
    assertThat(Json.isInt(Json.parse("\"3\"")), is(false));
    assertThat(Json.isInt(Json.parse("3000000000")), is(false));

    final JsonNode a = Json.parse("{\"a\": 1, \"b\": [1.0, \"x\"]}");
    final JsonNode b = Json.parse("{\"b\": [1, \"x\"], \"a\": 1.0}");
    assertThat(Json.equalsStructurally(a, b), is(true));
    assertThat(a.equals(b), is(false));
    assertThat(
        Json.equalsStructurally(a, Json.parse("{\"a\": 1, \"b\": [1, \"y\"]}")),
        is(false));

    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class, () -> Json.parse("[1,"));
    assertThat(e.getMessage().startsWith("invalid JSON: "), is(true));
  }

  /** Tests {@link Prop}. */
  @Test
  void testProp() {
    assertThat(Prop.lookup("relationPrefix"), is(Prop.RELATION_PREFIX));
    assertThat(Prop.lookup("RELATION_PREFIX"), is(Prop.RELATION_PREFIX));
    assertThrows(IllegalArgumentException.class, () -> Prop.lookup("x"));

    final Map<Prop, Object> map = new HashMap<>();
    assertThat(Prop.STRICT.booleanValue(map), is(false));
    assertThat(Prop.SECTION_COMMENTS.booleanValue(map), is(true));
    assertThat(Prop.FUNCTION_PREFIX.stringValue(map), is("fn"));
    assertThat(Prop.TYPE_PREFIX.get(map), is((Object) "typ"));

    Prop.STRICT.setLenient(map, "TRUE");
    assertThat(Prop.STRICT.booleanValue(map), is(true));
    Prop.TYPE_PREFIX.setLenient(map, "t");
    assertThat(Prop.TYPE_PREFIX.stringValue(map), is("t"));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.STRICT.setLenient(map, "yes"));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.STRICT.set(map, "true"));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.STRICT.set(map, null));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.STRICT.stringValue(map));
  }

  /** Tests that {@link Visitor} reaches every identifier. */
  @Test
  void testVisitor() {
    final Ast.Program program =
        Plans.parse("using u = \"u\";\n"
            + "function f = u::g;\n"
            + "raw r = {\"a\": [f, {\"b\": true}], \"c\": 1};\n"
            + "enhancement x;\n"
            + "execute r;\n", "stdIn");
    final List<String> names = new ArrayList<>();
    final Visitor visitor =
        new Visitor() {
          @Override
          protected void visit(Ast.Id id) {
            names.add(id.name);
          }
        };
    program.accept(visitor);
    assertThat(names.toString(), is("[u, f, u, r, f, true, x, r]"));
  }
}

// End UtilTest.java
