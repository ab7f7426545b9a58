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
package net.hydromatic.planasm.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Comparator;

/**
 * Utilities for the JSON value model.
 *
 * <p>Values are Jackson {@link JsonNode} trees. Numbers are created the same
 * way that Jackson's own reader creates them: integers become
 * {@code IntNode}, {@code LongNode} or {@code BigIntegerNode} depending on
 * their magnitude, and reals (including negative zero) become
 * {@code DoubleNode}. Therefore a document
 * that was assembled and a document that was read from text compare equal
 * using {@link JsonNode#equals(Object)}.
 */
public final class Json {
  private Json() {}

  private static final BigInteger MIN_INT = BigInteger.valueOf(Integer.MIN_VALUE);
  private static final BigInteger MAX_INT = BigInteger.valueOf(Integer.MAX_VALUE);
  private static final BigInteger MIN_LONG = BigInteger.valueOf(Long.MIN_VALUE);
  private static final BigInteger MAX_LONG = BigInteger.valueOf(Long.MAX_VALUE);

  /** Reads a single document; text after the first value is an error. */
  private static final ObjectMapper MAPPER =
      JsonMapper.builder()
          .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
          .build();

  /** Compares nodes by value; numbers of different representations that
   * have the same value are equal. */
  private static final Comparator<JsonNode> VALUE_COMPARATOR =
      (n0, n1) -> {
        if (n0.isNumber() && n1.isNumber()) {
          return n0.decimalValue().compareTo(n1.decimalValue());
        }
        return n0.equals(n1) ? 0 : 1;
      };

  /** Returns the factory for creating nodes. */
  public static JsonNodeFactory factory() {
    return JsonNodeFactory.instance;
  }

  /** Creates an empty object. */
  public static ObjectNode object() {
    return factory().objectNode();
  }

  /** Creates an integer node. */
  public static JsonNode number(BigInteger i) {
    if (i.compareTo(MIN_INT) >= 0 && i.compareTo(MAX_INT) <= 0) {
      return factory().numberNode(i.intValue());
    }
    if (i.compareTo(MIN_LONG) >= 0 && i.compareTo(MAX_LONG) <= 0) {
      return factory().numberNode(i.longValue());
    }
    return factory().numberNode(i);
  }

  /**
   * Creates a real node.
   *
   * @throws IllegalArgumentException if the value is too large for a double
   */
  public static JsonNode number(BigDecimal d) {
    final double v = d.doubleValue();
    if (Double.isInfinite(v)) {
      throw new IllegalArgumentException("number out of range: " + d);
    }
    return factory().numberNode(v);
  }

  /** Creates a real node from a double. */
  public static JsonNode number(double d) {
    return factory().numberNode(d);
  }

  /** Returns whether a node is a real whose value is negative zero. */
  public static boolean isNegativeZero(JsonNode node) {
    return node.isFloatingPointNumber()
        && Double.doubleToRawLongBits(node.doubleValue())
            == Double.doubleToRawLongBits(-0d);
  }

  /** Returns whether a node is an integer that fits in a Java {@code int}. */
  public static boolean isInt(JsonNode node) {
    return node.isIntegralNumber() && node.canConvertToInt();
  }

  /**
   * Parses a JSON document.
   *
   * @throws IllegalArgumentException if the text is not valid JSON
   */
  public static JsonNode parse(String text) {
    try {
      return MAPPER.readTree(text);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException(
          "invalid JSON: " + e.getOriginalMessage(), e);
    }
  }

  /** Converts a node to JSON text with one member per line. */
  public static String toPrettyString(JsonNode node) {
    return node.toPrettyString();
  }

  /** Converts a node to JSON text on a single line. */
  public static String toCompactString(JsonNode node) {
    return node.toString();
  }

  /**
   * Returns whether two values are structurally equal.
   *
   * <p>The order of members within an object does not matter, and numbers
   * are compared by value, so {@code 1} equals {@code 1.0}.
   */
  public static boolean equalsStructurally(JsonNode n0, JsonNode n1) {
    return n0.equals(VALUE_COMPARATOR, n1);
  }
}

// End Json.java
