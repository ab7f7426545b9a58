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
package net.hydromatic.planasm.parse;

import static com.google.common.base.Preconditions.checkArgument;

import java.io.StringReader;
import java.util.regex.Pattern;
import net.hydromatic.planasm.ast.Ast;
import net.hydromatic.planasm.ast.Op;

/** Utilities for parsing. */
public final class Parsers {
  private Parsers() {}

  private static final Pattern IDENTIFIER =
      Pattern.compile("[a-zA-Z_][a-zA-Z0-9_]*");

  private static final char[] HEX = "0123456789ABCDEF".toCharArray();

  /**
   * Parses a program.
   *
   * @param text Source text
   * @param file Name of the file that the text came from, for error positions
   * @throws PlanParseException if the text is not a valid program
   */
  public static Ast.Program parseProgram(String text, String file) {
    final PlanParserImpl parser = new PlanParserImpl(new StringReader(text));
    parser.setFile(file);
    try {
      return parser.program();
    } catch (ParseException e) {
      throw PlanParseException.of(e, file);
    }
  }

  /**
   * Returns whether a string can be written as an identifier: it matches
   * {@code [a-zA-Z_][a-zA-Z0-9_]*} and is not a keyword.
   */
  public static boolean isIdentifier(String s) {
    return IDENTIFIER.matcher(s).matches() && !Op.KEYWORDS.contains(s);
  }

  /**
   * Given quoted string {@code "abc"} returns {@code abc}; {@code "\t"} returns
   * the tab character.
   *
   * <p>The escapes are those of JSON: {@code \" \\ \/ \b \f \n \r \t} and
   * {@code \}{@code uXXXX}.
   */
  public static String unquoteString(String s) {
    checkArgument(s.length() >= 2);
    checkArgument(s.charAt(0) == '"');
    checkArgument(s.charAt(s.length() - 1) == '"');
    s = s.substring(1, s.length() - 1);
    if (!s.contains("\\")) {
      // There are no escaped characters. Take the quick route.
      return s;
    }
    final StringBuilder b = new StringBuilder();
    for (int i = 0; i < s.length(); ) {
      final char c = s.charAt(i++);
      if (c != '\\') {
        b.append(c);
        continue;
      }
      if (i >= s.length()) {
        throw new IllegalArgumentException(
            "illegal escape; no character after \\");
      }
      final char c2 = s.charAt(i++);
      switch (c2) {
      case '"':
      case '\\':
      case '/':
        b.append(c2);
        break;
      case 'b':
        b.append('\b');
        break;
      case 'f':
        b.append('\f');
        break;
      case 'n':
        b.append('\n');
        break;
      case 'r':
        b.append('\r');
        break;
      case 't':
        b.append('\t');
        break;
      case 'u':
        if (i + 4 > s.length()) {
          throw new IllegalArgumentException(
              "illegal unicode escape; too few digits after \\u");
        }
        b.append((char) Integer.parseInt(s.substring(i, i + 4), 16));
        i += 4;
        break;
      default:
        throw new IllegalArgumentException(
            "illegal escape; invalid character after \\");
      }
    }
    return b.toString();
  }

  /**
   * Converts a string to a quoted JSON string literal, appending to a
   * builder.
   *
   * <p>Printable ASCII characters appear as themselves, except for
   * double-quote and backslash; all other characters are escaped, so the
   * output is pure ASCII. Inverse of {@link #unquoteString}.
   */
  public static StringBuilder appendString(StringBuilder b, String s) {
    b.append('"');
    for (int i = 0; i < s.length(); i++) {
      final char c = s.charAt(i);
      switch (c) {
      case '"':
        b.append("\\\"");
        break;
      case '\\':
        b.append("\\\\");
        break;
      case '\b':
        b.append("\\b");
        break;
      case '\f':
        b.append("\\f");
        break;
      case '\n':
        b.append("\\n");
        break;
      case '\r':
        b.append("\\r");
        break;
      case '\t':
        b.append("\\t");
        break;
      default:
        if (c >= 32 && c <= 126) {
          b.append(c);
        } else {
          b.append("\\u")
              .append(HEX[(c >> 12) & 0xF])
              .append(HEX[(c >> 8) & 0xF])
              .append(HEX[(c >> 4) & 0xF])
              .append(HEX[c & 0xF]);
        }
      }
    }
    return b.append('"');
  }

  /** Converts a string to a quoted JSON string literal. */
  public static String quoteString(String s) {
    return appendString(new StringBuilder(), s).toString();
  }
}

// End Parsers.java
