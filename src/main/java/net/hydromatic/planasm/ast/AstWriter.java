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
package net.hydromatic.planasm.ast;

import java.util.List;
import java.util.Map;
import net.hydromatic.planasm.parse.Parsers;

/**
 * Context for writing an AST out as a string.
 *
 * <p>JSON objects and arrays are written with one member per line, indented
 * by two spaces per level of nesting; empty ones are written "{}" and "[]".
 */
public class AstWriter {
  private final StringBuilder b = new StringBuilder();
  private final boolean sectionComments;
  private int indent;

  /** Creates a writer that writes section comments. */
  public AstWriter() {
    this(true);
  }

  /** Creates a writer. */
  public AstWriter(boolean sectionComments) {
    this.sectionComments = sectionComments;
  }

  /** Returns whether a program should contain comments that introduce each
   * group of statements. */
  public boolean sectionComments() {
    return sectionComments;
  }

  /** Appends a string to the output. */
  public AstWriter append(String s) {
    b.append(s);
    return this;
  }

  /** Appends an identifier. */
  public AstWriter id(String name) {
    return append(name);
  }

  /** Appends a quoted string literal. */
  public AstWriter string(String s) {
    Parsers.appendString(b, s);
    return this;
  }

  /** Appends a line break, followed by the current indentation. */
  public AstWriter newline() {
    b.append('\n');
    for (int i = 0; i < indent; i++) {
      b.append("  ");
    }
    return this;
  }

  /**
   * Ends the current line and, unless the output is empty or already ends
   * with one, appends a blank line.
   */
  public AstWriter blankLine() {
    if (b.length() == 0) {
      return this;
    }
    if (b.charAt(b.length() - 1) != '\n') {
      b.append('\n');
    }
    if (b.length() < 2 || b.charAt(b.length() - 2) != '\n') {
      b.append('\n');
    }
    return this;
  }

  /** Appends a line comment and a line break. */
  public AstWriter comment(String text) {
    return append("// ").append(text).append("\n");
  }

  /** Appends a JSON array. */
  public AstWriter array(List<Ast.Exp> elements) {
    if (elements.isEmpty()) {
      return append("[]");
    }
    append("[");
    ++indent;
    for (int i = 0; i < elements.size(); i++) {
      if (i > 0) {
        append(",");
      }
      newline();
      elements.get(i).write(this);
    }
    --indent;
    newline();
    return append("]");
  }

  /** Appends a JSON object. */
  public AstWriter object(List<Map.Entry<String, Ast.Exp>> members) {
    if (members.isEmpty()) {
      return append("{}");
    }
    append("{");
    ++indent;
    for (int i = 0; i < members.size(); i++) {
      if (i > 0) {
        append(",");
      }
      newline();
      final Map.Entry<String, Ast.Exp> member = members.get(i);
      string(member.getKey()).append(": ");
      member.getValue().write(this);
    }
    --indent;
    newline();
    return append("}");
  }

  /** Appends a parenthesized, comma-separated list of string literals. */
  public AstWriter strings(List<String> strings) {
    append("(");
    for (int i = 0; i < strings.size(); i++) {
      if (i > 0) {
        append(", ");
      }
      string(strings.get(i));
    }
    return append(")");
  }

  @Override
  public String toString() {
    return b.toString();
  }

  /** Appends a node. */
  public AstWriter append(AstNode node) {
    return node.write(this);
  }
}

// End AstWriter.java
