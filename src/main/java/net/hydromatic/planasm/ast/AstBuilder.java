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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Builds parse tree nodes. */
public enum AstBuilder {
  /**
   * The singleton instance of the AST builder. The short name is convenient for
   * use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  ast;

  /** Creates a reference to a binding. */
  public Ast.Id id(Pos pos, String name) {
    return new Ast.Id(pos, name);
  }

  /** Creates a string literal. */
  public Ast.Literal stringLiteral(Pos pos, String value) {
    return new Ast.Literal(pos, Op.STRING_LITERAL, value);
  }

  /** Creates an integer literal. */
  public Ast.Literal numberLiteral(Pos pos, BigInteger value) {
    return new Ast.Literal(pos, Op.NUMBER_LITERAL, value);
  }

  /** Creates a real literal. */
  public Ast.Literal numberLiteral(Pos pos, BigDecimal value) {
    return new Ast.Literal(pos, Op.NUMBER_LITERAL, value);
  }

  /** Creates the real literal "{@code -0.0}", whose sign a
   * {@link BigDecimal} would lose. */
  public Ast.Literal negativeZero(Pos pos) {
    return new Ast.Literal(pos, Op.NUMBER_LITERAL, -0d);
  }

  /**
   * Creates a numeric literal from its JSON text.
   *
   * <p>The literal is an integer unless the text has a fraction or an
   * exponent; "{@code 1}" is an integer, "{@code 1.0}" and "{@code 1e0}" are
   * reals.
   */
  public Ast.Literal numberLiteral(Pos pos, String text) {
    if (text.indexOf('.') >= 0
        || text.indexOf('e') >= 0
        || text.indexOf('E') >= 0) {
      final BigDecimal d = new BigDecimal(text);
      if (d.signum() == 0 && text.startsWith("-")) {
        return negativeZero(pos);
      }
      return numberLiteral(pos, d);
    }
    return numberLiteral(pos, new BigInteger(text));
  }

  public Ast.ArrayExp array(Pos pos, List<? extends Ast.Exp> elements) {
    return new Ast.ArrayExp(pos, ImmutableList.copyOf(elements));
  }

  /** Creates an object from parallel lists of keys and values. */
  public Ast.ObjectExp object(
      Pos pos, List<String> keys, List<? extends Ast.Exp> values) {
    checkArgument(keys.size() == values.size());
    final ImmutableList.Builder<Map.Entry<String, Ast.Exp>> members =
        ImmutableList.builder();
    for (int i = 0; i < keys.size(); i++) {
      members.add(Maps.immutableEntry(keys.get(i), values.get(i)));
    }
    return new Ast.ObjectExp(pos, members.build());
  }

  public Ast.ObjectExp object(
      Pos pos, List<Map.Entry<String, Ast.Exp>> members) {
    return new Ast.ObjectExp(pos, ImmutableList.copyOf(members));
  }

  public Ast.UsingDecl usingDecl(
      Pos pos, Ast.Id id, String uri, @Nullable Integer anchor) {
    return new Ast.UsingDecl(pos, id, uri, anchor);
  }

  public Ast.ExtensionDecl extensionDecl(
      Pos pos,
      AnchorKind kind,
      Ast.Id id,
      Ast.@Nullable Exp uriRef,
      String name,
      @Nullable Integer anchor) {
    return new Ast.ExtensionDecl(pos, kind, id, uriRef, name, anchor);
  }

  public Ast.ProtoExtensionDecl protoExtensionDecl(Pos pos, String url) {
    return new Ast.ProtoExtensionDecl(pos, url);
  }

  /** Creates an "{@code enhancement}" or "{@code optimization}" statement. */
  public Ast.AdvancedExtensionDecl advancedExtensionDecl(
      Pos pos, Op op, Ast.Exp value) {
    return new Ast.AdvancedExtensionDecl(pos, op, value);
  }

  /**
   * Creates an "{@code execute}" statement.
   *
   * @param names Output names of a root relation, or null for a plain
   *     relation
   */
  public Ast.Execute execute(
      Pos pos, Ast.Id relation, @Nullable List<String> names) {
    return new Ast.Execute(
        pos, relation, names == null ? null : ImmutableList.copyOf(names));
  }

  public Ast.Raw raw(Pos pos, Ast.Id id, Ast.Exp value) {
    return new Ast.Raw(pos, id, value);
  }

  /** Creates a program. Its position spans all of its statements. */
  public Ast.Program program(List<? extends Ast.Statement> statements) {
    return new Ast.Program(
        Pos.sum(statements), ImmutableList.copyOf(statements));
  }
}

// End AstBuilder.java
