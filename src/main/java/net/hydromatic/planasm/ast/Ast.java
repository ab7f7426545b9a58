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
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Map;
import net.hydromatic.planasm.parse.Parsers;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Various sub-classes of AST nodes. */
public class Ast {
  private Ast() {}

  /**
   * Base class for a JSON expression: the right-hand side of "{@code raw}",
   * "{@code enhancement}" and "{@code optimization}" statements.
   */
  public abstract static class Exp extends AstNode {
    Exp(Pos pos, Op op) {
      super(pos, op);
    }
  }

  /**
   * Reference to a binding, or one of the reserved words {@code true},
   * {@code false}, {@code null}.
   */
  public static class Id extends Exp {
    public final String name;

    Id(Pos pos, String name) {
      super(pos, Op.ID);
      this.name = requireNonNull(name);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof Id && this.name.equals(((Id) o).name);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter write(AstWriter w) {
      return w.id(name);
    }
  }

  /**
   * String or numeric literal.
   *
   * <p>The value of a string literal is a {@link String}; of an integer
   * literal, a {@link BigInteger}; of a real literal, a {@link BigDecimal},
   * except that negative zero is the {@link Double} {@code -0.0}.
   */
  public static class Literal extends Exp {
    public final Object value;

    Literal(Pos pos, Op op, Object value) {
      super(pos, op);
      this.value = requireNonNull(value);
      checkArgument(
          op == Op.STRING_LITERAL && value instanceof String
              || op == Op.NUMBER_LITERAL
                  && (value instanceof BigInteger
                      || value instanceof BigDecimal
                      || value instanceof Double));
    }

    @Override
    public int hashCode() {
      return value.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Literal && this.value.equals(((Literal) o).value);
    }

    /** Returns whether this is an integer literal. */
    public boolean isInteger() {
      return value instanceof BigInteger;
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter write(AstWriter w) {
      if (op == Op.STRING_LITERAL) {
        return w.string((String) value);
      }
      final String s = value.toString();
      if (value instanceof BigDecimal
          && s.indexOf('.') < 0
          && s.indexOf('E') < 0) {
        // Otherwise it would read back as an integer
        return w.append(s).append(".0");
      }
      return w.append(s);
    }
  }

  /** JSON array. */
  public static class ArrayExp extends Exp {
    public final ImmutableList<Exp> elements;

    ArrayExp(Pos pos, ImmutableList<Exp> elements) {
      super(pos, Op.ARRAY);
      this.elements = requireNonNull(elements);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter write(AstWriter w) {
      return w.array(elements);
    }
  }

  /**
   * JSON object.
   *
   * <p>Keys may repeat; when the object is evaluated, the last occurrence of a
   * key wins.
   */
  public static class ObjectExp extends Exp {
    public final ImmutableList<Map.Entry<String, Exp>> members;

    ObjectExp(Pos pos, ImmutableList<Map.Entry<String, Exp>> members) {
      super(pos, Op.OBJECT);
      this.members = requireNonNull(members);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter write(AstWriter w) {
      return w.object(members);
    }
  }

  /** Base class for a statement. */
  public abstract static class Statement extends AstNode {
    Statement(Pos pos, Op op) {
      super(pos, op);
      checkArgument(op.isStatement());
    }

    /** Writes the keyword that starts this statement. */
    AstWriter keyword(AstWriter w) {
      return w.append(requireNonNull(op.keyword)).append(" ");
    }
  }

  /**
   * Extension URI declaration.
   *
   * <p>For example, "{@code using u = "functions.yaml" = 3;}". */
  public static class UsingDecl extends Statement {
    public final Id id;
    public final String uri;
    public final @Nullable Integer anchor;

    UsingDecl(Pos pos, Id id, String uri, @Nullable Integer anchor) {
      super(pos, Op.USING_DECL);
      this.id = requireNonNull(id);
      this.uri = requireNonNull(uri);
      this.anchor = anchor;
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter write(AstWriter w) {
      keyword(w).append(id).append(" = ").string(uri);
      if (anchor != null) {
        w.append(" = ").append(anchor.toString());
      }
      return w.append(";");
    }
  }

  /**
   * Declaration of an extension function, type or type variation.
   *
   * <p>For example, "{@code function add = u::"add" = 7;}". The URI reference
   * ("{@code u}" in the example) is an identifier bound by a previous
   * {@link UsingDecl}, or an integer literal, or absent.
   */
  public static class ExtensionDecl extends Statement {
    public final AnchorKind kind;
    public final Id id;
    public final @Nullable Exp uriRef;
    public final String name;
    public final @Nullable Integer anchor;

    ExtensionDecl(
        Pos pos,
        AnchorKind kind,
        Id id,
        @Nullable Exp uriRef,
        String name,
        @Nullable Integer anchor) {
      super(pos, kind.op);
      checkArgument(kind != AnchorKind.URI);
      checkArgument(
          uriRef == null
              || uriRef instanceof Id
              || uriRef instanceof Literal && ((Literal) uriRef).isInteger());
      this.kind = kind;
      this.id = requireNonNull(id);
      this.uriRef = uriRef;
      this.name = requireNonNull(name);
      this.anchor = anchor;
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter write(AstWriter w) {
      keyword(w).append(id).append(" = ");
      if (uriRef != null) {
        w.append(uriRef).append("::");
      }
      if (Parsers.isIdentifier(name)) {
        w.id(name);
      } else {
        w.string(name);
      }
      if (anchor != null) {
        w.append(" = ").append(anchor.toString());
      }
      return w.append(";");
    }
  }

  /**
   * Declaration of a protobuf type URL that the plan expects to be able to
   * resolve.
   *
   * <p>For example,
   * "{@code proto_extension "type.googleapis.com/foo.Bar";}". */
  public static class ProtoExtensionDecl extends Statement {
    public final String url;

    ProtoExtensionDecl(Pos pos, String url) {
      super(pos, Op.PROTO_EXTENSION_DECL);
      this.url = requireNonNull(url);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter write(AstWriter w) {
      return keyword(w).string(url).append(";");
    }
  }

  /** Plan-level "{@code enhancement}" or "{@code optimization}" statement. */
  public static class AdvancedExtensionDecl extends Statement {
    public final Exp value;

    AdvancedExtensionDecl(Pos pos, Op op, Exp value) {
      super(pos, op);
      checkArgument(op == Op.ENHANCEMENT_DECL || op == Op.OPTIMIZATION_DECL);
      this.value = requireNonNull(value);
    }

    /** Returns the name of the member of "advanced_extensions" that this
     * statement sets. */
    public String fieldName() {
      return requireNonNull(op.keyword);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter write(AstWriter w) {
      return keyword(w).append(value).append(";");
    }
  }

  /**
   * Statement that adds a relation to the plan.
   *
   * <p>For example, "{@code execute r("a", "b");}" adds a root relation with
   * output names "a" and "b"; "{@code execute r;}" adds a plain relation. */
  public static class Execute extends Statement {
    public final Id relation;
    public final @Nullable ImmutableList<String> names;

    Execute(Pos pos, Id relation, @Nullable ImmutableList<String> names) {
      super(pos, Op.EXECUTE);
      this.relation = requireNonNull(relation);
      this.names = names;
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter write(AstWriter w) {
      keyword(w).append(relation);
      if (names != null) {
        w.strings(names);
      }
      return w.append(";");
    }
  }

  /**
   * Statement that binds an identifier to a JSON value.
   *
   * <p>For example, "{@code raw lit = {"literal": {"i32": 1}};}". */
  public static class Raw extends Statement {
    public final Id id;
    public final Exp value;

    Raw(Pos pos, Id id, Exp value) {
      super(pos, Op.RAW);
      this.id = requireNonNull(id);
      this.value = requireNonNull(value);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter write(AstWriter w) {
      return keyword(w).append(id).append(" = ").append(value).append(";");
    }
  }

  /**
   * Sequence of statements.
   *
   * <p>When written, statements are laid out in sections: extension
   * declarations, protobuf-level declarations, and one section per relation
   * (a run of "{@code raw}" statements ended by "{@code execute}").
   */
  public static class Program extends AstNode {
    public final ImmutableList<Statement> statements;

    Program(Pos pos, ImmutableList<Statement> statements) {
      super(pos, Op.PROGRAM);
      this.statements = requireNonNull(statements);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter write(AstWriter w) {
      @Nullable Op lastOp = null;
      int relationCount = 0;
      for (Statement statement : statements) {
        final Section section = Section.of(statement.op);
        final boolean newSection =
            lastOp == null
                || section != Section.of(lastOp)
                || section == Section.RELATION && lastOp == Op.EXECUTE;
        if (newSection) {
          w.blankLine();
          if (w.sectionComments()) {
            w.comment(
                section == Section.RELATION
                    ? "Relation " + relationCount
                    : section.title);
          }
          if (section == Section.RELATION) {
            ++relationCount;
          }
        } else if (lastOp == Op.USING_DECL && statement.op != Op.USING_DECL) {
          w.blankLine();
        }
        statement.write(w).append("\n");
        if (statement.op == Op.RAW) {
          w.blankLine();
        }
        lastOp = statement.op;
      }
      return w;
    }
  }

  /** Group of statements that are written together. */
  private enum Section {
    EXTENSION("Type/function extensions"),
    PROTO("Protobuf extensions"),
    RELATION("Relation");

    final String title;

    Section(String title) {
      this.title = title;
    }

    static Section of(Op op) {
      switch (op) {
      case USING_DECL:
      case FUNCTION_DECL:
      case TYPE_DECL:
      case TYPE_VARIATION_DECL:
        return EXTENSION;
      case PROTO_EXTENSION_DECL:
      case ENHANCEMENT_DECL:
      case OPTIMIZATION_DECL:
        return PROTO;
      case EXECUTE:
      case RAW:
        return RELATION;
      default:
        throw new AssertionError(op);
      }
    }
  }
}

// End Ast.java
