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

/** Visits syntax trees. */
public class Visitor {

  /** For use as a method reference. */
  protected <E extends AstNode> void accept(E e) {
    e.accept(this);
  }

  // expressions

  protected void visit(Ast.Literal literal) {}

  protected void visit(Ast.Id id) {}

  protected void visit(Ast.ArrayExp arrayExp) {
    arrayExp.elements.forEach(this::accept);
  }

  protected void visit(Ast.ObjectExp objectExp) {
    objectExp.members.forEach(member -> member.getValue().accept(this));
  }

  // statements

  protected void visit(Ast.UsingDecl usingDecl) {
    usingDecl.id.accept(this);
  }

  protected void visit(Ast.ExtensionDecl extensionDecl) {
    extensionDecl.id.accept(this);
    if (extensionDecl.uriRef != null) {
      extensionDecl.uriRef.accept(this);
    }
  }

  protected void visit(Ast.ProtoExtensionDecl protoExtensionDecl) {}

  protected void visit(Ast.AdvancedExtensionDecl advancedExtensionDecl) {
    advancedExtensionDecl.value.accept(this);
  }

  protected void visit(Ast.Execute execute) {
    execute.relation.accept(this);
  }

  protected void visit(Ast.Raw raw) {
    raw.id.accept(this);
    raw.value.accept(this);
  }

  protected void visit(Ast.Program program) {
    program.statements.forEach(this::accept);
  }
}

// End Visitor.java
