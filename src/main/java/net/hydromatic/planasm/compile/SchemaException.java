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
package net.hydromatic.planasm.compile;

import net.hydromatic.planasm.ast.Pos;

/**
 * The plan schema could not classify a node of a plan document.
 *
 * <p>For example, a relation whose type the schema does not know, or an
 * anchor reference whose value is not an integer.
 */
public class SchemaException extends DisassembleException {
  public SchemaException(String message, String path, Pos pos) {
    super(message, path, pos);
  }
}

// End SchemaException.java
