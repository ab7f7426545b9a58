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

import net.hydromatic.planasm.ast.Pos;
import net.hydromatic.planasm.util.PlanException;

/**
 * Exception caused by a parse error.
 *
 * <p>Also thrown for malformed literals, such as an anchor that is not a
 * non-negative integer.
 */
public class PlanParseException extends RuntimeException
    implements PlanException {
  private final Pos pos;

  PlanParseException(Throwable cause, Pos pos) {
    super(cause.getMessage(), cause);
    this.pos = pos;
  }

  public PlanParseException(String message, Pos pos) {
    super(message);
    this.pos = pos;
  }

  /** Converts a JavaCC exception, positioned at the offending token. */
  static PlanParseException of(ParseException e, String file) {
    Token token = e.currentToken;
    if (token != null && token.next != null) {
      token = token.next;
    }
    final Pos pos =
        token == null
            ? new Pos(file, 0, 0, 0, 0)
            : new Pos(
                file,
                token.beginLine,
                token.beginColumn,
                token.endLine,
                token.endColumn + 1);
    return new PlanParseException(e, pos);
  }

  @Override
  public String toString() {
    return super.toString() + " at " + pos;
  }

  @Override
  public Pos pos() {
    return pos;
  }

  @Override
  public StringBuilder describeTo(StringBuilder buf) {
    return pos.describeTo(buf).append(" Error: ").append(getMessage());
  }
}

// End PlanParseException.java
