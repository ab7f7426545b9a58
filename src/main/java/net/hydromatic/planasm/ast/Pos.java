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

import com.google.common.collect.Maps;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Position of a parse-tree node.
 *
 * <p>Lines and columns are 1-based. The end column is one past the last
 * character of the node.
 */
public class Pos {
  public static final Pos ZERO = new Pos("", 0, 0, 0, 0);

  public final String file;
  public final int startLine;
  public final int startColumn;
  public final int endLine;
  public final int endColumn;

  /** Creates a Pos. */
  public Pos(
      String file, int startLine, int startColumn, int endLine, int endColumn) {
    this.file = file;
    this.startLine = startLine;
    this.startColumn = startColumn;
    this.endLine = endLine;
    this.endColumn = endColumn;
  }

  /** Creates a Pos from two offsets. */
  private static Pos of(
      String text, String file, int startOffset, int endOffset) {
    final int[] start = lineCol(text, startOffset);
    final int[] end = lineCol(text, endOffset);
    return new Pos(file, start[0], start[1], end[0], end[1]);
  }

  /**
   * Creates a Pos from a filename and a string with a delimiter character.
   * The delimiter must occur exactly twice in the string.
   *
   * <p>Returns the string with the delimiters removed, and the position of the
   * text between them.
   */
  public static Map.Entry<String, Pos> split(
      String s, char delimiter, String file) {
    final int i = s.indexOf(delimiter);
    final int j = s.indexOf(delimiter, i + 1);
    final int k = s.indexOf(delimiter, j + 1);
    if (i < 0 || j <= i || k >= 0) {
      throw new IllegalArgumentException(
          "expected exactly two occurrences of delimiter, '"
              + delimiter
              + "'");
    }
    final String s2 = s.substring(0, i) + s.substring(i + 1, j) + s.substring(j + 1);
    final Pos pos = of(s2, file, i, j - 1);
    return Maps.immutableEntry(s2, pos);
  }

  @Override
  public int hashCode() {
    return Objects.hash(startLine, startColumn, endLine, endColumn);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Pos
            && this.startLine == ((Pos) o).startLine
            && this.startColumn == ((Pos) o).startColumn
            && this.endLine == ((Pos) o).endLine
            && this.endColumn == ((Pos) o).endColumn;
  }

  @Override
  public String toString() {
    return describeTo(new StringBuilder()).toString();
  }

  public StringBuilder describeTo(StringBuilder buf) {
    buf.append(file)
        .append(file.isEmpty() ? "" : ":")
        .append(startLine)
        .append('.')
        .append(startColumn);
    if (endColumn != startColumn + 1 || endLine != startLine) {
      buf.append('-').append(endLine).append('.').append(endColumn);
    }
    return buf;
  }

  /**
   * Combines a list of nodes' positions to create a position which spans
   * from the beginning of the first to the end of the last.
   */
  public static Pos sum(List<? extends AstNode> nodes) {
    if (nodes.isEmpty()) {
      return ZERO;
    }
    Pos p = nodes.get(0).pos;
    for (AstNode node : nodes.subList(1, nodes.size())) {
      p = p.plus(node.pos);
    }
    return p;
  }

  /** Returns a position that spans this and another position. */
  public Pos plus(Pos pos) {
    if (pos.equals(ZERO)) {
      return this;
    }
    if (this.equals(ZERO)) {
      return pos;
    }
    int startLine = this.startLine;
    int startColumn = this.startColumn;
    if (pos.startLine < startLine
        || pos.startLine == startLine && pos.startColumn < startColumn) {
      startLine = pos.startLine;
      startColumn = pos.startColumn;
    }
    int endLine = pos.endLine;
    int endColumn = pos.endColumn;
    if (this.endLine > endLine
        || this.endLine == endLine && this.endColumn > endColumn) {
      endLine = this.endLine;
      endColumn = this.endColumn;
    }
    return new Pos(file, startLine, startColumn, endLine, endColumn);
  }

  /** Returns the 1-based line and column of an offset. */
  private static int[] lineCol(String s, int offset) {
    int line = 1;
    int lineStart = 0;
    int i;
    final int n = Math.min(s.length(), offset);
    for (i = 0; i < n; i++) {
      if (s.charAt(i) == '\n') {
        ++line;
        lineStart = i + 1;
      }
    }
    if (i == offset) {
      return new int[] {line, offset - lineStart + 1};
    } else {
      throw new IllegalArgumentException("not found");
    }
  }
}

// End Pos.java
