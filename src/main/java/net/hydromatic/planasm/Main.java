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

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.planasm.compile.AssembleException;
import net.hydromatic.planasm.compile.DisassembleException;
import net.hydromatic.planasm.parse.PlanParseException;
import net.hydromatic.planasm.util.PlanException;
import net.hydromatic.planasm.util.Prop;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Command-line tool that assembles or disassembles a plan.
 *
 * <blockquote><pre>
 * planasm assemble [--compact] [-Dprop=value...] input [output]
 * planasm disassemble [--no-comments] [-Dprop=value...] input [output]
 * </pre></blockquote>
 *
 * <p>The input "-" means standard input; if the output is omitted, writes to
 * standard output.
 */
public class Main {
  /** Exit status if a program or plan is invalid. */
  public static final int ERROR = 1;

  /** Exit status if the command line is invalid. */
  public static final int USAGE = 2;

  static final String USAGE_TEXT =
      "usage: planasm assemble [--compact] [-Dprop=value...] "
          + "input [output]\n"
          + "       planasm disassemble [--no-comments] [-Dprop=value...] "
          + "input [output]\n";

  private static final String STDIN = "stdin";

  private final List<String> args;
  private final InputStream in;
  private final PrintStream out;
  private final PrintStream err;

  /** Creates a Main. */
  public Main(
      List<String> args, InputStream in, PrintStream out, PrintStream err) {
    this.args = ImmutableList.copyOf(args);
    this.in = in;
    this.out = out;
    this.err = err;
  }

  /**
   * Command-line entry point.
   *
   * @param args Command-line arguments
   */
  public static void main(String[] args) {
    final Main main =
        new Main(ImmutableList.copyOf(args), System.in, System.out, System.err);
    System.exit(main.run());
  }

  /** Runs the command, and returns the exit status. */
  public int run() {
    if (args.isEmpty()) {
      return usage(null);
    }
    final String command = args.get(0);
    final boolean assemble;
    switch (command) {
    case "assemble":
      assemble = true;
      break;
    case "disassemble":
      assemble = false;
      break;
    default:
      return usage("unknown command '" + command + "'");
    }

    final Map<Prop, Object> propMap = new LinkedHashMap<>();
    final List<String> files = new ArrayList<>();
    for (String arg : args.subList(1, args.size())) {
      if (arg.equals("--compact") && assemble) {
        Prop.PRETTY_JSON.set(propMap, false);
      } else if (arg.equals("--no-comments") && !assemble) {
        Prop.SECTION_COMMENTS.set(propMap, false);
      } else if (arg.startsWith("-D")) {
        final int eq = arg.indexOf('=');
        if (eq < 0) {
          return usage("expected -Dprop=value, got '" + arg + "'");
        }
        try {
          Prop.lookup(arg.substring(2, eq))
              .setLenient(propMap, arg.substring(eq + 1));
        } catch (IllegalArgumentException e) {
          return usage(e.getMessage());
        }
      } else if (arg.startsWith("-") && !arg.equals("-")) {
        return usage("unknown option '" + arg + "'");
      } else {
        files.add(arg);
      }
    }
    if (files.isEmpty() || files.size() > 2) {
      return usage("expected an input file and an optional output file");
    }

    final String input = files.get(0);
    final String file = input.equals("-") ? STDIN : input;
    try {
      final String text = read(input);
      final String result =
          assemble
              ? Plans.assembleToString(text, file, propMap)
              : Plans.disassemble(text, file, propMap);
      if (files.size() == 2) {
        Files.write(Paths.get(files.get(1)), result.getBytes(UTF_8));
      } else {
        out.print(result);
        out.flush();
      }
      return 0;
    } catch (PlanParseException | AssembleException | DisassembleException e) {
      err.println(((PlanException) e).describeTo(new StringBuilder()));
      return ERROR;
    } catch (IOException e) {
      err.println("planasm: " + e);
      return ERROR;
    }
  }

  private String read(String input) throws IOException {
    if (input.equals("-")) {
      final byte[] bytes = in.readAllBytes();
      return new String(bytes, UTF_8);
    }
    final Path path = Paths.get(input);
    return new String(Files.readAllBytes(path), UTF_8);
  }

  private int usage(@Nullable String message) {
    if (message != null) {
      err.println("planasm: " + message);
    }
    err.print(USAGE_TEXT);
    return USAGE;
  }
}

// End Main.java
