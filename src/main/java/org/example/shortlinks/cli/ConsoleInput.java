package org.example.shortlinks.cli;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Objects;

/**
 * Line-oriented console input used by {@link ConsoleMenu}.
 *
 * <p>Prints a prompt without a newline, reads one line and trims it. End of input and read errors
 * are both reported as {@code null}, which the menu treats as "exit".
 */
public final class ConsoleInput {

  private final BufferedReader in;
  private final PrintStream out;

  /**
   * @param in source of user lines
   * @param out stream the prompts are printed to
   */
  public ConsoleInput(BufferedReader in, PrintStream out) {
    this.in = Objects.requireNonNull(in, "in");
    this.out = Objects.requireNonNull(out, "out");
  }

  /**
   * @param prompt text printed as-is before reading
   * @return trimmed line, or {@code null} at end of input
   */
  public String readTrimmed(String prompt) {
    out.print(prompt);
    out.flush();
    try {
      String s = in.readLine();
      return s == null ? null : s.trim();
    } catch (IOException e) {
      out.println();
      out.println("Input error: " + e.getMessage());
      return null;
    }
  }
}
