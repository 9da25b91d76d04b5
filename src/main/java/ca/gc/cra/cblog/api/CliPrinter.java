package ca.gc.cra.cblog.api;

import java.io.BufferedWriter;
import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.function.Consumer;

/**
 * Standard output of the cblog commands: usage text, run summaries, the statistics report and
 * filtered log lines. Logback writes to stderr, so this output can be piped on its own.
 */
public final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(new BufferedWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), 1 << 16));
  private static volatile PrintWriter override;

  private CliPrinter() {
    // Utility
  }

  /** Prints one line and flushes. */
  public static void println(String message) {
    PrintWriter out = out();
    out.println(message);
    out.flush();
  }

  /** Prints the lines in order and flushes once. */
  public static void printLines(String... lines) {
    if (lines != null) {
      printLines(List.of(lines));
    }
  }

  /** Prints the lines in order and flushes once. */
  public static void printLines(List<String> lines) {
    PrintWriter out = out();
    lines.forEach(out::println);
    out.flush();
  }

  /**
   * Returns a sink that prints each line without flushing, for the filter command's potentially
   * long output. Call {@link #flush()} when the sink is done.
   */
  static Consumer<String> lineSink() {
    PrintWriter out = out();
    return out::println;
  }

  static void flush() {
    out().flush();
  }

  static void setWriterForTesting(PrintWriter writer) {
    override = writer;
  }

  static void clearTestWriter() {
    override = null;
  }

  private static PrintWriter out() {
    PrintWriter test = override;
    return test != null ? test : STDOUT;
  }
}
