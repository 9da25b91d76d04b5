package ca.gc.cra.cblog.api;

import java.util.ArrayList;
import java.util.List;

/**
 * Process exit statuses of the cblog commands. Scripts can tell a bad log ({@link #INVALID_LOG})
 * from a log whose sends contradict each other ({@link #INVARIANT_VIOLATION}).
 *
 * @since 0.1.0
 */
public enum ExitCode {
  SUCCESS(0, "analysis completed"),
  INVALID_ARGS(2, "missing or malformed command-line arguments"),
  IO_ERROR(3, "the log, configuration or export directory could not be read or written"),
  CONFIG_ERROR(4, "the YAML configuration or event pattern table is invalid"),
  RUNTIME_FAILURE(5, "unexpected internal failure"),
  INVALID_LOG(6, "a line broke the annotation grammar or carried an out-of-range field"),
  INVARIANT_VIOLATION(7, "a send named a different peer than the announcement it completed");

  private final int code;
  private final String meaning;

  ExitCode(int code, String meaning) {
    this.code = code;
    this.meaning = meaning;
  }

  /** Numeric status handed to {@link System#exit(int)}. */
  public int code() {
    return code;
  }

  public String meaning() {
    return meaning;
  }

  /** One {@code "  <code>  <meaning>"} line per status, for help output. */
  static List<String> helpLines() {
    List<String> lines = new ArrayList<>();
    for (ExitCode exit : values()) {
      lines.add(String.format("  %-4d%s", exit.code, exit.meaning));
    }
    return lines;
  }
}
