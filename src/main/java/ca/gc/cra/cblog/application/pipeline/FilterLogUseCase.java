package ca.gc.cra.cblog.application.pipeline;

import ca.gc.cra.cblog.application.port.LineSource;
import ca.gc.cra.cblog.domain.line.TimeWindow;
import java.io.IOException;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Copies the lines of a log whose leading timestamp token falls inside a {@link TimeWindow}.
 * <p>Only the first whitespace-delimited token is compared; annotations are not parsed, so lines
 * with unknown annotations are still copied. Blank lines are dropped.</p>
 *
 * @since 0.1.0
 */
public final class FilterLogUseCase {
  private final TimeWindow window;

  /**
   * Creates the use case.
   *
   * @param window inclusive window; must not be {@code null}
   */
  public FilterLogUseCase(TimeWindow window) {
    this.window = Objects.requireNonNull(window, "window");
  }

  /**
   * Streams matching lines to {@code sink} and closes the source.
   *
   * @param source line source
   * @param sink receives each matching line verbatim
   * @return number of lines emitted
   * @throws IOException if reading fails
   */
  public long run(LineSource source, Consumer<String> sink) throws IOException {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(sink, "sink");
    long emitted = 0;
    try (LineSource lines = source) {
      Optional<String> next;
      while ((next = lines.nextLine()).isPresent()) {
        String line = next.get();
        String timestamp = firstToken(line);
        if (timestamp != null && window.contains(timestamp)) {
          sink.accept(line);
          emitted++;
        }
      }
    }
    return emitted;
  }

  private static String firstToken(String line) {
    String trimmed = line.strip();
    if (trimmed.isEmpty()) {
      return null;
    }
    for (int i = 0; i < trimmed.length(); i++) {
      if (Character.isWhitespace(trimmed.charAt(i))) {
        return trimmed.substring(0, i);
      }
    }
    return trimmed;
  }
}
