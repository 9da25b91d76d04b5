package ca.gc.cra.cblog.infrastructure.source;

import ca.gc.cra.cblog.application.port.LineSource;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * {@link LineSource} over an in-memory list of lines, stripped like {@link FileLineSource}. Used by
 * tests and embedders.
 *
 * @since 0.1.0
 */
public final class InMemoryLineSource implements LineSource {
  private final Iterator<String> lines;

  /**
   * Creates a source over a copy of {@code lines}.
   *
   * @param lines lines in order; elements must not be {@code null}
   */
  public InMemoryLineSource(List<String> lines) {
    this.lines = List.copyOf(lines).iterator();
  }

  /**
   * Splits {@code text} on line terminators.
   *
   * @param text multi-line text
   * @return source over its lines
   */
  public static InMemoryLineSource of(String text) {
    return new InMemoryLineSource(text.lines().toList());
  }

  @Override
  public Optional<String> nextLine() {
    return lines.hasNext() ? Optional.of(lines.next().strip()) : Optional.empty();
  }

  @Override
  public void close() {
    // nothing to release
  }
}
