package ca.gc.cra.cblog.application.port;

import java.io.IOException;
import java.util.Optional;

/**
 * <strong>What:</strong> Pull-based source of raw log lines.
 * <p><strong>Why:</strong> Lets the same pipeline read a file, an in-memory buffer or a test fixture.</p>
 * <p><strong>Thread-safety:</strong> Single consumer; not restartable without reopening.</p>
 *
 * @since 0.1.0
 */
public interface LineSource extends AutoCloseable {
  /**
   * Returns the next line in source order.
   *
   * @return next line without its terminator, or empty at end of stream
   * @throws IOException if reading fails
   */
  Optional<String> nextLine() throws IOException;

  /**
   * Releases the underlying resource.
   *
   * @throws IOException if closing fails
   */
  @Override
  void close() throws IOException;
}
