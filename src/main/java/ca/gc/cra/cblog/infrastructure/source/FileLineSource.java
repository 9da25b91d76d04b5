package ca.gc.cra.cblog.infrastructure.source;

import ca.gc.cra.cblog.application.port.LineSource;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> {@link LineSource} reading a UTF-8 log file sequentially.
 * <p><strong>Thread-safety:</strong> Single consumer.</p>
 * <p><strong>Performance:</strong> Buffered; memory use is bounded by the longest line.</p>
 *
 * @implNote Malformed UTF-8 is replaced rather than rejected so one corrupt line does not end the pass.
 * @since 0.1.0
 */
public final class FileLineSource implements LineSource {
  private final Path path;
  private final BufferedReader reader;

  private FileLineSource(Path path, BufferedReader reader) {
    this.path = path;
    this.reader = reader;
  }

  /**
   * Opens {@code path} for reading.
   *
   * @param path log file
   * @return open source
   * @throws IOException if the file cannot be opened
   */
  public static FileLineSource open(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    BufferedReader reader = new BufferedReader(new InputStreamReader(
        Files.newInputStream(path),
        StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPLACE)
            .onUnmappableCharacter(CodingErrorAction.REPLACE)));
    return new FileLineSource(path, reader);
  }

  /** Returns the next line with surrounding whitespace stripped; blank lines come back empty. */
  @Override
  public Optional<String> nextLine() throws IOException {
    return Optional.ofNullable(reader.readLine()).map(String::strip);
  }

  /**
   * Returns the file being read.
   *
   * @return source path
   */
  public Path path() {
    return path;
  }

  @Override
  public void close() throws IOException {
    reader.close();
  }
}
