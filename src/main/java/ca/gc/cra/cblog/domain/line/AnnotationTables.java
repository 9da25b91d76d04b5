package ca.gc.cra.cblog.domain.line;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * <strong>What:</strong> Closed vocabularies used to tell annotation kinds apart.
 * <p><strong>Why:</strong> Category and thread annotations are plain words; only membership in a
 * known set distinguishes {@code [net]} the category from {@code [msghand]} the thread.</p>
 * <p><strong>Role:</strong> Load-time constant table handed to {@link MetadataDisambiguator}.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; compiled patterns are thread-safe.</p>
 *
 * @param categories recognized log category names
 * @param threadNames recognized fixed thread names
 * @param workerThreadPatterns shapes of numbered worker threads such as {@code httpworker.3}
 * @since 0.1.0
 */
public record AnnotationTables(
    Set<String> categories,
    Set<String> threadNames,
    List<Pattern> workerThreadPatterns) {

  private static final Set<String> DEFAULT_CATEGORIES = Set.of(
      "all",
      "net",
      "tor",
      "mempool",
      "http",
      "bench",
      "zmq",
      "walletdb",
      "rpc",
      "estimatefee",
      "addrman",
      "selectcoins",
      "reindex",
      "cmpctblock",
      "rand",
      "prune",
      "proxy",
      "mempoolrej",
      "libevent",
      "coindb",
      "qt",
      "leveldb",
      "validation",
      "i2p",
      "ipc",
      "lock",
      "blockstorage",
      "txreconciliation",
      "scan",
      "txpackages");

  private static final Set<String> DEFAULT_THREAD_NAMES = Set.of(
      "init",
      "http",
      "shutoff",
      "capnp-loop",
      "main",
      "qt-clientmodl",
      "qt-init",
      "qt-rpcconsole",
      "qt-walletctrl",
      "test",
      "initload",
      "mapport",
      "net",
      "dnsseed",
      "addcon",
      "opencon",
      "msghand",
      "i2paccept",
      "torcontrol");

  private static final List<Pattern> DEFAULT_WORKER_PATTERNS = List.of(
      Pattern.compile("^scriptch\\.\\d+$"),
      Pattern.compile("^httpworker\\.\\d+$"));

  /**
   * Copies the supplied collections.
   */
  public AnnotationTables {
    categories = Set.copyOf(Objects.requireNonNull(categories, "categories"));
    threadNames = Set.copyOf(Objects.requireNonNull(threadNames, "threadNames"));
    workerThreadPatterns = List.copyOf(Objects.requireNonNull(workerThreadPatterns, "workerThreadPatterns"));
    if (categories.isEmpty()) {
      throw new IllegalArgumentException("at least one category is required");
    }
  }

  /**
   * Returns the vocabulary emitted by the node's logging subsystem.
   *
   * @return default tables
   */
  public static AnnotationTables defaults() {
    return new AnnotationTables(DEFAULT_CATEGORIES, DEFAULT_THREAD_NAMES, DEFAULT_WORKER_PATTERNS);
  }

  /**
   * Builds the {@code category[:level]} matcher for this vocabulary.
   *
   * @return compiled pattern with the category in group 1 and the optional level in group 2
   */
  Pattern categoryPattern() {
    String alternatives = categories.stream()
        .sorted()
        .map(Pattern::quote)
        .collect(Collectors.joining("|"));
    return Pattern.compile("^(" + alternatives + ")(?::(\\w+))?$");
  }

  /**
   * Tests whether an annotation names a thread.
   *
   * @param token annotation content
   * @return {@code true} when the token is a known or numbered worker thread name
   */
  boolean isThread(String token) {
    if (threadNames.contains(token)) {
      return true;
    }
    for (Pattern pattern : workerThreadPatterns) {
      if (pattern.matcher(token).matches()) {
        return true;
      }
    }
    return false;
  }
}
