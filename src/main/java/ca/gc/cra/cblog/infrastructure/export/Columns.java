package ca.gc.cra.cblog.infrastructure.export;

import java.util.List;

/** Column names shared by every exporter so CSV headers and NDJSON keys agree. */
final class Columns {
  static final String RECEIVED_TABLE = "received";
  static final String SENT_TABLE = "sent";

  static final List<String> RECEIVED = List.of(
      "block_hash",
      "time_received",
      "time_reconstructed",
      "received_size",
      "bytes_missing",
      "tx_missing_count",
      "prefilled_count",
      "mempool_count",
      "extra_pool_count",
      "reconstruction_time_ns");

  static final List<String> SENT = List.of(
      "block_hash",
      "peer_id",
      "trigger",
      "time_sent",
      "tcp_window_size",
      "received_size",
      "received_bytes_missing",
      "received_tx_missing",
      "send_size",
      "prefill_size",
      "window_bytes_used",
      "window_bytes_available",
      "rtts_without_prefill");

  private Columns() {}
}
