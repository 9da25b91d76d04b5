package ca.gc.cra.cblog.application.report;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;

/**
 * Renders {@link CompactBlockStats} as human-readable report lines.
 *
 * @since 0.1.0
 */
public final class StatsReportPrinter {
  private static final String NOT_AVAILABLE = "n/a";

  /**
   * Formats every non-empty section.
   *
   * @param stats statistics to render
   * @return report lines in section order
   */
  public List<String> render(CompactBlockStats stats) {
    List<String> lines = new ArrayList<>();
    stats.received().ifPresentOrElse(
        received -> renderReceived(received, lines),
        () -> lines.add("No compact blocks received."));
    stats.sent().ifPresentOrElse(
        sent -> renderSent(sent, lines),
        () -> lines.add("No compact blocks sent."));
    stats.window().ifPresent(window -> renderWindow(window, lines));
    stats.overWindow().ifPresent(over -> renderOverWindow(over, lines));
    return lines;
  }

  private static void renderReceived(CompactBlockStats.ReceivedStats s, List<String> lines) {
    lines.add("Received compact blocks");
    lines.add(format("  %d out of %d blocks received failed reconstruction. (%s)",
        s.failed(), s.total(), percent(s.failureRate())));
    lines.add(format("  Reconstruction rate: %s", percent(s.reconstructionRate())));
    lines.add(format("  Avg size of received block: %.2f bytes", s.averageReceivedSize()));
    lines.add(format("  Avg bytes missing from received blocks: %.2f bytes", s.averageBytesMissing()));
    lines.add(format("  Avg bytes missing from blocks that failed reconstruction: %s",
        bytes(s.averageBytesMissingWhenFailed())));
    lines.add(format("  Avg reconstruction time: %s",
        s.averageReconstructionMillis().isPresent()
            ? format("%.3fms", s.averageReconstructionMillis().getAsDouble())
            : NOT_AVAILABLE));
  }

  private static void renderSent(CompactBlockStats.SentStats s, List<String> lines) {
    lines.add("Sent compact blocks");
    lines.add(format("  Avg compact block sent: %.2f bytes", s.averageSendSize()));
    lines.add(format("  Avg prefilled compact block sent: %s", bytes(s.averagePrefilledSendSize())));
    lines.add(format("  Avg compact block sent without prefill: %s", bytes(s.averageUnprefilledSendSize())));
    lines.add(format("  %d/%d blocks were sent with prefills. (%s)",
        s.prefilled(), s.total(), percent(s.prefillRate())));
    lines.add(format("  Avg available prefill bytes for all sends: %s", bytes(s.averageAvailableBytes())));
    if (s.prefilled() == 0) {
      return;
    }
    lines.add(format("  Avg available prefill bytes for prefilled sends: %s",
        bytes(s.averageAvailableBytesWhenPrefilled())));
    lines.add(format("  Avg prefill size for prefilled sends: %s", bytes(s.averagePrefillSize())));
    lines.add(format("  %d/%d prefilled blocks sent fit in the available bytes. (%s)",
        s.prefillsThatFit(), s.prefilled(), percent((double) s.prefillsThatFit() / s.prefilled())));
  }

  private static void renderWindow(CompactBlockStats.WindowStats s, List<String> lines) {
    lines.add("Send window");
    lines.add(format("  TCP window size: avg %.2f bytes, median %.1f, mode %d", s.mean(), s.median(), s.mode()));
    lines.add(format("  The mode represented %d/%d windows. (%s)",
        s.modeFrequency(), s.count(), percent((double) s.modeFrequency() / s.count())));
    lines.add(format("  Avg TCP window bytes used: %.2f bytes", s.averageBytesUsed()));
    lines.add(format("  Avg TCP window bytes available: %.2f bytes", s.averageBytesAvailable()));
  }

  private static void renderOverWindow(CompactBlockStats.OverWindowStats s, List<String> lines) {
    lines.add(format("  %d/%d compact blocks sent were already over the window for a single RTT before prefilling. (%s)",
        s.overWindow(), s.total(), percent(s.total() == 0 ? 0 : (double) s.overWindow() / s.total())));
    if (s.overWindow() == 0) {
      return;
    }
    lines.add(format("  Avg available prefill bytes in those blocks: %s", bytes(s.averageAvailableBytes())));
    lines.add(format("  %d/%d of those blocks had prefills that fit. (%s)",
        s.prefillsThatFit(), s.overWindow(), percent((double) s.prefillsThatFit() / s.overWindow())));
  }

  private static String bytes(OptionalDouble value) {
    return value.isPresent() ? format("%.2f bytes", value.getAsDouble()) : NOT_AVAILABLE;
  }

  private static String percent(double ratio) {
    return format("%.2f%%", ratio * 100);
  }

  private static String format(String pattern, Object... args) {
    return String.format(Locale.ROOT, pattern, args);
  }
}
