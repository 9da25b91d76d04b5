package ca.gc.cra.cblog.api;

import ca.gc.cra.cblog.validation.Strings;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Map;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hands the {@code metricsExporter}, {@code otelEndpoint} and {@code otelResourceAttributes}
 * options to the metrics bootstrap as {@code otel.*} system properties.
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);

  private enum Option {
    EXPORTER("metricsExporter", "otel.metrics.exporter", TelemetryConfigurator::exporter),
    ENDPOINT("otelEndpoint", "otel.exporter.otlp.endpoint", TelemetryConfigurator::endpoint),
    RESOURCE_ATTRIBUTES("otelResourceAttributes", "otel.resource.attributes",
        value -> Strings.requirePrintableAscii("otelResourceAttributes", value, 4_096));

    private final String key;
    private final String property;
    private final UnaryOperator<String> validator;

    Option(String name, String property, UnaryOperator<String> validator) {
      this.key = name;
      this.property = property;
      this.validator = validator;
    }
  }

  private TelemetryConfigurator() {}

  /**
   * Removes the telemetry options from {@code options}, validating each non-blank one before
   * setting its system property.
   *
   * @throws IllegalArgumentException if an exporter, endpoint or attribute list is invalid
   */
  static void apply(Map<String, String> options) {
    for (Option option : Option.values()) {
      String raw = options.remove(option.key);
      if (raw == null || raw.isBlank()) {
        continue;
      }
      String value = option.validator.apply(raw.trim());
      log.debug("Metrics option {}={}", option.key, value);
      System.setProperty(option.property, value);
    }
  }

  private static String exporter(String raw) {
    String value = raw.toLowerCase(Locale.ROOT);
    if (!value.equals("otlp") && !value.equals("none")) {
      throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
    }
    return value;
  }

  private static String endpoint(String raw) {
    URI uri;
    try {
      uri = new URI(raw);
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
    String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
    if (!scheme.equals("http") && !scheme.equals("https")) {
      throw new IllegalArgumentException("otelEndpoint must use http or https scheme");
    }
    if (uri.getHost() == null || uri.getHost().isBlank()) {
      throw new IllegalArgumentException("otelEndpoint must include a host");
    }
    return raw;
  }
}
