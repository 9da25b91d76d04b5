package ca.gc.cra.cblog.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.MeterProvider;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates the meter used by {@link OpenTelemetryMetricsAdapter}.
 *
 * <p>Settings come from the {@code otel.*} system properties set by the CLI, falling back to the
 * standard {@code OTEL_*} environment variables. A run analyses one log and exits, so the periodic
 * reader rarely fires; {@link MeterHandle#close()} flushes what the run recorded.</p>
 */
final class OpenTelemetryBootstrap {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);
  static final String INSTRUMENTATION_SCOPE = "ca.gc.cra.cblog";
  private static final Duration EXPORT_INTERVAL = Duration.ofSeconds(30);
  private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

  private OpenTelemetryBootstrap() {
    // Utility class
  }

  static MeterHandle initialize() {
    return initialize(Settings.resolve(System::getProperty, System::getenv));
  }

  static MeterHandle initialize(Settings settings) {
    if (settings.exporter() == ExporterMode.NONE) {
      log.debug("Metrics export disabled");
      return MeterHandle.noop();
    }
    try {
      MetricReader reader = PeriodicMetricReader.builder(
              OtlpGrpcMetricExporter.builder().setEndpoint(settings.endpoint()).build())
          .setInterval(EXPORT_INTERVAL)
          .build();
      MeterHandle handle = open(reader, settings.resourceAttributes());
      log.info("Exporting cblog metrics over OTLP to {}", settings.endpoint());
      return handle;
    } catch (RuntimeException ex) {
      log.error("Could not start OTLP metrics export to {}; metrics disabled", settings.endpoint(), ex);
      return MeterHandle.noop();
    }
  }

  static MeterHandle forTesting(MetricReader reader) {
    return open(Objects.requireNonNull(reader, "reader"), Attributes.empty());
  }

  private static MeterHandle open(MetricReader reader, Attributes extra) {
    String version = implementationVersion();
    Attributes service = Attributes.builder()
        .put(AttributeKey.stringKey("service.name"), "cblog")
        .put(AttributeKey.stringKey("service.namespace"), "ca.gc.cra")
        .put(AttributeKey.stringKey("service.version"), version)
        .build();
    Resource resource = Resource.getDefault().merge(Resource.create(service)).merge(Resource.create(extra));
    SdkMeterProvider provider = SdkMeterProvider.builder()
        .setResource(resource)
        .registerMetricReader(reader)
        .build();
    return new MeterHandle(
        provider.meterBuilder(INSTRUMENTATION_SCOPE).setInstrumentationVersion(version).build(), provider);
  }

  /**
   * Parses {@code key=value} pairs separated by commas, as in {@code OTEL_RESOURCE_ATTRIBUTES}.
   * Entries without a key or a value are logged and skipped.
   */
  static Attributes parseResourceAttributes(String raw) {
    AttributesBuilder builder = Attributes.builder();
    if (raw == null) {
      return builder.build();
    }
    for (String entry : raw.split(",")) {
      String pair = entry.trim();
      int eq = pair.indexOf('=');
      if (pair.isEmpty()) {
        continue;
      }
      if (eq <= 0 || eq == pair.length() - 1) {
        log.warn("Ignoring malformed resource attribute entry: {}", pair);
        continue;
      }
      builder.put(AttributeKey.stringKey(pair.substring(0, eq).trim()), pair.substring(eq + 1).trim());
    }
    return builder.build();
  }

  private static String implementationVersion() {
    Package pkg = OpenTelemetryBootstrap.class.getPackage();
    String version = pkg == null ? null : pkg.getImplementationVersion();
    return version == null || version.isBlank() ? "0.0.0-dev" : version;
  }

  enum ExporterMode {
    OTLP,
    NONE;

    static ExporterMode from(String raw) {
      String value = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
      if (value.isEmpty() || value.equals("none")) {
        return NONE;
      }
      if (value.equals("otlp")) {
        return OTLP;
      }
      log.warn("Unknown metrics exporter '{}'; metrics disabled", raw);
      return NONE;
    }
  }

  /**
   * Exporter settings after property and environment lookup.
   *
   * @param exporter where metrics go
   * @param endpoint OTLP gRPC endpoint
   * @param resourceAttributes extra resource attributes
   */
  record Settings(ExporterMode exporter, String endpoint, Attributes resourceAttributes) {
    static final String DEFAULT_ENDPOINT = "http://localhost:4317";

    static Settings resolve(UnaryOperator<String> properties, UnaryOperator<String> environment) {
      ExporterMode exporter = ExporterMode.from(
          lookup(properties, "otel.metrics.exporter", environment, "OTEL_METRICS_EXPORTER"));
      String endpoint = lookup(properties, "otel.exporter.otlp.endpoint", environment, "OTEL_EXPORTER_OTLP_ENDPOINT");
      String attributes = lookup(properties, "otel.resource.attributes", environment, "OTEL_RESOURCE_ATTRIBUTES");
      return new Settings(
          exporter,
          endpoint == null ? DEFAULT_ENDPOINT : endpoint,
          parseResourceAttributes(attributes));
    }

    private static String lookup(
        UnaryOperator<String> properties, String property, UnaryOperator<String> environment, String variable) {
      String value = properties.apply(property);
      if (value == null || value.isBlank()) {
        value = environment.apply(variable);
      }
      return value == null || value.isBlank() ? null : value.trim();
    }
  }

  /** Meter plus the provider that owns it; the provider is {@code null} when export is off. */
  static final class MeterHandle implements AutoCloseable {
    private final Meter meter;
    private final SdkMeterProvider provider;

    private MeterHandle(Meter meter, SdkMeterProvider provider) {
      this.meter = meter;
      this.provider = provider;
    }

    static MeterHandle noop() {
      return new MeterHandle(MeterProvider.noop().get(INSTRUMENTATION_SCOPE), null);
    }

    Meter meter() {
      return meter;
    }

    boolean isNoop() {
      return provider == null;
    }

    void forceFlush() {
      if (provider != null) {
        await(provider.forceFlush(), "flush");
      }
    }

    @Override
    public void close() {
      if (provider == null) {
        return;
      }
      try {
        await(provider.shutdown(), "shutdown");
      } catch (RuntimeException ex) {
        log.warn("Meter provider shutdown failed", ex);
      }
    }

    private static void await(CompletableResultCode result, String operation) {
      result.join(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
      if (!result.isSuccess()) {
        log.warn("Metrics {} did not complete within {}s", operation, SHUTDOWN_TIMEOUT_SECONDS);
      }
    }
  }
}
