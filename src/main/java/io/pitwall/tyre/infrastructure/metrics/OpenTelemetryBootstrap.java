package io.pitwall.tyre.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
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
 * Builds the OpenTelemetry meter provider for the tyre model.
 *
 * <p>The model is usually embedded in a replay viewer, so nothing is exported unless
 * {@code otel.metrics.exporter=otlp} (or {@code OTEL_METRICS_EXPORTER}) is set. System properties win over
 * environment variables.</p>
 */
final class OpenTelemetryBootstrap {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);
  private static final String SCOPE = "io.pitwall.tyre";
  private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;
  private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
  private static final AttributeKey<String> SERVICE_NAMESPACE = AttributeKey.stringKey("service.namespace");
  private static final AttributeKey<String> SERVICE_VERSION = AttributeKey.stringKey("service.version");

  private OpenTelemetryBootstrap() {
    // Utility class
  }

  /** Resolves exporter settings from the running JVM and builds the matching meter provider. */
  static BootstrapResult initialize() {
    ExporterSettings settings;
    try {
      settings = ExporterSettings.resolve(System::getProperty, System::getenv);
    } catch (IllegalArgumentException ex) {
      log.warn("Invalid metrics exporter settings; metrics disabled: {}", ex.getMessage());
      return BootstrapResult.noop();
    }
    if (settings.mode() == ExporterMode.NONE) {
      log.debug("Tyre model metrics export disabled");
      return BootstrapResult.noop();
    }
    try {
      MetricReader reader = PeriodicMetricReader.builder(
              OtlpGrpcMetricExporter.builder().setEndpoint(settings.endpoint()).build())
          .setInterval(settings.interval())
          .build();
      log.info("Exporting tyre model metrics to {} every {}s", settings.endpoint(), settings.interval().toSeconds());
      return build(reader);
    } catch (RuntimeException ex) {
      log.error("Failed to start OTLP metrics export; metrics disabled", ex);
      return BootstrapResult.noop();
    }
  }

  static BootstrapResult forTesting(MetricReader reader) {
    return build(Objects.requireNonNull(reader, "reader"));
  }

  private static BootstrapResult build(MetricReader reader) {
    String version = serviceVersion();
    Resource resource = Resource.getDefault().merge(Resource.create(Attributes.of(
        SERVICE_NAME, "pitwall-tyre",
        SERVICE_NAMESPACE, "io.pitwall",
        SERVICE_VERSION, version)));
    SdkMeterProvider provider = SdkMeterProvider.builder()
        .setResource(resource)
        .registerMetricReader(reader)
        .build();
    return new BootstrapResult(provider.meterBuilder(SCOPE).setInstrumentationVersion(version).build(), provider);
  }

  private static String serviceVersion() {
    Package pkg = OpenTelemetryBootstrap.class.getPackage();
    String version = pkg == null ? null : pkg.getImplementationVersion();
    return version == null || version.isBlank() ? "dev" : version;
  }

  enum ExporterMode {
    OTLP,
    NONE;

    static ExporterMode parse(String raw) {
      return switch (raw.trim().toLowerCase(Locale.ROOT)) {
        case "none", "" -> NONE;
        case "otlp" -> OTLP;
        default -> throw new IllegalArgumentException("unsupported metrics exporter '" + raw + "'");
      };
    }
  }

  /**
   * Where and how often metrics are pushed.
   *
   * @param mode exporter selection
   * @param endpoint OTLP gRPC endpoint
   * @param interval push interval
   */
  record ExporterSettings(ExporterMode mode, String endpoint, Duration interval) {
    static final String DEFAULT_ENDPOINT = "http://localhost:4317";
    static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(30);

    /**
     * Reads {@code otel.metrics.exporter}, {@code otel.exporter.otlp.endpoint} and
     * {@code otel.metric.export.interval} (milliseconds), each falling back to its upper-case environment variable.
     *
     * @param properties system property lookup
     * @param environment environment variable lookup
     * @return resolved settings; exporting is off when nothing is set
     * @throws IllegalArgumentException when the exporter is unknown or the interval is not a positive number
     */
    static ExporterSettings resolve(UnaryOperator<String> properties, UnaryOperator<String> environment) {
      String exporter = lookup(properties, environment, "otel.metrics.exporter");
      String endpoint = lookup(properties, environment, "otel.exporter.otlp.endpoint");
      String interval = lookup(properties, environment, "otel.metric.export.interval");
      return new ExporterSettings(
          exporter == null ? ExporterMode.NONE : ExporterMode.parse(exporter),
          endpoint == null ? DEFAULT_ENDPOINT : endpoint,
          interval == null ? DEFAULT_INTERVAL : parseInterval(interval));
    }

    private static String lookup(UnaryOperator<String> properties, UnaryOperator<String> environment, String key) {
      String value = properties.apply(key);
      if (value == null || value.isBlank()) {
        value = environment.apply(key.toUpperCase(Locale.ROOT).replace('.', '_'));
      }
      return value == null || value.isBlank() ? null : value.trim();
    }

    private static Duration parseInterval(String raw) {
      long millis;
      try {
        millis = Long.parseLong(raw);
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException("metric export interval must be milliseconds (was '" + raw + "')", ex);
      }
      if (millis <= 0) {
        throw new IllegalArgumentException("metric export interval must be positive (was " + millis + ")");
      }
      return Duration.ofMillis(millis);
    }
  }

  /** Meter plus the provider that owns it; the provider is {@code null} in noop mode. */
  static final class BootstrapResult implements AutoCloseable {
    private final Meter meter;
    private final SdkMeterProvider provider;

    private BootstrapResult(Meter meter, SdkMeterProvider provider) {
      this.meter = meter;
      this.provider = provider;
    }

    static BootstrapResult noop() {
      return new BootstrapResult(MeterProvider.noop().get(SCOPE), null);
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
      if (provider != null) {
        await(provider.shutdown(), "shutdown");
      }
    }

    private static void await(CompletableResultCode result, String operation) {
      result.join(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
      if (!result.isSuccess()) {
        log.warn("Tyre model metrics {} did not complete within {}s", operation, SHUTDOWN_TIMEOUT_SECONDS);
      }
    }
  }
}
