package io.pitwall.tyre.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.pitwall.tyre.infrastructure.metrics.OpenTelemetryBootstrap.ExporterMode;
import io.pitwall.tyre.infrastructure.metrics.OpenTelemetryBootstrap.ExporterSettings;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryBootstrapNoopTest {
  private String previousExporter;

  @AfterEach
  void resetProperties() {
    if (previousExporter == null) {
      System.clearProperty("otel.metrics.exporter");
    } else {
      System.setProperty("otel.metrics.exporter", previousExporter);
    }
  }

  @Test
  void exporterNoneFallsBackToNoop() {
    previousExporter = System.getProperty("otel.metrics.exporter");
    System.setProperty("otel.metrics.exporter", "none");

    OpenTelemetryBootstrap.BootstrapResult result = OpenTelemetryBootstrap.initialize();
    assertTrue(result.isNoop(), "Expected noop metrics bootstrap when exporter=none");
    result.close();
  }

  @Test
  void unknownExporterFallsBackToNoop() {
    previousExporter = System.getProperty("otel.metrics.exporter");
    System.setProperty("otel.metrics.exporter", "prometheus");

    try (OpenTelemetryMetricsAdapter adapter = new OpenTelemetryMetricsAdapter()) {
      adapter.increment("tyre.fit.completed");
      adapter.observe("tyre.fit.laps.prepared", 42L);
    }
  }

  @Test
  void settingsDefaultToNoExport() {
    ExporterSettings settings = ExporterSettings.resolve(key -> null, key -> null);

    assertEquals(ExporterMode.NONE, settings.mode());
    assertEquals(ExporterSettings.DEFAULT_ENDPOINT, settings.endpoint());
    assertEquals(ExporterSettings.DEFAULT_INTERVAL, settings.interval());
  }

  @Test
  void propertiesOverrideEnvironment() {
    Map<String, String> properties = Map.of("otel.metrics.exporter", "OTLP");
    Map<String, String> environment = Map.of(
        "OTEL_METRICS_EXPORTER", "none",
        "OTEL_EXPORTER_OTLP_ENDPOINT", "http://collector:4317",
        "OTEL_METRIC_EXPORT_INTERVAL", "5000");

    ExporterSettings settings = ExporterSettings.resolve(properties::get, environment::get);

    assertEquals(ExporterMode.OTLP, settings.mode());
    assertEquals("http://collector:4317", settings.endpoint());
    assertEquals(Duration.ofSeconds(5), settings.interval());
  }

  @Test
  void invalidIntervalIsRejected() {
    Map<String, String> properties = Map.of("otel.metric.export.interval", "soon");

    assertThrows(IllegalArgumentException.class, () -> ExporterSettings.resolve(properties::get, key -> null));
  }
}
