package ca.gc.cra.edgeingest.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryBootstrapTest {
  private String previousExporter;

  @BeforeEach
  void rememberProperties() {
    previousExporter = System.getProperty("otel.metrics.exporter");
  }

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
    System.setProperty("otel.metrics.exporter", "none");

    OpenTelemetryBootstrap.BootstrapResult result = OpenTelemetryBootstrap.initialize();
    assertTrue(result.isNoop(), "Expected noop metrics bootstrap when exporter=none");
    result.close();
  }

  @Test
  void unknownExporterFallsBackToNoop() {
    System.setProperty("otel.metrics.exporter", "prometheus");

    OpenTelemetryBootstrap.BootstrapResult result = OpenTelemetryBootstrap.initialize();
    assertTrue(result.isNoop());
    result.forceFlush();
    result.close();
  }

  @Test
  void noopAdapterAcceptsMeasurements() {
    try (OpenTelemetryMetricsAdapter adapter =
        new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult.noop())) {
      adapter.increment("ingest.lines.in");
      adapter.observe("ingest.line.bytes", 10L);
      adapter.forceFlush();
    }
  }

  @Test
  void resourceAttributesParseCommaSeparatedPairs() {
    Attributes attributes = OpenTelemetryBootstrap.parseResourceAttributes("deployment.environment=prod, site=edge-1,bad");

    assertEquals("prod", attributes.get(AttributeKey.stringKey("deployment.environment")));
    assertEquals("edge-1", attributes.get(AttributeKey.stringKey("site")));
    assertEquals(2, attributes.size());
  }
}
