package ca.gc.cra.terf.infrastructure.metrics;

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
    try (OpenTelemetryBootstrap.BootstrapResult result = OpenTelemetryBootstrap.initialize()) {
      assertTrue(result.isNoop(), "Expected noop metrics bootstrap when exporter=none");
    }
  }

  @Test
  void unknownExporterDisablesMetrics() {
    assertEquals(OpenTelemetryBootstrap.ExporterMode.NONE, OpenTelemetryBootstrap.ExporterMode.from("prometheus"));
    assertEquals(OpenTelemetryBootstrap.ExporterMode.OTLP, OpenTelemetryBootstrap.ExporterMode.from(" OTLP "));
  }

  @Test
  void resourceAttributesSkipMalformedEntries() {
    Attributes attributes = OpenTelemetryBootstrap.parseResourceAttributes("env=dev, broken, team=ml=ops");
    assertEquals("dev", attributes.get(AttributeKey.stringKey("env")));
    assertEquals("ml=ops", attributes.get(AttributeKey.stringKey("team")));
    assertEquals(2, attributes.size());
  }
}
