package io.github.themoah.sigmon.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;

import io.vertx.core.Vertx;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * Tests for loading the YAML configuration file.
 */
@ExtendWith(VertxExtension.class)
public class ConfigLoaderTest {

  @Test
  void load_yamlFile(Vertx vertx, VertxTestContext testContext) {
    ConfigLoader.load(vertx, "src/test/resources/detector-config.yaml")
      .onComplete(testContext.succeeding(config -> testContext.verify(() -> {
        assertEquals("test-project", config.projectId());
        assertEquals(List.of(
          "compute.googleapis.com/instance/cpu/utilization",
          "custom.googleapis.com/queue/depth"), config.metrics());
        assertEquals(Duration.ofSeconds(30), config.pollingInterval());
        assertEquals(Duration.ofDays(3), config.baselineDuration());
        assertEquals(Duration.ofMinutes(10), config.recentDuration());
        assertEquals(2.5, config.zScoreThreshold());
        assertEquals("resource.labels.zone=\"us-central1-a\"",
          config.filterFor("compute.googleapis.com/instance/cpu/utilization"));
        testContext.completeNow();
      })));
  }

  @Test
  void load_missingFile_failsWithConfigException(Vertx vertx, VertxTestContext testContext) {
    ConfigLoader.load(vertx, "src/test/resources/does-not-exist.yaml")
      .onComplete(testContext.failing(err -> testContext.verify(() -> {
        assertInstanceOf(ConfigException.class, err);
        testContext.completeNow();
      })));
  }

  @Test
  void load_invalidDocument_failsWithConfigException(Vertx vertx, VertxTestContext testContext) {
    ConfigLoader.load(vertx, "src/test/resources/invalid-config.yaml")
      .onComplete(testContext.failing(err -> testContext.verify(() -> {
        assertInstanceOf(ConfigException.class, err);
        testContext.completeNow();
      })));
  }
}
