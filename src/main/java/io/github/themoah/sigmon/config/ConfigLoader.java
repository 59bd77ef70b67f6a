package io.github.themoah.sigmon.config;

import io.vertx.config.ConfigRetriever;
import io.vertx.config.ConfigRetrieverOptions;
import io.vertx.config.ConfigStoreOptions;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads the YAML detector configuration with Vert.x Config.
 */
public final class ConfigLoader {

  private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

  static final String ENV_CONFIG_PATH = "SIGMON_CONFIG";
  static final String DEFAULT_CONFIG_PATH = "config.yaml";

  private ConfigLoader() {}

  /**
   * Loads the configuration from the path in SIGMON_CONFIG, or config.yaml.
   *
   * @param vertx the Vert.x instance
   * @return Future with the validated configuration, failed with {@link ConfigException}
   */
  public static Future<DetectorConfig> load(Vertx vertx) {
    String path = System.getenv(ENV_CONFIG_PATH);
    if (path == null || path.isBlank()) {
      path = DEFAULT_CONFIG_PATH;
    }
    return load(vertx, path);
  }

  /**
   * Loads the configuration from a YAML file.
   *
   * @param vertx the Vert.x instance
   * @param path the file path
   * @return Future with the validated configuration, failed with {@link ConfigException}
   */
  public static Future<DetectorConfig> load(Vertx vertx, String path) {
    log.info("Loading configuration from: {}", path);

    ConfigStoreOptions fileStore = new ConfigStoreOptions()
      .setType("file")
      .setFormat("yaml")
      .setOptional(false)
      .setConfig(new JsonObject().put("path", path));

    ConfigRetriever retriever = ConfigRetriever.create(vertx,
      new ConfigRetrieverOptions()
        .setIncludeDefaultStores(false)
        .setScanPeriod(0)
        .addStore(fileStore));

    return retriever.getConfig()
      .recover(err -> Future.failedFuture(
        new ConfigException("Failed to read configuration file " + path + ": " + err.getMessage(), err)))
      .map(DetectorConfig::fromJson)
      .onComplete(ar -> retriever.close())
      .onFailure(err -> log.error("Invalid configuration in {}: {}", path, err.getMessage()));
  }
}
