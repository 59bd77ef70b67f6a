package io.github.themoah.sigmon.config;

import io.vertx.core.DeploymentOptions;
import io.vertx.core.VertxOptions;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Vert.x configuration.
 *
 * <p>Baseline queries over several days of data can keep a worker thread busy for a long
 * time, so the worker blocked-thread warning is raised to VERTX_MAX_WORKER_EXECUTE_SECONDS
 * (default 300).
 */
public final class VertxConfig {

  private static final Logger log = LoggerFactory.getLogger(VertxConfig.class);
  private static final String ENV_MAX_WORKER_EXECUTE_SECONDS = "VERTX_MAX_WORKER_EXECUTE_SECONDS";
  private static final int DEFAULT_MAX_WORKER_EXECUTE_SECONDS = 300;

  private VertxConfig() {}

  public static VertxOptions createVertxOptions() {
    int maxWorkerSeconds = EnvParser.parseInt(ENV_MAX_WORKER_EXECUTE_SECONDS, DEFAULT_MAX_WORKER_EXECUTE_SECONDS);
    VertxOptions options = new VertxOptions();
    options.setPreferNativeTransport(true);
    options.setMaxWorkerExecuteTime(maxWorkerSeconds);
    options.setMaxWorkerExecuteTimeUnit(TimeUnit.SECONDS);
    log.info("Vert.x options: maxWorkerExecuteTime={}s", maxWorkerSeconds);
    return options;
  }

  public static DeploymentOptions createDeploymentOptions() {
    // A single instance keeps all detector state on one event loop
    return new DeploymentOptions().setInstances(1);
  }
}
