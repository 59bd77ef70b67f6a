package io.github.themoah.sigmon;

import io.github.themoah.sigmon.config.VertxConfig;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process entry point: deploys the MainVerticle and exits on startup failure.
 */
public class SigmonLauncher {

  private static final Logger log = LoggerFactory.getLogger(SigmonLauncher.class);

  public static void main(String[] args) {
    Vertx vertx = Vertx.vertx(VertxConfig.createVertxOptions());

    vertx.deployVerticle(new MainVerticle(), VertxConfig.createDeploymentOptions())
      .onSuccess(id -> log.info("MainVerticle deployed with ID: {}", id))
      .onFailure(err -> {
        log.error("Failed to deploy MainVerticle", err);
        vertx.close();
        System.exit(1);
      });
  }
}
