package io.github.themoah.sigmon.engine;

/**
 * Thrown when anomaly detection is requested before any baseline was initialized.
 */
public class BaselineNotInitializedException extends IllegalStateException {

  public BaselineNotInitializedException() {
    super("Baseline not initialised");
  }
}
