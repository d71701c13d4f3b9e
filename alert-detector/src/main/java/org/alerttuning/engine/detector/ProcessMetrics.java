package org.alerttuning.engine.detector;

public interface ProcessMetrics {
  ProcessSnapshot snapshot();
}
