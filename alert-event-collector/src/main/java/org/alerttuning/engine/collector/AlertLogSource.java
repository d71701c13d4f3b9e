package org.alerttuning.engine.collector;

import com.typesafe.config.Config;
import java.nio.file.Path;
import java.nio.file.Paths;
import lombok.Value;

/** The NDJSON alert log written by one service. */
@Value
public class AlertLogSource {
  private static final String SERVICE_NAME_CONFIG = "serviceName";
  private static final String PATH_CONFIG = "path";

  String serviceName;
  Path path;

  public static AlertLogSource fromConfig(Config sourceConfig) {
    return new AlertLogSource(
        sourceConfig.getString(SERVICE_NAME_CONFIG),
        Paths.get(sourceConfig.getString(PATH_CONFIG)));
  }
}
