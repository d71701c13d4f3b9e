package org.alerttuning.engine.detector;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import org.alerttuning.engine.event.datamodel.AlertEvent;
import org.alerttuning.engine.event.datamodel.AlertEventCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Appends events to {@code <dir>/<service>-alert-data.ndjson}, one JSON object per line. */
public class NdjsonAlertEventLog implements AlertEventSink {
  private static final Logger LOGGER = LoggerFactory.getLogger(NdjsonAlertEventLog.class);
  private static final String FILE_SUFFIX = "-alert-data.ndjson";

  private final Path logFile;

  public NdjsonAlertEventLog(Path logDirectory, String serviceName) {
    this.logFile = logDirectory.resolve(serviceName + FILE_SUFFIX);
    try {
      Files.createDirectories(logDirectory);
    } catch (IOException e) {
      LOGGER.error("Failed to create alert log directory:{}", logDirectory, e);
    }
  }

  public Path getLogFile() {
    return logFile;
  }

  @Override
  public synchronized void append(AlertEvent alertEvent) {
    try {
      Files.writeString(
          logFile,
          AlertEventCodec.toJsonLine(alertEvent) + "\n",
          StandardCharsets.UTF_8,
          StandardOpenOption.CREATE,
          StandardOpenOption.APPEND);
    } catch (IOException e) {
      LOGGER.error("Failed to write alert event:{} to file:{}", alertEvent, logFile, e);
    }
  }
}
