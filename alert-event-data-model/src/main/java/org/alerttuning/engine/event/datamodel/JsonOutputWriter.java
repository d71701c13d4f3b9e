package org.alerttuning.engine.event.datamodel;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/** Writes batch outputs as pretty-printed JSON, creating parent directories as needed. */
public class JsonOutputWriter {

  private JsonOutputWriter() {}

  public static void write(Object value, Path outputPath) throws IOException {
    Path parent = outputPath.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    ObjectMapperProvider.get()
        .writerWithDefaultPrettyPrinter()
        .writeValue(outputPath.toFile(), value);
  }
}
