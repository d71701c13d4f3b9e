package org.alerttuning.engine.event.datamodel;

import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

public class ObjectMapperProvider {
  private static volatile ObjectMapper objectMapper;

  public static ObjectMapper get() {
    if (objectMapper == null) {
      synchronized (ObjectMapperProvider.class) {
        if (objectMapper == null) {
          objectMapper =
              new ObjectMapper()
                  .registerModule(new JavaTimeModule())
                  .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                  .setSerializationInclusion(Include.NON_NULL)
                  .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                  .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        }
      }
    }
    return objectMapper;
  }
}
