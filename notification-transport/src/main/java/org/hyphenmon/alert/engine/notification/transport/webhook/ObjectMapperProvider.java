package org.hyphenmon.alert.engine.notification.transport.webhook;

import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

public class ObjectMapperProvider {
  private static volatile ObjectMapper objectMapper;

  private ObjectMapperProvider() {}

  public static ObjectMapper get() {
    if (objectMapper == null) {
      synchronized (ObjectMapperProvider.class) {
        if (objectMapper == null) {
          objectMapper =
              new ObjectMapper()
                  .setSerializationInclusion(Include.NON_NULL)
                  .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
        }
      }
    }
    return objectMapper;
  }
}
