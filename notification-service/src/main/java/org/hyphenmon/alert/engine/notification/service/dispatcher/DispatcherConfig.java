package org.hyphenmon.alert.engine.notification.service.dispatcher;

import com.typesafe.config.Config;
import java.time.Duration;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DispatcherConfig {
  public static final String DISPATCHER_CONFIG = "dispatcher";
  private static final String SUPPRESSION_PERIOD = "suppressionPeriod";
  private static final String MAX_ATTEMPTS = "maxAttempts";
  private static final String CHANNEL_TIMEOUT = "channelTimeout";

  @Builder.Default Duration suppressionPeriod = Duration.ofMinutes(15);
  @Builder.Default int maxAttempts = 5;
  @Builder.Default Duration channelTimeout = Duration.ofSeconds(10);

  public static DispatcherConfig from(Config appConfig) {
    DispatcherConfigBuilder builder = DispatcherConfig.builder();
    if (!appConfig.hasPath(DISPATCHER_CONFIG)) {
      return builder.build();
    }
    Config config = appConfig.getConfig(DISPATCHER_CONFIG);
    if (config.hasPath(SUPPRESSION_PERIOD)) {
      builder.suppressionPeriod(config.getDuration(SUPPRESSION_PERIOD));
    }
    if (config.hasPath(MAX_ATTEMPTS)) {
      builder.maxAttempts(config.getInt(MAX_ATTEMPTS));
    }
    if (config.hasPath(CHANNEL_TIMEOUT)) {
      builder.channelTimeout(config.getDuration(CHANNEL_TIMEOUT));
    }
    return builder.build();
  }
}
