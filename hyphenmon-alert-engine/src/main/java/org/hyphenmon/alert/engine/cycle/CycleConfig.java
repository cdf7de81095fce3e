package org.hyphenmon.alert.engine.cycle;

import com.typesafe.config.Config;
import java.time.Duration;
import lombok.Builder;
import lombok.Value;

/** Settings of the correlation cycle, read from the {@code correlation} block. */
@Value
@Builder
public class CycleConfig {
  public static final String CORRELATION_CONFIG = "correlation";
  private static final String WINDOW_SECONDS = "windowSeconds";
  private static final String MAX_LOOKBACK = "maxLookback";
  private static final String FETCH_TIMEOUT = "fetchTimeout";

  @Builder.Default long windowSeconds = 10;
  @Builder.Default Duration maxLookback = Duration.ofMinutes(2);
  @Builder.Default Duration fetchTimeout = Duration.ofSeconds(10);

  public static CycleConfig from(Config appConfig) {
    CycleConfigBuilder builder = CycleConfig.builder();
    if (!appConfig.hasPath(CORRELATION_CONFIG)) {
      return builder.build();
    }
    Config config = appConfig.getConfig(CORRELATION_CONFIG);
    if (config.hasPath(WINDOW_SECONDS)) {
      builder.windowSeconds(config.getLong(WINDOW_SECONDS));
    }
    if (config.hasPath(MAX_LOOKBACK)) {
      builder.maxLookback(config.getDuration(MAX_LOOKBACK));
    }
    if (config.hasPath(FETCH_TIMEOUT)) {
      builder.fetchTimeout(config.getDuration(FETCH_TIMEOUT));
    }
    return builder.build();
  }
}
