package org.hyphenmon.alert.engine.metric.correlation.datamodel.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Timer;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/** Thin facade over the Micrometer global registry, shared by all modules of the engine. */
public class EngineMetricsRegistry {

  private EngineMetricsRegistry() {}

  public static void addRegistry(MeterRegistry registry) {
    Metrics.addRegistry(registry);
  }

  public static Counter registerCounter(String name, Map<String, String> tags) {
    return Counter.builder(name).tags(toTags(tags)).register(Metrics.globalRegistry);
  }

  public static Timer registerTimer(String name, Map<String, String> tags) {
    return Timer.builder(name).tags(toTags(tags)).register(Metrics.globalRegistry);
  }

  private static List<Tag> toTags(Map<String, String> tags) {
    return tags.entrySet().stream()
        .map(e -> Tag.of(e.getKey(), e.getValue()))
        .collect(Collectors.toList());
  }
}
