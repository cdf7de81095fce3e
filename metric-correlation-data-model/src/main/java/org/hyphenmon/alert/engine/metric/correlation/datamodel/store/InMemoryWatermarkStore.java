package org.hyphenmon.alert.engine.metric.correlation.datamodel.store;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.Watermark;

public class InMemoryWatermarkStore implements WatermarkStore {
  private final AtomicReference<Watermark> watermark = new AtomicReference<>();

  @Override
  public Optional<Watermark> read() {
    return Optional.ofNullable(watermark.get());
  }

  @Override
  public void write(Watermark watermark) {
    this.watermark.set(watermark);
  }
}
