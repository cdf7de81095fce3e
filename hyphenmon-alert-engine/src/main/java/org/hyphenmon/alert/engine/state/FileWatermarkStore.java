package org.hyphenmon.alert.engine.state;

import com.fasterxml.jackson.core.type.TypeReference;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.Watermark;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.store.WatermarkStore;

public class FileWatermarkStore implements WatermarkStore {
  private final JsonStateFile<Watermark> file;

  public FileWatermarkStore(Path path) {
    this.file = new JsonStateFile<>(path, new TypeReference<Watermark>() {});
  }

  @Override
  public synchronized Optional<Watermark> read() throws IOException {
    return file.read();
  }

  @Override
  public synchronized void write(Watermark watermark) throws IOException {
    file.write(watermark);
  }
}
