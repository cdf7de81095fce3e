package org.hyphenmon.alert.engine.metric.correlation.datamodel.store;

import java.io.IOException;
import java.util.Optional;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.Watermark;

public interface WatermarkStore {

  Optional<Watermark> read() throws IOException;

  void write(Watermark watermark) throws IOException;
}
