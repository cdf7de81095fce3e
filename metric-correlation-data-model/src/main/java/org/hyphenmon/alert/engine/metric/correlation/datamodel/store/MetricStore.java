package org.hyphenmon.alert.engine.metric.correlation.datamodel.store;

import java.util.List;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.MetricRecord;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.MetricSource;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.exception.TransientFetchException;

/** Append-only storage for both metric streams. */
public interface MetricStore {

  void append(MetricRecord record);

  /**
   * Returns the records of {@code source} with {@code since < recordedAt <= until}, ordered by
   * {@code timestamp} ascending.
   */
  List<MetricRecord> queryRange(MetricSource source, long since, long until)
      throws TransientFetchException;
}
