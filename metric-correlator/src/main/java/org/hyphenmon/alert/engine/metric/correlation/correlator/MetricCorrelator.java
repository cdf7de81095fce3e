package org.hyphenmon.alert.engine.metric.correlation.correlator;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.CorrelationResult;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.MetricRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Joins application records with the external records that fall within {@code windowSeconds} of
 * them. Application records drive the join: exactly one {@link CorrelationResult} is produced per
 * application record, in input order, whether or not external data is available.
 *
 * <p>Both inputs must be ordered by timestamp. The external sequence is scanned with a window that
 * only moves forward, so the join is linear in the size of both inputs plus the size of the
 * output.
 */
public class MetricCorrelator {
  private static final Logger LOGGER = LoggerFactory.getLogger(MetricCorrelator.class);

  public List<CorrelationResult> correlate(
      List<MetricRecord> appRecords, List<MetricRecord> externalRecords, long windowSeconds) {
    Preconditions.checkArgument(windowSeconds >= 0, "window must not be negative");
    Preconditions.checkArgument(
        isOrderedByTimestamp(appRecords), "application records must be ordered by timestamp");
    Preconditions.checkArgument(
        isOrderedByTimestamp(externalRecords), "external records must be ordered by timestamp");

    List<CorrelationResult> results = new ArrayList<>(appRecords.size());
    int windowLow = 0;
    int matchedCount = 0;
    for (MetricRecord appRecord : appRecords) {
      long windowStart = appRecord.getTimestamp() - windowSeconds;
      long windowEnd = appRecord.getTimestamp() + windowSeconds;

      while (windowLow < externalRecords.size()
          && externalRecords.get(windowLow).getTimestamp() < windowStart) {
        windowLow++;
      }

      List<MetricRecord> matches = new ArrayList<>();
      for (int i = windowLow;
          i < externalRecords.size() && externalRecords.get(i).getTimestamp() <= windowEnd;
          i++) {
        matches.add(externalRecords.get(i));
      }

      if (!matches.isEmpty()) {
        matchedCount++;
      }
      results.add(
          CorrelationResult.builder()
              .appRecord(appRecord)
              .externalRecords(Collections.unmodifiableList(matches))
              .windowStart(windowStart)
              .windowEnd(windowEnd)
              .matched(!matches.isEmpty())
              .build());
    }

    LOGGER.debug(
        "Correlated {} application records against {} external records, {} matched",
        appRecords.size(),
        externalRecords.size(),
        matchedCount);
    return Collections.unmodifiableList(results);
  }

  private static boolean isOrderedByTimestamp(List<MetricRecord> records) {
    for (int i = 1; i < records.size(); i++) {
      if (records.get(i - 1).getTimestamp() > records.get(i).getTimestamp()) {
        return false;
      }
    }
    return true;
  }
}
