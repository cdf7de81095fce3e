package org.hyphenmon.alert.engine.metric.anomaly.detector.evaluator;

import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import java.nio.charset.StandardCharsets;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.CorrelationResult;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.MetricRecord;

/**
 * Stable identity of an incident: a SHA-256 over the rule id, the identities of the records that
 * took part in the result and the window start. Equal inputs give equal fingerprints across
 * processes and restarts.
 */
public class AlertFingerprint {
  private static final char SEPARATOR = '|';

  private AlertFingerprint() {}

  public static String of(String ruleId, CorrelationResult result) {
    Hasher hasher = Hashing.sha256().newHasher();
    hasher.putString(ruleId, StandardCharsets.UTF_8).putChar(SEPARATOR);
    hasher
        .putString(
            result.getAppRecordIfPresent().map(MetricRecord::identity).orElse("-"),
            StandardCharsets.UTF_8)
        .putChar(SEPARATOR);
    for (MetricRecord external : result.getExternalRecords()) {
      hasher.putString(external.identity(), StandardCharsets.UTF_8).putChar(SEPARATOR);
    }
    hasher.putLong(result.getWindowStart());
    return hasher.hash().toString();
  }
}
