package org.hyphenmon.alert.engine.metric.anomaly.detector.evaluator;

import com.google.common.base.Preconditions;
import java.util.Objects;
import java.util.Optional;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.CorrelationResult;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.MetricRecord;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.rule.AllOfCondition;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.rule.AppThresholdCondition;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.rule.ExternalThresholdCondition;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.rule.RuleCondition;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.rule.ThresholdOperator;

/** Interprets a {@link RuleCondition} against one correlation result. Has no side effects. */
class ConditionEvaluator {

  static final String ITEM_NAME_LABEL = "name";

  boolean holds(RuleCondition condition, CorrelationResult result) {
    Preconditions.checkArgument(condition != null, "rule has no condition");
    switch (condition.getType()) {
      case APP_THRESHOLD:
        return appThresholdHolds((AppThresholdCondition) condition, result);
      case EXTERNAL_THRESHOLD:
        return externalThresholdHolds((ExternalThresholdCondition) condition, result);
      case UNMATCHED:
        return result.getAppRecordIfPresent().isPresent() && !result.isMatched();
      case ALL_OF:
        return allOfHolds((AllOfCondition) condition, result);
      default:
        throw new UnsupportedOperationException(
            "Unsupported condition type: " + condition.getType());
    }
  }

  private boolean appThresholdHolds(AppThresholdCondition condition, CorrelationResult result) {
    Optional<MetricRecord> appRecord = result.getAppRecordIfPresent();
    if (appRecord.isEmpty() || condition.getField() == null) {
      return false;
    }
    if (!condition.getField().equals(appRecord.get().getKey())) {
      return false;
    }
    return compareThreshold(
        appRecord.get().getValue(), condition.getOperator(), condition.getThreshold());
  }

  private boolean externalThresholdHolds(
      ExternalThresholdCondition condition, CorrelationResult result) {
    if (condition.getItem() == null) {
      return false;
    }
    for (MetricRecord external : result.getExternalRecords()) {
      boolean sameItem =
          condition.getItem().equals(external.getKey())
              || condition.getItem().equals(external.getLabel(ITEM_NAME_LABEL));
      if (sameItem
          && compareThreshold(
              external.getValue(), condition.getOperator(), condition.getThreshold())) {
        return true;
      }
    }
    return false;
  }

  private boolean allOfHolds(AllOfCondition condition, CorrelationResult result) {
    Preconditions.checkArgument(
        !condition.getConditions().isEmpty(), "ALL_OF needs at least one nested condition");
    for (RuleCondition nested : condition.getConditions()) {
      if (!holds(nested, result)) {
        return false;
      }
    }
    return true;
  }

  boolean compareThreshold(double lhs, ThresholdOperator operator, Double rhs) {
    Objects.requireNonNull(operator, "threshold operator");
    Objects.requireNonNull(rhs, "threshold value");
    if (!Double.isFinite(lhs)) {
      return false;
    }
    return evalOperator(operator, lhs, rhs);
  }

  private boolean evalOperator(ThresholdOperator operator, double lhs, double rhs) {
    switch (operator) {
      case GT:
        return lhs > rhs;
      case LT:
        return lhs < rhs;
      case GTE:
        return lhs >= rhs;
      case LTE:
        return lhs <= rhs;
      default:
        throw new UnsupportedOperationException(
            "Unsupported threshold condition operator: " + operator);
    }
  }
}
