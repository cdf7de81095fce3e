package org.hyphenmon.alert.engine.metric.anomaly.detector;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import com.typesafe.config.Config;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.apache.commons.lang3.StringUtils;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.Severity;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.rule.AllOfCondition;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.rule.AnomalyRule;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.rule.AppThresholdCondition;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.rule.ExternalThresholdCondition;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.rule.RuleCondition;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.rule.ThresholdOperator;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.rule.source.RuleSource;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.rule.source.RuleSourceProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads the anomaly rule set. Rules come from the configured {@code alertRuleSource}; without one
 * the built-in error-rate rule is used, with its threshold taken from {@code
 * detector.errorRateThreshold}.
 */
public class AnomalyRuleReader {

  private static final Logger LOGGER = LoggerFactory.getLogger(AnomalyRuleReader.class);
  public static final String ALERT_RULE_SOURCE = "alertRuleSource";
  public static final String ERROR_RATE_THRESHOLD = "detector.errorRateThreshold";
  public static final String DEFAULT_RULE_ID = "error-rate-exceeded";
  static final String ERROR_RATE_FIELD = "error_rate";
  static final double DEFAULT_ERROR_RATE_THRESHOLD = 0.5;
  static final String DEFAULT_MESSAGE_TEMPLATE =
      "Error rate {value} exceeded threshold at {timestamp} ({matched_count} correlated"
          + " monitoring records in [{window_start}, {window_end}])";
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  private AnomalyRuleReader() {}

  public static List<AnomalyRule> readRules(Config appConfig) throws IOException {
    if (!appConfig.hasPath(ALERT_RULE_SOURCE)) {
      double threshold =
          appConfig.hasPath(ERROR_RATE_THRESHOLD)
              ? appConfig.getDouble(ERROR_RATE_THRESHOLD)
              : DEFAULT_ERROR_RATE_THRESHOLD;
      LOGGER.info(
          "No rule source configured, using {} with threshold {}", DEFAULT_RULE_ID, threshold);
      return List.of(errorRateRule(threshold));
    }
    return readRules(RuleSourceProvider.getProvider(appConfig.getConfig(ALERT_RULE_SOURCE)));
  }

  @VisibleForTesting
  static List<AnomalyRule> readRules(RuleSource ruleSource) throws IOException {
    List<AnomalyRule> rules = new ArrayList<>();
    Set<String> ruleIds = new HashSet<>();
    for (JsonNode node : ruleSource.getAllRules(jsonNode -> true)) {
      AnomalyRule rule;
      try {
        rule = OBJECT_MAPPER.treeToValue(node, AnomalyRule.class);
      } catch (JsonProcessingException e) {
        LOGGER.error("Skipping rule that could not be parsed: {}", node, e);
        continue;
      }
      if (!isValid(rule)) {
        LOGGER.error("Skipping invalid rule: {}", rule);
        continue;
      }
      if (!ruleIds.add(rule.getId())) {
        LOGGER.error("Skipping rule with duplicate id: {}", rule.getId());
        continue;
      }
      rules.add(rule);
    }
    LOGGER.info("Loaded {} anomaly rules", rules.size());
    return List.copyOf(rules);
  }

  public static AnomalyRule errorRateRule(double threshold) {
    return AnomalyRule.builder()
        .id(DEFAULT_RULE_ID)
        .severity(Severity.CRITICAL)
        .messageTemplate(DEFAULT_MESSAGE_TEMPLATE)
        .condition(
            AppThresholdCondition.builder()
                .field(ERROR_RATE_FIELD)
                .operator(ThresholdOperator.GT)
                .threshold(threshold)
                .build())
        .build();
  }

  @VisibleForTesting
  static boolean isValid(AnomalyRule rule) {
    return StringUtils.isNotBlank(rule.getId())
        && rule.getSeverity() != null
        && StringUtils.isNotBlank(rule.getMessageTemplate())
        && isValid(rule.getCondition());
  }

  private static boolean isValid(RuleCondition condition) {
    if (condition == null || condition.getType() == null) {
      return false;
    }
    switch (condition.getType()) {
      case APP_THRESHOLD:
        AppThresholdCondition app = (AppThresholdCondition) condition;
        return StringUtils.isNotBlank(app.getField())
            && app.getOperator() != null
            && isFinite(app.getThreshold());
      case EXTERNAL_THRESHOLD:
        ExternalThresholdCondition external = (ExternalThresholdCondition) condition;
        return StringUtils.isNotBlank(external.getItem())
            && external.getOperator() != null
            && isFinite(external.getThreshold());
      case UNMATCHED:
        return true;
      case ALL_OF:
        List<RuleCondition> nested = ((AllOfCondition) condition).getConditions();
        return !nested.isEmpty() && nested.stream().allMatch(AnomalyRuleReader::isValid);
      default:
        return false;
    }
  }

  private static boolean isFinite(Double value) {
    return value != null && Double.isFinite(value);
  }
}
