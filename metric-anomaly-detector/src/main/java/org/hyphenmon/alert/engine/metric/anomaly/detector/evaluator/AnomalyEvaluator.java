package org.hyphenmon.alert.engine.metric.anomaly.detector.evaluator;

import io.micrometer.core.instrument.Counter;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.AlertEvent;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.CorrelationResult;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.exception.RuleEvaluationException;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.metrics.EngineMetricsRegistry;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.rule.AnomalyRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies anomaly rules to correlation results. Every (result, rule) pair whose condition holds
 * yields one {@link AlertEvent}; results are visited in input order and rules in list order.
 */
public class AnomalyEvaluator {

  private static final Logger LOGGER = LoggerFactory.getLogger(AnomalyEvaluator.class);
  private static final ConcurrentMap<String, Counter> ruleFiredCounter = new ConcurrentHashMap<>();
  private static final String RULE_FIRED_COUNTER = "hyphenmon.alert.engine.detector.rule.fired";
  private static final ConcurrentMap<String, Counter> ruleErrorCounter = new ConcurrentHashMap<>();
  private static final String RULE_ERROR_COUNTER = "hyphenmon.alert.engine.detector.rule.error";

  private final Clock clock;
  private final ConditionEvaluator conditionEvaluator = new ConditionEvaluator();
  private final AlertMessageRenderer messageRenderer = new AlertMessageRenderer();

  public AnomalyEvaluator(Clock clock) {
    this.clock = clock;
  }

  public List<AlertEvent> evaluate(List<CorrelationResult> results, List<AnomalyRule> rules) {
    if (results.isEmpty() || rules.isEmpty()) {
      return Collections.emptyList();
    }
    long createdAt = clock.instant().getEpochSecond();
    List<AlertEvent> events = new ArrayList<>();
    for (CorrelationResult result : results) {
      for (AnomalyRule rule : rules) {
        if (!conditionHolds(rule, result)) {
          continue;
        }
        AlertEvent event =
            AlertEvent.builder()
                .ruleId(rule.getId())
                .fingerprint(AlertFingerprint.of(rule.getId(), result))
                .severity(rule.getSeverity())
                .message(messageRenderer.render(rule, result))
                .createdAt(createdAt)
                .build();
        LOGGER.debug("Rule {} fired, fingerprint {}", rule.getId(), event.getFingerprint());
        ruleFiredCounter
            .computeIfAbsent(
                rule.getId(),
                k -> EngineMetricsRegistry.registerCounter(RULE_FIRED_COUNTER, Map.of("ruleId", k)))
            .increment();
        events.add(event);
      }
    }
    return Collections.unmodifiableList(events);
  }

  private boolean conditionHolds(AnomalyRule rule, CorrelationResult result) {
    try {
      return conditionEvaluator.holds(rule.getCondition(), result);
    } catch (RuntimeException e) {
      RuleEvaluationException error = new RuleEvaluationException(rule.getId(), e);
      LOGGER.warn("Rule configuration problem, treating condition as false", error);
      ruleErrorCounter
          .computeIfAbsent(
              rule.getId(),
              k -> EngineMetricsRegistry.registerCounter(RULE_ERROR_COUNTER, Map.of("ruleId", k)))
          .increment();
      return false;
    }
  }
}
