package org.hyphenmon.alert.engine.metric.correlation.datamodel.exception;

public class RuleEvaluationException extends RuntimeException {
  private final String ruleId;

  public RuleEvaluationException(String ruleId, Throwable cause) {
    super(String.format("Rule %s failed to evaluate", ruleId), cause);
    this.ruleId = ruleId;
  }

  public String getRuleId() {
    return ruleId;
  }
}
