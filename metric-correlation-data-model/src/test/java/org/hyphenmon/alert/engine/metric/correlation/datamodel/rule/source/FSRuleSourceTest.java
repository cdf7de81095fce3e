package org.hyphenmon.alert.engine.metric.correlation.datamodel.rule.source;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import java.io.File;
import java.io.IOException;
import java.net.URL;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.Severity;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.rule.AllOfCondition;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.rule.AnomalyRule;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.rule.AppThresholdCondition;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.rule.ThresholdOperator;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.rule.UnmatchedCondition;
import org.junit.jupiter.api.Test;

class FSRuleSourceTest {

  private static String resourcePath(String name) throws Exception {
    URL url = Thread.currentThread().getContextClassLoader().getResource(name);
    File file = Paths.get(url.toURI()).toFile();
    return file.getAbsolutePath();
  }

  @Test
  void testReadAllRules() throws Exception {
    Config ruleSourceConfig =
        ConfigFactory.parseMap(
            Map.of("type", "fs", "fs.path", resourcePath("anomaly-rules.json")));
    RuleSource ruleSource = RuleSourceProvider.getProvider(ruleSourceConfig);

    List<JsonNode> rules = ruleSource.getAllRules(node -> true);
    assertEquals(2, rules.size());

    List<JsonNode> critical =
        ruleSource.getAllRules(node -> "CRITICAL".equals(node.get("severity").asText()));
    assertEquals(1, critical.size());
    assertEquals("error-rate-exceeded", critical.get(0).get("id").asText());
  }

  @Test
  void testRulesBindToTaggedConditions() throws Exception {
    RuleSource ruleSource =
        new FSRuleSource(
            ConfigFactory.parseMap(Map.of("path", resourcePath("anomaly-rules.json"))));
    ObjectMapper objectMapper = new ObjectMapper();
    List<JsonNode> nodes = ruleSource.getAllRules(node -> true);

    AnomalyRule errorRate = objectMapper.treeToValue(nodes.get(0), AnomalyRule.class);
    assertEquals(Severity.CRITICAL, errorRate.getSeverity());
    AppThresholdCondition condition =
        assertInstanceOf(AppThresholdCondition.class, errorRate.getCondition());
    assertEquals("error_rate", condition.getField());
    assertEquals(ThresholdOperator.GT, condition.getOperator());
    assertEquals(0.5, condition.getThreshold());

    AnomalyRule composite = objectMapper.treeToValue(nodes.get(1), AnomalyRule.class);
    AllOfCondition allOf = assertInstanceOf(AllOfCondition.class, composite.getCondition());
    assertEquals(2, allOf.getConditions().size());
    assertInstanceOf(UnmatchedCondition.class, allOf.getConditions().get(1));
  }

  @Test
  void testFileMustContainArray() throws Exception {
    RuleSource ruleSource =
        new FSRuleSource(ConfigFactory.parseMap(Map.of("path", resourcePath("not-an-array.json"))));
    assertThrows(IOException.class, () -> ruleSource.getAllRules(node -> true));
  }

  @Test
  void testUnknownRuleSourceType() {
    Config ruleSourceConfig = ConfigFactory.parseMap(Map.of("type", "dataStore"));
    assertThrows(RuntimeException.class, () -> RuleSourceProvider.getProvider(ruleSourceConfig));
  }
}
