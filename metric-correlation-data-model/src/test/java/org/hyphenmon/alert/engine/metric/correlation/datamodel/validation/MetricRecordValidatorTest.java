package org.hyphenmon.alert.engine.metric.correlation.datamodel.validation;

import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.stream.Stream;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.MetricRecord;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.MetricSource;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.exception.MalformedRecordException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

class MetricRecordValidatorTest {

  private static MetricRecord.MetricRecordBuilder valid() {
    return MetricRecord.builder()
        .source(MetricSource.APP)
        .key("error_rate")
        .timestamp(1_000)
        .value(0.2)
        .recordedAt(1_001);
  }

  @Test
  void testValidRecordPasses() {
    MetricRecord record = valid().build();
    assertSame(record, MetricRecordValidator.validate(record, MetricSource.APP));
  }

  @ParameterizedTest
  @MethodSource("provideMalformedRecords")
  void testMalformedRecordsAreRejected(MetricRecord record) {
    assertThrows(
        MalformedRecordException.class,
        () -> MetricRecordValidator.validate(record, MetricSource.APP));
  }

  private static Stream<Arguments> provideMalformedRecords() {
    return Stream.of(
        Arguments.of(valid().source(MetricSource.EXTERNAL).build()),
        Arguments.of(valid().key(null).build()),
        Arguments.of(valid().key(" ").build()),
        Arguments.of(valid().timestamp(0).build()),
        Arguments.of(valid().value(Double.NaN).build()),
        Arguments.of(valid().value(Double.POSITIVE_INFINITY).build()));
  }
}
