package org.hyphenmon.alert.engine.metric.ingestion.job;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.typesafe.config.ConfigFactory;
import java.util.Map;
import org.hyphenmon.alert.engine.metric.ingestion.MetricIngestor;
import org.junit.jupiter.api.Test;
import org.quartz.JobExecutionContext;
import org.quartz.SimpleTrigger;

class IngestionJobManagerTest {

  @Test
  void testJobIsScheduledWithConfiguredInterval() {
    MetricIngestor ingestor = mock(MetricIngestor.class);
    IngestionJobManager jobManager = new IngestionJobManager(ingestor);

    jobManager.initJob(ConfigFactory.parseMap(Map.of("ingestion.intervalSeconds", 15)));

    SimpleTrigger trigger = (SimpleTrigger) jobManager.getJobTrigger();
    assertEquals(15_000, trigger.getRepeatInterval());
    assertSame(
        ingestor,
        jobManager.getJobDetail().getJobDataMap().get(IngestionJobManager.JOB_DATA_MAP_INGESTOR));
  }

  @Test
  void testJobRunsIngestor() {
    MetricIngestor ingestor = mock(MetricIngestor.class);
    IngestionJobManager jobManager = new IngestionJobManager(ingestor);
    jobManager.initJob(ConfigFactory.empty());
    JobExecutionContext context = mock(JobExecutionContext.class);
    when(context.getJobDetail()).thenReturn(jobManager.getJobDetail());

    new IngestionJob().execute(context);

    verify(ingestor).ingestOnce();
  }
}
