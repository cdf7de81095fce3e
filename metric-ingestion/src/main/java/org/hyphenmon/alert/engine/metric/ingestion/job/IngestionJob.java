package org.hyphenmon.alert.engine.metric.ingestion.job;

import org.hyphenmon.alert.engine.metric.ingestion.MetricIngestor;
import org.quartz.DisallowConcurrentExecution;
import org.quartz.Job;
import org.quartz.JobDataMap;
import org.quartz.JobExecutionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@DisallowConcurrentExecution
public class IngestionJob implements Job {
  private static final Logger LOGGER = LoggerFactory.getLogger(IngestionJob.class);

  @Override
  public void execute(JobExecutionContext jobExecutionContext) {
    JobDataMap jobDataMap = jobExecutionContext.getJobDetail().getJobDataMap();
    MetricIngestor ingestor =
        (MetricIngestor) jobDataMap.get(IngestionJobManager.JOB_DATA_MAP_INGESTOR);
    int appended = ingestor.ingestOnce();
    LOGGER.debug("Ingestion run stored {} records", appended);
  }
}
