package org.hyphenmon.alert.engine.metric.ingestion.job;

import com.typesafe.config.Config;
import org.hyphenmon.alert.engine.metric.ingestion.MetricIngestor;
import org.quartz.JobBuilder;
import org.quartz.JobDataMap;
import org.quartz.JobDetail;
import org.quartz.JobKey;
import org.quartz.Scheduler;
import org.quartz.SchedulerException;
import org.quartz.SimpleScheduleBuilder;
import org.quartz.Trigger;
import org.quartz.TriggerBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Schedules {@link IngestionJob} every {@code ingestion.intervalSeconds} (default 10). */
public class IngestionJobManager implements JobManager {
  private static final Logger LOGGER = LoggerFactory.getLogger(IngestionJobManager.class);

  static final String JOB_DATA_MAP_INGESTOR = "ingestor";
  static final String JOB_NAME = "metric-ingestion";
  static final String JOB_GROUP = "hyphenmon";
  static final String JOB_TRIGGER_NAME = "metric-ingestion-trigger";
  public static final String INTERVAL_SECONDS = "ingestion.intervalSeconds";
  static final int DEFAULT_INTERVAL_SECONDS = 10;

  private final MetricIngestor ingestor;
  private JobKey jobKey;
  private JobDetail jobDetail;
  private Trigger jobTrigger;

  public IngestionJobManager(MetricIngestor ingestor) {
    this.ingestor = ingestor;
  }

  @Override
  public void initJob(Config appConfig) {
    int intervalSeconds =
        appConfig.hasPath(INTERVAL_SECONDS)
            ? appConfig.getInt(INTERVAL_SECONDS)
            : DEFAULT_INTERVAL_SECONDS;
    jobKey = JobKey.jobKey(JOB_NAME, JOB_GROUP);

    JobDataMap jobDataMap = new JobDataMap();
    jobDataMap.put(JOB_DATA_MAP_INGESTOR, ingestor);

    jobDetail =
        JobBuilder.newJob(IngestionJob.class)
            .withIdentity(jobKey)
            .usingJobData(jobDataMap)
            .build();
    jobTrigger =
        TriggerBuilder.newTrigger()
            .withIdentity(JOB_TRIGGER_NAME, JOB_GROUP)
            .withSchedule(
                SimpleScheduleBuilder.repeatSecondlyForever(intervalSeconds)
                    .withMisfireHandlingInstructionNextWithRemainingCount())
            .startNow()
            .build();
  }

  @Override
  public void startJob(Scheduler scheduler) throws SchedulerException {
    LOGGER.info("Schedule a job:{} with Trigger:{}", jobKey, jobTrigger);
    scheduler.scheduleJob(jobDetail, jobTrigger);
  }

  @Override
  public void stopJob(Scheduler scheduler) throws SchedulerException {
    if (scheduler.checkExists(jobKey)) {
      scheduler.deleteJob(jobKey);
    }
  }

  JobDetail getJobDetail() {
    return jobDetail;
  }

  Trigger getJobTrigger() {
    return jobTrigger;
  }
}
