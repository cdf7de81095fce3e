package org.hyphenmon.alert.engine;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import java.util.Map;
import org.hyphenmon.alert.engine.cycle.NonOverlappingTask;
import org.hyphenmon.alert.engine.metric.ingestion.job.JobManager;
import org.quartz.CronScheduleBuilder;
import org.quartz.JobBuilder;
import org.quartz.JobDataMap;
import org.quartz.JobDetail;
import org.quartz.JobKey;
import org.quartz.Scheduler;
import org.quartz.SchedulerException;
import org.quartz.Trigger;
import org.quartz.TriggerBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class CorrelationJobManager implements JobManager {
  private static final Logger LOGGER = LoggerFactory.getLogger(CorrelationJobManager.class);

  static final String JOB_CONFIG = "job.config";
  static final String JOB_CONFIG_CRON_EXPRESSION = "cronExpression";
  static final String CRON_EXPRESSION = "0 * * * * ?";
  static final String JOB_DATA_MAP_CYCLE_TASK = "cycleTask";
  static final String JOB_NAME = "correlation-cycle";
  static final String JOB_GROUP = "hyphenmon";
  static final String JOB_TRIGGER_NAME = "correlation-cycle-trigger";

  private final NonOverlappingTask cycleTask;
  private JobKey jobKey;
  private JobDetail jobDetail;
  private Trigger jobTrigger;

  public CorrelationJobManager(NonOverlappingTask cycleTask) {
    this.cycleTask = cycleTask;
  }

  @Override
  public void initJob(Config appConfig) {
    Config jobConfig =
        appConfig.hasPath(JOB_CONFIG)
            ? appConfig.getConfig(JOB_CONFIG)
            : ConfigFactory.parseMap(Map.of());
    jobKey = JobKey.jobKey(JOB_NAME, JOB_GROUP);

    JobDataMap jobDataMap = new JobDataMap();
    jobDataMap.put(JOB_DATA_MAP_CYCLE_TASK, cycleTask);

    jobDetail =
        JobBuilder.newJob(CorrelationJob.class)
            .withIdentity(jobKey)
            .usingJobData(jobDataMap)
            .build();

    String cronExpression =
        jobConfig.hasPath(JOB_CONFIG_CRON_EXPRESSION)
            ? jobConfig.getString(JOB_CONFIG_CRON_EXPRESSION)
            : CRON_EXPRESSION;
    jobTrigger =
        TriggerBuilder.newTrigger()
            .withIdentity(JOB_TRIGGER_NAME, JOB_GROUP)
            .withSchedule(
                CronScheduleBuilder.cronSchedule(cronExpression)
                    .withMisfireHandlingInstructionDoNothing())
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
