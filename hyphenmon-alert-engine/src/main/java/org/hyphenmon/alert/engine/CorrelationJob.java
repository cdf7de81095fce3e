package org.hyphenmon.alert.engine;

import org.hyphenmon.alert.engine.cycle.NonOverlappingTask;
import org.quartz.Job;
import org.quartz.JobDataMap;
import org.quartz.JobDetail;
import org.quartz.JobExecutionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Quartz entry point of the correlation cycle. Overlap is handled by {@link NonOverlappingTask}
 * rather than {@code @DisallowConcurrentExecution}, which would queue the tick instead of dropping
 * it.
 */
public class CorrelationJob implements Job {
  private static final Logger LOGGER = LoggerFactory.getLogger(CorrelationJob.class);

  @Override
  public void execute(JobExecutionContext jobExecutionContext) {
    JobDetail jobDetail = jobExecutionContext.getJobDetail();
    LOGGER.debug("Correlation tick: {}", jobDetail.getKey());

    JobDataMap jobDataMap = jobDetail.getJobDataMap();
    NonOverlappingTask cycleTask =
        (NonOverlappingTask) jobDataMap.get(CorrelationJobManager.JOB_DATA_MAP_CYCLE_TASK);
    cycleTask.tick();
  }
}
