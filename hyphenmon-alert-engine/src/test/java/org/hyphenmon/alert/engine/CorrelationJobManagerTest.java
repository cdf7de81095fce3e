package org.hyphenmon.alert.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.typesafe.config.ConfigFactory;
import java.util.Map;
import org.hyphenmon.alert.engine.cycle.NonOverlappingTask;
import org.junit.jupiter.api.Test;
import org.quartz.CronTrigger;
import org.quartz.JobExecutionContext;

class CorrelationJobManagerTest {

  @Test
  void testDefaultScheduleIsEveryMinute() {
    NonOverlappingTask cycleTask = mock(NonOverlappingTask.class);
    CorrelationJobManager jobManager = new CorrelationJobManager(cycleTask);

    jobManager.initJob(ConfigFactory.empty());

    CronTrigger trigger = (CronTrigger) jobManager.getJobTrigger();
    assertEquals("0 * * * * ?", trigger.getCronExpression());
    assertEquals(CronTrigger.MISFIRE_INSTRUCTION_DO_NOTHING, trigger.getMisfireInstruction());
    assertSame(
        cycleTask,
        jobManager
            .getJobDetail()
            .getJobDataMap()
            .get(CorrelationJobManager.JOB_DATA_MAP_CYCLE_TASK));
  }

  @Test
  void testConfiguredCronExpression() {
    CorrelationJobManager jobManager = new CorrelationJobManager(mock(NonOverlappingTask.class));

    jobManager.initJob(
        ConfigFactory.parseMap(Map.of("job.config.cronExpression", "0/30 * * * * ?")));

    assertEquals("0/30 * * * * ?", ((CronTrigger) jobManager.getJobTrigger()).getCronExpression());
  }

  @Test
  void testJobTicksCycleTask() {
    NonOverlappingTask cycleTask = mock(NonOverlappingTask.class);
    CorrelationJobManager jobManager = new CorrelationJobManager(cycleTask);
    jobManager.initJob(ConfigFactory.empty());
    JobExecutionContext context = mock(JobExecutionContext.class);
    when(context.getJobDetail()).thenReturn(jobManager.getJobDetail());

    new CorrelationJob().execute(context);

    verify(cycleTask).tick();
  }
}
