package org.hyphenmon.alert.engine;

import com.google.common.annotations.VisibleForTesting;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import io.micrometer.core.instrument.logging.LoggingMeterRegistry;
import io.micrometer.core.instrument.logging.LoggingRegistryConfig;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.hyphenmon.alert.engine.cycle.CorrelationCycle;
import org.hyphenmon.alert.engine.cycle.CycleConfig;
import org.hyphenmon.alert.engine.cycle.NonOverlappingTask;
import org.hyphenmon.alert.engine.metric.anomaly.detector.AnomalyRuleReader;
import org.hyphenmon.alert.engine.metric.anomaly.detector.evaluator.AnomalyEvaluator;
import org.hyphenmon.alert.engine.metric.correlation.correlator.MetricCorrelator;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.metrics.EngineMetricsRegistry;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.rule.AnomalyRule;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.store.InMemoryMetricStore;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.store.MetricStore;
import org.hyphenmon.alert.engine.metric.ingestion.MetricIngestor;
import org.hyphenmon.alert.engine.metric.ingestion.client.AppMetricsClient;
import org.hyphenmon.alert.engine.metric.ingestion.client.ZabbixClient;
import org.hyphenmon.alert.engine.metric.ingestion.job.IngestionJobManager;
import org.hyphenmon.alert.engine.metric.ingestion.job.JobManager;
import org.hyphenmon.alert.engine.notification.service.NotificationChannelsReader;
import org.hyphenmon.alert.engine.notification.service.channel.NotificationChannel;
import org.hyphenmon.alert.engine.notification.service.dispatcher.AlertDispatcher;
import org.hyphenmon.alert.engine.notification.service.dispatcher.DispatcherConfig;
import org.hyphenmon.alert.engine.notification.transport.NotificationSenderConfig;
import org.hyphenmon.alert.engine.state.StateStores;
import org.quartz.Scheduler;
import org.quartz.SchedulerException;
import org.quartz.SchedulerFactory;
import org.quartz.impl.StdSchedulerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires the engine from {@code application.conf} and runs it: the ingestion job fills the metric
 * store and the correlation job runs one {@link CorrelationCycle} per tick.
 */
public class HyphenmonAlertEngine {
  private static final Logger LOGGER = LoggerFactory.getLogger(HyphenmonAlertEngine.class);

  static final String INGESTION_ENABLED = "ingestion.enabled";
  static final String INGESTION_RETENTION = "ingestion.retention";
  static final String INGESTION_APP = "ingestion.app";
  static final String INGESTION_ZABBIX = "ingestion.zabbix";
  static final String METRICS_LOGGING_STEP = "metrics.loggingStep";
  private static final Duration DEFAULT_RETENTION = Duration.ofHours(1);
  private static final Duration DEFAULT_LOGGING_STEP = Duration.ofMinutes(1);

  private final Config appConfig;
  private final Clock clock;
  private Scheduler scheduler;
  private final List<JobManager> jobManagers = new ArrayList<>();
  private MetricStore metricStore;
  private AlertDispatcher dispatcher;
  private CorrelationCycle cycle;
  private NonOverlappingTask cycleTask;

  public HyphenmonAlertEngine(Config appConfig, Clock clock) {
    this.appConfig = appConfig;
    this.clock = clock;
  }

  protected void doInit() {
    try {
      Duration step =
          appConfig.hasPath(METRICS_LOGGING_STEP)
              ? appConfig.getDuration(METRICS_LOGGING_STEP)
              : DEFAULT_LOGGING_STEP;
      LoggingRegistryConfig loggingConfig = key -> key.endsWith(".step") ? step.toString() : null;
      EngineMetricsRegistry.addRegistry(
          new LoggingMeterRegistry(loggingConfig, io.micrometer.core.instrument.Clock.SYSTEM));

      Duration retention =
          appConfig.hasPath(INGESTION_RETENTION)
              ? appConfig.getDuration(INGESTION_RETENTION)
              : DEFAULT_RETENTION;
      metricStore = new InMemoryMetricStore(retention, clock);

      StateStores stateStores = StateStores.from(appConfig);
      List<AnomalyRule> rules = AnomalyRuleReader.readRules(appConfig);
      List<NotificationChannel> channels =
          new NotificationChannelsReader(NotificationSenderConfig.from(appConfig))
              .readNotificationChannels(appConfig);
      dispatcher = new AlertDispatcher(channels, DispatcherConfig.from(appConfig), clock);

      cycle =
          new CorrelationCycle(
              metricStore,
              stateStores.getWatermarkStore(),
              stateStores.getDeliveryStore(),
              new MetricCorrelator(),
              new AnomalyEvaluator(clock),
              rules,
              dispatcher,
              CycleConfig.from(appConfig),
              clock);
      cycleTask = new NonOverlappingTask("correlation-cycle", cycle::run);

      if (!appConfig.hasPath(INGESTION_ENABLED) || appConfig.getBoolean(INGESTION_ENABLED)) {
        MetricIngestor ingestor =
            new MetricIngestor(
                AppMetricsClient.from(appConfig.getConfig(INGESTION_APP), clock),
                ZabbixClient.from(appConfig.getConfig(INGESTION_ZABBIX), clock),
                metricStore);
        jobManagers.add(new IngestionJobManager(ingestor));
      } else {
        LOGGER.info("Ingestion disabled, the metric store is fed externally");
      }
      jobManagers.add(new CorrelationJobManager(cycleTask));
      for (JobManager jobManager : jobManagers) {
        jobManager.initJob(appConfig);
      }

      SchedulerFactory schedulerFactory = new StdSchedulerFactory();
      scheduler = schedulerFactory.getScheduler();
    } catch (IOException | SchedulerException e) {
      throw new RuntimeException(e);
    }
  }

  protected void doStart() {
    try {
      for (JobManager jobManager : jobManagers) {
        jobManager.startJob(scheduler);
      }
      scheduler.start();
    } catch (SchedulerException e) {
      throw new RuntimeException(e);
    }
  }

  protected void doStop() {
    LOGGER.info("Stopping hyphenmon alert engine");
    cycle.cancel();
    try {
      for (JobManager jobManager : jobManagers) {
        jobManager.stopJob(scheduler);
      }
      scheduler.shutdown(true);
    } catch (SchedulerException e) {
      throw new RuntimeException(e);
    } finally {
      cycle.shutdown();
      dispatcher.shutdown();
    }
  }

  public boolean healthCheck() {
    try {
      return scheduler != null && scheduler.isStarted() && !scheduler.isShutdown();
    } catch (SchedulerException e) {
      LOGGER.warn("Unable to query scheduler state", e);
      return false;
    }
  }

  @VisibleForTesting
  MetricStore getMetricStore() {
    return metricStore;
  }

  @VisibleForTesting
  NonOverlappingTask getCycleTask() {
    return cycleTask;
  }

  @VisibleForTesting
  List<JobManager> getJobManagers() {
    return jobManagers;
  }

  public static void main(String[] args) {
    HyphenmonAlertEngine engine =
        new HyphenmonAlertEngine(ConfigFactory.load(), Clock.systemUTC());
    engine.doInit();
    Runtime.getRuntime().addShutdownHook(new Thread(engine::doStop, "hyphenmon-shutdown"));
    engine.doStart();
    LOGGER.info("Hyphenmon alert engine started");
  }
}
