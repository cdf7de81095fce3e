package org.hyphenmon.alert.engine.cycle;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.SimpleTimeLimiter;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.common.util.concurrent.TimeLimiter;
import com.google.common.util.concurrent.UncheckedExecutionException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.hyphenmon.alert.engine.metric.anomaly.detector.evaluator.AnomalyEvaluator;
import org.hyphenmon.alert.engine.metric.correlation.correlator.MetricCorrelator;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.AlertEvent;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.CorrelationResult;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.MetricRecord;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.MetricSource;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.Watermark;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.exception.MalformedRecordException;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.exception.TransientFetchException;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.metrics.EngineMetricsRegistry;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.rule.AnomalyRule;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.store.DeliveryStore;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.store.MetricStore;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.store.WatermarkStore;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.validation.MetricRecordValidator;
import org.hyphenmon.alert.engine.notification.service.dispatcher.AlertDispatcher;
import org.hyphenmon.alert.engine.notification.service.dispatcher.DispatchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One pass of the pipeline: fetch the records ingested since the watermark, correlate them,
 * evaluate the rules and dispatch the resulting alerts.
 *
 * <p>The watermark only moves after every stage succeeded. A failing or cancelled cycle leaves it
 * where it was, so the next cycle reads the same range again; the dispatcher's delivery records
 * keep that from producing duplicate notifications.
 */
public class CorrelationCycle {
  private static final Logger LOGGER = LoggerFactory.getLogger(CorrelationCycle.class);
  private static final ConcurrentMap<String, Counter> cycleErrorCounter =
      new ConcurrentHashMap<>();
  private static final String CYCLE_ERROR_COUNTER = "hyphenmon.alert.engine.cycle.error";
  private static final ConcurrentMap<String, Counter> malformedCounter = new ConcurrentHashMap<>();
  private static final String MALFORMED_COUNTER = "hyphenmon.alert.engine.cycle.malformed";
  private static final Timer cycleTimer =
      EngineMetricsRegistry.registerTimer("hyphenmon.alert.engine.cycle.latency", Map.of());

  private final MetricStore metricStore;
  private final WatermarkStore watermarkStore;
  private final DeliveryStore deliveryStore;
  private final MetricCorrelator correlator;
  private final AnomalyEvaluator evaluator;
  private final List<AnomalyRule> rules;
  private final AlertDispatcher dispatcher;
  private final CycleConfig config;
  private final Clock clock;
  private final ExecutorService fetchExecutor;
  private final TimeLimiter timeLimiter;
  private final AtomicReference<CycleState> state = new AtomicReference<>(CycleState.IDLE);
  private volatile boolean cancelRequested;

  public CorrelationCycle(
      MetricStore metricStore,
      WatermarkStore watermarkStore,
      DeliveryStore deliveryStore,
      MetricCorrelator correlator,
      AnomalyEvaluator evaluator,
      List<AnomalyRule> rules,
      AlertDispatcher dispatcher,
      CycleConfig config,
      Clock clock) {
    Preconditions.checkArgument(config.getWindowSeconds() >= 0, "window must not be negative");
    Preconditions.checkArgument(
        config.getMaxLookback().getSeconds() > 0, "maxLookback must be at least one second");
    this.metricStore = metricStore;
    this.watermarkStore = watermarkStore;
    this.deliveryStore = deliveryStore;
    this.correlator = correlator;
    this.evaluator = evaluator;
    this.rules = List.copyOf(rules);
    this.dispatcher = dispatcher;
    this.config = config;
    this.clock = clock;
    this.fetchExecutor =
        Executors.newCachedThreadPool(
            new ThreadFactoryBuilder().setNameFormat("cycle-fetch-%d").setDaemon(true).build());
    this.timeLimiter = SimpleTimeLimiter.create(fetchExecutor);
  }

  public CycleReport run() {
    String cycleId = UUID.randomUUID().toString();
    Instant startTime = Instant.now();
    cancelRequested = false;
    try {
      return runStages(cycleId);
    } catch (CycleCancelledException e) {
      CycleState stage = state.get();
      countError(stage, "cancelled");
      LOGGER.warn("Cycle aborted cycleId={} stage={} cause={}", cycleId, stage, e.getMessage());
      return CycleReport.aborted(cycleId, stage);
    } catch (RuntimeException e) {
      CycleState stage = state.get();
      countError(stage, e.getClass().getSimpleName());
      LOGGER.error("Cycle aborted cycleId={} stage={} cause={}", cycleId, stage, e.toString(), e);
      return CycleReport.aborted(cycleId, stage);
    } finally {
      state.set(CycleState.IDLE);
      cycleTimer.record(Duration.between(startTime, Instant.now()));
    }
  }

  /** Aborts the cycle in flight at its next stage boundary. No effect on an idle cycle. */
  public void cancel() {
    if (state.get() != CycleState.IDLE) {
      LOGGER.info("Cancelling cycle in stage {}", state.get());
      cancelRequested = true;
    }
  }

  public CycleState getState() {
    return state.get();
  }

  public void shutdown() {
    cancel();
    fetchExecutor.shutdownNow();
  }

  private CycleReport runStages(String cycleId) {
    enter(cycleId, CycleState.FETCHING);
    long now = clock.instant().getEpochSecond();
    long maxLookback = config.getMaxLookback().getSeconds();
    Optional<Watermark> watermark = withTimeout(watermarkStore::read, "watermark");
    long since = watermark.map(Watermark::getLastProcessedRecordedAt).orElse(now - maxLookback);
    // the current second is still open to ingestion, stop at the last closed one
    long lastClosedSecond = now - 1;
    long until = Math.min(since + maxLookback, lastClosedSecond);
    LOGGER.debug(
        "Cycle {} fetching ({}, {}], cold start: {}", cycleId, since, until, watermark.isEmpty());

    List<MetricRecord> appFetched =
        withTimeout(
            () -> metricStore.queryRange(MetricSource.APP, since, until), "APP records");
    List<MetricRecord> externalFetched =
        withTimeout(
            () ->
                metricStore.queryRange(
                    MetricSource.EXTERNAL, since - config.getWindowSeconds(), until),
            "EXTERNAL records");
    OptionalLong maxObserved =
        Stream.concat(appFetched.stream(), externalFetched.stream())
            .mapToLong(MetricRecord::getRecordedAt)
            .filter(recordedAt -> recordedAt > since && recordedAt <= until)
            .max();
    List<MetricRecord> appRecords = validRecords(cycleId, appFetched, MetricSource.APP);
    List<MetricRecord> externalRecords =
        validRecords(cycleId, externalFetched, MetricSource.EXTERNAL);

    enter(cycleId, CycleState.CORRELATING);
    List<CorrelationResult> results =
        correlator.correlate(appRecords, externalRecords, config.getWindowSeconds());

    enter(cycleId, CycleState.EVALUATING);
    List<AlertEvent> events = evaluator.evaluate(results, rules);

    enter(cycleId, CycleState.DISPATCHING);
    List<DispatchResult> dispatchResults = dispatcher.dispatch(withRetries(events), deliveryStore);

    checkCancelled(cycleId);
    Long newWatermark = null;
    if (maxObserved.isPresent()) {
      newWatermark = maxObserved.getAsLong();
    } else if (until < lastClosedSecond) {
      // nothing arrived in a range capped by the lookback limit, move past it
      newWatermark = until;
    }
    if (newWatermark != null) {
      advanceWatermark(cycleId, newWatermark);
    }

    LOGGER.info(
        "Cycle {} done: {} app, {} external records, {} results, {} events, {} dispatched",
        cycleId,
        appRecords.size(),
        externalRecords.size(),
        results.size(),
        events.size(),
        dispatchResults.size());
    return CycleReport.builder()
        .cycleId(cycleId)
        .completed(true)
        .events(events)
        .dispatchResults(dispatchResults)
        .watermark(newWatermark)
        .build();
  }

  private List<AlertEvent> withRetries(List<AlertEvent> events) {
    Set<String> seen =
        events.stream()
            .map(AlertEvent::getFingerprint)
            .collect(Collectors.toCollection(HashSet::new));
    List<AlertEvent> toDispatch = new ArrayList<>(events);
    for (AlertEvent retry : dispatcher.pendingRetries(deliveryStore)) {
      if (seen.add(retry.getFingerprint())) {
        toDispatch.add(retry);
      }
    }
    if (toDispatch.size() > events.size()) {
      LOGGER.info("Retrying {} undelivered alerts", toDispatch.size() - events.size());
    }
    return toDispatch;
  }

  private void advanceWatermark(String cycleId, long recordedAt) {
    try {
      watermarkStore.write(Watermark.of(recordedAt));
    } catch (IOException | RuntimeException e) {
      countError(CycleState.DISPATCHING, "watermark");
      LOGGER.error(
          "Cycle {} could not store watermark {}, the range will be read again",
          cycleId,
          recordedAt,
          e);
    }
  }

  private List<MetricRecord> validRecords(
      String cycleId, List<MetricRecord> records, MetricSource source) {
    List<MetricRecord> valid = new ArrayList<>(records.size());
    for (MetricRecord record : records) {
      try {
        valid.add(MetricRecordValidator.validate(record, source));
      } catch (MalformedRecordException e) {
        malformedCounter
            .computeIfAbsent(
                source.name(),
                k -> EngineMetricsRegistry.registerCounter(MALFORMED_COUNTER, Map.of("source", k)))
            .increment();
        LOGGER.warn("Cycle {} skipping malformed record: {}", cycleId, e.getMessage());
      }
    }
    valid.sort(Comparator.comparingLong(MetricRecord::getTimestamp));
    return valid;
  }

  private <T> T withTimeout(Callable<T> call, String what) {
    try {
      return timeLimiter.callWithTimeout(
          call, config.getFetchTimeout().toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      throw new TransientFetchException(
          String.format("Reading %s timed out after %s", what, config.getFetchTimeout()), e);
    } catch (ExecutionException | UncheckedExecutionException e) {
      if (e.getCause() instanceof TransientFetchException) {
        throw (TransientFetchException) e.getCause();
      }
      throw new TransientFetchException("Reading " + what + " failed", e.getCause());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TransientFetchException("Interrupted while reading " + what, e);
    }
  }

  private void enter(String cycleId, CycleState next) {
    checkCancelled(cycleId);
    state.set(next);
  }

  private void checkCancelled(String cycleId) {
    if (cancelRequested) {
      throw new CycleCancelledException(cycleId);
    }
  }

  private static void countError(CycleState stage, String cause) {
    cycleErrorCounter
        .computeIfAbsent(
            stage + ":" + cause,
            k ->
                EngineMetricsRegistry.registerCounter(
                    CYCLE_ERROR_COUNTER, Map.of("stage", stage.name(), "cause", cause)))
        .increment();
  }
}
