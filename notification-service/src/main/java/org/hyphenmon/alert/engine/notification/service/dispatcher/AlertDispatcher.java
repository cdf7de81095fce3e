package org.hyphenmon.alert.engine.notification.service.dispatcher;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.SimpleTimeLimiter;
import com.google.common.util.concurrent.Striped;
import com.google.common.util.concurrent.TimeLimiter;
import com.google.common.util.concurrent.UncheckedExecutionException;
import io.micrometer.core.instrument.Counter;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.Lock;
import java.util.stream.Collectors;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.AlertEvent;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.DeliveryRecord;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.exception.DeliveryException;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.metrics.EngineMetricsRegistry;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.store.DeliveryStore;
import org.hyphenmon.alert.engine.notification.service.AlertMessageFormatter;
import org.hyphenmon.alert.engine.notification.service.channel.NotificationChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Delivers alert events to the notification channels at most once per incident within the
 * suppression period. Every event gets exactly one outcome; a failure on one event never stops
 * the others. Work on one fingerprint is serialized by a striped lock, so concurrent duplicates
 * resolve to one SENT and the rest SUPPRESSED.
 */
public class AlertDispatcher {

  private static final Logger LOGGER = LoggerFactory.getLogger(AlertDispatcher.class);
  private static final int LOCK_STRIPES = 64;
  private static final ConcurrentMap<String, Counter> outcomeCounter = new ConcurrentHashMap<>();
  private static final String OUTCOME_COUNTER = "hyphenmon.alert.engine.dispatcher.outcome";
  private static final Counter permanentFailureCounter =
      EngineMetricsRegistry.registerCounter(
          "hyphenmon.alert.engine.dispatcher.permanent.failure", Map.of());

  private final List<NotificationChannel> channels;
  private final DispatcherConfig config;
  private final Clock clock;
  private final Striped<Lock> fingerprintLocks = Striped.lock(LOCK_STRIPES);
  private final ExecutorService sendExecutor;
  private final TimeLimiter timeLimiter;

  public AlertDispatcher(List<NotificationChannel> channels, DispatcherConfig config, Clock clock) {
    Preconditions.checkArgument(config.getMaxAttempts() > 0, "maxAttempts must be positive");
    this.channels = List.copyOf(channels);
    this.config = config;
    this.clock = clock;
    this.sendExecutor = Executors.newCachedThreadPool();
    this.timeLimiter = SimpleTimeLimiter.create(sendExecutor);
  }

  public List<DispatchResult> dispatch(List<AlertEvent> events, DeliveryStore deliveryStore) {
    purgeExpired(deliveryStore);
    List<DispatchResult> results = new ArrayList<>(events.size());
    for (AlertEvent event : events) {
      DispatchOutcome outcome;
      try {
        outcome = dispatchOne(event, deliveryStore);
      } catch (RuntimeException e) {
        LOGGER.error("Dispatch of alert {} failed", event.getFingerprint(), e);
        outcome = DispatchOutcome.FAILED;
      }
      outcomeCounter
          .computeIfAbsent(
              outcome.name(),
              k -> EngineMetricsRegistry.registerCounter(OUTCOME_COUNTER, Map.of("outcome", k)))
          .increment();
      results.add(DispatchResult.of(event, outcome));
    }
    return results;
  }

  /** Events of incidents that failed delivery but may still be retried. */
  public List<AlertEvent> pendingRetries(DeliveryStore deliveryStore) {
    return deliveryStore.getUndelivered().stream()
        .filter(r -> !r.isPermanentlyFailed() && r.getEvent() != null)
        .map(DeliveryRecord::getEvent)
        .collect(Collectors.toUnmodifiableList());
  }

  public void shutdown() {
    sendExecutor.shutdownNow();
  }

  // settled incidents past their suppression period behave exactly like unknown ones
  private void purgeExpired(DeliveryStore deliveryStore) {
    long cutoff = clock.instant().getEpochSecond() - config.getSuppressionPeriod().getSeconds();
    try {
      int purged = deliveryStore.purgeOlderThan(cutoff);
      if (purged > 0) {
        LOGGER.debug("Purged {} delivery records last attempted before {}", purged, cutoff);
      }
    } catch (RuntimeException e) {
      LOGGER.warn("Unable to purge delivery records, will try again on the next dispatch", e);
    }
  }

  private DispatchOutcome dispatchOne(AlertEvent event, DeliveryStore deliveryStore) {
    String fingerprint = event.getFingerprint();
    Lock lock = fingerprintLocks.get(fingerprint);
    lock.lock();
    try {
      long now = clock.instant().getEpochSecond();
      Optional<DeliveryRecord> existing = deliveryStore.get(fingerprint);
      int previousAttempts = 0;
      if (existing.isPresent()) {
        DeliveryRecord record = existing.get();
        boolean inSuppressionPeriod =
            now - record.getLastAttemptAt() < config.getSuppressionPeriod().getSeconds();
        if (record.isDelivered() && inSuppressionPeriod) {
          LOGGER.debug("Alert {} already delivered, suppressing", fingerprint);
          return DispatchOutcome.SUPPRESSED;
        }
        if (record.isPermanentlyFailed() && inSuppressionPeriod) {
          LOGGER.debug("Alert {} permanently failed, not attempting", fingerprint);
          return DispatchOutcome.FAILED;
        }
        if (!record.isDelivered() && !record.isPermanentlyFailed()) {
          previousAttempts = record.getAttemptCount();
        }
      }

      int attemptCount = previousAttempts + 1;
      boolean delivered = deliver(event);
      boolean permanentlyFailed = !delivered && attemptCount >= config.getMaxAttempts();
      deliveryStore.upsert(
          DeliveryRecord.builder()
              .fingerprint(fingerprint)
              .lastAttemptAt(now)
              .attemptCount(attemptCount)
              .delivered(delivered)
              .permanentlyFailed(permanentlyFailed)
              .event(event)
              .build());

      if (delivered) {
        LOGGER.info("Alert {} [{}] sent", event.getRuleId(), fingerprint);
        return DispatchOutcome.SENT;
      }
      if (permanentlyFailed) {
        permanentFailureCounter.increment();
        LOGGER.error(
            "Alert {} [{}] permanently failed after {} attempts",
            event.getRuleId(),
            fingerprint,
            attemptCount);
      } else {
        LOGGER.warn(
            "Alert {} [{}] delivery failed, attempt {} of {}",
            event.getRuleId(),
            fingerprint,
            attemptCount,
            config.getMaxAttempts());
      }
      return DispatchOutcome.FAILED;
    } finally {
      lock.unlock();
    }
  }

  private boolean deliver(AlertEvent event) {
    List<NotificationChannel> eligible =
        channels.stream()
            .filter(channel -> channel.accepts(event.getSeverity()))
            .collect(Collectors.toList());
    if (eligible.isEmpty()) {
      LOGGER.warn("No notification channel accepts severity {}", event.getSeverity());
      return false;
    }

    String subject = AlertMessageFormatter.subject(event);
    String body = AlertMessageFormatter.body(event);
    boolean anySent = false;
    for (NotificationChannel channel : eligible) {
      for (String recipient : channel.getRecipients()) {
        try {
          if (send(channel, subject, body, recipient)) {
            anySent = true;
          } else {
            LOGGER.warn(
                "Channel {} did not accept alert {} for {}",
                channel.getChannelName(),
                event.getFingerprint(),
                recipient);
          }
        } catch (DeliveryException e) {
          LOGGER.warn("Alert {} not delivered", event.getFingerprint(), e);
        }
      }
    }
    return anySent;
  }

  private boolean send(NotificationChannel channel, String subject, String body, String recipient) {
    try {
      return timeLimiter.callWithTimeout(
          () -> channel.send(subject, body, recipient),
          config.getChannelTimeout().toMillis(),
          TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      throw new DeliveryException(
          String.format(
              "Channel %s timed out after %s",
              channel.getChannelName(),
              config.getChannelTimeout()),
          e);
    } catch (ExecutionException | UncheckedExecutionException e) {
      throw new DeliveryException(
          String.format("Channel %s failed for %s", channel.getChannelName(), recipient),
          e.getCause());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new DeliveryException("Interrupted while sending to " + channel.getChannelName(), e);
    }
  }
}
