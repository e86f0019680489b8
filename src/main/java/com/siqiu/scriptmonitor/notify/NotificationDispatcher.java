package com.siqiu.scriptmonitor.notify;

import com.siqiu.scriptmonitor.alert.AlertEvent;
import com.siqiu.scriptmonitor.metrics.MonitorMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Delivers alert events to their channels off the evaluator threads.
 * <p>
 * Each (event, channel) pair is attempted up to {@code monitor.notify.max-attempts} times with
 * exponential backoff. A pair that runs out of attempts, or fails permanently, is written to the
 * failure table and optionally to a dead-letter queue; it is never re-queued.
 */
@Component
public class NotificationDispatcher implements DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

    private static final int MAX_BACKOFF_DOUBLINGS = 6;

    private final NotificationChannelRepository channels;
    private final Map<String, NotificationTransport> transports = new HashMap<>();
    private final NotificationFailureRepository failures;
    private final Optional<DeadLetterClient> deadLetters;
    private final MonitorMetrics metrics;
    private final Clock clock;
    private final int maxAttempts;
    private final long initialBackoffMs;

    private final ScheduledExecutorService executor;

    public NotificationDispatcher(
            NotificationChannelRepository channels,
            List<NotificationTransport> transports,
            NotificationFailureRepository failures,
            Optional<DeadLetterClient> deadLetters,
            MonitorMetrics metrics,
            Clock clock,
            @Value("${monitor.notify.max-attempts:5}") int maxAttempts,
            @Value("${monitor.notify.initial-backoff-ms:1000}") long initialBackoffMs
    ) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("monitor.notify.max-attempts must be >= 1");
        }
        this.channels = channels;
        for (NotificationTransport t : transports) {
            this.transports.put(t.type(), t);
        }
        this.failures = failures;
        this.deadLetters = deadLetters;
        this.metrics = metrics;
        this.clock = clock;
        this.maxAttempts = maxAttempts;
        this.initialBackoffMs = initialBackoffMs;

        AtomicInteger seq = new AtomicInteger();
        this.executor = Executors.newScheduledThreadPool(2, r -> {
            Thread t = new Thread(r, "notify-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Queue delivery of the event to every listed channel. Returns immediately.
     */
    public void dispatch(AlertEvent event, List<Long> channelIds) {
        for (Long channelId : channelIds) {
            if (channelId == null) continue;
            schedule(event, channelId, 1, 0);
        }
    }

    long backoffMs(int attempt) {
        return initialBackoffMs * (1L << Math.min(attempt - 1, MAX_BACKOFF_DOUBLINGS));
    }

    private void schedule(AlertEvent event, long channelId, int attempt, long delayMs) {
        try {
            executor.schedule(() -> attempt(event, channelId, attempt), delayMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.warn("notification_dropped eventId={} channelId={} reason=shutdown", event.id(), channelId);
        }
    }

    void attempt(AlertEvent event, long channelId, int attempt) {
        try {
            Optional<NotificationChannel> found = channels.findById(channelId);
            if (found.isEmpty()) {
                exhausted(event, channelId, attempt, "unknown channel " + channelId);
                return;
            }
            NotificationChannel channel = found.get();
            if (!channel.isEnabled()) {
                log.info("notification_skipped eventId={} channelId={} reason=channel_disabled", event.id(), channelId);
                return;
            }
            NotificationTransport transport = transports.get(channel.transportKey());
            if (transport == null) {
                exhausted(event, channelId, attempt, "no transport for channel type " + channel.getType());
                return;
            }

            transport.deliver(channel, event);
            metrics.incNotificationsDelivered();
            log.info("notification_delivered eventId={} channelId={} type={} attempt={}",
                    event.id(), channelId, channel.transportKey(), attempt);
        } catch (DeliveryException e) {
            retryOrGiveUp(event, channelId, attempt, e.getMessage(), e.isRetryable());
        } catch (RuntimeException e) {
            retryOrGiveUp(event, channelId, attempt, e.toString(), true);
        }
    }

    private void retryOrGiveUp(AlertEvent event, long channelId, int attempt, String error, boolean retryable) {
        if (!retryable || attempt >= maxAttempts) {
            exhausted(event, channelId, attempt, error);
            return;
        }
        long delay = backoffMs(attempt);
        metrics.incNotificationRetries();
        log.info("notification_retry_scheduled eventId={} channelId={} attempt={} delayMs={} error={}",
                event.id(), channelId, attempt, delay, error);
        schedule(event, channelId, attempt + 1, delay);
    }

    private void exhausted(AlertEvent event, long channelId, int attempts, String error) {
        metrics.incNotificationsFailed();
        log.warn("notification_failed eventId={} channelId={} attempts={} error={}", event.id(), channelId, attempts, error);

        try {
            failures.recordFailure(event.id(), channelId, attempts, error, clock.instant());
        } catch (RuntimeException e) {
            log.error("notification_failure_write_failed eventId={} channelId={}", event.id(), channelId, e);
        }

        deadLetters.ifPresent(dlq -> {
            try {
                dlq.publishDeadNotification(new DeadNotificationEvent(
                        event.id(), event.ruleId(), event.scheduleId(), channelId, attempts, error, clock.instant()));
                metrics.incDeadLettersPublished();
            } catch (RuntimeException e) {
                // best effort; the failure row above is the durable record
                log.warn("dead_letter_publish_failed eventId={} channelId={}", event.id(), channelId, e);
            }
        });
    }

    @Override
    public void destroy() throws InterruptedException {
        executor.shutdown();
        if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
            executor.shutdownNow();
        }
    }
}
