package com.vlrnotify.infrastructure.scheduling;

import com.vlrnotify.application.usecase.DispatchNotificationsUseCase;
import com.vlrnotify.application.usecase.PollEventsUseCase;
import com.vlrnotify.domain.ports.EventStore;
import com.vlrnotify.infrastructure.config.NotifierProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Fixed-delay jobs driving the poller, the notification tick and store cleanup.
 */
@Component
@ConditionalOnProperty(name = "vlr.scheduling.enabled", havingValue = "true", matchIfMissing = true)
public class NotifierJobs {

    private static final Logger logger = LoggerFactory.getLogger(NotifierJobs.class);

    private final PollEventsUseCase pollEventsUseCase;
    private final DispatchNotificationsUseCase dispatchNotificationsUseCase;
    private final EventStore eventStore;
    private final NotifierProperties properties;

    public NotifierJobs(PollEventsUseCase pollEventsUseCase,
                        DispatchNotificationsUseCase dispatchNotificationsUseCase,
                        EventStore eventStore,
                        NotifierProperties properties) {
        this.pollEventsUseCase = pollEventsUseCase;
        this.dispatchNotificationsUseCase = dispatchNotificationsUseCase;
        this.eventStore = eventStore;
        this.properties = properties;
    }

    @Scheduled(fixedDelayString = "${vlr.poll.interval-ms:300000}", initialDelayString = "${vlr.poll.initial-delay-ms:5000}")
    public void poll() {
        try {
            pollEventsUseCase.execute();
        } catch (Exception e) {
            logger.error("Scheduled poll failed", e);
        }
    }

    @Scheduled(fixedDelayString = "${vlr.dispatch.interval-ms:60000}", initialDelayString = "${vlr.dispatch.initial-delay-ms:20000}")
    public void dispatch() {
        try {
            dispatchNotificationsUseCase.execute(Instant.now());
        } catch (Exception e) {
            logger.error("Scheduled notification tick failed", e);
        }
    }

    @Scheduled(fixedDelayString = "${vlr.cleanup.interval-ms:3600000}", initialDelayString = "${vlr.cleanup.initial-delay-ms:600000}")
    public void cleanup() {
        try {
            int removed = eventStore.removeStale(Instant.now().minus(properties.retention()));
            if (removed > 0) {
                logger.info("Removed {} stale events", removed);
            }
        } catch (Exception e) {
            logger.error("Scheduled cleanup failed", e);
        }
    }
}
