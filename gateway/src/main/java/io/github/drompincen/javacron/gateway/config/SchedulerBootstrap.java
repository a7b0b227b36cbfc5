package io.github.drompincen.javacron.gateway.config;

import io.github.drompincen.javacron.runtime.scheduler.SchedulerService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Loads the timers of all active events once the application is up. A storage failure propagates
 * and fails startup.
 */
@Component
public class SchedulerBootstrap {

    private static final Logger log = LoggerFactory.getLogger(SchedulerBootstrap.class);

    private final SchedulerService schedulerService;

    public SchedulerBootstrap(SchedulerService schedulerService) {
        this.schedulerService = schedulerService;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        try {
            schedulerService.initialize();
            log.info("Scheduler started with {} scheduled events", schedulerService.scheduledCount());
        } catch (RuntimeException e) {
            log.error("Scheduler initialization failed, no events are scheduled", e);
            throw e;
        }
    }
}
