package com.example.statements.service;

import com.example.statements.config.StatementsProperties;
import com.example.statements.service.JobQueueService.EnqueueResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Cron tick that queues the day's statement dispatch. The worker picks the job up.
 */
@Component
public class DispatchScheduler {

    private static final Logger log = LoggerFactory.getLogger(DispatchScheduler.class);

    private final StatementDispatchService dispatchService;
    private final StatementsProperties properties;

    public DispatchScheduler(StatementDispatchService dispatchService, StatementsProperties properties) {
        this.dispatchService = dispatchService;
        this.properties = properties;
    }

    /**
     * Scheduled to run daily at 7:00 AM unless {@code statements.dispatch.cron} says otherwise.
     */
    @Scheduled(cron = "${statements.dispatch.cron:0 0 7 * * *}")
    public void enqueueScheduledDispatch() {
        if (!properties.getDispatch().isEnabled()) {
            log.debug("Statement dispatch disabled, skipping scheduled enqueue");
            return;
        }
        log.info("Running scheduled statement enqueue");
        try {
            EnqueueResult result = dispatchService.enqueueIfDue();
            log.info("Scheduled enqueue: {} ({})", result.status(), result.message());
        } catch (RuntimeException e) {
            log.error("Scheduled statement enqueue failed: {}", e.getMessage(), e);
        }
    }
}
