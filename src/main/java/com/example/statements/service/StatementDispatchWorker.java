package com.example.statements.service;

import com.example.statements.config.StatementsProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Background worker that claims queued dispatch jobs and processes them one at a time.
 *
 * <p>Owns a single daemon thread, started with the application context when
 * {@code statements.dispatch.enabled} is true. The loop only ends when the worker is
 * stopped; errors are logged and the loop resumes after {@code error-delay}.
 */
@Component
public class StatementDispatchWorker implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(StatementDispatchWorker.class);

    static final String THREAD_NAME = "statement-dispatch-worker";

    private final JobQueueService jobQueueService;
    private final ScheduledJobProcessor jobProcessor;
    private final StatementsProperties properties;
    private final Sleeper sleeper;

    private ExecutorService executor;
    private volatile boolean stopRequested;

    @Autowired
    public StatementDispatchWorker(JobQueueService jobQueueService,
                                   ScheduledJobProcessor jobProcessor,
                                   StatementsProperties properties) {
        this(jobQueueService, jobProcessor, properties, Sleeper.THREAD);
    }

    StatementDispatchWorker(JobQueueService jobQueueService,
                            ScheduledJobProcessor jobProcessor,
                            StatementsProperties properties,
                            Sleeper sleeper) {
        this.jobQueueService = jobQueueService;
        this.jobProcessor = jobProcessor;
        this.properties = properties;
        this.sleeper = sleeper;
    }

    @Override
    public synchronized void start() {
        if (executor != null) {
            return;
        }
        stopRequested = false;
        executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, THREAD_NAME);
            thread.setDaemon(true);
            return thread;
        });
        executor.submit(this::runLoop);
    }

    @Override
    public synchronized void stop() {
        stopRequested = true;
        if (executor == null) {
            return;
        }
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Dispatch worker did not stop within 5 seconds");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            executor = null;
        }
    }

    @Override
    public synchronized boolean isRunning() {
        return executor != null;
    }

    @Override
    public boolean isAutoStartup() {
        return properties.getDispatch().isEnabled();
    }

    void runLoop() {
        log.info("Dispatch worker started");
        while (!stopRequested && !Thread.currentThread().isInterrupted()) {
            try {
                if (!runOnce()) {
                    sleeper.sleep(properties.getDispatch().getIdleDelay());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (RuntimeException e) {
                log.error("Dispatch worker cycle failed, retrying in {}", properties.getDispatch().getErrorDelay(), e);
                try {
                    sleeper.sleep(properties.getDispatch().getErrorDelay());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
        log.info("Dispatch worker stopped");
    }

    /**
     * Claims and processes at most one job.
     *
     * @return true if a job was processed
     */
    boolean runOnce() throws InterruptedException {
        Optional<Long> jobId = jobQueueService.claim();
        if (jobId.isEmpty()) {
            return false;
        }
        jobProcessor.process(jobId.get());
        return true;
    }
}
