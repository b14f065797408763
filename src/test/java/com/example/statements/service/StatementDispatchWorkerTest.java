package com.example.statements.service;

import com.example.statements.config.StatementsProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for the dispatch worker loop.
 */
@ExtendWith(MockitoExtension.class)
class StatementDispatchWorkerTest {

    @Mock
    private JobQueueService jobQueueService;

    @Mock
    private ScheduledJobProcessor jobProcessor;

    private StatementsProperties properties;
    private final List<Duration> sleeps = new ArrayList<>();

    @BeforeEach
    void setUp() {
        properties = new StatementsProperties();
        properties.getDispatch().setIdleDelay(Duration.ofSeconds(2));
        properties.getDispatch().setErrorDelay(Duration.ofSeconds(30));
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Test
    void runOnce_NothingQueued_ReturnsFalse() throws Exception {
        // Given
        when(jobQueueService.claim()).thenReturn(Optional.empty());
        StatementDispatchWorker worker = worker(3);

        // When
        boolean processed = worker.runOnce();

        // Then
        assertFalse(processed);
        verifyNoInteractions(jobProcessor);
    }

    @Test
    void runOnce_JobClaimed_ProcessesIt() throws Exception {
        // Given
        when(jobQueueService.claim()).thenReturn(Optional.of(42L));
        StatementDispatchWorker worker = worker(3);

        // When
        boolean processed = worker.runOnce();

        // Then
        assertTrue(processed);
        verify(jobProcessor).process(42L);
    }

    @Test
    void runLoop_CycleThrows_LogsAndKeepsPolling() {
        // Given - the first cycle fails, the second finds nothing, then the worker is interrupted
        when(jobQueueService.claim())
            .thenThrow(new IllegalStateException("database unavailable"))
            .thenReturn(Optional.empty());
        StatementDispatchWorker worker = worker(2);

        // When
        worker.runLoop();

        // Then
        verify(jobQueueService, times(2)).claim();
        assertEquals(List.of(Duration.ofSeconds(30), Duration.ofSeconds(2)), sleeps);
    }

    @Test
    void runLoop_ProcessorInterrupted_StopsWithoutFurtherClaims() throws Exception {
        // Given
        when(jobQueueService.claim()).thenReturn(Optional.of(7L));
        doThrow(new InterruptedException()).when(jobProcessor).process(7L);
        StatementDispatchWorker worker = worker(5);

        // When
        worker.runLoop();

        // Then
        verify(jobQueueService, times(1)).claim();
        assertTrue(sleeps.isEmpty());
        assertTrue(Thread.interrupted());
    }

    // Helper methods

    /**
     * Worker whose sleeper records each delay and interrupts the loop on the given call.
     */
    private StatementDispatchWorker worker(int interruptOnSleep) {
        Sleeper sleeper = duration -> {
            sleeps.add(duration);
            if (sleeps.size() >= interruptOnSleep) {
                throw new InterruptedException("stop");
            }
        };
        return new StatementDispatchWorker(jobQueueService, jobProcessor, properties, sleeper);
    }
}
