package com.example.statements.service;

import com.example.statements.config.StatementsProperties;
import com.example.statements.service.JobQueueService.EnqueueResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DispatchSchedulerTest {

    @Mock
    private StatementDispatchService dispatchService;

    private StatementsProperties properties;
    private DispatchScheduler scheduler;

    @BeforeEach
    void setUp() {
        properties = new StatementsProperties();
        scheduler = new DispatchScheduler(dispatchService, properties);
    }

    @Test
    void enqueueScheduledDispatch_Enabled_EnqueuesIfDue() {
        // Given
        when(dispatchService.enqueueIfDue()).thenReturn(EnqueueResult.enqueued(7L, 3));

        // When
        scheduler.enqueueScheduledDispatch();

        // Then
        verify(dispatchService).enqueueIfDue();
    }

    @Test
    void enqueueScheduledDispatch_Disabled_DoesNothing() {
        // Given
        properties.getDispatch().setEnabled(false);

        // When
        scheduler.enqueueScheduledDispatch();

        // Then
        verifyNoInteractions(dispatchService);
    }

    @Test
    void enqueueScheduledDispatch_EnqueueThrows_DoesNotPropagate() {
        // Given
        when(dispatchService.enqueueIfDue()).thenThrow(new SnapshotUnavailableException("no invoice file"));

        // When / Then
        assertDoesNotThrow(() -> scheduler.enqueueScheduledDispatch());
    }
}
