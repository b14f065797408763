package com.example.statements.service;

import com.example.statements.repository.ScheduledJobItemRepository;
import com.example.statements.repository.ScheduledJobRepository;
import com.example.statements.service.JobQueueService.EnqueueResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Pageable;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for the StatementDispatchService control surface.
 */
@ExtendWith(MockitoExtension.class)
class StatementDispatchServiceTest {

    @Mock
    private JobQueueService jobQueueService;

    @Mock
    private ScheduledJobRepository jobRepository;

    @Mock
    private ScheduledJobItemRepository itemRepository;

    @Mock
    private AgingReportService agingReportService;

    @Mock
    private StatementRunService statementRunService;

    private StatementDispatchService service;

    @BeforeEach
    void setUp() {
        service = new StatementDispatchService(jobQueueService, jobRepository, itemRepository, agingReportService,
            statementRunService, Clock.fixed(Instant.parse("2024-03-04T23:30:00Z"), ZoneOffset.UTC));
    }

    @Test
    void enqueueIfDue_UsesClockDate() {
        // Given
        when(jobQueueService.enqueue(LocalDate.of(2024, 3, 4))).thenReturn(EnqueueResult.nothingDue());

        // When
        EnqueueResult result = service.enqueueIfDue();

        // Then
        assertFalse(result.isEnqueued());
    }

    @Test
    void listRecentJobs_LimitClamped() {
        // Given
        when(jobRepository.findAllByOrderByCreatedAtDescIdDesc(any(Pageable.class))).thenReturn(List.of());
        ArgumentCaptor<Pageable> captor = ArgumentCaptor.forClass(Pageable.class);

        // When
        service.listRecentJobs(5000);
        service.listRecentJobs(0);

        // Then
        verify(jobRepository, times(2)).findAllByOrderByCreatedAtDescIdDesc(captor.capture());
        assertEquals(StatementDispatchService.MAX_RECENT_JOBS, captor.getAllValues().get(0).getPageSize());
        assertEquals(1, captor.getAllValues().get(1).getPageSize());
    }
}
