package com.example.statements.service;

import com.example.statements.domain.Recipient;
import com.example.statements.domain.Recipient.Kind;
import com.example.statements.domain.ScheduledJob;
import com.example.statements.domain.ScheduledJob.JobStatus;
import com.example.statements.domain.TermsCode;
import com.example.statements.repository.RecipientRepository;
import com.example.statements.repository.ScheduledJobItemRepository;
import com.example.statements.repository.ScheduledJobRepository;
import com.example.statements.service.JobQueueService.EnqueueResult;
import com.example.statements.service.JobQueueService.EnqueueStatus;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Enqueue against an embedded database: lock row, active-job check and job insert.
 */
@DataJpaTest
@Import({JobQueueService.class, JobQueueServicePersistenceTest.QueueTestConfig.class})
class JobQueueServicePersistenceTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 3, 4);

    @TestConfiguration
    static class QueueTestConfig {

        @Bean
        Clock clock() {
            return Clock.fixed(Instant.parse("2024-03-04T07:00:00Z"), ZoneOffset.UTC);
        }
    }

    @Autowired
    private JobQueueService jobQueueService;

    @Autowired
    private ScheduledJobRepository jobRepository;

    @Autowired
    private ScheduledJobItemRepository itemRepository;

    @Autowired
    private RecipientRepository recipientRepository;

    @MockBean
    private DueRecipientService dueRecipientService;

    @MockBean
    private InvoiceSourceService invoiceSourceService;

    @Test
    void enqueue_CalledTwice_CreatesSingleQueuedJob() {
        // Given
        Recipient acme = recipientRepository.save(
            new Recipient("Acme Corp", Kind.SINGLE, "ap@acme.example", TermsCode.NET_30));
        Recipient harbor = recipientRepository.save(
            new Recipient("Harbor North", Kind.SINGLE, "ap@harbor.example", TermsCode.NET_15));
        when(dueRecipientService.findDueRecipients(TODAY)).thenReturn(List.of(acme, harbor));
        when(invoiceSourceService.currentReference()).thenReturn(Optional.of("file:1"));

        // When
        EnqueueResult first = jobQueueService.enqueue(TODAY);
        EnqueueResult second = jobQueueService.enqueue(TODAY);

        // Then
        assertEquals(EnqueueStatus.ENQUEUED, first.status());
        assertEquals(EnqueueStatus.ALREADY_ACTIVE, second.status());
        assertEquals(first.jobId(), second.jobId());

        List<ScheduledJob> jobs = jobRepository.findAll();
        assertEquals(1, jobs.size());
        assertEquals(JobStatus.QUEUED, jobs.get(0).getStatus());
        assertEquals("file:1", jobs.get(0).getInvoiceReference());
        assertEquals(2, itemRepository.findByJobIdOrderByIdAsc(first.jobId()).size());
    }

    @Test
    void enqueue_AfterActiveJobCompletes_CreatesNextJob() {
        // Given
        Recipient acme = recipientRepository.save(
            new Recipient("Acme Corp", Kind.SINGLE, "ap@acme.example", TermsCode.NET_30));
        when(dueRecipientService.findDueRecipients(TODAY)).thenReturn(List.of(acme));
        when(invoiceSourceService.currentReference()).thenReturn(Optional.of("file:1"));
        EnqueueResult first = jobQueueService.enqueue(TODAY);
        ScheduledJob done = jobRepository.findById(first.jobId()).orElseThrow();
        done.setStatus(JobStatus.COMPLETED);
        jobRepository.saveAndFlush(done);

        // When
        EnqueueResult next = jobQueueService.enqueue(TODAY);

        // Then
        assertEquals(EnqueueStatus.ENQUEUED, next.status());
        assertNotEquals(first.jobId(), next.jobId());
        assertEquals(1, jobRepository.findAll().stream()
            .filter(job -> job.getStatus().isActive())
            .count());
    }

    @Test
    void enqueue_NothingDue_CreatesNoJob() {
        // Given
        when(dueRecipientService.findDueRecipients(TODAY)).thenReturn(List.of());

        // When
        EnqueueResult result = jobQueueService.enqueue(TODAY);

        // Then
        assertEquals(EnqueueStatus.NOTHING_DUE, result.status());
        assertEquals(0, jobRepository.count());
    }
}
