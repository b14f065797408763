package com.example.statements.repository;

import com.example.statements.domain.ScheduledJob;
import com.example.statements.domain.ScheduledJob.JobStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface ScheduledJobRepository extends JpaRepository<ScheduledJob, Long> {

    Optional<ScheduledJob> findFirstByStatusInOrderByCreatedAtAsc(Collection<JobStatus> statuses);

    List<ScheduledJob> findAllByOrderByCreatedAtDescIdDesc(Pageable pageable);

    @Query("SELECT j.id FROM ScheduledJob j WHERE j.status = :status ORDER BY j.createdAt ASC, j.id ASC")
    List<Long> findIdsByStatusOldestFirst(@Param("status") JobStatus status, Pageable pageable);

    /**
     * Puts RUNNING jobs whose heartbeat is older than the cutoff back on the queue.
     *
     * @return number of jobs reclaimed
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("UPDATE ScheduledJob j SET j.status = :queued, j.startedAt = NULL " +
           "WHERE j.status = :running AND (j.heartbeatAt IS NULL OR j.heartbeatAt < :cutoff)")
    int requeueStale(@Param("cutoff") Instant cutoff,
                     @Param("running") JobStatus running,
                     @Param("queued") JobStatus queued);

    /**
     * Compare-and-swap claim: moves the job to RUNNING only if it is still QUEUED.
     *
     * @return 1 if this caller won the claim, 0 otherwise
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("UPDATE ScheduledJob j SET j.status = :running, j.startedAt = :now, j.heartbeatAt = :now " +
           "WHERE j.id = :id AND j.status = :queued")
    int claim(@Param("id") Long id,
              @Param("now") Instant now,
              @Param("queued") JobStatus queued,
              @Param("running") JobStatus running);
}
