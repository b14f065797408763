package com.example.statements.repository;

import com.example.statements.domain.ScheduledJobItem;
import com.example.statements.domain.ScheduledJobItem.ItemStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ScheduledJobItemRepository extends JpaRepository<ScheduledJobItem, Long> {

    List<ScheduledJobItem> findByJobIdOrderByIdAsc(Long jobId);

    long countByJobIdAndStatus(Long jobId, ItemStatus status);

    @Query("SELECT i.error FROM ScheduledJobItem i WHERE i.jobId = :jobId AND i.status = :status " +
           "AND i.error IS NOT NULL ORDER BY i.id ASC")
    List<String> findErrors(@Param("jobId") Long jobId, @Param("status") ItemStatus status);
}
