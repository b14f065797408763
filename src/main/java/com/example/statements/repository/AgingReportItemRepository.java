package com.example.statements.repository;

import com.example.statements.domain.AgingReportItem;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface AgingReportItemRepository extends JpaRepository<AgingReportItem, Long> {

    List<AgingReportItem> findByRunIdOrderByOverdueAmountDesc(Long runId);

    Optional<AgingReportItem> findByRunIdAndRecipientId(Long runId, Long recipientId);
}
