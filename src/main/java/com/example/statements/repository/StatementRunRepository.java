package com.example.statements.repository;

import com.example.statements.domain.StatementRun;
import com.example.statements.domain.StatementRun.RunStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface StatementRunRepository extends JpaRepository<StatementRun, Long> {

    List<StatementRun> findByRecipientIdOrderByCreatedAtDesc(Long recipientId);

    /**
     * True if a statement for this recipient and invoice export went out with the given
     * status at or after the given instant.
     */
    boolean existsByRecipientIdAndInvoiceReferenceAndStatusAndCreatedAtGreaterThanEqual(
        Long recipientId, String invoiceReference, RunStatus status, Instant since);
}
