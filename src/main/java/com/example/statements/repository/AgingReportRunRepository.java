package com.example.statements.repository;

import com.example.statements.domain.AgingReportRun;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface AgingReportRunRepository extends JpaRepository<AgingReportRun, Long> {

    Optional<AgingReportRun> findTopByOrderByCreatedAtDescIdDesc();

    List<AgingReportRun> findTop20ByOrderByCreatedAtDesc();
}
