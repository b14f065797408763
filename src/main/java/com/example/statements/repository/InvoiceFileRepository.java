package com.example.statements.repository;

import com.example.statements.domain.InvoiceFile;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface InvoiceFileRepository extends JpaRepository<InvoiceFile, Long> {

    Optional<InvoiceFile> findTopByOrderByUploadedAtDescIdDesc();
}
