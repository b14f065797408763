package com.example.statements.repository;

import com.example.statements.domain.NoticeSend;
import com.example.statements.domain.NoticeSend.NoticeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface NoticeSendRepository extends JpaRepository<NoticeSend, Long> {

    boolean existsByInvoiceReferenceAndRecipientIdAndNoticeType(String invoiceReference, Long recipientId,
                                                                NoticeType noticeType);

    List<NoticeSend> findByInvoiceReference(String invoiceReference);
}
