package com.example.statements.repository;

import com.example.statements.domain.Recipient;
import com.example.statements.domain.RecipientAlias;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface RecipientAliasRepository extends JpaRepository<RecipientAlias, Long> {

    Optional<RecipientAlias> findByCustomerName(String customerName);

    List<RecipientAlias> findByRecipient(Recipient recipient);

    @Query("SELECT a FROM RecipientAlias a JOIN FETCH a.recipient")
    List<RecipientAlias> findAllWithRecipient();

    void deleteByRecipient(Recipient recipient);
}
