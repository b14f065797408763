package com.example.statements.repository;

import com.example.statements.domain.Recipient;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface RecipientRepository extends JpaRepository<Recipient, Long> {

    Optional<Recipient> findByName(String name);

    @Query("SELECT r FROM Recipient r WHERE LOWER(TRIM(r.name)) = LOWER(TRIM(:name))")
    Optional<Recipient> findByNameIgnoreCase(@Param("name") String name);

    List<Recipient> findByActiveTrueOrderByNameAsc();

    List<Recipient> findAllByOrderByNameAsc();

    @Transactional
    @Modifying
    @Query("UPDATE Recipient r SET r.lastSent = :sentOn WHERE r.id = :id")
    int updateLastSent(@Param("id") Long id, @Param("sentOn") LocalDate sentOn);
}
