package com.example.statements.repository;

import com.example.statements.domain.DispatchLock;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface DispatchLockRepository extends JpaRepository<DispatchLock, String> {

    /**
     * Find lock row with pessimistic write lock, held until the surrounding transaction ends.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT l FROM DispatchLock l WHERE l.name = :name")
    Optional<DispatchLock> findByNameForUpdate(@Param("name") String name);
}
