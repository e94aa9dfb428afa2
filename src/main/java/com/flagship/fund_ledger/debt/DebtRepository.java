package com.flagship.fund_ledger.debt;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface DebtRepository extends JpaRepository<DebtEntity, UUID> {

    Optional<DebtEntity> findByIdAndOwnerId(UUID id, UUID ownerId);

    /**
     * Row-locks the debt so concurrent payments see each other's remaining.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT d FROM DebtEntity d WHERE d.id = :id AND d.ownerId = :ownerId")
    Optional<DebtEntity> findForUpdate(@Param("id") UUID id, @Param("ownerId") UUID ownerId);

    List<DebtEntity> findByOwnerIdOrderByCreatedAtDesc(UUID ownerId);

    List<DebtEntity> findByOwnerIdAndPaidFalseOrderByCreatedAtDesc(UUID ownerId);
}
