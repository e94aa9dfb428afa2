package com.flagship.fund_ledger.debt;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ContactRepository extends JpaRepository<ContactEntity, UUID> {

    /**
     * Inserts unless the owner already has a contact with this name (case-insensitive).
     *
     * @return 1 when a row was created, 0 when the name was taken
     */
    @Modifying(flushAutomatically = true)
    @Query(value = """
        INSERT INTO contacts (id, owner_id, name) VALUES (:id, :ownerId, :name)
        ON CONFLICT DO NOTHING
        """, nativeQuery = true)
    int insertIfAbsent(@Param("id") UUID id, @Param("ownerId") UUID ownerId, @Param("name") String name);

    @Query("SELECT c FROM ContactEntity c WHERE c.ownerId = :ownerId AND lower(c.name) = lower(:name)")
    Optional<ContactEntity> findByOwnerIdAndName(@Param("ownerId") UUID ownerId, @Param("name") String name);

    Optional<ContactEntity> findByIdAndOwnerId(UUID id, UUID ownerId);

    List<ContactEntity> findByOwnerIdAndIdIn(UUID ownerId, Collection<UUID> ids);

    @Query("SELECT c FROM ContactEntity c WHERE c.ownerId = :ownerId ORDER BY lower(c.name)")
    List<ContactEntity> findAllByOwner(@Param("ownerId") UUID ownerId);
}
