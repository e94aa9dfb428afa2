package com.flagship.fund_ledger.debt;

import com.flagship.fund_ledger.money.Money;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * JPA mapping of {@code debts}.
 *
 * No setters: state changes come in through {@link #updateFromDomain(Debt)} after the
 * domain object has checked them. The table's CHECK constraints repeat the
 * remaining/paid invariant.
 */
@Entity
@Table(name = "debts")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class DebtEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "owner_id", nullable = false, updatable = false)
    private UUID ownerId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 20)
    private DebtDirection direction;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal amount;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal remaining;

    @Column(name = "contact_id", nullable = false)
    private UUID contactId;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(name = "due_date")
    private LocalDate dueDate;

    @Column(nullable = false)
    private boolean paid;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static DebtEntity fromDomain(Debt debt) {
        DebtEntity entity = new DebtEntity();
        entity.id = debt.getId();
        entity.ownerId = debt.getOwnerId();
        entity.direction = debt.getDirection();
        entity.contactId = debt.getContactId();
        entity.apply(debt);
        return entity;
    }

    public Debt toDomain(String contactName) {
        return new Debt(
            id,
            ownerId,
            direction,
            Money.of(amount),
            Money.of(remaining),
            contactId,
            contactName,
            description,
            dueDate,
            paid,
            createdAt,
            updatedAt
        );
    }

    /**
     * Copies the mutable state. Id, owner and direction never change.
     */
    void updateFromDomain(Debt debt) {
        if (!id.equals(debt.getId())) {
            throw new IllegalArgumentException("Cannot update debt " + id + " from debt " + debt.getId());
        }
        this.contactId = debt.getContactId();
        apply(debt);
    }

    private void apply(Debt debt) {
        this.amount = debt.getAmount().toBigDecimal();
        this.remaining = debt.getRemaining().toBigDecimal();
        this.description = debt.getDescription();
        this.dueDate = debt.getDueDate();
        this.paid = debt.isPaid();
    }
}
