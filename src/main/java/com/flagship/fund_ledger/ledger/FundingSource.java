package com.flagship.fund_ledger.ledger;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Named provenance bucket ("Salary", "Loan: Budi"). Unique per owner, case-insensitively.
 */
@Value
public class FundingSource {
    UUID id;
    UUID ownerId;
    String name;
    Category category;
    Instant createdAt;

    public enum Category {
        INCOME,
        OTHER
    }
}
