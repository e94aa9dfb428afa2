package com.flagship.fund_ledger.ledger.exception;

import lombok.Getter;

import java.util.UUID;

/**
 * Entity does not exist or belongs to another owner. The two cases are
 * deliberately indistinguishable.
 */
@Getter
public class NotFoundException extends LedgerException {

    private final String entityType;
    private final UUID entityId;

    public NotFoundException(String entityType, UUID entityId) {
        super(entityType + " not found: " + entityId);
        this.entityType = entityType;
        this.entityId = entityId;
    }

    @Override
    public String getErrorCode() {
        return "NOT_FOUND";
    }
}
