package com.flagship.fund_ledger.debt;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class Contact {
    UUID id;
    UUID ownerId;
    String name;
    Instant createdAt;
}
