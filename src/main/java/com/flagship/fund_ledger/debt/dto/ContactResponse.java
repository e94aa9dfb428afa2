package com.flagship.fund_ledger.debt.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.fund_ledger.debt.Contact;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class ContactResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("name")
    String name;

    @JsonProperty("created_at")
    Instant createdAt;

    public static ContactResponse from(Contact contact) {
        return new ContactResponse(contact.getId(), contact.getName(), contact.getCreatedAt());
    }
}
