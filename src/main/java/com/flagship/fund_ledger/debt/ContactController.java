package com.flagship.fund_ledger.debt;

import com.flagship.fund_ledger.config.ApiHeaders;
import com.flagship.fund_ledger.debt.dto.ContactRequest;
import com.flagship.fund_ledger.debt.dto.ContactResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/contacts")
@RequiredArgsConstructor
public class ContactController {

    private final DebtService debtService;

    @GetMapping
    public List<ContactResponse> listContacts(@RequestHeader(ApiHeaders.OWNER_ID) UUID ownerId) {
        return debtService.listContacts(ownerId).stream()
            .map(ContactResponse::from)
            .toList();
    }

    @PostMapping
    public ResponseEntity<ContactResponse> createContact(
            @RequestHeader(ApiHeaders.OWNER_ID) UUID ownerId,
            @Valid @RequestBody ContactRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(ContactResponse.from(debtService.createContact(ownerId, request.getName())));
    }
}
