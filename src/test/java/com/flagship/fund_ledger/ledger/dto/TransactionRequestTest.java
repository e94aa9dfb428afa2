package com.flagship.fund_ledger.ledger.dto;

import com.flagship.fund_ledger.ledger.TransactionIntent;
import com.flagship.fund_ledger.ledger.TransactionKind;
import com.flagship.fund_ledger.money.Money;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class TransactionRequestTest {

    private static Validator validator;

    @BeforeAll
    static void setUpValidator() {
        validator = Validation.buildDefaultValidatorFactory().getValidator();
    }

    private static TransactionRequest expense(String amount) {
        return TransactionRequest.builder()
            .kind(TransactionKind.EXPENSE)
            .amount(new BigDecimal(amount))
            .sourceAccountId(UUID.randomUUID())
            .build();
    }

    @Test
    @DisplayName("Amounts are carried into the intent exactly")
    void exactAmount() {
        TransactionIntent intent = expense("100.0005").toIntent(null);

        assertEquals(0, new BigDecimal("100.0005").compareTo(intent.getAmount().toBigDecimal()));
        assertEquals(Money.of("100.0005"), intent.getAmount());
    }

    @Test
    @DisplayName("A fifth decimal place fails validation instead of being rounded away")
    void fifthDecimalRejected() {
        TransactionRequest request = expense("100.00005");

        Set<ConstraintViolation<TransactionRequest>> violations = validator.validate(request);
        assertEquals(1, violations.size());
        assertEquals("amount", violations.iterator().next().getPropertyPath().toString());
        assertThrows(IllegalArgumentException.class, () -> request.toIntent(null));
    }

    @Test
    @DisplayName("Sixteen integer digits fail validation")
    void oversizedRejected() {
        assertEquals(1, validator.validate(expense("1000000000000000")).size());
        assertTrue(validator.validate(expense("999999999999999.9999")).isEmpty());
    }
}
