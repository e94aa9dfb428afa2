package com.flagship.fund_ledger.debt;

import com.flagship.fund_ledger.ledger.exception.ValidationException;
import com.flagship.fund_ledger.money.Money;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class DebtTest {

    private static Debt lending(String amount) {
        return Debt.open(UUID.randomUUID(), DebtDirection.LENDING, Money.of(amount), UUID.randomUUID(),
                "Budi", null, null);
    }

    @Test
    @DisplayName("A new debt is active with remaining equal to amount")
    void opensActive() {
        Debt debt = lending("50000");

        assertEquals(Money.of("50000"), debt.getRemaining());
        assertFalse(debt.isPaid());
    }

    @Test
    @DisplayName("Opening needs a direction and a positive amount")
    void openValidation() {
        assertThrows(ValidationException.class, () -> Debt.open(UUID.randomUUID(), null, Money.of("1"),
                UUID.randomUUID(), "Budi", null, null));
        assertThrows(ValidationException.class, () -> lending("0"));
    }

    @Nested
    @DisplayName("Payments")
    class Payments {

        @Test
        @DisplayName("Partial then final payment ends paid")
        void partialThenFinal() {
            Debt debt = lending("50000");

            Debt partial = debt.recordPayment(Money.of("20000"));
            assertEquals(Money.of("30000"), partial.getRemaining());
            assertFalse(partial.isPaid());

            Debt done = partial.recordPayment(Money.of("30000"));
            assertEquals(Money.ZERO, done.getRemaining());
            assertTrue(done.isPaid());
        }

        @Test
        @DisplayName("Overpayment and payments on a paid debt are rejected")
        void rejectsInvalidPayments() {
            Debt debt = lending("100");

            assertThrows(ValidationException.class, () -> debt.recordPayment(Money.of("100.0001")));
            assertThrows(ValidationException.class, () -> debt.recordPayment(Money.ZERO));

            Debt paid = debt.recordPayment(Money.of("100"));
            assertThrows(ValidationException.class, () -> paid.recordPayment(Money.of("1")));
            assertThrows(ValidationException.class, paid::settle);
        }

        @Test
        @DisplayName("Administrative settlement zeroes remaining")
        void settle() {
            Debt settled = lending("100").recordPayment(Money.of("40")).settle();

            assertEquals(Money.ZERO, settled.getRemaining());
            assertEquals(Money.of("100"), settled.getAmount());
            assertTrue(settled.isPaid());
        }
    }

    @Nested
    @DisplayName("Revisions")
    class Revisions {

        @Test
        @DisplayName("Editing a payment moves remaining by the opposite delta")
        void revisePayment() {
            Debt debt = lending("100").recordPayment(Money.of("40"));

            Debt smaller = debt.revisePayment(Money.of("40"), Money.of("10"));
            assertEquals(Money.of("90"), smaller.getRemaining());

            Debt full = debt.revisePayment(Money.of("40"), Money.of("100"));
            assertTrue(full.isPaid());

            assertThrows(ValidationException.class, () -> debt.revisePayment(Money.of("40"), Money.of("101")));
        }

        @Test
        @DisplayName("Editing the disbursement moves amount and remaining together")
        void revisePrincipal() {
            Debt debt = lending("100").recordPayment(Money.of("40"));

            Debt larger = debt.revisePrincipal(Money.of("100"), Money.of("150"));
            assertEquals(Money.of("150"), larger.getAmount());
            assertEquals(Money.of("110"), larger.getRemaining());

            assertThrows(ValidationException.class, () -> debt.revisePrincipal(Money.of("100"), Money.of("30")));
        }

        @Test
        @DisplayName("Metadata edit clamps remaining at zero")
        void reviseClamps() {
            Debt debt = lending("100").recordPayment(Money.of("70"));

            Debt revised = debt.revise(Money.of("50"), null, null, "shared dinner", null);

            assertEquals(Money.of("50"), revised.getAmount());
            assertEquals(Money.ZERO, revised.getRemaining());
            assertTrue(revised.isPaid());
            assertEquals("shared dinner", revised.getDescription());
            assertEquals("Budi", revised.getContactName());
        }

        @Test
        @DisplayName("Raising the amount of a paid debt reopens it")
        void reviseReopens() {
            Debt paid = lending("100").settle();

            Debt reopened = paid.revise(Money.of("120"), null, null, null, null);

            assertEquals(Money.of("20"), reopened.getRemaining());
            assertFalse(reopened.isPaid());
        }
    }
}
