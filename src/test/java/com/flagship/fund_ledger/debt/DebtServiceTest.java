package com.flagship.fund_ledger.debt;

import com.flagship.fund_ledger.account.Account;
import com.flagship.fund_ledger.account.AccountDraft;
import com.flagship.fund_ledger.account.AccountKind;
import com.flagship.fund_ledger.account.AccountService;
import com.flagship.fund_ledger.ledger.Transaction;
import com.flagship.fund_ledger.ledger.TransactionDetail;
import com.flagship.fund_ledger.ledger.TransactionEditService;
import com.flagship.fund_ledger.ledger.TransactionIntent;
import com.flagship.fund_ledger.ledger.TransactionKind;
import com.flagship.fund_ledger.ledger.TransactionQueryService;
import com.flagship.fund_ledger.ledger.allocation.TagBalance;
import com.flagship.fund_ledger.ledger.exception.InsufficientFundsException;
import com.flagship.fund_ledger.ledger.exception.NotFoundException;
import com.flagship.fund_ledger.ledger.exception.ValidationException;
import com.flagship.fund_ledger.ledger.store.AccountRepository;
import com.flagship.fund_ledger.money.Money;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class DebtServiceTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("test_ledger")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("kafka.topic.auto-create", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
    }

    @Autowired
    private DebtService debtService;

    @Autowired
    private AccountService accountService;

    @Autowired
    private AccountRepository accountRepository;

    @Autowired
    private TransactionEditService editService;

    @Autowired
    private TransactionQueryService queryService;

    private UUID ownerId;
    private Account cash;

    @BeforeEach
    void setUp() {
        ownerId = UUID.randomUUID();
        cash = accountService.createAccount(ownerId, AccountDraft.builder()
            .name("Cash")
            .kind(AccountKind.CASH)
            .openingBalance(Money.of("100000"))
            .build());
    }

    private DebtPayment lend(String amount, String contact) {
        return debtService.createDebt(ownerId, DebtIntent.builder()
            .direction(DebtDirection.LENDING)
            .amount(Money.of(amount))
            .accountId(cash.getId())
            .contactName(contact)
            .build());
    }

    private DebtPayment borrow(String amount, String contact) {
        return debtService.createDebt(ownerId, DebtIntent.builder()
            .direction(DebtDirection.BORROWING)
            .amount(Money.of(amount))
            .accountId(cash.getId())
            .contactName(contact)
            .build());
    }

    private Money balance() {
        return accountRepository.findBalance(cash.getId());
    }

    private Map<String, Money> tags() {
        return accountService.getTagBalances(ownerId, cash.getId()).stream()
            .collect(Collectors.toMap(TagBalance::getName, TagBalance::getBalance));
    }

    @Nested
    @DisplayName("Lending")
    class Lending {

        @Test
        @DisplayName("Lend, pay back in part, then in full")
        void lendAndRepay() {
            DebtPayment opened = lend("50000", "Budi");
            Debt debt = opened.getDebt();

            assertEquals(Money.of("50000"), balance());
            assertEquals(Money.of("50000"), debt.getAmount());
            assertEquals(Money.of("50000"), debt.getRemaining());
            assertFalse(debt.isPaid());
            assertEquals("Budi", debt.getContactName());
            assertEquals(TransactionKind.LENDING, opened.getTransaction().getKind());
            assertEquals(debt.getId(), opened.getTransaction().getDebtId());

            DebtPayment partial = debtService.recordDebtPayment(ownerId, debt.getId(), Money.of("20000"),
                    cash.getId(), null);
            assertEquals(Money.of("30000"), partial.getDebt().getRemaining());
            assertFalse(partial.getDebt().isPaid());
            assertEquals(Money.of("70000"), balance());

            DebtPayment last = debtService.recordDebtPayment(ownerId, debt.getId(), Money.of("30000"),
                    cash.getId(), "Final installment");
            assertEquals(Money.ZERO, last.getDebt().getRemaining());
            assertTrue(last.getDebt().isPaid());
            assertEquals(Money.of("100000"), balance());
            assertEquals("Final installment", last.getTransaction().getDescription());

            assertEquals(Money.of("50000"), tags().get("Repayment: Budi"));
            List<TransactionDetail> linked = queryService.getDebtTransactions(ownerId, debt.getId());
            assertEquals(3, linked.size());
            assertTrue(linked.get(0).getAllocations().isEmpty());
        }

        @Test
        @DisplayName("Lending more than the account holds writes nothing")
        void lendingNeedsBalance() {
            assertThrows(InsufficientFundsException.class, () -> lend("150000", "Budi"));

            assertEquals(Money.of("100000"), balance());
            assertTrue(debtService.listDebts(ownerId, true).isEmpty());
        }

        @Test
        @DisplayName("Overpayment and payment of a paid debt are rejected without side effects")
        void paymentBounds() {
            Debt debt = lend("50000", "Budi").getDebt();

            assertThrows(ValidationException.class, () -> debtService.recordDebtPayment(ownerId, debt.getId(),
                    Money.of("60000"), cash.getId(), null));
            assertEquals(Money.of("50000"), balance());
            assertEquals(Money.of("50000"), debtService.getDebt(ownerId, debt.getId()).getRemaining());

            debtService.recordDebtPayment(ownerId, debt.getId(), Money.of("50000"), cash.getId(), null);
            assertThrows(ValidationException.class, () -> debtService.recordDebtPayment(ownerId, debt.getId(),
                    Money.of("1"), cash.getId(), null));
            assertEquals(Money.of("100000"), balance());
        }
    }

    @Nested
    @DisplayName("Borrowing")
    class Borrowing {

        @Test
        @DisplayName("Borrowed money is tagged with the lender and spent back by waterfall")
        void borrowAndRepay() {
            Debt debt = borrow("1000000", "Sari").getDebt();

            assertEquals(Money.of("1100000"), balance());
            assertEquals(Money.of("1000000"), tags().get("Loan: Sari"));

            DebtPayment payment = debtService.recordDebtPayment(ownerId, debt.getId(), Money.of("400000"),
                    cash.getId(), null);

            assertEquals(TransactionKind.REPAYMENT, payment.getTransaction().getKind());
            assertEquals(cash.getId(), payment.getTransaction().getSourceAccountId());
            assertEquals(Money.of("600000"), payment.getDebt().getRemaining());
            assertEquals(Money.of("700000"), balance());
            assertEquals(Money.of("600000"), tags().get("Loan: Sari"));
        }

        @Test
        @DisplayName("Summary totals active debts per direction")
        void summary() {
            borrow("300000", "Sari");
            lend("40000", "Budi");
            Debt settled = lend("10000", "Andi").getDebt();
            debtService.markDebtPaid(ownerId, settled.getId(), null);

            DebtSummary summary = debtService.getDebtSummary(ownerId);

            assertEquals(Money.of("40000"), summary.getTotalLent());
            assertEquals(Money.of("300000"), summary.getTotalBorrowed());
            assertEquals(1, summary.getActiveLendingCount());
            assertEquals(1, summary.getActiveBorrowingCount());
            assertEquals(2, debtService.listDebts(ownerId, false).size());
            assertEquals(3, debtService.listDebts(ownerId, true).size());
        }
    }

    @Nested
    @DisplayName("Settling, editing and deleting")
    class Lifecycle {

        @Test
        @DisplayName("Settling without an account moves no money")
        void settleAdministratively() {
            Debt debt = lend("50000", "Budi").getDebt();

            DebtPayment settled = debtService.markDebtPaid(ownerId, debt.getId(), null);

            assertTrue(settled.getDebt().isPaid());
            assertNull(settled.getTransaction());
            assertEquals(Money.of("50000"), balance());
        }

        @Test
        @DisplayName("Settling through an account pays the remaining amount")
        void settleThroughAccount() {
            Debt debt = lend("50000", "Budi").getDebt();
            debtService.recordDebtPayment(ownerId, debt.getId(), Money.of("10000"), cash.getId(), null);

            DebtPayment settled = debtService.markDebtPaid(ownerId, debt.getId(), cash.getId());

            assertTrue(settled.getDebt().isPaid());
            assertEquals(Money.of("40000"), settled.getTransaction().getAmount());
            assertEquals(Money.of("100000"), balance());
        }

        @Test
        @DisplayName("Metadata edit moves remaining with the amount")
        void editDebt() {
            Debt debt = lend("50000", "Budi").getDebt();
            debtService.recordDebtPayment(ownerId, debt.getId(), Money.of("20000"), cash.getId(), null);

            Debt revised = debtService.editDebt(ownerId, debt.getId(), DebtRevision.builder()
                .amount(Money.of("60000"))
                .contactName("Budi Santoso")
                .description("Motorbike repair")
                .build());

            assertEquals(Money.of("60000"), revised.getAmount());
            assertEquals(Money.of("40000"), revised.getRemaining());
            assertEquals("Budi Santoso", revised.getContactName());
            assertEquals("Motorbike repair", revised.getDescription());
            assertEquals(2, debtService.listContacts(ownerId).size());
        }

        @Test
        @DisplayName("Deleting a debt keeps its transactions and unlinks them")
        void deleteDebt() {
            DebtPayment opened = lend("50000", "Budi");
            UUID debtId = opened.getDebt().getId();

            debtService.deleteDebt(ownerId, debtId);

            assertThrows(NotFoundException.class, () -> debtService.getDebt(ownerId, debtId));
            Transaction lending = queryService.getTransaction(ownerId, opened.getTransaction().getId()).getTransaction();
            assertNull(lending.getDebtId());
            assertEquals(Money.of("50000"), balance());

            editService.editTransaction(ownerId, lending.getId(), TransactionIntent.builder()
                .amount(Money.of("30000"))
                .build());
            assertEquals(Money.of("70000"), balance());
        }
    }

    @Nested
    @DisplayName("Editing linked transactions")
    class LinkedEdits {

        @Test
        @DisplayName("Editing a repayment moves remaining the other way")
        void editRepayment() {
            Debt debt = lend("50000", "Budi").getDebt();
            DebtPayment payment = debtService.recordDebtPayment(ownerId, debt.getId(), Money.of("20000"),
                    cash.getId(), null);

            editService.editTransaction(ownerId, payment.getTransaction().getId(), TransactionIntent.builder()
                .amount(Money.of("25000"))
                .build());

            assertEquals(Money.of("25000"), debtService.getDebt(ownerId, debt.getId()).getRemaining());
            assertEquals(Money.of("75000"), balance());
            assertEquals(Money.of("25000"), tags().get("Repayment: Budi"));
        }

        @Test
        @DisplayName("Editing the disbursement moves amount and remaining together")
        void editLending() {
            DebtPayment opened = lend("50000", "Budi");

            editService.editTransaction(ownerId, opened.getTransaction().getId(), TransactionIntent.builder()
                .amount(Money.of("60000"))
                .build());

            Debt debt = debtService.getDebt(ownerId, opened.getDebt().getId());
            assertEquals(Money.of("60000"), debt.getAmount());
            assertEquals(Money.of("60000"), debt.getRemaining());
            assertEquals(Money.of("40000"), balance());
        }

        @Test
        @DisplayName("A repayment edited beyond the debt is rejected as a whole")
        void editBeyondDebt() {
            Debt debt = lend("50000", "Budi").getDebt();
            DebtPayment payment = debtService.recordDebtPayment(ownerId, debt.getId(), Money.of("20000"),
                    cash.getId(), null);

            assertThrows(ValidationException.class, () -> editService.editTransaction(ownerId,
                payment.getTransaction().getId(), TransactionIntent.builder().amount(Money.of("70000")).build()));

            assertEquals(Money.of("30000"), debtService.getDebt(ownerId, debt.getId()).getRemaining());
            assertEquals(Money.of("70000"), balance());
        }

        @Test
        @DisplayName("Kind and accounts of a debt transaction are fixed")
        void debtTransactionShapeFixed() {
            DebtPayment opened = lend("50000", "Budi");
            UUID transactionId = opened.getTransaction().getId();

            assertThrows(ValidationException.class, () -> editService.editTransaction(ownerId, transactionId,
                TransactionIntent.builder().kind(TransactionKind.EXPENSE).amount(Money.of("50000")).build()));
            assertThrows(ValidationException.class, () -> editService.editTransaction(ownerId, transactionId,
                TransactionIntent.builder().amount(Money.of("50000")).sourceAccountId(UUID.randomUUID()).build()));
        }
    }

    @Nested
    @DisplayName("Contacts")
    class Contacts {

        @Test
        @DisplayName("Contact names are unique per owner, ignoring case")
        void uniqueNames() {
            Contact budi = debtService.createContact(ownerId, "Budi");

            assertThrows(ValidationException.class, () -> debtService.createContact(ownerId, "budi"));

            Debt debt = lend("1000", "BUDI").getDebt();
            assertEquals(budi.getId(), debt.getContactId());
            assertEquals(1, debtService.listContacts(ownerId).size());
        }

        @Test
        @DisplayName("Contacts of another owner cannot be used")
        void foreignContact() {
            Contact budi = debtService.createContact(UUID.randomUUID(), "Budi");

            assertThrows(NotFoundException.class, () -> debtService.createDebt(ownerId, DebtIntent.builder()
                .direction(DebtDirection.LENDING)
                .amount(Money.of("1000"))
                .accountId(cash.getId())
                .contactId(budi.getId())
                .build()));
        }
    }
}
