package com.flagship.fund_ledger.account;

import com.flagship.fund_ledger.ledger.TransactionApplyService;
import com.flagship.fund_ledger.ledger.TransactionIntent;
import com.flagship.fund_ledger.ledger.TransactionKind;
import com.flagship.fund_ledger.ledger.exception.NotFoundException;
import com.flagship.fund_ledger.ledger.exception.ValidationException;
import com.flagship.fund_ledger.money.Money;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class AccountServiceTest {

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
    private AccountService accountService;

    @Autowired
    private TransactionApplyService applyService;

    private UUID ownerId;

    @BeforeEach
    void setUp() {
        ownerId = UUID.randomUUID();
    }

    @Test
    @DisplayName("Credit fields are dropped for non-credit accounts")
    void creditFieldsOnlyOnCredit() {
        Account bank = accountService.createAccount(ownerId, AccountDraft.builder()
            .name("  BCA  ")
            .kind(AccountKind.BANK)
            .creditLimit(Money.of("5000000"))
            .statementDay(20)
            .build());

        assertEquals("BCA", bank.getName());
        assertNull(bank.getCreditLimit());
        assertNull(bank.getStatementDay());
        assertEquals(Money.ZERO, bank.getBalance());
        assertEquals(Money.ZERO, bank.balanceFloor());
    }

    @Test
    @DisplayName("Credit accounts keep their limit and billing days")
    void creditAccount() {
        Account card = accountService.createAccount(ownerId, AccountDraft.builder()
            .name("Visa")
            .kind(AccountKind.CREDIT)
            .creditLimit(Money.of("5000000"))
            .statementDay(25)
            .dueDay(10)
            .build());

        assertEquals(Money.of("5000000"), card.getCreditLimit());
        assertEquals(25, card.getStatementDay());
        assertEquals(10, card.getDueDay());
        assertEquals(Money.of("-5000000"), card.balanceFloor());
        assertEquals(Money.of("5000000"), card.spendable());
    }

    @Test
    @DisplayName("Invalid drafts are rejected")
    void invalidDrafts() {
        assertThrows(ValidationException.class, () -> accountService.createAccount(ownerId,
            AccountDraft.builder().name(" ").kind(AccountKind.CASH).build()));
        assertThrows(ValidationException.class, () -> accountService.createAccount(ownerId,
            AccountDraft.builder().name("Cash").build()));
        assertThrows(ValidationException.class, () -> accountService.createAccount(ownerId,
            AccountDraft.builder().name("Visa").kind(AccountKind.CREDIT).dueDay(32).build()));
        assertThrows(ValidationException.class, () -> accountService.createAccount(ownerId,
            AccountDraft.builder().name("Visa").kind(AccountKind.CREDIT).creditLimit(Money.of("-1")).build()));
        assertThrows(ValidationException.class, () -> accountService.createAccount(null,
            AccountDraft.builder().name("Cash").kind(AccountKind.CASH).build()));
    }

    @Test
    @DisplayName("Account detail sums income and expense")
    void accountDetail() {
        Account cash = accountService.createAccount(ownerId, AccountDraft.builder()
            .name("Cash")
            .kind(AccountKind.CASH)
            .openingBalance(Money.of("1000"))
            .build());
        applyService.createTransaction(ownerId, TransactionIntent.builder()
            .kind(TransactionKind.EXPENSE)
            .amount(Money.of("250"))
            .sourceAccountId(cash.getId())
            .build());

        AccountDetail detail = accountService.getAccountDetail(ownerId, cash.getId());

        assertEquals(Money.of("750"), detail.getAccount().getBalance());
        assertEquals(Money.of("1000"), detail.getActivity().getTotalIncome());
        assertEquals(Money.of("250"), detail.getActivity().getTotalExpense());
        assertEquals(2, detail.getActivity().getTransactionCount());
    }

    @Test
    @DisplayName("Accounts are listed per owner")
    void listPerOwner() {
        accountService.createAccount(ownerId, AccountDraft.builder().name("Cash").kind(AccountKind.CASH).build());
        accountService.createAccount(ownerId, AccountDraft.builder().name("GoPay").kind(AccountKind.EWALLET).build());
        accountService.createAccount(UUID.randomUUID(), AccountDraft.builder().name("Other").kind(AccountKind.CASH).build());

        assertEquals(2, accountService.listAccounts(ownerId).size());
        assertThrows(NotFoundException.class, () -> accountService.getTagBalances(UUID.randomUUID(),
            accountService.listAccounts(ownerId).get(0).getId()));
    }
}
