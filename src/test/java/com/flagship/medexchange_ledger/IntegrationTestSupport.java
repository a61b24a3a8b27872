package com.flagship.medexchange_ledger;

import com.flagship.medexchange_ledger.ledger.LedgerEntryType;
import com.flagship.medexchange_ledger.ledger.LedgerReference;
import com.flagship.medexchange_ledger.ledger.LedgerService;
import com.flagship.medexchange_ledger.ledger.PostingRequest;
import com.flagship.medexchange_ledger.ledger.WalletService;
import com.flagship.medexchange_ledger.money.CurrencyCode;
import com.flagship.medexchange_ledger.provider.PaymentProviderClient;
import com.flagship.medexchange_ledger.security.CallerContext;
import com.flagship.medexchange_ledger.security.CallerIdentity;
import com.flagship.medexchange_ledger.security.CallerRole;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.support.TransactionTemplate;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.UUID;
import java.util.function.Supplier;

import static org.mockito.Mockito.when;

/**
 * Shared Postgres-backed application context. The container is started once
 * per JVM and reused by every subclass, so the cached Spring context always
 * points at a live database. Kafka listeners, the outbox publisher and the
 * schedulers are off (see application-test.yml); tests drive those paths
 * directly. The payment provider is a mock.
 */
@SpringBootTest
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
public abstract class IntegrationTestSupport {

    protected static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("medexchange_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        POSTGRES.start();
        registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        registry.add("spring.datasource.username", POSTGRES::getUsername);
        registry.add("spring.datasource.password", POSTGRES::getPassword);
    }

    @MockBean
    protected PaymentProviderClient providerClient;

    @Autowired
    protected JdbcTemplate jdbcTemplate;

    @Autowired
    protected TransactionTemplate transactionTemplate;

    @Autowired
    protected WalletService walletService;

    @Autowired
    protected LedgerService ledgerService;

    @BeforeEach
    void stubProviderName() {
        when(providerClient.name()).thenReturn("flutterwave");
    }

    protected static String uniqueId(String prefix) {
        return prefix + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    protected static CallerIdentity party(String userId, String cityId) {
        return CallerIdentity.of(userId, CallerRole.PARTY, cityId);
    }

    protected static CallerIdentity courier(String userId) {
        return CallerIdentity.of(userId, CallerRole.COURIER, null);
    }

    protected static CallerIdentity admin() {
        return CallerIdentity.of("admin-ops", CallerRole.ADMIN, null);
    }

    protected static <T> T as(CallerIdentity caller, Supplier<T> work) {
        return CallerContext.runAs(caller, work);
    }

    /**
     * Opens a wallet and credits it directly through the ledger.
     */
    protected void fundWallet(String userId, CurrencyCode currency, long amount) {
        walletService.openWallet(userId, currency);
        if (amount > 0) {
            ledgerService.credit(PostingRequest.builder()
                    .userId(userId)
                    .amount(amount)
                    .currency(currency)
                    .type(LedgerEntryType.CREDIT)
                    .description("Test funding")
                    .reference(LedgerReference.of("test_funding", userId))
                    .build());
        }
    }

    protected long balanceOf(String userId) {
        return walletService.getWallet(userId).getBalance();
    }
}
