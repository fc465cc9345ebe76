package com.flagship.revenue_ledger.outbox;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.revenue_ledger.allocation.ClaimantShare;
import com.flagship.revenue_ledger.allocation.ShareTable;
import com.flagship.revenue_ledger.ledger.DepositResult;
import com.flagship.revenue_ledger.ledger.LedgerPausedException;
import com.flagship.revenue_ledger.ledger.LedgerService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.IllegalTransactionStateException;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigInteger;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

/**
 * Outbox rows are written in the same transaction as the ledger change that
 * caused them and are tracked until published.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class OutboxServiceTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("revenue_ledger_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("spring.kafka.admin.auto-create", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
    }

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private OutboxEventRepository outboxEventRepository;

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private StringRedisTemplate redisTemplate;

    @MockBean
    private ValueOperations<String, String> valueOperations;

    private String ledgerAddress;
    private String admin;

    private static String randomAddress() {
        String hex = (UUID.randomUUID().toString() + UUID.randomUUID()).replace("-", "");
        return "0x" + hex.substring(0, 40);
    }

    @BeforeEach
    void setUp() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        outboxEventRepository.deleteAll();

        ledgerAddress = randomAddress();
        admin = randomAddress();
        ledgerService.register(ledgerAddress, UUID.randomUUID(), admin,
                ShareTable.of(List.of(ClaimantShare.of(randomAddress(), 10_000))), BigInteger.valueOf(1_000_000));
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @Test
    @DisplayName("A deposit writes a RevenueReceived event keyed by ledger address")
    void deposit_WritesRevenueReceived() throws Exception {
        printTestHeader("RevenueReceived Event");

        DepositResult result = ledgerService.deposit(ledgerAddress, BigInteger.valueOf(2500), "evt-1");

        List<OutboxEvent> events = outboxService.getEventsForAggregate(OutboxService.LEDGER_AGGREGATE, ledgerAddress);
        assertEquals(1, events.size());
        OutboxEvent event = events.get(0);
        assertEquals("RevenueReceived", event.getEventType());
        assertFalse(event.isPublished());
        assertEquals(0, event.getRetryCount());

        JsonNode payload = objectMapper.readTree(event.getPayload());
        assertEquals("2500", payload.get("amount").asText());
        assertEquals(result.getDeposit().getId().toString(), payload.get("depositId").asText());
        assertEquals(ledgerAddress, payload.get("ledgerAddress").asText());

        printSuccess("Event payload: " + event.getPayload());
    }

    @Test
    @DisplayName("A duplicate deposit does not write a second event")
    void duplicateDeposit_NoSecondEvent() {
        ledgerService.deposit(ledgerAddress, BigInteger.valueOf(2500), "evt-dup");
        ledgerService.deposit(ledgerAddress, BigInteger.valueOf(2500), "evt-dup");

        assertEquals(1, outboxService.getEventsForAggregate(OutboxService.LEDGER_AGGREGATE, ledgerAddress).size());
    }

    @Test
    @DisplayName("A rejected operation leaves no event behind")
    void rejectedOperation_NoEvent() {
        ledgerService.pause(ledgerAddress, admin);
        long before = outboxService.countUnpublished();

        assertThrows(LedgerPausedException.class,
                () -> ledgerService.deposit(ledgerAddress, BigInteger.TEN, "evt-paused"));

        assertEquals(before, outboxService.countUnpublished());
        List<String> types = outboxService.getEventsForAggregate(OutboxService.LEDGER_AGGREGATE, ledgerAddress)
                .stream().map(OutboxEvent::getEventType).toList();
        assertEquals(List.of("LedgerPaused"), types);
    }

    @Test
    @DisplayName("Events cannot be saved outside a business transaction")
    void saveEvent_RequiresTransaction() {
        assertThrows(IllegalTransactionStateException.class,
                () -> outboxService.saveEvent(OutboxService.LEDGER_AGGREGATE, ledgerAddress, "Orphan", "{}"));
    }

    @Test
    @DisplayName("Published events leave the queue; failures count retries and keep the last error")
    void markPublishedAndFailed() {
        printTestHeader("Publish Bookkeeping");

        ledgerService.deposit(ledgerAddress, BigInteger.valueOf(10), "evt-a");
        ledgerService.deposit(ledgerAddress, BigInteger.valueOf(20), "evt-b");

        List<OutboxEvent> pending = outboxService.findUnpublishedEvents(10, 5);
        assertEquals(2, pending.size());
        assertTrue(pending.get(0).getSequenceNumber() < pending.get(1).getSequenceNumber());

        outboxService.markPublished(pending.get(0).getId());
        outboxService.markFailed(pending.get(1).getId(), "Connection timeout");
        outboxService.markFailed(pending.get(1).getId(), "Broker not available");

        OutboxEventEntity failed = outboxEventRepository.findById(pending.get(1).getId()).orElseThrow();
        assertEquals(2, failed.getRetryCount());
        assertEquals("Broker not available", failed.getLastError());
        assertEquals(1, outboxService.countUnpublished());

        // With max retries at 2 the failed event is dead-lettered and no longer polled.
        assertTrue(outboxService.findUnpublishedEvents(10, 2).isEmpty());
        assertEquals(1, outboxEventRepository.countDeadLettered(2));

        printSuccess("Publish bookkeeping works");
    }
}
