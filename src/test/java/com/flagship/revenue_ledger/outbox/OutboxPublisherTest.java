package com.flagship.revenue_ledger.outbox;

import com.flagship.revenue_ledger.allocation.ClaimantShare;
import com.flagship.revenue_ledger.allocation.ShareTable;
import com.flagship.revenue_ledger.ledger.LedgerService;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.KafkaContainer;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.math.BigInteger;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

/**
 * Outbox publisher against a real broker: events reach the ledgers topic
 * keyed by ledger address and are marked published.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class OutboxPublisherTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("revenue_ledger_test")
            .withUsername("test")
            .withPassword("test");

    @Container
    static KafkaContainer kafka = new KafkaContainer(
            DockerImageName.parse("confluentinc/cp-kafka:7.5.0"));

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.kafka.bootstrap-servers", kafka::getBootstrapServers);
        // Publisher bean is needed, but we trigger it by hand
        registry.add("outbox.publisher.enabled", () -> "true");
        registry.add("outbox.publisher.poll-interval-ms", () -> "3600000");
    }

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private OutboxPublisher outboxPublisher;

    @Autowired
    private LedgerService ledgerService;

    @MockBean
    private StringRedisTemplate redisTemplate;

    @MockBean
    private ValueOperations<String, String> valueOperations;

    @Value("${kafka.topic.ledgers:revenue-ledger.ledgers}")
    private String ledgersTopic;

    @Value("${kafka.topic.deployments:revenue-ledger.deployments}")
    private String deploymentsTopic;

    private String ledgerAddress;
    private KafkaConsumer<String, String> consumer;

    private static String randomAddress() {
        String hex = (UUID.randomUUID().toString() + UUID.randomUUID()).replace("-", "");
        return "0x" + hex.substring(0, 40);
    }

    @BeforeEach
    void setUp() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);

        ledgerAddress = randomAddress();
        ledgerService.register(ledgerAddress, UUID.randomUUID(), randomAddress(),
                ShareTable.of(List.of(ClaimantShare.of(randomAddress(), 10_000))), BigInteger.valueOf(1_000_000));

        Properties props = new Properties();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, kafka.getBootstrapServers());
        props.put(ConsumerConfig.GROUP_ID_CONFIG, "test-group-" + UUID.randomUUID());
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");

        consumer = new KafkaConsumer<>(props);
        consumer.subscribe(List.of(ledgersTopic));

        System.out.println("\n--- Test Setup ---");
        System.out.println("Kafka bootstrap servers: " + kafka.getBootstrapServers());
        System.out.println("Ledger: " + ledgerAddress);
    }

    @AfterEach
    void tearDown() {
        consumer.close();
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
    @DisplayName("Deposits are published to the ledgers topic keyed by ledger address")
    void publisher_SendsLedgerEvents() {
        printTestHeader("Publisher Sends Ledger Events");

        ledgerService.deposit(ledgerAddress, BigInteger.valueOf(100), "pub-1");
        ledgerService.deposit(ledgerAddress, BigInteger.valueOf(200), "pub-2");
        ledgerService.deposit(ledgerAddress, BigInteger.valueOf(300), "pub-3");
        assertTrue(outboxService.countUnpublished() >= 3);

        outboxPublisher.triggerPublish();

        assertTrue(outboxService.getEventsForAggregate(OutboxService.LEDGER_AGGREGATE, ledgerAddress)
                .stream().allMatch(OutboxEvent::isPublished), "All ledger events should be published");

        List<ConsumerRecord<String, String>> records = consumeRecordsFor(ledgerAddress, 3, 10_000);
        assertEquals(3, records.size());

        // Same key, same partition, publish order preserved
        assertEquals(1, records.stream().map(ConsumerRecord::partition).distinct().count());
        assertTrue(records.get(0).value().contains("\"100\""));
        assertTrue(records.get(1).value().contains("\"200\""));
        assertTrue(records.get(2).value().contains("\"300\""));

        printSuccess("Ledger events published in order under key " + ledgerAddress);
    }

    @Test
    @DisplayName("Deployment events are routed to the deployments topic")
    void topicFor_RoutesByAggregateType() {
        OutboxEvent deployment = OutboxEvent.create(OutboxService.DEPLOYMENT_AGGREGATE,
                UUID.randomUUID().toString(), "LedgerDeployed", "{}");
        OutboxEvent ledger = OutboxEvent.create(OutboxService.LEDGER_AGGREGATE,
                ledgerAddress, "RevenueReceived", "{}");

        assertEquals(deploymentsTopic, outboxPublisher.topicFor(deployment));
        assertEquals(ledgersTopic, outboxPublisher.topicFor(ledger));
    }

    private List<ConsumerRecord<String, String>> consumeRecordsFor(String key, int expected, long timeoutMs) {
        List<ConsumerRecord<String, String>> matching = new ArrayList<>();
        long endTime = System.currentTimeMillis() + timeoutMs;

        while (System.currentTimeMillis() < endTime && matching.size() < expected) {
            for (ConsumerRecord<String, String> record : consumer.poll(Duration.ofMillis(200))) {
                if (key.equals(record.key())) {
                    matching.add(record);
                }
            }
        }
        return matching;
    }
}
