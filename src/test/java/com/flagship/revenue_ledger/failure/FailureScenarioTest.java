package com.flagship.revenue_ledger.failure;

import com.flagship.revenue_ledger.allocation.ClaimantShare;
import com.flagship.revenue_ledger.allocation.ShareTable;
import com.flagship.revenue_ledger.deployment.AmbiguousDeploymentException;
import com.flagship.revenue_ledger.deployment.DeploymentFailedException;
import com.flagship.revenue_ledger.deployment.DeploymentOrchestrator;
import com.flagship.revenue_ledger.deployment.DeploymentRecord;
import com.flagship.revenue_ledger.deployment.DeploymentStatus;
import com.flagship.revenue_ledger.deployment.LedgerProvisioner;
import com.flagship.revenue_ledger.deployment.ProvisioningOutcome;
import com.flagship.revenue_ledger.deployment.ProvisioningRequest;
import com.flagship.revenue_ledger.funding.FundingOutcome;
import com.flagship.revenue_ledger.funding.FundingRound;
import com.flagship.revenue_ledger.funding.FundingRoundService;
import com.flagship.revenue_ledger.funding.FundingStateMachine;
import com.flagship.revenue_ledger.funding.FundingStatus;
import com.flagship.revenue_ledger.ledger.DepositResult;
import com.flagship.revenue_ledger.ledger.LedgerService;
import com.flagship.revenue_ledger.ledger.ReleaseReceipt;
import com.flagship.revenue_ledger.outbox.OutboxEvent;
import com.flagship.revenue_ledger.outbox.OutboxService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * End-to-end failure scenarios across funding, deployment and the ledger.
 *
 * The provisioner and Redis are mocked so that each test can decide how
 * they misbehave; everything else runs against a real database.
 *
 * Invariants checked here:
 * 1. A round gets at most one ledger, whatever fails and however often it is retried.
 * 2. A failed or unknown deployment never leaves a half-registered ledger.
 * 3. Losing the cache never loses deposits or double-counts them.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class FailureScenarioTest {

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
        // No broker in these tests; events stay in the outbox
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("spring.kafka.admin.auto-create", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
    }

    @Autowired
    private FundingStateMachine fundingStateMachine;

    @Autowired
    private FundingRoundService roundService;

    @Autowired
    private DeploymentOrchestrator orchestrator;

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private OutboxService outboxService;

    @MockBean
    private LedgerProvisioner provisioner;

    @MockBean
    private StringRedisTemplate redisTemplate;

    @MockBean
    private ValueOperations<String, String> valueOperations;

    private String owner;
    private String alice;
    private String bob;

    private static String randomAddress() {
        String hex = (UUID.randomUUID().toString() + UUID.randomUUID()).replace("-", "");
        return "0x" + hex.substring(0, 40);
    }

    @BeforeEach
    void setUp() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        owner = randomAddress();
        alice = randomAddress();
        bob = randomAddress();
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    /**
     * Opens a 5000 round and brings it to 3000 from alice, leaving bob's 2000 to reach the goal.
     */
    private FundingRound openPartlyFundedRound() {
        FundingRound round = roundService.open(owner, new BigDecimal("5000"));
        fundingStateMachine.contribute(round.getId(), alice, new BigDecimal("3000"));
        return round;
    }

    @Nested
    @DisplayName("Deployment Failures")
    class DeploymentFailures {

        @Test
        @DisplayName("Reaching the goal deploys once and the round goes live")
        void goalReached_DeploysAndGoesLive() {
            printTestHeader("Goal Reached: Happy Path");

            String ledgerAddress = randomAddress();
            when(provisioner.provision(any())).thenReturn(ProvisioningOutcome.succeeded(ledgerAddress));
            FundingRound round = openPartlyFundedRound();

            FundingOutcome outcome = fundingStateMachine.contribute(round.getId(), bob, new BigDecimal("2000"));

            assertTrue(outcome.isDeployed());
            assertEquals(ledgerAddress, outcome.getLedgerAddress());
            assertEquals(FundingStatus.LIVE, roundService.getRound(round.getId()).getStatus());
            assertEquals(ledgerAddress, roundService.getRound(round.getId()).getLedgerAddress());
            assertTrue(ledgerService.findLedger(ledgerAddress).isPresent());

            List<String> types = outboxService
                    .getEventsForAggregate(OutboxService.DEPLOYMENT_AGGREGATE, round.getId().toString())
                    .stream().map(OutboxEvent::getEventType).toList();
            assertEquals(List.of("LedgerDeployed"), types);

            printSuccess("Round live with ledger " + ledgerAddress);
        }

        @Test
        @DisplayName("A failed deployment keeps the round funding and a retry completes it")
        void failedDeployment_RetrySucceeds() {
            printTestHeader("Failed Deployment Then Retry");

            String ledgerAddress = randomAddress();
            when(provisioner.provision(any()))
                    .thenReturn(ProvisioningOutcome.failed("exit code 1: insufficient funds"))
                    .thenReturn(ProvisioningOutcome.succeeded(ledgerAddress));
            FundingRound round = openPartlyFundedRound();

            FundingOutcome outcome = fundingStateMachine.contribute(round.getId(), bob, new BigDecimal("2000"));

            assertTrue(outcome.isDeploymentAttempted());
            assertFalse(outcome.isDeployed());
            assertInstanceOf(DeploymentFailedException.class, outcome.getDeploymentFailure());
            assertEquals(FundingStatus.FUNDING, roundService.getRound(round.getId()).getStatus());
            assertEquals(DeploymentStatus.FAILED, orchestrator.findRecord(round.getId()).getStatus());
            assertTrue(ledgerService.findByRoundId(round.getId()).isEmpty(), "No ledger for a failed deployment");
            System.out.println("First attempt failed as expected");

            FundingRound retried = fundingStateMachine.retryDeployment(round.getId());

            assertEquals(FundingStatus.LIVE, retried.getStatus());
            assertEquals(ledgerAddress, retried.getLedgerAddress());
            DeploymentRecord record = orchestrator.findRecord(round.getId());
            assertEquals(DeploymentStatus.DEPLOYED, record.getStatus());
            assertEquals(2, record.getAttempts());
            verify(provisioner, times(2)).provision(any());

            printSuccess("Retry deployed the ledger on attempt 2");
        }

        @Test
        @DisplayName("An unknown outcome blocks retries until reconciled")
        void ambiguousDeployment_RequiresReconcile() {
            printTestHeader("Ambiguous Deployment");

            when(provisioner.provision(any()))
                    .thenReturn(ProvisioningOutcome.ambiguous("timed out after 120s"));
            FundingRound round = openPartlyFundedRound();

            FundingOutcome outcome = fundingStateMachine.contribute(round.getId(), bob, new BigDecimal("2000"));

            assertInstanceOf(AmbiguousDeploymentException.class, outcome.getDeploymentFailure());
            assertEquals(DeploymentStatus.AMBIGUOUS, orchestrator.findRecord(round.getId()).getStatus());
            assertThrows(AmbiguousDeploymentException.class,
                    () -> fundingStateMachine.retryDeployment(round.getId()));
            verify(provisioner, times(1)).provision(any());

            // Operator found the ledger the timed-out run created
            String observed = randomAddress();
            DeploymentRecord reconciled = orchestrator.reconcile(round.getId(), observed);

            assertEquals(DeploymentStatus.DEPLOYED, reconciled.getStatus());
            assertEquals(FundingStatus.LIVE, roundService.getRound(round.getId()).getStatus());
            assertTrue(ledgerService.findLedger(observed).isPresent());

            printSuccess("Reconciled to " + observed + " without provisioning again");
        }

        @Test
        @DisplayName("A provisioner that throws is treated as an unknown outcome")
        void provisionerThrows_TreatedAsAmbiguous() {
            when(provisioner.provision(any())).thenThrow(new IllegalStateException("socket closed"));
            FundingRound round = openPartlyFundedRound();

            FundingOutcome outcome = fundingStateMachine.contribute(round.getId(), bob, new BigDecimal("2000"));

            assertInstanceOf(AmbiguousDeploymentException.class, outcome.getDeploymentFailure());
            assertEquals(DeploymentStatus.AMBIGUOUS, orchestrator.findRecord(round.getId()).getStatus());

            DeploymentRecord reconciled = orchestrator.reconcile(round.getId(), null);
            assertEquals(DeploymentStatus.FAILED, reconciled.getStatus());
            assertEquals(FundingStatus.FUNDING, roundService.getRound(round.getId()).getStatus());
        }
    }

    @Nested
    @DisplayName("Concurrency")
    class Concurrency {

        @Test
        @DisplayName("Concurrent contributions claim the goal once and deploy once")
        void concurrentContributions_DeployOnce() throws InterruptedException {
            printTestHeader("Concurrent Goal-Reaching Contributions");

            String ledgerAddress = randomAddress();
            when(provisioner.provision(any(ProvisioningRequest.class))).thenAnswer(invocation -> {
                Thread.sleep(100);
                return ProvisioningOutcome.succeeded(ledgerAddress);
            });

            FundingRound round = roundService.open(owner, new BigDecimal("4000"));
            int threads = 8;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            CountDownLatch done = new CountDownLatch(threads);
            AtomicInteger accepted = new AtomicInteger();
            AtomicInteger rejected = new AtomicInteger();
            AtomicInteger deployed = new AtomicInteger();

            for (int i = 0; i < threads; i++) {
                String contributor = randomAddress();
                executor.submit(() -> {
                    try {
                        start.await();
                        FundingOutcome outcome = fundingStateMachine.contribute(
                                round.getId(), contributor, new BigDecimal("1000"));
                        accepted.incrementAndGet();
                        if (outcome.isDeployed()) {
                            deployed.incrementAndGet();
                        }
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    } catch (RuntimeException e) {
                        System.out.println("Rejected: " + e.getMessage());
                        rejected.incrementAndGet();
                    } finally {
                        done.countDown();
                    }
                });
            }

            start.countDown();
            assertTrue(done.await(30, TimeUnit.SECONDS));
            executor.shutdown();

            assertEquals(4, accepted.get(), "Exactly the target is accepted");
            assertEquals(threads - 4, rejected.get());
            assertEquals(1, deployed.get(), "Only the goal-reaching contribution deploys");
            verify(provisioner, times(1)).provision(any());
            assertEquals(FundingStatus.LIVE, roundService.getRound(round.getId()).getStatus());

            printSuccess("One deployment for " + threads + " racing contributors");
        }
    }

    @Nested
    @DisplayName("Redis Failures")
    class RedisFailures {

        private String ledgerAddress;
        private String payee;

        @BeforeEach
        void deployLedger() {
            ledgerAddress = randomAddress();
            payee = randomAddress();
            when(provisioner.provision(any())).thenReturn(ProvisioningOutcome.succeeded(ledgerAddress));
            orchestrator.deploy(UUID.randomUUID(), owner,
                    ShareTable.of(List.of(ClaimantShare.of(payee, 10_000))),
                    BigInteger.valueOf(1_000_000));
        }

        @Test
        @DisplayName("Deposits keep working and stay idempotent when Redis is down")
        void redisDown_FallsBackToDatabase() {
            printTestHeader("Redis Unavailable");

            when(valueOperations.get(anyString()))
                    .thenThrow(new RedisConnectionFailureException("Connection refused"));
            doThrow(new RedisConnectionFailureException("Connection refused"))
                    .when(valueOperations).set(anyString(), anyString(), any(Duration.class));

            DepositResult first = ledgerService.deposit(ledgerAddress, BigInteger.valueOf(5000), "redis-down-1");
            DepositResult replay = ledgerService.deposit(ledgerAddress, BigInteger.valueOf(5000), "redis-down-1");

            assertFalse(first.isDuplicate());
            assertTrue(replay.isDuplicate(), "Database still detects the replay");
            assertEquals(first.getDeposit().getId(), replay.getDeposit().getId());
            assertEquals(BigInteger.valueOf(5000), ledgerService.getLedger(ledgerAddress).getTotalReceived());

            ReleaseReceipt receipt = ledgerService.release(ledgerAddress, payee);
            assertEquals(BigInteger.valueOf(5000), receipt.getAmount());

            printSuccess("Deposit and release succeeded without Redis");
        }

        @Test
        @DisplayName("A stale Redis entry cannot replace the database lookup")
        void staleRedisEntry_DatabaseWins() {
            when(valueOperations.get(anyString())).thenReturn(UUID.randomUUID().toString());

            DepositResult result = ledgerService.deposit(ledgerAddress, BigInteger.valueOf(700), "stale-key");

            assertFalse(result.isDuplicate());
            assertEquals(BigInteger.valueOf(700), ledgerService.getLedger(ledgerAddress).getTotalReceived());
        }
    }
}
