package com.flagship.settlement_engine.outbox;

import com.flagship.settlement_engine.authorization.AuthorizationVerifier;
import com.flagship.settlement_engine.authorization.OrderFingerprintService;
import com.flagship.settlement_engine.authorization.SwapOrder;
import com.flagship.settlement_engine.authorization.TestSigners;
import com.flagship.settlement_engine.marketplace.MarketplaceService;
import com.flagship.settlement_engine.swap.SwapSettlementService;
import com.flagship.settlement_engine.transfer.AssetLedgerService;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.KafkaContainer;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Outbox to Kafka: topic routing, record keys and the published flag.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class OutboxPublisherTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("settlement_test")
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
        registry.add("settlement.domain.chain-id", () -> "31337");
        registry.add("settlement.domain.verifying-contract", () -> TestSigners.VERIFYING_CONTRACT);
        // Publisher bean stays up, the schedule is pushed out and we trigger manually
        registry.add("outbox.publisher.enabled", () -> "true");
        registry.add("outbox.publisher.poll-interval-ms", () -> "3600000");
    }

    private static final String SELLER = "0x70997970c51812dc3a010c7d01b50e0d17dc79c8";
    private static final String OTHER_SELLER = "0x90f79bf6eb2c4f870365e785982e1f101e93b906";

    @Autowired
    private OutboxPublisher outboxPublisher;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private MarketplaceService marketplaceService;

    @Autowired
    private SwapSettlementService settlementService;

    @Autowired
    private AuthorizationVerifier verifier;

    @Autowired
    private OrderFingerprintService fingerprintService;

    @Autowired
    private AssetLedgerService ledger;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Value("${kafka.topic.swaps}")
    private String swapsTopic;

    @Value("${kafka.topic.marketplace}")
    private String marketplaceTopic;

    private KafkaConsumer<String, String> consumer;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @BeforeEach
    void setUp() {
        jdbcTemplate.execute("TRUNCATE settlement_records, listings, participants, ledger_entries, " +
                "asset_balances, asset_allowances, outbox_events");

        Properties props = new Properties();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, kafka.getBootstrapServers());
        props.put(ConsumerConfig.GROUP_ID_CONFIG, "test-group-" + UUID.randomUUID());
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");

        consumer = new KafkaConsumer<>(props);
        consumer.subscribe(List.of(swapsTopic, marketplaceTopic));
    }

    @AfterEach
    void tearDown() {
        consumer.close();
    }

    @Test
    @DisplayName("Swap and marketplace events land on their own topics, keyed by aggregate")
    void testPublisher_RoutesByAggregateType() {
        printTestHeader("Topic Routing");

        String initiator = TestSigners.address(TestSigners.INITIATOR);
        String counterparty = TestSigners.address(TestSigners.COUNTERPARTY);
        ledger.mint(TestSigners.ASSET_X, initiator, BigInteger.valueOf(100));
        ledger.mint(TestSigners.ASSET_Y, counterparty, BigInteger.valueOf(200));
        ledger.approve(TestSigners.ASSET_X, initiator, TestSigners.VERIFYING_CONTRACT, BigInteger.valueOf(100));
        ledger.approve(TestSigners.ASSET_Y, counterparty, TestSigners.VERIFYING_CONTRACT, BigInteger.valueOf(200));

        SwapOrder order = TestSigners.order(BigInteger.valueOf(21), Instant.now().getEpochSecond() + 3600);
        String fingerprint = fingerprintService.fingerprint(order);
        settlementService.executeSwap(order, TestSigners.sign(verifier, order, TestSigners.INITIATOR), counterparty);
        marketplaceService.registerParticipant(SELLER, "alice");

        assertEquals(2, outboxService.countUnpublished());

        assertEquals(2, outboxPublisher.triggerPublish());

        assertEquals(0, outboxService.countUnpublished());

        List<ConsumerRecord<String, String>> records = consumeRecords(List.of(fingerprint, SELLER), 2, 10000);
        assertEquals(2, records.size());

        ConsumerRecord<String, String> swapRecord = records.stream()
                .filter(r -> r.topic().equals(swapsTopic)).findFirst().orElseThrow();
        assertEquals(fingerprint, swapRecord.key());
        assertTrue(swapRecord.value().contains("SwapExecuted"));

        ConsumerRecord<String, String> marketplaceRecord = records.stream()
                .filter(r -> r.topic().equals(marketplaceTopic)).findFirst().orElseThrow();
        assertEquals(SELLER, marketplaceRecord.key());
        assertTrue(marketplaceRecord.value().contains("ParticipantRegistered"));

        printSuccess("Events routed and marked published");
    }

    @Test
    @DisplayName("Published events are not sent twice")
    void testPublisher_PublishesOnce() {
        marketplaceService.registerParticipant(OTHER_SELLER, "carol");

        assertEquals(1, outboxPublisher.triggerPublish());
        assertEquals(0, outboxPublisher.triggerPublish());

        List<ConsumerRecord<String, String>> records = consumeRecords(List.of(OTHER_SELLER), 2, 5000);
        assertEquals(1, records.size());
        assertTrue(outboxService.getEventsForAggregate("Participant", OTHER_SELLER).get(0).isPublished());
    }

    @Test
    @DisplayName("Unknown aggregate types have no topic")
    void testTopicFor() {
        assertEquals(swapsTopic, outboxPublisher.topicFor("Swap"));
        assertEquals(marketplaceTopic, outboxPublisher.topicFor("Participant"));
        assertEquals(marketplaceTopic, outboxPublisher.topicFor("Listing"));
        assertThrows(IllegalArgumentException.class, () -> outboxPublisher.topicFor("Invoice"));
    }

    /**
     * Polls until {@code expected} records with one of {@code keys} arrived or the timeout passed.
     * Earlier tests publish to the same topics, so other keys are skipped.
     */
    private List<ConsumerRecord<String, String>> consumeRecords(List<String> keys, int expected, long timeoutMs) {
        List<ConsumerRecord<String, String>> allRecords = new ArrayList<>();
        long endTime = System.currentTimeMillis() + timeoutMs;

        while (System.currentTimeMillis() < endTime && allRecords.size() < expected) {
            ConsumerRecords<String, String> records = consumer.poll(Duration.ofMillis(100));
            for (ConsumerRecord<String, String> record : records) {
                if (keys.contains(record.key())) {
                    allRecords.add(record);
                }
            }
        }

        return allRecords;
    }
}
