package com.flagship.settlement_engine.swap;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.settlement_engine.authorization.AuthorizationVerifier;
import com.flagship.settlement_engine.authorization.OrderFingerprintService;
import com.flagship.settlement_engine.authorization.SwapOrder;
import com.flagship.settlement_engine.authorization.TestSigners;
import com.flagship.settlement_engine.swap.dto.SignedSwapRequest;
import com.flagship.settlement_engine.swap.dto.SwapOrderPayload;
import com.flagship.settlement_engine.transfer.AssetLedgerService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigInteger;
import java.time.Instant;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * HTTP surface of swap settlement: status codes, error bodies and the
 * snake_case wire format.
 */
@SpringBootTest
@AutoConfigureMockMvc
@Testcontainers(disabledWithoutDocker = true)
class SwapControllerTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("settlement_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("settlement.domain.chain-id", () -> "31337");
        registry.add("settlement.domain.verifying-contract", () -> TestSigners.VERIFYING_CONTRACT);
        // Disable Kafka and outbox publisher for these tests
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("outbox.publisher.enabled", () -> "false");
    }

    private static final String CALLER_HEADER = "X-Caller-Address";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private AuthorizationVerifier verifier;

    @Autowired
    private OrderFingerprintService fingerprintService;

    @Autowired
    private AssetLedgerService ledger;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private String initiator;
    private String counterparty;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    @BeforeEach
    void setUp() {
        jdbcTemplate.execute("TRUNCATE settlement_records, ledger_entries, asset_balances, " +
                "asset_allowances, outbox_events");

        initiator = TestSigners.address(TestSigners.INITIATOR);
        counterparty = TestSigners.address(TestSigners.COUNTERPARTY);

        ledger.mint(TestSigners.ASSET_X, initiator, BigInteger.valueOf(1000));
        ledger.mint(TestSigners.ASSET_Y, counterparty, BigInteger.valueOf(1000));
        ledger.approve(TestSigners.ASSET_X, initiator, TestSigners.VERIFYING_CONTRACT, BigInteger.valueOf(1000));
        ledger.approve(TestSigners.ASSET_Y, counterparty, TestSigners.VERIFYING_CONTRACT, BigInteger.valueOf(1000));
    }

    private static SwapOrderPayload payload(SwapOrder order) {
        return new SwapOrderPayload(order.getId(), order.getInitiator(), order.getCounterparty(),
                order.getAssetA(), order.getAssetB(), order.getAmountA(), order.getAmountB(), order.getExpiry());
    }

    private String signedRequest(SwapOrder order, String signature) throws Exception {
        return objectMapper.writeValueAsString(new SignedSwapRequest(payload(order), signature));
    }

    private SwapOrder freshOrder(long id) {
        return TestSigners.order(BigInteger.valueOf(id), Instant.now().getEpochSecond() + 3600);
    }

    @Test
    @DisplayName("Digest returns the fingerprint and the hash to sign")
    void testDigest() throws Exception {
        SwapOrder order = freshOrder(11);

        mockMvc.perform(post("/api/swaps/digest")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(payload(order))))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.fingerprint").value(fingerprintService.fingerprint(order)))
            .andExpect(jsonPath("$.domain_name").value("OTCSwap"))
            .andExpect(jsonPath("$.chain_id").value("31337"))
            .andExpect(jsonPath("$.verifying_contract").value(TestSigners.VERIFYING_CONTRACT));
    }

    @Test
    @DisplayName("Counterparty executes a signed order over HTTP")
    void testExecute_Success() throws Exception {
        printTestHeader("Execute Swap Over HTTP");

        SwapOrder order = freshOrder(12);
        String fingerprint = fingerprintService.fingerprint(order);

        String responseJson = mockMvc.perform(post("/api/swaps/execute")
                .header(CALLER_HEADER, counterparty)
                .contentType(MediaType.APPLICATION_JSON)
                .content(signedRequest(order, TestSigners.sign(verifier, order, TestSigners.INITIATOR))))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.fingerprint").value(fingerprint))
            .andExpect(jsonPath("$.status").value("EXECUTED"))
            .andExpect(jsonPath("$.order_id").value("12"))
            .andExpect(jsonPath("$.settled_by").value(counterparty))
            .andReturn()
            .getResponse()
            .getContentAsString();
        printOutput("Response", responseJson);

        mockMvc.perform(get("/api/swaps/" + fingerprint.toUpperCase().replace("0X", "0x")))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("EXECUTED"));

        mockMvc.perform(get("/api/swaps").param("initiator", initiator))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(1))
            .andExpect(jsonPath("$[0].fingerprint").value(fingerprint));
    }

    @Test
    @DisplayName("Replay is a 409 conflict")
    void testExecute_ReplayConflict() throws Exception {
        SwapOrder order = freshOrder(13);
        String body = signedRequest(order, TestSigners.sign(verifier, order, TestSigners.INITIATOR));

        mockMvc.perform(post("/api/swaps/execute")
                .header(CALLER_HEADER, counterparty)
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isOk());

        mockMvc.perform(post("/api/swaps/execute")
                .header(CALLER_HEADER, counterparty)
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("ALREADY_SETTLED"));
    }

    @Test
    @DisplayName("Wrong caller and wrong signer are 403")
    void testExecute_Forbidden() throws Exception {
        SwapOrder order = freshOrder(14);

        mockMvc.perform(post("/api/swaps/execute")
                .header(CALLER_HEADER, initiator)
                .contentType(MediaType.APPLICATION_JSON)
                .content(signedRequest(order, TestSigners.sign(verifier, order, TestSigners.INITIATOR))))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.error").value("UNAUTHORIZED_CALLER"))
            .andExpect(jsonPath("$.message").value("Only counterparty can execute"));

        mockMvc.perform(post("/api/swaps/execute")
                .header(CALLER_HEADER, counterparty)
                .contentType(MediaType.APPLICATION_JSON)
                .content(signedRequest(order, TestSigners.sign(verifier, order, TestSigners.STRANGER))))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.error").value("INVALID_SIGNATURE"));
    }

    @Test
    @DisplayName("Initiator cancels; the counterparty then gets a conflict")
    void testCancel() throws Exception {
        SwapOrder order = freshOrder(15);
        String body = signedRequest(order, TestSigners.sign(verifier, order, TestSigners.INITIATOR));

        mockMvc.perform(post("/api/swaps/cancel")
                .header(CALLER_HEADER, initiator)
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("CANCELLED"));

        mockMvc.perform(post("/api/swaps/execute")
                .header(CALLER_HEADER, counterparty)
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.message").value("Swap has been cancelled"));
    }

    @Test
    @DisplayName("Malformed input is a 400")
    void testBadRequests() throws Exception {
        SwapOrder order = freshOrder(16);
        String body = signedRequest(order, TestSigners.sign(verifier, order, TestSigners.INITIATOR));

        mockMvc.perform(post("/api/swaps/execute")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Missing Required Header"));

        mockMvc.perform(post("/api/swaps/execute")
                .header(CALLER_HEADER, counterparty)
                .contentType(MediaType.APPLICATION_JSON)
                .content(body.replace(order.getInitiator(), "0x1234")))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Validation Failed"));

        mockMvc.perform(get("/api/swaps/0xabc"))
            .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Unknown fingerprint reads as UNSEEN")
    void testStatus_Unseen() throws Exception {
        SwapOrder order = freshOrder(17);

        mockMvc.perform(get("/api/swaps/" + fingerprintService.fingerprint(order)))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("UNSEEN"));
    }
}
