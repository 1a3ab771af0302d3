package com.flagship.settlement_engine.authorization;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Fingerprints key settlement state, so they must be deterministic and
 * sensitive to every field.
 */
class OrderFingerprintServiceTest {

    private final OrderFingerprintService fingerprintService = new OrderFingerprintService();

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    @Test
    @DisplayName("Fingerprint is keccak-256 over the tightly packed fields")
    void testFingerprint_MatchesPackedEncoding() throws Exception {
        printTestHeader("Fingerprint Packed Encoding");

        SwapOrder order = TestSigners.order(BigInteger.valueOf(7), 1_700_000_600L);

        ByteArrayOutputStream packed = new ByteArrayOutputStream();
        packed.write(Numeric.toBytesPadded(order.getId(), 32));
        packed.write(Numeric.hexStringToByteArray(order.getInitiator()));
        packed.write(Numeric.hexStringToByteArray(order.getCounterparty()));
        packed.write(Numeric.hexStringToByteArray(order.getAssetA()));
        packed.write(Numeric.hexStringToByteArray(order.getAssetB()));
        packed.write(Numeric.toBytesPadded(order.getAmountA(), 32));
        packed.write(Numeric.toBytesPadded(order.getAmountB(), 32));
        packed.write(Numeric.toBytesPadded(order.getExpiry(), 32));
        assertEquals(208, packed.size());

        String expected = Numeric.toHexString(Hash.sha3(packed.toByteArray()));
        String fingerprint = fingerprintService.fingerprint(order);
        printOutput("Fingerprint", fingerprint);

        assertEquals(expected, fingerprint);
        assertEquals(66, fingerprint.length());
    }

    @Test
    @DisplayName("Fingerprint is deterministic and ignores address casing")
    void testFingerprint_Deterministic() {
        printTestHeader("Fingerprint Determinism");

        SwapOrder order = TestSigners.order(BigInteger.ONE, 1_700_000_600L);
        SwapOrder upperCased = order.withInitiator("0x" + order.getInitiator().substring(2).toUpperCase());

        assertEquals(fingerprintService.fingerprint(order), fingerprintService.fingerprint(order));
        assertEquals(fingerprintService.fingerprint(order), fingerprintService.fingerprint(upperCased));
    }

    @Test
    @DisplayName("Changing any field changes the fingerprint")
    void testFingerprint_SensitiveToEveryField() {
        printTestHeader("Fingerprint Field Sensitivity");

        SwapOrder order = TestSigners.order(BigInteger.ONE, 1_700_000_600L);
        String base = fingerprintService.fingerprint(order);

        assertNotEquals(base, fingerprintService.fingerprint(order.withId(BigInteger.TWO)));
        assertNotEquals(base, fingerprintService.fingerprint(order.withInitiator(TestSigners.address(TestSigners.STRANGER))));
        assertNotEquals(base, fingerprintService.fingerprint(order.withCounterparty(TestSigners.address(TestSigners.STRANGER))));
        assertNotEquals(base, fingerprintService.fingerprint(order.withAssetA(TestSigners.ASSET_Y)));
        assertNotEquals(base, fingerprintService.fingerprint(order.withAssetB(TestSigners.ASSET_X)));
        assertNotEquals(base, fingerprintService.fingerprint(order.withAmountA(BigInteger.valueOf(101))));
        assertNotEquals(base, fingerprintService.fingerprint(order.withAmountB(BigInteger.valueOf(201))));
        assertNotEquals(base, fingerprintService.fingerprint(order.withExpiry(BigInteger.valueOf(1_700_000_601L))));
    }

    @Test
    @DisplayName("Swapping the two amounts changes the fingerprint")
    void testFingerprint_FieldOrderMatters() {
        printTestHeader("Fingerprint Field Order");

        SwapOrder order = TestSigners.order(BigInteger.ONE, 1_700_000_600L);
        SwapOrder swapped = order.withAmountA(order.getAmountB()).withAmountB(order.getAmountA());

        assertNotEquals(fingerprintService.fingerprint(order), fingerprintService.fingerprint(swapped));
    }

    @Test
    @DisplayName("Out-of-range integers and malformed addresses are rejected when the order is built")
    void testOrder_RejectsInvalidFields() {
        printTestHeader("Order Field Validation");

        SwapOrder order = TestSigners.order(BigInteger.ONE, 1_700_000_600L);

        assertThrows(IllegalArgumentException.class, () -> order.withAmountA(BigInteger.valueOf(-1)));
        assertThrows(IllegalArgumentException.class, () -> order.withId(BigInteger.ONE.shiftLeft(256)));
        assertThrows(IllegalArgumentException.class, () -> order.withCounterparty("0x1234"));
        assertThrows(IllegalArgumentException.class, () -> order.withAssetA(null));
    }
}
