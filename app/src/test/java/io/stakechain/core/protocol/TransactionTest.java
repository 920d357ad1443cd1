package io.stakechain.core.protocol;

import io.stakechain.core.MutableClock;
import org.junit.jupiter.api.Test;

import java.security.KeyPair;

import static org.junit.jupiter.api.Assertions.*;

public class TransactionTest {

    @Test
    void feePolicyScalesByTypeAndAmount() {
        assertEquals(0.011, TransactionFees.compute(TransactionType.TRANSFER, 100), 1e-9);
        assertEquals(0.017, TransactionFees.compute(TransactionType.STAKE, 150), 1e-9);
        // surcharge applies only to the 1000 above the threshold
        assertEquals(0.701, TransactionFees.compute(TransactionType.TRANSFER, 2000), 1e-9);
        assertEquals(0.0015 + 0.01, TransactionFees.compute(TransactionType.SWAP, 100), 1e-9);
    }

    @Test
    void feeNeverBelowBaseFee() {
        assertEquals(TransactionFees.BASE_FEE, TransactionFees.compute(TransactionType.TRANSFER, 0), 1e-12);
    }

    @Test
    void createAssignsIdTimestampAndPolicyFee() {
        MutableClock clock = new MutableClock();
        Transaction tx = Transaction.create("alice", "bob", 100, TransactionType.TRANSFER, null, clock);

        assertNotNull(tx.id());
        assertEquals(clock.millis(), tx.timestamp());
        assertEquals(0.011, tx.fee(), 1e-9);
        assertFalse(tx.isSigned());
        assertTrue(tx.isValid(clock.millis()));
    }

    @Test
    void validationRules() {
        MutableClock clock = new MutableClock();
        long now = clock.millis();

        assertEquals(ProtocolError.MISSING_ADDRESS,
                Transaction.create("", "bob", 1, TransactionType.TRANSFER, null, clock).validate(now).error);
        assertEquals(ProtocolError.NON_POSITIVE_AMOUNT,
                Transaction.create("alice", "bob", 0, TransactionType.TRANSFER, null, clock).validate(now).error);
        assertEquals(ProtocolError.SELF_TRANSFER,
                Transaction.create("alice", "alice", 1, TransactionType.TRANSFER, null, clock).validate(now).error);
        assertTrue(Transaction.create("alice", "alice", 100, TransactionType.STAKE, null, clock).isValid(now));
        assertEquals(ProtocolError.STAKE_BELOW_MINIMUM,
                Transaction.create("alice", "v1", 99, TransactionType.STAKE, null, clock).validate(now).error);
        assertEquals(ProtocolError.MISSING_SWAP_TOKENS,
                Transaction.create("alice", "router", 5, TransactionType.SWAP, Payload.validator("x"), clock).validate(now).error);

        Transaction negativeFee = Transaction.builder().from("alice").to("bob").amount(1).fee(-0.1).timestamp(now).build();
        assertEquals(ProtocolError.NEGATIVE_FEE, negativeFee.validate(now).error);
    }

    @Test
    void timestampWindow() {
        MutableClock clock = new MutableClock();
        Transaction tx = Transaction.create("alice", "bob", 10, TransactionType.TRANSFER, null, clock);

        assertTrue(tx.isValid(clock.millis() + Transaction.MAX_AGE_MILLIS));
        assertEquals(ProtocolError.STALE_TIMESTAMP, tx.validate(clock.millis() + Transaction.MAX_AGE_MILLIS + 1).error);
        assertEquals(ProtocolError.FUTURE_TIMESTAMP,
                tx.validate(clock.millis() - Transaction.MAX_FUTURE_DRIFT_MILLIS - 1).error);
    }

    @Test
    void signProducesVerifiableCopyAndLeavesOriginalUntouched() {
        KeyPair keys = SignatureUtil.generateKeyPair();
        KeyPair other = SignatureUtil.generateKeyPair();
        Transaction tx = Transaction.transfer("alice", "bob", 25);

        Transaction signed = tx.sign(keys.getPrivate());

        assertFalse(tx.isSigned());
        assertTrue(signed.isSigned());
        assertEquals(tx.id(), signed.id());
        assertEquals(tx.contentDigest(), signed.contentDigest());
        assertTrue(signed.verify(keys.getPublic()));
        assertFalse(signed.verify(other.getPublic()));
        assertThrows(IllegalStateException.class, () -> signed.sign(keys.getPrivate()));
    }

    @Test
    void digestCoversPayload() {
        Transaction a = Transaction.builder().id("t").from("alice").to("v1").amount(200)
                .type(TransactionType.STAKE).payload(Payload.validator("v1")).timestamp(1L).build();
        Transaction b = Transaction.builder().id("t").from("alice").to("v1").amount(200)
                .type(TransactionType.STAKE).payload(Payload.validator("v2")).timestamp(1L).build();

        assertNotEquals(a.contentDigest(), b.contentDigest());
        assertEquals("v2", b.validatorAddress());
    }

    @Test
    void tamperedSignedTransactionFailsVerification() {
        KeyPair keys = SignatureUtil.generateKeyPair();
        Transaction signed = Transaction.transfer("alice", "bob", 25).sign(keys.getPrivate());

        Transaction tampered = Transaction.builder()
                .id(signed.id()).from(signed.from()).to(signed.to()).amount(2500)
                .fee(signed.fee()).timestamp(signed.timestamp()).signature(signed.signature())
                .build();

        assertFalse(tampered.verify(keys.getPublic()));
    }
}
