package io.stakechain.core.protocol;

import io.stakechain.core.wallet.Wallet;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TransactionCodecTest {

    @Test
    void signedSwapSurvivesTheWire() {
        Wallet alice = Wallet.generate("alice");
        Transaction tx = alice.sign(Transaction.create("alice", "swap_router", 100, TransactionType.SWAP,
                Payload.swap("STC", "USDX", 100, 45)));

        Transaction restored = TransactionCodec.fromJson(TransactionCodec.toJson(tx));

        assertEquals(tx.id(), restored.id());
        assertEquals(TransactionType.SWAP, restored.type());
        assertEquals(tx.fee(), restored.fee(), 0.0);
        Payload payload = restored.payload().orElseThrow();
        assertEquals("STC", payload.tokenA());
        assertEquals("USDX", payload.tokenB());
        assertEquals(45.0, payload.minAmountOut(), 0.0);
        assertEquals(tx.contentDigest(), restored.contentDigest());
        assertTrue(alice.verify(restored));
    }

    @Test
    void absentPayloadIsWrittenAsNull() {
        Transaction tx = Transaction.transfer("alice", "bob", 5);

        String json = TransactionCodec.toJson(tx);
        assertTrue(json.contains("\"payload\":null"));
        assertTrue(json.contains("\"type\":\"transfer\""));
        assertTrue(TransactionCodec.fromJson(json).payload().isEmpty());
    }

    @Test
    void editedAmountBreaksTheSignature() {
        Wallet alice = Wallet.generate("alice");
        Transaction tx = alice.sign(Transaction.transfer("alice", "bob", 5));

        String tampered = TransactionCodec.toJson(tx).replace("\"amount\":5.0", "\"amount\":500.0");
        assertFalse(alice.verify(TransactionCodec.fromJson(tampered)));
    }

    @Test
    void malformedJsonIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> TransactionCodec.fromJson("{not json"));
        assertThrows(IllegalArgumentException.class, () -> TransactionCodec.fromJson("[1,2]"));
    }
}
