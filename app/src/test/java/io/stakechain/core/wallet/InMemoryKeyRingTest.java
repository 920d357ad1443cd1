package io.stakechain.core.wallet;

import io.stakechain.core.protocol.Transaction;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryKeyRingTest {

    @Test
    void walletIsCreatedOnceAndReused() {
        InMemoryKeyRing keys = new InMemoryKeyRing();
        assertFalse(keys.contains("alice"));
        assertTrue(keys.publicKeyOf("alice").isEmpty());

        Wallet first = keys.walletFor("alice");
        Wallet second = keys.walletFor("alice");

        assertSame(first, second);
        assertTrue(keys.contains("alice"));
        assertEquals(first.getPublicKey(), keys.publicKeyOf("alice").orElseThrow());
        assertThrows(IllegalArgumentException.class, () -> keys.walletFor(""));
    }

    @Test
    void walletSignsOnlyItsOwnTransactions() {
        InMemoryKeyRing keys = new InMemoryKeyRing();
        Wallet alice = keys.walletFor("alice");
        Wallet bob = keys.walletFor("bob");
        Transaction tx = Transaction.transfer("alice", "bob", 10);

        Transaction signed = alice.sign(tx);

        assertTrue(alice.verify(signed));
        assertFalse(bob.verify(signed));
        assertThrows(IllegalArgumentException.class, () -> bob.sign(tx));
    }

    @Test
    void registerKeepsExistingWallet() {
        InMemoryKeyRing keys = new InMemoryKeyRing();
        Wallet generated = keys.walletFor("carol");
        Wallet imported = Wallet.generate("carol");

        assertSame(generated, keys.register(imported));
        Wallet dave = Wallet.generate("dave");
        assertSame(dave, keys.register(dave));
        assertEquals(dave.getPublicKey(), keys.publicKeyOf("dave").orElseThrow());
    }
}
