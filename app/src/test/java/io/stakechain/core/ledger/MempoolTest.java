package io.stakechain.core.ledger;

import io.stakechain.core.MutableClock;
import io.stakechain.core.protocol.Block;
import io.stakechain.core.protocol.LedgerException;
import io.stakechain.core.protocol.ProtocolError;
import io.stakechain.core.protocol.SignatureUtil;
import io.stakechain.core.protocol.Transaction;
import io.stakechain.core.protocol.TransactionType;
import io.stakechain.core.state.InMemoryStateStore;
import io.stakechain.core.state.StateStore;
import io.stakechain.core.storage.ChainStore;
import io.stakechain.core.storage.InMemoryChainStore;
import io.stakechain.core.wallet.InMemoryKeyRing;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class MempoolTest {

    private MutableClock clock;
    private StateStore state;
    private ChainStore chain;
    private InMemoryKeyRing keys;
    private Mempool mempool;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        state = new InMemoryStateStore();
        chain = new InMemoryChainStore();
        keys = new InMemoryKeyRing();
        state.credit("alice", 1_000);
        mempool = new Mempool(new TxValidator(state, chain, keys, false, clock), 60_000L);
    }

    private Transaction transfer(String from, String to, double amount) {
        return Transaction.create(from, to, amount, TransactionType.TRANSFER, null, clock);
    }

    private static ProtocolError rejection(Runnable op) {
        return assertThrows(LedgerException.class, op::run).error();
    }

    @Test
    void addAcceptsValidTransaction() {
        assertTrue(mempool.add(transfer("alice", "bob", 10)));
        assertEquals(1, mempool.size());
    }

    @Test
    void addRejectsWhenBalanceInsufficient() {
        assertEquals(ProtocolError.INSUFFICIENT_BALANCE, rejection(() -> mempool.add(transfer("alice", "bob", 1_000))));
        assertEquals(ProtocolError.UNKNOWN_SENDER, rejection(() -> mempool.add(transfer("ghost", "bob", 1))));
        assertEquals(ProtocolError.NON_POSITIVE_AMOUNT, rejection(() -> mempool.add(transfer("alice", "bob", -5))));
        assertEquals(0, mempool.size());
    }

    @Test
    void equivalentTransactionWithinWindowIsDuplicate() {
        mempool.add(transfer("alice", "bob", 10));
        clock.advanceMillis(59_999);

        assertEquals(ProtocolError.DUPLICATE_TRANSACTION, rejection(() -> mempool.add(transfer("alice", "bob", 10))));
        mempool.add(transfer("alice", "bob", 11));
        mempool.add(transfer("alice", "carol", 10));

        clock.advanceMillis(1);
        mempool.add(transfer("alice", "bob", 10));
        assertEquals(4, mempool.size());
    }

    @Test
    void sameIdIsDuplicateWhetherPendingOrCommitted() {
        Transaction tx = transfer("alice", "bob", 10);
        mempool.add(tx);
        assertEquals(ProtocolError.DUPLICATE_TRANSACTION, rejection(() -> mempool.add(tx)));

        Block genesis = Block.create(0, List.of(), "0", "genesis", clock.millis());
        chain.append(genesis);
        Transaction committed = transfer("alice", "dave", 3);
        chain.append(Block.create(1, List.of(committed), genesis.hash(), "v1", clock.millis()));

        assertEquals(ProtocolError.DUPLICATE_TRANSACTION, rejection(() -> mempool.add(committed)));
    }

    @Test
    void signaturesAreCheckedAgainstTheKeyRing() {
        keys.walletFor("alice");
        Transaction forged = transfer("alice", "bob", 10).sign(SignatureUtil.generateKeyPair().getPrivate());
        assertEquals(ProtocolError.INVALID_SIGNATURE, rejection(() -> mempool.add(forged)));

        Transaction genuine = keys.walletFor("alice").sign(transfer("alice", "bob", 10));
        assertTrue(mempool.add(genuine));

        Mempool strict = new Mempool(new TxValidator(state, chain, keys, true, clock), 60_000L);
        assertEquals(ProtocolError.INVALID_SIGNATURE, rejection(() -> strict.add(transfer("alice", "carol", 1))));
    }

    @Test
    void candidatesComeOutByFeeDescending() {
        Transaction small = transfer("alice", "bob", 10);
        Transaction large = transfer("alice", "carol", 500);
        Transaction medium = transfer("alice", "dave", 100);
        mempool.add(small);
        mempool.add(large);
        mempool.add(medium);

        assertEquals(List.of(large, medium, small), mempool.candidates(10));
        assertEquals(List.of(large, medium), mempool.candidates(2));
        assertEquals(List.of(small, large, medium), mempool.snapshot());
        assertEquals(3, mempool.size());

        mempool.removeAll(List.of(large, small));
        assertEquals(List.of(medium), mempool.snapshot());
        assertFalse(mempool.contains(large.id()));
    }
}
