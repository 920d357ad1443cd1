package io.stakechain.core.state;

import io.stakechain.core.protocol.LedgerException;
import io.stakechain.core.protocol.ProtocolError;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryStateStoreTest {

    @Test
    void creditCreatesAccountLazily() {
        StateStore state = new InMemoryStateStore();
        assertFalse(state.exists("alice"));
        assertEquals(0.0, state.getBalance("alice"));

        state.credit("alice", 25.5);

        assertTrue(state.exists("alice"));
        assertEquals(25.5, state.getBalance("alice"), 1e-12);
        assertEquals(1, state.size());
    }

    @Test
    void debitChecksExistenceAndBalance() {
        StateStore state = new InMemoryStateStore();
        LedgerException missing = assertThrows(LedgerException.class, () -> state.debit("ghost", 1));
        assertEquals(ProtocolError.UNKNOWN_SENDER, missing.error());

        state.credit("alice", 10);
        LedgerException broke = assertThrows(LedgerException.class, () -> state.debit("alice", 10.5));
        assertEquals(ProtocolError.INSUFFICIENT_BALANCE, broke.error());
        assertEquals(10, state.getBalance("alice"), 1e-12);

        state.debit("alice", 10);
        assertEquals(0, state.getBalance("alice"), 1e-12);
    }

    @Test
    void negativeAmountsAreMisuse() {
        StateStore state = new InMemoryStateStore();
        assertThrows(IllegalArgumentException.class, () -> state.credit("alice", -1));
        assertThrows(IllegalArgumentException.class, () -> state.credit(" ", 1));
    }

    @Test
    void tokenHoldingsAreSeparateFromNativeBalance() {
        StateStore state = new InMemoryStateStore();
        state.creditToken("alice", "USDX", 40);

        assertEquals(0, state.getBalance("alice"), 1e-12);
        assertEquals(40, state.getTokenBalance("alice", "USDX"), 1e-12);
        assertThrows(LedgerException.class, () -> state.debitToken("alice", "USDX", 41));
        assertThrows(LedgerException.class, () -> state.debitToken("bob", "USDX", 1));

        state.debitToken("alice", "USDX", 15);
        assertEquals(25, state.getAccount("alice").orElseThrow().tokenBalance("USDX"), 1e-12);
    }

    @Test
    void snapshotsDoNotAliasLiveState() {
        StateStore state = new InMemoryStateStore();
        state.creditToken("alice", "USDX", 5);
        Account before = state.getAccount("alice").orElseThrow();

        state.creditToken("alice", "USDX", 5);
        state.incrementNonce("alice");
        state.markValidator("alice");

        assertEquals(5, before.tokenBalance("USDX"), 1e-12);
        assertEquals(0, before.nonce());
        assertFalse(before.validator());
        assertThrows(UnsupportedOperationException.class, () -> before.tokens().put("X", 1.0));
    }
}
