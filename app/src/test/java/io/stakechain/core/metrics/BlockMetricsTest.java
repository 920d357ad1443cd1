package io.stakechain.core.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.stakechain.core.MutableClock;
import io.stakechain.core.ledger.LedgerConfig;
import io.stakechain.core.ledger.LedgerEngine;
import io.stakechain.core.protocol.LedgerException;
import io.stakechain.core.protocol.Transaction;
import io.stakechain.core.protocol.TransactionType;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class BlockMetricsTest {

    private static double count(String name) {
        return BlockMetrics.registry().counter(name).count();
    }

    @Test
    void miningAndRejectionsAreCounted() {
        MutableClock clock = new MutableClock();
        LedgerEngine engine = new LedgerEngine(LedgerConfig.defaultLocal(), clock);
        MeterRegistry registry = BlockMetrics.registry();
        double blocks = count("blocks.produced");
        double included = count("transactions.included");
        double rejected = count("mempool.rejected");
        long timed = registry.timer("block.production.time").count();

        Transaction tx = engine.keys().walletFor("treasury").sign(Transaction.create("treasury", "alice", 10,
                TransactionType.TRANSFER, null, clock));
        engine.addTransaction(tx);
        assertThrows(LedgerException.class, () -> engine.addTransaction(tx));
        engine.mineBlock().orElseThrow();

        assertEquals(blocks + 1, count("blocks.produced"), 0.0);
        assertEquals(included + 1, count("transactions.included"), 0.0);
        assertEquals(rejected + 1, count("mempool.rejected"), 0.0);
        assertEquals(timed + 1, registry.timer("block.production.time").count());
        assertTrue(BlockMetrics.scrapeMetrics().contains("blocks.produced"));
    }
}
