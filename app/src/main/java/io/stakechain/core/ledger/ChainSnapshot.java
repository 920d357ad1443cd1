package io.stakechain.core.ledger;

import io.stakechain.core.protocol.Block;
import io.stakechain.core.protocol.Transaction;

import java.util.List;

/** Point-in-time copy of everything an external store needs to persist. */
public record ChainSnapshot(List<Block> chain,
                            List<Transaction> pendingTransactions,
                            SupplyReport supply,
                            List<SwapPool> swapPools) {
    public ChainSnapshot {
        chain = List.copyOf(chain);
        pendingTransactions = List.copyOf(pendingTransactions);
        swapPools = List.copyOf(swapPools);
    }
}
