package io.stakechain.core.storage;

import io.stakechain.core.protocol.Block;
import io.stakechain.core.protocol.Transaction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Simple, fast in-memory chain store.
 * Not persistent; callers snapshot the chain through the ledger export if they need durability.
 */
public final class InMemoryChainStore implements ChainStore {

    /** Blocks by index. */
    private final List<Block> blocks = new ArrayList<>();

    /** Map: blockHash -> index */
    private final Map<String, Long> byHash = new HashMap<>();

    /** Map: txId -> index of the committing block */
    private final Map<String, Long> byTransaction = new HashMap<>();

    @Override
    public synchronized void append(Block block) {
        if (block == null) {
            throw new IllegalArgumentException("block required");
        }
        long expectedIndex = blocks.size();
        if (block.index() != expectedIndex) {
            throw new IllegalArgumentException("Block index " + block.index() + " does not extend head (expected " + expectedIndex + ")");
        }
        if (!blocks.isEmpty()) {
            String headHash = blocks.get(blocks.size() - 1).hash();
            if (!headHash.equals(block.previousHash())) {
                throw new IllegalArgumentException("Block " + block.index() + " previousHash does not match head " + headHash);
            }
        }
        for (Transaction tx : block.transactions()) {
            if (byTransaction.containsKey(tx.id())) {
                throw new IllegalArgumentException("Transaction " + tx.id() + " already committed in block " + byTransaction.get(tx.id()));
            }
        }

        blocks.add(block);
        byHash.put(block.hash(), block.index());
        for (Transaction tx : block.transactions()) {
            byTransaction.put(tx.id(), block.index());
        }
    }

    @Override
    public synchronized Optional<Block> getBlock(long index) {
        if (index < 0 || index >= blocks.size()) return Optional.empty();
        return Optional.of(blocks.get((int) index));
    }

    @Override
    public synchronized Optional<Block> getBlockByHash(String hash) {
        if (hash == null) return Optional.empty();
        Long index = byHash.get(hash);
        return index == null ? Optional.empty() : Optional.of(blocks.get(index.intValue()));
    }

    @Override
    public synchronized Optional<Long> findTransactionBlock(String txId) {
        if (txId == null) return Optional.empty();
        return Optional.ofNullable(byTransaction.get(txId));
    }

    @Override
    public synchronized Optional<Block> getHead() {
        if (blocks.isEmpty()) return Optional.empty();
        return Optional.of(blocks.get(blocks.size() - 1));
    }

    @Override
    public synchronized long size() {
        return blocks.size();
    }

    @Override
    public synchronized List<Block> getBlocksInOrder() {
        return Collections.unmodifiableList(new ArrayList<>(blocks));
    }
}
