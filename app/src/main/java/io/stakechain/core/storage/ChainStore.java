package io.stakechain.core.storage;

import io.stakechain.core.protocol.Block;

import java.util.List;
import java.util.Optional;

/**
 * Append-only chain persistence API.
 * Blocks are indexed by height, by hash and by the ids of the transactions they carry.
 *
 * Notes:
 * - {@link #append} only accepts a block that extends the current head (index = head + 1,
 *   previousHash = head hash); there is no fork handling.
 * - Returned lists are read-only.
 */
public interface ChainStore {

    /** Append a block on top of the head. Throws IllegalArgumentException if it does not extend it. */
    void append(Block block);

    Optional<Block> getBlock(long index);

    Optional<Block> getBlockByHash(String hash);

    /** Index of the block that committed the transaction, if any. */
    Optional<Long> findTransactionBlock(String txId);

    default boolean containsTransaction(String txId) {
        return findTransactionBlock(txId).isPresent();
    }

    /** Latest block if set. */
    Optional<Block> getHead();

    /** Number of blocks stored. */
    long size();

    /** All blocks in index order. */
    List<Block> getBlocksInOrder();
}
