package io.stakechain.core.consensus;

import java.util.List;

/**
 * Chooses the producer of a block from the eligible validators.
 * Implementations must be deterministic: the same candidates (in the same order) and the
 * same block index always give the same address.
 */
public interface LeaderSelector {
    String select(List<Validator> activeValidators, long blockIndex);
}
