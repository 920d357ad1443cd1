package io.stakechain.core.consensus;

import java.util.List;

/**
 * Stake-weighted pick driven by a linear-congruential fraction of the block index.
 * Not manipulation resistant; kept bit-for-bit stable so past producer choices can be
 * re-derived. Arithmetic is done in doubles on purpose, precision loss included.
 */
public final class StakeWeightedSelector implements LeaderSelector {
    static final double LCG_MULTIPLIER = 1103515245.0;
    static final double LCG_INCREMENT = 12345.0;
    static final double LCG_MODULUS = 2147483647.0;

    /** Pseudo-random fraction in [0, 1) for a block index. */
    public static double fraction(long blockIndex) {
        double seed = blockIndex * LCG_MULTIPLIER + LCG_INCREMENT;
        return (seed % LCG_MODULUS) / LCG_MODULUS;
    }

    @Override
    public String select(List<Validator> activeValidators, long blockIndex) {
        if (activeValidators == null || activeValidators.isEmpty()) {
            throw new IllegalStateException("No active validators available");
        }
        double[] cumulative = new double[activeValidators.size()];
        double total = 0.0;
        for (int i = 0; i < cumulative.length; i++) {
            total += activeValidators.get(i).totalStake();
            cumulative[i] = total;
        }
        double target = fraction(blockIndex) * total;
        for (int i = 0; i < cumulative.length; i++) {
            if (cumulative[i] >= target) {
                return activeValidators.get(i).address();
            }
        }
        return activeValidators.get(0).address();
    }
}
