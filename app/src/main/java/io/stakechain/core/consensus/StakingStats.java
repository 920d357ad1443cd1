package io.stakechain.core.consensus;

public record StakingStats(int totalValidators,
                           int activeValidators,
                           double totalBonded,
                           double minStake,
                           int maxValidators,
                           double annualRewardRate,
                           long unbondingPeriodMillis) {
}
