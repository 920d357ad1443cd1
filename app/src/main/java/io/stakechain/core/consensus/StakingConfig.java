package io.stakechain.core.consensus;

import java.util.List;

/** Staking parameters and the genesis validator set. */
public final class StakingConfig {
    public final double minStake;
    public final int maxValidators;
    public final long unbondingPeriodMillis;
    public final double defaultCommission;
    public final double annualRewardRate;
    public final List<GenesisValidator> genesisValidators;

    public record GenesisValidator(String address, double selfStake, double commission) {}

    public StakingConfig(double minStake, int maxValidators, long unbondingPeriodMillis,
                         double defaultCommission, double annualRewardRate,
                         List<GenesisValidator> genesisValidators) {
        this.minStake = minStake;
        this.maxValidators = maxValidators;
        this.unbondingPeriodMillis = unbondingPeriodMillis;
        this.defaultCommission = defaultCommission;
        this.annualRewardRate = annualRewardRate;
        this.genesisValidators = List.copyOf(genesisValidators);
    }

    public static StakingConfig defaultLocal() {
        return new StakingConfig(
                100.0,                       // minimum stake to bond or stay active
                21,                          // validator registry cap
                7L * 24 * 60 * 60 * 1000,    // 7 day unbonding
                0.05,                        // commission for self-registered validators
                0.08,                        // informational annual rate
                List.of(
                        new GenesisValidator("genesis_validator_1", 1_000_000, 0.05),
                        new GenesisValidator("genesis_validator_2", 800_000, 0.04),
                        new GenesisValidator("genesis_validator_3", 600_000, 0.06)
                )
        );
    }

    public StakingConfig withMaxValidators(int maxValidators) {
        return new StakingConfig(minStake, maxValidators, unbondingPeriodMillis,
                defaultCommission, annualRewardRate, genesisValidators);
    }

    public StakingConfig withUnbondingPeriod(long unbondingPeriodMillis) {
        return new StakingConfig(minStake, maxValidators, unbondingPeriodMillis,
                defaultCommission, annualRewardRate, genesisValidators);
    }
}
