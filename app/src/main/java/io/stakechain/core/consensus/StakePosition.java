package io.stakechain.core.consensus;

import java.util.OptionalLong;

/**
 * Tokens one delegator has bonded to one validator.
 * {@code unbonding} holds amounts already unstaked and waiting for {@code unlockTimestamp}.
 */
public final class StakePosition {
    private final String delegator;
    private final String validator;
    private double amount;
    private double unbonding;
    private Long unlockTimestamp;
    private double rewards;

    StakePosition(String delegator, String validator) {
        this.delegator = delegator;
        this.validator = validator;
    }

    public String delegator() { return delegator; }
    public String validator() { return validator; }
    public double amount() { return amount; }
    public double unbonding() { return unbonding; }
    public OptionalLong unlockTimestamp() {
        return unlockTimestamp == null ? OptionalLong.empty() : OptionalLong.of(unlockTimestamp);
    }
    public double rewards() { return rewards; }

    boolean isEmpty() {
        return amount <= 0 && unbonding <= 0 && unlockTimestamp == null;
    }

    void addAmount(double delta) { amount += delta; }

    void beginUnbonding(double delta, long unlockAt) {
        amount = Math.max(0.0, amount - delta);
        unbonding += delta;
        unlockTimestamp = unlockAt;
    }

    boolean isUnlocked(long now) {
        return unlockTimestamp != null && unlockTimestamp <= now;
    }

    double release() {
        double released = unbonding;
        unbonding = 0.0;
        unlockTimestamp = null;
        return released;
    }

    void addRewards(double r) { rewards += r; }

    StakePosition copy() {
        StakePosition p = new StakePosition(delegator, validator);
        p.amount = amount;
        p.unbonding = unbonding;
        p.unlockTimestamp = unlockTimestamp;
        p.rewards = rewards;
        return p;
    }
}
