package io.stakechain.core.consensus;

/**
 * Validator registry entry. Instances handed out by {@link StakeLedger} are copies;
 * only the ledger mutates the live entries.
 */
public final class Validator {
    private final String address;
    private final double commissionRate;
    private double selfStake;
    private double totalStake;
    private boolean active;
    private long blocksProduced;
    private long lastActiveBlock;

    Validator(String address, double commissionRate) {
        this.address = address;
        this.commissionRate = commissionRate;
    }

    public String address() { return address; }
    public double selfStake() { return selfStake; }
    /** Self stake plus everything delegated. */
    public double totalStake() { return totalStake; }
    public double commissionRate() { return commissionRate; }
    public boolean active() { return active; }
    public long blocksProduced() { return blocksProduced; }
    public long lastActiveBlock() { return lastActiveBlock; }

    void bond(double amount, boolean self) {
        totalStake += amount;
        if (self) selfStake += amount;
    }

    void unbond(double amount, boolean self) {
        totalStake = Math.max(0.0, totalStake - amount);
        if (self) selfStake = Math.max(0.0, selfStake - amount);
    }

    void setActive(boolean active) { this.active = active; }

    void recordBlock(long index) {
        blocksProduced++;
        lastActiveBlock = index;
    }

    Validator copy() {
        Validator v = new Validator(address, commissionRate);
        v.selfStake = selfStake;
        v.totalStake = totalStake;
        v.active = active;
        v.blocksProduced = blocksProduced;
        v.lastActiveBlock = lastActiveBlock;
        return v;
    }

    @Override public String toString() {
        return "Validator{" + address + ", stake=" + totalStake + ", active=" + active + "}";
    }
}
