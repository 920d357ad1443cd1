package io.stakechain.core.ledger;

/**
 * Where every unit of the total supply currently sits.
 * circulating + burned + reserve + staked always adds back up to totalSupply.
 */
public record SupplyReport(double totalSupply,
                           double circulating,
                           double staked,
                           double reserve,
                           double burned,
                           double pooled) {

    private static final double RELATIVE_TOLERANCE = 1e-6;

    public double accountedFor() {
        return circulating + burned + reserve + staked;
    }

    public boolean isConserved() {
        return Math.abs(accountedFor() - totalSupply) <= Math.max(1e-3, totalSupply * RELATIVE_TOLERANCE);
    }
}
