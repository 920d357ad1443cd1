package io.stakechain.core.ledger;

public record NetworkStats(double totalSupply,
                           double circulatingSupply,
                           double totalStaked,
                           int totalValidators,
                           int activeValidators,
                           long chainLength,
                           int pendingTransactions,
                           double averageBlockTimeMillis,
                           double transactionsPerSecond) {
}
