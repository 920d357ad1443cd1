package io.stakechain.core.state;

import java.util.Map;

/**
 * Read-only view of an account at the moment it was taken.
 *
 * @param balance        spendable native-token balance
 * @param staked         native tokens currently bonded to validators
 * @param stakingRewards rewards accrued from block production
 * @param tokens         non-native token holdings by symbol
 */
public record Account(String address,
                      double balance,
                      long nonce,
                      double staked,
                      double stakingRewards,
                      boolean validator,
                      Map<String, Double> tokens) {

    public Account {
        tokens = tokens == null ? Map.of() : Map.copyOf(tokens);
    }

    public double tokenBalance(String symbol) {
        return tokens.getOrDefault(symbol, 0.0);
    }
}
