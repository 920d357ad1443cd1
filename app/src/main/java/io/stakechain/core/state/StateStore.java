package io.stakechain.core.state;

import java.util.List;
import java.util.Optional;

/**
 * Account state shared by the stake ledger and the ledger engine:
 * native balances, nonces, bonded stake, accrued rewards and token holdings.
 * Accounts are created lazily on first credit and never deleted.
 */
public interface StateStore {
    boolean exists(String address);

    /** Snapshot of an account, if it exists. */
    Optional<Account> getAccount(String address);

    double getBalance(String address);
    long getNonce(String address);
    double getTokenBalance(String address, String symbol);

    /** Create an empty account if absent; returns its snapshot either way. */
    Account createAccount(String address);

    /** Credit native balance, creating the account if needed. */
    void credit(String address, double amount);

    /** Debit native balance; fails with INSUFFICIENT_BALANCE without changing anything. */
    void debit(String address, double amount);

    void creditToken(String address, String symbol, double amount);
    void debitToken(String address, String symbol, double amount);

    void incrementNonce(String address);

    /** Add (or with a negative delta, remove) bonded stake on the account record. */
    void adjustStaked(String address, double delta);

    void addStakingRewards(String address, double amount);

    void markValidator(String address);

    /** Snapshots of every account in creation order. */
    List<Account> accounts();

    int size();
}
