package io.stakechain.core.state;

import io.stakechain.core.protocol.LedgerException;
import io.stakechain.core.protocol.ProtocolError;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory implementation of StateStore.
 * Not persistent, resets every process run.
 */
public final class InMemoryStateStore implements StateStore {

    /** Tolerance for float dust when comparing a balance against a debit. */
    private static final double DUST = 1e-9;

    private final Map<String, MutableAccount> accounts = new LinkedHashMap<>();

    @Override
    public synchronized boolean exists(String address) {
        return accounts.containsKey(address);
    }

    @Override
    public synchronized Optional<Account> getAccount(String address) {
        MutableAccount acc = accounts.get(address);
        return acc == null ? Optional.empty() : Optional.of(acc.snapshot());
    }

    @Override
    public synchronized double getBalance(String address) {
        MutableAccount acc = accounts.get(address);
        return acc == null ? 0.0 : acc.balance;
    }

    @Override
    public synchronized long getNonce(String address) {
        MutableAccount acc = accounts.get(address);
        return acc == null ? 0L : acc.nonce;
    }

    @Override
    public synchronized double getTokenBalance(String address, String symbol) {
        MutableAccount acc = accounts.get(address);
        return acc == null ? 0.0 : acc.tokens.getOrDefault(symbol, 0.0);
    }

    @Override
    public synchronized Account createAccount(String address) {
        return getOrCreate(address).snapshot();
    }

    @Override
    public synchronized void credit(String address, double amount) {
        requireNonNegative(amount);
        getOrCreate(address).balance += amount;
    }

    @Override
    public synchronized void debit(String address, double amount) {
        requireNonNegative(amount);
        MutableAccount acc = accounts.get(address);
        if (acc == null) {
            throw new LedgerException(ProtocolError.UNKNOWN_SENDER, "Account not found: " + address);
        }
        if (acc.balance + DUST < amount) {
            throw new LedgerException(ProtocolError.INSUFFICIENT_BALANCE,
                    "Insufficient balance: " + address + " has " + acc.balance + ", needs " + amount);
        }
        acc.balance = Math.max(0.0, acc.balance - amount);
    }

    @Override
    public synchronized void creditToken(String address, String symbol, double amount) {
        requireNonNegative(amount);
        getOrCreate(address).tokens.merge(symbol, amount, Double::sum);
    }

    @Override
    public synchronized void debitToken(String address, String symbol, double amount) {
        requireNonNegative(amount);
        MutableAccount acc = accounts.get(address);
        double held = acc == null ? 0.0 : acc.tokens.getOrDefault(symbol, 0.0);
        if (held + DUST < amount) {
            throw new LedgerException(ProtocolError.INSUFFICIENT_BALANCE,
                    "Insufficient " + symbol + ": " + address + " has " + held + ", needs " + amount);
        }
        if (acc != null) {
            acc.tokens.put(symbol, Math.max(0.0, held - amount));
        }
    }

    @Override
    public synchronized void incrementNonce(String address) {
        getOrCreate(address).nonce++;
    }

    @Override
    public synchronized void adjustStaked(String address, double delta) {
        MutableAccount acc = getOrCreate(address);
        acc.staked = Math.max(0.0, acc.staked + delta);
    }

    @Override
    public synchronized void addStakingRewards(String address, double amount) {
        requireNonNegative(amount);
        getOrCreate(address).stakingRewards += amount;
    }

    @Override
    public synchronized void markValidator(String address) {
        getOrCreate(address).validator = true;
    }

    @Override
    public synchronized List<Account> accounts() {
        List<Account> out = new ArrayList<>(accounts.size());
        for (MutableAccount acc : accounts.values()) {
            out.add(acc.snapshot());
        }
        return out;
    }

    @Override
    public synchronized int size() {
        return accounts.size();
    }

    private MutableAccount getOrCreate(String address) {
        if (address == null || address.isBlank()) {
            throw new IllegalArgumentException("address required");
        }
        return accounts.computeIfAbsent(address, MutableAccount::new);
    }

    private static void requireNonNegative(double amount) {
        if (!(amount >= 0)) {
            throw new IllegalArgumentException("amount must be >= 0: " + amount);
        }
    }

    private static final class MutableAccount {
        private final String address;
        private final Map<String, Double> tokens = new LinkedHashMap<>();
        private double balance;
        private long nonce;
        private double staked;
        private double stakingRewards;
        private boolean validator;

        MutableAccount(String address) {
            this.address = address;
        }

        Account snapshot() {
            return new Account(address, balance, nonce, staked, stakingRewards, validator, tokens);
        }
    }
}
