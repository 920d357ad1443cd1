package io.stakechain.core.ledger;

import io.stakechain.core.protocol.LedgerException;
import io.stakechain.core.protocol.ProtocolError;
import io.stakechain.core.protocol.Transaction;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pending transactions keyed by id.
 * - iteration order is insertion order
 * - block candidates come out fee-descending; equal fees keep insertion order
 */
public final class Mempool {

    private final Map<String, Transaction> pending = new LinkedHashMap<>();
    private final TxValidator validator;
    private final long duplicateWindowMillis;

    public Mempool(TxValidator validator, long duplicateWindowMillis) {
        this.validator = validator;
        this.duplicateWindowMillis = duplicateWindowMillis;
    }

    /**
     * Validate and add a tx. Same id, or same (from, to, amount) submitted within the
     * duplicate window of a pending one, is rejected.
     */
    public synchronized boolean add(Transaction tx) {
        validator.validate(tx);
        if (pending.containsKey(tx.id())) {
            throw new LedgerException(ProtocolError.DUPLICATE_TRANSACTION, "Transaction already pending: " + tx.id());
        }
        for (Transaction other : pending.values()) {
            if (isEquivalent(tx, other)) {
                throw new LedgerException(ProtocolError.DUPLICATE_TRANSACTION,
                        "Equivalent transaction " + other.id() + " already pending");
            }
        }
        pending.put(tx.id(), tx);
        return true;
    }

    private boolean isEquivalent(Transaction a, Transaction b) {
        return a.from().equals(b.from())
                && a.to().equals(b.to())
                && Double.compare(a.amount(), b.amount()) == 0
                && Math.abs(a.timestamp() - b.timestamp()) < duplicateWindowMillis;
    }

    /** Up to {@code max} transactions, highest fee first. Nothing is removed. */
    public synchronized List<Transaction> candidates(int max) {
        List<Transaction> sorted = new ArrayList<>(pending.values());
        sorted.sort(Comparator.comparingDouble(Transaction::fee).reversed());
        return sorted.size() > max ? new ArrayList<>(sorted.subList(0, max)) : sorted;
    }

    /** Remove transactions by id. */
    public synchronized void removeAll(Collection<Transaction> txs) {
        for (Transaction tx : txs) {
            pending.remove(tx.id());
        }
    }

    public synchronized boolean contains(String txId) {
        return pending.containsKey(txId);
    }

    /** Copy of the pending transactions in arrival order. */
    public synchronized List<Transaction> snapshot() {
        return new ArrayList<>(pending.values());
    }

    public synchronized int size() { return pending.size(); }

    public synchronized boolean isEmpty() { return pending.isEmpty(); }
}
