package io.stakechain.core.ledger;

import io.stakechain.core.protocol.LedgerException;
import io.stakechain.core.protocol.ProtocolError;
import io.stakechain.core.protocol.Transaction;
import io.stakechain.core.state.StateStore;
import io.stakechain.core.storage.ChainStore;
import io.stakechain.core.wallet.KeyRing;

import java.security.PublicKey;
import java.time.Clock;
import java.util.Optional;

/**
 * Admission checks that depend on ledger state: validity at the current time, signature,
 * sender existence, balance cover for amount + fee, and ids already committed.
 */
public class TxValidator {
    private static final double DUST = 1e-9;

    private final StateStore state;
    private final ChainStore chain;
    private final KeyRing keys;
    private final boolean requireSignatures;
    private final Clock clock;

    public TxValidator(StateStore state, ChainStore chain, KeyRing keys, boolean requireSignatures, Clock clock) {
        this.state = state;
        this.chain = chain;
        this.keys = keys;
        this.requireSignatures = requireSignatures;
        this.clock = clock;
    }

    public void validate(Transaction tx) {
        if (tx == null) {
            throw new IllegalArgumentException("Transaction required");
        }
        tx.validate(clock.millis()).orThrow();
        verifySignature(tx);
        if (!state.exists(tx.from())) {
            throw new LedgerException(ProtocolError.UNKNOWN_SENDER, "Sender account not found: " + tx.from());
        }
        double required = tx.amount() + tx.fee();
        if (state.getBalance(tx.from()) + DUST < required) {
            throw new LedgerException(ProtocolError.INSUFFICIENT_BALANCE,
                    "Insufficient balance: " + tx.from() + " needs " + required);
        }
        if (chain.containsTransaction(tx.id())) {
            throw new LedgerException(ProtocolError.DUPLICATE_TRANSACTION, "Transaction already committed: " + tx.id());
        }
    }

    private void verifySignature(Transaction tx) {
        if (!tx.isSigned()) {
            if (requireSignatures) {
                throw new LedgerException(ProtocolError.INVALID_SIGNATURE, "Transaction " + tx.id() + " is not signed");
            }
            return;
        }
        Optional<PublicKey> key = keys.publicKeyOf(tx.from());
        if (key.isEmpty() || !tx.verify(key.get())) {
            throw new LedgerException(ProtocolError.INVALID_SIGNATURE, "Signature does not verify for " + tx.from());
        }
    }
}
