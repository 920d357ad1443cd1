package io.stakechain.core.protocol;

import java.util.Objects;

/**
 * Synchronous rejection of a ledger operation. Nothing has been mutated when this is thrown.
 */
public class LedgerException extends RuntimeException {
    private final ProtocolError error;

    public LedgerException(ProtocolError error, String message) {
        super(message);
        this.error = Objects.requireNonNull(error, "error");
    }

    public ProtocolError error() {
        return error;
    }

    public ProtocolError.Category category() {
        return error.category();
    }
}
