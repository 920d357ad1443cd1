package io.stakechain.core.protocol;

public final class ValidationResult {
    private static final ValidationResult OK = new ValidationResult(true, null, null);

    public final boolean ok;
    public final ProtocolError error;
    public final String message;

    private ValidationResult(boolean ok, ProtocolError error, String message) {
        this.ok = ok; this.error = error; this.message = message;
    }
    public static ValidationResult ok() { return OK; }
    public static ValidationResult error(ProtocolError e, String msg) { return new ValidationResult(false, e, msg); }

    /** Throws a {@link LedgerException} carrying this result's error unless it is OK. */
    public void orThrow() {
        if (!ok) {
            throw new LedgerException(error, message);
        }
    }

    @Override public String toString() {
        return ok ? "OK" : ("ERR["+error+"]: "+message);
    }
}
