package io.stakechain.core.protocol;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Ledger transaction. Immutable: {@link #sign(PrivateKey)} returns a signed copy and the
 * id, fee and content digest never change once the transaction exists.
 */
public final class Transaction {

    public static final double MIN_STAKE_AMOUNT = 100.0;
    public static final long MAX_AGE_MILLIS = 10 * 60 * 1000L;
    public static final long MAX_FUTURE_DRIFT_MILLIS = 60_000L;

    private final String id;
    private final String from;
    private final String to;
    private final double amount;
    private final double fee;
    private final long timestamp;
    private final TransactionType type;
    private final Payload payload;
    private final String signature;

    private Transaction(String id,
                        String from,
                        String to,
                        double amount,
                        double fee,
                        long timestamp,
                        TransactionType type,
                        Payload payload,
                        String signature) {
        this.id = id;
        this.from = from;
        this.to = to;
        this.amount = amount;
        this.fee = fee;
        this.timestamp = timestamp;
        this.type = Objects.requireNonNull(type, "type");
        this.payload = payload;
        this.signature = signature != null ? signature : "";
    }

    /** New transaction with a fresh id, the current time and the policy fee. */
    public static Transaction create(String from, String to, double amount, TransactionType type, Payload payload) {
        return create(from, to, amount, type, payload, Clock.systemUTC());
    }

    public static Transaction create(String from, String to, double amount, TransactionType type, Payload payload, Clock clock) {
        return builder()
                .from(from)
                .to(to)
                .amount(amount)
                .type(type)
                .payload(payload)
                .timestamp(clock.millis())
                .build();
    }

    public static Transaction transfer(String from, String to, double amount) {
        return create(from, to, amount, TransactionType.TRANSFER, null);
    }

    public static Builder builder() { return new Builder(); }

    /**
     * Builder used by {@link #create} and by decoders. Unset id and fee are derived
     * (random UUID, policy fee) so that decoded transactions keep their original values.
     */
    public static final class Builder {
        private String id;
        private String from;
        private String to;
        private double amount;
        private Double fee;
        private long timestamp = System.currentTimeMillis();
        private TransactionType type = TransactionType.TRANSFER;
        private Payload payload;
        private String signature = "";

        public Builder id(String v) { this.id = v; return this; }
        public Builder from(String f) { this.from = f; return this; }
        public Builder to(String t) { this.to = t; return this; }
        public Builder amount(double a) { this.amount = a; return this; }
        public Builder fee(double f) { this.fee = f; return this; }
        public Builder timestamp(long ts) { this.timestamp = ts; return this; }
        public Builder type(TransactionType t) { this.type = t; return this; }
        public Builder payload(Payload p) { this.payload = p; return this; }
        public Builder signature(String s) { this.signature = s; return this; }

        public Transaction build() {
            String txId = id != null ? id : UUID.randomUUID().toString();
            double txFee = fee != null ? fee : TransactionFees.compute(type, amount);
            return new Transaction(txId, from, to, amount, txFee, timestamp, type, payload, signature);
        }
    }

    // -------------------- getters --------------------
    public String id() { return id; }
    public String from() { return from; }
    public String to() { return to; }
    public double amount() { return amount; }
    public double fee() { return fee; }
    public long timestamp() { return timestamp; }
    public TransactionType type() { return type; }
    public Optional<Payload> payload() { return Optional.ofNullable(payload); }
    public String signature() { return signature; }
    public boolean isSigned() { return !signature.isEmpty(); }

    /** Validator targeted by a stake/unstake: the payload's validator, else the recipient. */
    public String validatorAddress() {
        if (payload != null && payload.validator() != null && !payload.validator().isBlank()) {
            return payload.validator();
        }
        return to;
    }

    // -------------------- core methods --------------------

    /** Deterministic bytes over every field except id and signature. */
    public byte[] toUnsignedBytes() {
        byte[] fromBytes = utf8(from);
        byte[] toBytes = utf8(to);
        byte[] typeBytes = utf8(type.wireName());
        byte[] payloadBytes = utf8(payload != null ? LedgerJson.canonical(payload) : "{}");
        ByteBuffer buf = ByteBuffer.allocate(
                4 + fromBytes.length + 4 + toBytes.length + 8 + 8 + 8
                        + 4 + typeBytes.length + 4 + payloadBytes.length);
        putBytes(buf, fromBytes);
        putBytes(buf, toBytes);
        buf.putDouble(amount);
        buf.putDouble(fee);
        buf.putLong(timestamp);
        putBytes(buf, typeBytes);
        putBytes(buf, payloadBytes);
        return buf.array();
    }

    /** SHA-256 hex over {@link #toUnsignedBytes()}. */
    public String contentDigest() {
        return Hashes.sha256Hex(toUnsignedBytes());
    }

    /** Returns a copy of this transaction carrying a signature over its content digest. */
    public Transaction sign(PrivateKey key) {
        Objects.requireNonNull(key, "key");
        if (isSigned()) {
            throw new IllegalStateException("Transaction " + id + " is already signed");
        }
        String sig = SignatureUtil.signDigest(contentDigest(), key);
        return new Transaction(id, from, to, amount, fee, timestamp, type, payload, sig);
    }

    public boolean verify(PublicKey key) {
        return isSigned() && SignatureUtil.verifyDigest(contentDigest(), signature, key);
    }

    public boolean isValid() {
        return isValid(System.currentTimeMillis());
    }

    public boolean isValid(long nowMillis) {
        return validate(nowMillis).ok;
    }

    public ValidationResult validate(long nowMillis) {
        if (from == null || from.isBlank() || to == null || to.isBlank()) {
            return ValidationResult.error(ProtocolError.MISSING_ADDRESS, "from and to are required");
        }
        if (!(amount > 0)) {
            return ValidationResult.error(ProtocolError.NON_POSITIVE_AMOUNT, "amount must be > 0");
        }
        if (!(fee >= 0)) {
            return ValidationResult.error(ProtocolError.NEGATIVE_FEE, "fee must be >= 0");
        }
        if (from.equals(to) && type != TransactionType.STAKE) {
            return ValidationResult.error(ProtocolError.SELF_TRANSFER, "from == to");
        }
        if (timestamp < nowMillis - MAX_AGE_MILLIS) {
            return ValidationResult.error(ProtocolError.STALE_TIMESTAMP, "timestamp older than 10 minutes");
        }
        if (timestamp > nowMillis + MAX_FUTURE_DRIFT_MILLIS) {
            return ValidationResult.error(ProtocolError.FUTURE_TIMESTAMP, "timestamp too far in future");
        }
        switch (type) {
            case STAKE:
                if (amount < MIN_STAKE_AMOUNT) {
                    return ValidationResult.error(ProtocolError.STAKE_BELOW_MINIMUM,
                            "stake must be at least " + MIN_STAKE_AMOUNT);
                }
                break;
            case SWAP:
                if (payload == null || !payload.namesBothTokens()) {
                    return ValidationResult.error(ProtocolError.MISSING_SWAP_TOKENS, "swap must name tokenA and tokenB");
                }
                break;
            default:
                break;
        }
        return ValidationResult.ok();
    }

    // -------------------- helpers --------------------
    private static byte[] utf8(String s) {
        return s == null ? new byte[0] : s.getBytes(StandardCharsets.UTF_8);
    }

    private static void putBytes(ByteBuffer buf, byte[] b){
        buf.putInt(b.length); buf.put(b);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Transaction && id.equals(((Transaction) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override public String toString() {
        return "Transaction{id=" + id + ", type=" + type.wireName() + ", " + from + " -> " + to
                + ", amount=" + amount + ", fee=" + fee + "}";
    }
}
