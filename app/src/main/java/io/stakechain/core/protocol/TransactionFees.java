package io.stakechain.core.protocol;

/**
 * Fee policy: base fee scaled by type, plus 0.01% of the amount, plus 0.05% of the part
 * of the amount above {@link #LARGE_AMOUNT_THRESHOLD}. Never less than the base fee.
 */
public final class TransactionFees {
    public static final double BASE_FEE = 0.001;
    public static final double PERCENTAGE_RATE = 0.0001;
    public static final double LARGE_AMOUNT_THRESHOLD = 1000.0;
    public static final double LARGE_AMOUNT_RATE = 0.0005;

    private TransactionFees() {}

    public static double compute(TransactionType type, double amount) {
        if (type == null) throw new IllegalArgumentException("type required");
        double typeFee = BASE_FEE * type.feeMultiplier();
        double percentageFee = amount * PERCENTAGE_RATE;
        double largeTxFee = amount > LARGE_AMOUNT_THRESHOLD
                ? (amount - LARGE_AMOUNT_THRESHOLD) * LARGE_AMOUNT_RATE
                : 0.0;
        return Math.max(typeFee + percentageFee + largeTxFee, BASE_FEE);
    }
}
