package io.stakechain.core.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum TransactionType {
    TRANSFER(1.0),
    STAKE(2.0),
    UNSTAKE(3.0),
    SWAP(1.5);

    private final double feeMultiplier;

    TransactionType(double feeMultiplier) {
        this.feeMultiplier = feeMultiplier;
    }

    /** Multiple of the base fee charged for this type. */
    public double feeMultiplier() {
        return feeMultiplier;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static TransactionType fromWire(String value) {
        if (value == null) {
            return null;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
