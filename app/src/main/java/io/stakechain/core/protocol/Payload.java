package io.stakechain.core.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Type-specific transaction data.
 * <ul>
 *   <li>stake / unstake: {@code validator}, the validator the stake is bonded to (defaults to the tx recipient)</li>
 *   <li>swap: {@code tokenA} (sold), {@code tokenB} (bought), {@code amountIn}, {@code minAmountOut}</li>
 * </ul>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Payload {
    private final String validator;
    private final String tokenA;
    private final String tokenB;
    private final Double amountIn;
    private final Double minAmountOut;

    @JsonCreator
    public Payload(@JsonProperty("validator") String validator,
                   @JsonProperty("tokenA") String tokenA,
                   @JsonProperty("tokenB") String tokenB,
                   @JsonProperty("amountIn") Double amountIn,
                   @JsonProperty("minAmountOut") Double minAmountOut) {
        this.validator = validator;
        this.tokenA = tokenA;
        this.tokenB = tokenB;
        this.amountIn = amountIn;
        this.minAmountOut = minAmountOut;
    }

    public static Payload validator(String validator) {
        return new Payload(validator, null, null, null, null);
    }

    public static Payload swap(String tokenIn, String tokenOut, double amountIn, double minAmountOut) {
        return new Payload(null, tokenIn, tokenOut, amountIn, minAmountOut);
    }

    @JsonProperty("validator") public String validator() { return validator; }
    @JsonProperty("tokenA") public String tokenA() { return tokenA; }
    @JsonProperty("tokenB") public String tokenB() { return tokenB; }
    @JsonProperty("amountIn") public Double amountIn() { return amountIn; }
    @JsonProperty("minAmountOut") public Double minAmountOut() { return minAmountOut; }

    public boolean namesBothTokens() {
        return tokenA != null && !tokenA.isBlank() && tokenB != null && !tokenB.isBlank();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Payload)) return false;
        Payload other = (Payload) o;
        return Objects.equals(validator, other.validator)
                && Objects.equals(tokenA, other.tokenA)
                && Objects.equals(tokenB, other.tokenB)
                && Objects.equals(amountIn, other.amountIn)
                && Objects.equals(minAmountOut, other.minAmountOut);
    }

    @Override
    public int hashCode() {
        return Objects.hash(validator, tokenA, tokenB, amountIn, minAmountOut);
    }

    @Override
    public String toString() {
        return LedgerJson.canonical(this);
    }
}
