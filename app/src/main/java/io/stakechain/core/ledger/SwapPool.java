package io.stakechain.core.ledger;

import io.stakechain.core.protocol.LedgerException;
import io.stakechain.core.protocol.ProtocolError;

/**
 * Constant-product pool for a token pair. Tokens are stored in canonical (sorted) order so
 * that A/B and B/A name the same pool. The pool fee stays in the input reserve.
 */
public final class SwapPool {
    private final String tokenA;
    private final String tokenB;
    private final double feeRate;
    private final double totalLiquidity;
    private double reserveA;
    private double reserveB;

    SwapPool(String token1, String token2, double reserve1, double reserve2, double feeRate) {
        if (isBlank(token1) || isBlank(token2) || token1.equals(token2)) {
            throw new LedgerException(ProtocolError.INVALID_POOL, "Pool needs two distinct tokens");
        }
        if (!(reserve1 > 0) || !(reserve2 > 0)) {
            throw new LedgerException(ProtocolError.INVALID_POOL, "Pool reserves must be > 0");
        }
        boolean ordered = token1.compareTo(token2) < 0;
        this.tokenA = ordered ? token1 : token2;
        this.tokenB = ordered ? token2 : token1;
        this.reserveA = ordered ? reserve1 : reserve2;
        this.reserveB = ordered ? reserve2 : reserve1;
        this.feeRate = feeRate;
        this.totalLiquidity = Math.sqrt(reserve1 * reserve2);
    }

    private SwapPool(SwapPool other) {
        this.tokenA = other.tokenA;
        this.tokenB = other.tokenB;
        this.feeRate = other.feeRate;
        this.totalLiquidity = other.totalLiquidity;
        this.reserveA = other.reserveA;
        this.reserveB = other.reserveB;
    }

    /** Unordered token pair, stored sorted. Symbols are compared whole, never as a joined string. */
    public record Pair(String tokenA, String tokenB) {
        public static Pair of(String token1, String token2) {
            return token1.compareTo(token2) <= 0 ? new Pair(token1, token2) : new Pair(token2, token1);
        }

        @Override public String toString() {
            return tokenA + "-" + tokenB;
        }
    }

    public Pair pair() { return new Pair(tokenA, tokenB); }

    /** Display key, the sorted symbols joined with '-'. */
    public String key() { return pair().toString(); }
    public String tokenA() { return tokenA; }
    public String tokenB() { return tokenB; }
    public double reserveA() { return reserveA; }
    public double reserveB() { return reserveB; }
    public double feeRate() { return feeRate; }
    public double totalLiquidity() { return totalLiquidity; }

    public boolean holds(String token) {
        return tokenA.equals(token) || tokenB.equals(token);
    }

    public double reserveOf(String token) {
        if (tokenA.equals(token)) return reserveA;
        if (tokenB.equals(token)) return reserveB;
        throw new LedgerException(ProtocolError.UNKNOWN_POOL, token + " is not in pool " + key());
    }

    /** Output for {@code amountIn} of {@code tokenIn}: reserveOut * in' / (reserveIn + in'), in' = in * (1 - fee). */
    public double quote(String tokenIn, double amountIn) {
        double reserveIn = reserveOf(tokenIn);
        double reserveOut = tokenA.equals(tokenIn) ? reserveB : reserveA;
        double amountInWithFee = amountIn * (1 - feeRate);
        return (reserveOut * amountInWithFee) / (reserveIn + amountInWithFee);
    }

    /** Apply a swap and return the output amount. Nothing changes if the guard fails. */
    double swap(String tokenIn, double amountIn, double minAmountOut) {
        if (!(amountIn > 0)) {
            throw new LedgerException(ProtocolError.NON_POSITIVE_AMOUNT, "Swap input must be > 0");
        }
        double out = quote(tokenIn, amountIn);
        if (out < minAmountOut) {
            throw new LedgerException(ProtocolError.SLIPPAGE_EXCEEDED,
                    "Swap output " + out + " below minimum " + minAmountOut);
        }
        if (tokenA.equals(tokenIn)) {
            reserveA += amountIn;
            reserveB -= out;
        } else {
            reserveB += amountIn;
            reserveA -= out;
        }
        return out;
    }

    SwapPool copy() {
        return new SwapPool(this);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    @Override public String toString() {
        return "SwapPool{" + key() + ", reserves=" + reserveA + "/" + reserveB + "}";
    }
}
