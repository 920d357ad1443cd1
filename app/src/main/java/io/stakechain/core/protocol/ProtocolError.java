package io.stakechain.core.protocol;

/**
 * Reasons a transaction, block or ledger operation is refused.
 * VALIDATION errors mean the input itself is malformed or ineligible;
 * RESOURCE errors mean the input is well formed but the current state cannot satisfy it.
 */
public enum ProtocolError {
    MISSING_ADDRESS(Category.VALIDATION),
    NON_POSITIVE_AMOUNT(Category.VALIDATION),
    NEGATIVE_FEE(Category.VALIDATION),
    SELF_TRANSFER(Category.VALIDATION),
    STALE_TIMESTAMP(Category.VALIDATION),
    FUTURE_TIMESTAMP(Category.VALIDATION),
    STAKE_BELOW_MINIMUM(Category.VALIDATION),
    MISSING_SWAP_TOKENS(Category.VALIDATION),
    INVALID_TRANSACTION(Category.VALIDATION),
    INVALID_SIGNATURE(Category.VALIDATION),
    INVALID_POOL(Category.VALIDATION),

    UNKNOWN_SENDER(Category.RESOURCE),
    INSUFFICIENT_BALANCE(Category.RESOURCE),
    DUPLICATE_TRANSACTION(Category.RESOURCE),
    UNKNOWN_VALIDATOR(Category.RESOURCE),
    VALIDATOR_REGISTRY_FULL(Category.RESOURCE),
    INSUFFICIENT_STAKE(Category.RESOURCE),
    NO_ACTIVE_VALIDATORS(Category.RESOURCE),
    POOL_EXISTS(Category.RESOURCE),
    UNKNOWN_POOL(Category.RESOURCE),
    SLIPPAGE_EXCEEDED(Category.RESOURCE),
    RESERVE_EXHAUSTED(Category.RESOURCE);

    public enum Category { VALIDATION, RESOURCE }

    private final Category category;

    ProtocolError(Category category) {
        this.category = category;
    }

    public Category category() {
        return category;
    }
}
