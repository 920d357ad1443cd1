package io.stakechain.core.ledger;

import io.stakechain.core.consensus.LeaderSelector;
import io.stakechain.core.consensus.StakeLedger;
import io.stakechain.core.consensus.StakePosition;
import io.stakechain.core.consensus.StakeWeightedSelector;
import io.stakechain.core.consensus.StakingStats;
import io.stakechain.core.consensus.Validator;
import io.stakechain.core.metrics.BlockMetrics;
import io.stakechain.core.protocol.Block;
import io.stakechain.core.protocol.LedgerException;
import io.stakechain.core.protocol.Payload;
import io.stakechain.core.protocol.ProtocolError;
import io.stakechain.core.protocol.Transaction;
import io.stakechain.core.state.Account;
import io.stakechain.core.state.InMemoryStateStore;
import io.stakechain.core.state.StateStore;
import io.stakechain.core.storage.ChainStore;
import io.stakechain.core.storage.InMemoryChainStore;
import io.stakechain.core.wallet.InMemoryKeyRing;
import io.stakechain.core.wallet.KeyRing;

import java.security.PublicKey;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Single-writer ledger: admission, block production and transaction application.
 *
 * Every public method is synchronized on the engine, so admission, the timer tick, mining
 * and queries never interleave. Nothing in here blocks on I/O.
 */
public final class LedgerEngine {
    private static final Logger LOG = Logger.getLogger(LedgerEngine.class.getName());
    private static final double DUST = 1e-9;

    private final LedgerConfig config;
    private final Clock clock;
    private final KeyRing keys;
    private final StateStore state;
    private final ChainStore chain;
    private final StakeLedger stakeLedger;
    private final Mempool mempool;
    private final Map<SwapPool.Pair, SwapPool> pools = new LinkedHashMap<>();

    private double burned;
    private long lastBlockTime;

    public LedgerEngine(LedgerConfig config, Clock clock, KeyRing keys, LeaderSelector selector) {
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.keys = Objects.requireNonNull(keys, "keys");
        this.state = new InMemoryStateStore();
        this.chain = new InMemoryChainStore();
        this.stakeLedger = new StakeLedger(state, config.staking, selector, clock);
        TxValidator validator = new TxValidator(state, chain, keys, config.requireSignatures, clock);
        this.mempool = new Mempool(validator, config.duplicateWindowMillis);

        GenesisBuilder.initIfNeeded(chain, state, config, keys, clock.millis());
        this.lastBlockTime = chain.getHead().map(Block::timestamp).orElse(clock.millis());
    }

    public LedgerEngine(LedgerConfig config, Clock clock) {
        this(config, clock, new InMemoryKeyRing(), new StakeWeightedSelector());
    }

    public LedgerEngine() {
        this(LedgerConfig.defaultLocal(), Clock.systemUTC());
    }

    public LedgerConfig config() {
        return config;
    }

    public KeyRing keys() {
        return keys;
    }

    // -------------------- admission --------------------

    /**
     * Admit a transaction to the mempool, then mine if the mempool is full or the block
     * interval has elapsed. Rejections are thrown as {@link LedgerException}.
     */
    public synchronized boolean addTransaction(Transaction tx) {
        try {
            mempool.add(tx);
        } catch (LedgerException e) {
            BlockMetrics.transactionRejected();
            LOG.fine("Rejected " + (tx == null ? "null" : tx.id()) + ": " + e.getMessage());
            throw e;
        }
        autoMine();
        return true;
    }

    /** Timer hook: mines when the auto-mine condition holds. */
    public synchronized Optional<Block> tick() {
        return autoMine();
    }

    private Optional<Block> autoMine() {
        if (!shouldMine()) {
            return Optional.empty();
        }
        try {
            return mineBlock();
        } catch (LedgerException e) {
            LOG.warning("Auto-mine skipped (" + e.error() + "): " + e.getMessage());
            return Optional.empty();
        }
    }

    private boolean shouldMine() {
        if (mempool.size() >= config.maxTxPerBlock) {
            return true;
        }
        return !mempool.isEmpty() && clock.millis() - lastBlockTime >= config.blockIntervalMillis;
    }

    // -------------------- block production --------------------

    /**
     * Produce the next block from the highest-fee pending transactions. Candidates that fail
     * to apply are dropped from the mempool; if all of them fail the block is still sealed,
     * empty and without reward. Returns empty only when the mempool is empty.
     *
     * @throws LedgerException with {@link ProtocolError#NO_ACTIVE_VALIDATORS} when nobody can
     *         produce; the mempool is left untouched in that case
     */
    public synchronized Optional<Block> mineBlock() {
        if (mempool.isEmpty()) {
            return Optional.empty();
        }
        return BlockMetrics.recordProduction(this::produceBlock);
    }

    private Optional<Block> produceBlock() {
        Block head = chain.getHead().orElseThrow(() -> new IllegalStateException("Chain has no genesis block"));
        long index = head.index() + 1;
        String producer = stakeLedger.selectValidator(index);

        List<Transaction> candidates = mempool.candidates(config.maxTxPerBlock);
        List<Transaction> included = new ArrayList<>(candidates.size());
        for (Transaction tx : candidates) {
            try {
                apply(tx);
                included.add(tx);
            } catch (LedgerException e) {
                BlockMetrics.transactionDropped();
                LOG.fine("Dropped " + tx.id() + " (" + e.error() + "): " + e.getMessage());
            }
        }
        mempool.removeAll(candidates);
        if (included.isEmpty()) {
            LOG.info("No candidate applied at index " + index + "; " + candidates.size() + " dropped");
        }

        Block block = Block.create(index, included, head.hash(), producer, clock.millis());
        keys.walletFor(producer).sign(block);
        chain.append(block);
        lastBlockTime = block.timestamp();
        stakeLedger.recordBlockProduced(producer, index);
        payReward(block);

        BlockMetrics.blockProduced(included.size());
        LOG.info("Block " + index + " produced by " + producer + " with " + included.size()
                + " txs, reward=" + block.reward());
        return Optional.of(block);
    }

    /** Fees come from the block's own transactions; base reward and bonus are minted out of the reserve. */
    private void payReward(Block block) {
        double reward = block.reward();
        if (reward <= 0) {
            return;
        }
        double minted = reward - block.totalFees();
        double available = state.getBalance(LedgerConfig.RESERVE_ADDRESS);
        if (minted > available) {
            LOG.warning("Reserve exhausted: minting " + available + " of " + minted + " for block " + block.index());
            minted = available;
        }
        if (minted > 0) {
            state.debit(LedgerConfig.RESERVE_ADDRESS, minted);
        }
        stakeLedger.distributeStakingRewards(block.totalFees() + Math.max(0.0, minted), block.producer());
    }

    // -------------------- application --------------------

    private void apply(Transaction tx) {
        switch (tx.type()) {
            case TRANSFER:
                state.debit(tx.from(), tx.amount() + tx.fee());
                state.credit(tx.to(), tx.amount());
                state.incrementNonce(tx.from());
                break;
            case STAKE:
                requireBalance(tx.from(), tx.amount() + tx.fee());
                stakeLedger.stake(tx.from(), tx.validatorAddress(), tx.amount());
                state.debit(tx.from(), tx.fee());
                break;
            case UNSTAKE:
                requireBalance(tx.from(), tx.fee());
                stakeLedger.unstake(tx.from(), tx.validatorAddress(), tx.amount());
                state.debit(tx.from(), tx.fee());
                break;
            case SWAP:
                applySwap(tx);
                break;
            default:
                throw new LedgerException(ProtocolError.INVALID_TRANSACTION, "Unsupported type " + tx.type());
        }
    }

    private void applySwap(Transaction tx) {
        Payload payload = tx.payload()
                .filter(Payload::namesBothTokens)
                .orElseThrow(() -> new LedgerException(ProtocolError.MISSING_SWAP_TOKENS, "Swap must name both tokens"));
        String tokenIn = payload.tokenA();
        String tokenOut = payload.tokenB();
        double amountIn = payload.amountIn() != null ? payload.amountIn() : tx.amount();
        double minAmountOut = payload.minAmountOut() != null ? payload.minAmountOut() : 0.0;

        SwapPool pool = pools.get(SwapPool.Pair.of(tokenIn, tokenOut));
        if (pool == null || !pool.holds(tokenIn) || !pool.holds(tokenOut)) {
            throw new LedgerException(ProtocolError.UNKNOWN_POOL, "No pool for " + tokenIn + "/" + tokenOut);
        }
        boolean nativeIn = config.nativeSymbol.equals(tokenIn);
        if (nativeIn) {
            requireBalance(tx.from(), amountIn + tx.fee());
        } else {
            if (state.getTokenBalance(tx.from(), tokenIn) + DUST < amountIn) {
                throw new LedgerException(ProtocolError.INSUFFICIENT_BALANCE, "Insufficient " + tokenIn + " for swap");
            }
            requireBalance(tx.from(), tx.fee());
        }

        double out = pool.swap(tokenIn, amountIn, minAmountOut);

        if (nativeIn) {
            state.debit(tx.from(), amountIn + tx.fee());
        } else {
            state.debitToken(tx.from(), tokenIn, amountIn);
            state.debit(tx.from(), tx.fee());
        }
        if (config.nativeSymbol.equals(tokenOut)) {
            state.credit(tx.from(), out);
        } else {
            state.creditToken(tx.from(), tokenOut, out);
        }
    }

    private void requireBalance(String address, double required) {
        if (!state.exists(address)) {
            throw new LedgerException(ProtocolError.UNKNOWN_SENDER, "Account not found: " + address);
        }
        if (state.getBalance(address) + DUST < required) {
            throw new LedgerException(ProtocolError.INSUFFICIENT_BALANCE,
                    "Insufficient balance: " + address + " needs " + required);
        }
    }

    // -------------------- pools, burning, unbonding --------------------

    /** Open a pool for a pair. The native side is funded from the reserve account. */
    public synchronized SwapPool createSwapPool(String tokenA, String tokenB, double reserveA, double reserveB) {
        SwapPool pool = new SwapPool(tokenA, tokenB, reserveA, reserveB, config.swapFeeRate);
        if (pools.containsKey(pool.pair())) {
            throw new LedgerException(ProtocolError.POOL_EXISTS, "Pool already exists: " + pool.key());
        }
        if (pool.holds(config.nativeSymbol)) {
            double nativeReserve = pool.reserveOf(config.nativeSymbol);
            if (state.getBalance(LedgerConfig.RESERVE_ADDRESS) + DUST < nativeReserve) {
                throw new LedgerException(ProtocolError.RESERVE_EXHAUSTED,
                        "Reserve cannot fund " + nativeReserve + " " + config.nativeSymbol);
            }
            state.debit(LedgerConfig.RESERVE_ADDRESS, nativeReserve);
        }
        pools.put(pool.pair(), pool);
        LOG.info("Created swap pool " + pool);
        return pool.copy();
    }

    /** Burn from the treasury. */
    public synchronized void burnTokens(double amount) {
        burnTokens(LedgerConfig.TREASURY_ADDRESS, amount);
    }

    public synchronized void burnTokens(String address, double amount) {
        if (!(amount > 0)) {
            throw new LedgerException(ProtocolError.NON_POSITIVE_AMOUNT, "Burn amount must be > 0");
        }
        state.debit(address, amount);
        burned += amount;
        LOG.info("Burned " + amount + " from " + address + " (total burned " + burned + ")");
    }

    /** Release unlocked unbonding stake of {@code delegator}; returns the amount credited. */
    public synchronized double completeUnstaking(String delegator) {
        return stakeLedger.completeUnstaking(delegator);
    }

    // -------------------- queries --------------------

    public synchronized Optional<Block> getBlock(long index) {
        return chain.getBlock(index);
    }

    public synchronized Optional<Block> getBlockByHash(String hash) {
        return chain.getBlockByHash(hash);
    }

    public synchronized Optional<Transaction> getTransaction(String txId) {
        return chain.findTransactionBlock(txId)
                .flatMap(chain::getBlock)
                .flatMap(block -> block.transactions().stream()
                        .filter(tx -> tx.id().equals(txId))
                        .findFirst());
    }

    public synchronized double getBalance(String address) {
        return state.getBalance(address);
    }

    public synchronized double getTokenBalance(String address, String symbol) {
        return state.getTokenBalance(address, symbol);
    }

    public synchronized Optional<Account> getAccount(String address) {
        return state.getAccount(address);
    }

    public synchronized List<Transaction> getPendingTransactions() {
        return mempool.snapshot();
    }

    public synchronized long getChainLength() {
        return chain.size();
    }

    public synchronized Block getLatestBlock() {
        return chain.getHead().orElseThrow(() -> new IllegalStateException("Chain has no genesis block"));
    }

    public synchronized List<Validator> getValidators() {
        return stakeLedger.getValidators();
    }

    public synchronized List<Validator> getActiveValidators() {
        return stakeLedger.getActiveValidators();
    }

    public synchronized Optional<Validator> getValidator(String address) {
        return stakeLedger.getValidator(address);
    }

    public synchronized List<StakePosition> getStakePositions(String delegator) {
        return stakeLedger.getStakePositions(delegator);
    }

    public synchronized StakingStats stakingStats() {
        return stakeLedger.stats();
    }

    public synchronized List<SwapPool> getSwapPools() {
        List<SwapPool> out = new ArrayList<>(pools.size());
        for (SwapPool pool : pools.values()) out.add(pool.copy());
        return out;
    }

    public synchronized Optional<SwapPool> getSwapPool(String tokenA, String tokenB) {
        SwapPool pool = pools.get(SwapPool.Pair.of(tokenA, tokenB));
        return pool == null ? Optional.empty() : Optional.of(pool.copy());
    }

    public synchronized double getBurnedTokens() {
        return burned;
    }

    /** Each block valid on its own, linked to its predecessor, and signed by its producer's key. */
    public synchronized boolean isChainValid() {
        long now = clock.millis();
        Block previous = null;
        for (Block block : chain.getBlocksInOrder()) {
            if (!block.isValid(now)) {
                LOG.warning("Block " + block.index() + " failed validation");
                return false;
            }
            if (previous != null
                    && (block.index() != previous.index() + 1 || !block.previousHash().equals(previous.hash()))) {
                LOG.warning("Block " + block.index() + " does not link to its predecessor");
                return false;
            }
            Optional<PublicKey> key = keys.publicKeyOf(block.producer());
            if (key.isPresent() && !block.verify(key.get())) {
                LOG.warning("Block " + block.index() + " signature does not verify");
                return false;
            }
            previous = block;
        }
        return true;
    }

    public synchronized SupplyReport supplyReport() {
        double reserve = 0.0;
        double circulating = 0.0;
        for (Account account : state.accounts()) {
            if (LedgerConfig.RESERVE_ADDRESS.equals(account.address())) {
                reserve = account.balance();
            } else {
                circulating += account.balance();
            }
            circulating += account.stakingRewards();
        }
        double pooled = 0.0;
        for (SwapPool pool : pools.values()) {
            if (pool.holds(config.nativeSymbol)) {
                pooled += pool.reserveOf(config.nativeSymbol);
            }
        }
        return new SupplyReport(config.totalSupply, circulating + pooled, stakeLedger.totalStaked(),
                reserve, burned, pooled);
    }

    public synchronized NetworkStats networkStats() {
        List<Block> blocks = chain.getBlocksInOrder();
        long count = blocks.size();
        long totalTime = count > 1 ? blocks.get(blocks.size() - 1).timestamp() - blocks.get(0).timestamp() : 0L;
        double averageBlockTime = count > 1 ? (double) totalTime / (count - 1) : 0.0;
        long totalTransactions = 0;
        for (Block block : blocks) totalTransactions += block.transactionCount();
        double tps = totalTime > 0 ? totalTransactions * 1000.0 / totalTime : 0.0;

        SupplyReport supply = supplyReport();
        StakingStats staking = stakeLedger.stats();
        return new NetworkStats(config.totalSupply, supply.circulating(), supply.staked(),
                staking.totalValidators(), staking.activeValidators(), count, mempool.size(),
                averageBlockTime, tps);
    }

    /** Full copy of chain, mempool, supply figures and pools. */
    public synchronized ChainSnapshot exportChain() {
        return new ChainSnapshot(chain.getBlocksInOrder(), mempool.snapshot(), supplyReport(), getSwapPools());
    }
}
