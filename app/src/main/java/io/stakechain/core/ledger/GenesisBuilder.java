package io.stakechain.core.ledger;

import io.stakechain.core.consensus.StakingConfig;
import io.stakechain.core.protocol.Block;
import io.stakechain.core.state.StateStore;
import io.stakechain.core.storage.ChainStore;
import io.stakechain.core.wallet.KeyRing;

import java.util.Collections;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Creates the genesis block and seeds initial balances.
 * - index = 0, no transactions
 * - previousHash = "0", producer = "genesis"
 * - whatever the allocations and genesis self-stakes leave of the total supply goes to the reserve
 */
public final class GenesisBuilder {
    public static final String GENESIS_PRODUCER = "genesis";
    public static final String GENESIS_PREVIOUS_HASH = "0";

    private static final Logger LOG = Logger.getLogger(GenesisBuilder.class.getName());

    private GenesisBuilder(){}

    /** Build and sign the empty genesis block. */
    public static Block buildGenesis(KeyRing keys, long timestamp) {
        Block genesis = Block.create(0L, Collections.emptyList(), GENESIS_PREVIOUS_HASH, GENESIS_PRODUCER, timestamp);
        keys.walletFor(GENESIS_PRODUCER).sign(genesis);
        return genesis;
    }

    /** Amount left for the reserve once allocations and genesis self-stakes are taken out. */
    public static double reserveRemainder(LedgerConfig config) {
        double allocated = 0.0;
        for (Double amount : config.genesisAllocations.values()) {
            allocated += amount == null ? 0.0 : amount;
        }
        for (StakingConfig.GenesisValidator v : config.staking.genesisValidators) {
            allocated += v.selfStake();
        }
        return config.totalSupply - allocated;
    }

    /** Credit initial balances (allocations map) and the reserve remainder into state. */
    public static void seedBalances(StateStore state, LedgerConfig config) {
        double remainder = reserveRemainder(config);
        if (remainder < 0) {
            throw new IllegalArgumentException("Genesis allocations exceed total supply by " + (-remainder));
        }
        for (Map.Entry<String, Double> e : config.genesisAllocations.entrySet()) {
            state.credit(e.getKey(), e.getValue() == null ? 0.0 : e.getValue());
        }
        state.credit(LedgerConfig.RESERVE_ADDRESS, remainder);
        LOG.info("Genesis seeded " + config.genesisAllocations.size() + " accounts, reserve=" + remainder);
    }

    /**
     * If the chain is empty, seed balances and store the genesis block.
     * Idempotent: does nothing if a head already exists.
     */
    public static void initIfNeeded(ChainStore chain, StateStore state, LedgerConfig config, KeyRing keys, long timestamp) {
        if (chain.getHead().isPresent()) return;
        seedBalances(state, config);
        chain.append(buildGenesis(keys, timestamp));
    }
}
