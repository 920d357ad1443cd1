package io.stakechain.core.ledger;

import io.stakechain.core.consensus.StakingConfig;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Simple config holder for a local ledger. */
public final class LedgerConfig {
    public static final String RESERVE_ADDRESS = "reserve";
    public static final String TREASURY_ADDRESS = "treasury";

    public final int maxTxPerBlock;
    public final long blockIntervalMillis;
    public final long duplicateWindowMillis;
    public final double totalSupply;
    public final String nativeSymbol;
    public final double swapFeeRate;
    public final boolean requireSignatures;
    public final Map<String, Double> genesisAllocations;
    public final StakingConfig staking;

    public LedgerConfig(int maxTxPerBlock, long blockIntervalMillis, long duplicateWindowMillis,
                        double totalSupply, String nativeSymbol, double swapFeeRate,
                        boolean requireSignatures, Map<String, Double> genesisAllocations,
                        StakingConfig staking) {
        if (maxTxPerBlock <= 0) {
            throw new IllegalArgumentException("maxTxPerBlock must be > 0");
        }
        if (!(totalSupply > 0)) {
            throw new IllegalArgumentException("totalSupply must be > 0");
        }
        this.maxTxPerBlock = maxTxPerBlock;
        this.blockIntervalMillis = blockIntervalMillis;
        this.duplicateWindowMillis = duplicateWindowMillis;
        this.totalSupply = totalSupply;
        this.nativeSymbol = nativeSymbol;
        this.swapFeeRate = swapFeeRate;
        this.requireSignatures = requireSignatures;
        this.genesisAllocations = Collections.unmodifiableMap(new LinkedHashMap<>(genesisAllocations));
        this.staking = staking;
    }

    public static LedgerConfig defaultLocal() {
        Map<String, Double> alloc = new LinkedHashMap<>();
        alloc.put("genesis_validator_1", 100_000_000.0);
        alloc.put("genesis_validator_2",  80_000_000.0);
        alloc.put("genesis_validator_3",  60_000_000.0);
        alloc.put(TREASURY_ADDRESS,      200_000_000.0);
        alloc.put("community_fund",      100_000_000.0);
        alloc.put("development_fund",     50_000_000.0);
        return new LedgerConfig(
                1000,            // tx per block cap
                10_000L,         // target block interval
                60_000L,         // duplicate detection window
                1_000_000_000.0, // total supply, remainder goes to the reserve
                "STC",
                0.003,           // swap pool fee
                false,           // unsigned transactions are admitted
                alloc,
                StakingConfig.defaultLocal()
        );
    }

    public LedgerConfig withGenesisAllocations(Map<String, Double> allocations) {
        return new LedgerConfig(maxTxPerBlock, blockIntervalMillis, duplicateWindowMillis, totalSupply,
                nativeSymbol, swapFeeRate, requireSignatures, allocations, staking);
    }

    public LedgerConfig withMaxTxPerBlock(int maxTxPerBlock) {
        return new LedgerConfig(maxTxPerBlock, blockIntervalMillis, duplicateWindowMillis, totalSupply,
                nativeSymbol, swapFeeRate, requireSignatures, genesisAllocations, staking);
    }

    public LedgerConfig withBlockInterval(long blockIntervalMillis) {
        return new LedgerConfig(maxTxPerBlock, blockIntervalMillis, duplicateWindowMillis, totalSupply,
                nativeSymbol, swapFeeRate, requireSignatures, genesisAllocations, staking);
    }

    public LedgerConfig withRequireSignatures(boolean requireSignatures) {
        return new LedgerConfig(maxTxPerBlock, blockIntervalMillis, duplicateWindowMillis, totalSupply,
                nativeSymbol, swapFeeRate, requireSignatures, genesisAllocations, staking);
    }

    public LedgerConfig withNativeSymbol(String nativeSymbol) {
        return new LedgerConfig(maxTxPerBlock, blockIntervalMillis, duplicateWindowMillis, totalSupply,
                nativeSymbol, swapFeeRate, requireSignatures, genesisAllocations, staking);
    }

    public LedgerConfig withStaking(StakingConfig staking) {
        return new LedgerConfig(maxTxPerBlock, blockIntervalMillis, duplicateWindowMillis, totalSupply,
                nativeSymbol, swapFeeRate, requireSignatures, genesisAllocations, staking);
    }
}
