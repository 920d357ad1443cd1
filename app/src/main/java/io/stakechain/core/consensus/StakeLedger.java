package io.stakechain.core.consensus;

import io.stakechain.core.protocol.LedgerException;
import io.stakechain.core.protocol.ProtocolError;
import io.stakechain.core.state.StateStore;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Validator registry and delegation bookkeeping on top of the shared account state.
 * Every operation checks all its preconditions before it touches state, so a thrown
 * {@link LedgerException} leaves accounts, validators and positions unchanged.
 */
public final class StakeLedger {
    private static final Logger LOG = Logger.getLogger(StakeLedger.class.getName());
    private static final double DUST = 1e-9;

    private final StateStore state;
    private final StakingConfig config;
    private final LeaderSelector selector;
    private final Clock clock;

    /** Registry in registration order; selection walks it in this order. */
    private final Map<String, Validator> validators = new LinkedHashMap<>();
    /** delegator -> positions, in the order delegators first staked. */
    private final Map<String, List<StakePosition>> positions = new LinkedHashMap<>();

    public StakeLedger(StateStore state, StakingConfig config, LeaderSelector selector, Clock clock) {
        this.state = Objects.requireNonNull(state, "state");
        this.config = Objects.requireNonNull(config, "config");
        this.selector = Objects.requireNonNull(selector, "selector");
        this.clock = Objects.requireNonNull(clock, "clock");
        seedGenesisValidators();
    }

    public StakeLedger(StateStore state) {
        this(state, StakingConfig.defaultLocal(), new StakeWeightedSelector(), Clock.systemUTC());
    }

    private void seedGenesisValidators() {
        for (StakingConfig.GenesisValidator genesis : config.genesisValidators) {
            Validator v = new Validator(genesis.address(), genesis.commission());
            v.bond(genesis.selfStake(), true);
            v.setActive(true);
            validators.put(genesis.address(), v);

            state.createAccount(genesis.address());
            state.markValidator(genesis.address());
            state.adjustStaked(genesis.address(), genesis.selfStake());

            StakePosition self = new StakePosition(genesis.address(), genesis.address());
            self.addAmount(genesis.selfStake());
            positions.computeIfAbsent(genesis.address(), k -> new ArrayList<>()).add(self);
        }
    }

    public StakingConfig config() {
        return config;
    }

    /**
     * Bond {@code amount} from the delegator's balance to a validator. Staking to one's own
     * address registers a new validator when none exists and the registry has room.
     */
    public synchronized void stake(String delegator, String validatorAddress, double amount) {
        if (!(amount >= config.minStake)) {
            throw new LedgerException(ProtocolError.STAKE_BELOW_MINIMUM,
                    "Minimum stake amount is " + config.minStake);
        }
        if (!state.exists(delegator) || state.getBalance(delegator) + DUST < amount) {
            throw new LedgerException(ProtocolError.INSUFFICIENT_BALANCE, "Insufficient balance for staking");
        }
        boolean self = delegator.equals(validatorAddress);
        Validator validator = validators.get(validatorAddress);
        if (validator == null) {
            if (!self) {
                throw new LedgerException(ProtocolError.UNKNOWN_VALIDATOR,
                        "Cannot delegate to non-existent validator " + validatorAddress);
            }
            if (validators.size() >= config.maxValidators) {
                throw new LedgerException(ProtocolError.VALIDATOR_REGISTRY_FULL, "Maximum number of validators reached");
            }
        }

        state.debit(delegator, amount);
        state.adjustStaked(delegator, amount);
        if (validator == null) {
            validator = new Validator(validatorAddress, config.defaultCommission);
            validators.put(validatorAddress, validator);
            state.markValidator(validatorAddress);
            LOG.info("Registered validator " + validatorAddress);
        }
        validator.bond(amount, self);
        if (!validator.active() && validator.totalStake() >= config.minStake) {
            validator.setActive(true);
        }
        findOrCreatePosition(delegator, validatorAddress).addAmount(amount);
    }

    /**
     * Start unbonding {@code amount}. Stake leaves the validator immediately; the tokens
     * become spendable only through {@link #completeUnstaking} after the unbonding period.
     */
    public synchronized void unstake(String delegator, String validatorAddress, double amount) {
        if (!(amount > 0)) {
            throw new LedgerException(ProtocolError.NON_POSITIVE_AMOUNT, "Unstake amount must be > 0");
        }
        StakePosition position = findPosition(delegator, validatorAddress);
        if (position == null || position.amount() + DUST < amount) {
            throw new LedgerException(ProtocolError.INSUFFICIENT_STAKE, "Insufficient staked amount");
        }
        Validator validator = validators.get(validatorAddress);
        if (validator == null || !state.exists(delegator)) {
            throw new LedgerException(ProtocolError.UNKNOWN_VALIDATOR, "Validator or delegator not found");
        }

        position.beginUnbonding(amount, clock.millis() + config.unbondingPeriodMillis);
        validator.unbond(amount, delegator.equals(validatorAddress));
        if (validator.totalStake() < config.minStake && validator.active()) {
            validator.setActive(false);
            LOG.info("Validator " + validatorAddress + " deactivated (stake " + validator.totalStake() + ")");
        }
        state.adjustStaked(delegator, -amount);
    }

    /** Release every unbonding amount whose unlock time has passed; returns the total released. */
    public synchronized double completeUnstaking(String delegator) {
        if (!state.exists(delegator)) {
            throw new LedgerException(ProtocolError.UNKNOWN_SENDER, "Delegator account not found: " + delegator);
        }
        List<StakePosition> list = positions.get(delegator);
        if (list == null) {
            return 0.0;
        }
        long now = clock.millis();
        double released = 0.0;
        for (Iterator<StakePosition> it = list.iterator(); it.hasNext(); ) {
            StakePosition position = it.next();
            if (position.isUnlocked(now)) {
                released += position.release();
                if (position.isEmpty()) {
                    it.remove();
                }
            }
        }
        if (list.isEmpty()) {
            positions.remove(delegator);
        }
        if (released > 0) {
            state.credit(delegator, released);
        }
        return released;
    }

    /** Producer for {@code blockIndex} among active validators, via the configured selector. */
    public synchronized String selectValidator(long blockIndex) {
        List<Validator> active = getActiveValidators();
        if (active.isEmpty()) {
            throw new LedgerException(ProtocolError.NO_ACTIVE_VALIDATORS,
                    "No active validator can produce block " + blockIndex);
        }
        return selector.select(active, blockIndex);
    }

    public synchronized void recordBlockProduced(String validatorAddress, long blockIndex) {
        Validator validator = validators.get(validatorAddress);
        if (validator != null) {
            validator.recordBlock(blockIndex);
        }
    }

    /**
     * Split a block reward: the validator keeps its commission, the rest goes to every
     * position bonded to it in proportion to the position's share of total stake.
     */
    public synchronized void distributeStakingRewards(double reward, String validatorAddress) {
        Validator validator = validators.get(validatorAddress);
        if (validator == null || !(reward > 0)) {
            return;
        }
        double totalStake = validator.totalStake();
        double commission = totalStake > 0 ? reward * validator.commissionRate() : reward;
        double delegatorRewards = reward - commission;
        state.addStakingRewards(validatorAddress, commission);
        if (delegatorRewards <= 0) {
            return;
        }
        for (Map.Entry<String, List<StakePosition>> entry : positions.entrySet()) {
            for (StakePosition position : entry.getValue()) {
                if (!position.validator().equals(validatorAddress) || position.amount() <= 0) {
                    continue;
                }
                double share = delegatorRewards * (position.amount() / totalStake);
                position.addRewards(share);
                state.addStakingRewards(entry.getKey(), share);
            }
        }
    }

    // -------------------- queries --------------------

    public synchronized Optional<Validator> getValidator(String address) {
        Validator v = validators.get(address);
        return v == null ? Optional.empty() : Optional.of(v.copy());
    }

    public synchronized List<Validator> getValidators() {
        List<Validator> out = new ArrayList<>(validators.size());
        for (Validator v : validators.values()) out.add(v.copy());
        return out;
    }

    /** Validators eligible for selection, in registration order. */
    public synchronized List<Validator> getActiveValidators() {
        List<Validator> out = new ArrayList<>();
        for (Validator v : validators.values()) {
            if (v.active() && v.totalStake() >= config.minStake) {
                out.add(v.copy());
            }
        }
        return out;
    }

    public synchronized List<StakePosition> getStakePositions(String delegator) {
        List<StakePosition> list = positions.get(delegator);
        if (list == null) return List.of();
        List<StakePosition> out = new ArrayList<>(list.size());
        for (StakePosition p : list) out.add(p.copy());
        return out;
    }

    /** Every token held by positions, bonded or unbonding. */
    public synchronized double totalStaked() {
        double total = 0.0;
        for (List<StakePosition> list : positions.values()) {
            for (StakePosition p : list) {
                total += p.amount() + p.unbonding();
            }
        }
        return total;
    }

    public synchronized StakingStats stats() {
        List<Validator> active = getActiveValidators();
        double bonded = 0.0;
        for (Validator v : active) bonded += v.totalStake();
        return new StakingStats(validators.size(), active.size(), bonded, config.minStake,
                config.maxValidators, config.annualRewardRate, config.unbondingPeriodMillis);
    }

    // -------------------- helpers --------------------

    private StakePosition findPosition(String delegator, String validatorAddress) {
        List<StakePosition> list = positions.get(delegator);
        if (list == null) return null;
        for (StakePosition p : list) {
            if (p.validator().equals(validatorAddress)) return p;
        }
        return null;
    }

    private StakePosition findOrCreatePosition(String delegator, String validatorAddress) {
        StakePosition existing = findPosition(delegator, validatorAddress);
        if (existing != null) return existing;
        StakePosition created = new StakePosition(delegator, validatorAddress);
        positions.computeIfAbsent(delegator, k -> new ArrayList<>()).add(created);
        return created;
    }
}
