package io.stakechain.core.consensus;

import io.stakechain.core.MutableClock;
import io.stakechain.core.protocol.LedgerException;
import io.stakechain.core.protocol.ProtocolError;
import io.stakechain.core.state.InMemoryStateStore;
import io.stakechain.core.state.StateStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class StakeLedgerTest {

    private StateStore state;
    private MutableClock clock;
    private StakeLedger ledger;

    @BeforeEach
    void setUp() {
        state = new InMemoryStateStore();
        clock = new MutableClock();
        ledger = new StakeLedger(state, StakingConfig.defaultLocal(), new StakeWeightedSelector(), clock);
    }

    private static void assertError(ProtocolError expected, Runnable op) {
        LedgerException ex = assertThrows(LedgerException.class, op::run);
        assertEquals(expected, ex.error());
    }

    @Test
    void genesisSeedsThreeActiveValidators() {
        List<Validator> active = ledger.getActiveValidators();
        assertEquals(3, active.size());
        assertEquals("genesis_validator_1", active.get(0).address());
        assertEquals(1_000_000, active.get(0).totalStake(), 1e-9);
        assertEquals(0.04, ledger.getValidator("genesis_validator_2").orElseThrow().commissionRate(), 1e-12);
        assertEquals(2_400_000, ledger.totalStaked(), 1e-6);
        assertTrue(state.getAccount("genesis_validator_3").orElseThrow().validator());
        assertEquals(600_000, state.getAccount("genesis_validator_3").orElseThrow().staked(), 1e-9);
        assertEquals(1, ledger.getStakePositions("genesis_validator_1").size());
    }

    @Test
    void delegationMovesBalanceIntoStake() {
        state.credit("alice", 1_000);

        ledger.stake("alice", "genesis_validator_1", 500);

        assertEquals(500, state.getBalance("alice"), 1e-9);
        assertEquals(500, state.getAccount("alice").orElseThrow().staked(), 1e-9);
        assertEquals(1_000_500, ledger.getValidator("genesis_validator_1").orElseThrow().totalStake(), 1e-9);
        assertEquals(1_000_000, ledger.getValidator("genesis_validator_1").orElseThrow().selfStake(), 1e-9);
        StakePosition position = ledger.getStakePositions("alice").get(0);
        assertEquals("genesis_validator_1", position.validator());
        assertEquals(500, position.amount(), 1e-9);
        assertTrue(position.unlockTimestamp().isEmpty());
    }

    @Test
    void failedStakeLeavesStateUntouched() {
        state.credit("alice", 1_000);

        assertError(ProtocolError.STAKE_BELOW_MINIMUM, () -> ledger.stake("alice", "genesis_validator_1", 99));
        assertError(ProtocolError.INSUFFICIENT_BALANCE, () -> ledger.stake("alice", "genesis_validator_1", 5_000));
        assertError(ProtocolError.INSUFFICIENT_BALANCE, () -> ledger.stake("nobody", "genesis_validator_1", 500));
        assertError(ProtocolError.UNKNOWN_VALIDATOR, () -> ledger.stake("alice", "ghost", 500));

        assertEquals(1_000, state.getBalance("alice"), 1e-9);
        assertTrue(ledger.getStakePositions("alice").isEmpty());
        assertEquals(3, ledger.getValidators().size());
    }

    @Test
    void selfStakeRegistersValidator() {
        state.credit("carol", 1_000);

        ledger.stake("carol", "carol", 200);

        Validator carol = ledger.getValidator("carol").orElseThrow();
        assertTrue(carol.active());
        assertEquals(200, carol.selfStake(), 1e-9);
        assertEquals(0.05, carol.commissionRate(), 1e-12);
        assertTrue(state.getAccount("carol").orElseThrow().validator());
        assertEquals(4, ledger.stats().activeValidators());
    }

    @Test
    void registryCapIsEnforced() {
        StateStore cappedState = new InMemoryStateStore();
        StakeLedger full = new StakeLedger(cappedState,
                StakingConfig.defaultLocal().withMaxValidators(3), new StakeWeightedSelector(), clock);
        cappedState.credit("carol", 1_000);

        assertError(ProtocolError.VALIDATOR_REGISTRY_FULL, () -> full.stake("carol", "carol", 200));
        assertEquals(1_000, cappedState.getBalance("carol"), 1e-9);
        assertEquals(3, full.getValidators().size());
    }

    @Test
    void unbondingReleasesOnlyAfterPeriod() {
        state.credit("alice", 1_000);
        ledger.stake("alice", "genesis_validator_2", 500);

        ledger.unstake("alice", "genesis_validator_2", 500);

        assertEquals(800_000, ledger.getValidator("genesis_validator_2").orElseThrow().totalStake(), 1e-9);
        assertEquals(0, state.getAccount("alice").orElseThrow().staked(), 1e-9);
        StakePosition position = ledger.getStakePositions("alice").get(0);
        assertEquals(0, position.amount(), 1e-9);
        assertEquals(500, position.unbonding(), 1e-9);
        assertEquals(clock.millis() + Duration.ofDays(7).toMillis(), position.unlockTimestamp().getAsLong());
        // unbonding stake still counts toward the staked supply
        assertEquals(2_400_500, ledger.totalStaked(), 1e-6);

        assertEquals(0.0, ledger.completeUnstaking("alice"), 1e-12);
        assertEquals(500, state.getBalance("alice"), 1e-9);

        clock.advance(Duration.ofDays(7));
        assertEquals(500, ledger.completeUnstaking("alice"), 1e-9);
        assertEquals(1_000, state.getBalance("alice"), 1e-9);
        assertTrue(ledger.getStakePositions("alice").isEmpty());
        assertEquals(0.0, ledger.completeUnstaking("alice"), 1e-12);
    }

    @Test
    void partialUnstakeKeepsRemainderBonded() {
        state.credit("alice", 1_000);
        ledger.stake("alice", "genesis_validator_1", 600);
        ledger.unstake("alice", "genesis_validator_1", 200);

        clock.advance(Duration.ofDays(8));
        assertEquals(200, ledger.completeUnstaking("alice"), 1e-9);
        StakePosition position = ledger.getStakePositions("alice").get(0);
        assertEquals(400, position.amount(), 1e-9);
        assertEquals(0, position.unbonding(), 1e-9);
    }

    @Test
    void unstakeFailures() {
        state.credit("alice", 1_000);
        ledger.stake("alice", "genesis_validator_1", 300);

        assertError(ProtocolError.NON_POSITIVE_AMOUNT, () -> ledger.unstake("alice", "genesis_validator_1", 0));
        assertError(ProtocolError.INSUFFICIENT_STAKE, () -> ledger.unstake("alice", "genesis_validator_1", 301));
        assertError(ProtocolError.INSUFFICIENT_STAKE, () -> ledger.unstake("alice", "genesis_validator_2", 10));
        assertError(ProtocolError.UNKNOWN_SENDER, () -> ledger.completeUnstaking("nobody"));
        assertEquals(300, ledger.getStakePositions("alice").get(0).amount(), 1e-9);
    }

    @Test
    void validatorDeactivatesBelowMinimum() {
        state.credit("carol", 1_000);
        ledger.stake("carol", "carol", 150);

        ledger.unstake("carol", "carol", 100);

        Validator carol = ledger.getValidator("carol").orElseThrow();
        assertFalse(carol.active());
        assertEquals(50, carol.totalStake(), 1e-9);
        assertEquals(4, ledger.getValidators().size());
        assertEquals(3, ledger.getActiveValidators().size());
    }

    @Test
    void rewardsSplitByCommissionThenStakeShare() {
        state.credit("alice", 1_000_000);
        ledger.stake("alice", "genesis_validator_1", 1_000_000);

        ledger.distributeStakingRewards(100, "genesis_validator_1");

        // 5 commission, 95 split evenly between the self-bond and alice
        assertEquals(5 + 47.5, state.getAccount("genesis_validator_1").orElseThrow().stakingRewards(), 1e-9);
        assertEquals(47.5, state.getAccount("alice").orElseThrow().stakingRewards(), 1e-9);
        assertEquals(47.5, ledger.getStakePositions("alice").get(0).rewards(), 1e-9);
    }

    @Test
    void selectionIsDeterministicAndRecordsProduction() {
        assertEquals(ledger.selectValidator(7), ledger.selectValidator(7));
        assertEquals("genesis_validator_2", ledger.selectValidator(1));

        ledger.recordBlockProduced("genesis_validator_2", 1);

        Validator v2 = ledger.getValidator("genesis_validator_2").orElseThrow();
        assertEquals(1, v2.blocksProduced());
        assertEquals(1, v2.lastActiveBlock());
    }

    @Test
    void queriesReturnCopies() {
        Validator copy = ledger.getValidator("genesis_validator_1").orElseThrow();
        copy.bond(5_000_000, true);
        assertEquals(1_000_000, ledger.getValidator("genesis_validator_1").orElseThrow().totalStake(), 1e-9);
    }
}
