package io.stakechain.core.consensus;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StakeWeightedSelectorTest {

    private static Validator validator(String address, double stake) {
        Validator v = new Validator(address, 0.05);
        v.bond(stake, true);
        v.setActive(true);
        return v;
    }

    private final List<Validator> genesis = List.of(
            validator("genesis_validator_1", 1_000_000),
            validator("genesis_validator_2", 800_000),
            validator("genesis_validator_3", 600_000));

    @Test
    void fractionFollowsLinearCongruentialFormula() {
        assertEquals(12345.0 / 2147483647.0, StakeWeightedSelector.fraction(0), 1e-15);
        assertEquals(1103527590.0 / 2147483647.0, StakeWeightedSelector.fraction(1), 1e-12);
        for (long n = 0; n < 50; n++) {
            double f = StakeWeightedSelector.fraction(n);
            assertTrue(f >= 0 && f < 1, "n=" + n);
        }
    }

    @Test
    void picksByCumulativeStake() {
        StakeWeightedSelector selector = new StakeWeightedSelector();
        assertEquals("genesis_validator_1", selector.select(genesis, 0));
        // fraction(1) ~ 0.5139 -> target ~ 1,233,288 falls in the second bucket
        assertEquals("genesis_validator_2", selector.select(genesis, 1));
    }

    @Test
    void sameInputsSameProducer() {
        StakeWeightedSelector selector = new StakeWeightedSelector();
        for (long n = 0; n < 100; n++) {
            assertEquals(selector.select(genesis, n), selector.select(genesis, n));
        }
    }

    @Test
    void emptyRegistryIsAnError() {
        assertThrows(IllegalStateException.class, () -> new StakeWeightedSelector().select(List.of(), 1));
    }
}
