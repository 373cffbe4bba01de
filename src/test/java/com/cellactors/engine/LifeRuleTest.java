package com.cellactors.engine;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class LifeRuleTest {

    @Test
    void liveCellSurvivesOnlyWithTwoOrThreeNeighbors() {
        for (int count = 0; count <= 8; count++) {
            boolean expected = count == 2 || count == 3;
            assertEquals(expected, LifeRule.nextState(true, count), "alive with " + count + " neighbors");
        }
    }

    @Test
    void deadCellIsBornOnlyWithExactlyThreeNeighbors() {
        for (int count = 0; count <= 8; count++) {
            assertEquals(count == 3, LifeRule.nextState(false, count), "dead with " + count + " neighbors");
        }
    }

    @Test
    void rejectsImpossibleCounts() {
        assertThrows(IllegalArgumentException.class, () -> LifeRule.nextState(true, -1));
        assertThrows(IllegalArgumentException.class, () -> LifeRule.nextState(false, 9));
    }
}
