package com.cellactors.engine;

/**
 * Conway's B3/S23: a live cell survives with two or three live neighbours, a dead cell is born
 * with exactly three.
 */
public final class LifeRule {

    public static final String LABEL = "B3/S23";

    private LifeRule() {
    }

    public static boolean nextState(boolean currentlyAlive, int neighborCount) {
        if (neighborCount < 0 || neighborCount > CoordinateMapper.NEIGHBOR_COUNT) {
            throw new IllegalArgumentException("Neighbor count must be between 0 and 8");
        }
        if (currentlyAlive) {
            return neighborCount == 2 || neighborCount == 3;
        }
        return neighborCount == 3;
    }
}
