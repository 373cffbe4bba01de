package com.cellactors.engine;

/**
 * Reply to {@link CellMessage.QueryState}.
 *
 * @param generation highest generation the cell has committed to
 * @param lastUpdate most recent generation in which {@code alive} flipped
 * @param alive current liveness
 */
public record CellState(long generation, long lastUpdate, boolean alive) {
}
