package com.cellactors.engine;

/**
 * Live-neighbour tally of one cell, sent by its {@link NeighborCounter} to the step aggregator.
 */
public record NeighborReport(CellHandle cell, int count) {
}
