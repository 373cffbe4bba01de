package com.cellactors.engine;

import java.util.List;

import com.cellactors.actor.Actor;
import com.cellactors.actor.ActorRef;
import com.cellactors.actor.ProtocolViolationException;

/**
 * Short-lived actor counting the live neighbours of one cell for one step. Queries every
 * neighbour once, tallies the replies in whatever order they arrive and reports exactly once.
 */
final class NeighborCounter extends Actor<CellState> {

    private final CellHandle cell;
    private final List<CellHandle> neighbors;
    private final ActorRef<NeighborReport> aggregator;

    private int replies;
    private int alive;

    NeighborCounter(CellHandle cell, List<CellHandle> neighbors, ActorRef<NeighborReport> aggregator) {
        this.cell = cell;
        this.neighbors = List.copyOf(neighbors);
        this.aggregator = aggregator;
    }

    void start() {
        CellMessage query = new CellMessage.QueryState(self());
        for (CellHandle neighbor : neighbors) {
            neighbor.tell(query);
        }
    }

    @Override
    protected void receive(CellState reply) {
        if (replies >= neighbors.size()) {
            throw new ProtocolViolationException(self().name(), reply,
                    "reply beyond the " + neighbors.size() + " expected for " + cell);
        }
        replies++;
        if (reply.alive()) {
            alive++;
        }
        if (replies == neighbors.size()) {
            aggregator.tell(new NeighborReport(cell, alive));
        }
    }
}
