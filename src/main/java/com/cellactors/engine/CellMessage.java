package com.cellactors.engine;

import com.cellactors.actor.ActorRef;

/**
 * Everything a {@link CellActor} understands.
 */
public sealed interface CellMessage permits CellMessage.QueryState, CellMessage.ApplyNeighborCount {

    record QueryState(ActorRef<CellState> replyTo) implements CellMessage {
    }

    /**
     * Recompute liveness for {@code generation} unless the cell already holds it or a later one.
     */
    record ApplyNeighborCount(long generation, int count) implements CellMessage {
    }
}
