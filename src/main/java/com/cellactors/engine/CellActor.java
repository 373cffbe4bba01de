package com.cellactors.engine;

import com.cellactors.actor.Actor;
import com.cellactors.actor.ProtocolViolationException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Authoritative state of one grid position. Only this actor's mailbox mutates it.
 *
 * <p>Updates are tagged with the generation they produce and applied only when that generation
 * is newer than the one the cell holds, so duplicate, late or replayed updates are no-ops
 * regardless of how they interleave with state queries.
 */
public final class CellActor extends Actor<CellMessage> {

    private static final Logger log = LoggerFactory.getLogger(CellActor.class);

    private long generation;
    private long lastUpdate;
    private boolean alive;

    public CellActor(boolean alive) {
        this.alive = alive;
    }

    @Override
    protected void receive(CellMessage message) {
        if (message instanceof CellMessage.QueryState query) {
            if (query.replyTo() == null) {
                throw new ProtocolViolationException(self().name(), message, "state query without reply address");
            }
            query.replyTo().tell(new CellState(generation, lastUpdate, alive));
        } else if (message instanceof CellMessage.ApplyNeighborCount update) {
            apply(update);
        } else {
            throw new ProtocolViolationException(self().name(), message, "unrecognized cell message");
        }
    }

    private void apply(CellMessage.ApplyNeighborCount update) {
        if (update.generation() <= generation) {
            log.trace("{} ignoring stale update for generation {} (at {})", self().name(), update.generation(), generation);
            return;
        }
        boolean next;
        try {
            next = LifeRule.nextState(alive, update.count());
        } catch (IllegalArgumentException ex) {
            throw new ProtocolViolationException(self().name(), update, ex.getMessage());
        }
        if (next != alive) {
            lastUpdate = update.generation();
        }
        generation = update.generation();
        alive = next;
    }
}
