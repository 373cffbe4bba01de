package com.cellactors.engine;

import com.cellactors.actor.ActorRef;

/**
 * Routing reference to one cell actor. Holds no cell state, compares by identity.
 */
public final class CellHandle {

    private final int offset;
    private final ActorRef<CellMessage> ref;

    CellHandle(int offset, ActorRef<CellMessage> ref) {
        this.offset = offset;
        this.ref = ref;
    }

    public int offset() {
        return offset;
    }

    public ActorRef<CellMessage> ref() {
        return ref;
    }

    public void tell(CellMessage message) {
        ref.tell(message);
    }

    @Override
    public String toString() {
        return ref.name();
    }
}
