package com.cellactors.actor;

/**
 * Explicit address of an actor. Handles are passed around directly; there is no registry to
 * look actors up by name.
 *
 * @param <M> the message type the target actor accepts
 */
public interface ActorRef<M> {

    void tell(M message);

    String name();
}
