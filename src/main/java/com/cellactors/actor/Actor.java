package com.cellactors.actor;

/**
 * Base class for mailbox-driven actors. {@link #receive(Object)} is never invoked concurrently
 * for the same instance, so subclasses keep plain mutable fields.
 *
 * @param <M> accepted message type
 */
public abstract class Actor<M> {

    private ActorRef<M> self;

    protected abstract void receive(M message);

    protected final ActorRef<M> self() {
        if (self == null) {
            throw new IllegalStateException(getClass().getSimpleName() + " has not been spawned");
        }
        return self;
    }

    final void bind(ActorRef<M> ref) {
        if (self != null) {
            throw new IllegalStateException(getClass().getSimpleName() + " is already bound to " + self.name());
        }
        this.self = ref;
    }
}
