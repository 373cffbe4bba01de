package com.cellactors.actor;

/**
 * An exception escaped an actor's handler. Fatal for the whole runtime.
 */
public class ActorFailureException extends RuntimeException {

    private final String actorName;
    private final transient Object offendingMessage;

    public ActorFailureException(String actorName, Object offendingMessage, String reason) {
        this(actorName, offendingMessage, reason, null);
    }

    public ActorFailureException(String actorName, Object offendingMessage, String reason, Throwable cause) {
        super("Actor " + actorName + " failed on message " + offendingMessage + ": " + reason, cause);
        this.actorName = actorName;
        this.offendingMessage = offendingMessage;
    }

    public String actorName() {
        return actorName;
    }

    public Object offendingMessage() {
        return offendingMessage;
    }
}
