package com.cellactors.actor;

/**
 * An actor received a message outside its protocol, which means the coordination upstream is
 * broken.
 */
public class ProtocolViolationException extends ActorFailureException {

    public ProtocolViolationException(String actorName, Object offendingMessage, String reason) {
        super(actorName, offendingMessage, reason);
    }
}
