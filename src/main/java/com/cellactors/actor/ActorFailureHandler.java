package com.cellactors.actor;

@FunctionalInterface
public interface ActorFailureHandler {

    void onFailure(ActorFailureException failure);
}
