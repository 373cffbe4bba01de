package com.cellactors.engine;

import static org.junit.jupiter.api.Assertions.*;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import com.cellactors.actor.ActorFailureException;
import com.cellactors.actor.ActorRef;
import com.cellactors.actor.ActorRuntime;
import com.cellactors.actor.ProtocolViolationException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CellActorTest {

    private final CompletableFuture<ActorFailureException> failure = new CompletableFuture<>();
    private ActorRuntime runtime;

    @BeforeEach
    void setUp() {
        runtime = new ActorRuntime(2, failure::complete);
    }

    @AfterEach
    void tearDown() {
        runtime.close();
    }

    @Test
    void answersQueriesWithoutChangingState() throws Exception {
        ActorRef<CellMessage> cell = runtime.spawn("cell", new CellActor(true));
        assertEquals(new CellState(0, 0, true), query(cell));
        assertEquals(new CellState(0, 0, true), query(cell));
    }

    @Test
    void duplicateUpdateIsAppliedOnce() throws Exception {
        ActorRef<CellMessage> once = runtime.spawn("once", new CellActor(false));
        ActorRef<CellMessage> twice = runtime.spawn("twice", new CellActor(false));

        once.tell(new CellMessage.ApplyNeighborCount(5, 3));
        twice.tell(new CellMessage.ApplyNeighborCount(5, 3));
        twice.tell(new CellMessage.ApplyNeighborCount(5, 3));

        CellState expected = new CellState(5, 5, true);
        assertEquals(expected, query(once));
        assertEquals(expected, query(twice));
    }

    @Test
    void olderGenerationIsIgnored() throws Exception {
        ActorRef<CellMessage> cell = runtime.spawn("cell", new CellActor(false));
        cell.tell(new CellMessage.ApplyNeighborCount(5, 2));
        cell.tell(new CellMessage.ApplyNeighborCount(3, 3));

        assertEquals(new CellState(5, 0, false), query(cell));
    }

    @Test
    void lastUpdateTracksOnlyActualFlips() throws Exception {
        ActorRef<CellMessage> cell = runtime.spawn("cell", new CellActor(true));
        cell.tell(new CellMessage.ApplyNeighborCount(1, 2));
        assertEquals(new CellState(1, 0, true), query(cell));

        cell.tell(new CellMessage.ApplyNeighborCount(2, 4));
        assertEquals(new CellState(2, 2, false), query(cell));

        cell.tell(new CellMessage.ApplyNeighborCount(3, 1));
        CellState state = query(cell);
        assertEquals(new CellState(3, 2, false), state);
        assertTrue(state.lastUpdate() <= state.generation());
    }

    @Test
    void impossibleCountTerminatesTheRuntime() throws Exception {
        ActorRef<CellMessage> cell = runtime.spawn("cell(0,0)", new CellActor(false));
        cell.tell(new CellMessage.ApplyNeighborCount(1, 9));

        ProtocolViolationException violation = assertInstanceOf(ProtocolViolationException.class,
                failure.get(2, TimeUnit.SECONDS));
        assertEquals("cell(0,0)", violation.actorName());
        assertTrue(runtime.isTerminated());
    }

    @Test
    void queryWithoutReplyAddressIsAProtocolViolation() throws Exception {
        ActorRef<CellMessage> cell = runtime.spawn("cell", new CellActor(false));
        cell.tell(new CellMessage.QueryState(null));

        assertInstanceOf(ProtocolViolationException.class, failure.get(2, TimeUnit.SECONDS));
    }

    private CellState query(ActorRef<CellMessage> cell) throws Exception {
        return runtime.<CellMessage, CellState>ask(cell, CellMessage.QueryState::new).get(2, TimeUnit.SECONDS);
    }
}
