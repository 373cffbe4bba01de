package com.cellactors.engine;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.List;
import java.util.function.BooleanSupplier;

import com.cellactors.actor.ActorRuntime;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class BoardTest {

    private static final Duration STEP_TIMEOUT = Duration.ofSeconds(5);

    private ActorRuntime runtime;

    @BeforeEach
    void setUp() {
        runtime = new ActorRuntime(4);
    }

    @AfterEach
    void tearDown() {
        runtime.close();
    }

    @Test
    void blinkerOscillatesWithPeriodTwo() {
        List<String> horizontal = List.of(
                "_____",
                "_____",
                "_***_",
                "_____",
                "_____");
        List<String> vertical = List.of(
                "_____",
                "__*__",
                "__*__",
                "__*__",
                "_____");
        Board board = Board.fromGrid(runtime, SeedService.parsePattern(horizontal), STEP_TIMEOUT);

        Board first = board.step();
        assertEquals(vertical, first.render());

        Board second = first.step();
        assertEquals(horizontal, second.render());
        assertEquals(2, second.generation());
    }

    @Test
    void blockIsAStillLife() {
        List<String> block = List.of(
                "____",
                "_**_",
                "_**_",
                "____");
        Board board = Board.fromGrid(runtime, SeedService.parsePattern(block), STEP_TIMEOUT);

        Board next = board.step();
        assertEquals(block, next.render());
        assertEquals(block, next.step().render());
    }

    @Test
    void matchesSequentialReferenceOnRandomBoards() {
        for (long seed = 1; seed <= 20; seed++) {
            Grid initial = randomGrid(4, 4, seed);
            Board board = Board.fromGrid(runtime, initial, STEP_TIMEOUT);

            Board next = board.step();
            assertEquals(Grid.advance(initial), next.snapshot(), "seed " + seed);
        }
    }

    @Test
    void staysInLockstepWithReferenceOverManyGenerations() {
        Grid expected = randomGrid(9, 7, 99L);
        Board board = Board.fromGrid(runtime, expected, STEP_TIMEOUT);
        for (int i = 0; i < 15; i++) {
            board = board.step();
            expected = Grid.advance(expected);
            assertEquals(expected, board.snapshot(), "generation " + board.generation());
        }
    }

    @Test
    void generationAdvancesByOnePerStep() {
        Board board = Board.generate(runtime, 3, 3, () -> false, STEP_TIMEOUT);
        assertEquals(0, board.generation());
        for (int expected = 1; expected <= 3; expected++) {
            board = board.step();
            assertEquals(expected, board.generation());
        }
    }

    @Test
    void stepReturnsNewValueSharingTheSameCells() {
        Board board = Board.generate(runtime, 4, 2, () -> true, STEP_TIMEOUT);
        Board next = board.step();

        assertNotSame(board, next);
        assertEquals(0, board.generation());
        assertEquals(1, next.generation());
        assertSame(board.cells(), next.cells());
        assertEquals(8, next.cells().size());
    }

    @Test
    void steppingSupersededBoardLeavesCellsUntouched() {
        Board board = Board.fromGrid(runtime, SeedService.parsePattern(List.of(
                "_____",
                "_____",
                "_***_",
                "_____",
                "_____")), STEP_TIMEOUT);
        Board current = board.step();
        List<String> expected = current.render();

        Board replayed = board.step();
        assertEquals(1, replayed.generation());
        assertEquals(expected, current.render());
    }

    @Test
    void tinyBoardsStepWithoutFailing() {
        Grid single = SeedService.parsePattern(List.of("*"));
        Board singleBoard = Board.fromGrid(runtime, single, STEP_TIMEOUT).step();
        assertEquals(Grid.advance(single), singleBoard.snapshot());

        Grid pair = SeedService.parsePattern(List.of("**"));
        Board pairBoard = Board.fromGrid(runtime, pair, STEP_TIMEOUT).step();
        assertEquals(Grid.advance(pair), pairBoard.snapshot());
        assertFalse(runtime.isTerminated());
    }

    @Test
    void generateSeedsEveryCellFromTheRandomSource() {
        BooleanSupplier alternating = new BooleanSupplier() {
            private boolean next;

            @Override
            public boolean getAsBoolean() {
                next = !next;
                return next;
            }
        };
        Board board = Board.generate(runtime, 3, 2, alternating, STEP_TIMEOUT);
        assertEquals(List.of("*_*", "_*_"), board.render());
    }

    @Test
    void renderFrameEndsWithGenerationLine() {
        Board board = Board.generate(runtime, 2, 2, () -> true, STEP_TIMEOUT);
        assertEquals("**\n**\ngeneration 0", board.renderFrame());
        assertEquals("__\n__\ngeneration 1", board.step().renderFrame());
    }

    @Test
    void cellAtWrapsCoordinates() {
        Board board = Board.generate(runtime, 3, 3, () -> false, STEP_TIMEOUT);
        assertSame(board.cellAt(2, 2), board.cellAt(-1, -1));
        assertEquals(8, board.cellAt(2, 2).offset());
    }

    @Test
    void rejectsNonPositiveDimensions() {
        assertThrows(InvalidDimensionsException.class, () -> Board.generate(runtime, 0, 3, () -> true, STEP_TIMEOUT));
        assertThrows(InvalidDimensionsException.class, () -> Board.generate(runtime, 3, -1, () -> true, STEP_TIMEOUT));
    }

    @Test
    void rejectsNonPositiveStepTimeout() {
        assertThrows(IllegalArgumentException.class, () -> Board.generate(runtime, 2, 2, () -> true, Duration.ZERO));
    }

    @Test
    void stepFailsOnceRuntimeHasTerminated() {
        Board board = Board.generate(runtime, 2, 2, () -> true, STEP_TIMEOUT);
        runtime.close();
        assertThrows(IllegalStateException.class, board::step);
    }

    private static Grid randomGrid(int width, int height, long seed) {
        BooleanSupplier random = SeedService.randomSource(0.4, seed);
        Grid grid = new Grid(width, height);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                grid.set(x, y, random.getAsBoolean());
            }
        }
        return grid;
    }
}
