package com.cellactors.engine;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeoutException;
import java.util.function.BooleanSupplier;
import java.util.function.IntPredicate;

import com.cellactors.actor.ActorFailureException;
import com.cellactors.actor.ActorRef;
import com.cellactors.actor.ActorRuntime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One generation of a toroidal Life board whose cells are actors.
 *
 * <p>A board is an immutable value: {@link #step()} returns a new board with the same cell
 * handles and the next generation number. Cell state lives only in the actors, so a board value
 * is a view of "the cells, as of generation N". Stepping a board whose generation the cells have
 * already passed leaves the cells untouched, because every update it sends is stale.
 *
 * <p>Callers must not step concurrently; each step waits for the full barrier before returning.
 */
public final class Board {

    private static final Logger log = LoggerFactory.getLogger(Board.class);

    private final ActorRuntime runtime;
    private final int width;
    private final int height;
    private final long generation;
    private final List<CellHandle> cells;
    private final Duration stepTimeout;

    private Board(ActorRuntime runtime, int width, int height, long generation, List<CellHandle> cells,
            Duration stepTimeout) {
        this.runtime = runtime;
        this.width = width;
        this.height = height;
        this.generation = generation;
        this.cells = cells;
        this.stepTimeout = stepTimeout;
    }

    public static Board generate(ActorRuntime runtime, int width, int height, BooleanSupplier random,
            Duration stepTimeout) {
        InvalidDimensionsException.check(width, height);
        Objects.requireNonNull(random, "random");
        return spawn(runtime, width, height, offset -> random.getAsBoolean(), stepTimeout);
    }

    public static Board fromGrid(ActorRuntime runtime, Grid grid, Duration stepTimeout) {
        Objects.requireNonNull(grid, "grid");
        return spawn(runtime, grid.width(), grid.height(), grid::getAt, stepTimeout);
    }

    private static Board spawn(ActorRuntime runtime, int width, int height, IntPredicate initiallyAlive,
            Duration stepTimeout) {
        Objects.requireNonNull(runtime, "runtime");
        Objects.requireNonNull(stepTimeout, "stepTimeout");
        if (stepTimeout.isNegative() || stepTimeout.isZero()) {
            throw new IllegalArgumentException("Step timeout must be positive");
        }
        int size = width * height;
        List<CellHandle> cells = new ArrayList<>(size);
        for (int offset = 0; offset < size; offset++) {
            CellCoordinate coordinate = CoordinateMapper.toXy(offset, width);
            ActorRef<CellMessage> ref = runtime.spawn(
                    "cell(" + coordinate.x() + "," + coordinate.y() + ")",
                    new CellActor(initiallyAlive.test(offset)));
            cells.add(new CellHandle(offset, ref));
        }
        log.info("Spawned {} cell actors for a {}x{} board", size, width, height);
        return new Board(runtime, width, height, 0, List.copyOf(cells), stepTimeout);
    }

    /**
     * Advances every cell by one generation.
     *
     * @throws StepTimeoutException if the neighbour counts were not all collected in time; this
     *         board stays valid and the step may be retried
     * @throws ActorFailureException if any actor failed, which terminates the simulation
     */
    public Board step() {
        long targetGeneration = generation + 1;
        StepAggregator aggregator = new StepAggregator(targetGeneration, cells.size());
        ActorRef<NeighborReport> aggregatorRef = runtime.spawn("aggregator@" + targetGeneration, aggregator);
        for (CellHandle cell : cells) {
            NeighborCounter counter = new NeighborCounter(cell, neighborsOf(cell.offset()), aggregatorRef);
            runtime.spawn("counter:" + cell + "@" + targetGeneration, counter);
            counter.start();
        }
        aggregator.await(runtime, stepTimeout);
        log.debug("Board {}x{} advanced to generation {}", width, height, targetGeneration);
        return new Board(runtime, width, height, targetGeneration, cells, stepTimeout);
    }

    /**
     * Reads every cell's liveness in offset order. Consistent as long as no step runs meanwhile.
     */
    public Grid snapshot() {
        List<CompletableFuture<CellState>> replies = new ArrayList<>(cells.size());
        for (CellHandle cell : cells) {
            replies.add(runtime.<CellMessage, CellState>ask(cell.ref(), CellMessage.QueryState::new));
        }
        CompletableFuture<Void> all = CompletableFuture.allOf(replies.toArray(new CompletableFuture<?>[0]));
        try {
            runtime.await(all, stepTimeout);
        } catch (TimeoutException ex) {
            throw new IllegalStateException("Timed out reading cell states of generation " + generation, ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while reading cell states", ex);
        }
        Grid grid = new Grid(width, height);
        for (int offset = 0; offset < replies.size(); offset++) {
            grid.setAt(offset, replies.get(offset).join().alive());
        }
        return grid;
    }

    public List<String> render() {
        return snapshot().rows();
    }

    /**
     * Rendered rows followed by a line with the generation number.
     */
    public String renderFrame() {
        return String.join("\n", render()) + "\ngeneration " + generation;
    }

    List<CellHandle> neighborsOf(int offset) {
        int[] offsets = CoordinateMapper.neighborOffsets(offset, width, height);
        List<CellHandle> neighbors = new ArrayList<>(offsets.length);
        for (int neighbor : offsets) {
            neighbors.add(cells.get(neighbor));
        }
        return neighbors;
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public long generation() {
        return generation;
    }

    public List<CellHandle> cells() {
        return cells;
    }

    public CellHandle cellAt(int x, int y) {
        return cells.get(CoordinateMapper.toOffset(x, y, width, height));
    }

    @Override
    public String toString() {
        return "Board[" + width + "x" + height + ", generation=" + generation + "]";
    }
}
