package com.cellactors.simulation;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

import com.cellactors.actor.ActorRuntime;
import com.cellactors.config.AppProperties;
import com.cellactors.engine.Board;
import com.cellactors.engine.Grid;
import com.cellactors.engine.SeedService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Owns the running board. Every operation holds the service monitor, so steps are strictly
 * serialized and a render never overlaps a step.
 */
@Service
public class SimulationService {

    public static final int MAX_STEPS_PER_REQUEST = 1_000;

    private static final Logger log = LoggerFactory.getLogger(SimulationService.class);

    private final ActorRuntime runtime;
    private final Duration stepTimeout;
    private Board board;

    public SimulationService(ActorRuntime runtime, AppProperties properties) {
        this.runtime = runtime;
        this.stepTimeout = properties.getStepTimeout();
        this.board = properties.getSeedFile()
                .map(path -> fromSeedFile(path, properties.getWidth(), properties.getHeight()))
                .orElseGet(() -> randomBoard(properties.getWidth(), properties.getHeight(),
                        properties.getDensity(), properties.getRandomSeed()));
    }

    public synchronized Board current() {
        return board;
    }

    public synchronized BoardView render() {
        return BoardView.of(board.generation(), board.snapshot());
    }

    /**
     * Advances the board. If a step times out the board keeps every generation completed before
     * it and the timeout propagates.
     */
    public synchronized BoardView step(int generations) {
        if (generations < 1 || generations > MAX_STEPS_PER_REQUEST) {
            throw new IllegalArgumentException("Generations must be between 1 and " + MAX_STEPS_PER_REQUEST);
        }
        long start = System.nanoTime();
        for (int i = 0; i < generations; i++) {
            board = board.step();
        }
        Duration spent = Duration.ofNanos(System.nanoTime() - start);
        log.debug("Stepped {} generation(s) to {} in {}",
                generations,
                board.generation(),
                String.format(Locale.US, "%.1f ms", spent.toNanos() / 1_000_000.0));
        return render();
    }

    public synchronized BoardView resetRandom(int width, int height, double density, long seed) {
        board = randomBoard(width, height, density, seed);
        return render();
    }

    public synchronized BoardView resetPattern(List<String> rows) {
        Grid grid = SeedService.parsePattern(rows);
        board = Board.fromGrid(runtime, grid, stepTimeout);
        log.info("Reset to a {}x{} pattern with {} live cells", grid.width(), grid.height(), grid.aliveCount());
        return render();
    }

    private Board randomBoard(int width, int height, double density, long seed) {
        Board created = Board.generate(runtime, width, height, SeedService.randomSource(density, seed), stepTimeout);
        log.info("Seeded random {}x{} board (density={}, seed={})", width, height, density, seed);
        return created;
    }

    private Board fromSeedFile(Path path, int width, int height) {
        Objects.requireNonNull(path, "path");
        try {
            Grid grid = SeedService.loadSeedFromFile(path, width, height);
            log.info("Seeded {}x{} board from {} with {} live cells", width, height, path, grid.aliveCount());
            return Board.fromGrid(runtime, grid, stepTimeout);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read seed file " + path, ex);
        }
    }
}
