package com.cellactors.web;

import com.cellactors.config.AppProperties;
import com.cellactors.engine.LifeRule;
import com.cellactors.engine.SeedService;
import com.cellactors.engine.StepTimeoutException;
import com.cellactors.simulation.BoardView;
import com.cellactors.simulation.SimulationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

@RestController
@RequestMapping(path = "/board", produces = MediaType.APPLICATION_JSON_VALUE)
public class SimulationController {

    private static final Logger log = LoggerFactory.getLogger(SimulationController.class);

    private final SimulationService simulationService;
    private final AppProperties properties;

    public SimulationController(SimulationService simulationService, AppProperties properties) {
        this.simulationService = simulationService;
        this.properties = properties;
    }

    @GetMapping
    public BoardResponse board() {
        return toResponse(simulationService.render());
    }

    @PostMapping(path = "/step")
    public BoardResponse step(@RequestParam(name = "generations", defaultValue = "1") int generations) {
        try {
            return toResponse(simulationService.step(generations));
        } catch (StepTimeoutException ex) {
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage(), ex);
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage(), ex);
        }
    }

    @PostMapping(path = "/reset", consumes = MediaType.APPLICATION_JSON_VALUE)
    public BoardResponse reset(@RequestBody ResetRequest request) {
        BoardView view;
        try {
            if (request.pattern() != null && !request.pattern().isEmpty()) {
                view = simulationService.resetPattern(request.pattern());
            } else {
                int width = request.width() != null ? request.width() : properties.getWidth();
                int height = request.height() != null ? request.height() : properties.getHeight();
                double density = request.density() != null ? request.density() : SeedService.DEFAULT_RANDOM_DENSITY;
                long seed = request.randomSeed() != null ? request.randomSeed() : properties.getRandomSeed();
                view = simulationService.resetRandom(width, height, density, seed);
            }
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage(), ex);
        } catch (StepTimeoutException ex) {
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage(), ex);
        }
        log.info("Board reset to {}x{} with {} live cells", view.width(), view.height(), view.aliveCount());
        return toResponse(view);
    }

    private BoardResponse toResponse(BoardView view) {
        return new BoardResponse(
                view.width(),
                view.height(),
                view.generation(),
                view.aliveCount(),
                LifeRule.LABEL,
                view.rows());
    }
}
