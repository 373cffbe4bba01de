package com.cellactors.scheduler;

import com.cellactors.engine.StepTimeoutException;
import com.cellactors.simulation.BoardView;
import com.cellactors.simulation.SimulationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Render-then-step loop over the running board.
 */
@Component
@ConditionalOnProperty(name = "app.driver-enabled", havingValue = "true", matchIfMissing = true)
public class SimulationDriver {

    private static final Logger log = LoggerFactory.getLogger(SimulationDriver.class);

    private final SimulationService simulationService;

    public SimulationDriver(SimulationService simulationService) {
        this.simulationService = simulationService;
    }

    @Scheduled(fixedDelayString = "${app.tick-delay-ms:500}")
    public void tick() {
        BoardView view = simulationService.render();
        log.info("\n{}\n", view.frame());
        try {
            simulationService.step(1);
        } catch (StepTimeoutException ex) {
            log.warn("Generation {} not reached, retrying on next tick: {}", ex.targetGeneration(), ex.getMessage());
        }
    }
}
