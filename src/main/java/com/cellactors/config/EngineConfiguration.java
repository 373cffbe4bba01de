package com.cellactors.config;

import com.cellactors.actor.ActorRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class EngineConfiguration {

    private static final Logger log = LoggerFactory.getLogger(EngineConfiguration.class);

    /**
     * Actor failures are coordination bugs, so the whole process goes down with a non-zero status.
     * The exit runs on its own thread because closing the context closes this runtime, whose pool
     * the failing actor is running on.
     */
    @Bean(destroyMethod = "close")
    public ActorRuntime actorRuntime(AppProperties properties, ApplicationContext context) {
        return new ActorRuntime(properties.getParallelism(), failure -> {
            log.error("Terminating simulation: actor {} failed on {}", failure.actorName(), failure.offendingMessage());
            Thread exit = new Thread(() -> System.exit(SpringApplication.exit(context, () -> 1)), "fatal-exit");
            exit.start();
        });
    }
}
