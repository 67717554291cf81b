package com.dirgen.orchestrator.llm.local;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Background timer that unloads idle local models.
 *
 * fixedDelay: the next sweep starts a full interval after the previous one
 * finished, so a slow unload never makes sweeps overlap.
 */
@Component
@EnableScheduling
public class IdleModelSweeper {

    private static final Logger log = LoggerFactory.getLogger(IdleModelSweeper.class);

    private final LocalModelManager manager;

    public IdleModelSweeper(LocalModelManager manager) {
        this.manager = manager;
    }

    @Scheduled(fixedDelayString = "${dirgen.local-models.sweep-interval-ms:30000}",
               initialDelayString = "${dirgen.local-models.sweep-interval-ms:30000}")
    public void sweep() {
        try {
            List<String> evicted = manager.evictIdle();
            if (!evicted.isEmpty()) {
                log.info("Idle sweep unloaded {}", evicted);
            }
        } catch (Exception e) {
            log.error("Idle model sweep failed: {}", e.getMessage(), e);
        }
    }
}
