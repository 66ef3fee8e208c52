package org.caureq.opsanomaly.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Trains once at boot when no bundle could be loaded (app.model.train-on-startup=true).
 * A failure is logged and the service keeps running in fail-open mode.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app.model", name = "train-on-startup", havingValue = "true")
public class StartupTrainer implements ApplicationRunner {
    private final TrainingService training;
    private final ModelRegistry registry;

    @Override
    public void run(ApplicationArguments args) {
        if (registry.current().isPresent()) return;
        try {
            var report = training.train();
            log.info("[Train] startup training done: {} rows, threshold {}", report.rows(), report.threshold());
        } catch (RuntimeException e) {
            log.warn("[Train] startup training skipped: {}", e.getMessage());
        }
    }
}
