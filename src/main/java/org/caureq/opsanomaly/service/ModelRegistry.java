package org.caureq.opsanomaly.service;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.opsanomaly.ml.ModelBundle;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

@Slf4j
@Component
@RequiredArgsConstructor
public class ModelRegistry {
    private final ModelArtifactStore artifacts;
    private final AtomicReference<ModelBundle> current = new AtomicReference<>();

    @PostConstruct
    void loadAtStartup() {
        artifacts.load().ifPresent(current::set);
    }

    public Optional<ModelBundle> current() {
        return Optional.ofNullable(current.get());
    }

    public void publish(ModelBundle bundle) {
        current.set(bundle);
        log.info("[Model] now scoring with bundle trained {}", bundle.trainedAt());
    }
}
