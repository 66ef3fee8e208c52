package org.caureq.opsanomaly.api;

import lombok.RequiredArgsConstructor;
import org.caureq.opsanomaly.api.dto.ModelInfoDTO;
import org.caureq.opsanomaly.config.AppProps;
import org.caureq.opsanomaly.service.ModelArtifactStore;
import org.caureq.opsanomaly.service.ModelRegistry;
import org.caureq.opsanomaly.service.TrainingService;
import org.springframework.web.bind.annotation.*;

/** Model inspection and the manual training trigger. Training runs synchronously on the request thread. */
@RestController
@RequestMapping("/api/admin/model")
@RequiredArgsConstructor
public class AdminModelController {
    private final TrainingService training;
    private final ModelRegistry registry;
    private final ModelArtifactStore artifacts;
    private final AppProps props;

    @GetMapping
    public ModelInfoDTO info() {
        var imputation = props.model().imputation();
        var path = artifacts.path().toString();
        return registry.current()
                .map(b -> ModelInfoDTO.of(b, imputation, path))
                .orElseGet(() -> ModelInfoDTO.notLoaded(imputation, path));
    }

    @PostMapping("/train")
    public TrainingService.TrainingReport train() {
        return training.train();
    }
}
