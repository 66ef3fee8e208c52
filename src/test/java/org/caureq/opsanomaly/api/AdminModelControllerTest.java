package org.caureq.opsanomaly.api;

import org.caureq.opsanomaly.ml.DataQualityException;
import org.caureq.opsanomaly.ml.Feature;
import org.caureq.opsanomaly.service.ArtifactException;
import org.caureq.opsanomaly.service.ModelArtifactStore;
import org.caureq.opsanomaly.service.ModelRegistry;
import org.caureq.opsanomaly.service.StoreUnavailableException;
import org.caureq.opsanomaly.service.TrainingService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Optional;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AdminModelController.class)
class AdminModelControllerTest {

    @Autowired
    private MockMvc mvc;

    @MockBean
    private TrainingService training;
    @MockBean
    private ModelRegistry registry;
    @MockBean
    private ModelArtifactStore artifacts;

    @BeforeEach
    void setUp() {
        when(artifacts.path()).thenReturn(Path.of("/var/lib/ops/model-bundle.json"));
    }

    @Test
    void trainingRequiresTheAdminKey() throws Exception {
        mvc.perform(post("/api/admin/model/train")).andExpect(status().isUnauthorized());
        mvc.perform(post("/api/admin/model/train").header("X-ADMIN-API-KEY", "test-key"))
                .andExpect(status().isUnauthorized());
        verifyNoInteractions(training);
    }

    @Test
    void trainingReturnsTheReport() throws Exception {
        when(training.train()).thenReturn(new TrainingService.TrainingReport(
                1200, 100, 256, 0.05, 0.61, 60, Instant.parse("2025-03-11T06:00:00Z"), Path.of("m.json")));

        mvc.perform(post("/api/admin/model/train").header("X-ADMIN-API-KEY", "admin-key"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.rows").value(1200))
                .andExpect(jsonPath("$.anomaliesInTrainingSet").value(60))
                .andExpect(jsonPath("$.threshold").value(0.61));
    }

    @Test
    void emptyStoreIsAConflict() throws Exception {
        when(training.train()).thenThrow(new StoreUnavailableException("no samples collected yet"));

        mvc.perform(post("/api/admin/model/train").header("X-ADMIN-API-KEY", "admin-key"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("STORE_UNAVAILABLE"))
                .andExpect(jsonPath("$.path").value("/api/admin/model/train"));
    }

    @Test
    void missingMetricNamesTheFeature() throws Exception {
        when(training.train()).thenThrow(new DataQualityException(Feature.DISK_PERCENT, 40));

        mvc.perform(post("/api/admin/model/train").header("X-ADMIN-API-KEY", "admin-key"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("DATA_QUALITY"))
                .andExpect(jsonPath("$.details.feature").value("disk_percent"));
    }

    @Test
    void artifactFailureIsAServerError() throws Exception {
        when(training.train()).thenThrow(new ArtifactException(Path.of("m.json"), "disk full", null));

        mvc.perform(post("/api/admin/model/train").header("X-ADMIN-API-KEY", "admin-key"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.code").value("ARTIFACT_WRITE_FAILED"));
    }

    @Test
    void infoWithoutBundle() throws Exception {
        when(registry.current()).thenReturn(Optional.empty());

        mvc.perform(get("/api/admin/model").header("X-ADMIN-API-KEY", "admin-key"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.loaded").value(false))
                .andExpect(jsonPath("$.imputation").value("TRAINING"));
    }
}
