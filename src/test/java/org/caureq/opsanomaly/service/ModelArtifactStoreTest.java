package org.caureq.opsanomaly.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.caureq.opsanomaly.ml.DetectorOptions;
import org.caureq.opsanomaly.ml.FeaturePreprocessor;
import org.caureq.opsanomaly.ml.IsolationForest;
import org.caureq.opsanomaly.ml.ModelBundle;
import org.caureq.opsanomaly.ml.TestSamples;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;

class ModelArtifactStoreTest {

    @TempDir
    Path dir;

    private ObjectMapper mapper;
    private ModelBundle bundle;

    @BeforeEach
    void setUp() {
        mapper = new ObjectMapper().findAndRegisterModules();
        var prepared = FeaturePreprocessor.fitTransform(TestSamples.clusterWithOutlier(80, 2L));
        var forest = IsolationForest.fit(prepared.matrix(),
                DetectorOptions.defaults().toBuilder().numberOfTrees(20).build());
        bundle = ModelBundle.of(prepared.scaler(), forest, 81, Instant.parse("2025-03-10T12:00:00Z"));
    }

    @Test
    void savedBundleLoadsBackAndScoresIdentically() {
        var store = new ModelArtifactStore(mapper, dir.resolve("models/bundle.json"));

        store.save(bundle);
        var loaded = store.load();

        assertThat(loaded).isPresent();
        var b = loaded.get();
        assertThat(b.trainedAt()).isEqualTo(bundle.trainedAt());
        assertThat(b.trainingRows()).isEqualTo(81);
        assertThat(b.featureOrder()).containsExactly("cpu_percent", "memory_percent", "disk_percent");
        assertThat(b.detector().threshold()).isEqualTo(bundle.detector().threshold());
        assertArrayEquals(bundle.scaler().mean(), b.scaler().mean());
        assertArrayEquals(bundle.scaler().imputationMeans(), b.scaler().imputationMeans());

        double[][] probe = TestSamples.matrix(TestSamples.clusterWithOutlier(30, 9L));
        assertArrayEquals(bundle.detector().score(probe), b.detector().score(probe));
    }

    @Test
    void saveReplacesThePreviousBundleAndLeavesNoTempFile() throws Exception {
        var path = dir.resolve("bundle.json");
        var store = new ModelArtifactStore(mapper, path);

        store.save(bundle);
        var second = ModelBundle.of(bundle.scaler(), bundle.detector(), 5, bundle.trainedAt().plusSeconds(60));
        store.save(second);

        assertThat(store.load()).map(ModelBundle::trainingRows).contains(5);
        try (var files = Files.list(dir)) {
            assertThat(files.map(p -> p.getFileName().toString()).toList()).containsExactly("bundle.json");
        }
    }

    @Test
    void missingFileIsAbsent() {
        assertThat(new ModelArtifactStore(mapper, dir.resolve("none.json")).load()).isEmpty();
    }

    @Test
    void unreadableFileIsAbsent() throws Exception {
        var path = dir.resolve("bundle.json");
        Files.writeString(path, "{not json");

        assertThat(new ModelArtifactStore(mapper, path).load()).isEmpty();
    }

    @Test
    void bundleForAnotherColumnLayoutIsIgnored() {
        var path = dir.resolve("bundle.json");
        var store = new ModelArtifactStore(mapper, path);
        store.save(new ModelBundle(ModelBundle.FORMAT_VERSION, List.of("disk_percent", "cpu_percent", "memory_percent"),
                bundle.trainedAt(), 81, bundle.scaler(), bundle.detector()));

        assertThat(store.load()).isEmpty();
    }

    @Test
    void unwritableLocationRaisesArtifactException() throws Exception {
        var blocker = dir.resolve("blocker");
        Files.writeString(blocker, "a file, not a directory");
        var store = new ModelArtifactStore(mapper, blocker.resolve("bundle.json"));

        assertThatThrownBy(() -> store.save(bundle)).isInstanceOf(ArtifactException.class);
    }
}
