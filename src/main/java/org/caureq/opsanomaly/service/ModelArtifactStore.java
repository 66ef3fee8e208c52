package org.caureq.opsanomaly.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.caureq.opsanomaly.config.AppProps;
import org.caureq.opsanomaly.ml.ModelBundle;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/** Bundle as one JSON file, replaced through a temp sibling and an atomic move. */
@Slf4j
@Service
public class ModelArtifactStore {
    private final ObjectMapper objectMapper;
    private final Path path;

    @Autowired
    public ModelArtifactStore(ObjectMapper objectMapper, AppProps props) {
        this(objectMapper, props.model().artifactPath());
    }

    public ModelArtifactStore(ObjectMapper objectMapper, Path path) {
        this.objectMapper = objectMapper;
        this.path = path.toAbsolutePath();
    }

    public Path path() { return path; }

    public Path save(ModelBundle bundle) {
        Path tmp = null;
        try {
            Path dir = path.getParent();
            if (dir != null) Files.createDirectories(dir);
            tmp = Files.createTempFile(dir, path.getFileName().toString(), ".tmp");
            objectMapper.writeValue(tmp.toFile(), bundle);
            try {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            }
            log.info("[Model] bundle written to {} ({} rows, {} trees)", path, bundle.trainingRows(),
                    bundle.detector().trees().size());
            return path;
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new ArtifactException(path, "cannot write model bundle to " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * @return the stored bundle, or empty when the file is missing, unreadable or written for
     * another column layout; each of those cases is logged at WARN
     */
    public Optional<ModelBundle> load() {
        if (!Files.isRegularFile(path)) {
            log.warn("[Model] no bundle at {}, anomaly detection disabled until training runs", path);
            return Optional.empty();
        }
        try {
            var bundle = objectMapper.readValue(path.toFile(), ModelBundle.class);
            if (!bundle.matchesCurrentSchema()) {
                log.warn("[Model] bundle at {} has format {} and columns {}, ignoring it", path,
                        bundle.formatVersion(), bundle.featureOrder());
                return Optional.empty();
            }
            log.info("[Model] bundle loaded from {} (trained {} on {} rows)", path, bundle.trainedAt(), bundle.trainingRows());
            return Optional.of(bundle);
        } catch (IOException | RuntimeException e) {
            log.warn("[Model] cannot read bundle at {}: {}", path, e.getMessage());
            return Optional.empty();
        }
    }

    private void deleteQuietly(Path tmp) {
        if (tmp == null) return;
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.debug("could not remove {}: {}", tmp, e.getMessage());
        }
    }
}
