package org.caureq.opsanomaly.api;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.caureq.opsanomaly.api.dto.IngestDTO;
import org.caureq.opsanomaly.service.SampleStore;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Map;

/** Append endpoint for collectors running outside this process. */
@RestController
@RequestMapping("/api/ingest")
@RequiredArgsConstructor
public class IngestController {
    private final SampleStore store;
    private final Clock clock;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Map<String, Long> ingest(@Valid @RequestBody IngestDTO body) {
        var ts = body.timestamp() == null ? LocalDateTime.now(clock) : body.timestamp();
        long id = store.append(ts, body.cpuPercent(), body.memoryPercent(), body.diskPercent());
        return Map.of("id", id);
    }
}
