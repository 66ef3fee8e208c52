package org.caureq.opsanomaly.api;

import lombok.RequiredArgsConstructor;
import org.caureq.opsanomaly.api.dto.SamplePointDTO;
import org.caureq.opsanomaly.domain.DateRange;
import org.caureq.opsanomaly.service.ModelRegistry;
import org.caureq.opsanomaly.service.SampleStore;
import org.caureq.opsanomaly.service.ScoringService;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

/**
 * Read API for the dashboard: labelled time series, the statistics table and the latest
 * reading. Labels are -1 (anomaly) or 1 (normal); without a trained model every point is 1.
 */
@RestController
@RequestMapping("/api/anomalies")
@RequiredArgsConstructor
public class AnomalyController {
    private final ScoringService scoring;
    private final ModelRegistry registry;
    private final SampleStore store;

    @GetMapping
    public List<ScoringService.ScoredSample> scored(
            @RequestParam(value = "start", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
            @RequestParam(value = "end", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end
    ) {
        return scoring.scoreBatch(DateRange.ofNullable(start, end), registry.current());
    }

    @GetMapping("/summary")
    public ScoringService.ScoringSummary summary(
            @RequestParam(value = "start", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
            @RequestParam(value = "end", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end
    ) {
        return scoring.summarize(scoring.scoreBatch(DateRange.ofNullable(start, end), registry.current()));
    }

    @GetMapping("/latest")
    public ResponseEntity<SamplePointDTO> latest() {
        return store.latest()
                .map(SamplePointDTO::of)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }
}
