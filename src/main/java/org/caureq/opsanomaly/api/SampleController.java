package org.caureq.opsanomaly.api;

import lombok.RequiredArgsConstructor;
import org.caureq.opsanomaly.api.dto.SamplePointDTO;
import org.caureq.opsanomaly.domain.DateRange;
import org.caureq.opsanomaly.service.SampleStore;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/** Raw samples, oldest first. */
@RestController
@RequestMapping("/api/samples")
@RequiredArgsConstructor
public class SampleController {
    private final SampleStore store;

    @GetMapping
    public List<SamplePointDTO> query(
            @RequestParam(value = "start", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
            @RequestParam(value = "end", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end
    ) {
        return store.query(DateRange.ofNullable(start, end)).stream().map(SamplePointDTO::of).toList();
    }

    @GetMapping("/count")
    public Map<String, Long> count() {
        return Map.of("count", store.count());
    }
}
