package org.caureq.opsanomaly.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.opsanomaly.domain.DateRange;
import org.caureq.opsanomaly.domain.Sample;
import org.caureq.opsanomaly.repo.SampleRepo;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class SampleStore {
    private final SampleRepo repo;

    /**
     * @return the id assigned to the new row
     * @throws SampleWriteException if the sample is invalid or the insert failed; the row is rolled back
     */
    @Transactional
    public long append(LocalDateTime timestamp, Double cpuPercent, Double memoryPercent, Double diskPercent) {
        if (timestamp == null) throw new SampleWriteException("timestamp is required");
        check("cpu_percent", cpuPercent);
        check("memory_percent", memoryPercent);
        check("disk_percent", diskPercent);

        var sample = Sample.builder()
                .timestamp(timestamp)
                .cpuPercent(cpuPercent)
                .memoryPercent(memoryPercent)
                .diskPercent(diskPercent)
                .build();
        try {
            var saved = repo.saveAndFlush(sample);
            log.debug("appended #{} at {} cpu={} mem={} disk={}", saved.getId(), timestamp, cpuPercent, memoryPercent, diskPercent);
            return saved.getId();
        } catch (DataAccessException e) {
            throw new SampleWriteException("insert failed: " + e.getMostSpecificCause().getMessage(), e);
        }
    }

    @Transactional(readOnly = true)
    public List<Sample> query(Optional<DateRange> range) {
        try {
            return range
                    .map(r -> repo.findByTimestampGreaterThanEqualAndTimestampLessThanOrderByTimestampAscIdAsc(
                            r.fromInclusive(), r.toExclusive()))
                    .orElseGet(repo::findAllByOrderByTimestampAscIdAsc);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("sample store unreadable: " + e.getMostSpecificCause().getMessage(), e);
        }
    }

    public List<Sample> queryAll() {
        return query(Optional.empty());
    }

    @Transactional(readOnly = true)
    public Optional<Sample> latest() {
        return repo.findTopByOrderByTimestampDescIdDesc();
    }

    @Transactional(readOnly = true)
    public long count() {
        return repo.count();
    }

    private static void check(String column, Double v) {
        if (v == null) return;
        if (v.isNaN() || v.isInfinite() || v < 0.0 || v > 100.0) {
            throw new SampleWriteException(column + " must be absent or within [0, 100], got " + v);
        }
    }
}
