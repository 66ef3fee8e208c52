package org.caureq.opsanomaly.repo;

import org.caureq.opsanomaly.domain.Sample;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

public interface SampleRepo extends JpaRepository<Sample, Long> {
    List<Sample> findAllByOrderByTimestampAscIdAsc();

    /** Half-open range: from inclusive, to exclusive. */
    List<Sample> findByTimestampGreaterThanEqualAndTimestampLessThanOrderByTimestampAscIdAsc(LocalDateTime from,
                                                                                          LocalDateTime to);

    Optional<Sample> findTopByOrderByTimestampDescIdDesc();
}
