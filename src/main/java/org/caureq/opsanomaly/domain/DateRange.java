package org.caureq.opsanomaly.domain;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Calendar-day filter. Both days are included: the range covers
 * {@code [start 00:00, end + 1 day 00:00)}.
 */
public record DateRange(LocalDate start, LocalDate end) {

    public DateRange {
        if (start == null || end == null) throw new IllegalArgumentException("start and end are required");
        if (end.isBefore(start)) throw new IllegalArgumentException("end " + end + " is before start " + start);
    }

    /** A filter only when both days are given; otherwise no filter at all. */
    public static Optional<DateRange> ofNullable(LocalDate start, LocalDate end) {
        return start != null && end != null ? Optional.of(new DateRange(start, end)) : Optional.empty();
    }

    public LocalDateTime fromInclusive() { return start.atStartOfDay(); }

    public LocalDateTime toExclusive() { return end.plusDays(1).atStartOfDay(); }
}
