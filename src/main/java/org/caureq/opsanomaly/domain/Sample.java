package org.caureq.opsanomaly.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * One row per collection tick. Append-only: there are no setters and no update path.
 * A null metric means the collector failed to read it, it is never stored as 0.
 */
@Entity
@Table(name = "system_stats", indexes = {
        @Index(name = "idx_stats_ts", columnList = "timestamp")
})
@Getter @NoArgsConstructor(access = AccessLevel.PROTECTED) @AllArgsConstructor @Builder
@ToString
public class Sample {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "timestamp", nullable = false)
    private LocalDateTime timestamp;

    @Column(name = "cpu_percent")
    private Double cpuPercent;      // %

    @Column(name = "memory_percent")
    private Double memoryPercent;   // %

    @Column(name = "disk_percent")
    private Double diskPercent;     // % used
}
