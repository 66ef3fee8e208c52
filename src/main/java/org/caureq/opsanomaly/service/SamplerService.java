package org.caureq.opsanomaly.service;

import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One probe reading appended per tick; a failed tick is logged and the schedule carries on.
 * The last cancellation check and the write share a lock with {@link #cancel()}, so once
 * cancel returns no further row is committed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SamplerService {
    private final HostMetricsProbe probe;
    private final SampleStore store;
    private final Clock clock;

    private final ReentrantLock writeLock = new ReentrantLock();
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final AtomicLong written = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicReference<LocalDateTime> lastWrite = new AtomicReference<>();

    public record SamplerStatus(boolean cancelled, long written, long failed, LocalDateTime lastWrite) {}

    @Scheduled(fixedDelayString = "${app.sampler.interval-ms:10000}")
    public void tick() {
        sampleOnce();
    }

    public Optional<Long> sampleOnce() {
        if (cancelled.get()) return Optional.empty();
        try {
            var ts = LocalDateTime.now(clock);
            var r = probe.read();
            long id;
            writeLock.lock();
            try {
                if (cancelled.get()) {
                    log.debug("[Sampler] cancelled during tick {}, reading dropped", ts);
                    return Optional.empty();
                }
                id = store.append(ts, r.cpuPercent(), r.memoryPercent(), r.diskPercent());
            } finally {
                writeLock.unlock();
            }
            written.incrementAndGet();
            lastWrite.set(ts);
            log.debug("[Sampler] #{} cpu={} mem={} disk={}", id, r.cpuPercent(), r.memoryPercent(), r.diskPercent());
            return Optional.of(id);
        } catch (SampleWriteException e) {
            failed.incrementAndGet();
            log.warn("[Sampler] write failed, will retry next tick: {}", e.getMessage());
        } catch (RuntimeException e) {
            failed.incrementAndGet();
            log.warn("[Sampler] tick failed: {}", e.getMessage(), e);
        }
        return Optional.empty();
    }

    /** Waits for a write in progress to commit. */
    @PreDestroy
    public void cancel() {
        writeLock.lock();
        try {
            if (!cancelled.getAndSet(true)) log.info("[Sampler] cancelled after {} samples", written.get());
        } finally {
            writeLock.unlock();
        }
    }

    public void resume() {
        if (cancelled.getAndSet(false)) log.info("[Sampler] resumed");
    }

    public SamplerStatus status() {
        return new SamplerStatus(cancelled.get(), written.get(), failed.get(), lastWrite.get());
    }
}
