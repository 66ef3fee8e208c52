package org.caureq.opsanomaly.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SamplerServiceTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2025, 3, 10, 9, 30);

    @Mock
    private HostMetricsProbe probe;
    @Mock
    private SampleStore store;

    private SamplerService sampler;

    @BeforeEach
    void setUp() {
        var clock = Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        sampler = new SamplerService(probe, store, clock);
    }

    @Test
    void tickAppendsOneReading() {
        when(probe.read()).thenReturn(new HostMetricsProbe.Reading(12.5, 40.0, 71.2));
        when(store.append(NOW, 12.5, 40.0, 71.2)).thenReturn(7L);

        assertThat(sampler.sampleOnce()).contains(7L);
        assertThat(sampler.status().written()).isEqualTo(1);
        assertThat(sampler.status().lastWrite()).isEqualTo(NOW);
    }

    @Test
    void unreadableMetricIsWrittenAsAbsent() {
        when(probe.read()).thenReturn(new HostMetricsProbe.Reading(12.5, null, 71.2));
        when(store.append(eq(NOW), eq(12.5), isNull(), eq(71.2))).thenReturn(1L);

        assertThat(sampler.sampleOnce()).contains(1L);
    }

    @Test
    void writeFailureIsCountedAndTheNextTickStillRuns() {
        when(probe.read()).thenReturn(new HostMetricsProbe.Reading(10.0, 20.0, 30.0));
        when(store.append(any(), any(), any(), any()))
                .thenThrow(new SampleWriteException("database is locked"))
                .thenReturn(2L);

        sampler.tick();
        assertThat(sampler.status().failed()).isEqualTo(1);

        assertThat(sampler.sampleOnce()).contains(2L);
        assertThat(sampler.status().written()).isEqualTo(1);
    }

    @Test
    void probeFailureDoesNotEscapeTheTick() {
        when(probe.read()).thenThrow(new IllegalStateException("no /proc"));

        sampler.tick();

        assertThat(sampler.status().failed()).isEqualTo(1);
        verifyNoInteractions(store);
    }

    @Test
    void cancelledSamplerNeitherProbesNorWrites() {
        sampler.cancel();

        assertThat(sampler.sampleOnce()).isEmpty();
        assertThat(sampler.status().cancelled()).isTrue();
        verifyNoInteractions(probe, store);
    }

    @Test
    void cancellationDuringTheProbeDropsTheReading() {
        when(probe.read()).thenAnswer(inv -> {
            sampler.cancel();
            return new HostMetricsProbe.Reading(10.0, 20.0, 30.0);
        });

        assertThat(sampler.sampleOnce()).isEmpty();
        verifyNoInteractions(store);
        assertThat(sampler.status().written()).isZero();
    }

    @Test
    void cancelDuringTheWriteWaitsForTheCommit() throws Exception {
        when(probe.read()).thenReturn(new HostMetricsProbe.Reading(10.0, 20.0, 30.0));
        var canceller = new Thread(sampler::cancel);
        when(store.append(any(), any(), any(), any())).thenAnswer(inv -> {
            canceller.start();
            long deadline = System.nanoTime() + 5_000_000_000L;
            while (canceller.getState() != Thread.State.WAITING && System.nanoTime() < deadline) {
                Thread.onSpinWait();
            }
            assertThat(canceller.getState()).isEqualTo(Thread.State.WAITING);
            assertThat(sampler.status().cancelled()).isFalse();
            return 5L;
        });

        assertThat(sampler.sampleOnce()).contains(5L);
        canceller.join(5_000);

        assertThat(sampler.status().cancelled()).isTrue();
        assertThat(sampler.status().written()).isEqualTo(1);
        assertThat(sampler.sampleOnce()).isEmpty();
        verify(store, times(1)).append(any(), any(), any(), any());
    }

    @Test
    void resumeRestartsCollection() {
        when(probe.read()).thenReturn(new HostMetricsProbe.Reading(1.0, 2.0, 3.0));
        when(store.append(any(), any(), any(), any())).thenReturn(3L);
        sampler.cancel();
        sampler.resume();

        assertThat(sampler.sampleOnce()).contains(3L);
        assertThat(sampler.status().cancelled()).isFalse();
    }
}
