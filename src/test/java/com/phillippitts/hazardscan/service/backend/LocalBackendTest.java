package com.phillippitts.hazardscan.service.backend;

import com.phillippitts.hazardscan.domain.AccuracyClass;
import com.phillippitts.hazardscan.domain.BackendDescriptor;
import com.phillippitts.hazardscan.domain.BackendTier;
import com.phillippitts.hazardscan.domain.WorkType;
import com.phillippitts.hazardscan.exception.BackendException;
import com.phillippitts.hazardscan.testutil.Images;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LocalBackendTest {

    private static BackendDescriptor small() {
        return new BackendDescriptor(BackendTier.LOCAL_SMALL, AccuracyClass.STANDARD, BigDecimal.ZERO,
                Duration.ofSeconds(3), 256, false, false);
    }

    @Test
    void shouldHoldAcceleratorPermitWhileRunning() {
        ConcurrencyGuard guard = new ConcurrencyGuard(1, Duration.ofMillis(50), "accelerator");
        AtomicInteger permitsDuringRun = new AtomicInteger(-1);
        LocalModelRunner runner = (tier, artifact, request) -> {
            permitsDuringRun.set(guard.availablePermits());
            return BackendResponse.of(List.of(), 0.75);
        };
        LocalBackend backend = new LocalBackend(small(), runner, guard, null);
        backend.initialize();

        BackendResponse response = backend.analyze(Images.request(WorkType.PLUMBING, "fp"));

        assertThat(response.confidence()).isEqualTo(0.75);
        assertThat(permitsDuringRun.get()).isZero();
        assertThat(guard.availablePermits()).isEqualTo(1);
    }

    @Test
    void shouldExposeConfiguredArtifact() {
        ModelArtifact artifact = new ModelArtifact(Path.of("/models/small.bin"), "abc");
        LocalBackend backend = new LocalBackend(small(), new UnavailableLocalModelRunner(),
                new ConcurrencyGuard(1, Duration.ofMillis(50), "accelerator"), artifact);

        assertThat(backend.modelArtifact()).contains(artifact);
    }

    @Test
    void shouldFailWhenNoRuntimeInstalled() {
        LocalBackend backend = new LocalBackend(small(), new UnavailableLocalModelRunner(),
                new ConcurrencyGuard(1, Duration.ofMillis(50), "accelerator"), null);
        backend.initialize();

        assertThatThrownBy(() -> backend.analyze(Images.request(WorkType.PLUMBING, "fp")))
                .isInstanceOf(BackendException.class)
                .hasMessageContaining("No on-device inference runtime");
    }

    @Test
    void shouldRejectNonLocalTier() {
        BackendDescriptor emergency = new BackendDescriptor(BackendTier.EMERGENCY, AccuracyClass.BASIC,
                BigDecimal.ZERO, Duration.ofSeconds(1), 0, false, false);

        assertThatThrownBy(() -> new LocalBackend(emergency, new UnavailableLocalModelRunner(),
                new ConcurrencyGuard(1, Duration.ofMillis(50), "accelerator"), null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
