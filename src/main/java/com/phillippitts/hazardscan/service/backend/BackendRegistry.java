package com.phillippitts.hazardscan.service.backend;

import com.phillippitts.hazardscan.domain.BackendTier;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registered backends by tier, and the set of tiers permanently disabled for this process.
 *
 * <p>A tier is disabled after a model integrity violation; it stays registered (so health
 * reporting can see it) but is never offered to strategy selection again.
 */
public class BackendRegistry {
    private static final Logger LOG = LogManager.getLogger(BackendRegistry.class);

    private final Map<BackendTier, InferenceBackend> backends;
    private final Map<BackendTier, String> disabled = new ConcurrentHashMap<>();

    public BackendRegistry(Collection<? extends InferenceBackend> backends) {
        Map<BackendTier, InferenceBackend> byTier = new EnumMap<>(BackendTier.class);
        for (InferenceBackend backend : backends) {
            InferenceBackend previous = byTier.put(backend.tier(), backend);
            if (previous != null) {
                throw new IllegalArgumentException("Duplicate backend for tier " + backend.tier());
            }
        }
        this.backends = Collections.unmodifiableMap(byTier);
    }

    public Optional<InferenceBackend> find(BackendTier tier) {
        return Optional.ofNullable(backends.get(tier));
    }

    /** All registered backends in tier rank order, disabled ones included. */
    public List<InferenceBackend> all() {
        return List.copyOf(backends.values());
    }

    /** Registered backends that have not been disabled, in tier rank order. */
    public List<InferenceBackend> enabled() {
        return backends.values().stream()
                .filter(b -> !disabled.containsKey(b.tier()))
                .toList();
    }

    public void disable(BackendTier tier, String reason) {
        if (disabled.putIfAbsent(tier, reason) == null) {
            LOG.error("Backend tier {} permanently disabled: {}", tier.label(), reason);
        }
    }

    public boolean isDisabled(BackendTier tier) {
        return disabled.containsKey(tier);
    }

    public Optional<String> disabledReason(BackendTier tier) {
        return Optional.ofNullable(disabled.get(tier));
    }

    /** Initializes every backend; a backend that fails to initialize is disabled. */
    public void initializeAll() {
        for (InferenceBackend backend : backends.values()) {
            try {
                backend.initialize();
            } catch (RuntimeException e) {
                disable(backend.tier(), "initialization failed: " + e.getMessage());
            }
        }
    }

    public void closeAll() {
        backends.values().forEach(InferenceBackend::close);
    }
}
