package com.phillippitts.hazardscan.service.strategy;

import com.phillippitts.hazardscan.config.properties.FallbackProperties;
import com.phillippitts.hazardscan.domain.AnalysisRequest;
import com.phillippitts.hazardscan.domain.BackendDescriptor;
import com.phillippitts.hazardscan.domain.BackendTier;
import com.phillippitts.hazardscan.domain.BudgetState;
import com.phillippitts.hazardscan.domain.DeviceState;
import com.phillippitts.hazardscan.domain.NetworkReachability;
import com.phillippitts.hazardscan.domain.ThermalLevel;
import com.phillippitts.hazardscan.service.backend.BackendRegistry;
import com.phillippitts.hazardscan.service.backend.InferenceBackend;
import com.phillippitts.hazardscan.service.cache.CacheOutcome;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Decides which backends may process a request and in what order.
 *
 * <p><b>Selection Algorithm</b> (rules remove candidates, then order the rest):
 * <ol>
 *   <li>Cloud is excluded when the budget cannot afford its call, when the network is
 *       unreachable, or when it is metered and metered cloud use is disabled.</li>
 *   <li>LOCAL_LARGE is excluded when thermal level is SERIOUS or worse. Any non-emergency tier
 *       is excluded when it needs more memory than available or an accelerator that is absent.
 *       Tiers disabled in the registry are never offered.</li>
 *   <li>For a critical work type with cloud still available, cloud goes first. Otherwise the
 *       best remaining local tier goes first (LOCAL_LARGE, else LOCAL_SMALL). The rest follow
 *       by accuracy class, higher first, ties broken by tier rank.</li>
 *   <li>EMERGENCY is always last.</li>
 * </ol>
 *
 * <p>A cache hit needs no backend, so the plan for {@link CacheOutcome#HIT} is empty.
 *
 * <p><b>Thread Safety:</b> stateless apart from immutable collaborators; safe for concurrent use.
 */
public final class StrategySelector {
    private static final Logger LOG = LogManager.getLogger(StrategySelector.class);

    private static final Comparator<InferenceBackend> BY_ACCURACY_THEN_RANK =
            Comparator.<InferenceBackend, Integer>comparing(b -> b.descriptor().accuracyClass().ordinal())
                    .reversed()
                    .thenComparing(b -> b.tier().ordinal());

    private final BackendRegistry registry;
    private final FallbackProperties props;

    public StrategySelector(BackendRegistry registry, FallbackProperties props) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.props = Objects.requireNonNull(props, "props");
    }

    /**
     * Produces the ordered backend chain for one request.
     *
     * @return backends in attempt order; never null, possibly empty
     */
    public List<InferenceBackend> selectOrder(AnalysisRequest request,
                                              DeviceState device,
                                              BudgetState budget,
                                              CacheOutcome cacheOutcome) {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(device, "device");
        Objects.requireNonNull(budget, "budget");
        if (cacheOutcome == CacheOutcome.HIT) {
            return List.of();
        }

        Map<BackendTier, String> excluded = new EnumMap<>(BackendTier.class);
        List<InferenceBackend> candidates = new ArrayList<>();
        InferenceBackend emergency = null;
        for (InferenceBackend backend : registry.enabled()) {
            if (backend.tier() == BackendTier.EMERGENCY) {
                emergency = backend;
                continue;
            }
            String reason = exclusionReason(backend.descriptor(), device, budget);
            if (reason != null) {
                excluded.put(backend.tier(), reason);
            } else {
                candidates.add(backend);
            }
        }

        List<InferenceBackend> order = new ArrayList<>(candidates.size() + 1);
        InferenceBackend head = pickHead(request, candidates);
        if (head != null) {
            order.add(head);
            candidates.remove(head);
        }
        candidates.sort(BY_ACCURACY_THEN_RANK);
        order.addAll(candidates);
        if (emergency != null) {
            order.add(emergency);
        }

        if (LOG.isDebugEnabled()) {
            LOG.debug("Request {} ({}): order={}, excluded={}", request.requestId(), request.workType(),
                    order.stream().map(b -> b.tier().label()).toList(), excluded);
        }
        return List.copyOf(order);
    }

    /**
     * Returns why {@code d} cannot run under current conditions, or {@code null} if it can.
     */
    String exclusionReason(BackendDescriptor d, DeviceState device, BudgetState budget) {
        if (d.tier() == BackendTier.CLOUD) {
            if (!device.network().isReachable()) {
                return "offline";
            }
            if (!budget.canAfford(d.costPerCall())) {
                return "budget";
            }
            if (device.network() == NetworkReachability.METERED && !props.isAllowMeteredCloud()) {
                return "metered network";
            }
        }
        if (d.needsNetwork() && !device.network().isReachable()) {
            return "offline";
        }
        if (d.tier() == BackendTier.LOCAL_LARGE && device.thermalLevel().isAtLeast(ThermalLevel.SERIOUS)) {
            return "thermal " + device.thermalLevel();
        }
        if (d.tier().isLocal()) {
            if (d.minMemoryMb() > device.availableMemoryMb()) {
                return "memory " + device.availableMemoryMb() + "MB < " + d.minMemoryMb() + "MB";
            }
            if (d.needsAccelerator() && !device.acceleratorAvailable()) {
                return "no accelerator";
            }
        }
        return null;
    }

    private InferenceBackend pickHead(AnalysisRequest request, List<InferenceBackend> candidates) {
        if (props.isCritical(request.workType())) {
            for (InferenceBackend b : candidates) {
                if (b.tier() == BackendTier.CLOUD) {
                    return b;
                }
            }
        }
        return candidates.stream()
                .filter(b -> b.tier().isLocal())
                .min(Comparator.comparing(b -> b.tier().ordinal()))
                .orElse(null);
    }
}
