package com.phillippitts.hazardscan.config.properties;

import com.phillippitts.hazardscan.domain.WorkType;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Acceptance and ordering policy for the backend fallback chain.
 */
@ConfigurationProperties(prefix = "hazardscan.fallback")
@Validated
public class FallbackProperties {

    /** Minimum overall confidence for a backend result to be accepted. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double confidenceThreshold = 0.7;

    /** Per-work-type overrides of {@link #confidenceThreshold}. */
    @NotNull
    private Map<WorkType, Double> thresholds = new EnumMap<>(WorkType.class);

    /** Work types that put the cloud tier first when it is available. */
    @NotNull
    private Set<WorkType> criticalWorkTypes = EnumSet.of(
            WorkType.ELECTRICAL,
            WorkType.FALL_PROTECTION,
            WorkType.CRANE_OPERATIONS,
            WorkType.EXCAVATION,
            WorkType.SCAFFOLDING,
            WorkType.STEEL_ERECTION);

    /** Whether the cloud tier may be used over a metered connection. */
    private boolean allowMeteredCloud = true;

    public double thresholdFor(WorkType workType) {
        Double override = thresholds.get(workType);
        return override != null ? override : confidenceThreshold;
    }

    public boolean isCritical(WorkType workType) {
        return criticalWorkTypes.contains(workType);
    }

    public double getConfidenceThreshold() {
        return confidenceThreshold;
    }

    public void setConfidenceThreshold(double confidenceThreshold) {
        this.confidenceThreshold = confidenceThreshold;
    }

    public Map<WorkType, Double> getThresholds() {
        return thresholds;
    }

    public void setThresholds(Map<WorkType, Double> thresholds) {
        this.thresholds = thresholds;
    }

    public Set<WorkType> getCriticalWorkTypes() {
        return criticalWorkTypes;
    }

    public void setCriticalWorkTypes(Set<WorkType> criticalWorkTypes) {
        this.criticalWorkTypes = criticalWorkTypes;
    }

    public boolean isAllowMeteredCloud() {
        return allowMeteredCloud;
    }

    public void setAllowMeteredCloud(boolean allowMeteredCloud) {
        this.allowMeteredCloud = allowMeteredCloud;
    }
}
