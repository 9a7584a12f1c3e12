package com.phillippitts.hazardscan.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Security validation thresholds for incoming images and cloud prompt notes.
 *
 * <p>Note: Bean created via {@link com.phillippitts.hazardscan.HazardScanApplication}.
 */
@ConfigurationProperties(prefix = "hazardscan.validation")
@Validated
public class ValidationProperties {

    /** Maximum image payload in bytes (guard against memory exhaustion). Default: 50 MB. */
    @Positive(message = "Maximum image size must be positive")
    private long maxImageBytes = 50L * 1024 * 1024;

    @Positive(message = "Minimum dimension must be positive")
    private int minDimension = 32;

    @Positive(message = "Maximum dimension must be positive")
    private int maxDimension = 8192;

    /** Reject images whose byte histogram is dominated by very few values. */
    private boolean adversarialDetectionEnabled = false;

    /** Share of the most frequent byte value above which an image is treated as adversarial. */
    @DecimalMin("0.1")
    @DecimalMax("1.0")
    private double adversarialConcentrationThreshold = 0.95;

    /** Maximum length of user notes after sanitization. */
    @Positive(message = "Maximum notes length must be positive")
    private int maxNotesLength = 500;

    public long getMaxImageBytes() {
        return maxImageBytes;
    }

    public void setMaxImageBytes(long maxImageBytes) {
        this.maxImageBytes = maxImageBytes;
    }

    public int getMinDimension() {
        return minDimension;
    }

    public void setMinDimension(int minDimension) {
        this.minDimension = minDimension;
    }

    public int getMaxDimension() {
        return maxDimension;
    }

    public void setMaxDimension(int maxDimension) {
        this.maxDimension = maxDimension;
    }

    public boolean isAdversarialDetectionEnabled() {
        return adversarialDetectionEnabled;
    }

    public void setAdversarialDetectionEnabled(boolean adversarialDetectionEnabled) {
        this.adversarialDetectionEnabled = adversarialDetectionEnabled;
    }

    public double getAdversarialConcentrationThreshold() {
        return adversarialConcentrationThreshold;
    }

    public void setAdversarialConcentrationThreshold(double adversarialConcentrationThreshold) {
        this.adversarialConcentrationThreshold = adversarialConcentrationThreshold;
    }

    public int getMaxNotesLength() {
        return maxNotesLength;
    }

    public void setMaxNotesLength(int maxNotesLength) {
        this.maxNotesLength = maxNotesLength;
    }
}
