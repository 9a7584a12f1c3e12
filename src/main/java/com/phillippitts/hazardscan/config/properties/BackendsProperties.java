package com.phillippitts.hazardscan.config.properties;

import com.phillippitts.hazardscan.domain.AccuracyClass;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Declared contracts of the inference backends.
 *
 * <p>{@code maxLatency} doubles as the per-attempt timeout applied by the fallback coordinator.
 */
@ConfigurationProperties(prefix = "hazardscan.backends")
@Validated
public class BackendsProperties {

    @Valid
    private Cloud cloud = new Cloud();

    @Valid
    private Local localLarge = Local.large();

    @Valid
    private Local localSmall = Local.small();

    @Valid
    private Emergency emergency = new Emergency();

    @Valid
    private Accelerator accelerator = new Accelerator();

    public Cloud getCloud() {
        return cloud;
    }

    public void setCloud(Cloud cloud) {
        this.cloud = cloud;
    }

    public Local getLocalLarge() {
        return localLarge;
    }

    public void setLocalLarge(Local localLarge) {
        this.localLarge = localLarge;
    }

    public Local getLocalSmall() {
        return localSmall;
    }

    public void setLocalSmall(Local localSmall) {
        this.localSmall = localSmall;
    }

    public Emergency getEmergency() {
        return emergency;
    }

    public void setEmergency(Emergency emergency) {
        this.emergency = emergency;
    }

    public Accelerator getAccelerator() {
        return accelerator;
    }

    public void setAccelerator(Accelerator accelerator) {
        this.accelerator = accelerator;
    }

    /**
     * Cloud vision service.
     */
    public static class Cloud {
        private boolean enabled = true;

        @NotBlank
        private String endpoint = "https://vision.example.invalid/v1/analyze";

        @NotNull
        @DecimalMin("0.00")
        private BigDecimal costPerCall = new BigDecimal("0.05");

        @NotNull
        private Duration maxLatency = Duration.ofSeconds(10);

        @NotNull
        private AccuracyClass accuracyClass = AccuracyClass.PREMIUM;

        /** Concurrent in-flight cloud requests allowed. */
        @Positive
        private int maxConcurrentRequests = 4;

        /** How long a caller waits for a cloud permit before the attempt fails. */
        @NotNull
        private Duration permitTimeout = Duration.ofSeconds(2);

        /** Prompt template; {@code {workType}} and {@code {notes}} are substituted. */
        @NotBlank
        private String promptTemplate = "Identify construction safety hazards for {workType} work. "
                + "Return JSON with hazards, confidence and severity. Site notes: {notes}";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public BigDecimal getCostPerCall() {
            return costPerCall;
        }

        public void setCostPerCall(BigDecimal costPerCall) {
            this.costPerCall = costPerCall;
        }

        public Duration getMaxLatency() {
            return maxLatency;
        }

        public void setMaxLatency(Duration maxLatency) {
            this.maxLatency = maxLatency;
        }

        public AccuracyClass getAccuracyClass() {
            return accuracyClass;
        }

        public void setAccuracyClass(AccuracyClass accuracyClass) {
            this.accuracyClass = accuracyClass;
        }

        public int getMaxConcurrentRequests() {
            return maxConcurrentRequests;
        }

        public void setMaxConcurrentRequests(int maxConcurrentRequests) {
            this.maxConcurrentRequests = maxConcurrentRequests;
        }

        public Duration getPermitTimeout() {
            return permitTimeout;
        }

        public void setPermitTimeout(Duration permitTimeout) {
            this.permitTimeout = permitTimeout;
        }

        public String getPromptTemplate() {
            return promptTemplate;
        }

        public void setPromptTemplate(String promptTemplate) {
            this.promptTemplate = promptTemplate;
        }
    }

    /**
     * On-device detector tier. An empty {@code expectedSha256} skips integrity pinning.
     */
    public static class Local {
        private boolean enabled = true;

        private String modelPath = "";

        private String expectedSha256 = "";

        @NotNull
        private AccuracyClass accuracyClass = AccuracyClass.STANDARD;

        @NotNull
        private Duration maxLatency = Duration.ofSeconds(3);

        @Min(0)
        private long minMemoryMb = 256;

        private boolean needsAccelerator = false;

        static Local large() {
            Local l = new Local();
            l.accuracyClass = AccuracyClass.HIGH;
            l.maxLatency = Duration.ofSeconds(5);
            l.minMemoryMb = 1024;
            l.needsAccelerator = true;
            return l;
        }

        static Local small() {
            return new Local();
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getModelPath() {
            return modelPath;
        }

        public void setModelPath(String modelPath) {
            this.modelPath = modelPath;
        }

        public String getExpectedSha256() {
            return expectedSha256;
        }

        public void setExpectedSha256(String expectedSha256) {
            this.expectedSha256 = expectedSha256;
        }

        public AccuracyClass getAccuracyClass() {
            return accuracyClass;
        }

        public void setAccuracyClass(AccuracyClass accuracyClass) {
            this.accuracyClass = accuracyClass;
        }

        public Duration getMaxLatency() {
            return maxLatency;
        }

        public void setMaxLatency(Duration maxLatency) {
            this.maxLatency = maxLatency;
        }

        public long getMinMemoryMb() {
            return minMemoryMb;
        }

        public void setMinMemoryMb(long minMemoryMb) {
            this.minMemoryMb = minMemoryMb;
        }

        public boolean isNeedsAccelerator() {
            return needsAccelerator;
        }

        public void setNeedsAccelerator(boolean needsAccelerator) {
            this.needsAccelerator = needsAccelerator;
        }
    }

    /**
     * Dependency-free heuristic detector, always last in the chain.
     */
    public static class Emergency {
        @NotNull
        private Duration maxLatency = Duration.ofSeconds(1);

        /** Factor applied to heuristic confidences to mark them as limited analysis. */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double confidenceScale = 0.7;

        public Duration getMaxLatency() {
            return maxLatency;
        }

        public void setMaxLatency(Duration maxLatency) {
            this.maxLatency = maxLatency;
        }

        public double getConfidenceScale() {
            return confidenceScale;
        }

        public void setConfidenceScale(double confidenceScale) {
            this.confidenceScale = confidenceScale;
        }
    }

    /**
     * Shared accelerator gate; one permit means one local inference at a time.
     */
    public static class Accelerator {
        @Positive
        private int permits = 1;

        @NotNull
        private Duration permitTimeout = Duration.ofSeconds(5);

        public int getPermits() {
            return permits;
        }

        public void setPermits(int permits) {
            this.permits = permits;
        }

        public Duration getPermitTimeout() {
            return permitTimeout;
        }

        public void setPermitTimeout(Duration permitTimeout) {
            this.permitTimeout = permitTimeout;
        }
    }
}
