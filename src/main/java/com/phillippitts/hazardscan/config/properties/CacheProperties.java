package com.phillippitts.hazardscan.config.properties;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Result cache sizing. Entries expire {@code ttl} after creation regardless of access.
 */
@ConfigurationProperties(prefix = "hazardscan.cache")
@Validated
public class CacheProperties {

    @Positive(message = "Cache capacity must be positive")
    private int capacity = 128;

    @NotNull
    private Duration ttl = Duration.ofHours(4);

    public int getCapacity() {
        return capacity;
    }

    public void setCapacity(int capacity) {
        this.capacity = capacity;
    }

    public Duration getTtl() {
        return ttl;
    }

    public void setTtl(Duration ttl) {
        this.ttl = ttl;
    }
}
