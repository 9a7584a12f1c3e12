package com.phillippitts.hazardscan.service.backend;

import org.springframework.core.env.Environment;

import java.util.Objects;
import java.util.Optional;

/**
 * Reads the API key from the Spring {@link Environment} each time it is asked, so rotated keys
 * (environment variables, config server refreshes) take effect without a restart.
 */
public class EnvironmentCredentialProvider implements CredentialProvider {

    public static final String API_KEY_PROPERTY = "hazardscan.backends.cloud.api-key";

    private final Environment environment;

    public EnvironmentCredentialProvider(Environment environment) {
        this.environment = Objects.requireNonNull(environment, "environment");
    }

    @Override
    public Optional<String> currentApiKey() {
        String key = environment.getProperty(API_KEY_PROPERTY);
        return key == null || key.isBlank() ? Optional.empty() : Optional.of(key.trim());
    }
}
