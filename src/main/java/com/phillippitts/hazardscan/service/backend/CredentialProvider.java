package com.phillippitts.hazardscan.service.backend;

import java.util.Optional;

/**
 * Supplies the cloud API key. Queried on every cloud call; callers must not retain the value.
 */
@FunctionalInterface
public interface CredentialProvider {

    /** Current API key, or empty when no credential is configured. */
    Optional<String> currentApiKey();
}
