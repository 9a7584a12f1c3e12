package com.phillippitts.hazardscan.service.backend;

import java.nio.file.Path;
import java.util.Objects;

/**
 * On-device model file and the digest it is pinned to.
 *
 * @param path model file location
 * @param expectedSha256 hex SHA-256, or blank when the artifact is not pinned
 */
public record ModelArtifact(Path path, String expectedSha256) {

    public ModelArtifact {
        Objects.requireNonNull(path, "path");
        expectedSha256 = expectedSha256 == null ? "" : expectedSha256.trim();
    }

    public boolean isPinned() {
        return !expectedSha256.isEmpty();
    }
}
