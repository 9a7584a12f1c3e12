package com.phillippitts.hazardscan.service.validation;

import com.phillippitts.hazardscan.domain.BackendTier;
import com.phillippitts.hazardscan.exception.ModelIntegrityViolationException;
import com.phillippitts.hazardscan.service.backend.ModelArtifact;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.EnumSet;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Set;

/**
 * Verifies on-device model artifacts against pinned SHA-256 digests.
 *
 * <p>Each tier is hashed at most once per process: a verified tier is remembered and skipped on
 * later calls. Artifacts without a pinned digest are accepted without hashing.
 */
public class ModelIntegrityVerifier {
    private static final Logger LOG = LogManager.getLogger(ModelIntegrityVerifier.class);

    private static final int BUFFER_SIZE = 64 * 1024;

    private final Set<BackendTier> verified = EnumSet.noneOf(BackendTier.class);

    /**
     * Verifies the artifact for {@code tier} unless it was already verified.
     *
     * @throws ModelIntegrityViolationException if the artifact is unreadable or its digest differs
     */
    public synchronized void verifyOnce(BackendTier tier, ModelArtifact artifact) {
        if (verified.contains(tier)) {
            return;
        }
        if (!artifact.isPinned()) {
            LOG.debug("No pinned digest for {} model; skipping integrity check", tier.label());
            verified.add(tier);
            return;
        }
        String actual = sha256(tier, artifact.path());
        if (!actual.equalsIgnoreCase(artifact.expectedSha256())) {
            throw new ModelIntegrityViolationException(tier, artifact.path().toString(),
                    "digest mismatch (expected " + abbreviate(artifact.expectedSha256())
                            + ", actual " + abbreviate(actual) + ")");
        }
        verified.add(tier);
        LOG.info("Verified {} model integrity ({})", tier.label(), abbreviate(actual));
    }

    public synchronized boolean isVerified(BackendTier tier) {
        return verified.contains(tier);
    }

    static String sha256(BackendTier tier, Path path) {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
        try (InputStream in = Files.newInputStream(path)) {
            byte[] buffer = new byte[BUFFER_SIZE];
            int read;
            while ((read = in.read(buffer)) != -1) {
                digest.update(buffer, 0, read);
            }
        } catch (IOException e) {
            throw new ModelIntegrityViolationException(tier, path.toString(),
                    "artifact unreadable: " + e.getMessage(), e);
        }
        return HexFormat.of().formatHex(digest.digest()).toLowerCase(Locale.ROOT);
    }

    private static String abbreviate(String hex) {
        return hex.length() <= 12 ? hex : hex.substring(0, 12) + "...";
    }
}
