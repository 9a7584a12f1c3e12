package com.phillippitts.hazardscan.domain;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable hazard analysis request for one captured image.
 *
 * <p>The image bytes are copied on the way in and on the way out so no caller can mutate a
 * request after its fingerprint was computed. Instances are normally created by
 * {@link com.phillippitts.hazardscan.service.cache.AnalysisRequestFactory}.
 *
 * @param requestId monotonic id, unique within the process
 * @param imageBytes encoded image (JPEG/PNG) or raw pixel buffer
 * @param width declared width in pixels
 * @param height declared height in pixels
 * @param workType kind of work shown in the image
 * @param fingerprint stable hash of the pixel content and resize policy
 * @param userNotes free text typed by the user, may be interpolated into a cloud prompt; may be null
 */
public record AnalysisRequest(
        long requestId,
        byte[] imageBytes,
        int width,
        int height,
        WorkType workType,
        String fingerprint,
        String userNotes
) {
    public AnalysisRequest {
        Objects.requireNonNull(imageBytes, "imageBytes");
        imageBytes = imageBytes.clone();
        Objects.requireNonNull(workType, "workType");
        Objects.requireNonNull(fingerprint, "fingerprint");
        if (fingerprint.isBlank()) {
            throw new IllegalArgumentException("fingerprint must not be blank");
        }
    }

    @Override
    public byte[] imageBytes() {
        return imageBytes.clone();
    }

    /** Size of the payload without copying it. */
    public int byteSize() {
        return imageBytes.length;
    }

    public CacheKey cacheKey() {
        return new CacheKey(fingerprint, workType);
    }

    /**
     * Returns a copy of this request carrying different user notes. Id and fingerprint are kept.
     */
    public AnalysisRequest withUserNotes(String notes) {
        return new AnalysisRequest(requestId, imageBytes, width, height, workType, fingerprint, notes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AnalysisRequest other)) {
            return false;
        }
        return requestId == other.requestId
                && width == other.width
                && height == other.height
                && workType == other.workType
                && fingerprint.equals(other.fingerprint)
                && Objects.equals(userNotes, other.userNotes)
                && Arrays.equals(imageBytes, other.imageBytes);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(requestId, width, height, workType, fingerprint, userNotes);
        return 31 * result + Arrays.hashCode(imageBytes);
    }

    @Override
    public String toString() {
        return "AnalysisRequest[id=" + requestId + ", bytes=" + imageBytes.length + ", " + width + "x" + height
                + ", workType=" + workType + ", fingerprint=" + fingerprint + "]";
    }
}
