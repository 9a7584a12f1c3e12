package com.phillippitts.hazardscan.service.cache;

import com.phillippitts.hazardscan.domain.AnalysisRequest;
import com.phillippitts.hazardscan.domain.WorkType;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ImageFingerprinterTest {

    private final ImageFingerprinter fingerprinter = new ImageFingerprinter("none");

    @Test
    void shouldBeStableForIdenticalInput() {
        byte[] image = {1, 2, 3, 4};

        assertThat(fingerprinter.fingerprint(image, 2, 2))
                .isEqualTo(fingerprinter.fingerprint(image.clone(), 2, 2))
                .hasSize(64);
    }

    @Test
    void shouldDifferByDimensionsAndPolicy() {
        byte[] image = {1, 2, 3, 4};

        assertThat(fingerprinter.fingerprint(image, 2, 2)).isNotEqualTo(fingerprinter.fingerprint(image, 4, 1));
        assertThat(new ImageFingerprinter("512px").fingerprint(image, 2, 2))
                .isNotEqualTo(fingerprinter.fingerprint(image, 2, 2));
    }

    @Test
    void factoryShouldAssignIncreasingIdsAndSharedKeyForSameImage() {
        AnalysisRequestFactory factory = new AnalysisRequestFactory(fingerprinter);
        byte[] image = {9, 9, 9, 9};

        AnalysisRequest first = factory.create(image, 2, 2, WorkType.PLUMBING);
        AnalysisRequest second = factory.create(image, 2, 2, WorkType.PLUMBING, "different notes");

        assertThat(second.requestId()).isGreaterThan(first.requestId());
        assertThat(second.cacheKey()).isEqualTo(first.cacheKey());
        assertThat(second.userNotes()).isEqualTo("different notes");
    }
}
