package com.phillippitts.hazardscan.service.backend;

import com.phillippitts.hazardscan.domain.AnalysisRequest;
import com.phillippitts.hazardscan.domain.BackendDescriptor;
import com.phillippitts.hazardscan.domain.BackendTier;
import com.phillippitts.hazardscan.domain.BoundingBox;
import com.phillippitts.hazardscan.domain.DetectedHazard;
import com.phillippitts.hazardscan.domain.HazardType;
import com.phillippitts.hazardscan.domain.Severity;
import com.phillippitts.hazardscan.domain.WorkType;
import com.phillippitts.hazardscan.service.validation.ImageFormatInspector;

import javax.imageio.ImageIO;
import javax.imageio.ImageReadParam;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Last-resort detector with no model and no network.
 *
 * <p>Measures mean luminance and contrast of the image and reports generic hazards: poor
 * visibility when the scene is too dark or too flat, plus the dominant hazard of the work type
 * so a reviewer knows what to look for. All confidences are scaled by a configured factor so
 * results are always marked as limited analysis.
 */
public class EmergencyBackend extends AbstractInferenceBackend {

    public static final String NOTICE_LIMITED = "Limited analysis: emergency heuristic detector used";
    public static final String NOTICE_REVIEW = "Manual review recommended";

    static final double DARK_LUMINANCE = 0.25;
    static final double LOW_CONTRAST = 0.08;
    private static final double WORK_TYPE_BASE_CONFIDENCE = 0.6;
    private static final double VISIBILITY_BASE_CONFIDENCE = 0.8;
    static final int MAX_SAMPLES = 65_536;
    static final int MAX_DECODE_DIMENSION = 65_535;

    private final double confidenceScale;

    public EmergencyBackend(BackendDescriptor descriptor, double confidenceScale) {
        super(descriptor);
        if (descriptor.tier() != BackendTier.EMERGENCY) {
            throw new IllegalArgumentException("EmergencyBackend requires the EMERGENCY tier, got: "
                    + descriptor.tier());
        }
        if (confidenceScale < 0.0 || confidenceScale > 1.0) {
            throw new IllegalArgumentException("confidenceScale must be between 0.0 and 1.0, got: "
                    + confidenceScale);
        }
        this.confidenceScale = confidenceScale;
    }

    @Override
    protected BackendResponse doAnalyze(AnalysisRequest request) throws IOException {
        LuminanceStats stats = measure(request);

        List<DetectedHazard> hazards = new ArrayList<>();
        if (stats.mean() < DARK_LUMINANCE || stats.stdDev() < LOW_CONTRAST) {
            hazards.add(new DetectedHazard(HazardType.POOR_VISIBILITY, BoundingBox.FULL_FRAME,
                    VISIBILITY_BASE_CONFIDENCE * confidenceScale, Severity.MEDIUM));
        }
        hazards.add(new DetectedHazard(dominantHazard(request.workType()), BoundingBox.FULL_FRAME,
                WORK_TYPE_BASE_CONFIDENCE * confidenceScale, Severity.MEDIUM));

        double overall = WORK_TYPE_BASE_CONFIDENCE * confidenceScale;
        return new BackendResponse(hazards, overall, null, List.of(NOTICE_LIMITED, NOTICE_REVIEW));
    }

    static HazardType dominantHazard(WorkType workType) {
        return switch (workType) {
            case FALL_PROTECTION, ROOFING, SCAFFOLDING, STEEL_ERECTION -> HazardType.FALL_PROTECTION;
            case ELECTRICAL -> HazardType.ELECTRICAL;
            case CRANE_OPERATIONS -> HazardType.CRANE_LIFT;
            case EXCAVATION -> HazardType.EXCAVATION;
            case WELDING -> HazardType.FIRE;
            case DEMOLITION -> HazardType.STRUCK_BY;
            case MAINTENANCE -> HazardType.MECHANICAL;
            case PAINTING -> HazardType.CHEMICAL;
            default -> HazardType.PPE_VIOLATION;
        };
    }

    /** Mean and standard deviation of luminance, both in [0, 1]. */
    record LuminanceStats(double mean, double stdDev) {}

    static LuminanceStats measure(AnalysisRequest request) throws IOException {
        byte[] data = request.imageBytes();
        int channels = ImageFormatInspector.rawChannels(data.length, request.width(), request.height());
        if (channels > 0) {
            return measureRaw(data, channels);
        }
        return measureDecoded(decodeSubsampled(data));
    }

    /**
     * Decodes at most {@link #MAX_SAMPLES} pixels by reading every n-th row and column, so memory
     * stays bounded whatever the declared dimensions.
     */
    static BufferedImage decodeSubsampled(byte[] data) throws IOException {
        try (ImageInputStream in = ImageIO.createImageInputStream(new ByteArrayInputStream(data))) {
            Iterator<ImageReader> readers = in == null ? null : ImageIO.getImageReaders(in);
            if (readers == null || !readers.hasNext()) {
                throw new IOException("Unsupported image encoding for heuristic analysis");
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(in, true, true);
                int width = reader.getWidth(0);
                int height = reader.getHeight(0);
                if (width <= 0 || height <= 0 || width > MAX_DECODE_DIMENSION || height > MAX_DECODE_DIMENSION) {
                    throw new IOException("Image dimensions out of range: " + width + "x" + height);
                }
                int step = subsamplingStep(width, height);
                ImageReadParam param = reader.getDefaultReadParam();
                param.setSourceSubsampling(step, step, 0, 0);
                return reader.read(0, param);
            } finally {
                reader.dispose();
            }
        }
    }

    /** Smallest step such that a step x step subsampled image has at most {@link #MAX_SAMPLES} pixels. */
    static int subsamplingStep(int width, int height) {
        int step = Math.max(1, (int) Math.floor(Math.sqrt((double) width * height / MAX_SAMPLES)));
        while (ceilDiv(width, step) * ceilDiv(height, step) > MAX_SAMPLES) {
            step++;
        }
        return step;
    }

    private static long ceilDiv(int value, int step) {
        return (value + (long) step - 1) / step;
    }

    private static LuminanceStats measureRaw(byte[] data, int channels) {
        int pixels = data.length / channels;
        int step = Math.max(1, pixels / MAX_SAMPLES);
        double sum = 0;
        double sumSq = 0;
        int n = 0;
        for (int p = 0; p < pixels; p += step) {
            int i = p * channels;
            double y = channels >= 3
                    ? luminance(data[i] & 0xFF, data[i + 1] & 0xFF, data[i + 2] & 0xFF)
                    : (data[i] & 0xFF) / 255.0;
            sum += y;
            sumSq += y * y;
            n++;
        }
        return stats(sum, sumSq, n);
    }

    private static LuminanceStats measureDecoded(BufferedImage image) {
        int w = image.getWidth();
        int h = image.getHeight();
        long pixels = (long) w * h;
        int step = (int) Math.max(1, pixels / MAX_SAMPLES);
        double sum = 0;
        double sumSq = 0;
        int n = 0;
        for (long p = 0; p < pixels; p += step) {
            int rgb = image.getRGB((int) (p % w), (int) (p / w));
            double y = luminance((rgb >> 16) & 0xFF, (rgb >> 8) & 0xFF, rgb & 0xFF);
            sum += y;
            sumSq += y * y;
            n++;
        }
        return stats(sum, sumSq, n);
    }

    private static double luminance(int r, int g, int b) {
        return (0.2126 * r + 0.7152 * g + 0.0722 * b) / 255.0;
    }

    private static LuminanceStats stats(double sum, double sumSq, int n) {
        if (n == 0) {
            return new LuminanceStats(0.0, 0.0);
        }
        double mean = sum / n;
        double variance = Math.max(0.0, sumSq / n - mean * mean);
        return new LuminanceStats(mean, Math.sqrt(variance));
    }
}
