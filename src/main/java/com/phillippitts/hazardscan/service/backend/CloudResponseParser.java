package com.phillippitts.hazardscan.service.backend;

import com.phillippitts.hazardscan.domain.BoundingBox;
import com.phillippitts.hazardscan.domain.DetectedHazard;
import com.phillippitts.hazardscan.domain.HazardType;
import com.phillippitts.hazardscan.domain.Severity;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Parses the cloud vision JSON reply.
 *
 * <pre>
 * {
 *   "confidence": 0.91,
 *   "cost": 0.05,
 *   "hazards": [
 *     {"type": "FALL_PROTECTION", "confidence": 0.93, "severity": "HIGH",
 *      "box": {"left": 0.1, "top": 0.2, "width": 0.3, "height": 0.4}}
 *   ],
 *   "notices": ["..."]
 * }
 * </pre>
 *
 * <p>Unknown hazard types map to {@link HazardType#UNKNOWN}; unknown severities to
 * {@link Severity#MEDIUM}; a missing box to {@link BoundingBox#FULL_FRAME}. When the overall
 * confidence is absent, the mean hazard confidence is used (0.0 with no hazards).
 */
final class CloudResponseParser {

    private CloudResponseParser() {}

    /**
     * @throws IllegalArgumentException if the body is not a JSON object or a hazard is invalid
     */
    static BackendResponse parse(String body) {
        if (body == null || body.isBlank()) {
            throw new IllegalArgumentException("Empty cloud response");
        }
        JSONObject obj;
        try {
            obj = new JSONObject(body);
        } catch (JSONException e) {
            throw new IllegalArgumentException("Cloud response is not a JSON object", e);
        }

        List<DetectedHazard> hazards = new ArrayList<>();
        JSONArray arr = obj.optJSONArray("hazards");
        if (arr != null) {
            for (int i = 0; i < arr.length(); i++) {
                JSONObject h = arr.optJSONObject(i);
                if (h != null) {
                    hazards.add(parseHazard(h));
                }
            }
        }

        double confidence = obj.has("confidence")
                ? clamp(obj.optDouble("confidence", 0.0))
                : hazards.stream().mapToDouble(DetectedHazard::confidence).average().orElse(0.0);

        BigDecimal cost = null;
        if (obj.has("cost")) {
            BigDecimal reported = obj.optBigDecimal("cost", null);
            if (reported != null && reported.signum() >= 0) {
                cost = reported;
            }
        }

        List<String> notices = new ArrayList<>();
        JSONArray n = obj.optJSONArray("notices");
        if (n != null) {
            for (int i = 0; i < n.length(); i++) {
                String s = n.optString(i, "");
                if (!s.isBlank()) {
                    notices.add(s.trim());
                }
            }
        }
        return new BackendResponse(hazards, confidence, cost, notices);
    }

    private static DetectedHazard parseHazard(JSONObject h) {
        HazardType type = parseEnum(HazardType.class, h.optString("type", ""), HazardType.UNKNOWN);
        Severity severity = parseEnum(Severity.class, h.optString("severity", ""), Severity.MEDIUM);
        double confidence = clamp(h.optDouble("confidence", 0.0));
        BoundingBox box = BoundingBox.FULL_FRAME;
        JSONObject b = h.optJSONObject("box");
        if (b != null) {
            box = new BoundingBox(
                    clamp(b.optDouble("left", 0.0)),
                    clamp(b.optDouble("top", 0.0)),
                    clamp(b.optDouble("width", 1.0)),
                    clamp(b.optDouble("height", 1.0)));
        }
        return new DetectedHazard(type, box, confidence, severity);
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String raw, E fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Enum.valueOf(type, raw.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_'));
        } catch (IllegalArgumentException e) {
            return fallback;
        }
    }

    private static double clamp(double v) {
        if (Double.isNaN(v)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, v));
    }
}
