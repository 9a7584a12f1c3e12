package com.phillippitts.hazardscan.service.validation;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Makes free-text user notes safe to interpolate into a cloud prompt.
 *
 * <p>Steps, in order: control characters become spaces, template delimiters are replaced with
 * parentheses, known injection phrases are replaced with {@value #REDACTED}, whitespace is
 * collapsed and the result is truncated.
 */
public class PromptSanitizer {

    static final String REDACTED = "[removed]";

    private static final List<Pattern> INJECTION_PATTERNS = List.of(
            Pattern.compile("ignore\\s+(all\\s+)?(the\\s+)?(previous|prior|above|earlier)\\s+(instructions|prompts?|rules)",
                    Pattern.CASE_INSENSITIVE),
            Pattern.compile("disregard\\s+(all\\s+)?(the\\s+)?(previous|prior|above|earlier)\\b[^.]*",
                    Pattern.CASE_INSENSITIVE),
            Pattern.compile("forget\\s+(everything|all|your\\s+instructions)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("you\\s+are\\s+now\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(reveal|print|show)\\s+(your|the)\\s+(system\\s+)?(prompt|instructions)",
                    Pattern.CASE_INSENSITIVE),
            Pattern.compile("system\\s+prompt", Pattern.CASE_INSENSITIVE),
            Pattern.compile("</?\\s*(system|assistant|user)\\s*>", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(^|\\s)(system|assistant)\\s*:", Pattern.CASE_INSENSITIVE)
    );

    private final int maxLength;

    public PromptSanitizer(int maxLength) {
        if (maxLength <= 0) {
            throw new IllegalArgumentException("maxLength must be positive, got: " + maxLength);
        }
        this.maxLength = maxLength;
    }

    /**
     * Result of sanitizing one piece of text.
     *
     * @param text sanitized text, never null
     * @param injectionDetected whether any injection phrase was neutralized
     * @param matchedPatterns indexes of the patterns that matched, for diagnostics
     */
    public record Sanitized(String text, boolean injectionDetected, List<Integer> matchedPatterns) {
        public Sanitized {
            matchedPatterns = List.copyOf(matchedPatterns);
        }
    }

    public Sanitized sanitize(String notes) {
        if (notes == null || notes.isEmpty()) {
            return new Sanitized("", false, List.of());
        }
        StringBuilder sb = new StringBuilder(notes.length());
        for (int i = 0; i < notes.length(); i++) {
            char c = notes.charAt(i);
            if (Character.isISOControl(c)) {
                sb.append(' ');
            } else if (c == '{') {
                sb.append('(');
            } else if (c == '}') {
                sb.append(')');
            } else {
                sb.append(c);
            }
        }
        String text = sb.toString();

        List<Integer> matched = new ArrayList<>();
        for (int i = 0; i < INJECTION_PATTERNS.size(); i++) {
            Matcher m = INJECTION_PATTERNS.get(i).matcher(text);
            if (m.find()) {
                matched.add(i);
                text = m.replaceAll(" " + REDACTED + " ");
            }
        }

        text = text.replaceAll("\\s+", " ").trim();
        if (text.length() > maxLength) {
            int end = Character.isHighSurrogate(text.charAt(maxLength - 1)) ? maxLength - 1 : maxLength;
            text = text.substring(0, end);
        }
        return new Sanitized(text, !matched.isEmpty(), matched);
    }
}
