package domain.correct;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Corrector output: per-word suggestions and, when there is at least one,
 * the corrected (lowercased) text.
 */
public final class Correction {

    private static final Correction NONE = new Correction(Map.of(), null);

    private final Map<String, String> suggestions;
    private final String correctedText;

    private Correction(Map<String, String> suggestions, String correctedText) {
        this.suggestions = suggestions;
        this.correctedText = correctedText;
    }

    static Correction none() {
        return NONE;
    }

    static Correction of(LinkedHashMap<String, String> suggestions, String correctedText) {
        if (suggestions == null || suggestions.isEmpty()) return NONE;
        return new Correction(Collections.unmodifiableMap(new LinkedHashMap<>(suggestions)), correctedText);
    }

    /**
     * original word -> replacement, in input order.
     */
    public Map<String, String> getSuggestions() {
        return suggestions;
    }

    /**
     * Corrected text, or null when nothing was corrected.
     */
    public String getCorrectedText() {
        return correctedText;
    }

    public boolean isCorrected() {
        return correctedText != null;
    }
}
