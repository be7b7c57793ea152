package domain.parse;

import java.util.Locale;

/**
 * How a quantity question was phrased. Checked in declaration order.
 */
public enum QueryStyle {

    CONVERSATIONAL("conversational", "we have"),
    POLITE_REQUEST("polite_request", "can you tell me"),
    FORMAL_REQUEST("formal_request", "i want to know"),
    BASIC("basic", null);

    private final String value;
    private final String marker;

    QueryStyle(String value, String marker) {
        this.value = value;
        this.marker = marker;
    }

    public String value() {
        return value;
    }

    public static QueryStyle fromPhrase(String phrase) {
        String p = phrase == null ? "" : phrase.toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
        for (QueryStyle s : values()) {
            if (s.marker != null && p.contains(s.marker)) return s;
        }
        return BASIC;
    }
}
