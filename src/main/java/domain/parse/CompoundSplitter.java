package domain.parse;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Splits raw text into independent question segments before tokenization.
 *
 * <p>A split point is a {@code ?} followed (whitespace ignored, any case) by
 * one of the sentence starters. The {@code ?} is dropped, the starter stays
 * with the next segment. Segments are trimmed and empty ones discarded.</p>
 */
public final class CompoundSplitter {

    public static final List<String> DEFAULT_STARTERS = List.of("how", "what", "show", "list", "can");

    private final List<String> starters;
    private final Pattern splitPattern;

    public CompoundSplitter() {
        this(DEFAULT_STARTERS);
    }

    public CompoundSplitter(List<String> starters) {
        if (starters == null || starters.isEmpty()) throw new IllegalArgumentException("starters is empty");
        this.starters = List.copyOf(starters.stream()
                .map(s -> s.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toList()));
        String alternatives = this.starters.stream()
                .map(Pattern::quote)
                .collect(Collectors.joining("|"));
        this.splitPattern = Pattern.compile("\\?\\s*(?=(?:" + alternatives + "))",
                Pattern.CASE_INSENSITIVE);
    }

    public List<String> split(String text) {
        List<String> out = new ArrayList<>();
        if (text == null) return out;

        for (String part : splitPattern.split(text, -1)) {
            String t = part.trim();
            if (!t.isEmpty()) out.add(t);
        }
        return out;
    }

    public List<String> getStarters() {
        return starters;
    }
}
