package domain.correct;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Fuzzy per-word correction against a {@link Vocabulary}.
 *
 * <p>Each whitespace-separated word is compared with every vocabulary entry;
 * the best entry is suggested when its {@link SimilarityRatio} reaches the
 * cutoff and it differs from the word. Ties go to the lexicographically
 * greatest entry.</p>
 */
public final class ErrorCorrector {

    public static final double DEFAULT_CUTOFF = 0.6;

    private final Vocabulary vocabulary;
    private final double cutoff;

    public ErrorCorrector(Vocabulary vocabulary) {
        this(vocabulary, DEFAULT_CUTOFF);
    }

    public ErrorCorrector(Vocabulary vocabulary, double cutoff) {
        this.vocabulary = Objects.requireNonNull(vocabulary, "vocabulary");
        if (cutoff < 0.0 || cutoff > 1.0 || Double.isNaN(cutoff)) {
            throw new IllegalArgumentException("cutoff must be between 0.0 and 1.0: " + cutoff);
        }
        this.cutoff = cutoff;
    }

    public ErrorCorrector withCutoff(double newCutoff) {
        return new ErrorCorrector(vocabulary, newCutoff);
    }

    public ErrorCorrector withVocabulary(Vocabulary newVocabulary) {
        return new ErrorCorrector(newVocabulary, cutoff);
    }

    public Correction correct(String text) {
        if (text == null || text.isBlank()) return Correction.none();

        LinkedHashMap<String, String> suggestions = new LinkedHashMap<>();
        String corrected = text.toLowerCase(Locale.ROOT);

        for (String word : text.trim().split("\\s+")) {
            String lower = word.toLowerCase(Locale.ROOT);
            List<String> best = suggestionsFor(lower, 1);
            if (best.isEmpty() || best.get(0).equals(lower)) continue;

            suggestions.put(word, best.get(0));
            corrected = corrected.replace(lower, best.get(0));
        }

        return suggestions.isEmpty() ? Correction.none() : Correction.of(suggestions, corrected);
    }

    /**
     * Up to {@code n} vocabulary entries scoring at least the cutoff, best first.
     */
    public List<String> suggestionsFor(String word, int n) {
        if (word == null || n <= 0) return List.of();
        String w = word.toLowerCase(Locale.ROOT);

        List<Scored> scored = new ArrayList<>();
        for (String candidate : vocabulary.words()) {
            double r = SimilarityRatio.ratio(candidate, w);
            if (r >= cutoff) scored.add(new Scored(candidate, r));
        }
        scored.sort((x, y) -> {
            int c = Double.compare(y.score, x.score);
            return c != 0 ? c : y.word.compareTo(x.word);
        });

        List<String> out = new ArrayList<>(Math.min(n, scored.size()));
        for (int i = 0; i < scored.size() && i < n; i++) out.add(scored.get(i).word);
        return out;
    }

    public double similarity(String a, String b) {
        return SimilarityRatio.ratio(
                a == null ? "" : a.toLowerCase(Locale.ROOT),
                b == null ? "" : b.toLowerCase(Locale.ROOT));
    }

    public Vocabulary getVocabulary() {
        return vocabulary;
    }

    public double getCutoff() {
        return cutoff;
    }

    private static final class Scored {
        private final String word;
        private final double score;

        private Scored(String word, double score) {
            this.word = word;
            this.score = score;
        }
    }
}
