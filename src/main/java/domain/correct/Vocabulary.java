package domain.correct;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Immutable ordered set of lowercase words used for fuzzy correction.
 *
 * <p>Built once at startup. The add/remove operations return new instances.</p>
 */
public final class Vocabulary {

    private static final List<String> DEFAULT_WORDS = List.of(
            "i", "want", "to", "know", "how", "many", "units", "of", "item", "items",
            "product", "products", "tvs", "tv", "phones", "phone", "mobiles", "mobile",
            "smartphone", "laptops", "laptop", "computers", "computer", "tablets", "tablet",
            "drives", "drive", "hard", "in", "the", "store", "stock", "show", "list", "all",
            "what", "is", "are", "available", "low", "out", "empty", "less", "than", "more",
            "greater", "we", "have", "do", "you", "can", "get", "tell", "me", "and", "also"
    );

    private static final Vocabulary DEFAULTS = new Vocabulary(DEFAULT_WORDS);

    private final List<String> words;
    private final Set<String> index;

    public Vocabulary(Collection<String> words) {
        LinkedHashSet<String> set = new LinkedHashSet<>();
        if (words != null) {
            for (String w : words) {
                String n = normalize(w);
                if (!n.isEmpty()) set.add(n);
            }
        }
        this.words = Collections.unmodifiableList(new ArrayList<>(set));
        this.index = Collections.unmodifiableSet(set);
    }

    public static Vocabulary defaults() {
        return DEFAULTS;
    }

    private static String normalize(String w) {
        return w == null ? "" : w.trim().toLowerCase(Locale.ROOT);
    }

    public List<String> words() {
        return words;
    }

    public boolean contains(String word) {
        return index.contains(normalize(word));
    }

    public int size() {
        return words.size();
    }

    public Vocabulary withAdded(Collection<String> more) {
        List<String> all = new ArrayList<>(words);
        if (more != null) all.addAll(more);
        return new Vocabulary(all);
    }

    public Vocabulary withRemoved(Collection<String> gone) {
        Set<String> drop = new LinkedHashSet<>();
        if (gone != null) {
            for (String g : gone) drop.add(normalize(g));
        }
        List<String> kept = new ArrayList<>(words.size());
        for (String w : words) {
            if (!drop.contains(w)) kept.add(w);
        }
        return new Vocabulary(kept);
    }

    /**
     * total_words, unique_first_letters, average_length, shortest_word, longest_word.
     */
    public Map<String, Number> stats() {
        Map<String, Number> m = new LinkedHashMap<>();
        m.put("total_words", words.size());
        m.put("unique_first_letters", words.stream().map(w -> w.charAt(0)).distinct().count());
        m.put("average_length", words.stream().mapToInt(String::length).average().orElse(0));
        m.put("shortest_word", words.stream().mapToInt(String::length).min().orElse(0));
        m.put("longest_word", words.stream().mapToInt(String::length).max().orElse(0));
        return m;
    }
}
