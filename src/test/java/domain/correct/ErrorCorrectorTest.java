package domain.correct;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ErrorCorrectorTest {

    private final ErrorCorrector corrector = new ErrorCorrector(Vocabulary.defaults());

    @Test
    void should_correct_misspelled_show() {
        Correction c = corrector.correct("Sho all products");
        assertTrue(c.isCorrected());
        assertEquals(Map.of("Sho", "show"), c.getSuggestions());
        assertEquals("show all products", c.getCorrectedText());
    }

    @Test
    void should_correct_several_words_and_lowercase_text() {
        Correction c = corrector.correct("How many laptps in STOKC");
        assertEquals("laptops", c.getSuggestions().get("laptps"));
        assertEquals("stock", c.getSuggestions().get("STOKC"));
        assertEquals("how many laptops in stock", c.getCorrectedText());
    }

    @Test
    void should_not_suggest_for_vocabulary_only_input() {
        for (String w : Vocabulary.defaults().words()) {
            Correction c = corrector.correct(w);
            assertFalse(c.isCorrected(), "unexpected correction for " + w);
            assertTrue(c.getSuggestions().isEmpty());
        }
        assertFalse(corrector.correct("can you tell me how many phones we have").isCorrected());
    }

    @Test
    void should_not_correct_words_below_cutoff() {
        Correction c = corrector.correct("xyzzy qqq");
        assertFalse(c.isCorrected());
        assertNull(c.getCorrectedText());
        assertFalse(corrector.correct("   ").isCorrected());
        assertFalse(corrector.correct(null).isCorrected());
    }

    @Test
    void should_validate_cutoff_range() {
        assertThrows(IllegalArgumentException.class, () -> new ErrorCorrector(Vocabulary.defaults(), 1.5));
        assertThrows(IllegalArgumentException.class, () -> new ErrorCorrector(Vocabulary.defaults(), -0.1));
        assertThrows(IllegalArgumentException.class, () -> corrector.withCutoff(Double.NaN));
        assertEquals(0.9, corrector.withCutoff(0.9).getCutoff());
    }

    @Test
    void should_respect_higher_cutoff() {
        // sho/show = 6/7 ~ 0.857
        assertTrue(corrector.withCutoff(0.8).correct("sho").isCorrected());
        assertFalse(corrector.withCutoff(0.9).correct("sho").isCorrected());
    }

    @Test
    void should_rank_suggestions_best_first() {
        List<String> s = corrector.suggestionsFor("phnes", 3);
        assertFalse(s.isEmpty());
        assertEquals("phones", s.get(0));
        assertTrue(s.size() <= 3);
        assertTrue(corrector.suggestionsFor("phnes", 0).isEmpty());
    }

    @Test
    void should_compute_similarity_case_insensitively() {
        assertEquals(1.0, corrector.similarity("SHOW", "show"));
        assertEquals(6.0 / 7.0, corrector.similarity("sho", "show"), 1e-9);
    }

    @Test
    void should_use_custom_vocabulary() {
        ErrorCorrector custom = corrector.withVocabulary(Vocabulary.defaults().withAdded(List.of("monitors")));
        assertEquals("monitors", custom.correct("monitrs").getSuggestions().get("monitrs"));
    }
}
