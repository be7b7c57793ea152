package domain.correct;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class VocabularyTest {

    @Test
    void should_hold_default_words_in_order() {
        Vocabulary v = Vocabulary.defaults();
        assertEquals(56, v.size());
        assertEquals("i", v.words().get(0));
        assertEquals("also", v.words().get(55));
        assertTrue(v.contains("SMARTPHONE"));
        assertFalse(v.contains("monitor"));
    }

    @Test
    void should_return_new_instances_on_add_and_remove() {
        Vocabulary base = Vocabulary.defaults();
        Vocabulary more = base.withAdded(List.of(" Monitor ", "tv"));
        Vocabulary less = base.withRemoved(List.of("ALSO"));

        assertEquals(57, more.size());
        assertTrue(more.contains("monitor"));
        assertEquals(55, less.size());
        assertFalse(less.contains("also"));
        assertEquals(56, base.size());
    }

    @Test
    void should_report_stats() {
        Vocabulary v = new Vocabulary(List.of("tv", "phone", "stock"));
        Map<String, Number> stats = v.stats();

        assertEquals(3, stats.get("total_words").intValue());
        assertEquals(3L, stats.get("unique_first_letters").longValue());
        assertEquals(4.0, stats.get("average_length").doubleValue(), 1e-9);
        assertEquals(2, stats.get("shortest_word").intValue());
        assertEquals(5, stats.get("longest_word").intValue());
    }
}
