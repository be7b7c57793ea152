package domain.correct;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SimilarityRatioTest {

    @Test
    void should_return_one_for_identical_and_empty_strings() {
        assertEquals(1.0, SimilarityRatio.ratio("stock", "stock"));
        assertEquals(1.0, SimilarityRatio.ratio("", ""));
        assertEquals(0.0, SimilarityRatio.ratio("abc", ""));
    }

    @Test
    void should_count_recursive_matching_blocks() {
        // abcd / bcde: "bcd" => 2*3/8
        assertEquals(0.75, SimilarityRatio.ratio("abcd", "bcde"), 1e-9);
        // laptop / laptps: "lapt" + "p" => 2*5/12
        assertEquals(10.0 / 12.0, SimilarityRatio.ratio("laptop", "laptps"), 1e-9);
        assertEquals(3, SimilarityRatio.matchingCharacters("tablets", "tbl"));
    }

    @Test
    void should_return_zero_without_common_characters() {
        assertEquals(0.0, SimilarityRatio.ratio("xyz", "abc"));
    }
}
