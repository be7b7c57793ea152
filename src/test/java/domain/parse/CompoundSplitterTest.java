package domain.parse;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CompoundSplitterTest {

    private final CompoundSplitter splitter = new CompoundSplitter();

    @Test
    void should_split_at_question_mark_followed_by_query_starter() {
        assertEquals(
                List.of("How many TVs we have", "How many phones we have ?"),
                splitter.split("How many TVs we have ? How many phones we have ?"));
    }

    @Test
    void should_keep_single_segment_when_no_split_point() {
        assertEquals(List.of("Show all products"), splitter.split("  Show all products  "));
        assertEquals(List.of("show low stock ?"), splitter.split("show low stock ?"));
    }

    @Test
    void should_ignore_case_and_whitespace_before_starter() {
        assertEquals(
                List.of("show low stock", "WHAT is available", "list all items"),
                splitter.split("show low stock?WHAT is available ?   list all items"));
    }

    @Test
    void should_not_split_on_question_mark_before_other_words() {
        assertEquals(List.of("how many TVs ? and also show all products"),
                splitter.split("how many TVs ? and also show all products"));
    }

    @Test
    void should_drop_empty_segments() {
        assertEquals(List.of("show all products"), splitter.split("?show all products"));
        assertTrue(splitter.split("   ").isEmpty());
        assertTrue(splitter.split(null).isEmpty());
    }

    @Test
    void should_preserve_content_apart_from_consumed_question_marks() {
        String in = "how many laptops in stock ? can you tell me how many phones we have ? show low stock";
        List<String> parts = splitter.split(in);

        assertEquals(3, parts.size());
        String rejoined = String.join(" ", parts).replaceAll("\\s+", "");
        assertEquals(in.replaceAll("\\s+", "").replace("stock?can", "stockcan").replace("have?show", "haveshow"),
                rejoined);
    }
}
