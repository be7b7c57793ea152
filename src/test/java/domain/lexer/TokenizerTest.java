package domain.lexer;

import domain.model.Diagnostic;
import domain.model.DiagnosticCode;
import domain.model.ListDiagnosticSink;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class TokenizerTest {

    private final Tokenizer tokenizer = new Tokenizer(TokenRules.defaults());

    private List<TokenKind> kinds(String text) {
        return tokenizer.tokenize(text).toList().stream()
                .map(Token::getKind)
                .collect(Collectors.toList());
    }

    @Test
    void should_tokenize_conversational_quantity_question() {
        assertEquals(
                List.of(TokenKind.HOW_MANY, TokenKind.TVS, TokenKind.WE, TokenKind.HAVE, TokenKind.QUESTION_MARK),
                kinds("How many TVs we have ?"));
    }

    @Test
    void should_prefer_longer_keyword_spellings() {
        assertEquals(List.of(TokenKind.ITEMS), kinds("items"));
        assertEquals(List.of(TokenKind.ITEM), kinds("item"));
        assertEquals(List.of(TokenKind.PRODUCTS), kinds("PRODUCTS"));
        assertEquals(List.of(TokenKind.PHONES, TokenKind.PHONE), kinds("phones phone"));
        assertEquals(List.of(TokenKind.SMARTPHONE), kinds("smartphone"));
    }

    @Test
    void should_match_keywords_only_as_whole_words() {
        assertEquals(List.of(TokenKind.WORD), kinds("tomorrow"));
        assertEquals(List.of(TokenKind.WORD), kinds("itemsgo"));
        assertEquals(List.of(TokenKind.WORD), kinds("showcase"));
    }

    @Test
    void should_read_letters_dash_digits_as_item_id() {
        List<Token> tokens = tokenizer.tokenize("how many TV-1234").toList();
        assertEquals(2, tokens.size());
        assertEquals(TokenKind.ITEM_ID, tokens.get(1).getKind());
        assertEquals("TV-1234", tokens.get(1).getText());
        assertEquals(9, tokens.get(1).getPosition());
    }

    @Test
    void should_keep_how_many_as_one_token_across_extra_whitespace() {
        List<Token> tokens = tokenizer.tokenize("how \t many phones").toList();
        assertEquals(TokenKind.HOW_MANY, tokens.get(0).getKind());
        assertEquals("how \t many", tokens.get(0).getText());
        assertEquals(TokenKind.PHONES, tokens.get(1).getKind());
    }

    @Test
    void should_read_numbers_and_fallback_words() {
        assertEquals(List.of(TokenKind.SHOW, TokenKind.PRODUCTS, TokenKind.LESS, TokenKind.THAN, TokenKind.NUMBER),
                kinds("Show products less than 10"));
        assertEquals(List.of(TokenKind.WORD, TokenKind.ALL, TokenKind.PRODUCTS), kinds("Sho all products"));
    }

    @Test
    void should_skip_illegal_characters_and_report_them() {
        List<Diagnostic> diags = new ArrayList<>();
        TokenStream stream = tokenizer.tokenize("show all products!", new ListDiagnosticSink(diags));

        assertEquals(3, stream.toList().size());
        assertEquals(1, diags.size());
        assertEquals(DiagnosticCode.ILLEGAL_CHARACTER, diags.get(0).getCode());
        assertEquals(17, diags.get(0).getPosition());
    }

    @Test
    void should_restart_stream_on_every_iteration_without_duplicate_diagnostics() {
        List<Diagnostic> diags = new ArrayList<>();
        TokenStream stream = tokenizer.tokenize("show # low stock", new ListDiagnosticSink(diags));

        List<Token> first = stream.toList();
        List<Token> second = stream.toList();
        assertEquals(first, second);
        assertEquals(3, first.size());
        assertEquals(1, diags.size());
    }

    @Test
    void should_be_lazy_and_finite() {
        Iterator<Token> it = tokenizer.tokenize("what is available").iterator();
        assertTrue(it.hasNext());
        assertEquals(TokenKind.WHAT, it.next().getKind());
        assertEquals(TokenKind.IS, it.next().getKind());
        assertEquals(TokenKind.AVAILABLE, it.next().getKind());
        assertFalse(it.hasNext());
    }

    @Test
    void should_return_empty_stream_for_blank_input() {
        assertTrue(tokenizer.tokenize("   ").toList().isEmpty());
        assertTrue(tokenizer.tokenize("").toList().isEmpty());
    }
}
