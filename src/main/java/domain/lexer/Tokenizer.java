package domain.lexer;

import domain.model.DiagnosticSink;

import java.util.Objects;

/**
 * Turns raw query text into a {@link TokenStream}.
 *
 * <p>Stateless; the rule table is passed in at construction and shared.</p>
 */
public final class Tokenizer {

    private final TokenRules rules;

    public Tokenizer(TokenRules rules) {
        this.rules = Objects.requireNonNull(rules, "rules");
    }

    public TokenStream tokenize(String text) {
        return tokenize(text, DiagnosticSink.none());
    }

    /**
     * @param sink receives one ILLEGAL_CHARACTER diagnostic per skipped character
     */
    public TokenStream tokenize(String text, DiagnosticSink sink) {
        return new TokenStream(text == null ? "" : text, rules, sink == null ? DiagnosticSink.none() : sink);
    }

    public TokenRules getRules() {
        return rules;
    }
}
