package domain.lexer;

import domain.model.Diagnostic;
import domain.model.DiagnosticCode;
import domain.model.DiagnosticSink;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Lazy token sequence over one input text.
 *
 * <p>Every call to {@link #iterator()} starts again from offset 0, so the
 * stream can be walked any number of times. Characters no rule accepts are
 * skipped and reported to the sink; they never stop the scan.</p>
 */
public final class TokenStream implements Iterable<Token> {

    private final String text;
    private final TokenRules rules;
    private final DiagnosticSink sink;

    TokenStream(String text, TokenRules rules, DiagnosticSink sink) {
        this.text = text;
        this.rules = rules;
        this.sink = sink;
    }

    public String getText() {
        return text;
    }

    @Override
    public Iterator<Token> iterator() {
        return new Scan();
    }

    public List<Token> toList() {
        List<Token> out = new ArrayList<>();
        for (Token t : this) out.add(t);
        return out;
    }

    private final class Scan implements Iterator<Token> {

        private int pos;
        private Token next;

        @Override
        public boolean hasNext() {
            if (next == null) next = advance();
            return next != null;
        }

        @Override
        public Token next() {
            if (!hasNext()) throw new NoSuchElementException();
            Token t = next;
            next = null;
            return t;
        }

        private Token advance() {
            while (pos < text.length()) {
                char ch = text.charAt(pos);
                if (Character.isWhitespace(ch)) {
                    pos++;
                    continue;
                }

                for (TokenRule rule : rules.rules()) {
                    int len = rule.scan(text, pos);
                    if (len > 0) {
                        Token t = new Token(rule.getKind(), text.substring(pos, pos + len), pos);
                        pos += len;
                        return t;
                    }
                }

                sink.report(new Diagnostic(DiagnosticCode.ILLEGAL_CHARACTER, text, pos,
                        "Illegal character '" + ch + "' ignored", ""));
                pos++;
            }
            return null;
        }
    }
}
