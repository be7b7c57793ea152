package domain.lexer;

import java.util.Objects;

/**
 * One classified unit of input text. Immutable.
 */
public final class Token {

    private final TokenKind kind;
    private final String text;
    private final int position;

    public Token(TokenKind kind, String text, int position) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.text = Objects.requireNonNull(text, "text");
        this.position = position;
    }

    public TokenKind getKind() {
        return kind;
    }

    /**
     * Source text exactly as written (original case).
     */
    public String getText() {
        return text;
    }

    /**
     * Character offset of the first character in the tokenized text.
     */
    public int getPosition() {
        return position;
    }

    public boolean is(TokenKind k) {
        return kind == k;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Token)) return false;
        Token other = (Token) o;
        return kind == other.kind && position == other.position && text.equals(other.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, text, position);
    }

    @Override
    public String toString() {
        return kind + "('" + text + "')@" + position;
    }
}
