package domain.parse;

import domain.lexer.Token;

import java.util.List;
import java.util.stream.Collectors;

/**
 * One fixed surface pattern of a single question.
 */
public final class Production {

    private final QueryShape shape;
    private final List<Symbol> symbols;

    Production(QueryShape shape, List<Symbol> symbols) {
        if (symbols == null || symbols.isEmpty()) throw new IllegalArgumentException("empty production");
        this.shape = shape;
        this.symbols = List.copyOf(symbols);
    }

    public QueryShape getShape() {
        return shape;
    }

    /**
     * @return token index just past the match, or -1
     */
    int match(List<Token> tokens, int start) {
        int pos = start;
        for (Symbol s : symbols) {
            int n = s.match(tokens, pos);
            if (n < 0) return -1;
            pos += n;
        }
        return pos;
    }

    /**
     * Index of the first token this production could not consume from {@code start}.
     */
    int reach(List<Token> tokens, int start) {
        int pos = start;
        for (Symbol s : symbols) {
            int n = s.match(tokens, pos);
            if (n < 0) return pos;
            pos += n;
        }
        return pos;
    }

    @Override
    public String toString() {
        return shape + " : " + symbols.stream().map(String::valueOf).collect(Collectors.joining(" "));
    }
}
