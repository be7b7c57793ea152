package domain.parse;

import domain.ast.AstNode;
import domain.lexer.Token;

import java.util.List;

/**
 * Result of one parse attempt: an AST, or a failure with the reason.
 *
 * <p>Grammar mismatch is an ordinary outcome, not an exception.</p>
 */
public final class ParseOutcome {

    private final AstNode ast;
    private final List<Token> tokens;
    private final String error;
    private final int errorTokenIndex;

    private ParseOutcome(AstNode ast, List<Token> tokens, String error, int errorTokenIndex) {
        this.ast = ast;
        this.tokens = tokens == null ? List.of() : List.copyOf(tokens);
        this.error = error;
        this.errorTokenIndex = errorTokenIndex;
    }

    static ParseOutcome success(AstNode ast, List<Token> tokens) {
        return new ParseOutcome(ast, tokens, null, -1);
    }

    static ParseOutcome failure(String error, List<Token> tokens, int errorTokenIndex) {
        return new ParseOutcome(null, tokens, error, errorTokenIndex);
    }

    public boolean isSuccess() {
        return ast != null;
    }

    /**
     * Root node on success, null on failure.
     */
    public AstNode getAst() {
        return ast;
    }

    public List<Token> getTokens() {
        return tokens;
    }

    /**
     * Failure reason, null on success.
     */
    public String getError() {
        return error;
    }

    /**
     * Index of the token where matching stopped; equals the token count when
     * input ended too early; -1 on success.
     */
    public int getErrorTokenIndex() {
        return errorTokenIndex;
    }
}
