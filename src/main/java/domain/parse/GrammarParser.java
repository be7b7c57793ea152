package domain.parse;

import domain.ast.AstNode;
import domain.lexer.Token;
import domain.lexer.TokenKind;
import domain.lexer.Tokenizer;
import domain.model.DiagnosticSink;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Recursive-descent matcher over the fixed production table.
 *
 * <pre>
 * query  : single [?] ( connector single [?] )*
 * connector : AND ALSO | AND | ALSO | (nothing)
 * </pre>
 *
 * <p>At each position every production is tried; longer matches are preferred
 * and ties go to the earlier production. If the rest of the input cannot be
 * parsed after a match, shorter matches are tried. Two or more questions
 * become right-nested {@code CompoundQuery} nodes.</p>
 */
public final class GrammarParser {

    private final Tokenizer tokenizer;
    private final GrammarRules rules;
    private final QueryNodeFactory nodeFactory;

    public GrammarParser(Tokenizer tokenizer, GrammarRules rules) {
        this.tokenizer = Objects.requireNonNull(tokenizer, "tokenizer");
        this.rules = Objects.requireNonNull(rules, "rules");
        this.nodeFactory = new QueryNodeFactory(rules.getLowStockThreshold());
    }

    public ParseOutcome parse(String segment) {
        return parse(segment, DiagnosticSink.none());
    }

    public ParseOutcome parse(String segment, DiagnosticSink sink) {
        List<Token> tokens = tokenizer.tokenize(segment, sink).toList();
        return parseTokens(tokens);
    }

    public ParseOutcome parseTokens(List<Token> tokens) {
        if (tokens == null || tokens.isEmpty()) {
            return ParseOutcome.failure("empty query", tokens, 0);
        }

        Attempt attempt = new Attempt(tokens);
        List<AstNode> questions = attempt.sequence(0, true);
        if (questions == null) {
            int at = attempt.furthest;
            String near = at < tokens.size() ? "near '" + tokens.get(at).getText() + "'" : "at end of input";
            return ParseOutcome.failure("Syntax error " + near, tokens, at);
        }

        // right-nest: A, B, C -> Compound(A, Compound(B, C))
        AstNode root = questions.get(questions.size() - 1);
        for (int i = questions.size() - 2; i >= 0; i--) {
            root = AstNode.compound(questions.get(i), root);
        }
        return ParseOutcome.success(root, tokens);
    }

    public GrammarRules getRules() {
        return rules;
    }

    /** Per-parse state. */
    private final class Attempt {

        private final List<Token> tokens;
        private final Set<Integer> deadEnds = new HashSet<>();
        private int furthest;

        private Attempt(List<Token> tokens) {
            this.tokens = tokens;
        }

        private List<AstNode> sequence(int start, boolean first) {
            if (deadEnds.contains(start * 2 + (first ? 1 : 0))) return null;

            int pos = first ? start : skipConnector(start);
            mark(pos);

            for (Match m : matchesAt(pos)) {
                int end = m.end;
                if (end < tokens.size() && tokens.get(end).is(TokenKind.QUESTION_MARK)) end++;
                mark(end);

                AstNode node = nodeFactory.build(m.production.getShape(), tokens.subList(pos, m.end));
                if (end == tokens.size()) {
                    List<AstNode> out = new ArrayList<>();
                    out.add(node);
                    return out;
                }

                List<AstNode> rest = sequence(end, false);
                if (rest != null) {
                    rest.add(0, node);
                    return rest;
                }
            }

            deadEnds.add(start * 2 + (first ? 1 : 0));
            return null;
        }

        private int skipConnector(int pos) {
            int p = pos;
            if (p < tokens.size() && tokens.get(p).is(TokenKind.AND)) {
                p++;
                if (p < tokens.size() && tokens.get(p).is(TokenKind.ALSO)) p++;
            } else if (p < tokens.size() && tokens.get(p).is(TokenKind.ALSO)) {
                p++;
            }
            return p;
        }

        /** longest first, production order among equal lengths */
        private List<Match> matchesAt(int pos) {
            List<Match> out = new ArrayList<>();
            for (Production p : rules.productions()) {
                int end = p.match(tokens, pos);
                if (end > pos) out.add(new Match(p, end));
                else mark(p.reach(tokens, pos));
            }
            out.sort((a, b) -> Integer.compare(b.end, a.end));
            return out;
        }

        private void mark(int pos) {
            if (pos > furthest) furthest = pos;
        }
    }

    private static final class Match {
        private final Production production;
        private final int end;

        private Match(Production production, int end) {
            this.production = production;
            this.end = end;
        }
    }
}
