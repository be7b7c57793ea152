package domain.lexer;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Immutable, priority-ordered tokenizer rule table.
 *
 * <p>The tokenizer commits to the first rule that matches at the current
 * offset, so the order below is the tie-breaker:</p>
 * <ol>
 *   <li>{@code ?}</li>
 *   <li>"how many" as one {@link TokenKind#HOW_MANY} token</li>
 *   <li>single-word keywords, longest spelling first (TVS before TV, ITEMS before ITEM);
 *       each must match a whole word</li>
 *   <li>{@link TokenKind#ITEM_ID} {@code LETTERS-DIGITS}</li>
 *   <li>{@link TokenKind#NUMBER}</li>
 *   <li>{@link TokenKind#WORD} fallback</li>
 * </ol>
 */
public final class TokenRules {

    private static final TokenRules DEFAULTS = new TokenRules(buildDefaultRules());

    private final List<TokenRule> rules;

    public TokenRules(List<TokenRule> rules) {
        if (rules == null || rules.isEmpty()) throw new IllegalArgumentException("rules is empty");
        this.rules = Collections.unmodifiableList(new ArrayList<>(rules));
    }

    public static TokenRules defaults() {
        return DEFAULTS;
    }

    private static List<TokenRule> buildDefaultRules() {
        List<TokenRule> out = new ArrayList<>(64);
        out.add(TokenRule.questionMark());
        out.add(TokenRule.howMany());

        // stable sort keeps enum order among keywords of the same length
        Arrays.stream(TokenKind.values())
                .filter(TokenKind::isKeyword)
                .sorted(Comparator.comparingInt((TokenKind k) -> k.keyword().length()).reversed())
                .map(TokenRule::keyword)
                .forEach(out::add);

        out.add(TokenRule.literal(TokenKind.ITEM_ID, "[A-Za-z]+-\\d+"));
        out.add(TokenRule.literal(TokenKind.NUMBER, "\\d+"));
        out.add(TokenRule.literal(TokenKind.WORD, "[A-Za-z]+"));
        return out;
    }

    public List<TokenRule> rules() {
        return rules;
    }

    public int size() {
        return rules.size();
    }
}
