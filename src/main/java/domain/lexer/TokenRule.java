package domain.lexer;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One entry of the tokenizer rule table: a token kind plus the scanner that
 * recognizes it at a given offset.
 */
public final class TokenRule {

    @FunctionalInterface
    interface Scanner {
        /**
         * @return matched length at {@code pos}, or 0 when the rule does not match
         */
        int scan(String text, int pos);
    }

    private static final Pattern HOW_MANY = Pattern.compile("(?i)how\\s+many");

    private final TokenKind kind;
    private final Scanner scanner;
    private final String description;

    private TokenRule(TokenKind kind, Scanner scanner, String description) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.scanner = Objects.requireNonNull(scanner, "scanner");
        this.description = description;
    }

    /**
     * Case-insensitive whole-word keyword.
     */
    public static TokenRule keyword(TokenKind kind) {
        if (!kind.isKeyword()) throw new IllegalArgumentException("not a keyword kind: " + kind);
        String spelling = kind.keyword();
        return new TokenRule(kind, (text, pos) -> {
            int len = spelling.length();
            if (!text.regionMatches(true, pos, spelling, 0, len)) return 0;
            return isWordEnd(text, pos + len) ? len : 0;
        }, "keyword '" + spelling + "'");
    }

    /**
     * "how many" with any run of whitespace between the two words.
     */
    public static TokenRule howMany() {
        return new TokenRule(TokenKind.HOW_MANY, (text, pos) -> {
            int len = lookingAt(HOW_MANY, text, pos);
            if (len == 0) return 0;
            return isWordEnd(text, pos + len) ? len : 0;
        }, "phrase 'how many'");
    }

    public static TokenRule questionMark() {
        return new TokenRule(TokenKind.QUESTION_MARK,
                (text, pos) -> text.charAt(pos) == '?' ? 1 : 0, "'?'");
    }

    /**
     * Structured literal matched by a regular expression anchored at the current offset.
     */
    public static TokenRule literal(TokenKind kind, String regex) {
        Pattern p = Pattern.compile(regex);
        return new TokenRule(kind, (text, pos) -> lookingAt(p, text, pos), "pattern " + regex);
    }

    private static int lookingAt(Pattern p, String text, int pos) {
        Matcher m = p.matcher(text);
        m.region(pos, text.length());
        return m.lookingAt() ? m.end() - pos : 0;
    }

    /**
     * A keyword ends where no letter or digit follows, and no "-digit" that would
     * make the word the prefix of an item id (TV-1234).
     */
    static boolean isWordEnd(String text, int end) {
        if (end >= text.length()) return true;
        char c = text.charAt(end);
        if (Character.isLetterOrDigit(c)) return false;
        if (c == '-' && end + 1 < text.length() && Character.isDigit(text.charAt(end + 1))) return false;
        return true;
    }

    int scan(String text, int pos) {
        return scanner.scan(text, pos);
    }

    public TokenKind getKind() {
        return kind;
    }

    public String getDescription() {
        return description;
    }

    @Override
    public String toString() {
        return kind + " <- " + description;
    }
}
