package domain.parse;

import domain.lexer.Token;
import domain.lexer.TokenKind;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Grammar symbol: a terminal token kind or one of the small fixed nonterminals.
 */
abstract class Symbol {

    static final Set<TokenKind> PRODUCT_KINDS = EnumSet.of(
            TokenKind.TVS, TokenKind.TV,
            TokenKind.PHONES, TokenKind.PHONE,
            TokenKind.MOBILES, TokenKind.MOBILE, TokenKind.SMARTPHONE,
            TokenKind.LAPTOPS, TokenKind.LAPTOP,
            TokenKind.COMPUTERS, TokenKind.COMPUTER,
            TokenKind.TABLETS, TokenKind.TABLET,
            TokenKind.DRIVES, TokenKind.DRIVE
    );

    /**
     * @return number of tokens consumed at {@code pos}, or -1 when the symbol does not match
     */
    abstract int match(List<Token> tokens, int pos);

    static Symbol t(TokenKind kind) {
        return new Terminal(kind);
    }

    /** PRODUCTS | ITEMS */
    static Symbol products() {
        return new Symbol() {
            @Override
            int match(List<Token> tokens, int pos) {
                if (pos >= tokens.size()) return -1;
                TokenKind k = tokens.get(pos).getKind();
                return (k == TokenKind.PRODUCTS || k == TokenKind.ITEMS) ? 1 : -1;
            }

            @Override
            public String toString() {
                return "products";
            }
        };
    }

    /** a product word, HARD DRIVE, or PRODUCTS | ITEMS */
    static Symbol productType() {
        Symbol products = products();
        return new Symbol() {
            @Override
            int match(List<Token> tokens, int pos) {
                if (pos >= tokens.size()) return -1;
                TokenKind k = tokens.get(pos).getKind();
                if (PRODUCT_KINDS.contains(k)) return 1;
                if (k == TokenKind.HARD) {
                    return (pos + 1 < tokens.size() && tokens.get(pos + 1).is(TokenKind.DRIVE)) ? 2 : -1;
                }
                return products.match(tokens, pos);
            }

            @Override
            public String toString() {
                return "product_type";
            }
        };
    }

    /** [THE] STORE | STOCK */
    static Symbol location() {
        return new Symbol() {
            @Override
            int match(List<Token> tokens, int pos) {
                int i = pos;
                if (i < tokens.size() && tokens.get(i).is(TokenKind.THE)) i++;
                if (i >= tokens.size()) return -1;
                TokenKind k = tokens.get(i).getKind();
                return (k == TokenKind.STORE || k == TokenKind.STOCK) ? (i - pos + 1) : -1;
            }

            @Override
            public String toString() {
                return "location";
            }
        };
    }

    /** NUMBER of any length */
    static Symbol number() {
        return new Symbol() {
            @Override
            int match(List<Token> tokens, int pos) {
                return (pos < tokens.size() && tokens.get(pos).is(TokenKind.NUMBER)) ? 1 : -1;
            }

            @Override
            public String toString() {
                return "NUMBER";
            }
        };
    }

    private static final class Terminal extends Symbol {
        private final TokenKind kind;

        private Terminal(TokenKind kind) {
            this.kind = kind;
        }

        @Override
        int match(List<Token> tokens, int pos) {
            return (pos < tokens.size() && tokens.get(pos).is(kind)) ? 1 : -1;
        }

        @Override
        public String toString() {
            return kind.name();
        }
    }
}
