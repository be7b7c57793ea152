package domain.lexer;

/**
 * Closed set of token kinds.
 *
 * <p>Keyword kinds carry their spelling. {@link #QUESTION_MARK}, {@link #HOW_MANY}
 * and the literal kinds ({@link #ITEM_ID}, {@link #NUMBER}, {@link #WORD}) are
 * matched by dedicated rules in {@link TokenRules}.</p>
 */
public enum TokenKind {

    I("i"),
    WANT("want"),
    TO("to"),
    KNOW("know"),
    HOW_MANY(null),
    UNITS("units"),
    OF("of"),
    ITEM("item"),
    ITEMS("items"),
    PRODUCT("product"),
    PRODUCTS("products"),
    IN("in"),
    STORE("store"),
    STOCK("stock"),
    THE("the"),
    TVS("tvs"),
    TV("tv"),
    PHONES("phones"),
    PHONE("phone"),
    MOBILES("mobiles"),
    MOBILE("mobile"),
    SMARTPHONE("smartphone"),
    LAPTOPS("laptops"),
    LAPTOP("laptop"),
    COMPUTERS("computers"),
    COMPUTER("computer"),
    TABLETS("tablets"),
    TABLET("tablet"),
    DRIVES("drives"),
    DRIVE("drive"),
    HARD("hard"),
    ALL("all"),
    SHOW("show"),
    LIST("list"),
    WHAT("what"),
    IS("is"),
    ARE("are"),
    AVAILABLE("available"),
    LOW("low"),
    OUT("out"),
    EMPTY("empty"),
    LESS("less"),
    THAN("than"),
    MORE("more"),
    GREATER("greater"),
    WE("we"),
    HAVE("have"),
    DO("do"),
    YOU("you"),
    CAN("can"),
    GET("get"),
    TELL("tell"),
    ME("me"),
    AND("and"),
    ALSO("also"),
    QUESTION_MARK(null),
    ITEM_ID(null),
    NUMBER(null),
    WORD(null);

    private final String keyword;

    TokenKind(String keyword) {
        this.keyword = keyword;
    }

    /**
     * Lowercase keyword spelling, or null for punctuation, multi-word and literal kinds.
     */
    public String keyword() {
        return keyword;
    }

    public boolean isKeyword() {
        return keyword != null;
    }
}
