package domain.parse;

/**
 * The five single-question shapes the grammar recognizes, in tie-break order.
 */
public enum QueryShape {
    QUANTITY,
    LIST,
    AVAILABILITY,
    LOW_STOCK,
    COMPARISON
}
