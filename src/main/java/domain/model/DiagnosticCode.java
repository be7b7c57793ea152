package domain.model;

/**
 * Standard diagnostic codes emitted while a query runs through the pipeline.
 *
 * <p>Keep the set small and stable. Add codes only when the meaning is clear
 * and actionable for whoever reads the report.</p>
 */
public enum DiagnosticCode {

    /**
     * A character matched no token rule and was skipped.
     */
    ILLEGAL_CHARACTER,

    /**
     * The segment matched none of the grammar productions.
     */
    PARSE_FAILED,

    /**
     * The corrector rewrote the segment and the corrected text parsed.
     */
    CORRECTION_APPLIED,

    /**
     * No usable correction was found, or the corrected text still did not parse.
     */
    CORRECTION_FAILED,

    /**
     * AST shape had no statement template; the catch-all SELECT was used.
     */
    TRANSLATION_FALLBACK,

    /**
     * Product type has no predicate mapping; the always-true predicate was used.
     */
    PRODUCT_PREDICATE_MISSING,

    /**
     * The execution collaborator reported a failure for a statement.
     */
    EXECUTION_FAILED,

    /**
     * Unexpected exception while processing one segment.
     */
    SEGMENT_ERROR,

    /**
     * Processing time exceeded the configured slow threshold.
     */
    SLOW_QUERY
}
