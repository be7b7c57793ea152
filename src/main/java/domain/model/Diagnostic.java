package domain.model;

/**
 * A single non-fatal diagnostic produced while processing a query.
 *
 * <p>Diagnostics replace console debugging inside the pipeline. They are
 * returned with the result so callers decide whether to print, store or
 * ignore them.</p>
 */
public final class Diagnostic {

    private final DiagnosticCode code;
    private final String segment;
    private final int position;
    private final String message;
    private final String detail;

    public Diagnostic(
            DiagnosticCode code,
            String segment,
            int position,
            String message,
            String detail
    ) {
        this.code = code == null ? DiagnosticCode.SEGMENT_ERROR : code;
        this.segment = nullToEmpty(segment);
        this.position = position;
        this.message = nullToEmpty(message);
        this.detail = nullToEmpty(detail);
    }

    public static Diagnostic of(DiagnosticCode code, String segment, String message) {
        return new Diagnostic(code, segment, -1, message, "");
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    public DiagnosticCode getCode() {
        return code;
    }

    public String getSegment() {
        return segment;
    }

    /**
     * Character or token offset inside the segment, -1 when not applicable.
     */
    public int getPosition() {
        return position;
    }

    public String getMessage() {
        return message;
    }

    public String getDetail() {
        return detail;
    }

    @Override
    public String toString() {
        return code + "[" + position + "] " + message + (detail.isEmpty() ? "" : " (" + detail + ")");
    }
}
