package domain.model;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * List-backed sink with best-effort de-duplication.
 *
 * <p>We deduplicate by (code|segment|position|message|detail). A token stream
 * is restartable, so iterating it twice must not double the skipped-character
 * records.</p>
 */
public final class ListDiagnosticSink implements DiagnosticSink {

    private final List<Diagnostic> target;
    private final Set<String> seen = new HashSet<>(64);

    public ListDiagnosticSink(List<Diagnostic> target) {
        this.target = target;
    }

    private static String key(Diagnostic d) {
        return d.getCode().name() + "|"
                + d.getSegment() + "|"
                + d.getPosition() + "|"
                + d.getMessage() + "|"
                + d.getDetail();
    }

    @Override
    public void report(Diagnostic diagnostic) {
        if (diagnostic == null || target == null) return;
        if (seen.add(key(diagnostic))) {
            target.add(diagnostic);
        }
    }
}
