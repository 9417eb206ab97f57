package info.isaksson.erland.sforganalyzer.diag;

import java.util.ArrayList;
import java.util.List;

/**
 * Collector for diagnostics produced during one run.
 *
 * <p>Not thread-safe: parallel parse tasks each own a collector and the results are merged afterwards.
 * Output order is always {@link Diagnostic#ORDER}, regardless of insertion order.</p>
 */
public final class Diagnostics {
    private final List<Diagnostic> items = new ArrayList<>();

    public void add(Diagnostic d) {
        if (d != null) items.add(d);
    }

    public void addAll(List<Diagnostic> ds) {
        if (ds == null) return;
        for (Diagnostic d : ds) add(d);
    }

    public void parseError(String file, int line, String message) {
        add(Diagnostic.parseError(file, line, message));
    }

    public void unresolved(String file, int line, String message) {
        add(Diagnostic.unresolved(file, line, message));
    }

    public void duplicate(String file, int line, String message) {
        add(Diagnostic.duplicate(file, line, message));
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public int size() {
        return items.size();
    }

    public long count(DiagnosticKind kind) {
        return items.stream().filter(d -> d.kind == kind).count();
    }

    public List<Diagnostic> sorted() {
        List<Diagnostic> out = new ArrayList<>(items);
        out.sort(Diagnostic.ORDER);
        return List.copyOf(out);
    }
}
