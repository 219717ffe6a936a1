package org.srcgen;

import java.util.List;

/**
 * The text produced by one emitter run, together with the non-fatal diagnostics of that run.
 */
public class GenerationResult {

    private final String source;
    private final List<Diagnostic> diagnostics;

    public GenerationResult(String source, List<Diagnostic> diagnostics) {
        this.source = source;
        this.diagnostics = List.copyOf(diagnostics);
    }

    public String getSource() {
        return source;
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    public boolean hasDiagnostics() {
        return !diagnostics.isEmpty();
    }

    public List<Diagnostic> getDiagnostics(Diagnostic.Kind kind) {
        return diagnostics.stream().filter(d -> d.getKind() == kind).toList();
    }

    @Override
    public String toString() {
        return source;
    }
}
