package org.srcgen;

import java.util.Objects;

/**
 * A non-fatal finding reported while emitting. The run continues and the finding is returned
 * alongside the generated text.
 */
public final class Diagnostic {

    public enum Kind {
        /** A class-level attribute whose value shape has no inference rule; typed {@code id}. */
        UNINFERRED_ATTRIBUTE_TYPE,
        /** A selector whose keyword parts do not pair up one-to-one with the call arguments. */
        SELECTOR_ARGUMENT_MISMATCH,
        /** Keyword or {@code **} arguments of a message send, which selectors cannot carry. */
        DROPPED_KEYWORD_ARGUMENTS,
        /** An {@code else} arm of a {@code try} or loop with no target counterpart. */
        DROPPED_ELSE_BRANCH,
        /** A construct emitted in an approximate form. */
        UNTRANSLATED_CONSTRUCT
    }

    private final Kind kind;
    private final String nodeKind;
    private final int line;
    private final String message;

    public Diagnostic(Kind kind, String nodeKind, int line, String message) {
        this.kind = Objects.requireNonNull(kind);
        this.nodeKind = nodeKind;
        this.line = line;
        this.message = message;
    }

    public Kind getKind() {
        return kind;
    }

    public String getNodeKind() {
        return nodeKind;
    }

    public int getLine() {
        return line;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Diagnostic)) {
            return false;
        }
        Diagnostic that = (Diagnostic) o;
        return line == that.line && kind == that.kind && Objects.equals(nodeKind, that.nodeKind)
               && Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, nodeKind, line, message);
    }

    @Override
    public String toString() {
        return kind + " [" + nodeKind + (line > 0 ? " line " + line : "") + "]: " + message;
    }
}
