package org.srcgen.printer;

/**
 * Accumulates emitted text with deferred line breaks and indentation.
 * <p>
 * Line breaks are not written when requested but when the next text arrives, so that several
 * requests in a row collapse into the largest one. Indentation is written together with the
 * pending line breaks, at the depth current at that moment.
 */
public class SourceBuffer {

    private final String indentUnit;
    private final StringBuilder buf = new StringBuilder();
    private int level;
    private int pendingNewlines;
    private boolean fresh = true;

    public SourceBuffer(String indentUnit) {
        this.indentUnit = indentUnit;
    }

    public SourceBuffer write(String text) {
        if (pendingNewlines > 0) {
            if (!fresh) {
                buf.append("\n".repeat(pendingNewlines));
            }
            buf.append(indentUnit.repeat(level));
            pendingNewlines = 0;
        }
        buf.append(text);
        fresh = false;
        return this;
    }

    /**
     * Asks for the next write to start on a new line, preceded by {@code extra} blank lines.
     * Successive requests keep the largest, they never add up.
     */
    public SourceBuffer requestNewline(int extra) {
        if (extra < 0) {
            throw new IllegalArgumentException("extra blank lines must not be negative: " + extra);
        }
        pendingNewlines = Math.max(pendingNewlines, 1 + extra);
        return this;
    }

    public SourceBuffer indent() {
        level++;
        return this;
    }

    public SourceBuffer unindent() {
        if (level == 0) {
            throw new IllegalStateException("Cannot unindent below level 0");
        }
        level--;
        return this;
    }

    public int getLevel() {
        return level;
    }

    public int getPendingNewlines() {
        return pendingNewlines;
    }

    /**
     * @return the number of characters written so far, pending line breaks excluded
     */
    public int length() {
        return buf.length();
    }

    public boolean isEmpty() {
        return fresh;
    }

    public String getSource() {
        return buf.toString();
    }

    @Override
    public String toString() {
        return getSource();
    }
}
