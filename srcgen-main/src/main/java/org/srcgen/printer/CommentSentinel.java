package org.srcgen.printer;

import java.util.function.UnaryOperator;

/**
 * Carries free-standing comments across a parse and re-emit round trip.
 * <p>
 * Before parsing, {@link #encode(String)} turns every comment line into an assignment of a string
 * literal to {@value #IDENTIFIER}. The emitters treat that assignment like any other, and their
 * text post-pass calls {@link #decode} to turn the emitted assignment back into a comment of the
 * target syntax.
 */
public final class CommentSentinel {

    public static final String IDENTIFIER = "__comment__";

    private CommentSentinel() {
    }

    /**
     * Rewrites each line whose first non-blank character is {@code #} into
     * {@code __comment__ = "text"}, keeping its indentation.
     */
    public static String encode(String source) {
        String[] lines = source.split("\n", -1);
        StringBuilder sb = new StringBuilder(source.length());
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) {
                sb.append('\n');
            }
            String line = lines[i];
            String trimmed = line.stripLeading();
            if (trimmed.startsWith("#")) {
                String indentation = line.substring(0, line.length() - trimmed.length());
                String text = trimmed.substring(1).replace("\\", "\\\\").replace("\"", "\\\"");
                sb.append(indentation).append(IDENTIFIER).append(" = \"").append(text).append('"');
            } else {
                sb.append(line);
            }
        }
        return sb.toString();
    }

    /**
     * Replaces every emitted sentinel assignment with a comment.
     *
     * @param generated    emitted text
     * @param opening      how the sentinel assignment starts in the emitted text, up to and
     *                     including the opening quote, e.g. {@code __comment__ = '}
     * @param commentToken the comment introducer of the target syntax
     * @param unescape     reverses the literal escaping of the target syntax
     */
    public static String decode(String generated, String opening, String commentToken, UnaryOperator<String> unescape) {
        String[] lines = generated.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            String trimmed = line.stripLeading();
            if (trimmed.startsWith(opening) && trimmed.length() > opening.length()) {
                String indentation = line.substring(0, line.length() - trimmed.length());
                String text = trimmed.substring(opening.length(), trimmed.length() - 1);
                lines[i] = indentation + commentToken + unescape.apply(text);
            }
        }
        return String.join("\n", lines);
    }
}
