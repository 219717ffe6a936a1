package org.srcgen.printer;

/**
 * Quoting of string and bytes literals following the rules of Python's {@code repr}: single quotes
 * unless the text contains a single quote and no double quote.
 */
public final class PythonLiterals {

    private PythonLiterals() {
    }

    public static String repr(String value) {
        char quote = value.indexOf('\'') >= 0 && value.indexOf('"') < 0 ? '"' : '\'';
        return quote(value, quote, false);
    }

    /**
     * Quotes a bytes literal whose characters each stand for one byte.
     *
     * @throws IllegalArgumentException if a character lies above {@code 0xff}
     */
    public static String bytesRepr(String value) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c > 0xff) {
                throw new IllegalArgumentException(String.format(
                        "Bytes literal holds U+%04X at index %d, which does not fit in a byte", (int) c, i));
            }
        }
        char quote = value.indexOf('\'') >= 0 && value.indexOf('"') < 0 ? '"' : '\'';
        return "b" + quote(value, quote, true);
    }

    private static String quote(String value, char quote, boolean asciiOnly) {
        StringBuilder sb = new StringBuilder(value.length() + 2);
        sb.append(quote);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == quote || c == '\\') {
                sb.append('\\').append(c);
            } else if (c == '\n') {
                sb.append("\\n");
            } else if (c == '\r') {
                sb.append("\\r");
            } else if (c == '\t') {
                sb.append("\\t");
            } else if (c < ' ' || c == 0x7f || (asciiOnly && c > 0x7f)) {
                sb.append(String.format("\\x%02x", (int) c));
            } else {
                sb.append(c);
            }
        }
        return sb.append(quote).toString();
    }

    /**
     * Reverses the escapes produced by {@link #repr(String)} on the text between the quotes.
     */
    public static String unescape(String body) {
        StringBuilder sb = new StringBuilder(body.length());
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c != '\\' || i + 1 == body.length()) {
                sb.append(c);
                continue;
            }
            char next = body.charAt(++i);
            switch (next) {
                case 'n':
                    sb.append('\n');
                    break;
                case 'r':
                    sb.append('\r');
                    break;
                case 't':
                    sb.append('\t');
                    break;
                case 'x':
                    if (i + 2 < body.length()) {
                        sb.append((char) Integer.parseInt(body.substring(i + 1, i + 3), 16));
                        i += 2;
                    } else {
                        sb.append('\\').append(next);
                    }
                    break;
                default:
                    sb.append(next);
            }
        }
        return sb.toString();
    }
}
