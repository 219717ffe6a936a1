package org.srcgen.objc;

import com.github.javaparser.utils.Utils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The keyword parts of a method name split on a delimiter, e.g. {@code _foo_bar_} splits into
 * {@code [foo, bar]} with one leading and one trailing delimiter.
 */
public final class Selector {

    private static final String INIT = "init";

    private final String name;
    private final char delimiter;
    private final List<String> parts;
    private final int leadingDelimiters;
    private final int trailingDelimiters;

    private Selector(String name, char delimiter, List<String> parts, int leadingDelimiters, int trailingDelimiters) {
        this.name = name;
        this.delimiter = delimiter;
        this.parts = parts;
        this.leadingDelimiters = leadingDelimiters;
        this.trailingDelimiters = trailingDelimiters;
    }

    public static Selector parse(String name, char delimiter) {
        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c == delimiter) {
                if (current.length() > 0) {
                    parts.add(current.toString());
                    current.setLength(0);
                }
            } else {
                current.append(c);
            }
        }
        if (current.length() > 0) {
            parts.add(current.toString());
        }

        int leading = 0;
        while (leading < name.length() && name.charAt(leading) == delimiter) {
            leading++;
        }
        int trailing = 0;
        if (!parts.isEmpty()) {
            while (trailing < name.length() && name.charAt(name.length() - 1 - trailing) == delimiter) {
                trailing++;
            }
        }
        return new Selector(name, delimiter, Collections.unmodifiableList(parts), leading, trailing);
    }

    public String getName() {
        return name;
    }

    public List<String> parts() {
        return parts;
    }

    public int leadingDelimiters() {
        return leadingDelimiters;
    }

    public int trailingDelimiters() {
        return trailingDelimiters;
    }

    /**
     * @return the parts as message keywords, with the leading delimiters re-attached to the first
     * keyword and the trailing ones to the last
     */
    public List<String> keywordParts() {
        if (parts.isEmpty()) {
            return parts;
        }
        List<String> keywords = new ArrayList<>(parts);
        String run = String.valueOf(delimiter);
        keywords.set(0, run.repeat(leadingDelimiters) + keywords.get(0));
        int last = keywords.size() - 1;
        keywords.set(last, keywords.get(last) + run.repeat(trailingDelimiters));
        return keywords;
    }

    /**
     * Builds the declared name of a method: the special names {@code __init__} and
     * {@code __repr__} become {@code init} and {@code description}, a leading {@code get} part is
     * dropped when more parts follow, and the remaining parts are joined in camel case.
     * Delimiters around the name are not kept.
     */
    public static String declaredName(String name, char delimiter) {
        String renamed;
        switch (name) {
            case "__init__":
                renamed = INIT;
                break;
            case "__repr__":
                renamed = "description";
                break;
            default:
                renamed = name;
        }
        List<String> parts = new ArrayList<>(parse(renamed, delimiter).parts());
        if (parts.isEmpty()) {
            return renamed;
        }
        if (parts.size() > 1 && parts.get(0).equals("get")) {
            parts.remove(0);
        }
        StringBuilder declared = new StringBuilder(parts.get(0));
        for (int i = 1; i < parts.size(); i++) {
            declared.append(Utils.capitalize(parts.get(i)));
        }
        return declared.toString();
    }

    static boolean isInitializer(String declaredName) {
        return INIT.equals(declaredName);
    }

    @Override
    public String toString() {
        return String.join(":", keywordParts()) + (parts.isEmpty() ? "" : ":");
    }
}
