package org.srcgen.objc;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Collects, per class, the instance attributes seen during one walk and the types inferred for
 * them, then renders one interface block per class.
 * <p>
 * Classes keep the order in which they were first declared. Attributes are kept sorted by name.
 */
public final class ClassAttributeRegistry {

    public static final String DEFAULT_TYPE = "id";

    private static final class ClassEntry {
        private final List<String> bases;
        private final Set<String> attributes = new TreeSet<>();
        private final Map<String, String> types = new LinkedHashMap<>();

        private ClassEntry(List<String> bases) {
            this.bases = List.copyOf(bases);
        }
    }

    private final Map<String, ClassEntry> classes = new LinkedHashMap<>();

    /**
     * Registers a class. Declaring the same name again keeps the first entry and its attributes.
     */
    public void declareClass(String className, List<String> bases) {
        classes.putIfAbsent(className, new ClassEntry(bases));
    }

    /**
     * Records an attribute read or written through a method's receiver.
     */
    public void recordAccess(String className, String attribute) {
        entry(className).attributes.add(attribute);
    }

    /**
     * Records an attribute assigned in the class body, with its inferred type if there is one.
     * The first type recorded for an attribute is kept.
     */
    public void recordAssignment(String className, String attribute, Optional<String> type) {
        ClassEntry entry = entry(className);
        entry.attributes.add(attribute);
        type.ifPresent(t -> entry.types.putIfAbsent(attribute, t));
    }

    public List<String> classes() {
        return Collections.unmodifiableList(new ArrayList<>(classes.keySet()));
    }

    public Set<String> attributesOf(String className) {
        return Collections.unmodifiableSet(entry(className).attributes);
    }

    /**
     * @return the recorded type of the attribute, or {@value #DEFAULT_TYPE} when none was inferred
     */
    public String typeOf(String className, String attribute) {
        return entry(className).types.getOrDefault(attribute, DEFAULT_TYPE);
    }

    public boolean isEmpty() {
        return classes.isEmpty();
    }

    /**
     * Renders the interface blocks of every declared class, separated by a blank line.
     */
    public String emitInterfaces(String indentUnit) {
        List<String> blocks = new ArrayList<>();
        for (Map.Entry<String, ClassEntry> each : classes.entrySet()) {
            ClassEntry entry = each.getValue();
            StringBuilder block = new StringBuilder("@interface ").append(each.getKey());
            if (!entry.bases.isEmpty()) {
                block.append(" : ").append(String.join(", ", entry.bases));
            }
            block.append(" {\n");
            for (String attribute : entry.attributes) {
                block.append(indentUnit)
                        .append(entry.types.getOrDefault(attribute, DEFAULT_TYPE))
                        .append(' ')
                        .append(attribute)
                        .append(";\n");
            }
            block.append("}\n\n@end");
            blocks.add(block.toString());
        }
        return String.join("\n\n", blocks);
    }

    private ClassEntry entry(String className) {
        ClassEntry entry = classes.get(className);
        if (entry == null) {
            throw new IllegalArgumentException("Unknown class: " + className);
        }
        return entry;
    }
}
