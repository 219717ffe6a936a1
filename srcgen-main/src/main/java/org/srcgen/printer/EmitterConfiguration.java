package org.srcgen.printer;

import com.github.javaparser.printer.configuration.Indentation;
import com.github.javaparser.printer.configuration.Indentation.IndentType;

import java.util.Objects;

/**
 * Immutable settings of one emitter run. Each command-line flag of a driver maps to exactly one
 * setting here.
 */
public final class EmitterConfiguration {

    public static final char DEFAULT_SELECTOR_DELIMITER = '_';

    private static final EmitterConfiguration DEFAULTS = builder().build();

    private final String indentUnit;
    private final boolean addLineInformation;
    private final char selectorDelimiter;

    private EmitterConfiguration(Builder builder) {
        this.indentUnit = builder.indentUnit;
        this.addLineInformation = builder.addLineInformation;
        this.selectorDelimiter = builder.selectorDelimiter;
    }

    public static EmitterConfiguration defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return the text written once per nesting level at the start of each line
     */
    public String getIndentUnit() {
        return indentUnit;
    }

    /**
     * @return whether each statement is preceded by a comment naming its source line
     */
    public boolean isAddLineInformation() {
        return addLineInformation;
    }

    /**
     * @return the character separating keyword parts in a method name
     */
    public char getSelectorDelimiter() {
        return selectorDelimiter;
    }

    public Builder toBuilder() {
        return new Builder()
                .indentWith(indentUnit)
                .lineInformation(addLineInformation)
                .selectorDelimiter(selectorDelimiter);
    }

    @Override
    public String toString() {
        return "EmitterConfiguration{indentUnit='" + indentUnit.replace("\t", "\\t") + "', addLineInformation="
               + addLineInformation + ", selectorDelimiter='" + selectorDelimiter + "'}";
    }

    public static final class Builder {

        private String indentUnit = new Indentation(IndentType.SPACES, 4).getIndent();
        private boolean addLineInformation;
        private char selectorDelimiter = DEFAULT_SELECTOR_DELIMITER;

        private Builder() {
        }

        public Builder indentWith(String indentUnit) {
            this.indentUnit = Objects.requireNonNull(indentUnit, "indentUnit");
            return this;
        }

        public Builder indentation(Indentation indentation) {
            return indentWith(indentation.getIndent());
        }

        public Builder lineInformation(boolean addLineInformation) {
            this.addLineInformation = addLineInformation;
            return this;
        }

        public Builder selectorDelimiter(char selectorDelimiter) {
            if (Character.isLetterOrDigit(selectorDelimiter) || Character.isWhitespace(selectorDelimiter)) {
                throw new IllegalArgumentException("Selector delimiter must be a punctuation character, got '"
                                                   + selectorDelimiter + "'");
            }
            this.selectorDelimiter = selectorDelimiter;
            return this;
        }

        public EmitterConfiguration build() {
            return new EmitterConfiguration(this);
        }
    }
}
