package org.srcgen.printer;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PythonLiteralsTest {

    @Test
    void repr_keepsNonAsciiText() {
        assertThat(PythonLiterals.repr("caf\u00e9\u0100\n")).isEqualTo("'caf\u00e9\u0100\\n'");
    }

    @Test
    void repr_prefersDoubleQuotesAroundSingleQuote() {
        assertThat(PythonLiterals.repr("it's")).isEqualTo("\"it's\"");
        assertThat(PythonLiterals.repr("'\"")).isEqualTo("'\\'\"'");
    }

    @Test
    void bytesRepr_escapesControlAndHighBytes() {
        assertThat(PythonLiterals.bytesRepr("\u0001\u007f\u0080\u00ff")).isEqualTo("b'\\x01\\x7f\\x80\\xff'");
    }

    @Test
    void bytesRepr_rejectsCharactersAboveOneByte() {
        assertThatThrownBy(() -> PythonLiterals.bytesRepr("ok\u20ac"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("U+20AC")
                .hasMessageContaining("index 2");
    }
}
