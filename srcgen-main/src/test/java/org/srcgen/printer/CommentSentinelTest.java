package org.srcgen.printer;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CommentSentinelTest {

    @Test
    void encode_turnsCommentLinesIntoAssignments() {
        String source = "x = 1\n    # keep \"this\"\ny = 2";

        assertThat(CommentSentinel.encode(source))
                .isEqualTo("x = 1\n    __comment__ = \" keep \\\"this\\\"\"\ny = 2");
    }

    @Test
    void encode_leavesTrailingCommentsAlone() {
        String source = "x = 1  # not a line comment";
        assertThat(CommentSentinel.encode(source)).isEqualTo(source);
    }

    @Test
    void decode_restoresCommentWithIndentation() {
        String generated = "def f():\n    __comment__ = ' note'\n    pass";

        String decoded = CommentSentinel.decode(generated, "__comment__ = '", "#", PythonLiterals::unescape);

        assertThat(decoded).isEqualTo("def f():\n    # note\n    pass");
    }

    @Test
    void decode_appliesTargetUnescaping() {
        String generated = "__comment__ = @\" say \\\"hi\\\"\"";

        String decoded = CommentSentinel.decode(generated, "__comment__ = @\"", "//", s -> s.replace("\\\"", "\""));

        assertThat(decoded).isEqualTo("// say \"hi\"");
    }

    @Test
    void decode_ignoresOtherLines() {
        String generated = "comment = 'x'\nfoo(__comment__)";
        assertThat(CommentSentinel.decode(generated, "__comment__ = '", "#", PythonLiterals::unescape))
                .isEqualTo(generated);
    }
}
