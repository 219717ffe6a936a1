package org.srcgen;

import org.junit.jupiter.api.Test;
import org.srcgen.ast.Arguments;
import org.srcgen.ast.Module;
import org.srcgen.ast.expr.AttributeExpr;
import org.srcgen.ast.expr.CallExpr;
import org.srcgen.ast.expr.DictExpr;
import org.srcgen.ast.expr.NameExpr;
import org.srcgen.ast.stmt.AssignStmt;
import org.srcgen.ast.stmt.ClassDeclaration;
import org.srcgen.ast.stmt.ExpressionStmt;
import org.srcgen.ast.stmt.FunctionDeclaration;
import org.srcgen.ast.stmt.PassStmt;
import org.srcgen.objc.ObjectiveCEmitter;
import org.srcgen.printer.EmitterConfiguration;
import org.srcgen.printer.PythonSourceEmitter;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SourceGenTest {

    private static Module sample() {
        return new Module(List.of(new ClassDeclaration("Cache", List.of(), List.of(
                new AssignStmt(name("entries"), new DictExpr(List.of(), List.of())),
                new FunctionDeclaration("clear", Arguments.of("self"), List.of(
                        new ExpressionStmt(new CallExpr(new AttributeExpr(new AttributeExpr(name("self"), "entries"), "clear"),
                                                        List.of()))))))));
    }

    private static NameExpr name(String id) {
        return new NameExpr(id);
    }

    @Test
    void defaultBackend_isTheMirror() {
        assertThat(SourceGen.toSource(sample()).getSource()).isEqualTo("class Cache:\n"
                                                                       + "    entries = {}\n"
                                                                       + "\n"
                                                                       + "    def clear(self):\n"
                                                                       + "        self.entries.clear()");
    }

    @Test
    void objectiveC_returnsDiagnosticsWithTheText() {
        GenerationResult result = SourceGen.toSource(sample(), SourceGen.Backend.OBJECTIVE_C);

        assertThat(result.getSource()).contains("- (id)clear {", "[self.entries clear];", "id entries;");
        assertThat(result.hasDiagnostics()).isTrue();
        assertThat(result.getDiagnostics()).extracting(Diagnostic::getKind)
                .containsExactly(Diagnostic.Kind.UNINFERRED_ATTRIBUTE_TYPE);
    }

    @Test
    void callsAreIndependent() {
        GenerationResult first = SourceGen.toSource(sample(), SourceGen.Backend.OBJECTIVE_C);
        GenerationResult second = SourceGen.toSource(sample(), SourceGen.Backend.OBJECTIVE_C);

        assertThat(second.getSource()).isEqualTo(first.getSource());
        assertThat(second.getDiagnostics()).isEqualTo(first.getDiagnostics());
    }

    @Test
    void backend_createsMatchingEmitter() {
        EmitterConfiguration configuration = EmitterConfiguration.defaults();
        assertThat(SourceGen.Backend.MIRROR.newEmitter(configuration)).isInstanceOf(PythonSourceEmitter.class);
        assertThat(SourceGen.Backend.OBJECTIVE_C.newEmitter(configuration)).isInstanceOf(ObjectiveCEmitter.class);
    }

    @Test
    void configuration_isPassedThrough() {
        EmitterConfiguration configuration = EmitterConfiguration.builder().indentWith("  ").build();
        Module module = new Module(List.of(new FunctionDeclaration("f", Arguments.of(), List.of(new PassStmt()))));

        assertThat(SourceGen.toSource(module, SourceGen.Backend.MIRROR, configuration).getSource())
                .isEqualTo("def f():\n  pass");
    }

    @Test
    void configuration_rejectsLetterDelimiter() {
        assertThatThrownBy(() -> EmitterConfiguration.builder().selectorDelimiter('x'))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void nullModule_isRejected() {
        assertThatThrownBy(() -> SourceGen.toSource(null)).isInstanceOf(NullPointerException.class);
    }
}
