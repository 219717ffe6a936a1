package org.srcgen.ast;

import org.junit.jupiter.api.Test;
import org.srcgen.ast.expr.BinaryExpr;
import org.srcgen.ast.expr.CallExpr;
import org.srcgen.ast.expr.ConditionalExpr;
import org.srcgen.ast.expr.Expression;
import org.srcgen.ast.expr.NameExpr;
import org.srcgen.ast.expr.NumberLiteralExpr;
import org.srcgen.ast.stmt.ExpressionStmt;
import org.srcgen.ast.stmt.FunctionDeclaration;
import org.srcgen.ast.stmt.IfStmt;
import org.srcgen.ast.stmt.PassStmt;
import org.srcgen.ast.stmt.ReturnStmt;
import org.srcgen.ast.visitor.VoidVisitorWithDefaults;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NodeTest {

    /**
     * Records the kind of every node reached, recursing through children.
     */
    private static class KindCollector extends VoidVisitorWithDefaults<List<String>> {
        @Override
        public void defaultAction(Node n, List<String> kinds) {
            kinds.add(n.getKind());
            for (Node child : n.getChildNodes()) {
                child.accept(this, kinds);
            }
        }
    }

    @Test
    void childNodes_followDeclarationOrder() {
        NameExpr test = new NameExpr("c");
        NameExpr body = new NameExpr("a");
        NameExpr orElse = new NameExpr("b");
        ConditionalExpr conditional = new ConditionalExpr(test, body, orElse);

        assertThat(conditional.getChildNodes()).containsExactly(test, body, orElse);
    }

    @Test
    void childNodes_skipAbsentOptionalChildren() {
        ReturnStmt bare = new ReturnStmt(null);
        assertThat(bare.getChildNodes()).isEmpty();

        ReturnStmt withValue = new ReturnStmt(new NameExpr("x"));
        assertThat(withValue.getChildNodes()).hasSize(1);
    }

    @Test
    void defaultsVisitor_reachesEveryNodeInPreOrder() {
        Module module = new Module(List.of(
                new FunctionDeclaration("f", Arguments.of("a"), List.of(
                        new ReturnStmt(new BinaryExpr(new NameExpr("a"), BinaryExpr.Operator.ADD, new NumberLiteralExpr(1))))),
                new ExpressionStmt(new CallExpr(new NameExpr("f"), List.of(new NumberLiteralExpr(2))))));

        List<String> kinds = new ArrayList<>();
        module.accept(new KindCollector(), kinds);

        assertThat(kinds).containsExactly(
                "Module",
                "FunctionDeclaration", "Arguments", "Parameter", "ReturnStmt", "BinaryExpr", "NameExpr", "NumberLiteralExpr",
                "ExpressionStmt", "CallExpr", "NameExpr", "NumberLiteralExpr");
    }

    @Test
    void ifStmt_singleNestedIfIsAnElif() {
        IfStmt inner = new IfStmt(new NameExpr("b"), List.of(new PassStmt()));
        IfStmt outer = new IfStmt(new NameExpr("a"), List.of(new PassStmt()), List.of(inner));
        assertThat(outer.getElif()).isSameAs(inner);

        IfStmt twoStatements = new IfStmt(new NameExpr("a"), List.of(new PassStmt()), List.of(inner, new PassStmt()));
        assertThat(twoStatements.getElif()).isNull();
        assertThat(inner.getElif()).isNull();
    }

    @Test
    void arguments_defaultsAlignWithLastParameters() {
        Expression one = new NumberLiteralExpr(1);
        Arguments arguments = new Arguments(List.of(new Parameter("a"), new Parameter("b")), List.of(one), null, null);

        assertThat(arguments.getPaddedDefaults()).containsExactly(null, one);
    }

    @Test
    void arguments_rejectMoreDefaultsThanParameters() {
        assertThatThrownBy(() -> new Arguments(List.of(new Parameter("a")),
                                               List.of(new NumberLiteralExpr(1), new NumberLiteralExpr(2)), null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("More defaults");
    }

    @Test
    void keyword_withoutNameIsAnExpansion() {
        assertThat(new Keyword(null, new NameExpr("kw")).isExpansion()).isTrue();
        assertThat(new Keyword("x", new NameExpr("kw")).isExpansion()).isFalse();
    }

    @Test
    void numberLiteral_reportsItsKind() {
        assertThat(new NumberLiteralExpr(3).getNumberKind().getTypeName()).isEqualTo("int");
        assertThat(new NumberLiteralExpr(1.5).getNumberKind().getTypeName()).isEqualTo("float");
        assertThat(new NumberLiteralExpr("2j", NumberLiteralExpr.Kind.COMPLEX).getNumberKind().getTypeName())
                .isEqualTo("complex");
    }

    @Test
    void toString_showsKindAndLine() {
        assertThat(new PassStmt(7)).hasToString("PassStmt@7");
        assertThat(new NameExpr("x")).hasToString("NameExpr");
    }
}
