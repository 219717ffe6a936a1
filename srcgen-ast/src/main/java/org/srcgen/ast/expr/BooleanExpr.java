package org.srcgen.ast.expr;

import org.srcgen.ast.Node;
import org.srcgen.ast.visitor.VoidVisitor;

import java.util.List;

/**
 * {@code a and b and c}: one operator applied across two or more values.
 */
public class BooleanExpr extends Expression {

    public enum Operator {
        AND("and"),
        OR("or");

        private final String codeRepresentation;

        Operator(String codeRepresentation) {
            this.codeRepresentation = codeRepresentation;
        }

        public String asString() {
            return codeRepresentation;
        }
    }

    private final Operator operator;
    private final List<Expression> values;

    public BooleanExpr(Operator operator, List<Expression> values) {
        super(0);
        this.operator = operator;
        this.values = copyOf(values);
    }

    public Operator getOperator() {
        return operator;
    }

    public List<Expression> getValues() {
        return values;
    }

    @Override
    public List<Node> getChildNodes() {
        return childrenOf(values);
    }

    @Override
    public <A> void accept(VoidVisitor<A> v, A arg) {
        v.visit(this, arg);
    }
}
