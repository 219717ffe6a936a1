package org.srcgen.ast.expr;

import org.srcgen.ast.Node;
import org.srcgen.ast.visitor.VoidVisitor;

import java.util.List;

/**
 * A comparison chain {@code left op1 c1 op2 c2 ...}; operators and comparators pair up in order.
 */
public class CompareExpr extends Expression {

    public enum Operator {
        EQ("=="),
        NOT_EQ("!="),
        LT("<"),
        LT_E("<="),
        GT(">"),
        GT_E(">="),
        IS("is"),
        IS_NOT("is not"),
        IN("in"),
        NOT_IN("not in");

        private final String codeRepresentation;

        Operator(String codeRepresentation) {
            this.codeRepresentation = codeRepresentation;
        }

        public String asString() {
            return codeRepresentation;
        }
    }

    private final Expression left;
    private final List<Operator> operators;
    private final List<Expression> comparators;

    public CompareExpr(Expression left, Operator operator, Expression comparator) {
        this(left, List.of(operator), List.of(comparator));
    }

    public CompareExpr(Expression left, List<Operator> operators, List<Expression> comparators) {
        super(0);
        if (operators.size() != comparators.size()) {
            throw new IllegalArgumentException("Comparison has " + operators.size() + " operators but "
                                               + comparators.size() + " comparators");
        }
        this.left = left;
        this.operators = copyOf(operators);
        this.comparators = copyOf(comparators);
    }

    public Expression getLeft() {
        return left;
    }

    public List<Operator> getOperators() {
        return operators;
    }

    public List<Expression> getComparators() {
        return comparators;
    }

    @Override
    public List<Node> getChildNodes() {
        return childrenOf(left, comparators);
    }

    @Override
    public <A> void accept(VoidVisitor<A> v, A arg) {
        v.visit(this, arg);
    }
}
