package org.srcgen.ast.expr;

import org.srcgen.ast.Comprehension;
import org.srcgen.ast.Node;

import java.util.List;

/**
 * Shared shape of list, set and generator comprehensions: one element expression followed by
 * one or more {@code for} clauses.
 */
public abstract class ComprehensionExpr extends Expression {

    private final Expression element;
    private final List<Comprehension> generators;

    protected ComprehensionExpr(Expression element, List<Comprehension> generators) {
        super(0);
        this.element = element;
        this.generators = copyOf(generators);
    }

    public Expression getElement() {
        return element;
    }

    public List<Comprehension> getGenerators() {
        return generators;
    }

    @Override
    public List<Node> getChildNodes() {
        return childrenOf(element, generators);
    }
}
