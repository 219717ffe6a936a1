package org.srcgen.ast.expr;

import org.srcgen.ast.Comprehension;
import org.srcgen.ast.Node;
import org.srcgen.ast.visitor.VoidVisitor;

import java.util.List;

public class DictCompExpr extends Expression {

    private final Expression key;
    private final Expression value;
    private final List<Comprehension> generators;

    public DictCompExpr(Expression key, Expression value, List<Comprehension> generators) {
        super(0);
        this.key = key;
        this.value = value;
        this.generators = copyOf(generators);
    }

    public Expression getKey() {
        return key;
    }

    public Expression getValue() {
        return value;
    }

    public List<Comprehension> getGenerators() {
        return generators;
    }

    @Override
    public List<Node> getChildNodes() {
        return childrenOf(key, value, generators);
    }

    @Override
    public <A> void accept(VoidVisitor<A> v, A arg) {
        v.visit(this, arg);
    }
}
