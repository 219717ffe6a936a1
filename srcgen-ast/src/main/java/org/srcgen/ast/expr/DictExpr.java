package org.srcgen.ast.expr;

import org.srcgen.ast.Node;
import org.srcgen.ast.visitor.VoidVisitor;

import java.util.List;

public class DictExpr extends Expression {

    private final List<Expression> keys;
    private final List<Expression> values;

    public DictExpr(List<Expression> keys, List<Expression> values) {
        super(0);
        if (keys.size() != values.size()) {
            throw new IllegalArgumentException("Dict literal has " + keys.size() + " keys but " + values.size() + " values");
        }
        this.keys = copyOf(keys);
        this.values = copyOf(values);
    }

    public List<Expression> getKeys() {
        return keys;
    }

    public List<Expression> getValues() {
        return values;
    }

    @Override
    public List<Node> getChildNodes() {
        return childrenOf(keys, values);
    }

    @Override
    public <A> void accept(VoidVisitor<A> v, A arg) {
        v.visit(this, arg);
    }
}
