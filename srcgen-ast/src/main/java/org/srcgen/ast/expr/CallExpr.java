package org.srcgen.ast.expr;

import org.srcgen.ast.Keyword;
import org.srcgen.ast.Node;
import org.srcgen.ast.visitor.VoidVisitor;

import java.util.List;

/**
 * A call {@code func(args, name=value, **kwargs)}. Positional {@code *args} appear among the
 * arguments as {@link StarredExpr}.
 */
public class CallExpr extends Expression {

    private final Expression function;
    private final List<Expression> arguments;
    private final List<Keyword> keywords;

    public CallExpr(Expression function, List<Expression> arguments) {
        this(0, function, arguments, List.of());
    }

    public CallExpr(Expression function, List<Expression> arguments, List<Keyword> keywords) {
        this(0, function, arguments, keywords);
    }

    public CallExpr(int line, Expression function, List<Expression> arguments, List<Keyword> keywords) {
        super(line);
        this.function = function;
        this.arguments = copyOf(arguments);
        this.keywords = copyOf(keywords);
    }

    public Expression getFunction() {
        return function;
    }

    public List<Expression> getArguments() {
        return arguments;
    }

    public List<Keyword> getKeywords() {
        return keywords;
    }

    @Override
    public List<Node> getChildNodes() {
        return childrenOf(function, arguments, keywords);
    }

    @Override
    public <A> void accept(VoidVisitor<A> v, A arg) {
        v.visit(this, arg);
    }
}
