package org.srcgen.ast.stmt;

import org.srcgen.ast.Arguments;
import org.srcgen.ast.Node;
import org.srcgen.ast.expr.Expression;
import org.srcgen.ast.visitor.VoidVisitor;

import java.util.List;

/**
 * A {@code def} statement. Whether it declares a method or a free function depends on where it
 * appears, not on the node itself.
 */
public class FunctionDeclaration extends Statement {

    private final String name;
    private final Arguments arguments;
    private final List<Statement> body;
    private final List<Expression> decorators;

    public FunctionDeclaration(String name, Arguments arguments, List<Statement> body) {
        this(0, name, arguments, body, List.of());
    }

    public FunctionDeclaration(int line, String name, Arguments arguments, List<Statement> body, List<Expression> decorators) {
        super(line);
        this.name = name;
        this.arguments = arguments;
        this.body = copyOf(body);
        this.decorators = copyOf(decorators);
    }

    public String getName() {
        return name;
    }

    public Arguments getArguments() {
        return arguments;
    }

    public List<Statement> getBody() {
        return body;
    }

    public List<Expression> getDecorators() {
        return decorators;
    }

    @Override
    public List<Node> getChildNodes() {
        return childrenOf(decorators, arguments, body);
    }

    @Override
    public <A> void accept(VoidVisitor<A> v, A arg) {
        v.visit(this, arg);
    }
}
