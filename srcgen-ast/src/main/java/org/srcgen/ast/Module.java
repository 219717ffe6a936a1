package org.srcgen.ast;

import org.srcgen.ast.stmt.Statement;
import org.srcgen.ast.visitor.VoidVisitor;

import java.util.List;

/**
 * Root of a parsed file: the top-level statements followed by any type-ignore markers the parser
 * collected.
 */
public class Module extends Node {

    private final List<Statement> body;
    private final List<TypeIgnore> typeIgnores;

    public Module(List<Statement> body) {
        this(body, List.of());
    }

    public Module(List<Statement> body, List<TypeIgnore> typeIgnores) {
        super(0);
        this.body = copyOf(body);
        this.typeIgnores = copyOf(typeIgnores);
    }

    public List<Statement> getBody() {
        return body;
    }

    public List<TypeIgnore> getTypeIgnores() {
        return typeIgnores;
    }

    @Override
    public List<Node> getChildNodes() {
        return childrenOf(body, typeIgnores);
    }

    @Override
    public <A> void accept(VoidVisitor<A> v, A arg) {
        v.visit(this, arg);
    }
}
