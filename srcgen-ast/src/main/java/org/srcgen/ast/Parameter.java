package org.srcgen.ast;

import org.srcgen.ast.visitor.VoidVisitor;

import java.util.List;

public class Parameter extends Node {

    private final String name;

    public Parameter(String name) {
        super(0);
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public List<Node> getChildNodes() {
        return List.of();
    }

    @Override
    public <A> void accept(VoidVisitor<A> v, A arg) {
        v.visit(this, arg);
    }
}
