package org.srcgen.ast;

import org.srcgen.ast.visitor.VoidVisitor;

import java.util.List;

public class Alias extends Node {

    private final String name;
    private final String asName;

    public Alias(String name) {
        this(name, null);
    }

    public Alias(String name, String asName) {
        super(0);
        this.name = name;
        this.asName = asName;
    }

    public String getName() {
        return name;
    }

    public String getAsName() {
        return asName;
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
