package org.srcgen.ast;

import org.srcgen.ast.visitor.VoidVisitor;

import java.util.List;

/**
 * A {@code # type: ignore} marker attached to a module. It has no source form of its own.
 */
public class TypeIgnore extends Node {

    private final String tag;

    public TypeIgnore(int line, String tag) {
        super(line);
        this.tag = tag;
    }

    public String getTag() {
        return tag;
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
