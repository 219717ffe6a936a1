package org.srcgen.ast.stmt;

import org.srcgen.ast.Node;
import org.srcgen.ast.visitor.VoidVisitor;

import java.util.List;

public class GlobalStmt extends Statement {

    private final List<String> names;

    public GlobalStmt(List<String> names) {
        this(0, names);
    }

    public GlobalStmt(int line, List<String> names) {
        super(line);
        this.names = copyOf(names);
    }

    public List<String> getNames() {
        return names;
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
