package org.srcgen.ast.stmt;

import org.srcgen.ast.Node;
import org.srcgen.ast.visitor.VoidVisitor;

import java.util.List;

public class PassStmt extends Statement {

    public PassStmt() {
        this(0);
    }

    public PassStmt(int line) {
        super(line);
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
