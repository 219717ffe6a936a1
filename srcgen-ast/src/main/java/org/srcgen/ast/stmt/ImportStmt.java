package org.srcgen.ast.stmt;

import org.srcgen.ast.Alias;
import org.srcgen.ast.Node;
import org.srcgen.ast.visitor.VoidVisitor;

import java.util.List;

public class ImportStmt extends Statement {

    private final List<Alias> names;

    public ImportStmt(List<Alias> names) {
        this(0, names);
    }

    public ImportStmt(int line, List<Alias> names) {
        super(line);
        this.names = copyOf(names);
    }

    public List<Alias> getNames() {
        return names;
    }

    @Override
    public List<Node> getChildNodes() {
        return childrenOf(names);
    }

    @Override
    public <A> void accept(VoidVisitor<A> v, A arg) {
        v.visit(this, arg);
    }
}
