package org.srcgen.ast.stmt;

import org.srcgen.ast.Alias;
import org.srcgen.ast.Node;
import org.srcgen.ast.visitor.VoidVisitor;

import java.util.List;

/**
 * {@code from ..module import a as b}. {@code level} counts the leading dots of a relative import;
 * {@code module} is {@code null} for {@code from . import x}.
 */
public class ImportFromStmt extends Statement {

    private final String module;
    private final List<Alias> names;
    private final int level;

    public ImportFromStmt(String module, List<Alias> names) {
        this(0, module, names, 0);
    }

    public ImportFromStmt(int line, String module, List<Alias> names, int level) {
        super(line);
        this.module = module;
        this.names = copyOf(names);
        this.level = level;
    }

    public String getModule() {
        return module;
    }

    public List<Alias> getNames() {
        return names;
    }

    public int getLevel() {
        return level;
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
