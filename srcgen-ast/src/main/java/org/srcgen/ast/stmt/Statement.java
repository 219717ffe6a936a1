package org.srcgen.ast.stmt;

import org.srcgen.ast.Node;

/**
 * A node that occupies its own line(s) in the source: simple statements and compound statements
 * with bodies.
 */
public abstract class Statement extends Node {

    protected Statement(int line) {
        super(line);
    }
}
